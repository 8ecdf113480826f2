package fr.lapetina.llm.gateway.domain.exception;

/**
 * Top-level error taxonomy.
 * Decides whether an error is terminal for the caller or absorbed by the gateway.
 */
public enum ErrorCategory {
    /** Bad backend definition, unknown backend id, unreadable configuration */
    CONFIGURATION(true),

    /** No backend survives the routing filters, or every candidate failed */
    ROUTING(true),

    /** A backend call failed; the orchestrator moves to the next candidate */
    PROVIDER(false),

    /** Cache infrastructure failure; treated as a miss */
    CACHE(false),

    /** Caller exceeded its request or unit budget */
    RATE_LIMIT(true),

    /** Backend rejected locally by its circuit breaker */
    CIRCUIT_BREAKER(false),

    /** Admission queue overflow or expired deadline */
    ADMISSION(true);

    private final boolean terminal;

    ErrorCategory(boolean terminal) {
        this.terminal = terminal;
    }

    /**
     * Returns true if errors of this category are returned to the caller as-is.
     */
    public boolean isTerminal() {
        return terminal;
    }
}
