package fr.lapetina.llm.gateway.domain.exception;

/**
 * Closed set of error codes, each bound to exactly one {@link ErrorCategory}.
 */
public enum ErrorCode {
    INVALID_BACKEND(ErrorCategory.CONFIGURATION, "Invalid backend definition"),
    DUPLICATE_BACKEND(ErrorCategory.CONFIGURATION, "Backend already registered"),
    BACKEND_NOT_FOUND(ErrorCategory.CONFIGURATION, "Unknown backend"),
    INVALID_CONFIGURATION(ErrorCategory.CONFIGURATION, "Invalid gateway configuration"),

    NO_CAPABLE_BACKEND(ErrorCategory.ROUTING, "No backend supports the required capabilities"),
    CONTEXT_LENGTH_EXCEEDED(ErrorCategory.ROUTING, "No backend has a large enough context window"),
    DATA_RESIDENCY_VIOLATION(ErrorCategory.ROUTING, "No backend is available in the allowed regions"),
    ALL_BACKENDS_UNHEALTHY(ErrorCategory.ROUTING, "All candidate backends have an open circuit"),
    ALL_FALLBACKS_EXHAUSTED(ErrorCategory.ROUTING, "Primary and all fallback backends failed"),

    PROVIDER_TIMEOUT(ErrorCategory.PROVIDER, "Backend call timed out"),
    PROVIDER_AUTHENTICATION(ErrorCategory.PROVIDER, "Backend rejected credentials"),
    PROVIDER_RATE_LIMITED(ErrorCategory.PROVIDER, "Backend applied its own rate limit"),
    PROVIDER_MALFORMED_RESPONSE(ErrorCategory.PROVIDER, "Backend returned a malformed response"),
    PROVIDER_UNSUPPORTED_MODEL(ErrorCategory.PROVIDER, "Backend does not serve the requested model"),
    PROVIDER_UNAVAILABLE(ErrorCategory.PROVIDER, "Backend is unreachable or failing"),

    CACHE_STORE_UNAVAILABLE(ErrorCategory.CACHE, "Cache store unavailable"),
    EMBEDDING_FAILED(ErrorCategory.CACHE, "Embedding generation failed"),

    REQUEST_RATE_EXCEEDED(ErrorCategory.RATE_LIMIT, "Request rate limit exceeded"),
    UNIT_RATE_EXCEEDED(ErrorCategory.RATE_LIMIT, "Unit rate limit exceeded"),

    CIRCUIT_OPEN(ErrorCategory.CIRCUIT_BREAKER, "Circuit breaker is open"),
    HALF_OPEN_TRIAL_EXHAUSTED(ErrorCategory.CIRCUIT_BREAKER, "Half-open trial capacity exhausted"),

    QUEUE_FULL(ErrorCategory.ADMISSION, "Admission queue is full"),
    DEADLINE_EXCEEDED(ErrorCategory.ADMISSION, "Request deadline exceeded");

    private final ErrorCategory category;
    private final String description;

    ErrorCode(ErrorCategory category, String description) {
        this.category = category;
        this.description = description;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public String getDescription() {
        return description;
    }
}
