package fr.lapetina.llm.gateway.domain.exception;

/**
 * Call rejected by a circuit breaker without reaching the backend.
 */
public final class CircuitOpenException extends GatewayException {

    private final String backendId;

    public CircuitOpenException(ErrorCode code, String backendId) {
        super(code, "backendId=" + backendId);
        if (code.getCategory() != ErrorCategory.CIRCUIT_BREAKER) {
            throw new IllegalArgumentException("Not a circuit breaker error code: " + code);
        }
        this.backendId = backendId;
    }

    public String getBackendId() {
        return backendId;
    }
}
