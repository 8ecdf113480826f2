package fr.lapetina.llm.gateway.domain.exception;

/**
 * Failure reported by a backend adapter.
 *
 * Never surfaced to the caller directly: the orchestrator treats it as a
 * signal to try the next candidate.
 */
public final class ProviderException extends GatewayException {

    private final Kind kind;
    private final String backendId;

    public ProviderException(Kind kind, String backendId, String message) {
        super(kind.getErrorCode(), "backendId=" + backendId + ", " + message);
        this.kind = kind;
        this.backendId = backendId;
    }

    public ProviderException(Kind kind, String backendId, String message, Throwable cause) {
        super(kind.getErrorCode(), "backendId=" + backendId + ", " + message, cause);
        this.kind = kind;
        this.backendId = backendId;
    }

    public Kind getKind() {
        return kind;
    }

    public String getBackendId() {
        return backendId;
    }

    public enum Kind {
        TIMEOUT(ErrorCode.PROVIDER_TIMEOUT),
        AUTHENTICATION(ErrorCode.PROVIDER_AUTHENTICATION),
        RATE_LIMITED(ErrorCode.PROVIDER_RATE_LIMITED),
        MALFORMED_RESPONSE(ErrorCode.PROVIDER_MALFORMED_RESPONSE),
        UNSUPPORTED_MODEL(ErrorCode.PROVIDER_UNSUPPORTED_MODEL),
        UNAVAILABLE(ErrorCode.PROVIDER_UNAVAILABLE);

        private final ErrorCode errorCode;

        Kind(ErrorCode errorCode) {
            this.errorCode = errorCode;
        }

        public ErrorCode getErrorCode() {
            return errorCode;
        }
    }
}
