package fr.lapetina.llm.gateway.domain.exception;

/**
 * Base class of every error raised by the gateway.
 */
public class GatewayException extends RuntimeException {

    private final ErrorCode code;

    public GatewayException(ErrorCode code, String message) {
        super(code.getDescription() + ": " + message);
        this.code = code;
    }

    public GatewayException(ErrorCode code, String message, Throwable cause) {
        super(code.getDescription() + ": " + message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    public ErrorCategory getCategory() {
        return code.getCategory();
    }

    public boolean isTerminal() {
        return code.getCategory().isTerminal();
    }
}
