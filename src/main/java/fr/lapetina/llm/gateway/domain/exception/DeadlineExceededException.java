package fr.lapetina.llm.gateway.domain.exception;

/**
 * The caller's deadline passed before the request completed.
 */
public final class DeadlineExceededException extends GatewayException {

    private final String requestId;
    private final String stage;

    public DeadlineExceededException(String requestId, String stage) {
        super(ErrorCode.DEADLINE_EXCEEDED, "requestId=" + requestId + ", stage=" + stage);
        this.requestId = requestId;
        this.stage = stage;
    }

    public String getRequestId() {
        return requestId;
    }

    public String getStage() {
        return stage;
    }
}
