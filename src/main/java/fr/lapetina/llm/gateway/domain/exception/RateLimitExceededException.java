package fr.lapetina.llm.gateway.domain.exception;

import java.time.Duration;

/**
 * Caller exceeded its request-rate or unit-rate budget for a backend.
 */
public final class RateLimitExceededException extends GatewayException {

    private final String callerId;
    private final String backendId;
    private final Duration retryAfter;

    public RateLimitExceededException(ErrorCode code, String callerId, String backendId, Duration retryAfter) {
        super(code, "callerId=" + callerId + ", backendId=" + backendId
                + ", retryAfterMs=" + retryAfter.toMillis());
        if (code != ErrorCode.REQUEST_RATE_EXCEEDED && code != ErrorCode.UNIT_RATE_EXCEEDED) {
            throw new IllegalArgumentException("Not a rate limit error code: " + code);
        }
        this.callerId = callerId;
        this.backendId = backendId;
        this.retryAfter = retryAfter;
    }

    public String getCallerId() {
        return callerId;
    }

    public String getBackendId() {
        return backendId;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
