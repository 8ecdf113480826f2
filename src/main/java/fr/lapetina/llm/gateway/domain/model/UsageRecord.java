package fr.lapetina.llm.gateway.domain.model;

import java.time.Instant;

/**
 * Usage emitted after each completed request.
 */
public record UsageRecord(
        String requestId,
        String callerId,
        String backendId,
        String provider,
        int inputTokens,
        int outputTokens,
        long latencyMs,
        boolean cached,
        double costEstimateUsd,
        ResponseStatus status,
        Instant timestamp
) {
    public static UsageRecord of(InferenceRequest request, InferenceResponse response, double costEstimateUsd) {
        return new UsageRecord(
                request.requestId(),
                request.callerId(),
                response.backendId(),
                response.provider(),
                response.usage().inputTokens(),
                response.usage().outputTokens(),
                response.latencyMs(),
                response.cached(),
                response.cached() ? 0.0 : costEstimateUsd,
                response.status(),
                Instant.now()
        );
    }
}
