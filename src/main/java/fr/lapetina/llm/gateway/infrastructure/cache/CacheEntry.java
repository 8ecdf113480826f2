package fr.lapetina.llm.gateway.infrastructure.cache;

import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.llm.gateway.domain.model.InferenceResponse;
import fr.lapetina.llm.gateway.domain.model.TokenUsage;

import java.time.Instant;

/**
 * Stored form of a cached response.
 */
public record CacheEntry(
        @JsonProperty("fingerprint") String fingerprint,
        @JsonProperty("scope") String scope,
        @JsonProperty("backend_id") String backendId,
        @JsonProperty("provider") String provider,
        @JsonProperty("content") String content,
        @JsonProperty("input_tokens") int inputTokens,
        @JsonProperty("output_tokens") int outputTokens,
        @JsonProperty("finish_reason") String finishReason,
        @JsonProperty("created_at") Instant createdAt
) {
    static CacheEntry of(String fingerprint, String scope, InferenceResponse response, Instant now) {
        return new CacheEntry(
                fingerprint,
                scope,
                response.backendId(),
                response.provider(),
                response.content(),
                response.usage().inputTokens(),
                response.usage().outputTokens(),
                response.finishReason(),
                now
        );
    }

    /**
     * Rebuilds a response for a new request. Cached responses carry no latency.
     */
    InferenceResponse toResponse(String requestId, String matchType) {
        return InferenceResponse.builder()
                .requestId(requestId)
                .backendId(backendId)
                .provider(provider)
                .content(content)
                .usage(new TokenUsage(inputTokens, outputTokens, 0))
                .latencyMs(0)
                .cached(true)
                .finishReason(finishReason)
                .putMetadata("cache_match", matchType)
                .putMetadata("cached_at", createdAt.toString())
                .build();
    }
}
