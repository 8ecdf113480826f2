package fr.lapetina.llm.gateway.domain.model;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Represents the result of an inference request.
 * Immutable and thread-safe.
 *
 * @param metadata diagnostic details (attempt count, fallback use, cache match type)
 */
public record InferenceResponse(
        String requestId,
        String backendId,
        String provider,
        String content,
        TokenUsage usage,
        long latencyMs,
        boolean cached,
        ResponseStatus status,
        String finishReason,
        String errorMessage,
        Map<String, String> metadata,
        Instant createdAt
) {
    public InferenceResponse {
        Objects.requireNonNull(requestId, "Request ID is required");
        if (usage == null) {
            usage = TokenUsage.EMPTY;
        }
        if (status == null) {
            status = ResponseStatus.SUCCESS;
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public boolean isSuccess() {
        return status == ResponseStatus.SUCCESS;
    }

    public boolean isError() {
        return status == ResponseStatus.ERROR;
    }

    /**
     * Creates a successful response.
     */
    public static InferenceResponse success(
            String requestId,
            String backendId,
            String provider,
            String content,
            TokenUsage usage
    ) {
        return builder()
                .requestId(requestId)
                .backendId(backendId)
                .provider(provider)
                .content(content)
                .usage(usage)
                .finishReason("stop")
                .build();
    }

    /**
     * Creates an error response.
     */
    public static InferenceResponse error(String requestId, String backendId, String provider, String errorMessage) {
        return builder()
                .requestId(requestId)
                .backendId(backendId)
                .provider(provider)
                .status(ResponseStatus.ERROR)
                .errorMessage(errorMessage)
                .build();
    }

    public Builder toBuilder() {
        return new Builder()
                .requestId(requestId)
                .backendId(backendId)
                .provider(provider)
                .content(content)
                .usage(usage)
                .latencyMs(latencyMs)
                .cached(cached)
                .status(status)
                .finishReason(finishReason)
                .errorMessage(errorMessage)
                .metadata(metadata)
                .createdAt(createdAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String requestId;
        private String backendId;
        private String provider;
        private String content;
        private TokenUsage usage;
        private long latencyMs;
        private boolean cached;
        private ResponseStatus status;
        private String finishReason;
        private String errorMessage;
        private Map<String, String> metadata = new HashMap<>();
        private Instant createdAt;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder backendId(String backendId) {
            this.backendId = backendId;
            return this;
        }

        public Builder provider(String provider) {
            this.provider = provider;
            return this;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder usage(TokenUsage usage) {
            this.usage = usage;
            return this;
        }

        public Builder latencyMs(long latencyMs) {
            this.latencyMs = latencyMs;
            return this;
        }

        public Builder cached(boolean cached) {
            this.cached = cached;
            return this;
        }

        public Builder status(ResponseStatus status) {
            this.status = status;
            return this;
        }

        public Builder finishReason(String finishReason) {
            this.finishReason = finishReason;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata = new HashMap<>(metadata);
            return this;
        }

        public Builder putMetadata(String key, String value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public InferenceResponse build() {
            return new InferenceResponse(
                    requestId, backendId, provider, content, usage, latencyMs, cached,
                    status, finishReason, errorMessage, metadata, createdAt
            );
        }
    }
}
