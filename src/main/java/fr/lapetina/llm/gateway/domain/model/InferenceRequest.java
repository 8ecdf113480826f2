package fr.lapetina.llm.gateway.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Represents an inference request entering the gateway.
 * Immutable and thread-safe; lives for one gateway call.
 *
 * @param deadline absolute instant after which the caller no longer waits, or null
 */
public record InferenceRequest(
        String requestId,
        String callerId,
        LogicalPrompt prompt,
        Requirements requirements,
        Constraints constraints,
        boolean cacheEnabled,
        Instant createdAt,
        Instant deadline
) {
    public InferenceRequest {
        Objects.requireNonNull(callerId, "Caller ID is required");
        Objects.requireNonNull(prompt, "Prompt is required");
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        if (requirements == null) {
            requirements = Requirements.NONE;
        }
        if (constraints == null) {
            constraints = Constraints.NONE;
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    /**
     * Capabilities a backend needs, including streaming when the constraints demand it.
     */
    public Set<Capability> effectiveCapabilities() {
        if (!constraints.streamingRequired()) {
            return requirements.capabilities();
        }
        Set<Capability> all = EnumSet.of(Capability.STREAMING);
        all.addAll(requirements.capabilities());
        return all;
    }

    public int requestedMaxTokens() {
        return prompt.parameters().maxTokens();
    }

    public boolean hasDeadline() {
        return deadline != null;
    }

    public boolean isExpired(Instant now) {
        return deadline != null && !now.isBefore(deadline);
    }

    public InferenceRequest withDeadline(Instant newDeadline) {
        return new InferenceRequest(requestId, callerId, prompt, requirements, constraints,
                cacheEnabled, createdAt, newDeadline);
    }

    /**
     * Creates a single-turn request with default parameters and caching enabled.
     */
    public static InferenceRequest ofPrompt(String callerId, String text) {
        return builder().callerId(callerId).messages(List.of(Message.user(text))).build();
    }

    /**
     * Creates a chat-style request with messages.
     */
    public static InferenceRequest ofChat(String callerId, List<Message> messages) {
        return builder().callerId(callerId).messages(messages).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String requestId;
        private String callerId;
        private List<Message> messages;
        private String systemPrompt;
        private GenerationParameters parameters;
        private Requirements requirements;
        private Constraints constraints;
        private boolean cacheEnabled = true;
        private Instant createdAt;
        private Instant deadline;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder callerId(String callerId) {
            this.callerId = callerId;
            return this;
        }

        public Builder messages(List<Message> messages) {
            this.messages = messages;
            return this;
        }

        public Builder systemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt;
            return this;
        }

        public Builder parameters(GenerationParameters parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder requirements(Requirements requirements) {
            this.requirements = requirements;
            return this;
        }

        public Builder constraints(Constraints constraints) {
            this.constraints = constraints;
            return this;
        }

        public Builder cacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder deadline(Instant deadline) {
            this.deadline = deadline;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.deadline = Instant.now().plus(timeout);
            return this;
        }

        public InferenceRequest build() {
            return new InferenceRequest(
                    requestId, callerId,
                    new LogicalPrompt(messages, systemPrompt, parameters),
                    requirements, constraints, cacheEnabled, createdAt, deadline
            );
        }
    }
}
