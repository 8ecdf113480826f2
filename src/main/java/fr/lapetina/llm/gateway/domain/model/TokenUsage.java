package fr.lapetina.llm.gateway.domain.model;

/**
 * Token counts reported by a backend.
 */
public record TokenUsage(int inputTokens, int outputTokens, int cachedTokens) {

    public static final TokenUsage EMPTY = new TokenUsage(0, 0, 0);

    public TokenUsage {
        if (inputTokens < 0 || outputTokens < 0 || cachedTokens < 0) {
            throw new IllegalArgumentException("Token counts must not be negative");
        }
    }

    public int totalTokens() {
        return inputTokens + outputTokens;
    }
}
