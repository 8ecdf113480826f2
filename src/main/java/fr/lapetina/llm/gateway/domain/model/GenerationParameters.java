package fr.lapetina.llm.gateway.domain.model;

/**
 * Sampling parameters forwarded to the backend.
 * A null topP means the backend default.
 */
public record GenerationParameters(double temperature, int maxTokens, Double topP) {

    public static final int DEFAULT_MAX_TOKENS = 1024;
    public static final GenerationParameters DEFAULT = new GenerationParameters(0.7, DEFAULT_MAX_TOKENS, null);

    public GenerationParameters {
        if (temperature < 0) {
            throw new IllegalArgumentException("temperature must not be negative");
        }
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive");
        }
        if (topP != null && (topP <= 0 || topP > 1)) {
            throw new IllegalArgumentException("topP must be in (0, 1]");
        }
    }
}
