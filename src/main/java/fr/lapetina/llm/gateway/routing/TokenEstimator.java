package fr.lapetina.llm.gateway.routing;

import fr.lapetina.llm.gateway.domain.model.InferenceRequest;

/**
 * Estimates the input size of a request in backend units (tokens).
 * Precise counting belongs to backend adapters; routing only needs an estimate.
 */
@FunctionalInterface
public interface TokenEstimator {

    int estimateInputTokens(InferenceRequest request);

    /**
     * Roughly four characters per token.
     */
    static TokenEstimator characterRatio() {
        return request -> Math.max(1, request.prompt().characterCount() / 4);
    }
}
