package fr.lapetina.llm.gateway.domain.strategy;

import fr.lapetina.llm.gateway.domain.model.InferenceRequest;

/**
 * Per-request values shared by the routing stages and ranking strategies.
 */
public record RoutingContext(InferenceRequest request, int estimatedInputTokens) {

    public int estimatedOutputTokens() {
        return request.requestedMaxTokens();
    }
}
