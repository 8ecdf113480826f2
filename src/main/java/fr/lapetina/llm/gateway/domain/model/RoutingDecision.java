package fr.lapetina.llm.gateway.domain.model;

import fr.lapetina.llm.gateway.domain.strategy.RoutingStrategy;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Output of the router. Consumed immediately by the orchestrator, never persisted.
 *
 * @param fallbackBackendIds   ordered, already bounded by the router
 * @param estimatedCostUsd     primary backend cost for the estimated token counts
 * @param estimatedLatencyMs   primary backend p50
 * @param candidateCount       candidates left after filtering
 */
public record RoutingDecision(
        String primaryBackendId,
        String primaryProvider,
        List<String> fallbackBackendIds,
        RoutingStrategy strategy,
        double estimatedCostUsd,
        long estimatedLatencyMs,
        String reason,
        int candidateCount,
        int estimatedInputTokens
) {
    public RoutingDecision {
        Objects.requireNonNull(primaryBackendId, "Primary backend is required");
        Objects.requireNonNull(strategy, "Strategy is required");
        fallbackBackendIds = fallbackBackendIds != null ? List.copyOf(fallbackBackendIds) : List.of();
    }

    /**
     * Primary followed by fallbacks, in attempt order.
     */
    public List<String> attemptOrder() {
        List<String> order = new ArrayList<>(fallbackBackendIds.size() + 1);
        order.add(primaryBackendId);
        order.addAll(fallbackBackendIds);
        return order;
    }
}
