package fr.lapetina.llm.gateway.domain.strategy;

import fr.lapetina.llm.gateway.domain.model.BackendDescriptor;

import java.util.Comparator;
import java.util.List;

/**
 * Ranks by declared median latency, fastest first.
 */
public final class LatencyOptimizedStrategy implements RankingStrategy {

    @Override
    public RoutingStrategy getType() {
        return RoutingStrategy.LATENCY_OPTIMIZED;
    }

    @Override
    public List<BackendDescriptor> rank(List<BackendDescriptor> candidates, RoutingContext context) {
        return candidates.stream()
                .sorted(Comparator.comparingLong((BackendDescriptor b) -> b.getLatency().p50Ms())
                        .thenComparing(RankingStrategy.byId()))
                .toList();
    }
}
