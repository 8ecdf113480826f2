package fr.lapetina.llm.gateway.domain.strategy;

import fr.lapetina.llm.gateway.domain.model.BackendDescriptor;

import java.util.Comparator;
import java.util.List;

/**
 * Ranks by estimated request cost, cheapest first.
 * Backends with provisioned throughput have no marginal cost and rank as zero.
 */
public final class CostOptimizedStrategy implements RankingStrategy {

    private final RoutingStrategy type;

    public CostOptimizedStrategy() {
        this(RoutingStrategy.COST_OPTIMIZED);
    }

    CostOptimizedStrategy(RoutingStrategy type) {
        this.type = type;
    }

    @Override
    public RoutingStrategy getType() {
        return type;
    }

    @Override
    public List<BackendDescriptor> rank(List<BackendDescriptor> candidates, RoutingContext context) {
        return candidates.stream()
                .sorted(Comparator.comparingDouble((BackendDescriptor b) -> effectiveCost(b, context))
                        .thenComparing(RankingStrategy.byId()))
                .toList();
    }

    static double effectiveCost(BackendDescriptor backend, RoutingContext context) {
        if (backend.hasProvisionedThroughput()) {
            return 0.0;
        }
        return backend.estimateCost(context.estimatedInputTokens(), context.estimatedOutputTokens());
    }
}
