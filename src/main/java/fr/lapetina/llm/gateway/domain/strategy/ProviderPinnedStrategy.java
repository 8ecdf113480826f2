package fr.lapetina.llm.gateway.domain.strategy;

import fr.lapetina.llm.gateway.domain.model.BackendDescriptor;

import java.util.Comparator;
import java.util.List;

/**
 * Keeps only backends from the caller's preferred providers, in preference order.
 *
 * When no candidate matches (or no provider is preferred) the full candidate
 * set is kept so routing never fails on a preference alone. Within a provider,
 * and in the fallback case, candidates are ordered by cost.
 */
public final class ProviderPinnedStrategy implements RankingStrategy {

    @Override
    public RoutingStrategy getType() {
        return RoutingStrategy.PROVIDER_PINNED;
    }

    @Override
    public List<BackendDescriptor> rank(List<BackendDescriptor> candidates, RoutingContext context) {
        List<String> preferred = context.request().constraints().preferredProviders();
        Comparator<BackendDescriptor> byCost = Comparator
                .comparingDouble((BackendDescriptor b) -> CostOptimizedStrategy.effectiveCost(b, context))
                .thenComparing(RankingStrategy.byId());

        List<BackendDescriptor> pinned = candidates.stream()
                .filter(b -> preferred.contains(b.getProvider()))
                .sorted(Comparator.comparingInt((BackendDescriptor b) -> preferred.indexOf(b.getProvider()))
                        .thenComparing(byCost))
                .toList();

        if (!pinned.isEmpty()) {
            return pinned;
        }
        return candidates.stream().sorted(byCost).toList();
    }
}
