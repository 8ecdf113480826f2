package fr.lapetina.llm.gateway.domain.strategy;

import fr.lapetina.llm.gateway.domain.model.BackendDescriptor;
import fr.lapetina.llm.gateway.domain.model.QualityDimension;

import java.util.Comparator;
import java.util.List;

/**
 * Ranks by score on the request's preferred quality dimension, highest first.
 * Requests without a preference are ranked on reasoning.
 */
public final class QualityOptimizedStrategy implements RankingStrategy {

    @Override
    public RoutingStrategy getType() {
        return RoutingStrategy.QUALITY_OPTIMIZED;
    }

    @Override
    public List<BackendDescriptor> rank(List<BackendDescriptor> candidates, RoutingContext context) {
        QualityDimension dimension = context.request().requirements().preferredQuality();
        QualityDimension effective = dimension != null ? dimension : QualityDimension.REASONING;

        return candidates.stream()
                .sorted(Comparator.comparingDouble((BackendDescriptor b) -> b.getQualityScore(effective))
                        .reversed()
                        .thenComparing(RankingStrategy.byId()))
                .toList();
    }
}
