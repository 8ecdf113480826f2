package fr.lapetina.llm.gateway.domain.strategy;

import fr.lapetina.llm.gateway.domain.model.BackendDescriptor;

import java.util.Comparator;
import java.util.List;

/**
 * Orders filtered candidates for one routing strategy.
 *
 * Implementations must be stateless and deterministic: the same candidates
 * and context always produce the same order. Ties are broken on backend id.
 */
public interface RankingStrategy {

    /**
     * Returns the strategy this implementation ranks for.
     */
    RoutingStrategy getType();

    /**
     * Ranks candidates, best first. May return a subset but never an empty
     * list for a non-empty input.
     */
    List<BackendDescriptor> rank(List<BackendDescriptor> candidates, RoutingContext context);

    /**
     * Tie-breaker appended to every comparator.
     */
    static Comparator<BackendDescriptor> byId() {
        return Comparator.comparing(BackendDescriptor::getId);
    }
}
