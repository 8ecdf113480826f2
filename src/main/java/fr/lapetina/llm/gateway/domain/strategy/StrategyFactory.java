package fr.lapetina.llm.gateway.domain.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Factory for ranking strategies.
 *
 * Strategies are stateless, so one instance per type is created and shared.
 */
public final class StrategyFactory {

    private static final Logger log = LoggerFactory.getLogger(StrategyFactory.class);

    private static final Map<RoutingStrategy, Supplier<RankingStrategy>> REGISTRY = new EnumMap<>(RoutingStrategy.class);

    static {
        REGISTRY.put(RoutingStrategy.COST_OPTIMIZED, CostOptimizedStrategy::new);
        REGISTRY.put(RoutingStrategy.LATENCY_OPTIMIZED, LatencyOptimizedStrategy::new);
        REGISTRY.put(RoutingStrategy.QUALITY_OPTIMIZED, QualityOptimizedStrategy::new);
        REGISTRY.put(RoutingStrategy.PROVIDER_PINNED, ProviderPinnedStrategy::new);
        REGISTRY.put(RoutingStrategy.CAPABILITY_FIRST, () -> new CostOptimizedStrategy(RoutingStrategy.CAPABILITY_FIRST));
    }

    private StrategyFactory() {
        // Utility class
    }

    /**
     * Creates one ranking strategy per routing strategy.
     */
    public static Map<RoutingStrategy, RankingStrategy> createAll() {
        Map<RoutingStrategy, RankingStrategy> strategies = new EnumMap<>(RoutingStrategy.class);
        REGISTRY.forEach((type, supplier) -> strategies.put(type, supplier.get()));
        return strategies;
    }

    /**
     * Creates the ranking strategy for a type.
     */
    public static RankingStrategy create(RoutingStrategy type) {
        return REGISTRY.get(type).get();
    }

    /**
     * Resolves a strategy from its configuration name, with default fallback.
     *
     * @param name            name from configuration, may be null
     * @param defaultStrategy used when the name is missing or unknown
     */
    public static RoutingStrategy resolveOrDefault(String name, RoutingStrategy defaultStrategy) {
        if (name == null || name.isBlank()) {
            return defaultStrategy;
        }
        try {
            return RoutingStrategy.fromName(name);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown routing strategy '{}', using {}", name, defaultStrategy.getConfigName());
            return defaultStrategy;
        }
    }
}
