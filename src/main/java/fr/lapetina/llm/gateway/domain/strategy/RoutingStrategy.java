package fr.lapetina.llm.gateway.domain.strategy;

import java.util.Locale;

/**
 * Ranking policy applied after the routing filters.
 */
public enum RoutingStrategy {
    /** Lowest estimated cost; provisioned throughput counts as free */
    COST_OPTIMIZED("cost-optimized"),

    /** Lowest declared p50 latency */
    LATENCY_OPTIMIZED("latency-optimized"),

    /** Highest score on the requested quality dimension */
    QUALITY_OPTIMIZED("quality-optimized"),

    /** Restrict to preferred providers, falling back to every candidate */
    PROVIDER_PINNED("provider-pinned"),

    /** Default: candidates already satisfy every capability, so rank by cost */
    CAPABILITY_FIRST("capability-first");

    private final String configName;

    RoutingStrategy(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * Parses a strategy from its configuration name ("cost-optimized") or enum name.
     */
    public static RoutingStrategy fromName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (RoutingStrategy strategy : values()) {
            if (strategy.configName.equals(normalized)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown routing strategy: " + name);
    }
}
