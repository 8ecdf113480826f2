package fr.lapetina.llm.gateway.domain.model;

import java.util.List;
import java.util.Set;

/**
 * Caller constraints on routing. Null limits mean unbounded.
 *
 * @param maxLatencyMs       soft ceiling on declared p99 latency
 * @param maxCostUsd         soft ceiling on estimated cost; over-budget backends rank last
 * @param preferredBackends  backend ids ranked ahead of all others, in order
 * @param excludedBackends   backend ids never routed to
 * @param preferredProviders providers used by provider-pinned routing
 * @param allowedRegions     data residency; empty means any region
 * @param streamingRequired  implies the streaming capability
 */
public record Constraints(
        Long maxLatencyMs,
        Double maxCostUsd,
        List<String> preferredBackends,
        Set<String> excludedBackends,
        List<String> preferredProviders,
        Set<String> allowedRegions,
        boolean streamingRequired
) {
    public static final Constraints NONE = builder().build();

    public Constraints {
        preferredBackends = preferredBackends != null ? List.copyOf(preferredBackends) : List.of();
        excludedBackends = excludedBackends != null ? Set.copyOf(excludedBackends) : Set.of();
        preferredProviders = preferredProviders != null ? List.copyOf(preferredProviders) : List.of();
        allowedRegions = allowedRegions != null ? Set.copyOf(allowedRegions) : Set.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Long maxLatencyMs;
        private Double maxCostUsd;
        private List<String> preferredBackends;
        private Set<String> excludedBackends;
        private List<String> preferredProviders;
        private Set<String> allowedRegions;
        private boolean streamingRequired;

        public Builder maxLatencyMs(Long maxLatencyMs) {
            this.maxLatencyMs = maxLatencyMs;
            return this;
        }

        public Builder maxCostUsd(Double maxCostUsd) {
            this.maxCostUsd = maxCostUsd;
            return this;
        }

        public Builder preferredBackends(List<String> preferredBackends) {
            this.preferredBackends = preferredBackends;
            return this;
        }

        public Builder excludedBackends(Set<String> excludedBackends) {
            this.excludedBackends = excludedBackends;
            return this;
        }

        public Builder preferredProviders(List<String> preferredProviders) {
            this.preferredProviders = preferredProviders;
            return this;
        }

        public Builder allowedRegions(Set<String> allowedRegions) {
            this.allowedRegions = allowedRegions;
            return this;
        }

        public Builder streamingRequired(boolean streamingRequired) {
            this.streamingRequired = streamingRequired;
            return this;
        }

        public Constraints build() {
            return new Constraints(maxLatencyMs, maxCostUsd, preferredBackends, excludedBackends,
                    preferredProviders, allowedRegions, streamingRequired);
        }
    }
}
