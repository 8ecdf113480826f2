package fr.lapetina.llm.gateway.domain.model;

import fr.lapetina.llm.gateway.domain.exception.ConfigurationException;
import fr.lapetina.llm.gateway.domain.exception.ErrorCode;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Describes one routable backend (a model served by a provider).
 * Immutable; status changes produce a new instance through {@link #withStatus(BackendStatus)}.
 */
public final class BackendDescriptor {
    private final String id;
    private final String provider;
    private final String displayName;
    private final Set<Capability> capabilities;
    private final int contextWindow;
    private final int maxOutputTokens;
    private final CostProfile cost;
    private final RateLimits rateLimits;
    private final LatencyProfile latency;
    private final BackendStatus status;
    private final Set<String> regions;
    private final Map<QualityDimension, Double> qualityScores;
    private final boolean provisionedThroughput;

    private BackendDescriptor(Builder builder) {
        if (builder.id == null || builder.id.isBlank()) {
            throw new ConfigurationException(ErrorCode.INVALID_BACKEND, "id is required");
        }
        if (builder.provider == null || builder.provider.isBlank()) {
            throw new ConfigurationException(ErrorCode.INVALID_BACKEND, "provider is required for " + builder.id);
        }
        if (builder.contextWindow <= 0) {
            throw new ConfigurationException(ErrorCode.INVALID_BACKEND,
                    "contextWindow must be positive for " + builder.id);
        }
        if (builder.maxOutputTokens <= 0) {
            throw new ConfigurationException(ErrorCode.INVALID_BACKEND,
                    "maxOutputTokens must be positive for " + builder.id);
        }
        this.id = builder.id;
        this.provider = builder.provider;
        this.displayName = builder.displayName != null ? builder.displayName : builder.id;
        this.capabilities = builder.capabilities.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(Capability.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.capabilities));
        this.contextWindow = builder.contextWindow;
        this.maxOutputTokens = builder.maxOutputTokens;
        this.cost = Objects.requireNonNull(builder.cost, "cost");
        this.rateLimits = builder.rateLimits;
        this.latency = Objects.requireNonNull(builder.latency, "latency");
        this.status = Objects.requireNonNull(builder.status, "status");
        this.regions = Set.copyOf(builder.regions);
        Map<QualityDimension, Double> scores = new EnumMap<>(QualityDimension.class);
        scores.putAll(builder.qualityScores);
        this.qualityScores = Collections.unmodifiableMap(scores);
        this.provisionedThroughput = builder.provisionedThroughput;
    }

    public String getId() {
        return id;
    }

    public String getProvider() {
        return provider;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Set<Capability> getCapabilities() {
        return capabilities;
    }

    public boolean supports(Capability capability) {
        return capabilities.contains(capability);
    }

    public boolean supportsAll(Set<Capability> required) {
        return capabilities.containsAll(required);
    }

    public int getContextWindow() {
        return contextWindow;
    }

    public int getMaxOutputTokens() {
        return maxOutputTokens;
    }

    public CostProfile getCost() {
        return cost;
    }

    /**
     * Returns declared rate limits, or null when the gateway defaults apply.
     */
    public RateLimits getRateLimits() {
        return rateLimits;
    }

    public LatencyProfile getLatency() {
        return latency;
    }

    public BackendStatus getStatus() {
        return status;
    }

    public boolean isActive() {
        return status == BackendStatus.ACTIVE;
    }

    /**
     * Regions this backend may serve from. Empty means unrestricted.
     */
    public Set<String> getRegions() {
        return regions;
    }

    public Map<QualityDimension, Double> getQualityScores() {
        return qualityScores;
    }

    public double getQualityScore(QualityDimension dimension) {
        return qualityScores.getOrDefault(dimension, 0.0);
    }

    /**
     * True when capacity is committed up front, so marginal cost is zero.
     */
    public boolean hasProvisionedThroughput() {
        return provisionedThroughput;
    }

    /**
     * Estimated cost in USD for the given token counts.
     */
    public double estimateCost(int inputTokens, int outputTokens) {
        return cost.estimate(inputTokens, outputTokens);
    }

    public BackendDescriptor withStatus(BackendStatus newStatus) {
        return toBuilder().status(newStatus).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .provider(provider)
                .displayName(displayName)
                .capabilities(capabilities)
                .contextWindow(contextWindow)
                .maxOutputTokens(maxOutputTokens)
                .cost(cost)
                .rateLimits(rateLimits)
                .latency(latency)
                .status(status)
                .regions(regions)
                .qualityScores(qualityScores)
                .provisionedThroughput(provisionedThroughput);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BackendDescriptor that = (BackendDescriptor) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "BackendDescriptor{" +
                "id='" + id + '\'' +
                ", provider='" + provider + '\'' +
                ", status=" + status +
                ", capabilities=" + capabilities +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String provider;
        private String displayName;
        private Set<Capability> capabilities = EnumSet.of(Capability.TEXT);
        private int contextWindow;
        private int maxOutputTokens;
        private CostProfile cost = CostProfile.FREE;
        private RateLimits rateLimits;
        private LatencyProfile latency = LatencyProfile.UNKNOWN;
        private BackendStatus status = BackendStatus.ACTIVE;
        private Set<String> regions = Set.of();
        private Map<QualityDimension, Double> qualityScores = Map.of();
        private boolean provisionedThroughput;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder provider(String provider) {
            this.provider = provider;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder capabilities(Set<Capability> capabilities) {
            this.capabilities = capabilities;
            return this;
        }

        public Builder capabilities(Capability... capabilities) {
            this.capabilities = Set.of(capabilities);
            return this;
        }

        public Builder contextWindow(int contextWindow) {
            this.contextWindow = contextWindow;
            return this;
        }

        public Builder maxOutputTokens(int maxOutputTokens) {
            this.maxOutputTokens = maxOutputTokens;
            return this;
        }

        public Builder cost(CostProfile cost) {
            this.cost = cost;
            return this;
        }

        public Builder cost(double inputPerMillion, double outputPerMillion) {
            this.cost = new CostProfile(inputPerMillion, outputPerMillion, 0);
            return this;
        }

        public Builder rateLimits(RateLimits rateLimits) {
            this.rateLimits = rateLimits;
            return this;
        }

        public Builder latency(LatencyProfile latency) {
            this.latency = latency;
            return this;
        }

        public Builder latency(long p50Ms, long p99Ms) {
            this.latency = new LatencyProfile(p50Ms, p99Ms);
            return this;
        }

        public Builder status(BackendStatus status) {
            this.status = status;
            return this;
        }

        public Builder regions(Set<String> regions) {
            this.regions = regions;
            return this;
        }

        public Builder qualityScores(Map<QualityDimension, Double> qualityScores) {
            this.qualityScores = qualityScores;
            return this;
        }

        public Builder qualityScore(QualityDimension dimension, double score) {
            Map<QualityDimension, Double> scores = new EnumMap<>(QualityDimension.class);
            scores.putAll(this.qualityScores);
            scores.put(dimension, score);
            this.qualityScores = scores;
            return this;
        }

        public Builder provisionedThroughput(boolean provisionedThroughput) {
            this.provisionedThroughput = provisionedThroughput;
            return this;
        }

        public BackendDescriptor build() {
            return new BackendDescriptor(this);
        }
    }
}
