package fr.lapetina.llm.gateway.domain.model;

/**
 * Declared latency percentiles in milliseconds.
 */
public record LatencyProfile(long p50Ms, long p99Ms) {

    public static final LatencyProfile UNKNOWN = new LatencyProfile(1_000, 5_000);

    public LatencyProfile {
        if (p50Ms < 0 || p99Ms < p50Ms) {
            throw new IllegalArgumentException("Invalid latency profile: p50=" + p50Ms + ", p99=" + p99Ms);
        }
    }
}
