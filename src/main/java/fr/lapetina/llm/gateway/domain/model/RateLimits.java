package fr.lapetina.llm.gateway.domain.model;

/**
 * Per-minute request and unit budgets.
 */
public record RateLimits(long requestsPerMinute, long unitsPerMinute) {

    public static final RateLimits DEFAULT = new RateLimits(60, 100_000);

    public RateLimits {
        if (requestsPerMinute <= 0 || unitsPerMinute <= 0) {
            throw new IllegalArgumentException("Rate limits must be positive");
        }
    }
}
