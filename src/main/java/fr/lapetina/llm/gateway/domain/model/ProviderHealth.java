package fr.lapetina.llm.gateway.domain.model;

/**
 * Result of a backend adapter health check.
 *
 * @param circuitHint suggested breaker state for the provider's backends
 */
public record ProviderHealth(Status status, CircuitHint circuitHint, String detail) {

    public enum Status {
        HEALTHY,
        DEGRADED,
        UNHEALTHY
    }

    public enum CircuitHint {
        NONE,
        OPEN
    }

    public static ProviderHealth healthy() {
        return new ProviderHealth(Status.HEALTHY, CircuitHint.NONE, null);
    }

    public static ProviderHealth unhealthy(String detail) {
        return new ProviderHealth(Status.UNHEALTHY, CircuitHint.OPEN, detail);
    }
}
