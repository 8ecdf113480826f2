package fr.lapetina.llm.gateway.orchestrator;

import fr.lapetina.llm.gateway.domain.model.ProviderHealth;
import fr.lapetina.llm.gateway.infrastructure.cache.ResponseCache;
import fr.lapetina.llm.gateway.infrastructure.queue.AdmissionQueue;
import fr.lapetina.llm.gateway.infrastructure.ratelimit.RateLimiter;
import fr.lapetina.llm.gateway.infrastructure.registry.BackendRegistry;
import fr.lapetina.llm.gateway.infrastructure.resilience.CircuitBreaker;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time view of every gateway component.
 *
 * @param cache  null when caching is not configured
 * @param queue  null when no admission queue is configured
 * @param usage  null when no usage publisher is configured
 */
public record GatewayHealth(
        Status status,
        Instant timestamp,
        BackendRegistry.RegistryStats registry,
        Map<String, CircuitBreaker.CircuitStats> circuits,
        Map<String, ProviderHealth> providers,
        RateLimiter.RateLimiterStats rateLimiter,
        ResponseCache.CacheStats cache,
        AdmissionQueue.QueueStats queue,
        UsageStats usage
) {
    public GatewayHealth {
        circuits = Map.copyOf(circuits);
        providers = Map.copyOf(providers);
    }

    public enum Status {
        HEALTHY,
        DEGRADED
    }

    public record UsageStats(long published, long dropped, long delivered, long sinkErrors) {
    }
}
