package fr.lapetina.llm.gateway.infrastructure.health;

import fr.lapetina.llm.gateway.domain.model.BackendDescriptor;
import fr.lapetina.llm.gateway.domain.model.ProviderHealth;
import fr.lapetina.llm.gateway.infrastructure.adapter.BackendAdapter;
import fr.lapetina.llm.gateway.infrastructure.registry.BackendRegistry;
import fr.lapetina.llm.gateway.infrastructure.resilience.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background health checker for providers.
 *
 * Periodically health-checks each adapter. An UNHEALTHY result carrying the OPEN
 * circuit hint forces open the breaker of every backend of that provider,
 * so routing stops selecting them before requests start failing.
 */
public final class ProviderHealthMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProviderHealthMonitor.class);

    private final Collection<BackendAdapter> adapters;
    private final BackendRegistry registry;
    private final CircuitBreakerRegistry circuitBreakers;
    private final Duration checkInterval;
    private final ScheduledExecutorService scheduler;
    private final Map<String, ProviderHealth> lastHealth = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    public ProviderHealthMonitor(
            Collection<BackendAdapter> adapters,
            BackendRegistry registry,
            CircuitBreakerRegistry circuitBreakers,
            Duration checkInterval
    ) {
        this.adapters = adapters;
        this.registry = registry;
        this.circuitBreakers = circuitBreakers;
        this.checkInterval = checkInterval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "provider-health-checker");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts the periodic health checking.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    this::checkAllProviders,
                    0,
                    checkInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Provider health monitor started with interval: {}", checkInterval);
        }
    }

    /**
     * Performs an immediate health check of every provider.
     */
    public void checkAllProviders() {
        log.debug("Starting health check cycle: providerCount={}", adapters.size());
        for (BackendAdapter adapter : adapters) {
            checkProvider(adapter);
        }
    }

    /**
     * Checks one provider and applies its circuit hint.
     */
    public ProviderHealth checkProvider(BackendAdapter adapter) {
        String provider = adapter.providerName();
        ProviderHealth health;
        try {
            health = adapter.healthCheck();
        } catch (RuntimeException e) {
            log.warn("Health check failed: provider={}, error={}", provider, e.getMessage());
            health = new ProviderHealth(ProviderHealth.Status.UNHEALTHY, ProviderHealth.CircuitHint.NONE,
                    e.getMessage());
        }

        ProviderHealth previous = lastHealth.put(provider, health);
        if (previous == null || previous.status() != health.status()) {
            log.info("Provider health changed: provider={}, previousHealth={}, newHealth={}, detail={}",
                    provider, previous != null ? previous.status() : null, health.status(), health.detail());
        }

        if (health.status() == ProviderHealth.Status.UNHEALTHY
                && health.circuitHint() == ProviderHealth.CircuitHint.OPEN) {
            List<BackendDescriptor> backends = registry.listByProvider(provider);
            for (BackendDescriptor backend : backends) {
                circuitBreakers.forceOpen(backend.getId());
            }
            log.warn("Provider unhealthy, circuits forced open: provider={}, backends={}",
                    provider, backends.size());
        }
        return health;
    }

    /**
     * Last observed health per provider.
     */
    public Map<String, ProviderHealth> snapshot() {
        return Map.copyOf(lastHealth);
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Provider health monitor stopped");
        } else {
            scheduler.shutdownNow();
        }
    }
}
