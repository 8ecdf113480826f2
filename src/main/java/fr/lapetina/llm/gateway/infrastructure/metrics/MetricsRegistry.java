package fr.lapetina.llm.gateway.infrastructure.metrics;

import fr.lapetina.llm.gateway.domain.exception.ErrorCode;
import fr.lapetina.llm.gateway.domain.model.ResponseStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Request counters and latency timers per backend
 * - Cache lookup, rate-limit rejection and routing failure counters
 * - Circuit state, queue depth and usage pipeline gauges
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> cacheCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> rejectionCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> routingFailureCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> fallbackCounters = new ConcurrentHashMap<>();

    private final AtomicInteger ringBufferRemaining = new AtomicInteger(0);
    private final Counter usageDropped;
    private final Counter usageSinkErrors;

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        Gauge.builder(prefix + "_usage_ringbuffer_remaining", ringBufferRemaining, AtomicInteger::get)
                .description("Remaining capacity in the usage ring buffer")
                .register(registry);

        this.usageDropped = Counter.builder(prefix + "_usage_dropped_total")
                .description("Usage records dropped because the ring buffer was full")
                .register(registry);

        this.usageSinkErrors = Counter.builder(prefix + "_usage_sink_errors_total")
                .description("Usage records the sink failed to accept")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("llm_gateway");
    }

    /**
     * Increments the request counter for a backend/status combination.
     */
    public void incrementRequestCount(String backendId, ResponseStatus status, boolean cached) {
        String key = backendId + ":" + status.name() + ":" + cached;
        requestCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_requests_total")
                        .description("Total number of completed requests")
                        .tag("backend", backendId)
                        .tag("status", status.name())
                        .tag("cached", Boolean.toString(cached))
                        .register(registry)
        ).increment();
    }

    /**
     * Records the latency of a backend attempt.
     */
    public void recordLatency(String backendId, Duration latency) {
        latencyTimers.computeIfAbsent(backendId, k ->
                Timer.builder(prefix + "_request_latency")
                        .description("Backend request latency")
                        .tag("backend", backendId)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Counts a cache lookup. {@code matchType} is "exact", "similar" or "miss".
     */
    public void recordCacheLookup(String matchType) {
        cacheCounters.computeIfAbsent(matchType, k ->
                Counter.builder(prefix + "_cache_lookups_total")
                        .description("Response cache lookups by result")
                        .tag("result", matchType)
                        .register(registry)
        ).increment();
    }

    public void incrementRateLimitRejection(ErrorCode code) {
        rejectionCounters.computeIfAbsent(code.name(), k ->
                Counter.builder(prefix + "_ratelimit_rejections_total")
                        .description("Requests rejected by the rate limiter")
                        .tag("code", code.name())
                        .register(registry)
        ).increment();
    }

    public void incrementRoutingFailure(ErrorCode code) {
        routingFailureCounters.computeIfAbsent(code.name(), k ->
                Counter.builder(prefix + "_routing_failures_total")
                        .description("Requests that could not be routed or executed")
                        .tag("code", code.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Counts a request answered by a backend other than the routed primary.
     */
    public void incrementFallback(String backendId) {
        fallbackCounters.computeIfAbsent(backendId, k ->
                Counter.builder(prefix + "_fallbacks_total")
                        .description("Requests served by a fallback backend")
                        .tag("backend", backendId)
                        .register(registry)
        ).increment();
    }

    /**
     * Registers a gauge for a backend's circuit state.
     */
    public void registerCircuitState(String backendId, Supplier<Number> stateValue) {
        Gauge.builder(prefix + "_circuit_state", stateValue, s -> s.get().doubleValue())
                .description("Circuit breaker state (0=CLOSED, 1=HALF_OPEN, 2=OPEN)")
                .tag("backend", backendId)
                .register(registry);
    }

    /**
     * Registers a gauge for the admission queue depth.
     */
    public void registerQueueSize(Supplier<Number> size) {
        Gauge.builder(prefix + "_queue_size", size, s -> s.get().doubleValue())
                .description("Requests waiting in the admission queue")
                .register(registry);
    }

    public void incrementUsageDropped() {
        usageDropped.increment();
    }

    public void incrementUsageSinkErrors() {
        usageSinkErrors.increment();
    }

    public void setRingBufferRemaining(int value) {
        ringBufferRemaining.set(value);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
