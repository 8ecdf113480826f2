package fr.lapetina.llm.gateway.orchestrator;

import fr.lapetina.llm.gateway.domain.exception.DeadlineExceededException;
import fr.lapetina.llm.gateway.domain.exception.ErrorCode;
import fr.lapetina.llm.gateway.domain.exception.GatewayException;
import fr.lapetina.llm.gateway.domain.exception.ProviderException;
import fr.lapetina.llm.gateway.domain.exception.RateLimitExceededException;
import fr.lapetina.llm.gateway.domain.exception.RoutingException;
import fr.lapetina.llm.gateway.domain.model.BackendDescriptor;
import fr.lapetina.llm.gateway.domain.model.Constraints;
import fr.lapetina.llm.gateway.domain.model.InferenceRequest;
import fr.lapetina.llm.gateway.domain.model.InferenceResponse;
import fr.lapetina.llm.gateway.domain.model.Priority;
import fr.lapetina.llm.gateway.domain.model.ProviderHealth;
import fr.lapetina.llm.gateway.domain.model.RoutingDecision;
import fr.lapetina.llm.gateway.domain.model.StreamChunk;
import fr.lapetina.llm.gateway.domain.model.TokenUsage;
import fr.lapetina.llm.gateway.domain.model.UsageRecord;
import fr.lapetina.llm.gateway.domain.strategy.RoutingStrategy;
import fr.lapetina.llm.gateway.domain.strategy.StrategyFactory;
import fr.lapetina.llm.gateway.infrastructure.adapter.BackendAdapter;
import fr.lapetina.llm.gateway.infrastructure.cache.ResponseCache;
import fr.lapetina.llm.gateway.infrastructure.config.ConfigChangeListener;
import fr.lapetina.llm.gateway.infrastructure.config.GatewayConfig;
import fr.lapetina.llm.gateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llm.gateway.infrastructure.queue.AdmissionQueue;
import fr.lapetina.llm.gateway.infrastructure.ratelimit.RateLimiter;
import fr.lapetina.llm.gateway.infrastructure.registry.BackendRegistry;
import fr.lapetina.llm.gateway.infrastructure.resilience.CircuitBreaker;
import fr.lapetina.llm.gateway.infrastructure.resilience.CircuitBreakerRegistry;
import fr.lapetina.llm.gateway.infrastructure.usage.UsagePublisher;
import fr.lapetina.llm.gateway.routing.Router;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Entry point of the gateway.
 *
 * A call runs these stages in order: gateway rate limit, cache lookup,
 * routing, execution with failover, cache write, usage record. Rate-limit,
 * routing and deadline failures are terminal. Provider failures, circuit
 * rejections and per-backend quota rejections move on to the next candidate.
 *
 * The request deadline is checked before every stage and bounds every
 * suspension point: shared rate-limit store calls, cache lookups and writes
 * (embedding included) and adapter waits.
 */
public final class ModelGateway implements ConfigChangeListener, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ModelGateway.class);

    private final BackendRegistry registry;
    private final Router router;
    private final CircuitBreakerRegistry circuitBreakers;
    private final RateLimiter rateLimiter;
    private final ResponseCache cache;
    private final Map<String, BackendAdapter> adapters;
    private final UsagePublisher usagePublisher;
    private final MetricsRegistry metricsRegistry;
    private final AdmissionQueue admissionQueue;
    private final AdmissionDispatcher dispatcher;
    private final Duration attemptTimeout;
    private final Duration defaultQueueTimeout;
    private final Clock clock;
    private final ExecutorService asyncExecutor;
    private volatile boolean cacheEnabled;

    private ModelGateway(Builder builder) {
        this.registry = builder.registry;
        this.router = builder.router;
        this.circuitBreakers = builder.circuitBreakers;
        this.rateLimiter = builder.rateLimiter;
        this.cache = builder.cache;
        this.adapters = Map.copyOf(builder.adapters);
        this.usagePublisher = builder.usagePublisher;
        this.metricsRegistry = builder.metricsRegistry;
        this.admissionQueue = builder.admissionQueue;
        this.attemptTimeout = builder.attemptTimeout;
        this.defaultQueueTimeout = builder.defaultQueueTimeout;
        this.clock = builder.clock;
        this.cacheEnabled = builder.cacheEnabled;
        this.asyncExecutor = Executors.newFixedThreadPool(builder.workers, new GatewayThreadFactory());
        this.dispatcher = admissionQueue != null
                ? new AdmissionDispatcher(admissionQueue, this::execute, builder.workers)
                : null;

        log.info("ModelGateway created: providers={}, attemptTimeout={}, cacheEnabled={}, queue={}",
                adapters.keySet(), attemptTimeout, cacheEnabled, admissionQueue != null);
    }

    /**
     * Starts the admission workers. Direct {@code execute} calls work without it.
     */
    public void start() {
        if (dispatcher != null) {
            dispatcher.start();
        }
    }

    public InferenceResponse execute(InferenceRequest request) {
        return execute(request, null);
    }

    /**
     * Runs a request synchronously on the calling thread.
     *
     * @param strategy routing strategy, or null for the configured default
     * @throws RateLimitExceededException if the caller is over the gateway limit
     * @throws RoutingException           if no backend qualifies or every candidate failed
     * @throws DeadlineExceededException if the deadline passes before a response
     */
    public InferenceResponse execute(InferenceRequest request, RoutingStrategy strategy) {
        MDC.put("requestId", request.requestId());
        MDC.put("callerId", request.callerId());
        long start = System.nanoTime();
        try {
            log.info("Executing request: requestId={}, callerId={}, capabilities={}",
                    request.requestId(), request.callerId(), request.effectiveCapabilities());

            checkDeadline(request, "rate-limit");
            int estimatedInput = router.estimateInputTokens(request);
            checkGatewayRateLimit(request, estimatedInput);

            boolean useCache = isCacheable(request);
            if (useCache) {
                checkDeadline(request, "cache");
                Optional<InferenceResponse> cached = cache.get(request);
                recordCacheLookup(cached);
                if (cached.isPresent()) {
                    InferenceResponse response = cached.get();
                    log.info("Cache hit: requestId={}, backendId={}", request.requestId(), response.backendId());
                    complete(request, response, 0.0);
                    return response;
                }
            }

            checkDeadline(request, "routing");
            RoutingDecision decision = route(request, strategy);

            InferenceResponse response = executeWithFailover(request, decision);

            if (useCache) {
                cache.set(request, response);
            }
            complete(request, response, costOf(response));

            log.info("Request completed: requestId={}, backendId={}, attempts={}, latencyMs={}, totalMs={}",
                    request.requestId(), response.backendId(), response.metadata().get("attempts"),
                    response.latencyMs(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
            return response;

        } finally {
            MDC.remove("requestId");
            MDC.remove("callerId");
        }
    }

    /**
     * Runs a request on the gateway worker pool.
     */
    public CompletableFuture<InferenceResponse> executeAsync(InferenceRequest request, RoutingStrategy strategy) {
        return CompletableFuture.supplyAsync(() -> execute(request, strategy), asyncExecutor);
    }

    public CompletableFuture<InferenceResponse> executeAsync(InferenceRequest request) {
        return executeAsync(request, null);
    }

    /**
     * Queues a request for the admission workers.
     *
     * The request's own deadline applies, or the configured queue timeout when
     * it has none. A request still queued at its deadline completes
     * exceptionally with {@code DEADLINE_EXCEEDED}.
     *
     * @throws IllegalStateException                                         if no admission queue is configured
     * @throws fr.lapetina.llm.gateway.domain.exception.QueueFullException if the queue is at capacity
     */
    public CompletableFuture<InferenceResponse> submit(InferenceRequest request, Priority priority) {
        if (admissionQueue == null) {
            throw new IllegalStateException("No admission queue configured");
        }
        Instant deadline = request.hasDeadline()
                ? request.deadline()
                : clock.instant().plus(defaultQueueTimeout);
        return admissionQueue.enqueue(request, priority, deadline).response();
    }

    public Stream<StreamChunk> stream(InferenceRequest request) {
        return stream(request, null);
    }

    /**
     * Opens a streamed completion on the first candidate that accepts it.
     *
     * Streaming bypasses the cache. A usage record is published when the
     * returned stream is closed, so callers must close it. The backend's
     * circuit learns the outcome from consumption: a source error mid-stream
     * counts as a failure, reaching the end as a success.
     */
    public Stream<StreamChunk> stream(InferenceRequest request, RoutingStrategy strategy) {
        MDC.put("requestId", request.requestId());
        MDC.put("callerId", request.callerId());
        try {
            InferenceRequest streaming = requireStreaming(request);
            checkDeadline(streaming, "rate-limit");
            int estimatedInput = router.estimateInputTokens(streaming);
            checkGatewayRateLimit(streaming, estimatedInput);

            checkDeadline(streaming, "routing");
            RoutingDecision decision = route(streaming, strategy);

            List<String> attempted = new ArrayList<>();
            Throwable lastFailure = null;
            for (String backendId : decision.attemptOrder()) {
                Optional<BackendDescriptor> backend = registry.get(backendId);
                BackendAdapter adapter = backend.map(b -> adapters.get(b.getProvider())).orElse(null);
                if (adapter == null) {
                    log.warn("Skipping stream candidate without backend or adapter: requestId={}, backendId={}",
                            streaming.requestId(), backendId);
                    continue;
                }
                checkDeadline(streaming, "execution");
                attempted.add(backendId);
                try {
                    Stream<StreamChunk> chunks = circuitBreakers.callStream(backendId, () -> adapter.stream(streaming, backendId));
                    log.info("Stream opened: requestId={}, backendId={}, attempts={}",
                            streaming.requestId(), backendId, attempted.size());
                    return withUsageOnClose(streaming, backend.get(), estimatedInput, chunks);
                } catch (DeadlineExceededException e) {
                    throw e;
                } catch (RuntimeException e) {
                    lastFailure = e;
                    log.warn("Stream attempt failed: requestId={}, backendId={}, error={}",
                            streaming.requestId(), backendId, e.getMessage());
                }
            }
            throw exhausted(streaming, attempted, lastFailure);

        } finally {
            MDC.remove("requestId");
            MDC.remove("callerId");
        }
    }

    private RoutingDecision route(InferenceRequest request, RoutingStrategy strategy) {
        try {
            return router.route(request, strategy);
        } catch (RoutingException e) {
            if (metricsRegistry != null) {
                metricsRegistry.incrementRoutingFailure(e.getCode());
            }
            log.warn("Routing failed: requestId={}, code={}, stage={}, constraint={}",
                    request.requestId(), e.getCode(), e.getStage(), e.getConstraint());
            throw e;
        }
    }

    /**
     * Tries the primary, then each fallback, until one succeeds.
     */
    private InferenceResponse executeWithFailover(InferenceRequest request, RoutingDecision decision) {
        List<String> attempted = new ArrayList<>();
        Throwable lastFailure = null;

        for (String backendId : decision.attemptOrder()) {
            Optional<BackendDescriptor> backend = registry.get(backendId);
            if (backend.isEmpty()) {
                log.warn("Skipping candidate no longer registered: requestId={}, backendId={}",
                        request.requestId(), backendId);
                continue;
            }
            BackendAdapter adapter = adapters.get(backend.get().getProvider());
            if (adapter == null) {
                log.warn("Skipping candidate without adapter: requestId={}, backendId={}, provider={}",
                        request.requestId(), backendId, backend.get().getProvider());
                continue;
            }

            Duration budget = attemptBudget(request);
            boolean deadlineBound = budget.compareTo(attemptTimeout) < 0;
            attempted.add(backendId);
            long attemptStart = System.nanoTime();
            try {
                checkBackendRateLimit(request, backend.get(), decision.estimatedInputTokens());
                InferenceResponse response = circuitBreakers.call(backendId,
                        () -> await(adapter.complete(request, backendId), budget, deadlineBound, request, backendId));
                recordLatency(backendId, attemptStart);

                boolean fallbackUsed = !backendId.equals(decision.primaryBackendId());
                if (fallbackUsed && metricsRegistry != null) {
                    metricsRegistry.incrementFallback(backendId);
                }
                return response.toBuilder()
                        .putMetadata("attempts", Integer.toString(attempted.size()))
                        .putMetadata("fallback_used", Boolean.toString(fallbackUsed))
                        .putMetadata("routing_strategy", decision.strategy().getConfigName())
                        .build();

            } catch (DeadlineExceededException e) {
                log.warn("Deadline exceeded during execution: requestId={}, backendId={}, attempts={}",
                        request.requestId(), backendId, attempted.size());
                throw e;
            } catch (GatewayException e) {
                recordLatency(backendId, attemptStart);
                lastFailure = e;
                log.warn("Backend attempt failed: requestId={}, backendId={}, code={}, error={}",
                        request.requestId(), backendId, e.getCode(), e.getMessage());
            } catch (RuntimeException e) {
                recordLatency(backendId, attemptStart);
                lastFailure = e;
                log.warn("Backend attempt failed: requestId={}, backendId={}, error={}",
                        request.requestId(), backendId, e.toString());
            }
        }

        throw exhausted(request, attempted, lastFailure);
    }

    private RoutingException exhausted(InferenceRequest request, List<String> attempted, Throwable lastFailure) {
        if (metricsRegistry != null) {
            metricsRegistry.incrementRoutingFailure(ErrorCode.ALL_FALLBACKS_EXHAUSTED);
        }
        log.error("All candidates failed: requestId={}, attempted={}", request.requestId(), attempted);
        return new RoutingException(ErrorCode.ALL_FALLBACKS_EXHAUSTED, "execution",
                "attempted=" + attempted, attempted, lastFailure);
    }

    /**
     * Waits for an adapter result, turning every failure into an exception so
     * the circuit breaker records it.
     */
    private InferenceResponse await(
            CompletableFuture<InferenceResponse> future,
            Duration wait,
            boolean deadlineBound,
            InferenceRequest request,
            String backendId
    ) {
        InferenceResponse response;
        try {
            response = future.get(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            if (deadlineBound) {
                throw new DeadlineExceededException(request.requestId(), "execution");
            }
            throw new ProviderException(ProviderException.Kind.TIMEOUT, backendId,
                    "No response within " + wait.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new ProviderException(ProviderException.Kind.UNAVAILABLE, backendId, String.valueOf(cause), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProviderException(ProviderException.Kind.UNAVAILABLE, backendId, "Interrupted while waiting", e);
        }

        if (response == null || !response.isSuccess()) {
            String message = response != null ? response.errorMessage() : "empty response";
            throw new ProviderException(ProviderException.Kind.UNAVAILABLE, backendId,
                    "Backend returned an error: " + message);
        }
        return response;
    }

    /**
     * Time the next attempt may take: the attempt timeout, capped by the deadline.
     */
    private Duration attemptBudget(InferenceRequest request) {
        if (!request.hasDeadline()) {
            return attemptTimeout;
        }
        Duration remaining = Duration.between(clock.instant(), request.deadline());
        if (remaining.isNegative() || remaining.isZero()) {
            throw new DeadlineExceededException(request.requestId(), "execution");
        }
        return remaining.compareTo(attemptTimeout) < 0 ? remaining : attemptTimeout;
    }

    private void checkDeadline(InferenceRequest request, String stage) {
        if (request.isExpired(clock.instant())) {
            log.warn("Deadline exceeded: requestId={}, stage={}", request.requestId(), stage);
            throw new DeadlineExceededException(request.requestId(), stage);
        }
    }

    private void checkGatewayRateLimit(InferenceRequest request, int estimatedInput) {
        try {
            rateLimiter.checkGateway(request.callerId(), estimatedInput, request.deadline());
        } catch (RateLimitExceededException e) {
            if (metricsRegistry != null) {
                metricsRegistry.incrementRateLimitRejection(e.getCode());
            }
            throw e;
        }
    }

    /**
     * Applies a backend's declared quota. Backends without one are only
     * bounded by the gateway-wide check.
     */
    private void checkBackendRateLimit(InferenceRequest request, BackendDescriptor backend, int estimatedInput) {
        if (backend.getRateLimits() == null) {
            return;
        }
        try {
            rateLimiter.check(request.callerId(), backend.getId(), estimatedInput, backend.getRateLimits(),
                    request.deadline());
        } catch (RateLimitExceededException e) {
            if (metricsRegistry != null) {
                metricsRegistry.incrementRateLimitRejection(e.getCode());
            }
            throw e;
        }
    }

    private boolean isCacheable(InferenceRequest request) {
        return cache != null
                && cacheEnabled
                && request.cacheEnabled()
                && !request.constraints().streamingRequired();
    }

    private InferenceRequest requireStreaming(InferenceRequest request) {
        Constraints c = request.constraints();
        if (c.streamingRequired()) {
            return request;
        }
        Constraints streaming = new Constraints(c.maxLatencyMs(), c.maxCostUsd(), c.preferredBackends(),
                c.excludedBackends(), c.preferredProviders(), c.allowedRegions(), true);
        return new InferenceRequest(request.requestId(), request.callerId(), request.prompt(),
                request.requirements(), streaming, false, request.createdAt(), request.deadline());
    }

    private Stream<StreamChunk> withUsageOnClose(
            InferenceRequest request,
            BackendDescriptor backend,
            int estimatedInput,
            Stream<StreamChunk> chunks
    ) {
        long start = System.nanoTime();
        AtomicInteger emitted = new AtomicInteger();
        return chunks
                .peek(chunk -> {
                    if (!chunk.delta().isEmpty()) {
                        emitted.incrementAndGet();
                    }
                })
                .onClose(() -> {
                    long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
                    TokenUsage usage = new TokenUsage(estimatedInput, emitted.get(), 0);
                    InferenceResponse summary = InferenceResponse.builder()
                            .requestId(request.requestId())
                            .backendId(backend.getId())
                            .provider(backend.getProvider())
                            .usage(usage)
                            .latencyMs(latencyMs)
                            .build();
                    complete(request, summary, backend.estimateCost(usage.inputTokens(), usage.outputTokens()));
                    log.info("Stream closed: requestId={}, backendId={}, chunks={}, latencyMs={}",
                            request.requestId(), backend.getId(), emitted.get(), latencyMs);
                });
    }

    private double costOf(InferenceResponse response) {
        return registry.get(response.backendId())
                .map(b -> b.estimateCost(response.usage().inputTokens(), response.usage().outputTokens()))
                .orElse(0.0);
    }

    /**
     * Metrics and usage for a finished request. Never throws.
     */
    private void complete(InferenceRequest request, InferenceResponse response, double costUsd) {
        if (metricsRegistry != null && response.backendId() != null) {
            metricsRegistry.incrementRequestCount(response.backendId(), response.status(), response.cached());
        }
        if (usagePublisher != null) {
            usagePublisher.publish(UsageRecord.of(request, response, costUsd));
        }
    }

    private void recordCacheLookup(Optional<InferenceResponse> cached) {
        if (metricsRegistry != null) {
            metricsRegistry.recordCacheLookup(cached.map(r -> r.metadata().getOrDefault("cache_match", "exact"))
                    .orElse("miss"));
        }
    }

    private void recordLatency(String backendId, long startNanos) {
        if (metricsRegistry != null) {
            metricsRegistry.recordLatency(backendId, Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }

    /**
     * Aggregates component statistics and checks every provider.
     */
    public GatewayHealth health() {
        Map<String, ProviderHealth> providers = new LinkedHashMap<>();
        for (BackendAdapter adapter : adapters.values()) {
            try {
                providers.put(adapter.providerName(), adapter.healthCheck());
            } catch (RuntimeException e) {
                log.error("Health check failed: provider={}", adapter.providerName(), e);
                providers.put(adapter.providerName(), new ProviderHealth(
                        ProviderHealth.Status.UNHEALTHY, ProviderHealth.CircuitHint.NONE, e.getMessage()));
            }
        }

        Map<String, CircuitBreaker.CircuitStats> circuits = circuitBreakers.stats();
        boolean degraded = providers.values().stream().anyMatch(p -> p.status() != ProviderHealth.Status.HEALTHY)
                || circuits.values().stream().anyMatch(c -> c.state() != CircuitBreaker.State.CLOSED);

        return new GatewayHealth(
                degraded ? GatewayHealth.Status.DEGRADED : GatewayHealth.Status.HEALTHY,
                clock.instant(),
                registry.stats(),
                circuits,
                providers,
                rateLimiter.stats(),
                cache != null ? cache.stats() : null,
                admissionQueue != null ? admissionQueue.stats() : null,
                usagePublisher != null
                        ? new GatewayHealth.UsageStats(usagePublisher.getPublishedCount(),
                        usagePublisher.getDroppedCount(), usagePublisher.getDeliveredCount(),
                        usagePublisher.getSinkErrorCount())
                        : null
        );
    }

    /**
     * Applies the reloadable settings: default routing strategy and cache switch.
     */
    @Override
    public void onConfigChanged(GatewayConfig oldConfig, GatewayConfig newConfig) {
        RoutingStrategy strategy = StrategyFactory.resolveOrDefault(
                newConfig.getRouting().getDefaultStrategy(), router.getDefaultStrategy());
        if (strategy != router.getDefaultStrategy()) {
            router.setDefaultStrategy(strategy);
        }
        boolean enabled = newConfig.getCache().isEnabled();
        if (enabled != cacheEnabled) {
            cacheEnabled = enabled;
            log.info("Response cache {}", enabled ? "enabled" : "disabled");
        }
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public Router getRouter() {
        return router;
    }

    @Override
    public void close() {
        if (dispatcher != null) {
            dispatcher.close();
        }
        asyncExecutor.shutdown();
        try {
            if (!asyncExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                asyncExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            asyncExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("ModelGateway closed");
    }

    public static Builder builder() {
        return new Builder();
    }

    private static class GatewayThreadFactory implements ThreadFactory {
        private final AtomicLong counter = new AtomicLong();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "gateway-async-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Builder for ModelGateway.
     */
    public static final class Builder {
        private BackendRegistry registry;
        private Router router;
        private CircuitBreakerRegistry circuitBreakers;
        private RateLimiter rateLimiter;
        private ResponseCache cache;
        private final Map<String, BackendAdapter> adapters = new LinkedHashMap<>();
        private UsagePublisher usagePublisher;
        private MetricsRegistry metricsRegistry;
        private AdmissionQueue admissionQueue;
        private int workers = 4;
        private Duration attemptTimeout = Duration.ofSeconds(60);
        private Duration defaultQueueTimeout = Duration.ofSeconds(30);
        private Clock clock = Clock.systemUTC();
        private boolean cacheEnabled = true;

        public Builder registry(BackendRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder router(Router router) {
            this.router = router;
            return this;
        }

        public Builder circuitBreakers(CircuitBreakerRegistry circuitBreakers) {
            this.circuitBreakers = circuitBreakers;
            return this;
        }

        public Builder rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder cache(ResponseCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder adapter(BackendAdapter adapter) {
            this.adapters.put(adapter.providerName(), adapter);
            return this;
        }

        public Builder adapters(Iterable<? extends BackendAdapter> adapters) {
            adapters.forEach(this::adapter);
            return this;
        }

        public Builder usagePublisher(UsagePublisher usagePublisher) {
            this.usagePublisher = usagePublisher;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry metricsRegistry) {
            this.metricsRegistry = metricsRegistry;
            return this;
        }

        public Builder admissionQueue(AdmissionQueue admissionQueue) {
            this.admissionQueue = admissionQueue;
            return this;
        }

        public Builder workers(int workers) {
            if (workers <= 0) {
                throw new IllegalArgumentException("workers must be positive");
            }
            this.workers = workers;
            return this;
        }

        public Builder attemptTimeout(Duration attemptTimeout) {
            this.attemptTimeout = attemptTimeout;
            return this;
        }

        public Builder defaultQueueTimeout(Duration defaultQueueTimeout) {
            this.defaultQueueTimeout = defaultQueueTimeout;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder cacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
            return this;
        }

        public Builder fromConfig(GatewayConfig config) {
            this.workers = config.getQueue().getWorkers();
            this.attemptTimeout = Duration.ofMillis(config.getTimeouts().getAttemptTimeoutMs());
            this.defaultQueueTimeout = Duration.ofMillis(config.getQueue().getDefaultTimeoutMs());
            this.cacheEnabled = config.getCache().isEnabled();
            return this;
        }

        public ModelGateway build() {
            if (registry == null) {
                throw new IllegalStateException("BackendRegistry is required");
            }
            if (circuitBreakers == null) {
                circuitBreakers = new CircuitBreakerRegistry();
            }
            if (router == null) {
                router = new Router(registry, circuitBreakers);
            }
            if (rateLimiter == null) {
                rateLimiter = new RateLimiter();
            }
            return new ModelGateway(this);
        }
    }
}
