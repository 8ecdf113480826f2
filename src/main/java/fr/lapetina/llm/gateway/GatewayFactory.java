package fr.lapetina.llm.gateway;

import fr.lapetina.llm.gateway.domain.model.BackendDescriptor;
import fr.lapetina.llm.gateway.domain.model.RateLimits;
import fr.lapetina.llm.gateway.domain.model.UsageRecord;
import fr.lapetina.llm.gateway.domain.strategy.RoutingStrategy;
import fr.lapetina.llm.gateway.domain.strategy.StrategyFactory;
import fr.lapetina.llm.gateway.infrastructure.adapter.BackendAdapter;
import fr.lapetina.llm.gateway.infrastructure.adapter.OllamaEmbeddingProvider;
import fr.lapetina.llm.gateway.infrastructure.cache.CacheStore;
import fr.lapetina.llm.gateway.infrastructure.cache.CaffeineCacheStore;
import fr.lapetina.llm.gateway.infrastructure.cache.EmbeddingProvider;
import fr.lapetina.llm.gateway.infrastructure.cache.RedissonCacheStore;
import fr.lapetina.llm.gateway.infrastructure.cache.ResponseCache;
import fr.lapetina.llm.gateway.infrastructure.config.ConfigLoader;
import fr.lapetina.llm.gateway.infrastructure.config.GatewayConfig;
import fr.lapetina.llm.gateway.infrastructure.health.ProviderHealthMonitor;
import fr.lapetina.llm.gateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llm.gateway.infrastructure.queue.AdmissionQueue;
import fr.lapetina.llm.gateway.infrastructure.ratelimit.BucketStore;
import fr.lapetina.llm.gateway.infrastructure.ratelimit.InMemoryBucketStore;
import fr.lapetina.llm.gateway.infrastructure.ratelimit.RateLimiter;
import fr.lapetina.llm.gateway.infrastructure.ratelimit.RedissonBucketStore;
import fr.lapetina.llm.gateway.infrastructure.registry.BackendRegistry;
import fr.lapetina.llm.gateway.infrastructure.resilience.CircuitBreakerRegistry;
import fr.lapetina.llm.gateway.infrastructure.usage.UsagePublisher;
import fr.lapetina.llm.gateway.infrastructure.usage.UsageSink;
import fr.lapetina.llm.gateway.orchestrator.AdmissionDispatcher;
import fr.lapetina.llm.gateway.orchestrator.ModelGateway;
import fr.lapetina.llm.gateway.routing.Router;
import fr.lapetina.llm.gateway.routing.TokenEstimator;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Factory for creating a fully-wired gateway from configuration.
 * This is the primary entry point for obtaining a configured {@link ModelGateway}.
 *
 * <p>Usage:
 * <pre>{@code
 * try (GatewayFactory factory = GatewayFactory.builder()
 *         .configPath("gateway.yaml")
 *         .registry(registry)
 *         .adapter(openAiAdapter)
 *         .usageSink(billing::record)
 *         .build()
 *         .start()) {
 *     InferenceResponse response = factory.getGateway().execute(request);
 * }
 * }</pre>
 */
public class GatewayFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GatewayFactory.class);

    private final ConfigLoader configLoader;
    private final GatewayConfig config;
    private final BackendRegistry registry;
    private final List<BackendAdapter> adapters;
    private final MetricsRegistry metricsRegistry;
    private final CircuitBreakerRegistry circuitBreakers;
    private final RateLimiter rateLimiter;
    private final RedissonClient ownedRedissonClient;
    private final ResponseCache cache;
    private final AdmissionQueue admissionQueue;
    private final UsagePublisher usagePublisher;
    private final ProviderHealthMonitor healthMonitor;
    private final Router router;
    private final ModelGateway gateway;

    protected GatewayFactory(Builder builder) {
        log.info("Initializing GatewayFactory from config: {}", builder.configPath);

        this.configLoader = new ConfigLoader(builder.configPath);
        this.config = configLoader.load();
        Clock clock = builder.clock;

        this.registry = builder.registry != null ? builder.registry : new BackendRegistry();
        this.adapters = List.copyOf(builder.adapters);

        this.metricsRegistry = config.getMetrics().isEnabled()
                ? new MetricsRegistry(config.getMetrics().getPrefix())
                : null;

        GatewayConfig.CircuitBreakerConfig breakerConfig = config.getCircuitBreaker();
        this.circuitBreakers = new CircuitBreakerRegistry(
                breakerConfig.getFailureThreshold(),
                Duration.ofMillis(breakerConfig.getRecoveryTimeoutMs()),
                breakerConfig.getHalfOpenMaxTrials(),
                clock
        );

        GatewayConfig.RateLimitConfig limitConfig = config.getRateLimit();
        GatewayConfig.CacheConfig cacheConfig = config.getCache();
        boolean redisCache = "redis".equals(cacheConfig.getStore());
        boolean redisBuckets = "redis".equals(limitConfig.getStore()) && builder.bucketStore == null;
        this.ownedRedissonClient = (redisCache || redisBuckets) && builder.redissonClient == null
                ? createRedissonClient(cacheConfig.getRedis())
                : null;
        RedissonClient redissonClient = builder.redissonClient != null ? builder.redissonClient : ownedRedissonClient;

        Duration period = Duration.ofMillis(limitConfig.getPeriodMs());
        this.rateLimiter = new RateLimiter(
                createBucketStore(limitConfig, cacheConfig.getRedis(), period, builder.bucketStore, redissonClient),
                new RateLimits(limitConfig.getRequestsPerMinute(), limitConfig.getUnitsPerMinute()),
                period,
                Duration.ofMillis(limitConfig.getStoreTimeoutMs()),
                clock
        );

        this.cache = new ResponseCache(
                createCacheStore(cacheConfig, redissonClient),
                createEmbeddingProvider(cacheConfig, builder.embeddingProvider),
                new ResponseCache.Settings(
                        Duration.ofSeconds(cacheConfig.getTtlSeconds()),
                        cacheConfig.isSimilarityEnabled(),
                        cacheConfig.getSimilarityThreshold(),
                        cacheConfig.getMaxSimilarityCandidates(),
                        Duration.ofMillis(cacheConfig.getOperationTimeoutMs())
                ),
                clock
        );

        this.admissionQueue = new AdmissionQueue(config.getQueue().getMaxSize(), clock, AdmissionDispatcher::expire);

        this.usagePublisher = UsagePublisher.builder()
                .fromConfig(config.getUsage())
                .sink(builder.usageSink != null ? builder.usageSink : GatewayFactory::logUsage)
                .metricsRegistry(metricsRegistry)
                .build();

        RoutingStrategy strategy = StrategyFactory.resolveOrDefault(
                config.getRouting().getDefaultStrategy(), RoutingStrategy.CAPABILITY_FIRST);
        log.info("Using routing strategy: {}", strategy.getConfigName());
        this.router = new Router(
                registry,
                circuitBreakers,
                builder.tokenEstimator,
                strategy,
                config.getRouting().getMaxFallbacks()
        );

        this.healthMonitor = config.getHealthCheck().isEnabled() && !adapters.isEmpty()
                ? new ProviderHealthMonitor(adapters, registry, circuitBreakers,
                Duration.ofMillis(config.getHealthCheck().getIntervalMs()))
                : null;

        this.gateway = ModelGateway.builder()
                .fromConfig(config)
                .registry(registry)
                .router(router)
                .circuitBreakers(circuitBreakers)
                .rateLimiter(rateLimiter)
                .cache(cache)
                .adapters(adapters)
                .usagePublisher(usagePublisher)
                .metricsRegistry(metricsRegistry)
                .admissionQueue(admissionQueue)
                .clock(clock)
                .build();

        configLoader.addListener(gateway);
        registerMetrics();

        log.info("GatewayFactory initialized: backends={}, providers={}, cacheStore={}",
                registry.size(), adapters.size(), cacheConfig.getStore());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the usage publisher, admission workers, health monitor and config watcher.
     */
    public GatewayFactory start() {
        usagePublisher.start();
        gateway.start();
        if (healthMonitor != null) {
            healthMonitor.start();
        }
        configLoader.startWatching();
        log.info("Gateway started");
        return this;
    }

    public ModelGateway getGateway() {
        return gateway;
    }

    public BackendRegistry getRegistry() {
        return registry;
    }

    public CircuitBreakerRegistry getCircuitBreakers() {
        return circuitBreakers;
    }

    public RateLimiter getRateLimiter() {
        return rateLimiter;
    }

    public ResponseCache getCache() {
        return cache;
    }

    public AdmissionQueue getAdmissionQueue() {
        return admissionQueue;
    }

    public UsagePublisher getUsagePublisher() {
        return usagePublisher;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public ProviderHealthMonitor getHealthMonitor() {
        return healthMonitor;
    }

    public Router getRouter() {
        return router;
    }

    public GatewayConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    private static CacheStore createCacheStore(GatewayConfig.CacheConfig cacheConfig, RedissonClient redissonClient) {
        if ("redis".equals(cacheConfig.getStore())) {
            return new RedissonCacheStore(redissonClient, cacheConfig.getRedis().getNamespace());
        }
        return new CaffeineCacheStore(cacheConfig.getMaxEntries());
    }

    /**
     * Bucket states live twice the refill period after their last update: an
     * idle bucket is full by then, so forgetting it changes no decision.
     */
    private static BucketStore createBucketStore(
            GatewayConfig.RateLimitConfig limitConfig,
            GatewayConfig.RedisConfig redisConfig,
            Duration period,
            BucketStore override,
            RedissonClient redissonClient
    ) {
        if (override != null) {
            return override;
        }
        Duration idleExpiry = period.multipliedBy(2);
        if ("redis".equals(limitConfig.getStore())) {
            log.info("Using shared rate-limit buckets: namespace={}", redisConfig.getNamespace());
            return new RedissonBucketStore(redissonClient, redisConfig.getNamespace(), idleExpiry);
        }
        return new InMemoryBucketStore(idleExpiry);
    }

    private EmbeddingProvider createEmbeddingProvider(
            GatewayConfig.CacheConfig cacheConfig,
            EmbeddingProvider override
    ) {
        if (override != null || !cacheConfig.isSimilarityEnabled()) {
            return override;
        }
        return new OllamaEmbeddingProvider(
                cacheConfig.getEmbedding().getBaseUrl(),
                cacheConfig.getEmbedding().getModel(),
                Duration.ofMillis(config.getTimeouts().getConnectTimeoutMs()),
                Duration.ofMillis(config.getTimeouts().getAttemptTimeoutMs())
        );
    }

    private static RedissonClient createRedissonClient(GatewayConfig.RedisConfig redisConfig) {
        Config redissonConfig = new Config();
        redissonConfig.useSingleServer()
                .setAddress(redisConfig.getAddress())
                .setDatabase(redisConfig.getDatabase())
                .setConnectTimeout(redisConfig.getConnectTimeoutMs());
        log.info("Connecting cache store to Redis: address={}, database={}",
                redisConfig.getAddress(), redisConfig.getDatabase());
        return Redisson.create(redissonConfig);
    }

    private void registerMetrics() {
        if (metricsRegistry == null) {
            return;
        }
        metricsRegistry.registerQueueSize(admissionQueue::size);
        for (BackendDescriptor backend : registry.listAvailable()) {
            registerCircuitGauge(backend.getId());
        }
        registry.addListener(event -> {
            if (event.type() == BackendRegistry.RegistryEvent.Type.ADDED) {
                registerCircuitGauge(event.backend().getId());
            }
        });
    }

    private void registerCircuitGauge(String backendId) {
        metricsRegistry.registerCircuitState(backendId, () -> switch (circuitBreakers.getState(backendId)) {
            case CLOSED -> 0;
            case HALF_OPEN -> 1;
            case OPEN -> 2;
        });
    }

    private static void logUsage(UsageRecord record) {
        log.debug("Usage: requestId={}, callerId={}, backendId={}, inputTokens={}, outputTokens={}, costUsd={}",
                record.requestId(), record.callerId(), record.backendId(),
                record.inputTokens(), record.outputTokens(), record.costEstimateUsd());
    }

    @Override
    public void close() {
        log.info("Shutting down GatewayFactory...");

        if (healthMonitor != null) {
            try {
                healthMonitor.close();
            } catch (Exception e) {
                log.warn("Error closing health monitor", e);
            }
        }

        try {
            gateway.close();
        } catch (Exception e) {
            log.warn("Error closing gateway", e);
        }

        try {
            usagePublisher.close();
        } catch (Exception e) {
            log.warn("Error closing usage publisher", e);
        }

        try {
            rateLimiter.close();
        } catch (Exception e) {
            log.warn("Error closing rate limiter", e);
        }

        try {
            cache.close();
        } catch (Exception e) {
            log.warn("Error closing response cache", e);
        }

        if (ownedRedissonClient != null) {
            try {
                ownedRedissonClient.shutdown();
            } catch (Exception e) {
                log.warn("Error closing Redis client", e);
            }
        }

        if (metricsRegistry != null) {
            try {
                metricsRegistry.close();
            } catch (Exception e) {
                log.warn("Error closing metrics registry", e);
            }
        }

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        log.info("GatewayFactory shut down");
    }

    /**
     * Builder for GatewayFactory. Only the registry contents and adapters are
     * usually supplied; everything else has a config-driven default.
     */
    public static class Builder {
        private String configPath = ConfigLoader.DEFAULT_RESOURCE;
        private BackendRegistry registry;
        private final List<BackendAdapter> adapters = new ArrayList<>();
        private UsageSink usageSink;
        private EmbeddingProvider embeddingProvider;
        private RedissonClient redissonClient;
        private BucketStore bucketStore;
        private TokenEstimator tokenEstimator = TokenEstimator.characterRatio();
        private Clock clock = Clock.systemUTC();

        public Builder configPath(String configPath) {
            this.configPath = configPath;
            return this;
        }

        public Builder registry(BackendRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder adapter(BackendAdapter adapter) {
            this.adapters.add(adapter);
            return this;
        }

        public Builder usageSink(UsageSink usageSink) {
            this.usageSink = usageSink;
            return this;
        }

        public Builder embeddingProvider(EmbeddingProvider embeddingProvider) {
            this.embeddingProvider = embeddingProvider;
            return this;
        }

        /**
         * Redis client for the shared cache store. Not closed by the factory.
         */
        public Builder redissonClient(RedissonClient redissonClient) {
            this.redissonClient = redissonClient;
            return this;
        }

        public Builder bucketStore(BucketStore bucketStore) {
            this.bucketStore = bucketStore;
            return this;
        }

        public Builder tokenEstimator(TokenEstimator tokenEstimator) {
            this.tokenEstimator = tokenEstimator;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public GatewayFactory build() {
            return new GatewayFactory(this);
        }
    }
}
