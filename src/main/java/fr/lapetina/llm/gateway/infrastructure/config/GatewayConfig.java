package fr.lapetina.llm.gateway.infrastructure.config;

import fr.lapetina.llm.gateway.domain.exception.ConfigurationException;
import fr.lapetina.llm.gateway.domain.exception.ErrorCode;

/**
 * Root configuration object for the gateway.
 * Designed to be populated from YAML.
 */
public class GatewayConfig {

    private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();
    private RateLimitConfig rateLimit = new RateLimitConfig();
    private CacheConfig cache = new CacheConfig();
    private QueueConfig queue = new QueueConfig();
    private RoutingConfig routing = new RoutingConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private HealthCheckConfig healthCheck = new HealthCheckConfig();
    private UsageConfig usage = new UsageConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public CircuitBreakerConfig getCircuitBreaker() { return circuitBreaker; }
    public void setCircuitBreaker(CircuitBreakerConfig circuitBreaker) { this.circuitBreaker = circuitBreaker; }

    public RateLimitConfig getRateLimit() { return rateLimit; }
    public void setRateLimit(RateLimitConfig rateLimit) { this.rateLimit = rateLimit; }

    public CacheConfig getCache() { return cache; }
    public void setCache(CacheConfig cache) { this.cache = cache; }

    public QueueConfig getQueue() { return queue; }
    public void setQueue(QueueConfig queue) { this.queue = queue; }

    public RoutingConfig getRouting() { return routing; }
    public void setRouting(RoutingConfig routing) { this.routing = routing; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public HealthCheckConfig getHealthCheck() { return healthCheck; }
    public void setHealthCheck(HealthCheckConfig healthCheck) { this.healthCheck = healthCheck; }

    public UsageConfig getUsage() { return usage; }
    public void setUsage(UsageConfig usage) { this.usage = usage; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Checks value ranges that YAML typing cannot express.
     *
     * @throws ConfigurationException with {@code INVALID_CONFIGURATION} on the first violation
     */
    public void validate() {
        require(circuitBreaker.getFailureThreshold() > 0, "circuitBreaker.failureThreshold must be positive");
        require(circuitBreaker.getRecoveryTimeoutMs() > 0, "circuitBreaker.recoveryTimeoutMs must be positive");
        require(circuitBreaker.getHalfOpenMaxTrials() > 0, "circuitBreaker.halfOpenMaxTrials must be positive");
        require(rateLimit.getRequestsPerMinute() > 0, "rateLimit.requestsPerMinute must be positive");
        require(rateLimit.getUnitsPerMinute() > 0, "rateLimit.unitsPerMinute must be positive");
        require(rateLimit.getPeriodMs() > 0, "rateLimit.periodMs must be positive");
        require(rateLimit.getStoreTimeoutMs() > 0, "rateLimit.storeTimeoutMs must be positive");
        require("memory".equals(rateLimit.getStore()) || "redis".equals(rateLimit.getStore()),
                "rateLimit.store must be 'memory' or 'redis'");
        require(cache.getTtlSeconds() > 0, "cache.ttlSeconds must be positive");
        require(cache.getSimilarityThreshold() > 0 && cache.getSimilarityThreshold() <= 1,
                "cache.similarityThreshold must be in (0, 1]");
        require("caffeine".equals(cache.getStore()) || "redis".equals(cache.getStore()),
                "cache.store must be 'caffeine' or 'redis'");
        require(cache.getOperationTimeoutMs() > 0, "cache.operationTimeoutMs must be positive");
        require(queue.getMaxSize() > 0, "queue.maxSize must be positive");
        require(queue.getWorkers() > 0, "queue.workers must be positive");
        require(routing.getMaxFallbacks() >= 0, "routing.maxFallbacks must not be negative");
        require(timeouts.getAttemptTimeoutMs() > 0, "timeouts.attemptTimeoutMs must be positive");
        require(Integer.bitCount(usage.getRingBufferSize()) == 1, "usage.ringBufferSize must be a power of 2");
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new ConfigurationException(ErrorCode.INVALID_CONFIGURATION, message);
        }
    }

    /**
     * Per-backend circuit breaker configuration.
     */
    public static class CircuitBreakerConfig {
        private int failureThreshold = 5;
        private long recoveryTimeoutMs = 60000;
        private int halfOpenMaxTrials = 3;

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public long getRecoveryTimeoutMs() { return recoveryTimeoutMs; }
        public void setRecoveryTimeoutMs(long recoveryTimeoutMs) { this.recoveryTimeoutMs = recoveryTimeoutMs; }

        public int getHalfOpenMaxTrials() { return halfOpenMaxTrials; }
        public void setHalfOpenMaxTrials(int halfOpenMaxTrials) { this.halfOpenMaxTrials = halfOpenMaxTrials; }
    }

    /**
     * Default limits for backends that declare none.
     */
    public static class RateLimitConfig {
        private int requestsPerMinute = 60;
        private long unitsPerMinute = 100000;
        private long periodMs = 60000;
        private String store = "memory";
        private long storeTimeoutMs = 500;

        public int getRequestsPerMinute() { return requestsPerMinute; }
        public void setRequestsPerMinute(int requestsPerMinute) { this.requestsPerMinute = requestsPerMinute; }

        public long getUnitsPerMinute() { return unitsPerMinute; }
        public void setUnitsPerMinute(long unitsPerMinute) { this.unitsPerMinute = unitsPerMinute; }

        public long getPeriodMs() { return periodMs; }
        public void setPeriodMs(long periodMs) { this.periodMs = periodMs; }

        public String getStore() { return store; }
        public void setStore(String store) { this.store = store; }

        public long getStoreTimeoutMs() { return storeTimeoutMs; }
        public void setStoreTimeoutMs(long storeTimeoutMs) { this.storeTimeoutMs = storeTimeoutMs; }
    }

    /**
     * Response cache configuration.
     */
    public static class CacheConfig {
        private boolean enabled = true;
        private String store = "caffeine";
        private long ttlSeconds = 3600;
        private long maxEntries = 10000;
        private boolean similarityEnabled = false;
        private double similarityThreshold = 0.95;
        private int maxSimilarityCandidates = 1000;
        private long operationTimeoutMs = 2000;
        private EmbeddingConfig embedding = new EmbeddingConfig();
        private RedisConfig redis = new RedisConfig();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getStore() { return store; }
        public void setStore(String store) { this.store = store; }

        public long getTtlSeconds() { return ttlSeconds; }
        public void setTtlSeconds(long ttlSeconds) { this.ttlSeconds = ttlSeconds; }

        public long getMaxEntries() { return maxEntries; }
        public void setMaxEntries(long maxEntries) { this.maxEntries = maxEntries; }

        public boolean isSimilarityEnabled() { return similarityEnabled; }
        public void setSimilarityEnabled(boolean similarityEnabled) { this.similarityEnabled = similarityEnabled; }

        public double getSimilarityThreshold() { return similarityThreshold; }
        public void setSimilarityThreshold(double similarityThreshold) { this.similarityThreshold = similarityThreshold; }

        public int getMaxSimilarityCandidates() { return maxSimilarityCandidates; }
        public void setMaxSimilarityCandidates(int max) { this.maxSimilarityCandidates = max; }

        public long getOperationTimeoutMs() { return operationTimeoutMs; }
        public void setOperationTimeoutMs(long operationTimeoutMs) { this.operationTimeoutMs = operationTimeoutMs; }

        public EmbeddingConfig getEmbedding() { return embedding; }
        public void setEmbedding(EmbeddingConfig embedding) { this.embedding = embedding; }

        public RedisConfig getRedis() { return redis; }
        public void setRedis(RedisConfig redis) { this.redis = redis; }
    }

    /**
     * Ollama embeddings endpoint used by similarity matching.
     */
    public static class EmbeddingConfig {
        private String baseUrl = "http://localhost:11434";
        private String model = "nomic-embed-text";

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
    }

    /**
     * Redis connection for the shared cache store.
     */
    public static class RedisConfig {
        private String address = "redis://localhost:6379";
        private String namespace = "llm-gateway:";
        private int database = 0;
        private int connectTimeoutMs = 10000;

        public String getAddress() { return address; }
        public void setAddress(String address) { this.address = address; }

        public String getNamespace() { return namespace; }
        public void setNamespace(String namespace) { this.namespace = namespace; }

        public int getDatabase() { return database; }
        public void setDatabase(int database) { this.database = database; }

        public int getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(int connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }
    }

    /**
     * Admission queue and worker configuration.
     */
    public static class QueueConfig {
        private int maxSize = 1000;
        private int workers = 4;
        private long defaultTimeoutMs = 30000;

        public int getMaxSize() { return maxSize; }
        public void setMaxSize(int maxSize) { this.maxSize = maxSize; }

        public int getWorkers() { return workers; }
        public void setWorkers(int workers) { this.workers = workers; }

        public long getDefaultTimeoutMs() { return defaultTimeoutMs; }
        public void setDefaultTimeoutMs(long defaultTimeoutMs) { this.defaultTimeoutMs = defaultTimeoutMs; }
    }

    /**
     * Routing configuration.
     */
    public static class RoutingConfig {
        private String defaultStrategy = "capability-first";
        private int maxFallbacks = 2;

        public String getDefaultStrategy() { return defaultStrategy; }
        public void setDefaultStrategy(String defaultStrategy) { this.defaultStrategy = defaultStrategy; }

        public int getMaxFallbacks() { return maxFallbacks; }
        public void setMaxFallbacks(int maxFallbacks) { this.maxFallbacks = maxFallbacks; }
    }

    /**
     * Timeout configuration.
     */
    public static class TimeoutsConfig {
        private long attemptTimeoutMs = 60000;
        private long connectTimeoutMs = 10000;
        private long healthCheckTimeoutMs = 5000;

        public long getAttemptTimeoutMs() { return attemptTimeoutMs; }
        public void setAttemptTimeoutMs(long attemptTimeoutMs) { this.attemptTimeoutMs = attemptTimeoutMs; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getHealthCheckTimeoutMs() { return healthCheckTimeoutMs; }
        public void setHealthCheckTimeoutMs(long healthCheckTimeoutMs) { this.healthCheckTimeoutMs = healthCheckTimeoutMs; }
    }

    /**
     * Provider health check configuration.
     */
    public static class HealthCheckConfig {
        private boolean enabled = true;
        private long intervalMs = 30000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }
    }

    /**
     * Usage ring buffer configuration.
     */
    public static class UsageConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "llm_gateway";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
