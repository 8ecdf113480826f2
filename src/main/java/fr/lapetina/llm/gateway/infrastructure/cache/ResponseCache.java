package fr.lapetina.llm.gateway.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.llm.gateway.domain.model.InferenceRequest;
import fr.lapetina.llm.gateway.domain.model.InferenceResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Response cache with exact-match and similarity lookup.
 *
 * Exact matches use the request fingerprint. When similarity is enabled, a
 * miss falls back to comparing the request's embedding with stored embeddings
 * of the same scope and accepts the best match at or above the threshold.
 * The similarity scan is capped at {@code maxSimilarityCandidates} entries.
 *
 * Every operation is best-effort: store, serialization and embedding failures
 * are logged, counted and reported as a miss or no-op. Lookups and writes run
 * on the cache's own threads and are abandoned after {@code operationTimeout}
 * or at the request deadline, whichever comes first; an abandoned lookup is a
 * miss.
 */
public final class ResponseCache implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

    static final String KEY_PREFIX = "cache:";
    static final String EXACT_PREFIX = KEY_PREFIX + "exact:";
    static final String VECTOR_PREFIX = KEY_PREFIX + "vector:";

    private final CacheStore store;
    private final EmbeddingProvider embeddingProvider;
    private final Settings settings;
    private final Clock clock;
    private final RequestFingerprinter fingerprinter = new RequestFingerprinter();
    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong similarityHits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong writes = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final ExecutorService executor = newExecutor();

    /**
     * @param embeddingProvider may be null, which disables similarity matching
     */
    public ResponseCache(CacheStore store, EmbeddingProvider embeddingProvider, Settings settings, Clock clock) {
        this.store = store;
        this.embeddingProvider = embeddingProvider;
        this.settings = settings;
        this.clock = clock;
        log.info("Response cache initialized: ttl={}, similarityEnabled={}, threshold={}, operationTimeout={}",
                settings.ttl(), isSimilarityActive(), settings.similarityThreshold(), settings.operationTimeout());
    }

    /**
     * Looks up a cached response for the request, within the request's
     * remaining time.
     *
     * @return a response marked cached with the current request id, or empty on miss
     */
    public Optional<InferenceResponse> get(InferenceRequest request) {
        Optional<Hit> hit = withinBudget("lookup", request, () -> lookup(request), Optional.empty());
        if (hit.isEmpty()) {
            misses.incrementAndGet();
            return Optional.empty();
        }

        hits.incrementAndGet();
        if ("similar".equals(hit.get().match())) {
            similarityHits.incrementAndGet();
        }
        log.debug("Cache hit ({}): requestId={}, fingerprint={}",
                hit.get().match(), request.requestId(), hit.get().entry().fingerprint());
        return Optional.of(hit.get().entry().toResponse(request.requestId(), hit.get().match()));
    }

    /**
     * Stores a successful response. Error and already-cached responses are
     * ignored, and so is a write with no time left before the deadline.
     */
    public void set(InferenceRequest request, InferenceResponse response) {
        if (!response.isSuccess() || response.cached()) {
            return;
        }
        withinBudget("write", request, () -> {
            write(request, response);
            return Boolean.TRUE;
        }, Boolean.FALSE);
    }

    private Optional<Hit> lookup(InferenceRequest request) {
        String fingerprint = fingerprinter.fingerprint(request);

        Optional<CacheEntry> exact = readEntry(fingerprint);
        if (exact.isPresent()) {
            return Optional.of(new Hit(exact.get(), "exact"));
        }
        if (isSimilarityActive()) {
            return findSimilar(request).map(entry -> new Hit(entry, "similar"));
        }
        return Optional.empty();
    }

    private void write(InferenceRequest request, InferenceResponse response) {
        String fingerprint = fingerprinter.fingerprint(request);
        String scope = fingerprinter.scope(request);
        Instant now = clock.instant();

        try {
            store.put(EXACT_PREFIX + fingerprint,
                    objectMapper.writeValueAsString(CacheEntry.of(fingerprint, scope, response, now)),
                    settings.ttl());
            writes.incrementAndGet();
        } catch (JsonProcessingException | RuntimeException e) {
            recordError("write", fingerprint, e);
            return;
        }

        if (isSimilarityActive()) {
            try {
                float[] embedding = embeddingProvider.embed(fingerprinter.embeddingText(request));
                store.put(vectorKey(scope, fingerprint),
                        objectMapper.writeValueAsString(new VectorEntry(fingerprint, embedding, now)),
                        settings.ttl());
            } catch (JsonProcessingException | RuntimeException e) {
                recordError("vector write", fingerprint, e);
            }
        }
        log.debug("Cache write: requestId={}, fingerprint={}, backendId={}",
                request.requestId(), fingerprint, response.backendId());
    }

    /**
     * Runs a cache operation on the cache executor for at most the operation
     * timeout, capped by the request deadline. Returns {@code fallback} when
     * no time is left, on timeout, or if the operation fails.
     */
    private <T> T withinBudget(String operation, InferenceRequest request, Supplier<T> work, T fallback) {
        Duration budget = settings.operationTimeout();
        if (request.hasDeadline()) {
            Duration remaining = Duration.between(clock.instant(), request.deadline());
            if (remaining.compareTo(budget) < 0) {
                budget = remaining;
            }
        }
        if (budget.isNegative() || budget.isZero()) {
            log.debug("Skipping cache {}, deadline reached: requestId={}", operation, request.requestId());
            return fallback;
        }

        CompletableFuture<T> future = CompletableFuture.supplyAsync(work, executor);
        try {
            return future.get(budget.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            recordError(operation, request.requestId(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            recordError(operation, request.requestId(), cause instanceof Exception ? (Exception) cause : e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            recordError(operation, request.requestId(), e);
        }
        return fallback;
    }

    /**
     * Removes every entry matching the filter.
     *
     * @return number of removed responses
     */
    public long invalidate(CacheInvalidation filter) {
        long removed = 0;
        try {
            Map<String, String> entries = store.scan(EXACT_PREFIX, Integer.MAX_VALUE);
            for (Map.Entry<String, String> stored : entries.entrySet()) {
                CacheEntry entry = decode(stored.getValue(), CacheEntry.class);
                if (entry == null || filter.matches(entry)) {
                    store.remove(stored.getKey());
                    if (entry != null) {
                        store.remove(vectorKey(entry.scope(), entry.fingerprint()));
                    }
                    removed++;
                }
            }
        } catch (RuntimeException e) {
            recordError("invalidate", String.valueOf(filter), e);
        }
        log.info("Cache invalidated: filter={}, removed={}", filter, removed);
        return removed;
    }

    /**
     * Removes every cached entry.
     */
    public long clear() {
        try {
            long removed = store.removeByPrefix(KEY_PREFIX);
            log.info("Cache cleared: removed={}", removed);
            return removed;
        } catch (RuntimeException e) {
            recordError("clear", KEY_PREFIX, e);
            return 0;
        }
    }

    public CacheStats stats() {
        long hitCount = hits.get();
        long missCount = misses.get();
        long total = hitCount + missCount;
        return new CacheStats(
                hitCount, similarityHits.get(), missCount, writes.get(), errors.get(),
                total > 0 ? (double) hitCount / total : 0.0
        );
    }

    public boolean isSimilarityActive() {
        return settings.similarityEnabled() && embeddingProvider != null;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private Optional<CacheEntry> readEntry(String fingerprint) {
        try {
            return store.get(EXACT_PREFIX + fingerprint)
                    .map(json -> decode(json, CacheEntry.class));
        } catch (RuntimeException e) {
            recordError("read", fingerprint, e);
            return Optional.empty();
        }
    }

    private Optional<CacheEntry> findSimilar(InferenceRequest request) {
        float[] embedding;
        try {
            embedding = embeddingProvider.embed(fingerprinter.embeddingText(request));
        } catch (RuntimeException e) {
            recordError("embedding", request.requestId(), e);
            return Optional.empty();
        }

        String scope = fingerprinter.scope(request);
        Map<String, String> candidates;
        try {
            candidates = store.scan(VECTOR_PREFIX + scope + ":", settings.maxSimilarityCandidates());
        } catch (RuntimeException e) {
            recordError("vector scan", scope, e);
            return Optional.empty();
        }

        String bestFingerprint = null;
        double bestScore = -1.0;
        for (String json : candidates.values()) {
            VectorEntry vector = decode(json, VectorEntry.class);
            if (vector == null) {
                continue;
            }
            double score = VectorMath.cosine(embedding, vector.embedding());
            if (score >= settings.similarityThreshold() && score > bestScore) {
                bestScore = score;
                bestFingerprint = vector.fingerprint();
            }
        }

        if (bestFingerprint == null) {
            return Optional.empty();
        }
        log.debug("Similar cache entry found: requestId={}, similarity={}", request.requestId(), bestScore);
        return readEntry(bestFingerprint);
    }

    private <T> T decode(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            recordError("decode", type.getSimpleName(), e);
            return null;
        }
    }

    private void recordError(String operation, String key, Exception e) {
        errors.incrementAndGet();
        log.warn("Cache {} failed, treating as miss: key={}, error={}", operation, key, e.toString());
    }

    private static String vectorKey(String scope, String fingerprint) {
        return VECTOR_PREFIX + scope + ":" + fingerprint;
    }

    private static ExecutorService newExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "response-cache-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    private record Hit(CacheEntry entry, String match) {
    }

    /**
     * Cache tuning.
     *
     * @param maxSimilarityCandidates upper bound on vectors compared per lookup
     * @param operationTimeout        longest a lookup or write may take, embedding included
     */
    public record Settings(
            Duration ttl,
            boolean similarityEnabled,
            double similarityThreshold,
            int maxSimilarityCandidates,
            Duration operationTimeout
    ) {
        public static final Duration DEFAULT_OPERATION_TIMEOUT = Duration.ofSeconds(2);
        public static final Settings DEFAULT = new Settings(Duration.ofHours(1), false, 0.95, 1000);

        public Settings(Duration ttl, boolean similarityEnabled, double similarityThreshold,
                        int maxSimilarityCandidates) {
            this(ttl, similarityEnabled, similarityThreshold, maxSimilarityCandidates, DEFAULT_OPERATION_TIMEOUT);
        }

        public Settings {
            if (similarityThreshold < -1.0 || similarityThreshold > 1.0) {
                throw new IllegalArgumentException("similarityThreshold must be within [-1, 1]");
            }
            if (maxSimilarityCandidates <= 0) {
                throw new IllegalArgumentException("maxSimilarityCandidates must be positive");
            }
            if (operationTimeout == null || operationTimeout.isNegative() || operationTimeout.isZero()) {
                throw new IllegalArgumentException("operationTimeout must be positive");
            }
        }
    }

    public record CacheStats(
            long hits,
            long similarityHits,
            long misses,
            long writes,
            long errors,
            double hitRate
    ) {
    }
}
