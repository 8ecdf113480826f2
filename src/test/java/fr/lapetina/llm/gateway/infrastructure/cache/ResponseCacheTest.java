package fr.lapetina.llm.gateway.infrastructure.cache;

import fr.lapetina.llm.gateway.domain.model.GenerationParameters;
import fr.lapetina.llm.gateway.domain.model.InferenceRequest;
import fr.lapetina.llm.gateway.domain.model.InferenceResponse;
import fr.lapetina.llm.gateway.domain.model.Message;
import fr.lapetina.llm.gateway.domain.model.TokenUsage;
import fr.lapetina.llm.gateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseCacheTest {

    private MutableClock clock;
    private AtomicLong tickerNanos;
    private CaffeineCacheStore store;
    private ResponseCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        tickerNanos = new AtomicLong();
        store = new CaffeineCacheStore(1000, tickerNanos::get);
        cache = new ResponseCache(store, null,
                new ResponseCache.Settings(Duration.ofMinutes(10), false, 0.95, 100), clock);
    }

    private static InferenceRequest request(String text) {
        return InferenceRequest.ofPrompt("team-a", text);
    }

    private static InferenceResponse response(InferenceRequest request, String backendId, String content) {
        return InferenceResponse.success(request.requestId(), backendId, "openai", content, new TokenUsage(12, 30, 0));
    }

    @Nested
    @DisplayName("Exact match")
    class ExactMatchTests {

        @Test
        @DisplayName("should return a stored response for an equal request")
        void shouldReturnStoredResponse() {
            InferenceRequest first = request("What is the capital of France?");
            cache.set(first, response(first, "gpt-4o", "Paris"));

            InferenceRequest second = request("What is the capital of France?");
            Optional<InferenceResponse> hit = cache.get(second);

            assertThat(hit).isPresent();
            InferenceResponse cached = hit.get();
            assertThat(cached.requestId()).isEqualTo(second.requestId());
            assertThat(cached.content()).isEqualTo("Paris");
            assertThat(cached.backendId()).isEqualTo("gpt-4o");
            assertThat(cached.cached()).isTrue();
            assertThat(cached.latencyMs()).isZero();
            assertThat(cached.usage().outputTokens()).isEqualTo(30);
            assertThat(cached.metadata()).containsEntry("cache_match", "exact");
        }

        @Test
        @DisplayName("should miss when any fingerprinted field differs")
        void shouldMissWhenFieldDiffers() {
            InferenceRequest original = request("Summarize this");
            cache.set(original, response(original, "gpt-4o", "Summary"));

            InferenceRequest otherTemperature = InferenceRequest.builder()
                    .callerId("team-a")
                    .messages(List.of(Message.user("Summarize this")))
                    .parameters(new GenerationParameters(0.2, GenerationParameters.DEFAULT_MAX_TOKENS, null))
                    .build();
            InferenceRequest otherSystem = InferenceRequest.builder()
                    .callerId("team-a")
                    .messages(List.of(Message.user("Summarize this")))
                    .systemPrompt("Be brief")
                    .build();

            assertThat(cache.get(otherTemperature)).isEmpty();
            assertThat(cache.get(otherSystem)).isEmpty();
            assertThat(cache.get(request("Summarize that"))).isEmpty();
        }

        @Test
        @DisplayName("should not store error or already-cached responses")
        void shouldNotStoreErrorResponses() {
            InferenceRequest failed = request("Hello");
            cache.set(failed, InferenceResponse.error(failed.requestId(), "gpt-4o", "openai", "overloaded"));

            InferenceRequest replay = request("Replay");
            cache.set(replay, response(replay, "gpt-4o", "cached").toBuilder().cached(true).build());

            assertThat(cache.get(request("Hello"))).isEmpty();
            assertThat(cache.get(request("Replay"))).isEmpty();
            assertThat(cache.stats().writes()).isZero();
        }

        @Test
        @DisplayName("should expire entries after the TTL")
        void shouldExpireAfterTtl() {
            InferenceRequest original = request("Hello");
            cache.set(original, response(original, "gpt-4o", "Hi"));

            tickerNanos.addAndGet(Duration.ofMinutes(10).plusSeconds(1).toNanos());

            assertThat(cache.get(request("Hello"))).isEmpty();
        }

        @Test
        @DisplayName("should report a miss when the store fails")
        void shouldMissOnStoreFailure() {
            ResponseCache broken = new ResponseCache(new FailingStore(), null, ResponseCache.Settings.DEFAULT, clock);
            InferenceRequest original = request("Hello");

            broken.set(original, response(original, "gpt-4o", "Hi"));

            assertThat(broken.get(request("Hello"))).isEmpty();
            assertThat(broken.stats().errors()).isEqualTo(2);
            assertThat(broken.stats().misses()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Similarity match")
    class SimilarityTests {

        private ResponseCache similarCache;

        @BeforeEach
        void setUp() {
            EmbeddingProvider embeddings = text -> {
                if (text.contains("France")) {
                    return new float[]{1.0f, 0.0f, 0.0f};
                }
                if (text.contains("French")) {
                    return new float[]{0.99f, 0.1f, 0.0f};
                }
                if (text.contains("Spain")) {
                    return new float[]{0.6f, 0.8f, 0.0f};
                }
                return new float[]{0.0f, 0.0f, 1.0f};
            };
            similarCache = new ResponseCache(store, embeddings,
                    new ResponseCache.Settings(Duration.ofMinutes(10), true, 0.95, 100), clock);
        }

        @Test
        @DisplayName("should return a similar entry above the threshold")
        void shouldReturnSimilarEntry() {
            InferenceRequest original = request("What is the capital of France?");
            similarCache.set(original, response(original, "gpt-4o", "Paris"));

            Optional<InferenceResponse> hit = similarCache.get(request("Which city is the French capital?"));

            assertThat(hit).isPresent();
            assertThat(hit.get().content()).isEqualTo("Paris");
            assertThat(hit.get().metadata()).containsEntry("cache_match", "similar");
            assertThat(similarCache.stats().similarityHits()).isEqualTo(1);
        }

        @Test
        @DisplayName("should miss below the threshold")
        void shouldMissBelowThreshold() {
            InferenceRequest original = request("What is the capital of France?");
            similarCache.set(original, response(original, "gpt-4o", "Paris"));

            assertThat(similarCache.get(request("What is the capital of Spain?"))).isEmpty();
        }

        @Test
        @DisplayName("should never match across different generation parameters")
        void shouldNotMatchAcrossScopes() {
            InferenceRequest original = request("What is the capital of France?");
            similarCache.set(original, response(original, "gpt-4o", "Paris"));

            InferenceRequest otherScope = InferenceRequest.builder()
                    .callerId("team-a")
                    .messages(List.of(Message.user("Which city is the French capital?")))
                    .parameters(new GenerationParameters(0.0, 64, null))
                    .build();

            assertThat(similarCache.get(otherScope)).isEmpty();
        }

        @Test
        @DisplayName("should treat an embedding failure as a miss")
        void shouldMissOnEmbeddingFailure() {
            ResponseCache failing = new ResponseCache(store, text -> {
                throw new IllegalStateException("embedding service down");
            }, new ResponseCache.Settings(Duration.ofMinutes(10), true, 0.95, 100), clock);
            InferenceRequest original = request("What is the capital of France?");
            failing.set(original, response(original, "gpt-4o", "Paris"));

            assertThat(failing.get(request("Which city is the French capital?"))).isEmpty();
            // Exact match still works without embeddings
            assertThat(failing.get(request("What is the capital of France?"))).isPresent();
        }
    }

    @Nested
    @DisplayName("Time bounds")
    class TimeBoundTests {

        private final AtomicInteger embedCalls = new AtomicInteger();

        private ResponseCache slowEmbeddingCache(Duration operationTimeout) {
            EmbeddingProvider slow = text -> {
                embedCalls.incrementAndGet();
                try {
                    Thread.sleep(2000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return new float[]{1.0f, 0.0f, 0.0f};
            };
            return new ResponseCache(store, slow,
                    new ResponseCache.Settings(Duration.ofMinutes(10), true, 0.95, 100, operationTimeout), clock);
        }

        @Test
        @DisplayName("should give up on a slow embedding at the request deadline")
        void shouldMissWhenEmbeddingOutlivesDeadline() {
            ResponseCache slowCache = slowEmbeddingCache(Duration.ofSeconds(5));
            InferenceRequest request = request("What is the capital of France?")
                    .withDeadline(clock.instant().plusMillis(100));
            long start = System.nanoTime();

            Optional<InferenceResponse> hit = slowCache.get(request);

            assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofMillis(500));
            assertThat(hit).isEmpty();
            assertThat(slowCache.stats().misses()).isEqualTo(1);
            assertThat(slowCache.stats().errors()).isEqualTo(1);
            slowCache.close();
        }

        @Test
        @DisplayName("should give up after the operation timeout when the request has no deadline")
        void shouldMissAfterOperationTimeout() {
            ResponseCache slowCache = slowEmbeddingCache(Duration.ofMillis(100));
            long start = System.nanoTime();

            assertThat(slowCache.get(request("What is the capital of France?"))).isEmpty();

            assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofMillis(500));
            slowCache.close();
        }

        @Test
        @DisplayName("should bound a write by the deadline and keep the exact entry")
        void shouldBoundWrite() {
            ResponseCache slowCache = slowEmbeddingCache(Duration.ofSeconds(5));
            InferenceRequest original = request("What is the capital of France?")
                    .withDeadline(clock.instant().plusMillis(100));
            long start = System.nanoTime();

            slowCache.set(original, response(original, "gpt-4o", "Paris"));

            assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofMillis(500));
            assertThat(cache.get(request("What is the capital of France?"))).isPresent();
            slowCache.close();
        }

        @Test
        @DisplayName("should not touch the store or embeddings once the deadline passed")
        void shouldSkipAfterDeadline() {
            ResponseCache slowCache = slowEmbeddingCache(Duration.ofSeconds(5));
            InferenceRequest original = request("Hello");
            cache.set(original, response(original, "gpt-4o", "Hi"));
            InferenceRequest expired = request("Hello").withDeadline(clock.instant().minusMillis(1));

            assertThat(slowCache.get(expired)).isEmpty();
            slowCache.set(expired, response(expired, "gpt-4o", "Hi again"));

            assertThat(embedCalls).hasValue(0);
            assertThat(slowCache.stats().misses()).isEqualTo(1);
            assertThat(slowCache.stats().writes()).isZero();
            slowCache.close();
        }
    }

    @Nested
    @DisplayName("Invalidation")
    class InvalidationTests {

        @Test
        @DisplayName("should remove entries of one backend only")
        void shouldInvalidateByBackend() {
            InferenceRequest a = request("A");
            InferenceRequest b = request("B");
            cache.set(a, response(a, "gpt-4o", "from gpt"));
            cache.set(b, response(b, "claude-sonnet", "from claude"));

            long removed = cache.invalidate(CacheInvalidation.byBackend("gpt-4o"));

            assertThat(removed).isEqualTo(1);
            assertThat(cache.get(request("A"))).isEmpty();
            assertThat(cache.get(request("B"))).isPresent();
        }

        @Test
        @DisplayName("should remove entries older than an instant")
        void shouldInvalidateByAge() {
            InferenceRequest old = request("Old");
            cache.set(old, response(old, "gpt-4o", "old"));
            clock.advance(Duration.ofMinutes(5));
            InferenceRequest recent = request("Recent");
            cache.set(recent, response(recent, "gpt-4o", "recent"));

            long removed = cache.invalidate(CacheInvalidation.olderThan(clock.instant().minusSeconds(60)));

            assertThat(removed).isEqualTo(1);
            assertThat(cache.get(request("Old"))).isEmpty();
            assertThat(cache.get(request("Recent"))).isPresent();
        }

        @Test
        @DisplayName("should clear every entry")
        void shouldClear() {
            InferenceRequest a = request("A");
            cache.set(a, response(a, "gpt-4o", "a"));

            assertThat(cache.clear()).isEqualTo(1);
            assertThat(cache.get(request("A"))).isEmpty();
        }
    }

    @Test
    @DisplayName("should compute hit rate")
    void shouldComputeHitRate() {
        InferenceRequest original = request("Hello");
        cache.set(original, response(original, "gpt-4o", "Hi"));

        cache.get(request("Hello"));
        cache.get(request("Hello"));
        cache.get(request("Unknown"));
        cache.get(request("Other"));

        ResponseCache.CacheStats stats = cache.stats();
        assertThat(stats.hits()).isEqualTo(2);
        assertThat(stats.misses()).isEqualTo(2);
        assertThat(stats.hitRate()).isEqualTo(0.5);
    }

    private static final class FailingStore implements CacheStore {

        @Override
        public Optional<String> get(String key) {
            throw new IllegalStateException("store down");
        }

        @Override
        public void put(String key, String value, Duration ttl) {
            throw new IllegalStateException("store down");
        }

        @Override
        public void remove(String key) {
            throw new IllegalStateException("store down");
        }

        @Override
        public Map<String, String> scan(String prefix, int limit) {
            throw new IllegalStateException("store down");
        }

        @Override
        public long removeByPrefix(String prefix) {
            throw new IllegalStateException("store down");
        }
    }
}
