package fr.lapetina.llm.gateway.infrastructure.ratelimit;

import fr.lapetina.llm.gateway.domain.exception.ErrorCode;
import fr.lapetina.llm.gateway.domain.exception.RateLimitExceededException;
import fr.lapetina.llm.gateway.domain.model.RateLimits;
import fr.lapetina.llm.gateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimiterTest {

    private MutableClock clock;
    private InMemoryBucketStore store;
    private RateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        store = new InMemoryBucketStore();
        rateLimiter = new RateLimiter(store, new RateLimits(5, 1000), Duration.ofMinutes(1), clock);
    }

    @Nested
    @DisplayName("Request budget")
    class RequestBudgetTests {

        @Test
        @DisplayName("should allow N requests then reject the next one")
        void shouldAllowNThenReject() {
            for (int i = 0; i < 5; i++) {
                rateLimiter.check("team-a", "gpt-4o", 10);
            }

            assertThatThrownBy(() -> rateLimiter.check("team-a", "gpt-4o", 10))
                    .isInstanceOf(RateLimitExceededException.class)
                    .satisfies(e -> {
                        RateLimitExceededException ex = (RateLimitExceededException) e;
                        assertThat(ex.getCode()).isEqualTo(ErrorCode.REQUEST_RATE_EXCEEDED);
                        assertThat(ex.getRetryAfter()).isPositive();
                        assertThat(ex.getCallerId()).isEqualTo("team-a");
                    });
        }

        @Test
        @DisplayName("should refill after one period")
        void shouldRefillAfterPeriod() {
            for (int i = 0; i < 5; i++) {
                rateLimiter.check("team-a", "gpt-4o", 10);
            }

            clock.advance(Duration.ofSeconds(12));
            // 12s of a 60s period refills one of five requests
            assertThatCode(() -> rateLimiter.check("team-a", "gpt-4o", 10)).doesNotThrowAnyException();
            assertThatThrownBy(() -> rateLimiter.check("team-a", "gpt-4o", 10))
                    .isInstanceOf(RateLimitExceededException.class);

            clock.advance(Duration.ofMinutes(1));
            RateLimiter.RateLimitUsage usage = rateLimiter.usage("team-a", "gpt-4o");
            assertThat(usage.requestsRemaining()).isEqualTo(5);
        }

        @Test
        @DisplayName("should keep separate budgets per caller and backend")
        void shouldKeepSeparateBudgets() {
            for (int i = 0; i < 5; i++) {
                rateLimiter.check("team-a", "gpt-4o", 10);
            }

            assertThatCode(() -> rateLimiter.check("team-b", "gpt-4o", 10)).doesNotThrowAnyException();
            assertThatCode(() -> rateLimiter.check("team-a", "claude-sonnet", 10)).doesNotThrowAnyException();
        }
    }

    @Nested
    @DisplayName("Unit budget")
    class UnitBudgetTests {

        @Test
        @DisplayName("should reject when units exceed the remaining budget")
        void shouldRejectOnUnits() {
            rateLimiter.check("team-a", "gpt-4o", 900);

            assertThatThrownBy(() -> rateLimiter.check("team-a", "gpt-4o", 200))
                    .isInstanceOf(RateLimitExceededException.class)
                    .satisfies(e -> assertThat(((RateLimitExceededException) e).getCode())
                            .isEqualTo(ErrorCode.UNIT_RATE_EXCEEDED));
        }

        @Test
        @DisplayName("should deduct nothing when a check is rejected")
        void shouldDeductNothingOnRejection() {
            rateLimiter.check("team-a", "gpt-4o", 900);
            RateLimiter.RateLimitUsage before = rateLimiter.usage("team-a", "gpt-4o");

            assertThatThrownBy(() -> rateLimiter.check("team-a", "gpt-4o", 200))
                    .isInstanceOf(RateLimitExceededException.class);

            RateLimiter.RateLimitUsage after = rateLimiter.usage("team-a", "gpt-4o");
            assertThat(after.requestsRemaining()).isEqualTo(before.requestsRemaining()).isEqualTo(4);
            assertThat(after.unitsRemaining()).isEqualTo(before.unitsRemaining()).isEqualTo(100);
        }

        @Test
        @DisplayName("should apply explicit backend limits over the defaults")
        void shouldApplyExplicitLimits() {
            RateLimits strict = new RateLimits(1, 50);
            rateLimiter.check("team-a", "gpt-4o", 10, strict);

            assertThatThrownBy(() -> rateLimiter.check("team-a", "gpt-4o", 10, strict))
                    .isInstanceOf(RateLimitExceededException.class);
        }
    }

    @Nested
    @DisplayName("Store failures")
    class StoreFailureTests {

        @Test
        @DisplayName("should fail open when the store throws")
        void shouldFailOpen() {
            RateLimiter failing = new RateLimiter(new BrokenStore(), new RateLimits(1, 10), Duration.ofMinutes(1), clock);

            for (int i = 0; i < 10; i++) {
                assertThatCode(() -> failing.check("team-a", "gpt-4o", 100)).doesNotThrowAnyException();
            }
            assertThat(failing.stats().storeErrors()).isEqualTo(10);
            assertThat(failing.usage("team-a", "gpt-4o").requestsRemaining()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Bucket keys")
    class BucketKeyTests {

        @Test
        @DisplayName("should keep ids containing ':' in separate buckets")
        void shouldNotCollideOnSeparators() {
            RateLimiter single = new RateLimiter(store, new RateLimits(1, 1000), Duration.ofMinutes(1), clock);

            single.check("team:a", "b", 1);

            assertThatCode(() -> single.check("team", "a:b", 1)).doesNotThrowAnyException();
            assertThat(RateLimiter.key("team:a", "b")).isNotEqualTo(RateLimiter.key("team", "a:b"));
        }

        @Test
        @DisplayName("should not share the gateway-wide bucket with a backend named like it")
        void shouldIsolateGatewayBucket() {
            for (int i = 0; i < 5; i++) {
                rateLimiter.checkGateway("team-a", 10, null);
            }

            assertThatThrownBy(() -> rateLimiter.checkGateway("team-a", 10, null))
                    .isInstanceOf(RateLimitExceededException.class)
                    .satisfies(e -> assertThat(((RateLimitExceededException) e).getBackendId())
                            .isEqualTo(RateLimiter.GATEWAY_SCOPE));
            assertThatCode(() -> rateLimiter.check("team-a", RateLimiter.GATEWAY_SCOPE, 10))
                    .doesNotThrowAnyException();
            assertThatCode(() -> rateLimiter.check("team-a", "*", 10)).doesNotThrowAnyException();
            assertThat(rateLimiter.gatewayUsage("team-a").requestsRemaining()).isZero();
        }
    }

    @Nested
    @DisplayName("Shared store time bounds")
    class SharedStoreTests {

        @Test
        @DisplayName("should fail open once the request deadline passes during a slow store call")
        void shouldBoundStoreCallByDeadline() {
            try (RateLimiter slow = new RateLimiter(new SlowStore(Duration.ofSeconds(2)), new RateLimits(1, 10),
                    Duration.ofMinutes(1), Duration.ofSeconds(5), clock)) {
                long start = System.nanoTime();

                assertThatCode(() -> slow.checkGateway("team-a", 1, clock.instant().plusMillis(100)))
                        .doesNotThrowAnyException();

                assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofMillis(500));
                assertThat(slow.stats().storeErrors()).isEqualTo(1);
                assertThat(slow.stats().allowed()).isZero();
            }
        }

        @Test
        @DisplayName("should fail open after the store timeout when no deadline is set")
        void shouldBoundStoreCallByTimeout() {
            try (RateLimiter slow = new RateLimiter(new SlowStore(Duration.ofSeconds(2)), new RateLimits(1, 10),
                    Duration.ofMinutes(1), Duration.ofMillis(100), clock)) {
                long start = System.nanoTime();

                assertThatCode(() -> slow.check("team-a", "gpt-4o", 1)).doesNotThrowAnyException();

                assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofMillis(500));
                assertThat(slow.stats().storeErrors()).isEqualTo(1);
            }
        }

        @Test
        @DisplayName("should skip the store when the deadline already passed")
        void shouldSkipStoreAfterDeadline() {
            SlowStore store = new SlowStore(Duration.ZERO);
            try (RateLimiter slow = new RateLimiter(store, new RateLimits(1, 10),
                    Duration.ofMinutes(1), Duration.ofSeconds(5), clock)) {

                slow.check("team-a", "gpt-4o", 1, null, clock.instant().minusMillis(1));

                assertThat(store.calls).hasValue(0);
                assertThat(slow.stats().storeErrors()).isEqualTo(1);
            }
        }
    }

    @Test
    @DisplayName("should reset a single key")
    void shouldReset() {
        for (int i = 0; i < 5; i++) {
            rateLimiter.check("team-a", "gpt-4o", 10);
        }

        rateLimiter.reset("team-a", "gpt-4o");

        assertThat(store.get(RateLimiter.key("team-a", "gpt-4o"))).isEmpty();
        assertThatCode(() -> rateLimiter.check("team-a", "gpt-4o", 10)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("should never over-admit under concurrent checks")
    void shouldNotOverAdmitConcurrently() throws Exception {
        RateLimiter limiter = new RateLimiter(store, new RateLimits(50, 1_000_000), Duration.ofMinutes(1), clock);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        AtomicInteger admitted = new AtomicInteger();
        CountDownLatch latch = new CountDownLatch(200);

        for (int i = 0; i < 200; i++) {
            executor.submit(() -> {
                try {
                    limiter.check("team-a", "gpt-4o", 1);
                    admitted.incrementAndGet();
                } catch (RateLimitExceededException e) {
                    // expected once the budget is spent
                } finally {
                    latch.countDown();
                }
            });
        }

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(admitted).hasValue(50);
        assertThat(limiter.stats().allowed()).isEqualTo(50);
        assertThat(limiter.stats().requestRateRejections()).isEqualTo(150);
    }

    /**
     * Shared store whose updates take {@code delay}.
     */
    private static final class SlowStore implements BucketStore {

        private final Duration delay;
        private final AtomicInteger calls = new AtomicInteger();

        SlowStore(Duration delay) {
            this.delay = delay;
        }

        @Override
        public BucketState update(String key, UnaryOperator<BucketState> update) {
            calls.incrementAndGet();
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted", e);
            }
            return update.apply(null);
        }

        @Override
        public Optional<BucketState> get(String key) {
            return Optional.empty();
        }

        @Override
        public void remove(String key) {
        }

        @Override
        public boolean isShared() {
            return true;
        }
    }

    private static final class BrokenStore implements BucketStore {

        @Override
        public BucketState update(String key, UnaryOperator<BucketState> update) {
            throw new IllegalStateException("redis down");
        }

        @Override
        public Optional<BucketState> get(String key) {
            throw new IllegalStateException("redis down");
        }

        @Override
        public void remove(String key) {
            throw new IllegalStateException("redis down");
        }
    }
}
