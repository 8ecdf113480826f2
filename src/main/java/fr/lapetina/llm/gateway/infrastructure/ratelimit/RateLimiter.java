package fr.lapetina.llm.gateway.infrastructure.ratelimit;

import fr.lapetina.llm.gateway.domain.exception.ErrorCode;
import fr.lapetina.llm.gateway.domain.exception.RateLimitExceededException;
import fr.lapetina.llm.gateway.domain.model.RateLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
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
 * Token-bucket rate limiter keyed by (caller, backend), plus one gateway-wide
 * bucket per caller.
 *
 * Each key holds a request bucket (one token per call) and a unit bucket
 * (tokens per requested unit). Both refill to their capacity over one period,
 * one minute by default. A check deducts from both or from neither.
 * Store failures fail open: the request is allowed and the error counted.
 * Calls to a shared store are bounded by the request deadline and the store
 * timeout; running out of time is a store failure.
 */
public final class RateLimiter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    /**
     * Scope label of the gateway-wide bucket in logs and rejections.
     */
    public static final String GATEWAY_SCOPE = "gateway";

    public static final Duration DEFAULT_STORE_TIMEOUT = Duration.ofMillis(500);

    private final BucketStore store;
    private final RateLimits defaultLimits;
    private final Duration period;
    private final Duration storeTimeout;
    private final Clock clock;
    private final ExecutorService storeExecutor;

    private final AtomicLong allowed = new AtomicLong();
    private final AtomicLong requestRateRejections = new AtomicLong();
    private final AtomicLong unitRateRejections = new AtomicLong();
    private final AtomicLong storeErrors = new AtomicLong();

    public RateLimiter(BucketStore store, RateLimits defaultLimits, Duration period, Duration storeTimeout,
                       Clock clock) {
        this.store = store;
        this.defaultLimits = defaultLimits;
        this.period = period;
        this.storeTimeout = storeTimeout;
        this.clock = clock;
        this.storeExecutor = store.isShared() ? newStoreExecutor() : null;
    }

    public RateLimiter(BucketStore store, RateLimits defaultLimits, Duration period, Clock clock) {
        this(store, defaultLimits, period, DEFAULT_STORE_TIMEOUT, clock);
    }

    public RateLimiter() {
        this(new InMemoryBucketStore(), RateLimits.DEFAULT, Duration.ofMinutes(1), Clock.systemUTC());
    }

    /**
     * Checks and consumes budget with the default limits.
     *
     * @see #check(String, String, long, RateLimits, Instant)
     */
    public void check(String callerId, String backendId, long unitsRequested) {
        check(callerId, backendId, unitsRequested, defaultLimits, null);
    }

    public void check(String callerId, String backendId, long unitsRequested, RateLimits limits) {
        check(callerId, backendId, unitsRequested, limits, null);
    }

    /**
     * Refills both buckets, then deducts one request and {@code unitsRequested} units.
     *
     * @param limits   backend limits, or null for the defaults
     * @param deadline request deadline bounding the store call, or null
     * @throws RateLimitExceededException with {@code REQUEST_RATE_EXCEEDED} or
     *         {@code UNIT_RATE_EXCEEDED}; nothing is deducted in that case
     */
    public void check(String callerId, String backendId, long unitsRequested, RateLimits limits, Instant deadline) {
        consume(key(callerId, backendId), callerId, backendId, unitsRequested,
                limits != null ? limits : defaultLimits, deadline);
    }

    /**
     * Checks and consumes the caller's gateway-wide budget, which no backend
     * bucket can share whatever the backend is called.
     */
    public void checkGateway(String callerId, long unitsRequested, Instant deadline) {
        consume(gatewayKey(callerId), callerId, GATEWAY_SCOPE, unitsRequested, defaultLimits, deadline);
    }

    private void consume(String key, String callerId, String scope, long unitsRequested, RateLimits limits,
                         Instant deadline) {
        Instant now = clock.instant();
        Decision decision = new Decision();

        try {
            callStore(deadline, () -> store.update(key, current -> {
                BucketState refilled = refill(current, limits, now);
                boolean requestsOk = refilled.requests().canCover(1);
                boolean unitsOk = refilled.units().canCover(unitsRequested);
                if (requestsOk && unitsOk) {
                    decision.rejection = null;
                    return new BucketState(refilled.requests().deduct(1), refilled.units().deduct(unitsRequested));
                }
                if (!requestsOk) {
                    decision.rejection = ErrorCode.REQUEST_RATE_EXCEEDED;
                    decision.retryAfter = refilled.requests().timeUntil(1, period);
                } else {
                    decision.rejection = ErrorCode.UNIT_RATE_EXCEEDED;
                    decision.retryAfter = refilled.units().timeUntil(unitsRequested, period);
                }
                return refilled;
            }));
        } catch (RuntimeException e) {
            storeErrors.incrementAndGet();
            log.warn("Rate limiter store error, failing open: callerId={}, scope={}, error={}",
                    callerId, scope, e.toString());
            return;
        }

        if (decision.rejection != null) {
            if (decision.rejection == ErrorCode.REQUEST_RATE_EXCEEDED) {
                requestRateRejections.incrementAndGet();
            } else {
                unitRateRejections.incrementAndGet();
            }
            log.info("Rate limit exceeded: callerId={}, scope={}, kind={}, retryAfterMs={}",
                    callerId, scope, decision.rejection, decision.retryAfter.toMillis());
            throw new RateLimitExceededException(decision.rejection, callerId, scope, decision.retryAfter);
        }
        allowed.incrementAndGet();
    }

    /**
     * Returns remaining budget without consuming any. Unknown keys report full buckets.
     */
    public RateLimitUsage usage(String callerId, String backendId) {
        return usage(callerId, backendId, defaultLimits);
    }

    public RateLimitUsage usage(String callerId, String backendId, RateLimits limits) {
        return usage(key(callerId, backendId), callerId, backendId, limits);
    }

    /**
     * Remaining gateway-wide budget of a caller.
     */
    public RateLimitUsage gatewayUsage(String callerId) {
        return usage(gatewayKey(callerId), callerId, GATEWAY_SCOPE, defaultLimits);
    }

    private RateLimitUsage usage(String key, String callerId, String scope, RateLimits limits) {
        Instant now = clock.instant();
        Optional<BucketState> stored;
        try {
            stored = callStore(null, () -> store.get(key));
        } catch (RuntimeException e) {
            storeErrors.incrementAndGet();
            log.warn("Rate limiter store error reading usage: callerId={}, scope={}, error={}",
                    callerId, scope, e.toString());
            stored = Optional.empty();
        }
        BucketState state = refill(stored.orElse(null), limits, now);
        return new RateLimitUsage(
                (long) Math.floor(state.requests().level()), limits.requestsPerMinute(),
                (long) Math.floor(state.units().level()), limits.unitsPerMinute()
        );
    }

    /**
     * Clears the buckets of one (caller, backend) pair.
     */
    public void reset(String callerId, String backendId) {
        try {
            callStore(null, () -> {
                store.remove(key(callerId, backendId));
                return null;
            });
        } catch (RuntimeException e) {
            storeErrors.incrementAndGet();
            log.warn("Rate limiter store error on reset: callerId={}, backendId={}, error={}",
                    callerId, backendId, e.toString());
        }
    }

    public RateLimiterStats stats() {
        return new RateLimiterStats(allowed.get(), requestRateRejections.get(),
                unitRateRejections.get(), storeErrors.get());
    }

    public RateLimits getDefaultLimits() {
        return defaultLimits;
    }

    @Override
    public void close() {
        if (storeExecutor != null) {
            storeExecutor.shutdownNow();
        }
    }

    /**
     * Runs a store call inline for local stores. Shared-store calls run on the
     * store executor and are abandoned after the store timeout or at the
     * deadline, whichever comes first.
     */
    private <T> T callStore(Instant deadline, Supplier<T> call) {
        if (storeExecutor == null) {
            return call.get();
        }
        Duration budget = storeTimeout;
        if (deadline != null) {
            Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.compareTo(budget) < 0) {
                budget = remaining;
            }
        }
        if (budget.isNegative() || budget.isZero()) {
            throw new IllegalStateException("No time left for the bucket store");
        }

        CompletableFuture<T> future = CompletableFuture.supplyAsync(call, storeExecutor);
        try {
            return future.get(budget.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new IllegalStateException("Bucket store did not answer within " + budget.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Bucket store call failed", cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the bucket store", e);
        }
    }

    private static ExecutorService newStoreExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "ratelimit-store-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    private BucketState refill(BucketState current, RateLimits limits, Instant now) {
        double requestCapacity = limits.requestsPerMinute();
        double unitCapacity = limits.unitsPerMinute();
        if (current == null) {
            return new BucketState(TokenBucket.full(requestCapacity, now), TokenBucket.full(unitCapacity, now));
        }
        return new BucketState(
                current.requests().refill(now, period, requestCapacity),
                current.units().refill(now, period, unitCapacity)
        );
    }

    /**
     * Store key of a (caller, backend) pair. Components are escaped so that
     * ':' inside an id cannot make two pairs share a key.
     */
    static String key(String callerId, String backendId) {
        return "ratelimit:" + escape(callerId) + ":" + escape(backendId);
    }

    /**
     * Store key of a caller's gateway-wide bucket. The bare '*' never comes
     * out of {@link #escape(String)}, so no backend id maps here.
     */
    static String gatewayKey(String callerId) {
        return "ratelimit:" + escape(callerId) + ":*";
    }

    static String escape(String component) {
        return component.replace("%", "%25").replace(":", "%3A").replace("*", "%2A");
    }

    private static final class Decision {
        private ErrorCode rejection;
        private Duration retryAfter = Duration.ZERO;
    }

    /**
     * Remaining budget of one (caller, backend) pair.
     */
    public record RateLimitUsage(
            long requestsRemaining,
            long requestCapacity,
            long unitsRemaining,
            long unitCapacity
    ) {
    }

    public record RateLimiterStats(
            long allowed,
            long requestRateRejections,
            long unitRateRejections,
            long storeErrors
    ) {
    }
}
