package fr.lapetina.llm.gateway.infrastructure.resilience;

import fr.lapetina.llm.gateway.domain.exception.CircuitOpenException;
import fr.lapetina.llm.gateway.domain.exception.DeadlineExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Spliterator;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Holds one {@link CircuitBreaker} per backend, created on first use.
 */
public final class CircuitBreakerRegistry {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final int halfOpenMaxTrials;
    private final Clock clock;

    public CircuitBreakerRegistry(int failureThreshold, Duration recoveryTimeout, int halfOpenMaxTrials, Clock clock) {
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.halfOpenMaxTrials = halfOpenMaxTrials;
        this.clock = clock;
    }

    public CircuitBreakerRegistry() {
        this(5, Duration.ofSeconds(60), 3, Clock.systemUTC());
    }

    /**
     * Runs an operation against a backend through its breaker.
     *
     * The breaker is consulted first: an open circuit rejects without invoking
     * the operation. A normal return counts as success, any runtime exception
     * as failure, except {@link DeadlineExceededException}, which only releases
     * the permission since the backend is not at fault. The permission is also
     * released when the operation ends with an {@link Error}.
     *
     * @throws CircuitOpenException if the circuit rejects the call
     */
    public <T> T call(String backendId, Supplier<T> operation) {
        CircuitBreaker breaker = getOrCreate(backendId);
        CircuitBreaker.Permission permission = breaker.acquirePermission();

        boolean recorded = false;
        try {
            T result = operation.get();
            breaker.recordSuccess(permission);
            recorded = true;
            return result;
        } catch (DeadlineExceededException e) {
            throw e;
        } catch (RuntimeException e) {
            breaker.recordFailure(permission);
            recorded = true;
            log.debug("Call failed through circuit breaker: backendId={}, error={}", backendId, e.getMessage());
            throw e;
        } finally {
            if (!recorded) {
                breaker.releasePermission(permission);
            }
        }
    }

    /**
     * Opens a stream against a backend through its breaker.
     *
     * Failing to open counts as a failure. Once open, the outcome is settled by
     * consumption: running out of elements counts as success, an exception
     * raised by the source as failure. A stream closed before either happens
     * only releases its permission.
     *
     * @throws CircuitOpenException if the circuit rejects the call
     */
    public <T> Stream<T> callStream(String backendId, Supplier<Stream<T>> opener) {
        CircuitBreaker breaker = getOrCreate(backendId);
        StreamOutcome outcome = new StreamOutcome(backendId, breaker, breaker.acquirePermission());

        Stream<T> source;
        boolean opened = false;
        try {
            source = opener.get();
            opened = true;
        } catch (DeadlineExceededException e) {
            throw e;
        } catch (RuntimeException e) {
            outcome.failure(e);
            throw e;
        } finally {
            if (!opened) {
                outcome.release();
            }
        }
        return StreamSupport.stream(new GuardedSpliterator<>(source.spliterator(), outcome), false)
                .onClose(source::close)
                .onClose(outcome::release);
    }

    public CircuitBreaker getOrCreate(String backendId) {
        return breakers.computeIfAbsent(backendId, id ->
                new CircuitBreaker(id, failureThreshold, recoveryTimeout, halfOpenMaxTrials, clock));
    }

    /**
     * Returns the state of a backend's circuit. Backends never called are CLOSED.
     */
    public CircuitBreaker.State getState(String backendId) {
        CircuitBreaker breaker = breakers.get(backendId);
        return breaker != null ? breaker.getState() : CircuitBreaker.State.CLOSED;
    }

    public CircuitBreaker.Health getHealth(String backendId) {
        CircuitBreaker breaker = breakers.get(backendId);
        return breaker != null ? breaker.getHealth() : CircuitBreaker.Health.HEALTHY;
    }

    public void forceOpen(String backendId) {
        getOrCreate(backendId).forceState(CircuitBreaker.State.OPEN);
    }

    public void reset(String backendId) {
        CircuitBreaker breaker = breakers.get(backendId);
        if (breaker != null) {
            breaker.reset();
        }
    }

    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
    }

    /**
     * Returns a snapshot of every known breaker, keyed by backend id.
     */
    public Map<String, CircuitBreaker.CircuitStats> stats() {
        Map<String, CircuitBreaker.CircuitStats> stats = new TreeMap<>();
        breakers.forEach((id, breaker) -> stats.put(id, breaker.snapshot()));
        return stats;
    }

    /**
     * Settles a streamed call's permission exactly once.
     */
    private static final class StreamOutcome {

        private final String backendId;
        private final CircuitBreaker breaker;
        private final CircuitBreaker.Permission permission;
        private final AtomicBoolean settled = new AtomicBoolean();

        StreamOutcome(String backendId, CircuitBreaker breaker, CircuitBreaker.Permission permission) {
            this.backendId = backendId;
            this.breaker = breaker;
            this.permission = permission;
        }

        void success() {
            if (settled.compareAndSet(false, true)) {
                breaker.recordSuccess(permission);
            }
        }

        void failure(RuntimeException e) {
            if (settled.compareAndSet(false, true)) {
                breaker.recordFailure(permission);
                log.debug("Stream failed through circuit breaker: backendId={}, error={}", backendId, e.getMessage());
            }
        }

        void release() {
            if (settled.compareAndSet(false, true)) {
                breaker.releasePermission(permission);
            }
        }
    }

    /**
     * Reports source exceptions and exhaustion to the stream's outcome.
     * Exceptions thrown by the downstream consumer are not the backend's.
     */
    private static final class GuardedSpliterator<T> implements Spliterator<T> {

        private final Spliterator<T> delegate;
        private final StreamOutcome outcome;
        private T current;

        GuardedSpliterator(Spliterator<T> delegate, StreamOutcome outcome) {
            this.delegate = delegate;
            this.outcome = outcome;
        }

        @Override
        public boolean tryAdvance(Consumer<? super T> action) {
            boolean advanced;
            try {
                advanced = delegate.tryAdvance(item -> current = item);
            } catch (DeadlineExceededException e) {
                outcome.release();
                throw e;
            } catch (RuntimeException e) {
                outcome.failure(e);
                throw e;
            }
            if (!advanced) {
                outcome.success();
                return false;
            }
            T item = current;
            current = null;
            action.accept(item);
            return true;
        }

        @Override
        public Spliterator<T> trySplit() {
            return null;
        }

        @Override
        public long estimateSize() {
            return delegate.estimateSize();
        }

        @Override
        public int characteristics() {
            return delegate.characteristics() & Spliterator.ORDERED;
        }
    }
}
