package fr.lapetina.llm.gateway.infrastructure.resilience;

import fr.lapetina.llm.gateway.domain.exception.CircuitOpenException;
import fr.lapetina.llm.gateway.domain.exception.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Circuit breaker protecting a single backend.
 *
 * States:
 * - CLOSED: Normal operation, requests pass through
 * - OPEN: Consecutive failures reached the threshold, requests rejected immediately
 * - HALF_OPEN: Recovery timeout elapsed, a bounded number of trial requests pass
 *
 * OPEN moves to HALF_OPEN lazily, on the first state query after the recovery
 * timeout. HALF_OPEN closes after {@code halfOpenMaxTrials} trial successes and
 * reopens on any trial failure.
 *
 * Every call holds a {@link Permission} stamped with the state generation it
 * was admitted in. Only trial permissions of the current half-open period move
 * a HALF_OPEN circuit; outcomes of calls admitted earlier still update the
 * counters but cannot close or reopen it.
 *
 * Every transition and counter update happens under this breaker's lock, so
 * concurrent callers on one backend never race while other backends are unaffected.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    /**
     * Health derived from circuit state and error history.
     */
    public enum Health {
        HEALTHY,
        DEGRADED,
        UNAVAILABLE
    }

    private final String backendId;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final int halfOpenMaxTrials;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    // Guarded by lock
    private State state = State.CLOSED;
    private int consecutiveFailures;
    private long totalFailures;
    private long totalRequests;
    private int halfOpenInFlight;
    private int halfOpenSuccesses;
    private Instant lastFailureTime;
    private Instant lastSuccessTime;
    private Instant openedAt;
    private long generation;

    public CircuitBreaker(
            String backendId,
            int failureThreshold,
            Duration recoveryTimeout,
            int halfOpenMaxTrials,
            Clock clock
    ) {
        if (failureThreshold <= 0 || halfOpenMaxTrials <= 0) {
            throw new IllegalArgumentException("Thresholds must be positive");
        }
        this.backendId = backendId;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.halfOpenMaxTrials = halfOpenMaxTrials;
        this.clock = clock;
    }

    public CircuitBreaker(String backendId) {
        this(backendId, 5, Duration.ofSeconds(60), 3, Clock.systemUTC());
    }

    /**
     * Claims permission for one call. The returned permission must be handed
     * back to exactly one of {@link #recordSuccess(Permission)},
     * {@link #recordFailure(Permission)} or {@link #releasePermission(Permission)}.
     *
     * @throws CircuitOpenException with {@code CIRCUIT_OPEN} when open, or
     *         {@code HALF_OPEN_TRIAL_EXHAUSTED} when every trial slot is taken
     */
    public Permission acquirePermission() {
        lock.lock();
        try {
            transitionIfRecovered();
            return switch (state) {
                case CLOSED -> new Permission(generation, false);
                case OPEN -> throw new CircuitOpenException(ErrorCode.CIRCUIT_OPEN, backendId);
                case HALF_OPEN -> {
                    if (halfOpenInFlight >= halfOpenMaxTrials) {
                        throw new CircuitOpenException(ErrorCode.HALF_OPEN_TRIAL_EXHAUSTED, backendId);
                    }
                    halfOpenInFlight++;
                    yield new Permission(generation, true);
                }
            };
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a success observed outside a permitted call. It resets the
     * consecutive-failure counter but never closes a HALF_OPEN circuit.
     */
    public void recordSuccess() {
        recordSuccess(Permission.UNTRACKED);
    }

    /**
     * Records a successful call. Resets the consecutive-failure counter.
     */
    public void recordSuccess(Permission permission) {
        lock.lock();
        try {
            totalRequests++;
            consecutiveFailures = 0;
            lastSuccessTime = clock.instant();

            if (isCurrentTrial(permission)) {
                releaseTrialSlot();
                halfOpenSuccesses++;
                if (halfOpenSuccesses >= halfOpenMaxTrials) {
                    state = State.CLOSED;
                    generation++;
                    halfOpenSuccesses = 0;
                    halfOpenInFlight = 0;
                    openedAt = null;
                    log.info("Circuit breaker CLOSED after recovery: backendId={}", backendId);
                }
            } else if (state == State.HALF_OPEN) {
                log.debug("Ignoring success of a call admitted before the trial period: backendId={}", backendId);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a failure observed outside a permitted call. It counts toward
     * the threshold while CLOSED but never reopens a HALF_OPEN circuit.
     */
    public void recordFailure() {
        recordFailure(Permission.UNTRACKED);
    }

    /**
     * Records a failed call.
     */
    public void recordFailure(Permission permission) {
        lock.lock();
        try {
            Instant now = clock.instant();
            totalRequests++;
            totalFailures++;
            consecutiveFailures++;
            lastFailureTime = now;

            if (state == State.HALF_OPEN) {
                if (isCurrentTrial(permission)) {
                    open(now);
                    log.warn("Circuit breaker OPENED (half-open failure): backendId={}", backendId);
                } else {
                    log.debug("Ignoring failure of a call admitted before the trial period: backendId={}", backendId);
                }
            } else if (state == State.CLOSED && consecutiveFailures >= failureThreshold) {
                open(now);
                log.warn("Circuit breaker OPENED: backendId={}, failures={}", backendId, consecutiveFailures);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Releases a claimed permission without counting a success or failure,
     * e.g. when the caller's own deadline aborted the call.
     */
    public void releasePermission(Permission permission) {
        lock.lock();
        try {
            if (isCurrentTrial(permission)) {
                releaseTrialSlot();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forces the circuit to a specific state. For admin and health-monitor use.
     */
    public void forceState(State newState) {
        lock.lock();
        try {
            State old = state;
            state = newState;
            generation++;
            halfOpenInFlight = 0;
            halfOpenSuccesses = 0;
            if (newState == State.CLOSED) {
                consecutiveFailures = 0;
                openedAt = null;
            }
            if (newState == State.OPEN) {
                openedAt = clock.instant();
            }
            log.info("Circuit breaker forced from {} to {}: backendId={}", old, newState, backendId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns to CLOSED and clears every counter.
     */
    public void reset() {
        lock.lock();
        try {
            state = State.CLOSED;
            generation++;
            consecutiveFailures = 0;
            totalFailures = 0;
            totalRequests = 0;
            halfOpenInFlight = 0;
            halfOpenSuccesses = 0;
            lastFailureTime = null;
            lastSuccessTime = null;
            openedAt = null;
            log.info("Circuit breaker reset: backendId={}", backendId);
        } finally {
            lock.unlock();
        }
    }

    public State getState() {
        lock.lock();
        try {
            transitionIfRecovered();
            return state;
        } finally {
            lock.unlock();
        }
    }

    public Health getHealth() {
        return switch (getState()) {
            case OPEN -> Health.UNAVAILABLE;
            case HALF_OPEN -> Health.DEGRADED;
            case CLOSED -> Health.HEALTHY;
        };
    }

    /**
     * Returns a consistent snapshot of this breaker.
     */
    public CircuitStats snapshot() {
        lock.lock();
        try {
            transitionIfRecovered();
            double errorRate = totalRequests > 0 ? (double) totalFailures / totalRequests : 0.0;
            return new CircuitStats(
                    backendId, state, getHealthLocked(), consecutiveFailures, totalFailures,
                    totalRequests, errorRate, halfOpenInFlight, lastFailureTime, lastSuccessTime, openedAt
            );
        } finally {
            lock.unlock();
        }
    }

    public int getFailureCount() {
        lock.lock();
        try {
            return consecutiveFailures;
        } finally {
            lock.unlock();
        }
    }

    public String getBackendId() {
        return backendId;
    }

    private Health getHealthLocked() {
        return switch (state) {
            case OPEN -> Health.UNAVAILABLE;
            case HALF_OPEN -> Health.DEGRADED;
            case CLOSED -> Health.HEALTHY;
        };
    }

    private void transitionIfRecovered() {
        if (state == State.OPEN && openedAt != null
                && !clock.instant().isBefore(openedAt.plus(recoveryTimeout))) {
            state = State.HALF_OPEN;
            generation++;
            halfOpenInFlight = 0;
            halfOpenSuccesses = 0;
            log.info("Circuit breaker transitioning to HALF_OPEN: backendId={}", backendId);
        }
    }

    private void open(Instant now) {
        state = State.OPEN;
        generation++;
        openedAt = now;
        halfOpenInFlight = 0;
        halfOpenSuccesses = 0;
    }

    private boolean isCurrentTrial(Permission permission) {
        return permission.trial() && state == State.HALF_OPEN && permission.generation() == generation;
    }

    private void releaseTrialSlot() {
        if (halfOpenInFlight > 0) {
            halfOpenInFlight--;
        }
    }

    @Override
    public String toString() {
        return "CircuitBreaker{" +
                "backendId='" + backendId + '\'' +
                ", state=" + getState() +
                ", failures=" + getFailureCount() +
                '}';
    }

    /**
     * Admission of one call: the state generation it was granted in and
     * whether it took a half-open trial slot.
     */
    public record Permission(long generation, boolean trial) {

        /**
         * Stands for outcomes that were not admitted through {@link #acquirePermission()}.
         */
        public static final Permission UNTRACKED = new Permission(-1, false);
    }

    /**
     * Point-in-time view of a breaker's counters.
     */
    public record CircuitStats(
            String backendId,
            State state,
            Health health,
            int consecutiveFailures,
            long totalFailures,
            long totalRequests,
            double errorRate,
            int halfOpenInFlight,
            Instant lastFailureTime,
            Instant lastSuccessTime,
            Instant openedAt
    ) {
    }
}
