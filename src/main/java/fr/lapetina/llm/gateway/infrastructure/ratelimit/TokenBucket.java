package fr.lapetina.llm.gateway.infrastructure.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable token bucket. Refills continuously at {@code capacity} per period.
 * Invariant: {@code 0 <= level <= capacity}.
 */
public record TokenBucket(double capacity, double level, Instant lastRefill) {

    public TokenBucket {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        if (level < 0 || level > capacity) {
            throw new IllegalArgumentException("level must be within [0, capacity]: " + level);
        }
    }

    public static TokenBucket full(double capacity, Instant now) {
        return new TokenBucket(capacity, capacity, now);
    }

    /**
     * Returns this bucket refilled up to {@code now}, adopting a new capacity if it changed.
     */
    public TokenBucket refill(Instant now, Duration period, double newCapacity) {
        long elapsedNanos = Duration.between(lastRefill, now).toNanos();
        double added = elapsedNanos > 0
                ? (double) elapsedNanos / period.toNanos() * newCapacity
                : 0.0;
        double refilled = Math.min(newCapacity, level + added);
        Instant refillTime = elapsedNanos > 0 ? now : lastRefill;
        return new TokenBucket(newCapacity, refilled, refillTime);
    }

    public boolean canCover(double amount) {
        return level >= amount;
    }

    public TokenBucket deduct(double amount) {
        return new TokenBucket(capacity, level - amount, lastRefill);
    }

    /**
     * Time until {@code amount} tokens are available, assuming no other consumer.
     */
    public Duration timeUntil(double amount, Duration period) {
        if (canCover(amount)) {
            return Duration.ZERO;
        }
        double deficit = Math.min(amount, capacity) - level;
        return Duration.ofNanos((long) Math.ceil(deficit / capacity * period.toNanos()));
    }
}
