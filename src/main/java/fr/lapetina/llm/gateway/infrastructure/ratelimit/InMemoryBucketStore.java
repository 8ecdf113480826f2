package fr.lapetina.llm.gateway.infrastructure.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Single-instance bucket store.
 *
 * Keys untouched for {@code idleExpiry} are evicted; a bucket idle that long
 * has refilled completely, so dropping it loses nothing. Updates go through
 * {@code asMap().compute}, which locks only the entry being changed.
 */
public final class InMemoryBucketStore implements BucketStore {

    private final Cache<String, BucketState> states;

    public InMemoryBucketStore(Duration idleExpiry, Ticker ticker) {
        this.states = Caffeine.newBuilder()
                .expireAfterAccess(idleExpiry)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    public InMemoryBucketStore(Duration idleExpiry) {
        this(idleExpiry, Ticker.systemTicker());
    }

    /**
     * Store sized for the default one-minute period.
     */
    public InMemoryBucketStore() {
        this(Duration.ofMinutes(2));
    }

    @Override
    public BucketState update(String key, UnaryOperator<BucketState> update) {
        return states.asMap().compute(key, (k, current) -> update.apply(current));
    }

    @Override
    public Optional<BucketState> get(String key) {
        return Optional.ofNullable(states.getIfPresent(key));
    }

    @Override
    public void remove(String key) {
        states.invalidate(key);
    }

    public long size() {
        states.cleanUp();
        return states.estimatedSize();
    }
}
