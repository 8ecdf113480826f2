package fr.lapetina.llm.gateway.infrastructure.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-process cache store on Caffeine with a TTL per entry.
 * Suitable for a single gateway instance; entries do not survive restarts.
 */
public final class CaffeineCacheStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(CaffeineCacheStore.class);

    private final Cache<String, Stored> cache;

    public CaffeineCacheStore(long maximumSize, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new PerEntryExpiry())
                .ticker(ticker)
                .executor(Runnable::run)
                .removalListener((String key, Stored value, RemovalCause cause) -> {
                    if (cause == RemovalCause.SIZE) {
                        log.debug("Cache entry evicted due to size: key={}", key);
                    } else if (cause == RemovalCause.EXPIRED) {
                        log.debug("Cache entry expired: key={}", key);
                    }
                })
                .build();
        log.info("Caffeine cache store initialized: maximumSize={}", maximumSize);
    }

    public CaffeineCacheStore(long maximumSize) {
        this(maximumSize, Ticker.systemTicker());
    }

    @Override
    public Optional<String> get(String key) {
        Stored stored = cache.getIfPresent(key);
        return stored != null ? Optional.of(stored.value()) : Optional.empty();
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        cache.put(key, new Stored(value, ttl));
    }

    @Override
    public void remove(String key) {
        cache.invalidate(key);
    }

    @Override
    public Map<String, String> scan(String prefix, int limit) {
        Map<String, String> result = new LinkedHashMap<>();
        for (Map.Entry<String, Stored> entry : cache.asMap().entrySet()) {
            if (result.size() >= limit) {
                break;
            }
            if (entry.getKey().startsWith(prefix)) {
                result.put(entry.getKey(), entry.getValue().value());
            }
        }
        return result;
    }

    @Override
    public long removeByPrefix(String prefix) {
        long before = cache.asMap().size();
        cache.asMap().keySet().removeIf(key -> key.startsWith(prefix));
        return before - cache.asMap().size();
    }

    /**
     * Runs pending maintenance, then returns the approximate entry count.
     */
    public long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private record Stored(String value, Duration ttl) {
    }

    private static final class PerEntryExpiry implements Expiry<String, Stored> {

        @Override
        public long expireAfterCreate(String key, Stored value, long currentTime) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Stored value, long currentTime, long currentDuration) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, Stored value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
