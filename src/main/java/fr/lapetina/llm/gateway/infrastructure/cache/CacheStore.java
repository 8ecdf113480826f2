package fr.lapetina.llm.gateway.infrastructure.cache;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * String key/value store with per-entry TTL backing the response cache.
 *
 * Implementations may throw any {@link RuntimeException}; the cache treats
 * failures as misses.
 */
public interface CacheStore {

    Optional<String> get(String key);

    void put(String key, String value, Duration ttl);

    void remove(String key);

    /**
     * Returns up to {@code limit} live entries whose key starts with {@code prefix}.
     */
    Map<String, String> scan(String prefix, int limit);

    /**
     * Removes every entry whose key starts with {@code prefix}.
     *
     * @return number of removed entries
     */
    long removeByPrefix(String prefix);
}
