package fr.lapetina.llm.gateway.infrastructure.cache;

import fr.lapetina.llm.gateway.domain.exception.CacheException;
import fr.lapetina.llm.gateway.domain.exception.ErrorCode;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Redis-backed cache store shared by every gateway instance.
 * Entries survive gateway restarts and expire through Redis TTLs.
 */
public final class RedissonCacheStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(RedissonCacheStore.class);

    private final RedissonClient redissonClient;
    private final String namespace;

    public RedissonCacheStore(RedissonClient redissonClient, String namespace) {
        this.redissonClient = redissonClient;
        this.namespace = namespace.endsWith(":") ? namespace : namespace + ":";
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(bucket(key).get());
        } catch (RuntimeException e) {
            throw unavailable("get", key, e);
        }
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        try {
            bucket(key).set(value, ttl.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            throw unavailable("put", key, e);
        }
    }

    @Override
    public void remove(String key) {
        try {
            bucket(key).delete();
        } catch (RuntimeException e) {
            throw unavailable("remove", key, e);
        }
    }

    @Override
    public Map<String, String> scan(String prefix, int limit) {
        Map<String, String> result = new LinkedHashMap<>();
        try {
            for (String redisKey : redissonClient.getKeys().getKeysByPattern(namespace + prefix + "*", 100)) {
                if (result.size() >= limit) {
                    break;
                }
                String value = redissonClient.<String>getBucket(redisKey, StringCodec.INSTANCE).get();
                // Expired between SCAN and GET
                if (value != null) {
                    result.put(redisKey.substring(namespace.length()), value);
                }
            }
        } catch (RuntimeException e) {
            throw unavailable("scan", prefix, e);
        }
        return result;
    }

    @Override
    public long removeByPrefix(String prefix) {
        try {
            long removed = redissonClient.getKeys().deleteByPattern(namespace + prefix + "*");
            log.debug("Removed cache keys by prefix: prefix={}, removed={}", prefix, removed);
            return removed;
        } catch (RuntimeException e) {
            throw unavailable("removeByPrefix", prefix, e);
        }
    }

    private RBucket<String> bucket(String key) {
        return redissonClient.getBucket(namespace + key, StringCodec.INSTANCE);
    }

    private CacheException unavailable(String operation, String key, RuntimeException cause) {
        return new CacheException(ErrorCode.CACHE_STORE_UNAVAILABLE, operation + " failed for " + key, cause);
    }
}
