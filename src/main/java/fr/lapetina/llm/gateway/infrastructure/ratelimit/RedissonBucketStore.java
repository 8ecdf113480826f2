package fr.lapetina.llm.gateway.infrastructure.ratelimit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.redisson.api.RBucket;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;

/**
 * Redis-backed bucket store shared by every gateway instance.
 *
 * An update holds a per-key Redisson lock across read, refill and write, so
 * concurrent checks from any instance never over-admit. States expire after
 * {@code ttl} without updates; the caller sizes it at twice the refill period,
 * by which time an idle bucket is full again.
 */
public final class RedissonBucketStore implements BucketStore {

    private static final Logger log = LoggerFactory.getLogger(RedissonBucketStore.class);

    private static final long LOCK_WAIT_MS = 200;
    private static final long LOCK_LEASE_MS = 5000;

    private final RedissonClient redissonClient;
    private final String namespace;
    private final Duration ttl;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public RedissonBucketStore(RedissonClient redissonClient, String namespace, Duration ttl) {
        this.redissonClient = redissonClient;
        this.namespace = namespace.endsWith(":") ? namespace : namespace + ":";
        this.ttl = ttl;
    }

    /**
     * @throws IllegalStateException if the key's lock is not obtained in time
     */
    @Override
    public BucketState update(String key, UnaryOperator<BucketState> update) {
        RLock lock = redissonClient.getLock(namespace + key + ":lock");
        boolean acquired;
        try {
            acquired = lock.tryLock(LOCK_WAIT_MS, LOCK_LEASE_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while locking bucket " + key, e);
        }
        if (!acquired) {
            throw new IllegalStateException("Bucket " + key + " stayed locked for " + LOCK_WAIT_MS + "ms");
        }

        try {
            RBucket<String> bucket = bucket(key);
            BucketState next = update.apply(decode(bucket.get()));
            bucket.set(encode(next), ttl.toMillis(), TimeUnit.MILLISECONDS);
            return next;
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            } else {
                log.warn("Bucket lock lease expired before release: key={}", key);
            }
        }
    }

    @Override
    public Optional<BucketState> get(String key) {
        return Optional.ofNullable(decode(bucket(key).get()));
    }

    @Override
    public void remove(String key) {
        bucket(key).delete();
    }

    @Override
    public boolean isShared() {
        return true;
    }

    private RBucket<String> bucket(String key) {
        return redissonClient.getBucket(namespace + key, StringCodec.INSTANCE);
    }

    private BucketState decode(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, BucketState.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Unreadable bucket state", e);
        }
    }

    private String encode(BucketState state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Unwritable bucket state", e);
        }
    }
}
