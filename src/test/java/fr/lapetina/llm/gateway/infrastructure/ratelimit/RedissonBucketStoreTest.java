package fr.lapetina.llm.gateway.infrastructure.ratelimit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RBucket;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedissonBucketStoreTest {

    private static final String KEY = "ratelimit:team-a:gpt-4o";
    private static final String REDIS_KEY = "llm-gateway:" + KEY;
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Mock
    private RedissonClient redissonClient;

    @Mock
    private RBucket<String> bucket;

    @Mock
    private RLock lock;

    private RedissonBucketStore store;

    @BeforeEach
    void setUp() {
        store = new RedissonBucketStore(redissonClient, "llm-gateway", Duration.ofMinutes(2));
    }

    private static BucketState state(double requests, double units) {
        return new BucketState(new TokenBucket(5, requests, NOW), new TokenBucket(1000, units, NOW));
    }

    private void lockAvailable() throws InterruptedException {
        when(redissonClient.getLock(REDIS_KEY + ":lock")).thenReturn(lock);
        when(lock.tryLock(anyLong(), anyLong(), any(TimeUnit.class))).thenReturn(true);
        when(lock.isHeldByCurrentThread()).thenReturn(true);
        when(redissonClient.<String>getBucket(REDIS_KEY, StringCodec.INSTANCE)).thenReturn(bucket);
    }

    @Test
    @DisplayName("should create missing state under the key lock and write it with the TTL")
    void shouldCreateStateUnderLock() throws Exception {
        lockAvailable();
        when(bucket.get()).thenReturn(null);
        AtomicReference<BucketState> seen = new AtomicReference<>(state(0, 0));

        BucketState written = store.update(KEY, current -> {
            seen.set(current);
            return state(4, 990);
        });

        assertThat(seen.get()).isNull();
        assertThat(written).isEqualTo(state(4, 990));
        verify(bucket).set(anyString(), eq(120_000L), eq(TimeUnit.MILLISECONDS));
        verify(lock).unlock();
    }

    @Test
    @DisplayName("should hand the stored state to the next update")
    void shouldReadBackStoredState() throws Exception {
        lockAvailable();
        when(bucket.get()).thenReturn(null);
        store.update(KEY, current -> state(3, 700));
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(bucket).set(json.capture(), eq(120_000L), eq(TimeUnit.MILLISECONDS));

        when(bucket.get()).thenReturn(json.getValue());
        AtomicReference<BucketState> seen = new AtomicReference<>();
        store.update(KEY, current -> {
            seen.set(current);
            return current;
        });

        assertThat(seen.get()).isEqualTo(state(3, 700));
        assertThat(store.get(KEY)).contains(state(3, 700));
    }

    @Test
    @DisplayName("should fail without touching the bucket when the lock stays busy")
    void shouldFailWhenLockBusy() throws Exception {
        when(redissonClient.getLock(REDIS_KEY + ":lock")).thenReturn(lock);
        when(lock.tryLock(anyLong(), anyLong(), any(TimeUnit.class))).thenReturn(false);

        assertThatThrownBy(() -> store.update(KEY, current -> state(4, 990)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(KEY);

        verify(redissonClient, never()).getBucket(anyString(), any(StringCodec.class));
        verify(lock, never()).unlock();
    }

    @Test
    @DisplayName("should release the lock when the update throws")
    void shouldUnlockOnFailure() throws Exception {
        lockAvailable();
        when(bucket.get()).thenThrow(new IllegalStateException("connection reset"));

        assertThatThrownBy(() -> store.update(KEY, current -> state(4, 990)))
                .isInstanceOf(IllegalStateException.class);

        verify(lock).unlock();
    }

    @Test
    @DisplayName("should report empty for a key never written and delete on remove")
    void shouldReadAndRemove() {
        when(redissonClient.<String>getBucket(REDIS_KEY, StringCodec.INSTANCE)).thenReturn(bucket);
        when(bucket.get()).thenReturn(null);

        assertThat(store.get(KEY)).isEmpty();
        store.remove(KEY);

        verify(bucket).delete();
        assertThat(store.isShared()).isTrue();
    }
}
