package fr.lapetina.llm.gateway.infrastructure.queue;

import fr.lapetina.llm.gateway.domain.exception.QueueFullException;
import fr.lapetina.llm.gateway.domain.model.InferenceRequest;
import fr.lapetina.llm.gateway.domain.model.Priority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Bounded priority queue for requests awaiting dispatch.
 *
 * Producers never block: a full queue rejects immediately with
 * {@link QueueFullException} so callers apply their own backpressure.
 * Consumers block up to a timeout. Items whose deadline passed are dropped
 * on delivery, counted as expired and handed to the expiry listener.
 */
public final class AdmissionQueue {

    private static final Logger log = LoggerFactory.getLogger(AdmissionQueue.class);

    private final int maxSize;
    private final Clock clock;
    private final Consumer<QueuedRequest> expiryListener;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final PriorityQueue<QueuedRequest> queue = new PriorityQueue<>(QueuedRequest.ORDER);

    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong enqueued = new AtomicLong();
    private final AtomicLong dequeued = new AtomicLong();
    private final AtomicLong expired = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    /**
     * @param expiryListener called outside the lock for every dropped item, may be null
     */
    public AdmissionQueue(int maxSize, Clock clock, Consumer<QueuedRequest> expiryListener) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive");
        }
        this.maxSize = maxSize;
        this.clock = clock;
        this.expiryListener = expiryListener;
    }

    public AdmissionQueue(int maxSize) {
        this(maxSize, Clock.systemUTC(), null);
    }

    /**
     * Enqueues with an absolute deadline (null for none).
     *
     * @throws QueueFullException if the queue is at capacity
     */
    public QueuedRequest enqueue(InferenceRequest request, Priority priority, Instant deadline) {
        Instant now = clock.instant();
        QueuedRequest item = new QueuedRequest(
                request, priority, now, deadline, sequence.getAndIncrement(), new CompletableFuture<>());

        lock.lock();
        try {
            if (queue.size() >= maxSize) {
                rejected.incrementAndGet();
                log.warn("Admission queue full: requestId={}, maxSize={}", request.requestId(), maxSize);
                throw new QueueFullException(maxSize);
            }
            queue.offer(item);
            enqueued.incrementAndGet();
            notEmpty.signal();
        } finally {
            lock.unlock();
        }

        log.debug("Request enqueued: requestId={}, priority={}, deadline={}",
                request.requestId(), priority, deadline);
        return item;
    }

    /**
     * Enqueues with a deadline relative to now.
     */
    public QueuedRequest enqueue(InferenceRequest request, Priority priority, Duration timeoutFromNow) {
        return enqueue(request, priority, clock.instant().plus(timeoutFromNow));
    }

    /**
     * Waits up to {@code timeout} for the highest-priority item.
     *
     * @return the item, or empty on timeout or when the head had expired
     *         (the caller re-polls in both cases)
     */
    public Optional<QueuedRequest> dequeue(Duration timeout) throws InterruptedException {
        QueuedRequest item;
        long remainingNanos = timeout.toNanos();

        lock.lockInterruptibly();
        try {
            while (queue.isEmpty()) {
                if (remainingNanos <= 0) {
                    return Optional.empty();
                }
                remainingNanos = notEmpty.awaitNanos(remainingNanos);
            }
            item = queue.poll();
        } finally {
            lock.unlock();
        }

        if (item.isExpired(clock.instant())) {
            expired.incrementAndGet();
            log.info("Dropped expired request: requestId={}, priority={}, deadline={}",
                    item.request().requestId(), item.priority(), item.deadline());
            if (expiryListener != null) {
                expiryListener.accept(item);
            }
            return Optional.empty();
        }

        dequeued.incrementAndGet();
        return Optional.of(item);
    }

    /**
     * Non-blocking variant of {@link #dequeue(Duration)}.
     */
    public Optional<QueuedRequest> poll() {
        try {
            return dequeue(Duration.ZERO);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    /**
     * Removes every pending item, completing each future with the given error.
     */
    public int drain(Throwable reason) {
        QueuedRequest[] pending;
        lock.lock();
        try {
            pending = queue.toArray(new QueuedRequest[0]);
            queue.clear();
        } finally {
            lock.unlock();
        }
        for (QueuedRequest item : pending) {
            item.response().completeExceptionally(reason);
        }
        return pending.length;
    }

    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isFull() {
        return size() >= maxSize;
    }

    public int getMaxSize() {
        return maxSize;
    }

    public QueueStats stats() {
        return new QueueStats(size(), maxSize, enqueued.get(), dequeued.get(), expired.get(), rejected.get());
    }

    /**
     * Cumulative queue counters.
     */
    public record QueueStats(
            int size,
            int maxSize,
            long enqueued,
            long dequeued,
            long expired,
            long rejected
    ) {
    }
}
