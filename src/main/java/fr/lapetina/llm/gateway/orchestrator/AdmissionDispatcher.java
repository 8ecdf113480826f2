package fr.lapetina.llm.gateway.orchestrator;

import fr.lapetina.llm.gateway.domain.exception.DeadlineExceededException;
import fr.lapetina.llm.gateway.domain.model.InferenceRequest;
import fr.lapetina.llm.gateway.domain.model.InferenceResponse;
import fr.lapetina.llm.gateway.infrastructure.queue.AdmissionQueue;
import fr.lapetina.llm.gateway.infrastructure.queue.QueuedRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Worker threads that drain the admission queue into the gateway.
 *
 * Each worker takes the highest-priority request, runs it with the deadline
 * it was queued with and completes the request's future with the outcome.
 */
public final class AdmissionDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AdmissionDispatcher.class);

    private static final Duration POLL_INTERVAL = Duration.ofMillis(200);

    private final AdmissionQueue queue;
    private final Function<InferenceRequest, InferenceResponse> executor;
    private final int workerCount;
    private final List<Thread> workers = new ArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    public AdmissionDispatcher(
            AdmissionQueue queue,
            Function<InferenceRequest, InferenceResponse> executor,
            int workerCount
    ) {
        if (workerCount <= 0) {
            throw new IllegalArgumentException("workerCount must be positive");
        }
        this.queue = queue;
        this.executor = executor;
        this.workerCount = workerCount;
    }

    /**
     * Expiry callback for the admission queue: fails the waiting future.
     */
    public static void expire(QueuedRequest item) {
        item.response().completeExceptionally(
                new DeadlineExceededException(item.request().requestId(), "admission-queue"));
    }

    public synchronized void start() {
        if (running.compareAndSet(false, true)) {
            for (int i = 0; i < workerCount; i++) {
                Thread worker = new Thread(this::runWorker, "admission-worker-" + i);
                worker.setDaemon(true);
                worker.start();
                workers.add(worker);
            }
            log.info("Admission dispatcher started: workers={}, queueMaxSize={}", workerCount, queue.getMaxSize());
        }
    }

    private void runWorker() {
        while (running.get()) {
            Optional<QueuedRequest> next;
            try {
                next = queue.dequeue(POLL_INTERVAL);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            next.ifPresent(this::dispatch);
        }
        log.debug("Admission worker exiting: thread={}", Thread.currentThread().getName());
    }

    void dispatch(QueuedRequest item) {
        if (item.response().isDone()) {
            return;
        }
        InferenceRequest request = item.deadline() != null
                ? item.request().withDeadline(item.deadline())
                : item.request();
        try {
            item.response().complete(executor.apply(request));
        } catch (RuntimeException e) {
            log.debug("Queued request failed: requestId={}, error={}", request.requestId(), e.getMessage());
            item.response().completeExceptionally(e);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Stops the workers and fails every request still queued.
     */
    @Override
    public synchronized void close() {
        if (running.compareAndSet(true, false)) {
            for (Thread worker : workers) {
                worker.interrupt();
            }
            for (Thread worker : workers) {
                try {
                    worker.join(5000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
            workers.clear();
            int drained = queue.drain(new IllegalStateException("Gateway is shutting down"));
            log.info("Admission dispatcher stopped: drainedRequests={}", drained);
        }
    }
}
