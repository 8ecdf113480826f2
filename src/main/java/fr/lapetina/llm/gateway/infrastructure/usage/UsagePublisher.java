package fr.lapetina.llm.gateway.infrastructure.usage;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.EventTranslatorOneArg;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.llm.gateway.domain.event.UsageEvent;
import fr.lapetina.llm.gateway.domain.event.UsageEventFactory;
import fr.lapetina.llm.gateway.domain.model.UsageRecord;
import fr.lapetina.llm.gateway.infrastructure.config.GatewayConfig;
import fr.lapetina.llm.gateway.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Best-effort usage record delivery on an LMAX Disruptor ring buffer.
 *
 * Request threads publish with {@code tryPublishEvent} and never block: when
 * the ring buffer is full the record is dropped and counted. A single
 * consumer thread hands records to the {@link UsageSink}.
 *
 * PRODUCER TYPE: MULTI, since every request thread publishes.
 *
 * WAIT STRATEGY: configurable, default blocking. Usage delivery is not
 * latency sensitive, so the consumer should not burn a core.
 */
public final class UsagePublisher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(UsagePublisher.class);

    private static final EventTranslatorOneArg<UsageEvent, UsageRecord> TRANSLATOR =
            (event, sequence, record) -> event.initialize(record, System.nanoTime());

    private final Disruptor<UsageEvent> disruptor;
    private final RingBuffer<UsageEvent> ringBuffer;
    private final UsageSinkHandler handler;
    private final MetricsRegistry metricsRegistry;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong published = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    private UsagePublisher(Builder builder) {
        this.metricsRegistry = builder.metricsRegistry;
        this.disruptor = new Disruptor<>(
                new UsageEventFactory(),
                builder.ringBufferSize,
                new UsageThreadFactory("usage-publisher"),
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );
        this.handler = new UsageSinkHandler(builder.sink, builder.metricsRegistry);
        disruptor.handleEventsWith(handler);
        disruptor.setDefaultExceptionHandler(new UsageExceptionHandler());
        this.ringBuffer = disruptor.getRingBuffer();

        log.info("UsagePublisher created: ringBufferSize={}, waitStrategy={}",
                builder.ringBufferSize, builder.waitStrategy);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("UsagePublisher started");
        }
    }

    /**
     * Publishes a record without blocking.
     *
     * @return false if the record was dropped
     */
    public boolean publish(UsageRecord record) {
        if (!running.get()) {
            countDrop(record, "not running");
            return false;
        }
        if (!ringBuffer.tryPublishEvent(TRANSLATOR, record)) {
            countDrop(record, "ring buffer full");
            return false;
        }
        published.incrementAndGet();
        if (metricsRegistry != null) {
            metricsRegistry.setRingBufferRemaining((int) ringBuffer.remainingCapacity());
        }
        return true;
    }

    private void countDrop(UsageRecord record, String reason) {
        long total = dropped.incrementAndGet();
        if (metricsRegistry != null) {
            metricsRegistry.incrementUsageDropped();
        }
        log.warn("Usage record dropped: requestId={}, reason={}, totalDropped={}",
                record.requestId(), reason, total);
    }

    public long getPublishedCount() {
        return published.get();
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public long getDeliveredCount() {
        return handler.getDelivered();
    }

    public long getSinkErrorCount() {
        return handler.getSinkErrors();
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Drains pending records, then stops the consumer.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down UsagePublisher...");
            try {
                disruptor.shutdown(30, TimeUnit.SECONDS);
                log.info("UsagePublisher shut down gracefully: published={}, dropped={}",
                        published.get(), dropped.get());
            } catch (TimeoutException e) {
                log.warn("UsagePublisher shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    private static class UsageThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        UsageThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    private static class UsageExceptionHandler implements ExceptionHandler<UsageEvent> {

        @Override
        public void handleEventException(Throwable ex, long sequence, UsageEvent event) {
            log.error("Exception in usage handler: sequence={}, event={}", sequence, event, ex);
            event.clear();
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during usage publisher start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during usage publisher shutdown", ex);
        }
    }

    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private UsageSink sink;
        private MetricsRegistry metricsRegistry;

        public Builder ringBufferSize(int size) {
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder sink(UsageSink sink) {
            this.sink = sink;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder fromConfig(GatewayConfig.UsageConfig config) {
            ringBufferSize(config.getRingBufferSize());
            this.waitStrategy = config.getWaitStrategy();
            return this;
        }

        public UsagePublisher build() {
            if (sink == null) {
                throw new IllegalStateException("UsageSink is required");
            }
            return new UsagePublisher(this);
        }
    }
}
