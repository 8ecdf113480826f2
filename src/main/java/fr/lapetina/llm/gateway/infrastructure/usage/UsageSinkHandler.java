package fr.lapetina.llm.gateway.infrastructure.usage;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.llm.gateway.domain.event.UsageEvent;
import fr.lapetina.llm.gateway.domain.model.UsageRecord;
import fr.lapetina.llm.gateway.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Delivers usage events to the sink.
 *
 * Sink failures are logged and counted; they never reach the request path.
 */
public final class UsageSinkHandler implements EventHandler<UsageEvent> {

    private static final Logger log = LoggerFactory.getLogger(UsageSinkHandler.class);

    private final UsageSink sink;
    private final MetricsRegistry metricsRegistry;
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong sinkErrors = new AtomicLong();

    public UsageSinkHandler(UsageSink sink, MetricsRegistry metricsRegistry) {
        this.sink = sink;
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(UsageEvent event, long sequence, boolean endOfBatch) {
        UsageRecord record = event.getRecord();
        if (record == null) {
            return;
        }
        try {
            sink.record(record);
            delivered.incrementAndGet();
            log.debug("Usage delivered: requestId={}, backendId={}, sequence={}",
                    record.requestId(), record.backendId(), sequence);
        } catch (RuntimeException e) {
            sinkErrors.incrementAndGet();
            if (metricsRegistry != null) {
                metricsRegistry.incrementUsageSinkErrors();
            }
            log.warn("Usage sink failed: requestId={}, backendId={}, error={}",
                    record.requestId(), record.backendId(), e.getMessage());
        } finally {
            event.clear();
        }
    }

    public long getDelivered() {
        return delivered.get();
    }

    public long getSinkErrors() {
        return sinkErrors.get();
    }
}
