package fr.lapetina.llm.gateway.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates usage events for the ring buffer.
 */
public final class UsageEventFactory implements EventFactory<UsageEvent> {

    @Override
    public UsageEvent newInstance() {
        return new UsageEvent();
    }
}
