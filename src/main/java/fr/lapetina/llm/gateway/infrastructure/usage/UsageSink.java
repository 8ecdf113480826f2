package fr.lapetina.llm.gateway.infrastructure.usage;

import fr.lapetina.llm.gateway.domain.model.UsageRecord;

/**
 * Destination of usage records, typically an analytics or billing system.
 * Called from the usage handler thread, never from a request thread.
 */
@FunctionalInterface
public interface UsageSink {

    void record(UsageRecord record);
}
