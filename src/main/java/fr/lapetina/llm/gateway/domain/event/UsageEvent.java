package fr.lapetina.llm.gateway.domain.event;

import fr.lapetina.llm.gateway.domain.model.UsageRecord;

/**
 * Event object for the usage ring buffer.
 *
 * Mutable holder reused across the ring buffer. It should never be accessed
 * outside the usage publisher and its handler.
 */
public final class UsageEvent {

    private UsageRecord record;
    private long publishedAtNanos;

    public void initialize(UsageRecord record, long publishedAtNanos) {
        this.record = record;
        this.publishedAtNanos = publishedAtNanos;
    }

    /**
     * Clears the event for reuse.
     */
    public void clear() {
        this.record = null;
        this.publishedAtNanos = 0;
    }

    public UsageRecord getRecord() {
        return record;
    }

    public long getPublishedAtNanos() {
        return publishedAtNanos;
    }

    @Override
    public String toString() {
        return "UsageEvent{requestId=" + (record != null ? record.requestId() : null)
                + ", backendId=" + (record != null ? record.backendId() : null) + "}";
    }
}
