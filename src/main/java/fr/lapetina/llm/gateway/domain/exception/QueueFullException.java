package fr.lapetina.llm.gateway.domain.exception;

/**
 * Thrown when the admission queue is at capacity.
 * Producers are never blocked; they receive this immediately.
 */
public final class QueueFullException extends GatewayException {

    private final int capacity;

    public QueueFullException(int capacity) {
        super(ErrorCode.QUEUE_FULL, "capacity=" + capacity);
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }
}
