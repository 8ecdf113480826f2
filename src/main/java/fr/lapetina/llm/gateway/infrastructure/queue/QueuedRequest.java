package fr.lapetina.llm.gateway.infrastructure.queue;

import fr.lapetina.llm.gateway.domain.model.InferenceRequest;
import fr.lapetina.llm.gateway.domain.model.InferenceResponse;
import fr.lapetina.llm.gateway.domain.model.Priority;

import java.time.Instant;
import java.util.Comparator;
import java.util.concurrent.CompletableFuture;

/**
 * A request waiting for dispatch.
 *
 * @param sequence insertion order, breaks every remaining tie
 * @param response completed by whoever dequeues the request
 */
public record QueuedRequest(
        InferenceRequest request,
        Priority priority,
        Instant enqueuedAt,
        Instant deadline,
        long sequence,
        CompletableFuture<InferenceResponse> response
) {
    /**
     * Priority tier, then earliest deadline (none last), then enqueue time, then insertion order.
     */
    static final Comparator<QueuedRequest> ORDER = Comparator
            .comparing(QueuedRequest::priority)
            .thenComparing(QueuedRequest::deadline, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(QueuedRequest::enqueuedAt)
            .thenComparingLong(QueuedRequest::sequence);

    public boolean isExpired(Instant now) {
        return deadline != null && !now.isBefore(deadline);
    }
}
