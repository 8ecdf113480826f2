package fr.lapetina.llm.gateway.domain.model;

/**
 * One increment of a streamed response. The final chunk has {@code done = true}.
 */
public record StreamChunk(
        String requestId,
        String backendId,
        int index,
        String delta,
        boolean done,
        String finishReason
) {
    public StreamChunk {
        if (delta == null) {
            delta = "";
        }
    }
}
