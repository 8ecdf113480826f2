package fr.lapetina.llm.gateway.infrastructure.cache;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Embedding stored next to an exact-match entry.
 */
public record VectorEntry(
        @JsonProperty("fingerprint") String fingerprint,
        @JsonProperty("embedding") float[] embedding,
        @JsonProperty("created_at") Instant createdAt
) {
}
