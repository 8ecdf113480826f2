package fr.lapetina.llm.gateway.infrastructure.cache;

import java.time.Instant;

/**
 * Filter for bulk cache removal. Null fields match everything;
 * an entry is removed when every non-null field matches.
 *
 * @param backendId  entries produced by this backend
 * @param olderThan  entries created strictly before this instant
 */
public record CacheInvalidation(String backendId, Instant olderThan) {

    public static CacheInvalidation all() {
        return new CacheInvalidation(null, null);
    }

    public static CacheInvalidation byBackend(String backendId) {
        return new CacheInvalidation(backendId, null);
    }

    public static CacheInvalidation olderThan(Instant instant) {
        return new CacheInvalidation(null, instant);
    }

    boolean matches(CacheEntry entry) {
        if (backendId != null && !backendId.equals(entry.backendId())) {
            return false;
        }
        return olderThan == null || entry.createdAt().isBefore(olderThan);
    }
}
