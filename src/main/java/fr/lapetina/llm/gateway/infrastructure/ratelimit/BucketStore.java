package fr.lapetina.llm.gateway.infrastructure.ratelimit;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Storage for rate limiter state.
 *
 * Implementations may be in-process or shared between gateway instances.
 * Any {@link RuntimeException} thrown here makes the rate limiter fail open.
 */
public interface BucketStore {

    /**
     * Atomically replaces the state stored under {@code key} with the result of
     * {@code update}. The operator receives null when no state exists yet.
     *
     * @return the stored state
     */
    BucketState update(String key, UnaryOperator<BucketState> update);

    Optional<BucketState> get(String key);

    void remove(String key);

    /**
     * Whether calls leave the process. The rate limiter bounds calls to a
     * shared store by the request deadline and its store timeout.
     */
    default boolean isShared() {
        return false;
    }
}
