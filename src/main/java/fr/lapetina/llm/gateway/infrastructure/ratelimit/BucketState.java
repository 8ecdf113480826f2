package fr.lapetina.llm.gateway.infrastructure.ratelimit;

/**
 * Both buckets of one (caller, backend) pair, stored and updated together so
 * that a deduction is applied to both or neither.
 */
public record BucketState(TokenBucket requests, TokenBucket units) {
}
