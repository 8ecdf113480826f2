package fr.lapetina.llm.gateway.domain.exception;

/**
 * Cache infrastructure failure. Logged and converted to a miss by the cache.
 */
public final class CacheException extends GatewayException {

    public CacheException(ErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
        if (code.getCategory() != ErrorCategory.CACHE) {
            throw new IllegalArgumentException("Not a cache error code: " + code);
        }
    }
}
