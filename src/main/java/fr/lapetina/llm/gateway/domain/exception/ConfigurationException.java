package fr.lapetina.llm.gateway.domain.exception;

/**
 * Raised for invalid backend definitions, unknown backend ids and unreadable configuration.
 */
public final class ConfigurationException extends GatewayException {

    public ConfigurationException(ErrorCode code, String message) {
        super(requireCategory(code), message);
    }

    public ConfigurationException(ErrorCode code, String message, Throwable cause) {
        super(requireCategory(code), message, cause);
    }

    private static ErrorCode requireCategory(ErrorCode code) {
        if (code.getCategory() != ErrorCategory.CONFIGURATION) {
            throw new IllegalArgumentException("Not a configuration error code: " + code);
        }
        return code;
    }
}
