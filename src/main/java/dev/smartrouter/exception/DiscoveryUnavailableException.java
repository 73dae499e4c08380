package dev.smartrouter.exception;

/**
 * The backend model listing could not be fetched or parsed.
 */
public class DiscoveryUnavailableException extends RuntimeException {

    public DiscoveryUnavailableException(String message) {
        super(message);
    }

    public DiscoveryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
