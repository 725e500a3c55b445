package io.rrproxy.core.error;

/**
 * Thrown when the proxy cannot be configured: an empty or malformed upstream
 * list, an invalid port, or any other setting that prevents startup.
 *
 * <p>
 * Always fatal. The process logs the message and exits with a non-zero
 * status; it is never raised while serving requests.
 */
public class ConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
