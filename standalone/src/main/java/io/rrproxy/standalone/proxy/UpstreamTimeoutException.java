package io.rrproxy.standalone.proxy;

/**
 * Thrown when an upstream accepted the connection but stayed idle beyond the
 * configured read timeout.
 *
 * <p>
 * Callers use this to generate a {@code 504 Gateway Timeout} response.
 */
public class UpstreamTimeoutException extends UpstreamException {

    private static final long serialVersionUID = 1L;

    /**
     * @param message human-readable error description
     * @param cause   the underlying timeout exception
     */
    public UpstreamTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
