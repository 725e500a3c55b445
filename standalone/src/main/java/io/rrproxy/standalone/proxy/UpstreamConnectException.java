package io.rrproxy.standalone.proxy;

/**
 * Thrown when an upstream cannot be reached or drops the exchange before
 * sending a response.
 *
 * <p>
 * Nothing has been written to the client at this point, so the request may
 * be retried against another upstream; once attempts run out it becomes a
 * {@code 502 Bad Gateway}.
 */
public class UpstreamConnectException extends UpstreamException {

    private static final long serialVersionUID = 1L;

    /**
     * @param message human-readable error description
     * @param cause   the underlying network exception
     */
    public UpstreamConnectException(String message, Throwable cause) {
        super(message, cause);
    }
}
