package io.rrproxy.standalone.proxy;

/**
 * Base exception for failures talking to an upstream before its response
 * reached the client.
 *
 * <p>
 * Subtypes represent specific failure modes:
 * <ul>
 * <li>{@link UpstreamConnectException}: connection refused, host unreachable,
 * connection dropped before a response
 * <li>{@link UpstreamTimeoutException}: upstream idle beyond the read timeout
 * </ul>
 */
public abstract class UpstreamException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * @param message human-readable error description
     * @param cause   the underlying exception
     */
    protected UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
