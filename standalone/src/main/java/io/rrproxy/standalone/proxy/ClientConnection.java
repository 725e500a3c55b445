package io.rrproxy.standalone.proxy;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.Map;

/**
 * The client side of one exchange, as seen by {@link ConnectionForwarder}.
 *
 * <p>
 * The head is staged by {@link #sendHead} and goes out with the first body
 * flush. Until then {@link #reset()} discards it and the exchange can be
 * answered differently; afterwards the only way to signal a failure is
 * {@link #abort}.
 */
public interface ClientConnection {

    /**
     * Stages the response status line and headers.
     *
     * @param status  HTTP status code
     * @param headers end-to-end headers in upstream order, names as received
     */
    void sendHead(int status, List<Map.Entry<String, String>> headers);

    /** Stream the response body is written to; each flush reaches the client. */
    OutputStream body() throws IOException;

    /**
     * Checks, without blocking, whether the client still holds the connection
     * open. Called while the upstream has not answered yet.
     */
    boolean isConnected();

    /** {@code true} once any part of the response has been sent. */
    boolean isCommitted();

    /** Discards a staged, uncommitted head. */
    void reset();

    /** Tears the client connection down without a clean end of message. */
    void abort(Throwable cause);
}
