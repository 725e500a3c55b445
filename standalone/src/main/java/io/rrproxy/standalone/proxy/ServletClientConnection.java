package io.rrproxy.standalone.proxy;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.eclipse.jetty.io.EndPoint;
import org.eclipse.jetty.server.HttpChannel;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.util.BufferUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ClientConnection} over Jetty's servlet request/response pair.
 *
 * <p>
 * Writes go straight to the servlet output stream, bypassing Javalin's
 * result handling and compression, so upstream bytes reach the client
 * unchanged.
 */
final class ServletClientConnection implements ClientConnection {

    private static final Logger LOG = LoggerFactory.getLogger(ServletClientConnection.class);

    private final HttpServletRequest request;
    private final HttpServletResponse response;
    private boolean pipelined;

    ServletClientConnection(HttpServletRequest request, HttpServletResponse response) {
        this.request = request;
        this.response = response;
    }

    @Override
    public void sendHead(int status, List<Map.Entry<String, String>> headers) {
        response.setStatus(status);
        // Drop any default content type; the upstream's, if any, is copied below
        response.setContentType(null);
        Set<String> seen = new HashSet<>();
        for (Map.Entry<String, String> header : headers) {
            if (seen.add(header.getKey().toLowerCase(Locale.ROOT))) {
                response.setHeader(header.getKey(), header.getValue());
            } else {
                response.addHeader(header.getKey(), header.getValue());
            }
        }
    }

    @Override
    public OutputStream body() throws IOException {
        return response.getOutputStream();
    }

    /**
     * Attempts a non-blocking read on the connection: {@code -1} means the
     * client closed it. A byte that does arrive belongs to a pipelined
     * request, which is then lost; the connection is closed after this
     * response so the client resends it.
     */
    @Override
    public boolean isConnected() {
        EndPoint endPoint = endPoint();
        if (endPoint == null) {
            return true;
        }
        if (!endPoint.isOpen() || endPoint.isInputShutdown()) {
            return false;
        }
        if (pipelined) {
            return true;
        }
        try {
            ByteBuffer sample = BufferUtil.allocate(1);
            int filled = endPoint.fill(sample);
            if (filled > 0) {
                pipelined = true;
                closeAfterResponse();
            }
            return filled >= 0;
        } catch (IOException e) {
            LOG.debug("Client connection check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public boolean isCommitted() {
        return response.isCommitted();
    }

    @Override
    public void reset() {
        response.reset();
        if (pipelined) {
            closeAfterResponse();
        }
    }

    private void closeAfterResponse() {
        response.setHeader("Connection", "close");
    }

    private EndPoint endPoint() {
        HttpChannel channel = channel();
        return channel != null ? channel.getEndPoint() : null;
    }

    private HttpChannel channel() {
        Request baseRequest = Request.getBaseRequest(request);
        return baseRequest != null ? baseRequest.getHttpChannel() : null;
    }

    @Override
    public void abort(Throwable cause) {
        HttpChannel channel = channel();
        if (channel == null) {
            LOG.warn("Cannot abort client connection: no Jetty channel behind {}", request.getClass().getName());
            return;
        }
        channel.abort(cause);
    }
}
