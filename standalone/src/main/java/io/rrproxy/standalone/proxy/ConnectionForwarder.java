package io.rrproxy.standalone.proxy;

import io.rrproxy.core.model.RelayOutcome;
import io.rrproxy.core.model.UpstreamTarget;
import io.rrproxy.standalone.config.ProxyConfig;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.eclipse.jetty.client.HttpClient;
import org.eclipse.jetty.client.api.Request;
import org.eclipse.jetty.client.api.Response;
import org.eclipse.jetty.client.util.BytesRequestContent;
import org.eclipse.jetty.client.util.InputStreamResponseListener;
import org.eclipse.jetty.http.HttpField;
import org.eclipse.jetty.http.HttpFields;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Relays one request to one upstream and streams the response back.
 *
 * <p>
 * Backed by a Jetty {@link HttpClient} set up as a transparent proxy client:
 * no redirects, no content decoding, no protocol handlers and no injected
 * {@code User-Agent}. Upstream connections are pooled per upstream.
 *
 * <p>
 * The response body is copied through a fixed-size buffer and flushed after
 * every chunk; it is never materialised in full. A failure before the client
 * saw any byte leaves the client untouched and is reported as retryable.
 * After that the client connection is aborted so a truncated body is never
 * mistaken for a complete one.
 *
 * <p>
 * Thread-safe: no per-request state is kept between calls.
 */
public final class ConnectionForwarder {

    private static final Logger LOG = LoggerFactory.getLogger(ConnectionForwarder.class);

    /** Hop-by-hop headers per RFC 7230 §6.1, stripped in both directions. */
    private static final Set<String> HOP_BY_HOP_HEADERS = Set.of(
            "connection",
            "keep-alive",
            "proxy-authenticate",
            "proxy-authorization",
            "proxy-connection",
            "te",
            "trailer",
            "transfer-encoding",
            "upgrade");

    /**
     * Request headers the upstream client recomputes. {@code expect} is
     * answered by the listener; the buffered body is sent outright.
     */
    private static final Set<String> RECOMPUTED_REQUEST_HEADERS = Set.of("host", "content-length", "expect");

    private static final Set<String> FORWARDED_HEADERS =
            Set.of("x-forwarded-for", "x-forwarded-proto", "x-forwarded-host");

    static final long CLIENT_CHECK_INTERVAL_MS = 100;

    private final HttpClient httpClient;
    private final long connectTimeoutMs;
    private final long readTimeoutMs;
    private final int bufferSize;
    private final boolean forwardedHeadersEnabled;

    public ConnectionForwarder(ProxyConfig config) {
        this.connectTimeoutMs = config.upstreamConnectTimeoutMs();
        this.readTimeoutMs = config.upstreamReadTimeoutMs();
        this.bufferSize = config.bufferSize();
        this.forwardedHeadersEnabled = config.forwardedHeadersEnabled();

        QueuedThreadPool executor = new QueuedThreadPool();
        executor.setName("rrproxy-upstream");

        this.httpClient = new HttpClient();
        httpClient.setExecutor(executor);
        httpClient.setConnectTimeout(connectTimeoutMs);
        httpClient.setFollowRedirects(false);
        httpClient.setMaxConnectionsPerDestination(config.maxConnectionsPerUpstream());
        httpClient.setUserAgentField(null);
        httpClient.setDefaultRequestContentType(null);
    }

    /** Starts the upstream client; must be called before {@link #relay}. */
    public void start() throws Exception {
        httpClient.start();
        // Installed by start(): gzip decoding (with its Accept-Encoding) and the 401/407/redirect handlers
        httpClient.getContentDecoderFactories().clear();
        httpClient.getProtocolHandlers().clear();
        LOG.debug(
                "ConnectionForwarder started: connectTimeoutMs={}, readTimeoutMs={}, bufferSize={}",
                connectTimeoutMs,
                readTimeoutMs,
                bufferSize);
    }

    /** Stops the upstream client, closing all pooled connections. */
    public void stop() {
        try {
            httpClient.stop();
        } catch (Exception e) {
            LOG.warn("Failed to stop upstream client cleanly: {}", e.getMessage(), e);
        }
    }

    /**
     * Relays {@code inbound} to {@code target} and streams the response to
     * {@code client}.
     *
     * @param inbound the buffered client request
     * @param client  where the response goes
     * @param target  the upstream to use
     * @return what happened; never throws for upstream or client failures
     */
    public RelayOutcome relay(InboundRequest inbound, ClientConnection client, UpstreamTarget target) {
        long startNanos = System.nanoTime();

        Request request = httpClient
                .newRequest(target.resolve(inbound.pathAndQuery()))
                .method(inbound.method())
                .idleTimeout(readTimeoutMs, TimeUnit.MILLISECONDS)
                .headers(fields -> copyRequestHeaders(inbound, fields));
        if (inbound.hasBody()) {
            request.body(new BytesRequestContent((String) null, inbound.body()));
        }

        LOG.debug("Forwarding {} {} to {}", inbound.method(), inbound.pathAndQuery(), target);

        InputStreamResponseListener listener = new InputStreamResponseListener();
        request.send(listener);

        Response response;
        try {
            response = awaitResponse(request, listener, client, target);
        } catch (ClientDisconnectedException e) {
            LOG.debug("Client went away while waiting for {}: {}", target, e.getMessage());
            client.abort(e);
            return RelayOutcome.clientDisconnected(target, 0, 0, elapsed(startNanos));
        } catch (UpstreamTimeoutException e) {
            return RelayOutcome.timeout(target, elapsed(startNanos), e.getMessage());
        } catch (UpstreamException e) {
            return RelayOutcome.unreachable(target, elapsed(startNanos), e.getMessage());
        }

        int status = response.getStatus();
        client.sendHead(status, responseHeaders(response.getHeaders()));

        InputStream upstream = listener.getInputStream();
        byte[] buffer = new byte[bufferSize];
        long relayed = 0;
        try {
            OutputStream out;
            try {
                out = client.body();
            } catch (IOException e) {
                request.abort(e);
                return RelayOutcome.clientDisconnected(target, status, relayed, elapsed(startNanos));
            }
            while (true) {
                int read;
                try {
                    read = upstream.read(buffer);
                } catch (IOException e) {
                    return upstreamReadFailed(client, target, status, relayed, startNanos, e);
                }
                if (read < 0) {
                    break;
                }
                try {
                    out.write(buffer, 0, read);
                    out.flush();
                } catch (IOException e) {
                    request.abort(e);
                    LOG.debug("Client went away after {} bytes from {}: {}", relayed, target, e.getMessage());
                    return RelayOutcome.clientDisconnected(target, status, relayed, elapsed(startNanos));
                }
                relayed += read;
            }
        } finally {
            closeUpstream(upstream, target);
        }
        return RelayOutcome.success(target, status, relayed, elapsed(startNanos));
    }

    /**
     * Waits for the response head, classifying failures by cause. The client
     * is checked every {@value #CLIENT_CHECK_INTERVAL_MS} ms; once it is gone
     * the upstream exchange is aborted.
     */
    private Response awaitResponse(
            Request request, InputStreamResponseListener listener, ClientConnection client, UpstreamTarget target)
            throws UpstreamException, ClientDisconnectedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(connectTimeoutMs + readTimeoutMs);
        try {
            while (true) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0) {
                    TimeoutException timeout = new TimeoutException("No response head");
                    request.abort(timeout);
                    throw new UpstreamTimeoutException(
                            "No response from " + target + " within " + readTimeoutMs + " ms", timeout);
                }
                try {
                    return listener.get(Math.min(remainingMs, CLIENT_CHECK_INTERVAL_MS), TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    if (!client.isConnected()) {
                        ClientDisconnectedException gone =
                                new ClientDisconnectedException("Client closed the connection before " + target + " answered");
                        request.abort(gone);
                        throw gone;
                    }
                }
            }
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (isIdleTimeout(cause)) {
                throw new UpstreamTimeoutException("Read timeout from " + target + " after " + readTimeoutMs + " ms", cause);
            }
            throw new UpstreamConnectException("Failed to reach " + target + ": " + describe(cause), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            request.abort(e);
            throw new UpstreamConnectException("Interrupted while waiting for " + target, e);
        }
    }

    private RelayOutcome upstreamReadFailed(
            ClientConnection client, UpstreamTarget target, int status, long relayed, long startNanos, IOException e) {
        boolean timedOut = isIdleTimeout(e);
        if (!client.isCommitted()) {
            client.reset();
            String detail = (timedOut ? "Read timeout from " : "Connection lost to ") + target + ": " + describe(e);
            return timedOut
                    ? RelayOutcome.timeout(target, elapsed(startNanos), detail)
                    : RelayOutcome.unreachable(target, elapsed(startNanos), detail);
        }
        client.abort(e);
        return RelayOutcome.failed(
                target,
                status,
                relayed,
                elapsed(startNanos),
                "Upstream " + target + " failed after " + relayed + " bytes: " + describe(e));
    }

    private void closeUpstream(InputStream upstream, UpstreamTarget target) {
        try {
            upstream.close();
        } catch (IOException e) {
            LOG.debug("Error closing response stream from {}: {}", target, e.getMessage());
        }
    }

    private void copyRequestHeaders(InboundRequest inbound, HttpFields.Mutable fields) {
        Set<String> connectionTokens = connectionTokens(inbound.header("connection"));
        for (Map.Entry<String, List<String>> header : inbound.headers().entrySet()) {
            String name = header.getKey();
            if (HOP_BY_HOP_HEADERS.contains(name)
                    || RECOMPUTED_REQUEST_HEADERS.contains(name)
                    || connectionTokens.contains(name)
                    || (forwardedHeadersEnabled && FORWARDED_HEADERS.contains(name))) {
                continue;
            }
            for (String value : header.getValue()) {
                fields.add(name, value);
            }
        }

        if (forwardedHeadersEnabled) {
            // Append per RFC 7239: earlier hops stay first
            String prior = String.join(", ", inbound.header("x-forwarded-for"));
            fields.put("X-Forwarded-For", prior.isEmpty() ? inbound.clientIp() : prior + ", " + inbound.clientIp());
            fields.put("X-Forwarded-Proto", inbound.scheme());
            if (inbound.host() != null && !inbound.host().isEmpty()) {
                fields.put("X-Forwarded-Host", inbound.host());
            }
        }
    }

    static List<Map.Entry<String, String>> responseHeaders(HttpFields upstreamHeaders) {
        List<String> connectionValues = new ArrayList<>();
        for (HttpField field : upstreamHeaders) {
            if ("connection".equalsIgnoreCase(field.getName())) {
                connectionValues.add(field.getValue());
            }
        }
        Set<String> connectionTokens = connectionTokens(connectionValues);

        List<Map.Entry<String, String>> relayed = new ArrayList<>();
        for (HttpField field : upstreamHeaders) {
            String lowerName = field.getName().toLowerCase(Locale.ROOT);
            if (HOP_BY_HOP_HEADERS.contains(lowerName) || connectionTokens.contains(lowerName)) {
                continue;
            }
            relayed.add(Map.entry(field.getName(), field.getValue()));
        }
        return relayed;
    }

    /** Header names listed in {@code Connection}, which are hop-by-hop too. */
    static Set<String> connectionTokens(List<String> connectionValues) {
        Set<String> tokens = new HashSet<>();
        for (String value : connectionValues) {
            for (String token : value.split(",")) {
                String trimmed = token.trim().toLowerCase(Locale.ROOT);
                if (!trimmed.isEmpty()) {
                    tokens.add(trimmed);
                }
            }
        }
        return tokens;
    }

    private static boolean isIdleTimeout(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException) {
                return true;
            }
        }
        return false;
    }

    private static String describe(Throwable failure) {
        String message = failure.getMessage();
        return failure.getClass().getSimpleName() + (message != null ? " (" + message + ")" : "");
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
