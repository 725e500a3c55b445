package io.rrproxy.standalone.proxy;

import com.fasterxml.jackson.databind.JsonNode;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.rrproxy.core.health.HealthObserver;
import io.rrproxy.core.model.RelayOutcome;
import io.rrproxy.core.model.UpstreamTarget;
import io.rrproxy.core.pool.UpstreamPool;
import io.rrproxy.standalone.config.ProxyConfig;
import jakarta.servlet.http.HttpServletRequest;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Per-request dispatcher: reads the client request, picks upstreams from the
 * pool and hands the exchange to the {@link ConnectionForwarder}.
 *
 * <p>
 * Each request runs on its own Jetty worker thread and moves through the
 * {@link ExchangeState} lifecycle:
 * <ol>
 * <li>{@code ACCEPTED → READING}: assign or echo {@code X-Request-ID}, read
 * the body up to {@code proxy.max-body-bytes} (413 beyond it)</li>
 * <li>{@code DISPATCHED → RELAYING}: select the next upstream and relay</li>
 * <li>{@code RETRYING}: an unreachable upstream, or a timeout when
 * {@code upstreams.retry-on-timeout} is set, moves on to the pool entry after
 * the failed one, skipping upstreams this request already tried, until the
 * attempt budget is spent</li>
 * <li>{@code COMPLETED} on success; {@code FAILED} otherwise, answered with
 * 502, or 504 when the last attempt timed out</li>
 * </ol>
 * Every relay outcome is reported to the pool's {@link HealthObserver}.
 *
 * <p>
 * Thread-safe: all request state is local to {@link #handle(Context)}.
 */
public final class ProxyHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(ProxyHandler.class);

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String MDC_REQUEST_ID = "requestId";

    private final UpstreamPool pool;
    private final ConnectionForwarder forwarder;
    private final int maxBodyBytes;
    private final int maxAttempts;
    private final boolean retryOnTimeout;

    /**
     * @param pool      upstream selection, with its health observer
     * @param forwarder relays single attempts
     * @param config    body limit and retry policy
     */
    public ProxyHandler(UpstreamPool pool, ConnectionForwarder forwarder, ProxyConfig config) {
        this.pool = pool;
        this.forwarder = forwarder;
        this.maxBodyBytes = config.maxBodyBytes();
        this.maxAttempts = config.effectiveAttempts();
        this.retryOnTimeout = config.retryOnTimeout();
    }

    /**
     * Final state of an exchange.
     *
     * @param state    {@link ExchangeState#COMPLETED} or {@link ExchangeState#FAILED}
     * @param attempts relay attempts made
     * @param outcome  outcome of the last attempt, {@code null} if none was made
     */
    record ExchangeResult(ExchangeState state, int attempts, RelayOutcome outcome) {}

    @Override
    public void handle(Context ctx) {
        String requestId = ctx.header(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        MDC.put(MDC_REQUEST_ID, requestId);
        try {
            exchange(ctx, requestId);
        } finally {
            MDC.remove(MDC_REQUEST_ID);
        }
    }

    ExchangeResult exchange(Context ctx, String requestId) {
        long startNanos = System.nanoTime();
        ExchangeState state = enter(ExchangeState.ACCEPTED);
        ctx.header(REQUEST_ID_HEADER, requestId);

        // --- READING: body bounded by max-body-bytes ---
        state = enter(ExchangeState.READING);
        long declaredLength = ctx.req().getContentLengthLong();
        if (declaredLength > maxBodyBytes) {
            return rejectTooLarge(ctx, declaredLength, requestId);
        }
        boolean hasBody = declaredLength >= 0 || ctx.header("Transfer-Encoding") != null;
        byte[] body;
        try {
            body = hasBody ? readBody(ctx.req().getInputStream()) : new byte[0];
        } catch (IOException e) {
            LOG.debug("Client went away while sending the request body: {}", e.getMessage());
            return new ExchangeResult(ExchangeState.FAILED, 0, null);
        }
        if (body.length > maxBodyBytes) {
            return rejectTooLarge(ctx, body.length, requestId);
        }

        InboundRequest inbound = new InboundRequest(
                ctx.method().name(),
                pathAndQuery(ctx.req()),
                requestHeaders(ctx.req(), requestId),
                body,
                hasBody,
                ctx.ip(),
                ctx.scheme(),
                ctx.header("Host"));
        ClientConnection client = new ServletClientConnection(ctx.req(), ctx.res());

        // --- DISPATCHED / RELAYING / RETRYING ---
        RelayOutcome outcome = null;
        int attempts = 0;
        UpstreamPool.Selection selection = pool.select();
        while (attempts < maxAttempts) {
            state = enter(attempts == 0 ? ExchangeState.DISPATCHED : ExchangeState.RETRYING);
            UpstreamTarget target = selection.next();
            attempts++;

            state = enter(ExchangeState.RELAYING);
            outcome = forwarder.relay(inbound, client, target);
            pool.healthObserver().recordOutcome(target, outcome);

            if (!shouldRetry(outcome) || attempts == maxAttempts) {
                break;
            }
            LOG.debug(
                    "Attempt {}/{} to {} failed ({}), trying next upstream",
                    attempts,
                    maxAttempts,
                    target,
                    outcome.detail());
            // A reset head drops the echoed id with it
            ctx.header(REQUEST_ID_HEADER, requestId);
        }

        state = enter(
                outcome != null && outcome.kind() == RelayOutcome.Kind.SUCCESS
                        ? ExchangeState.COMPLETED
                        : ExchangeState.FAILED);
        report(ctx, inbound, outcome, attempts, startNanos, requestId);
        return new ExchangeResult(state, attempts, outcome);
    }

    private boolean shouldRetry(RelayOutcome outcome) {
        return switch (outcome.kind()) {
            case UPSTREAM_UNREACHABLE -> true;
            case UPSTREAM_TIMEOUT -> retryOnTimeout;
            default -> false;
        };
    }

    private void report(
            Context ctx, InboundRequest inbound, RelayOutcome outcome, int attempts, long startNanos, String requestId) {
        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        switch (outcome.kind()) {
            case SUCCESS -> LOG.info(
                    "{} {} → {} {} ({} bytes, {} ms, attempts={})",
                    inbound.method(),
                    inbound.pathAndQuery(),
                    outcome.target(),
                    outcome.status(),
                    outcome.bytesRelayed(),
                    elapsedMs,
                    attempts);
            case CLIENT_DISCONNECTED -> LOG.debug(
                    "{} {} → {}: client disconnected after {} bytes",
                    inbound.method(),
                    inbound.pathAndQuery(),
                    outcome.target(),
                    outcome.bytesRelayed());
            case UPSTREAM_FAILED -> LOG.warn(
                    "{} {} → {}: response truncated, client connection aborted: {}",
                    inbound.method(),
                    inbound.pathAndQuery(),
                    outcome.target(),
                    outcome.detail());
            case UPSTREAM_TIMEOUT -> {
                LOG.warn("{} {}: gateway timeout after {} attempt(s): {}",
                        inbound.method(), inbound.pathAndQuery(), attempts, outcome.detail());
                writeProblemResponse(
                        ctx,
                        504,
                        ProblemDetail.gatewayTimeout(
                                "Upstream " + outcome.target() + " did not respond in time", ctx.path()),
                        requestId);
            }
            case UPSTREAM_UNREACHABLE -> {
                LOG.warn("{} {}: no upstream reachable after {} attempt(s): {}",
                        inbound.method(), inbound.pathAndQuery(), attempts, outcome.detail());
                writeProblemResponse(
                        ctx,
                        502,
                        ProblemDetail.badGateway("All " + attempts + " upstream attempt(s) failed", ctx.path()),
                        requestId);
            }
        }
    }

    private static ExchangeState enter(ExchangeState state) {
        LOG.trace("Exchange state → {}", state);
        return state;
    }

    private ExchangeResult rejectTooLarge(Context ctx, long size, String requestId) {
        LOG.warn("Request body too large: {} bytes (limit {})", size, maxBodyBytes);
        writeProblemResponse(
                ctx,
                413,
                ProblemDetail.bodyTooLarge("Request body exceeds " + maxBodyBytes + " bytes", ctx.path()),
                requestId);
        // The rest of the body is never read; do not keep the connection
        ctx.header("Connection", "close");
        return new ExchangeResult(ExchangeState.FAILED, 0, null);
    }

    /** Reads at most one byte past the limit, enough to detect overflow. */
    private byte[] readBody(InputStream in) throws IOException {
        int limit = maxBodyBytes == Integer.MAX_VALUE ? maxBodyBytes : maxBodyBytes + 1;
        return in.readNBytes(limit);
    }

    /**
     * Writes an RFC 9457 Problem Details response.
     *
     * @param ctx        the Javalin context
     * @param statusCode the HTTP status code
     * @param problem    the problem body
     * @param requestId  echoed in {@code X-Request-ID}
     */
    private static void writeProblemResponse(Context ctx, int statusCode, JsonNode problem, String requestId) {
        ctx.status(statusCode);
        ctx.contentType(ProblemDetail.CONTENT_TYPE);
        if (requestId != null) {
            ctx.header(REQUEST_ID_HEADER, requestId);
        }
        ctx.result(problem.toString());
    }

    /** Raw request target: undecoded path plus query string. */
    private static String pathAndQuery(HttpServletRequest req) {
        String path = req.getRequestURI();
        String query = req.getQueryString();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        return query == null || query.isEmpty() ? path : path + "?" + query;
    }

    /** Copies inbound headers under lowercase names, adding the request id. */
    private static Map<String, List<String>> requestHeaders(HttpServletRequest req, String requestId) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        Enumeration<String> names = req.getHeaderNames();
        while (names.hasMoreElements()) {
            String name = names.nextElement();
            List<String> values = headers.computeIfAbsent(name.toLowerCase(Locale.ROOT), k -> new ArrayList<>());
            Enumeration<String> valueEnum = req.getHeaders(name);
            while (valueEnum.hasMoreElements()) {
                values.add(valueEnum.nextElement());
            }
        }
        headers.put(REQUEST_ID_HEADER.toLowerCase(Locale.ROOT), List.of(requestId));
        return headers;
    }
}
