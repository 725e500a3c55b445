package io.rrproxy.standalone.proxy;

import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.rrproxy.core.pool.UpstreamPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Readiness check.
 *
 * <p>
 * Returns {@code 200 OK} with {@code {"status":"READY","eligible":n,"total":m}}
 * while at least one upstream is eligible for selection, and
 * {@code 503 Service Unavailable} with {@code "status":"NOT_READY"} once the
 * health observer has taken every upstream out of rotation. Without a
 * health-aware observer every upstream is always eligible.
 */
public final class ReadinessHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(ReadinessHandler.class);

    private final UpstreamPool pool;

    public ReadinessHandler(UpstreamPool pool) {
        this.pool = pool;
    }

    @Override
    public void handle(Context ctx) {
        int eligible = pool.eligibleCount();
        int total = pool.size();
        ctx.contentType("application/json");

        if (eligible == 0) {
            LOG.debug("Readiness check: no eligible upstream out of {}", total);
            ctx.status(503);
            ctx.result("{\"status\":\"NOT_READY\",\"eligible\":0,\"total\":" + total + "}");
            return;
        }

        ctx.status(200);
        ctx.result("{\"status\":\"READY\",\"eligible\":" + eligible + ",\"total\":" + total + "}");
    }
}
