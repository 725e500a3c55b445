package io.rrproxy.standalone.proxy;

import io.javalin.http.Context;
import io.javalin.http.Handler;

/**
 * Liveness check: a fixed {@code 200 OK} with {@code {"status":"UP"}} while
 * the process and listener are running. Registered ahead of the proxy
 * wildcard, so it is never forwarded upstream.
 */
public final class HealthHandler implements Handler {

    private static final String HEALTH_RESPONSE = "{\"status\":\"UP\"}";

    @Override
    public void handle(Context ctx) {
        ctx.status(200);
        ctx.contentType("application/json");
        ctx.result(HEALTH_RESPONSE);
    }
}
