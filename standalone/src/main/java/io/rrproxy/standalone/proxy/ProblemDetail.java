package io.rrproxy.standalone.proxy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Builds RFC 9457 Problem Details bodies for errors the proxy answers
 * itself.
 *
 * <p>
 * Example:
 * <pre>{@code
 * {
 * "type": "urn:rrproxy:bad-gateway",
 * "title": "Bad Gateway",
 * "status": 502,
 * "detail": "All 2 upstream attempts failed",
 * "instance": "/api/orders"
 * }
 * }</pre>
 *
 * <p>
 * Thread-safe: all methods are stateless.
 */
public final class ProblemDetail {

    /** Media type of every problem body. */
    public static final String CONTENT_TYPE = "application/problem+json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String URN_BAD_GATEWAY = "urn:rrproxy:bad-gateway";
    static final String URN_GATEWAY_TIMEOUT = "urn:rrproxy:gateway-timeout";
    static final String URN_BODY_TOO_LARGE = "urn:rrproxy:body-too-large";
    static final String URN_METHOD_NOT_ALLOWED = "urn:rrproxy:method-not-allowed";

    private ProblemDetail() {
        // utility class
    }

    /** No upstream could be reached, or every attempt failed before responding. */
    public static JsonNode badGateway(String detail, String instancePath) {
        return build(URN_BAD_GATEWAY, "Bad Gateway", 502, detail, instancePath);
    }

    /** The last upstream tried accepted the request but did not answer in time. */
    public static JsonNode gatewayTimeout(String detail, String instancePath) {
        return build(URN_GATEWAY_TIMEOUT, "Gateway Timeout", 504, detail, instancePath);
    }

    /** Request body larger than {@code proxy.max-body-bytes}. */
    public static JsonNode bodyTooLarge(String detail, String instancePath) {
        return build(URN_BODY_TOO_LARGE, "Payload Too Large", 413, detail, instancePath);
    }

    /** HTTP method outside the proxied set. */
    public static JsonNode methodNotAllowed(String detail, String instancePath) {
        return build(URN_METHOD_NOT_ALLOWED, "Method Not Allowed", 405, detail, instancePath);
    }

    static JsonNode build(String type, String title, int status, String detail, String instancePath) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", type);
        node.put("title", title);
        node.put("status", status);
        node.put("detail", detail);
        if (instancePath != null) {
            node.put("instance", instancePath);
        } else {
            node.putNull("instance");
        }
        return node;
    }
}
