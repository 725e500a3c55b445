package io.rrproxy.standalone.proxy;

import java.util.List;
import java.util.Map;

/**
 * A client request as received, read once and replayed unchanged on every
 * relay attempt.
 *
 * @param method       HTTP method
 * @param pathAndQuery raw request target, e.g. {@code /api/users?page=2}
 * @param headers      lowercase header names to their values, in arrival order
 * @param body         request body, empty when there is none
 * @param hasBody      whether the client framed a body (Content-Length or
 *                     Transfer-Encoding), even an empty one
 * @param clientIp     remote address of the client
 * @param scheme       inbound scheme, {@code http}
 * @param host         original {@code Host} header, may be {@code null}
 */
public record InboundRequest(
        String method,
        String pathAndQuery,
        Map<String, List<String>> headers,
        byte[] body,
        boolean hasBody,
        String clientIp,
        String scheme,
        String host) {

    /** All values of a header, empty when absent. */
    public List<String> header(String lowerCaseName) {
        return headers.getOrDefault(lowerCaseName, List.of());
    }
}
