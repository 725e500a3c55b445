package io.rrproxy.core.model;

import io.rrproxy.core.error.ConfigurationException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * A backend server the proxy forwards requests to.
 *
 * <p>
 * Immutable and shared read-only by every request-handling thread. Two
 * targets are equal when scheme, host and port match; {@link #address()} is
 * the identity used in logs and failure bookkeeping.
 *
 * @param scheme lowercase URI scheme, always {@code http}
 * @param host   hostname or IP literal (IPv6 literals keep their brackets)
 * @param port   TCP port in 1..65535
 */
public record UpstreamTarget(String scheme, String host, int port) {

    /** The only scheme accepted for upstreams. */
    public static final String HTTP = "http";

    private static final int DEFAULT_HTTP_PORT = 80;

    public UpstreamTarget {
        if (!HTTP.equals(scheme)) {
            throw new ConfigurationException("Unsupported upstream scheme '" + scheme + "' (only http is supported)");
        }
        if (host == null || host.isBlank()) {
            throw new ConfigurationException("Upstream host must not be empty");
        }
        if (port < 1 || port > 65_535) {
            throw new ConfigurationException("Upstream port out of range: " + port);
        }
    }

    /**
     * Parses a single {@code scheme://host[:port]} entry.
     *
     * @param text the entry, surrounding whitespace ignored
     * @return the parsed target
     * @throws ConfigurationException if the entry is not a plain http origin
     */
    public static UpstreamTarget parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ConfigurationException("Upstream entry must not be empty");
        }
        String trimmed = text.trim();
        URI uri;
        try {
            uri = new URI(trimmed);
        } catch (URISyntaxException e) {
            throw new ConfigurationException("Malformed upstream '" + trimmed + "': " + e.getMessage(), e);
        }

        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new ConfigurationException("Malformed upstream '" + trimmed + "': expected scheme://host:port");
        }
        String path = uri.getRawPath();
        if ((path != null && !path.isEmpty() && !"/".equals(path))
                || uri.getRawQuery() != null
                || uri.getRawFragment() != null
                || uri.getRawUserInfo() != null) {
            throw new ConfigurationException(
                    "Malformed upstream '" + trimmed + "': path, query, fragment and user info are not allowed");
        }

        int port = uri.getPort() == -1 ? DEFAULT_HTTP_PORT : uri.getPort();
        return new UpstreamTarget(uri.getScheme().toLowerCase(Locale.ROOT), uri.getHost(), port);
    }

    /** {@code host:port}, the identity of this target. */
    public String address() {
        return host + ":" + port;
    }

    /**
     * Builds the absolute URI for a request path on this target.
     *
     * @param pathAndQuery raw request target, e.g. {@code /api/users?page=2}
     */
    public URI resolve(String pathAndQuery) {
        String target = pathAndQuery == null || pathAndQuery.isEmpty() ? "/" : pathAndQuery;
        return URI.create(scheme + "://" + address() + target);
    }

    @Override
    public String toString() {
        return scheme + "://" + address();
    }
}
