package io.rrproxy.standalone.config;

import io.rrproxy.core.error.ConfigurationException;
import io.rrproxy.core.model.UpstreamTarget;
import io.rrproxy.core.pool.UpstreamPool;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Root configuration for the proxy.
 *
 * <p>
 * Every setting has a default except the upstream list, which is required.
 * Use {@link #builder()} to construct instances; {@link Builder#build()}
 * validates ranges and rejects bad values with a {@link ConfigLoadException}
 * naming the YAML key.
 *
 * @param proxyHost                 bind address of the listener
 * @param proxyPort                 listen port, {@code 0} for an ephemeral port
 * @param maxBodyBytes              largest request body accepted
 * @param clientIdleTimeoutMs       idle timeout on client connections
 * @param shutdownDrainTimeoutMs    max wait for in-flight requests on shutdown
 * @param forwardedHeadersEnabled   add X-Forwarded-* headers to upstream requests
 * @param upstreams                 upstream servers in selection order
 * @param upstreamConnectTimeoutMs  TCP connect timeout towards upstreams
 * @param upstreamReadTimeoutMs     idle read timeout towards upstreams
 * @param maxAttempts               attempts per request, {@code 0} for pool size
 * @param retryOnTimeout            whether a read timeout is retried elsewhere
 * @param bufferSize                relay buffer size in bytes
 * @param maxConnectionsPerUpstream connection pool size per upstream
 * @param failureThreshold          consecutive failures before an upstream is
 *                                  taken out of rotation, {@code 0} disables
 * @param cooldownMs                time an ineligible upstream stays out
 * @param statusEnabled             register the health/readiness endpoints
 * @param healthPath                liveness check path
 * @param readyPath                 readiness check path
 * @param loggingFormat             {@code text} or {@code json}
 * @param loggingLevel              root log level
 */
public record ProxyConfig(
        String proxyHost,
        int proxyPort,
        int maxBodyBytes,
        int clientIdleTimeoutMs,
        int shutdownDrainTimeoutMs,
        boolean forwardedHeadersEnabled,
        List<UpstreamTarget> upstreams,
        int upstreamConnectTimeoutMs,
        int upstreamReadTimeoutMs,
        int maxAttempts,
        boolean retryOnTimeout,
        int bufferSize,
        int maxConnectionsPerUpstream,
        int failureThreshold,
        int cooldownMs,
        boolean statusEnabled,
        String healthPath,
        String readyPath,
        String loggingFormat,
        String loggingLevel) {

    private static final Set<String> LOG_FORMATS = Set.of("text", "json");
    private static final Set<String> LOG_LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");

    public ProxyConfig {
        upstreams = List.copyOf(upstreams);
    }

    /** Creates a new builder with the documented defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Number of upstreams tried for one request: {@code maxAttempts} when set,
     * never more than the pool size.
     */
    public int effectiveAttempts() {
        int size = upstreams.size();
        return maxAttempts == 0 ? size : Math.min(maxAttempts, size);
    }

    /** Builder for {@link ProxyConfig}. */
    public static final class Builder {
        private String proxyHost = "0.0.0.0";
        private int proxyPort = 9090;
        private int maxBodyBytes = 10_485_760; // 10 MB
        private int clientIdleTimeoutMs = 30000;
        private int shutdownDrainTimeoutMs = 30000;
        private boolean forwardedHeadersEnabled = true;
        private List<UpstreamTarget> upstreams;
        private int upstreamConnectTimeoutMs = 5000;
        private int upstreamReadTimeoutMs = 30000;
        private int maxAttempts = 0;
        private boolean retryOnTimeout = false;
        private int bufferSize = 8192;
        private int maxConnectionsPerUpstream = 64;
        private int failureThreshold = 0;
        private int cooldownMs = 30000;
        private boolean statusEnabled = false;
        private String healthPath = "/health";
        private String readyPath = "/ready";
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder proxyHost(String proxyHost) {
            this.proxyHost = proxyHost;
            return this;
        }

        public Builder proxyPort(int proxyPort) {
            this.proxyPort = proxyPort;
            return this;
        }

        public Builder maxBodyBytes(int maxBodyBytes) {
            this.maxBodyBytes = maxBodyBytes;
            return this;
        }

        public Builder clientIdleTimeoutMs(int clientIdleTimeoutMs) {
            this.clientIdleTimeoutMs = clientIdleTimeoutMs;
            return this;
        }

        public Builder shutdownDrainTimeoutMs(int shutdownDrainTimeoutMs) {
            this.shutdownDrainTimeoutMs = shutdownDrainTimeoutMs;
            return this;
        }

        public Builder forwardedHeadersEnabled(boolean forwardedHeadersEnabled) {
            this.forwardedHeadersEnabled = forwardedHeadersEnabled;
            return this;
        }

        public Builder upstreams(List<UpstreamTarget> upstreams) {
            this.upstreams = upstreams;
            return this;
        }

        /**
         * Parses a comma-separated {@code scheme://host:port} list.
         *
         * @throws ConfigLoadException if the list is empty or an entry is malformed
         */
        public Builder upstreamServers(String commaSeparated) {
            try {
                this.upstreams = UpstreamPool.parseTargets(commaSeparated);
            } catch (ConfigurationException e) {
                throw new ConfigLoadException("Invalid upstreams.servers: " + e.getMessage(), e);
            }
            return this;
        }

        public Builder upstreamConnectTimeoutMs(int upstreamConnectTimeoutMs) {
            this.upstreamConnectTimeoutMs = upstreamConnectTimeoutMs;
            return this;
        }

        public Builder upstreamReadTimeoutMs(int upstreamReadTimeoutMs) {
            this.upstreamReadTimeoutMs = upstreamReadTimeoutMs;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder retryOnTimeout(boolean retryOnTimeout) {
            this.retryOnTimeout = retryOnTimeout;
            return this;
        }

        public Builder bufferSize(int bufferSize) {
            this.bufferSize = bufferSize;
            return this;
        }

        public Builder maxConnectionsPerUpstream(int maxConnectionsPerUpstream) {
            this.maxConnectionsPerUpstream = maxConnectionsPerUpstream;
            return this;
        }

        public Builder failureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
            return this;
        }

        public Builder cooldownMs(int cooldownMs) {
            this.cooldownMs = cooldownMs;
            return this;
        }

        public Builder statusEnabled(boolean statusEnabled) {
            this.statusEnabled = statusEnabled;
            return this;
        }

        public Builder healthPath(String healthPath) {
            this.healthPath = healthPath;
            return this;
        }

        public Builder readyPath(String readyPath) {
            this.readyPath = readyPath;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        /**
         * Validates all settings and builds the {@link ProxyConfig}.
         *
         * @throws ConfigLoadException naming the first invalid key
         */
        public ProxyConfig build() {
            if (upstreams == null || upstreams.isEmpty()) {
                throw new ConfigLoadException(
                        "upstreams.servers is required (YAML upstreams.servers or env UPSTREAM_SERVERS)");
            }
            if (proxyHost == null || proxyHost.isBlank()) {
                throw new ConfigLoadException("proxy.host must not be empty");
            }
            if (proxyPort < 0 || proxyPort > 65_535) {
                throw new ConfigLoadException("proxy.port must be in 0..65535, got " + proxyPort);
            }
            requirePositive("proxy.max-body-bytes", maxBodyBytes);
            requirePositive("proxy.client-idle-timeout-ms", clientIdleTimeoutMs);
            requireNonNegative("proxy.shutdown.drain-timeout-ms", shutdownDrainTimeoutMs);
            requirePositive("upstreams.connect-timeout-ms", upstreamConnectTimeoutMs);
            requirePositive("upstreams.read-timeout-ms", upstreamReadTimeoutMs);
            requireNonNegative("upstreams.max-attempts", maxAttempts);
            requirePositive("upstreams.buffer-size", bufferSize);
            requirePositive("upstreams.max-connections", maxConnectionsPerUpstream);
            requireNonNegative("upstreams.health.failure-threshold", failureThreshold);
            requireNonNegative("upstreams.health.cooldown-ms", cooldownMs);
            requirePath("status.health-path", healthPath);
            requirePath("status.ready-path", readyPath);

            String format = loggingFormat == null ? "" : loggingFormat.trim().toLowerCase(Locale.ROOT);
            if (!LOG_FORMATS.contains(format)) {
                throw new ConfigLoadException("logging.format must be text or json, got '" + loggingFormat + "'");
            }
            String level = loggingLevel == null ? "" : loggingLevel.trim().toUpperCase(Locale.ROOT);
            if (!LOG_LEVELS.contains(level)) {
                throw new ConfigLoadException("logging.level must be one of " + LOG_LEVELS + ", got '" + loggingLevel + "'");
            }

            return new ProxyConfig(
                    proxyHost.trim(),
                    proxyPort,
                    maxBodyBytes,
                    clientIdleTimeoutMs,
                    shutdownDrainTimeoutMs,
                    forwardedHeadersEnabled,
                    upstreams,
                    upstreamConnectTimeoutMs,
                    upstreamReadTimeoutMs,
                    maxAttempts,
                    retryOnTimeout,
                    bufferSize,
                    maxConnectionsPerUpstream,
                    failureThreshold,
                    cooldownMs,
                    statusEnabled,
                    healthPath,
                    readyPath,
                    format,
                    level);
        }

        private static void requirePositive(String key, int value) {
            if (value <= 0) {
                throw new ConfigLoadException(key + " must be > 0, got " + value);
            }
        }

        private static void requireNonNegative(String key, int value) {
            if (value < 0) {
                throw new ConfigLoadException(key + " must be >= 0, got " + value);
            }
        }

        private static void requirePath(String key, String value) {
            if (value == null || !value.startsWith("/")) {
                throw new ConfigLoadException(key + " must start with '/', got '" + value + "'");
            }
        }
    }
}
