package io.rrproxy.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link ProxyConfig} from an optional YAML file with an environment
 * variable overlay.
 *
 * <p>
 * File resolution:
 * <ul>
 * <li>{@code --config /path/to/config.yaml}: that file, which must exist</li>
 * <li>otherwise {@code rrproxy.yaml} in the working directory, if present</li>
 * <li>otherwise no file: environment variables and defaults only</li>
 * </ul>
 *
 * <p>
 * Environment variables take precedence over YAML values. A variable counts
 * as "set" only when it is defined and its trimmed value is non-empty; blank
 * values leave the YAML value in place. Variables missing from the process
 * environment are looked up in an optional {@value #DOTENV_FILE} file in the
 * working directory.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String DEFAULT_CONFIG_FILE = "rrproxy.yaml";
    static final String DOTENV_FILE = ".env";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from {@code configPath} (may be {@code null}) with
     * overrides from the environment and {@code ./.env}.
     */
    public static ProxyConfig load(Path configPath) {
        return load(configPath, environment(Path.of(".")));
    }

    /**
     * Environment lookup: the process environment first, then the entries of
     * {@code directory/.env} when that file exists.
     *
     * @throws ConfigLoadException if the file exists but cannot be parsed
     */
    static Function<String, String> environment(Path directory) {
        try {
            Dotenv dotenv = Dotenv.configure()
                    .directory(directory.toString())
                    .filename(DOTENV_FILE)
                    .ignoreIfMissing()
                    .load();
            return dotenv::get;
        } catch (DotenvException e) {
            throw new ConfigLoadException(
                    "Failed to read " + directory.resolve(DOTENV_FILE) + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads configuration from {@code configPath} with overrides from the
     * supplied lookup.
     *
     * @param configPath YAML file, or {@code null} to use the environment alone
     * @param envLookup  environment variable lookup; {@code null} means undefined
     * @return the validated configuration
     * @throws ConfigLoadException if the file is missing, unreadable, or any
     *                             value is invalid
     */
    public static ProxyConfig load(Path configPath, Function<String, String> envLookup) {
        JsonNode root = MissingNode.getInstance();
        if (configPath != null) {
            if (!Files.exists(configPath)) {
                throw new ConfigLoadException(
                        "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
            }
            try (InputStream in = Files.newInputStream(configPath)) {
                JsonNode parsed = YAML_MAPPER.readTree(in);
                if (parsed != null) {
                    root = parsed;
                }
            } catch (IOException e) {
                throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
            }
        }
        return mapToConfig(root, envLookup);
    }

    /**
     * Resolves the config file from CLI arguments.
     *
     * @param args command-line arguments
     * @return the file to load, or {@code null} when neither {@code --config}
     *         was given nor {@value #DEFAULT_CONFIG_FILE} exists
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new ConfigLoadException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        Path fallback = Path.of(DEFAULT_CONFIG_FILE);
        return Files.exists(fallback) ? fallback : null;
    }

    private static ProxyConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        ProxyConfig.Builder builder = ProxyConfig.builder();

        // --- YAML mapping ---

        JsonNode proxy = root.path("proxy");
        yamlString(proxy, "host", "proxy.host", builder::proxyHost);
        yamlInt(proxy, "port", "proxy.port", builder::proxyPort);
        yamlInt(proxy, "max-body-bytes", "proxy.max-body-bytes", builder::maxBodyBytes);
        yamlInt(proxy, "client-idle-timeout-ms", "proxy.client-idle-timeout-ms", builder::clientIdleTimeoutMs);
        yamlInt(
                proxy.path("shutdown"),
                "drain-timeout-ms",
                "proxy.shutdown.drain-timeout-ms",
                builder::shutdownDrainTimeoutMs);
        yamlBool(
                proxy.path("forwarded-headers"),
                "enabled",
                "proxy.forwarded-headers.enabled",
                builder::forwardedHeadersEnabled);

        JsonNode upstreams = root.path("upstreams");
        if (upstreams.has("servers")) {
            builder.upstreamServers(serverList(upstreams.get("servers")));
        }
        yamlInt(upstreams, "connect-timeout-ms", "upstreams.connect-timeout-ms", builder::upstreamConnectTimeoutMs);
        yamlInt(upstreams, "read-timeout-ms", "upstreams.read-timeout-ms", builder::upstreamReadTimeoutMs);
        yamlInt(upstreams, "max-attempts", "upstreams.max-attempts", builder::maxAttempts);
        yamlBool(upstreams, "retry-on-timeout", "upstreams.retry-on-timeout", builder::retryOnTimeout);
        yamlInt(upstreams, "buffer-size", "upstreams.buffer-size", builder::bufferSize);
        yamlInt(upstreams, "max-connections", "upstreams.max-connections", builder::maxConnectionsPerUpstream);
        JsonNode health = upstreams.path("health");
        yamlInt(health, "failure-threshold", "upstreams.health.failure-threshold", builder::failureThreshold);
        yamlInt(health, "cooldown-ms", "upstreams.health.cooldown-ms", builder::cooldownMs);

        JsonNode status = root.path("status");
        yamlBool(status, "enabled", "status.enabled", builder::statusEnabled);
        yamlString(status, "health-path", "status.health-path", builder::healthPath);
        yamlString(status, "ready-path", "status.ready-path", builder::readyPath);

        JsonNode logging = root.path("logging");
        yamlString(logging, "format", "logging.format", builder::loggingFormat);
        yamlString(logging, "level", "logging.level", builder::loggingLevel);

        // --- Environment variable overlay ---

        envString(envLookup, "PROXY_HOST", builder::proxyHost);
        envInt(envLookup, "LISTEN_PORT", builder::proxyPort);
        envInt(envLookup, "PROXY_MAX_BODY_BYTES", builder::maxBodyBytes);
        envInt(envLookup, "PROXY_CLIENT_IDLE_TIMEOUT_MS", builder::clientIdleTimeoutMs);
        envInt(envLookup, "PROXY_SHUTDOWN_DRAIN_TIMEOUT_MS", builder::shutdownDrainTimeoutMs);
        envBool(envLookup, "PROXY_FORWARDED_HEADERS_ENABLED", builder::forwardedHeadersEnabled);

        envString(envLookup, "UPSTREAM_SERVERS", builder::upstreamServers);
        envInt(envLookup, "UPSTREAM_CONNECT_TIMEOUT_MS", builder::upstreamConnectTimeoutMs);
        envInt(envLookup, "UPSTREAM_READ_TIMEOUT_MS", builder::upstreamReadTimeoutMs);
        envInt(envLookup, "UPSTREAM_MAX_ATTEMPTS", builder::maxAttempts);
        envBool(envLookup, "UPSTREAM_RETRY_ON_TIMEOUT", builder::retryOnTimeout);
        envInt(envLookup, "UPSTREAM_BUFFER_SIZE", builder::bufferSize);
        envInt(envLookup, "UPSTREAM_MAX_CONNECTIONS", builder::maxConnectionsPerUpstream);
        envInt(envLookup, "UPSTREAM_FAILURE_THRESHOLD", builder::failureThreshold);
        envInt(envLookup, "UPSTREAM_COOLDOWN_MS", builder::cooldownMs);

        envBool(envLookup, "STATUS_ENABLED", builder::statusEnabled);
        envString(envLookup, "STATUS_HEALTH_PATH", builder::healthPath);
        envString(envLookup, "STATUS_READY_PATH", builder::readyPath);

        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);

        return builder.build();
    }

    /** Accepts either a comma-separated string or a YAML sequence of entries. */
    private static String serverList(JsonNode servers) {
        if (servers.isArray()) {
            List<String> entries = new ArrayList<>();
            servers.forEach(entry -> entries.add(entry.asText()));
            return String.join(",", entries);
        }
        if (servers.isValueNode()) {
            return servers.asText();
        }
        throw new ConfigLoadException("upstreams.servers must be a string or a list of strings");
    }

    // --- YAML helpers ---

    private static void yamlString(JsonNode node, String field, String key, Consumer<String> setter) {
        if (!node.has(field)) {
            return;
        }
        JsonNode value = node.get(field);
        if (!value.isValueNode()) {
            throw new ConfigLoadException(key + " must be a scalar value");
        }
        setter.accept(value.asText());
    }

    private static void yamlInt(JsonNode node, String field, String key, IntConsumer setter) {
        if (!node.has(field)) {
            return;
        }
        JsonNode value = node.get(field);
        if (value.isIntegralNumber() && value.canConvertToInt()) {
            setter.accept(value.asInt());
        } else if (value.isTextual()) {
            setter.accept(parseInt(key, value.asText()));
        } else {
            throw new ConfigLoadException(key + " must be an integer, got '" + value.asText() + "'");
        }
    }

    private static void yamlBool(JsonNode node, String field, String key, Consumer<Boolean> setter) {
        if (!node.has(field)) {
            return;
        }
        JsonNode value = node.get(field);
        if (value.isBoolean()) {
            setter.accept(value.asBoolean());
        } else {
            setter.accept(parseBoolean(key, value.asText()));
        }
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(parseInt(envVar, envLookup.apply(envVar).trim()));
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(parseBoolean(envVar, envLookup.apply(envVar).trim()));
        }
    }

    private static int parseInt(String key, String text) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new ConfigLoadException(key + " must be an integer, got '" + text + "'", e);
        }
    }

    private static boolean parseBoolean(String key, String text) {
        String trimmed = text.trim();
        if ("true".equalsIgnoreCase(trimmed)) {
            return true;
        }
        if ("false".equalsIgnoreCase(trimmed)) {
            return false;
        }
        throw new ConfigLoadException(key + " must be true or false, got '" + text + "'");
    }
}
