package io.rrproxy.standalone.proxy;

import io.javalin.Javalin;
import io.javalin.http.HandlerType;
import io.rrproxy.core.health.ConsecutiveFailureHealthObserver;
import io.rrproxy.core.health.HealthObserver;
import io.rrproxy.core.pool.UpstreamPool;
import io.rrproxy.standalone.config.ConfigLoader;
import io.rrproxy.standalone.config.ProxyConfig;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import org.eclipse.jetty.server.HttpConnectionFactory;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.server.handler.StatisticsHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates the proxy startup sequence.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>Load configuration from YAML + env overlay</li>
 * <li>Configure logging</li>
 * <li>Build the upstream pool and its health observer</li>
 * <li>Start the upstream client</li>
 * <li>Start the Javalin listener</li>
 * </ol>
 *
 * <p>
 * This class is separate from {@link io.rrproxy.standalone.StandaloneMain}
 * to allow clean integration testing without going through {@code main()}.
 */
public final class ProxyApp {

    private static final Logger LOG = LoggerFactory.getLogger(ProxyApp.class);

    /** HTTP methods accepted by the proxy. */
    static final Set<String> ALLOWED_METHODS = Set.of("GET", "POST", "PUT", "DELETE", "PATCH", "HEAD", "OPTIONS");

    private static final List<HandlerType> PROXIED_HANDLER_TYPES = List.of(
            HandlerType.GET,
            HandlerType.POST,
            HandlerType.PUT,
            HandlerType.DELETE,
            HandlerType.PATCH,
            HandlerType.HEAD,
            HandlerType.OPTIONS);

    private final Javalin app;
    private final ConnectionForwarder forwarder;
    private final UpstreamPool pool;
    private final ProxyConfig config;
    private final AtomicBoolean stopped = new AtomicBoolean();

    private ProxyApp(Javalin app, ConnectionForwarder forwarder, UpstreamPool pool, ProxyConfig config) {
        this.app = app;
        this.forwarder = forwarder;
        this.pool = pool;
        this.config = config;
    }

    /**
     * Loads configuration and starts the proxy.
     *
     * @param args command-line arguments (e.g. {@code --config rrproxy.yaml})
     * @return a running proxy application
     * @throws Exception if any startup step fails
     */
    public static ProxyApp start(String[] args) throws Exception {
        Path configPath = ConfigLoader.resolveConfigPath(args);
        ProxyConfig config = ConfigLoader.load(configPath);

        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.info("Configuration loaded from {}", configPath != null ? configPath : "environment");

        return start(config);
    }

    /**
     * Starts the proxy with an already-built configuration.
     *
     * @param config validated configuration
     * @return a running proxy application
     * @throws Exception if the upstream client or the listener fails to start
     */
    public static ProxyApp start(ProxyConfig config) throws Exception {
        long startTime = System.nanoTime();

        HealthObserver healthObserver = config.failureThreshold() > 0
                ? new ConsecutiveFailureHealthObserver(
                        config.failureThreshold(), Duration.ofMillis(config.cooldownMs()))
                : HealthObserver.noop();
        UpstreamPool pool = new UpstreamPool(config.upstreams(), healthObserver);

        ConnectionForwarder forwarder = new ConnectionForwarder(config);
        forwarder.start();

        Javalin app;
        try {
            app = createListener(config, pool, new ProxyHandler(pool, forwarder, config));
            app.start();
        } catch (Exception e) {
            // Javalin reports a failed bind as a checked exception
            forwarder.stop();
            throw e;
        }

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info(
                "rrproxy started: listen={}:{}, upstreams={}, attempts={}, connectTimeoutMs={}, readTimeoutMs={}, startupMs={}",
                config.proxyHost(),
                app.port(),
                config.upstreams(),
                config.effectiveAttempts(),
                config.upstreamConnectTimeoutMs(),
                config.upstreamReadTimeoutMs(),
                elapsedMs);

        return new ProxyApp(app, forwarder, pool, config);
    }

    private static Javalin createListener(ProxyConfig config, UpstreamPool pool, ProxyHandler proxyHandler) {
        Javalin app = Javalin.create(javalinConfig -> {
            javalinConfig.showJavalinBanner = false;
            javalinConfig.http.prefer405over404 = true;
            javalinConfig.jetty.modifyServer(server -> {
                // Graceful stop waits for in-flight requests tracked here
                server.setHandler(new StatisticsHandler());
                server.setStopTimeout(config.shutdownDrainTimeoutMs());
            });
            javalinConfig.jetty.addConnector((server, httpConfig) -> {
                httpConfig.setSendServerVersion(false);
                ServerConnector connector = new ServerConnector(server, new HttpConnectionFactory(httpConfig));
                connector.setHost(config.proxyHost());
                connector.setPort(config.proxyPort());
                connector.setIdleTimeout(config.clientIdleTimeoutMs());
                return connector;
            });
        });

        // Status endpoints take precedence over the proxy wildcard
        if (config.statusEnabled()) {
            app.get(config.healthPath(), new HealthHandler());
            app.get(config.readyPath(), new ReadinessHandler(pool));
        }

        app.before(ctx -> {
            String method = ctx.req().getMethod();
            if (!ALLOWED_METHODS.contains(method)) {
                ctx.status(405);
                ctx.contentType(ProblemDetail.CONTENT_TYPE);
                ctx.result(ProblemDetail.methodNotAllowed("HTTP method " + method + " is not supported", ctx.path())
                        .toString());
                ctx.skipRemainingHandlers();
            }
        });
        for (HandlerType type : PROXIED_HANDLER_TYPES) {
            app.addHttpHandler(type, "/", proxyHandler);
            app.addHttpHandler(type, "/<path>", proxyHandler);
        }
        return app;
    }

    /** Returns the port the proxy is listening on. */
    public int port() {
        return app.port();
    }

    /** Returns the upstream pool. */
    public UpstreamPool pool() {
        return pool;
    }

    /** Returns the proxy configuration. */
    public ProxyConfig config() {
        return config;
    }

    /**
     * Stops the listener, waiting up to the drain timeout for in-flight
     * requests, then closes upstream connections. Safe to call more than once.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        LOG.info("rrproxy stopping (drain timeout {} ms)", config.shutdownDrainTimeoutMs());
        app.stop();
        forwarder.stop();
        LOG.info("rrproxy stopped");
    }
}
