package io.rrproxy.standalone;

import ch.qos.logback.classic.LoggerContext;
import io.rrproxy.standalone.proxy.ProxyApp;
import java.util.function.IntConsumer;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the proxy process.
 *
 * <p>
 * Delegates to {@link ProxyApp#start(String[])}. On failure, logs the error
 * and exits with status 1. SIGTERM/SIGINT drain in-flight requests through
 * {@link ProxyApp#stop()}, flush logging and exit with status 0, or 1 when
 * the drain failed.
 *
 * <p>
 * The exit status is forced with {@link Runtime#halt(int)}: a JVM ending on a
 * signal reports 128 plus the signal number otherwise. The halt cuts short any
 * shutdown hook still running, so this process registers no other hooks and
 * logging is flushed before it.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g. {@code --config rrproxy.yaml})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        ProxyApp proxyApp;
        try {
            proxyApp = ProxyApp.start(args);
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }

        Runtime.getRuntime()
                .addShutdownHook(new Thread(
                        shutdownSequence(proxyApp::stop, StandaloneMain::flushLogging, Runtime.getRuntime()::halt),
                        "rrproxy-shutdown"));
    }

    /**
     * Drain, flush, exit: the body of the shutdown hook.
     *
     * @param stopProxy    drains and stops the proxy
     * @param flushLogging flushes and stops the logging backend
     * @param exit         receives the exit status
     */
    static Runnable shutdownSequence(Runnable stopProxy, Runnable flushLogging, IntConsumer exit) {
        return () -> {
            int status = 0;
            try {
                stopProxy.run();
            } catch (RuntimeException e) {
                LOG.error("Shutdown failed: {}", e.getMessage(), e);
                status = 1;
            }
            flushLogging.run();
            exit.accept(status);
        };
    }

    private static void flushLogging() {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext) {
            ((LoggerContext) factory).stop();
        }
    }
}
