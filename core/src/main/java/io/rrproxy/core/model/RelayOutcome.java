package io.rrproxy.core.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of relaying one request to one upstream.
 *
 * <p>
 * Failures that happen before any response byte reached the client
 * ({@link Kind#UPSTREAM_UNREACHABLE}, {@link Kind#UPSTREAM_TIMEOUT}) leave the
 * client untouched, so the caller may retry elsewhere. The remaining failure
 * kinds are terminal for the exchange.
 *
 * @param kind          what happened
 * @param target        the upstream the attempt went to
 * @param status        upstream status code, or {@code 0} when none was received
 * @param bytesRelayed  response body bytes written to the client
 * @param duration      wall-clock time spent on the attempt
 * @param detail        human-readable failure description, {@code null} on success
 */
public record RelayOutcome(
        Kind kind, UpstreamTarget target, int status, long bytesRelayed, Duration duration, String detail) {

    /** Outcome categories. */
    public enum Kind {
        /** Response fully relayed. */
        SUCCESS,
        /** Connect failed or the upstream dropped the exchange before responding. */
        UPSTREAM_UNREACHABLE,
        /** Upstream accepted the connection but stayed idle past the read timeout. */
        UPSTREAM_TIMEOUT,
        /** Upstream failed after part of the response had been relayed. */
        UPSTREAM_FAILED,
        /** Client went away; the upstream exchange was abandoned. */
        CLIENT_DISCONNECTED
    }

    public RelayOutcome {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(duration, "duration");
    }

    public static RelayOutcome success(UpstreamTarget target, int status, long bytesRelayed, Duration duration) {
        return new RelayOutcome(Kind.SUCCESS, target, status, bytesRelayed, duration, null);
    }

    public static RelayOutcome unreachable(UpstreamTarget target, Duration duration, String detail) {
        return new RelayOutcome(Kind.UPSTREAM_UNREACHABLE, target, 0, 0, duration, detail);
    }

    public static RelayOutcome timeout(UpstreamTarget target, Duration duration, String detail) {
        return new RelayOutcome(Kind.UPSTREAM_TIMEOUT, target, 0, 0, duration, detail);
    }

    public static RelayOutcome failed(
            UpstreamTarget target, int status, long bytesRelayed, Duration duration, String detail) {
        return new RelayOutcome(Kind.UPSTREAM_FAILED, target, status, bytesRelayed, duration, detail);
    }

    public static RelayOutcome clientDisconnected(
            UpstreamTarget target, int status, long bytesRelayed, Duration duration) {
        return new RelayOutcome(Kind.CLIENT_DISCONNECTED, target, status, bytesRelayed, duration, null);
    }

    /** {@code true} when the client saw nothing and another upstream may be tried. */
    public boolean isRetryable() {
        return kind == Kind.UPSTREAM_UNREACHABLE || kind == Kind.UPSTREAM_TIMEOUT;
    }

    /** {@code true} for outcomes that count against the upstream's health. */
    public boolean isUpstreamFailure() {
        return kind == Kind.UPSTREAM_UNREACHABLE || kind == Kind.UPSTREAM_TIMEOUT || kind == Kind.UPSTREAM_FAILED;
    }
}
