package io.rrproxy.core.health;

import io.rrproxy.core.model.RelayOutcome;
import io.rrproxy.core.model.UpstreamTarget;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Takes an upstream out of rotation after a run of consecutive failures and
 * re-admits it once a cooldown has elapsed since its last failure.
 *
 * <p>
 * A re-admitted upstream keeps its failure count, so the first failure after
 * the cooldown makes it ineligible again; a single success clears the count.
 * Client disconnects do not affect an upstream's record.
 *
 * <p>
 * Thread-safe: each record is replaced atomically through
 * {@link ConcurrentHashMap#compute}.
 */
public final class ConsecutiveFailureHealthObserver implements HealthObserver {

    private static final Logger LOG = LoggerFactory.getLogger(ConsecutiveFailureHealthObserver.class);

    private final int failureThreshold;
    private final Duration cooldown;
    private final Clock clock;
    private final Map<UpstreamTarget, FailureRecord> records = new ConcurrentHashMap<>();

    /**
     * @param failureThreshold consecutive failures that make a target ineligible
     *                         (must be at least 1)
     * @param cooldown         how long an ineligible target stays out of rotation
     */
    public ConsecutiveFailureHealthObserver(int failureThreshold, Duration cooldown) {
        this(failureThreshold, cooldown, Clock.systemUTC());
    }

    ConsecutiveFailureHealthObserver(int failureThreshold, Duration cooldown, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, got " + failureThreshold);
        }
        if (cooldown == null || cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must be a non-negative duration");
        }
        this.failureThreshold = failureThreshold;
        this.cooldown = cooldown;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void recordOutcome(UpstreamTarget target, RelayOutcome outcome) {
        if (outcome.kind() == RelayOutcome.Kind.SUCCESS) {
            FailureRecord previous = records.remove(target);
            if (previous != null && previous.consecutiveFailures() >= failureThreshold) {
                LOG.info("Upstream {} recovered after {} consecutive failures", target, previous.consecutiveFailures());
            }
            return;
        }
        if (!outcome.isUpstreamFailure()) {
            return;
        }

        Instant now = clock.instant();
        FailureRecord updated =
                records.compute(target, (key, current) -> (current == null ? FailureRecord.CLEAN : current).failedAt(now));
        if (updated.consecutiveFailures() == failureThreshold) {
            LOG.warn(
                    "Upstream {} marked ineligible after {} consecutive failures (cooldown {} ms)",
                    target,
                    updated.consecutiveFailures(),
                    cooldown.toMillis());
        }
    }

    @Override
    public boolean isEligible(UpstreamTarget target) {
        FailureRecord record = records.get(target);
        if (record == null || record.consecutiveFailures() < failureThreshold) {
            return true;
        }
        return !clock.instant().isBefore(record.lastFailure().plus(cooldown));
    }

    /**
     * Returns the current failure record for {@code target}.
     *
     * @param target the upstream to look up
     * @return its record, {@link FailureRecord#CLEAN} if it has none
     */
    public FailureRecord failureRecord(UpstreamTarget target) {
        return records.getOrDefault(target, FailureRecord.CLEAN);
    }

    public int failureThreshold() {
        return failureThreshold;
    }

    public Duration cooldown() {
        return cooldown;
    }
}
