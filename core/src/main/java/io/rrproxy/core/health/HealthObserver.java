package io.rrproxy.core.health;

import io.rrproxy.core.model.RelayOutcome;
import io.rrproxy.core.model.UpstreamTarget;

/**
 * Observes relay outcomes per upstream and decides which upstreams may be
 * selected.
 *
 * <p>
 * Implementations MUST be thread-safe and non-blocking: {@link #isEligible}
 * runs inside every pool selection and {@link #recordOutcome} after every
 * relay attempt, from any request-handling thread.
 */
public interface HealthObserver {

    /**
     * Records the outcome of one relay attempt.
     *
     * @param target  the upstream the attempt went to
     * @param outcome the attempt's result
     */
    void recordOutcome(UpstreamTarget target, RelayOutcome outcome);

    /**
     * Returns whether {@code target} may currently be selected.
     *
     * @param target the upstream being considered
     * @return {@code true} if the pool may hand it out
     */
    boolean isEligible(UpstreamTarget target);

    /** Observer that keeps no state: every target is always eligible. */
    static HealthObserver noop() {
        return NoopHealthObserver.INSTANCE;
    }

    /** Shared stateless instance behind {@link HealthObserver#noop()}. */
    enum NoopHealthObserver implements HealthObserver {
        INSTANCE;

        @Override
        public void recordOutcome(UpstreamTarget target, RelayOutcome outcome) {}

        @Override
        public boolean isEligible(UpstreamTarget target) {
            return true;
        }
    }
}
