package io.rrproxy.core.health;

import java.time.Instant;

/**
 * Snapshot of an upstream's failure history.
 *
 * @param consecutiveFailures failures since the last success
 * @param lastFailure         when the latest failure was recorded, {@code null}
 *                            if there has been none
 */
public record FailureRecord(int consecutiveFailures, Instant lastFailure) {

    /** Record for an upstream with a clean history. */
    public static final FailureRecord CLEAN = new FailureRecord(0, null);

    FailureRecord failedAt(Instant when) {
        return new FailureRecord(consecutiveFailures + 1, when);
    }
}
