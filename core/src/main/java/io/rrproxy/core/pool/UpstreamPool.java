package io.rrproxy.core.pool;

import io.rrproxy.core.error.ConfigurationException;
import io.rrproxy.core.health.HealthObserver;
import io.rrproxy.core.model.UpstreamTarget;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Ordered set of upstreams with a shared round-robin cursor.
 *
 * <p>
 * The cursor is the only mutable state and always holds an index in
 * {@code [0, size)}. Every selection claims exactly one slot through a single
 * compare-and-set, so concurrent callers never observe the same slot and none
 * is lost: over N selections each target is handed out
 * {@code floor(N / size)} or {@code ceil(N / size)} times.
 *
 * <p>
 * With a health-aware {@link HealthObserver}, ineligible targets are skipped;
 * each skip still consumes its slot, which keeps the eligible targets in
 * configured order. If no target is eligible the pool fails open and returns
 * the next target anyway.
 *
 * <p>
 * Retries within one request go through a {@link Selection}: only its first
 * pick touches the shared cursor, later picks walk forward from the slot that
 * failed. Concurrent traffic therefore cannot steer a retry back onto the
 * upstream that just failed.
 */
public final class UpstreamPool {

    private final List<UpstreamTarget> targets;
    private final HealthObserver healthObserver;
    private final AtomicInteger cursor = new AtomicInteger();

    public UpstreamPool(List<UpstreamTarget> targets) {
        this(targets, HealthObserver.noop());
    }

    /**
     * @param targets        upstreams in selection order; duplicates act as weights
     * @param healthObserver eligibility source consulted on every selection
     * @throws ConfigurationException if {@code targets} is null or empty
     */
    public UpstreamPool(List<UpstreamTarget> targets, HealthObserver healthObserver) {
        if (targets == null || targets.isEmpty()) {
            throw new ConfigurationException("Upstream list must contain at least one server");
        }
        this.targets = List.copyOf(targets);
        this.healthObserver = Objects.requireNonNull(healthObserver, "healthObserver");
    }

    /**
     * Parses a comma-separated list of {@code scheme://host:port} entries.
     *
     * @param commaSeparated the raw list, e.g. {@code http://a:8080,http://b:8080}
     * @param healthObserver eligibility source
     * @throws ConfigurationException if the list is empty or any entry is malformed
     */
    public static UpstreamPool parse(String commaSeparated, HealthObserver healthObserver) {
        return new UpstreamPool(parseTargets(commaSeparated), healthObserver);
    }

    /**
     * Parses a comma-separated upstream list without building a pool.
     *
     * @throws ConfigurationException if the list is empty or any entry is malformed
     */
    public static List<UpstreamTarget> parseTargets(String commaSeparated) {
        if (commaSeparated == null || commaSeparated.isBlank()) {
            throw new ConfigurationException("Upstream list must contain at least one server");
        }
        List<UpstreamTarget> parsed = new ArrayList<>();
        // -1 keeps trailing empty entries so they are rejected too
        for (String entry : commaSeparated.split(",", -1)) {
            parsed.add(UpstreamTarget.parse(entry));
        }
        return parsed;
    }

    /**
     * Selects the next upstream.
     *
     * @return the target at the claimed cursor slot, never {@code null}
     */
    public UpstreamTarget next() {
        return targets.get(nextSlot());
    }

    /**
     * Starts the selection sequence for one request.
     *
     * @return a selection whose first pick is {@link #next()}
     */
    public Selection select() {
        return new Selection();
    }

    private int nextSlot() {
        int size = targets.size();
        for (int i = 0; i < size; i++) {
            int slot = claimSlot(size);
            if (healthObserver.isEligible(targets.get(slot))) {
                return slot;
            }
        }
        return claimSlot(size);
    }

    private int claimSlot(int size) {
        return cursor.getAndUpdate(current -> (current + 1) % size);
    }

    /** Number of configured entries. */
    public int size() {
        return targets.size();
    }

    /** Configured entries in selection order. */
    public List<UpstreamTarget> targets() {
        return targets;
    }

    /** Number of entries the health observer currently admits. */
    public int eligibleCount() {
        int eligible = 0;
        for (UpstreamTarget target : targets) {
            if (healthObserver.isEligible(target)) {
                eligible++;
            }
        }
        return eligible;
    }

    public HealthObserver healthObserver() {
        return healthObserver;
    }

    /**
     * Upstreams for the attempts of a single request. Not thread-safe; owned
     * by the thread handling the request.
     *
     * <p>
     * The first pick claims a slot from the shared cursor. Each later pick is
     * the first entry after the previous slot, in configured order, that this
     * selection has not returned yet, preferring eligible entries. Once every
     * distinct upstream was tried the walk simply continues to the next slot.
     */
    public final class Selection {

        private final Set<UpstreamTarget> tried = new HashSet<>();
        private int slot = -1;

        private Selection() {}

        /** Returns the upstream for the next attempt. */
        public UpstreamTarget next() {
            slot = slot < 0 ? nextSlot() : slotAfter(slot);
            UpstreamTarget target = targets.get(slot);
            tried.add(target);
            return target;
        }

        private int slotAfter(int previous) {
            int size = targets.size();
            int untried = -1;
            for (int step = 1; step <= size; step++) {
                int candidate = (previous + step) % size;
                UpstreamTarget target = targets.get(candidate);
                if (tried.contains(target)) {
                    continue;
                }
                if (healthObserver.isEligible(target)) {
                    return candidate;
                }
                if (untried < 0) {
                    untried = candidate;
                }
            }
            return untried >= 0 ? untried : (previous + 1) % size;
        }
    }
}
