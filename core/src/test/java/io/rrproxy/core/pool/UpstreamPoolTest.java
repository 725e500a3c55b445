package io.rrproxy.core.pool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.rrproxy.core.error.ConfigurationException;
import io.rrproxy.core.health.HealthObserver;
import io.rrproxy.core.model.RelayOutcome;
import io.rrproxy.core.model.UpstreamTarget;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("UpstreamPool round-robin selection")
class UpstreamPoolTest {

    private static final UpstreamTarget A = UpstreamTarget.parse("http://10.0.0.1:8080");
    private static final UpstreamTarget B = UpstreamTarget.parse("http://10.0.0.2:8080");
    private static final UpstreamTarget C = UpstreamTarget.parse("http://10.0.0.3:8080");

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Empty list → ConfigurationException")
        void emptyList_rejected() {
            assertThatThrownBy(() -> new UpstreamPool(List.of()))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("at least one");
        }

        @Test
        @DisplayName("Null list → ConfigurationException")
        void nullList_rejected() {
            assertThatThrownBy(() -> new UpstreamPool(null)).isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("Comma-separated list parsed in order")
        void parse_commaSeparated() {
            UpstreamPool pool =
                    UpstreamPool.parse("http://10.0.0.1:8080, http://10.0.0.2:8080,http://10.0.0.3:8080", HealthObserver.noop());

            assertThat(pool.targets()).containsExactly(A, B, C);
            assertThat(pool.size()).isEqualTo(3);
        }

        @Test
        @DisplayName("Blank list → ConfigurationException")
        void parse_blank_rejected() {
            assertThatThrownBy(() -> UpstreamPool.parse("  ", HealthObserver.noop()))
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("One malformed entry rejects the whole list")
        void parse_malformedEntry_rejected() {
            assertThatThrownBy(() -> UpstreamPool.parse("http://10.0.0.1:8080,,http://10.0.0.3:8080", HealthObserver.noop()))
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("Trailing empty entry rejects the whole list")
        void parse_trailingEmptyEntry_rejected() {
            assertThatThrownBy(() -> UpstreamPool.parse("http://10.0.0.1:8080,", HealthObserver.noop()))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("empty");
        }

        @Test
        @DisplayName("Later changes to the source list do not leak into the pool")
        void defensiveCopy() {
            List<UpstreamTarget> source = new ArrayList<>(List.of(A, B));
            UpstreamPool pool = new UpstreamPool(source);

            source.add(C);

            assertThat(pool.targets()).containsExactly(A, B);
        }
    }

    @Nested
    @DisplayName("Sequential selection")
    class SequentialSelection {

        @Test
        @DisplayName("Pool [A, B, C], five selections → A, B, C, A, B")
        void fiveSelections_cycleInOrder() {
            UpstreamPool pool = new UpstreamPool(List.of(A, B, C));

            List<UpstreamTarget> picked = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                picked.add(pool.next());
            }

            assertThat(picked).containsExactly(A, B, C, A, B);
        }

        @Test
        @DisplayName("Single-target pool always returns that target")
        void singleTarget() {
            UpstreamPool pool = new UpstreamPool(List.of(A));

            for (int i = 0; i < 10; i++) {
                assertThat(pool.next()).isEqualTo(A);
            }
        }

        @ParameterizedTest(name = "N={0} over M={1}")
        @CsvSource({"0,3", "1,3", "7,3", "100,7", "1000,4", "12,12"})
        @DisplayName("Each target chosen floor(N/M) or ceil(N/M) times")
        void fairness(int n, int m) {
            List<UpstreamTarget> targets = new ArrayList<>();
            for (int i = 0; i < m; i++) {
                targets.add(new UpstreamTarget("http", "10.1.0." + i, 8080));
            }
            UpstreamPool pool = new UpstreamPool(targets);

            Map<UpstreamTarget, Integer> counts = new HashMap<>();
            for (int i = 0; i < n; i++) {
                counts.merge(pool.next(), 1, Integer::sum);
            }

            int floor = n / m;
            int ceil = (n + m - 1) / m;
            for (UpstreamTarget target : targets) {
                assertThat(counts.getOrDefault(target, 0)).isBetween(floor, ceil);
            }
        }

        @Test
        @DisplayName("Duplicate entries act as weights")
        void duplicatesActAsWeights() {
            UpstreamPool pool = new UpstreamPool(List.of(A, A, B));

            List<UpstreamTarget> picked = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                picked.add(pool.next());
            }

            assertThat(picked).containsExactly(A, A, B, A, A, B);
        }
    }

    @Nested
    @DisplayName("Concurrent selection")
    class ConcurrentSelection {

        @Test
        @DisplayName("K concurrent callers → exactly K selections, no slot lost or served twice")
        void concurrentCallers_noLostUpdates() throws Exception {
            int threads = 16;
            int perThread = 3_000;
            UpstreamPool pool = new UpstreamPool(List.of(A, B, C));

            ConcurrentLinkedQueue<UpstreamTarget> picked = new ConcurrentLinkedQueue<>();
            CountDownLatch start = new CountDownLatch(1);
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            try {
                for (int t = 0; t < threads; t++) {
                    executor.submit(() -> {
                        start.await();
                        for (int i = 0; i < perThread; i++) {
                            picked.add(pool.next());
                        }
                        return null;
                    });
                }
                start.countDown();
                executor.shutdown();
                assertThat(executor.awaitTermination(30, TimeUnit.SECONDS)).isTrue();
            } finally {
                executor.shutdownNow();
            }

            int total = threads * perThread;
            assertThat(picked).hasSize(total);

            Map<UpstreamTarget, Integer> counts = new HashMap<>();
            picked.forEach(target -> counts.merge(target, 1, Integer::sum));
            // 48000 is divisible by 3: every target gets exactly a third
            assertThat(counts).containsEntry(A, total / 3).containsEntry(B, total / 3).containsEntry(C, total / 3);

            // The cursor is back at the start: the next pick is A
            assertThat(pool.next()).isEqualTo(A);
        }
    }

    @Nested
    @DisplayName("Per-request selection")
    class PerRequestSelection {

        @Test
        @DisplayName("Retries walk on from the failed slot even when other requests move the cursor")
        void retryIgnoresSharedCursor() {
            UpstreamPool pool = new UpstreamPool(List.of(A, B, C));
            UpstreamPool.Selection selection = pool.select();

            assertThat(selection.next()).isEqualTo(A);
            // Concurrent requests take B and C
            pool.next();
            pool.next();

            assertThat(selection.next()).isEqualTo(B);
            assertThat(selection.next()).isEqualTo(C);
        }

        @Test
        @DisplayName("Only the first pick consumes a cursor slot")
        void firstPickOnly() {
            UpstreamPool pool = new UpstreamPool(List.of(A, B, C));
            UpstreamPool.Selection selection = pool.select();

            selection.next();
            selection.next();
            selection.next();

            assertThat(pool.next()).isEqualTo(B);
        }

        @Test
        @DisplayName("Duplicate entries of a tried upstream are skipped")
        void duplicatesSkipped() {
            UpstreamPool pool = new UpstreamPool(List.of(A, A, B));
            UpstreamPool.Selection selection = pool.select();

            assertThat(selection.next()).isEqualTo(A);
            assertThat(selection.next()).isEqualTo(B);
            // Everything tried: the walk continues in slot order
            assertThat(selection.next()).isEqualTo(A);
        }

        @Test
        @DisplayName("Eligible untried upstreams come before ineligible ones")
        void eligibleFirst() {
            StubObserver observer = new StubObserver();
            UpstreamPool pool = new UpstreamPool(List.of(A, B, C), observer);
            UpstreamPool.Selection selection = pool.select();

            assertThat(selection.next()).isEqualTo(A);
            observer.ineligible.add(B);

            assertThat(selection.next()).isEqualTo(C);
            assertThat(selection.next()).isEqualTo(B);
        }
    }

    @Nested
    @DisplayName("Health-aware selection")
    class HealthAwareSelection {

        @Test
        @DisplayName("Ineligible target skipped, eligible ones keep configured order")
        void ineligibleSkipped() {
            StubObserver observer = new StubObserver();
            observer.ineligible.add(B);
            UpstreamPool pool = new UpstreamPool(List.of(A, B, C), observer);

            List<UpstreamTarget> picked = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                picked.add(pool.next());
            }

            assertThat(picked).containsExactly(A, C, A, C);
            assertThat(pool.eligibleCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("All targets ineligible → fails open and keeps cycling")
        void allIneligible_failsOpen() {
            StubObserver observer = new StubObserver();
            observer.ineligible.addAll(Set.of(A, B));
            UpstreamPool pool = new UpstreamPool(List.of(A, B), observer);

            assertThat(pool.next()).isEqualTo(A);
            assertThat(pool.next()).isEqualTo(B);
            assertThat(pool.eligibleCount()).isZero();
        }

        @Test
        @DisplayName("Target becoming eligible again rejoins the rotation")
        void reAdmitted() {
            StubObserver observer = new StubObserver();
            observer.ineligible.add(A);
            UpstreamPool pool = new UpstreamPool(List.of(A, B), observer);

            assertThat(pool.next()).isEqualTo(B);
            observer.ineligible.clear();

            assertThat(pool.next()).isEqualTo(A);
            assertThat(pool.next()).isEqualTo(B);
        }
    }

    private static final class StubObserver implements HealthObserver {
        final Set<UpstreamTarget> ineligible = ConcurrentHashMap.newKeySet();

        @Override
        public void recordOutcome(UpstreamTarget target, RelayOutcome outcome) {}

        @Override
        public boolean isEligible(UpstreamTarget target) {
            return !ineligible.contains(target);
        }
    }
}
