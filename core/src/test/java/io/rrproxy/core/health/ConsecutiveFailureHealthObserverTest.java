package io.rrproxy.core.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.rrproxy.core.model.RelayOutcome;
import io.rrproxy.core.model.UpstreamTarget;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ConsecutiveFailureHealthObserver")
class ConsecutiveFailureHealthObserverTest {

    private static final UpstreamTarget A = UpstreamTarget.parse("http://10.0.0.1:8080");
    private static final UpstreamTarget B = UpstreamTarget.parse("http://10.0.0.2:8080");

    private MutableClock clock;
    private ConsecutiveFailureHealthObserver observer;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        observer = new ConsecutiveFailureHealthObserver(3, Duration.ofSeconds(10), clock);
    }

    @Test
    @DisplayName("Threshold below 1 → IllegalArgumentException")
    void invalidThreshold() {
        assertThatThrownBy(() -> new ConsecutiveFailureHealthObserver(0, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Unknown target is eligible with a clean record")
    void unknownTarget_eligible() {
        assertThat(observer.isEligible(A)).isTrue();
        assertThat(observer.failureRecord(A)).isEqualTo(FailureRecord.CLEAN);
    }

    @Nested
    @DisplayName("Tripping")
    class Tripping {

        @Test
        @DisplayName("Below threshold → still eligible")
        void belowThreshold() {
            fail(A, 2);

            assertThat(observer.isEligible(A)).isTrue();
            assertThat(observer.failureRecord(A).consecutiveFailures()).isEqualTo(2);
        }

        @Test
        @DisplayName("At threshold → ineligible, other targets unaffected")
        void atThreshold() {
            fail(A, 3);

            assertThat(observer.isEligible(A)).isFalse();
            assertThat(observer.isEligible(B)).isTrue();
        }

        @Test
        @DisplayName("Timeouts and mid-stream failures count like unreachable")
        void allUpstreamFailuresCount() {
            observer.recordOutcome(A, RelayOutcome.timeout(A, Duration.ZERO, "idle"));
            observer.recordOutcome(A, RelayOutcome.failed(A, 200, 10, Duration.ZERO, "reset"));
            observer.recordOutcome(A, RelayOutcome.unreachable(A, Duration.ZERO, "refused"));

            assertThat(observer.isEligible(A)).isFalse();
        }

        @Test
        @DisplayName("Client disconnects do not count")
        void clientDisconnect_neutral() {
            fail(A, 2);
            observer.recordOutcome(A, RelayOutcome.clientDisconnected(A, 200, 5, Duration.ZERO));

            assertThat(observer.failureRecord(A).consecutiveFailures()).isEqualTo(2);
            assertThat(observer.isEligible(A)).isTrue();
        }

        @Test
        @DisplayName("Success resets the count")
        void success_resets() {
            fail(A, 2);
            observer.recordOutcome(A, RelayOutcome.success(A, 200, 0, Duration.ZERO));
            fail(A, 2);

            assertThat(observer.isEligible(A)).isTrue();
            assertThat(observer.failureRecord(A).consecutiveFailures()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Cooldown")
    class Cooldown {

        @Test
        @DisplayName("Re-admitted once the cooldown elapses")
        void readmittedAfterCooldown() {
            fail(A, 3);

            clock.advance(Duration.ofSeconds(9));
            assertThat(observer.isEligible(A)).isFalse();

            clock.advance(Duration.ofSeconds(1));
            assertThat(observer.isEligible(A)).isTrue();
        }

        @Test
        @DisplayName("One failure after re-admission trips again")
        void failureAfterReadmission_tripsAgain() {
            fail(A, 3);
            clock.advance(Duration.ofSeconds(10));

            fail(A, 1);

            assertThat(observer.isEligible(A)).isFalse();
            assertThat(observer.failureRecord(A).lastFailure()).isEqualTo(clock.instant());
        }

        @Test
        @DisplayName("Success after re-admission clears the record")
        void successAfterReadmission_clears() {
            fail(A, 3);
            clock.advance(Duration.ofSeconds(10));

            observer.recordOutcome(A, RelayOutcome.success(A, 204, 0, Duration.ofMillis(3)));

            assertThat(observer.failureRecord(A)).isEqualTo(FailureRecord.CLEAN);
            assertThat(observer.isEligible(A)).isTrue();
        }
    }

    @Test
    @DisplayName("noop() keeps every target eligible")
    void noopObserver() {
        HealthObserver noop = HealthObserver.noop();
        for (int i = 0; i < 5; i++) {
            noop.recordOutcome(A, RelayOutcome.unreachable(A, Duration.ZERO, "refused"));
        }

        assertThat(noop.isEligible(A)).isTrue();
    }

    private void fail(UpstreamTarget target, int times) {
        for (int i = 0; i < times; i++) {
            observer.recordOutcome(target, RelayOutcome.unreachable(target, Duration.ofMillis(1), "Connection refused"));
        }
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration by) {
            now = now.plus(by);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
