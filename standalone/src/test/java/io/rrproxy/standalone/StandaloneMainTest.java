package io.rrproxy.standalone;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Shutdown sequence")
class StandaloneMainTest {

    private final List<String> steps = new ArrayList<>();

    @Test
    @DisplayName("Drain, then flush logging, then exit 0")
    void cleanShutdown() {
        StandaloneMain.shutdownSequence(
                        () -> steps.add("stop"), () -> steps.add("flush"), status -> steps.add("exit " + status))
                .run();

        assertThat(steps).containsExactly("stop", "flush", "exit 0");
    }

    @Test
    @DisplayName("Failed drain still flushes logging, then exits 1")
    void failedShutdown() {
        StandaloneMain.shutdownSequence(
                        () -> {
                            throw new IllegalStateException("listener stuck");
                        },
                        () -> steps.add("flush"),
                        status -> steps.add("exit " + status))
                .run();

        assertThat(steps).containsExactly("flush", "exit 1");
    }
}
