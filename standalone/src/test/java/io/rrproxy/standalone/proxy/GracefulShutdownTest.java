package io.rrproxy.standalone.proxy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.OutputStream;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Graceful shutdown")
class GracefulShutdownTest extends ProxyTestHarness {

    @AfterEach
    void tearDown() {
        stopInfrastructure();
    }

    @Test
    @DisplayName("In-flight request completes across stop(); new connections are refused afterwards")
    void inFlightDrained() throws Exception {
        CountDownLatch hit = new CountDownLatch(1);
        String slow = startBackend("slow", exchange -> {
            hit.countDown();
            try {
                Thread.sleep(1500);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            byte[] bytes = "drained".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        startProxy(proxyConfig(slow).shutdownDrainTimeoutMs(10_000).build());

        CompletableFuture<HttpResponse<String>> inFlight = testClient.sendAsync(
                HttpRequest.newBuilder(proxyUri("/long")).GET().build(), HttpResponse.BodyHandlers.ofString());
        assertThat(hit.await(5, TimeUnit.SECONDS)).isTrue();

        proxyApp.stop();

        HttpResponse<String> response = inFlight.get(10, TimeUnit.SECONDS);
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("drained");

        assertThatThrownBy(() -> get("/after")).isInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("stop() is idempotent")
    void stopTwice() throws Exception {
        startProxy(proxyConfig(startEchoBackend("A")).build());

        proxyApp.stop();

        assertThatCode(proxyApp::stop).doesNotThrowAnyException();
    }
}
