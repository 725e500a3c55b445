package io.rrproxy.standalone.proxy;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.http.HttpRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("X-Forwarded-* headers")
class ForwardedHeadersTest extends ProxyTestHarness {

    @AfterEach
    void tearDown() {
        stopInfrastructure();
    }

    @Test
    @DisplayName("Client address appended to an existing X-Forwarded-For chain")
    void forwardedFor_appended() throws Exception {
        startProxy(proxyConfig(startEchoBackend("A")).build());

        send(HttpRequest.newBuilder(proxyUri("/xff"))
                .header("X-Forwarded-For", "10.9.9.9")
                .GET()
                .build());

        ReceivedRequest received = receivedRequests.peek();
        assertThat(received.header("X-Forwarded-For")).isEqualTo("10.9.9.9, 127.0.0.1");
        assertThat(received.header("X-Forwarded-Proto")).isEqualTo("http");
        assertThat(received.header("X-Forwarded-Host")).isEqualTo("127.0.0.1:" + proxyPort);
    }

    @Test
    @DisplayName("No prior chain → X-Forwarded-For is the client address")
    void forwardedFor_started() throws Exception {
        startProxy(proxyConfig(startEchoBackend("A")).build());

        get("/fresh");

        assertThat(receivedRequests.peek().header("X-Forwarded-For")).isEqualTo("127.0.0.1");
    }

    @Test
    @DisplayName("Disabled → client-supplied values pass through, nothing added")
    void disabled_passThrough() throws Exception {
        startProxy(proxyConfig(startEchoBackend("A"))
                .forwardedHeadersEnabled(false)
                .build());

        send(HttpRequest.newBuilder(proxyUri("/off"))
                .header("X-Forwarded-For", "10.9.9.9")
                .GET()
                .build());

        ReceivedRequest received = receivedRequests.peek();
        assertThat(received.header("X-Forwarded-For")).isEqualTo("10.9.9.9");
        assertThat(received.header("X-Forwarded-Proto")).isNull();
        assertThat(received.header("X-Forwarded-Host")).isNull();
    }
}
