package com.umitunal.cronlite.collaborator;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.*;

class HttpWebhookSenderTest {

    private HttpServer server;
    private final AtomicReference<byte[]> receivedBody = new AtomicReference<>();
    private final AtomicReference<String> receivedSignature = new AtomicReference<>();
    private final AtomicInteger responseStatus = new AtomicInteger(200);
    private String url;

    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/hook", exchange -> {
            receivedBody.set(exchange.getRequestBody().readAllBytes());
            receivedSignature.set(exchange.getRequestHeaders().getFirst(HttpWebhookSender.SIGNATURE_HEADER));
            exchange.sendResponseHeaders(responseStatus.get(), -1);
            exchange.close();
        });
        server.start();
        url = "http://127.0.0.1:" + server.getAddress().getPort() + "/hook";
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    @DisplayName("Should post JSON with an HMAC signature of the body")
    void testSignedDelivery() throws Exception {
        // Given
        HttpWebhookSender sender = new HttpWebhookSender();

        // When
        DeliveryResult result = sender.deliver(url, Map.of("event", "backup.done"), "s3cret");

        // Then
        assertThat(result.isOk()).isTrue();
        assertThat(result.getStatusCode()).isEqualTo(200);

        Map<String, Object> body = new ObjectMapper().readValue(receivedBody.get(),
                new TypeReference<Map<String, Object>>() {});
        assertThat(body).containsEntry("event", "backup.done");
        assertThat(receivedSignature.get())
                .isEqualTo("sha256=" + HttpWebhookSender.sign(receivedBody.get(), "s3cret"));
    }

    @Test
    @DisplayName("Should omit the signature without a secret")
    void testUnsignedDelivery() {
        DeliveryResult result = new HttpWebhookSender().deliver(url, Map.of("event", "ping"), null);

        assertThat(result.isOk()).isTrue();
        assertThat(receivedSignature.get()).isNull();
    }

    @Test
    @DisplayName("Should report non-2xx responses as errors")
    void testErrorStatus() {
        responseStatus.set(503);

        DeliveryResult result = new HttpWebhookSender().deliver(url, Map.of("event", "ping"), null);

        assertThat(result.isOk()).isFalse();
        assertThat(result.getStatusCode()).isEqualTo(503);
        assertThat(result.getError()).isEqualTo("HTTP 503");
    }

    @Test
    @DisplayName("Should report connection failures as errors")
    void testConnectionFailure() throws Exception {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }

        DeliveryResult result = new HttpWebhookSender()
                .deliver("http://127.0.0.1:" + closedPort + "/hook", Map.of("event", "ping"), null);

        assertThat(result.isOk()).isFalse();
        assertThat(result.getStatusCode()).isEqualTo(-1);
    }

    @Test
    @DisplayName("Should compute the RFC 4231 HMAC-SHA256 test vector")
    void testSignKnownVector() {
        String signature = HttpWebhookSender.sign("what do ya want for nothing?".getBytes(UTF_8), "Jefe");

        assertThat(signature).isEqualTo("5bdcc146bf60754e6a042426089575c75a003f089d2739839dec58b964ec3843");
    }
}
