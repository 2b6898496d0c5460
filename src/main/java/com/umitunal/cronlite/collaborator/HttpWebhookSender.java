package com.umitunal.cronlite.collaborator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Posts webhook payloads as JSON. Signed deliveries carry
 * {@code X-Signature: sha256=<hex HMAC-SHA256 of the body>}.
 */
public class HttpWebhookSender implements WebhookSender {
    private static final Logger log = LoggerFactory.getLogger(HttpWebhookSender.class);

    public static final String SIGNATURE_HEADER = "X-Signature";

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient client;
    private final ObjectMapper mapper;
    private final Duration timeout;

    public HttpWebhookSender() {
        this(HttpClient.newBuilder().connectTimeout(DEFAULT_TIMEOUT).build(), new ObjectMapper(), DEFAULT_TIMEOUT);
    }

    public HttpWebhookSender(HttpClient client, ObjectMapper mapper, Duration timeout) {
        this.client = client;
        this.mapper = mapper;
        this.timeout = timeout;
    }

    @Override
    public DeliveryResult deliver(String url, Map<String, Object> payload, String secret) {
        byte[] body;
        try {
            body = mapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            return DeliveryResult.error("Payload is not serializable: " + e.getOriginalMessage());
        }

        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(body));
        if (secret != null && !secret.isEmpty()) {
            request.header(SIGNATURE_HEADER, "sha256=" + sign(body, secret));
        }

        try {
            HttpResponse<String> response = client.send(request.build(), HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            if (status >= 200 && status < 300) {
                log.debug("Webhook delivered to {}: {}", url, status);
                return DeliveryResult.ok(status);
            }
            return DeliveryResult.error(status, "HTTP " + status);
        } catch (IOException e) {
            return DeliveryResult.error(e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DeliveryResult.error("Interrupted");
        }
    }

    static String sign(byte[] body, String secret) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(UTF_8), "HmacSHA256"));
            return HexFormat.of().formatHex(mac.doFinal(body));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }
}
