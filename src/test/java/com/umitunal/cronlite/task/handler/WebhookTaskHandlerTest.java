package com.umitunal.cronlite.task.handler;

import com.umitunal.cronlite.collaborator.DeliveryResult;
import com.umitunal.cronlite.collaborator.WebhookSender;
import com.umitunal.cronlite.core.JobConfig;
import com.umitunal.cronlite.task.TaskHandler.TaskResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class WebhookTaskHandlerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);

    @Test
    @DisplayName("Should deliver payload with timestamp and default secret")
    void testDelivery() {
        // Given
        RecordingSender sender = new RecordingSender(DeliveryResult.ok(204));
        WebhookTaskHandler handler = new WebhookTaskHandler(sender, "default-secret", CLOCK);
        JobConfig config = JobConfig.of(WebhookTaskHandler.URL, "http://example.test/hook")
                .with(WebhookTaskHandler.PAYLOAD, Map.of("event", "nightly"));

        // When
        TaskResult result = handler.execute(config);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMessage()).isEqualTo("Webhook delivered to http://example.test/hook (204)");
        assertThat(sender.url).isEqualTo("http://example.test/hook");
        assertThat(sender.secret).isEqualTo("default-secret");
        assertThat(sender.payload)
                .containsEntry("event", "nightly")
                .containsEntry("timestamp", CLOCK.millis());
    }

    @Test
    @DisplayName("Should prefer the job's own secret")
    void testJobSecret() {
        RecordingSender sender = new RecordingSender(DeliveryResult.ok(200));
        WebhookTaskHandler handler = new WebhookTaskHandler(sender, "default-secret", CLOCK);

        handler.execute(JobConfig.of(WebhookTaskHandler.URL, "http://example.test/hook")
                .with(WebhookTaskHandler.SECRET, "job-secret"));

        assertThat(sender.secret).isEqualTo("job-secret");
    }

    @Test
    @DisplayName("Should fail when the endpoint rejects the delivery")
    void testRejectedDelivery() {
        RecordingSender sender = new RecordingSender(DeliveryResult.error(500, "HTTP 500"));
        WebhookTaskHandler handler = new WebhookTaskHandler(sender, null, CLOCK);

        TaskResult result = handler.execute(JobConfig.of(WebhookTaskHandler.URL, "http://example.test/hook"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage()).contains("HTTP 500");
    }

    @Test
    @DisplayName("Should fail without a url and never call the sender")
    void testMissingUrl() {
        RecordingSender sender = new RecordingSender(DeliveryResult.ok(200));
        WebhookTaskHandler handler = new WebhookTaskHandler(sender, null, CLOCK);

        TaskResult result = handler.execute(JobConfig.empty());

        assertThat(result.isSuccess()).isFalse();
        assertThat(sender.url).isNull();
    }

    static class RecordingSender implements WebhookSender {
        private final DeliveryResult result;
        String url;
        Map<String, Object> payload;
        String secret;

        RecordingSender(DeliveryResult result) {
            this.result = result;
        }

        @Override
        public DeliveryResult deliver(String url, Map<String, Object> payload, String secret) {
            this.url = url;
            this.payload = payload;
            this.secret = secret;
            return result;
        }
    }
}
