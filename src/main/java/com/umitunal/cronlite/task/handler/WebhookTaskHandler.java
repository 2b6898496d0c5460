package com.umitunal.cronlite.task.handler;

import com.umitunal.cronlite.collaborator.DeliveryResult;
import com.umitunal.cronlite.collaborator.WebhookSender;
import com.umitunal.cronlite.core.JobConfig;
import com.umitunal.cronlite.task.TaskHandler;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Delivers a payload to a webhook URL.
 *
 * Config: {@code url} (required), {@code payload} (map), {@code secret}
 * (falls back to the configured default secret).
 */
public class WebhookTaskHandler implements TaskHandler {
    public static final String URL = "url";
    public static final String PAYLOAD = "payload";
    public static final String SECRET = "secret";

    private final WebhookSender sender;
    private final String defaultSecret;
    private final Clock clock;

    public WebhookTaskHandler(WebhookSender sender, String defaultSecret, Clock clock) {
        this.sender = sender;
        this.defaultSecret = defaultSecret;
        this.clock = clock;
    }

    @Override
    public TaskResult execute(JobConfig config) {
        String url = config.getString(URL, null);
        if (url == null || url.isBlank()) {
            return TaskResult.failure("Webhook url is not configured");
        }

        Map<String, Object> payload = new LinkedHashMap<>(config.getMap(PAYLOAD));
        payload.putIfAbsent("timestamp", clock.millis());

        DeliveryResult result = sender.deliver(url, payload, config.getString(SECRET, defaultSecret));
        if (!result.isOk()) {
            return TaskResult.failure("Webhook delivery to " + url + " failed: " + result.getError());
        }
        return TaskResult.success("Webhook delivered to " + url + " (" + result.getStatusCode() + ")");
    }
}
