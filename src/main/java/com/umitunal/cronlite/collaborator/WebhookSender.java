package com.umitunal.cronlite.collaborator;

import java.util.Map;

/**
 * Delivers notification payloads to subscriber URLs.
 */
public interface WebhookSender {

    /**
     * @param secret signing secret, or null to send unsigned
     */
    DeliveryResult deliver(String url, Map<String, Object> payload, String secret);
}
