package com.tracker.domain.model;

/**
 * One attempt to deliver an event to a subscription. Not persisted.
 *
 * @param body serialized JSON request body, identical across retries
 * @param attemptNumber 1-based
 */
public record DeliveryAttempt(
    WebhookSubscription subscription,
    String eventName,
    String body,
    int attemptNumber
) {

    public static DeliveryAttempt first(WebhookSubscription subscription, String eventName, String body) {
        return new DeliveryAttempt(subscription, eventName, body, 1);
    }

    public DeliveryAttempt next() {
        return new DeliveryAttempt(subscription, eventName, body, attemptNumber + 1);
    }
}
