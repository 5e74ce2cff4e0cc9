package com.tracker.application.service;

import java.util.UUID;

/**
 * Final result of delivering one event to one subscription.
 *
 * @param statusCode last HTTP status received, 0 if the endpoint never answered
 */
public record DeliveryOutcome(
    UUID subscriptionId,
    String url,
    boolean delivered,
    int attempts,
    int statusCode,
    String failureReason
) {

    public static DeliveryOutcome delivered(UUID subscriptionId, String url, int attempts, int statusCode) {
        return new DeliveryOutcome(subscriptionId, url, true, attempts, statusCode, null);
    }

    public static DeliveryOutcome failed(UUID subscriptionId, String url, int attempts, int statusCode, String reason) {
        return new DeliveryOutcome(subscriptionId, url, false, attempts, statusCode, reason);
    }
}
