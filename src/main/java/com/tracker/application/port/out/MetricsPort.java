package com.tracker.application.port.out;

import java.time.Duration;

/**
 * Port for recording application metrics.
 */
public interface MetricsPort {

    void incrementKeysAllocated();

    void incrementWebhookDeliveryAttempts();

    void incrementWebhookDeliveriesSucceeded();

    void incrementWebhookDeliveriesFailed();

    void recordWebhookDeliveryDuration(Duration duration);
}
