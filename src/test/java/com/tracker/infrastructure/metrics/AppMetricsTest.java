package com.tracker.infrastructure.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AppMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final AppMetrics metrics = new AppMetrics(registry);

    @Test
    void shouldCountKeysAndDeliveries() {
        metrics.incrementKeysAllocated();
        metrics.incrementWebhookDeliveryAttempts();
        metrics.incrementWebhookDeliveryAttempts();
        metrics.incrementWebhookDeliveriesSucceeded();
        metrics.incrementWebhookDeliveriesFailed();

        assertEquals(1.0, registry.get("keys_allocated_total").counter().count());
        assertEquals(2.0, registry.get("webhook_delivery_attempts_total").counter().count());
        assertEquals(1.0, registry.get("webhook_deliveries_succeeded_total").counter().count());
        assertEquals(1.0, registry.get("webhook_deliveries_failed_total").counter().count());
    }

    @Test
    void shouldRecordDeliveryDuration() {
        metrics.recordWebhookDeliveryDuration(Duration.ofMillis(250));

        var timer = registry.get("webhook_delivery_duration_seconds").timer();
        assertEquals(1, timer.count());
        assertEquals(250.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
    }
}
