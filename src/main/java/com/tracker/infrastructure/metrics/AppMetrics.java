package com.tracker.infrastructure.metrics;

import com.tracker.application.port.out.MetricsPort;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class AppMetrics implements MetricsPort {

    private final Counter keysAllocated;
    private final Counter deliveryAttempts;
    private final Counter deliveriesSucceeded;
    private final Counter deliveriesFailed;
    private final Timer deliveryDuration;

    public AppMetrics(MeterRegistry registry) {
        this.keysAllocated = Counter.builder("keys_allocated_total")
            .description("Total number of entity keys allocated")
            .register(registry);

        this.deliveryAttempts = Counter.builder("webhook_delivery_attempts_total")
            .description("Total number of webhook delivery attempts, retries included")
            .register(registry);

        this.deliveriesSucceeded = Counter.builder("webhook_deliveries_succeeded_total")
            .description("Webhook deliveries that eventually succeeded")
            .register(registry);

        this.deliveriesFailed = Counter.builder("webhook_deliveries_failed_total")
            .description("Webhook deliveries abandoned after a permanent failure or exhausted retries")
            .register(registry);

        this.deliveryDuration = Timer.builder("webhook_delivery_duration_seconds")
            .description("Time from first attempt to final outcome of a webhook delivery")
            .register(registry);
    }

    @Override
    public void incrementKeysAllocated() {
        keysAllocated.increment();
    }

    @Override
    public void incrementWebhookDeliveryAttempts() {
        deliveryAttempts.increment();
    }

    @Override
    public void incrementWebhookDeliveriesSucceeded() {
        deliveriesSucceeded.increment();
    }

    @Override
    public void incrementWebhookDeliveriesFailed() {
        deliveriesFailed.increment();
    }

    @Override
    public void recordWebhookDeliveryDuration(Duration duration) {
        deliveryDuration.record(duration);
    }
}
