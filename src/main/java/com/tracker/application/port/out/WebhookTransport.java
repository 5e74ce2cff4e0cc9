package com.tracker.application.port.out;

import com.tracker.domain.model.DeliveryAttempt;

import java.util.concurrent.CompletableFuture;

/**
 * Port for sending one delivery attempt to a subscriber endpoint.
 */
public interface WebhookTransport {

    /**
     * POSTs the attempt's body to the subscription URL with a bounded timeout.
     *
     * @return future of the HTTP status code; completes exceptionally with a retryable
     *         {@link com.tracker.infrastructure.exception.DeliveryException} when no response was received
     */
    CompletableFuture<Integer> deliver(DeliveryAttempt attempt);
}
