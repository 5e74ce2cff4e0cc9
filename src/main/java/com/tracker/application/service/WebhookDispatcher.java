package com.tracker.application.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracker.application.port.in.TriggerWebhooksUseCase;
import com.tracker.application.port.out.MetricsPort;
import com.tracker.application.port.out.WebhookRepository;
import com.tracker.application.port.out.WebhookTransport;
import com.tracker.domain.model.DeliveryAttempt;
import com.tracker.domain.model.WebhookEventName;
import com.tracker.domain.model.WebhookSubscription;
import com.tracker.infrastructure.exception.DeliveryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Fans an event out to every matching subscription.
 *
 * <p>Deliveries to different subscriptions run concurrently and independently. Attempts for
 * one subscription are strictly sequential and follow the {@link RetryPolicy}. Nothing that
 * goes wrong here, including a failed registry lookup, is propagated to the caller.
 */
@Service
public class WebhookDispatcher implements TriggerWebhooksUseCase {

    private static final Logger log = LoggerFactory.getLogger(WebhookDispatcher.class);

    private final WebhookRepository webhookRepository;
    private final WebhookTransport transport;
    private final RetryPolicy retryPolicy;
    private final Executor executor;
    private final ObjectMapper objectMapper;
    private final MetricsPort metrics;

    public WebhookDispatcher(
            WebhookRepository webhookRepository,
            WebhookTransport transport,
            RetryPolicy webhookRetryPolicy,
            @Qualifier("webhookExecutor") Executor executor,
            ObjectMapper objectMapper,
            MetricsPort metrics) {
        this.webhookRepository = webhookRepository;
        this.transport = transport;
        this.retryPolicy = webhookRetryPolicy;
        this.executor = executor;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    @Override
    public CompletableFuture<Void> trigger(String eventName, Object payload) {
        return dispatch(eventName, payload).thenAccept(outcomes -> { });
    }

    /**
     * Same as {@link #trigger} but exposes the per-subscription outcomes.
     */
    public CompletableFuture<List<DeliveryOutcome>> dispatch(String eventName, Object payload) {
        CompletableFuture<List<WebhookSubscription>> lookup;
        try {
            lookup = CompletableFuture.supplyAsync(webhookRepository::findAll, executor);
        } catch (RejectedExecutionException e) {
            log.error("Webhook executor rejected event={}, no notifications sent", eventName);
            return CompletableFuture.completedFuture(List.of());
        }

        return lookup
            .handle((subscriptions, error) -> {
                if (error != null) {
                    log.error("Webhook lookup failed for event={}, no notifications sent: {}",
                        eventName, RetryPolicy.unwrap(error).getMessage());
                    return List.<WebhookSubscription>of();
                }
                return subscriptions;
            })
            .thenCompose(subscriptions -> fanOut(eventName, payload, subscriptions))
            .exceptionally(error -> {
                log.error("Webhook dispatch failed for event={}", eventName, RetryPolicy.unwrap(error));
                return List.of();
            });
    }

    private CompletableFuture<List<DeliveryOutcome>> fanOut(
            String eventName, Object payload, List<WebhookSubscription> subscriptions) {
        List<WebhookSubscription> matching = subscriptions.stream()
            .filter(WebhookSubscription::active)
            .filter(subscription -> subscription.subscribesTo(eventName))
            .toList();

        if (matching.isEmpty()) {
            log.debug("No webhooks registered for event={}", eventName);
            return CompletableFuture.completedFuture(List.of());
        }

        String body = serialize(eventName, payload);
        log.info("Dispatching event={} to {} webhooks", eventName, matching.size());

        List<CompletableFuture<DeliveryOutcome>> deliveries = matching.stream()
            .map(subscription -> deliver(DeliveryAttempt.first(subscription, eventName, body), System.nanoTime()))
            .toList();

        return CompletableFuture.allOf(deliveries.toArray(new CompletableFuture<?>[0]))
            .thenApply(ignored -> {
                List<DeliveryOutcome> outcomes = deliveries.stream().map(CompletableFuture::join).toList();
                long delivered = outcomes.stream().filter(DeliveryOutcome::delivered).count();
                log.info("Webhook summary for event={}: {} succeeded, {} failed",
                    eventName, delivered, outcomes.size() - delivered);
                return outcomes;
            });
    }

    private CompletableFuture<DeliveryOutcome> deliver(DeliveryAttempt attempt, long startNanos) {
        metrics.incrementWebhookDeliveryAttempts();
        String url = attempt.subscription().url();

        CompletableFuture<Integer> response;
        try {
            response = transport.deliver(attempt);
        } catch (RuntimeException e) {
            response = CompletableFuture.failedFuture(e);
        }

        return response
            .thenApply(status -> {
                if (status < 200 || status > 299) {
                    throw DeliveryException.forStatus(url, status);
                }
                return status;
            })
            .handle((status, error) -> error == null
                ? CompletableFuture.completedFuture(succeeded(attempt, status, startNanos))
                : afterFailure(attempt, RetryPolicy.unwrap(error), startNanos))
            .thenCompose(Function.identity());
    }

    private DeliveryOutcome succeeded(DeliveryAttempt attempt, int status, long startNanos) {
        WebhookSubscription subscription = attempt.subscription();
        metrics.incrementWebhookDeliveriesSucceeded();
        metrics.recordWebhookDeliveryDuration(Duration.ofNanos(System.nanoTime() - startNanos));
        log.info("Webhook delivered: id={}, url={}, event={}, status={}, attempt={}",
            subscription.id(), subscription.url(), attempt.eventName(), status, attempt.attemptNumber());
        return DeliveryOutcome.delivered(subscription.id(), subscription.url(), attempt.attemptNumber(), status);
    }

    private CompletableFuture<DeliveryOutcome> afterFailure(DeliveryAttempt attempt, Throwable error, long startNanos) {
        WebhookSubscription subscription = attempt.subscription();
        int status = error instanceof DeliveryException deliveryException ? deliveryException.getStatusCode() : 0;

        if (retryPolicy.shouldRetry(attempt.attemptNumber(), error)) {
            Duration wait = retryPolicy.delay(attempt.attemptNumber());
            log.warn("Webhook attempt {}/{} to {} failed for event={}, retrying in {}ms: {}",
                attempt.attemptNumber(), retryPolicy.maxAttempts(), subscription.url(),
                attempt.eventName(), wait.toMillis(), error.getMessage());
            return scheduleRetry(attempt, wait)
                .handle((next, rejected) -> rejected == null
                    ? deliver(next, startNanos)
                    : CompletableFuture.completedFuture(
                        gaveUp(attempt, status, "executor shut down", startNanos)))
                .thenCompose(Function.identity());
        }

        return CompletableFuture.completedFuture(gaveUp(attempt, status, error.getMessage(), startNanos));
    }

    /**
     * Hands the next attempt to the webhook executor once the backoff has elapsed. Completes
     * exceptionally when the executor refuses the task, so a shutdown never strands a delivery.
     */
    private CompletableFuture<DeliveryAttempt> scheduleRetry(DeliveryAttempt attempt, Duration wait) {
        CompletableFuture<DeliveryAttempt> next = new CompletableFuture<>();
        CompletableFuture.delayedExecutor(wait.toMillis(), TimeUnit.MILLISECONDS).execute(() -> {
            try {
                executor.execute(() -> next.complete(attempt.next()));
            } catch (RejectedExecutionException e) {
                next.completeExceptionally(e);
            }
        });
        return next;
    }

    private DeliveryOutcome gaveUp(DeliveryAttempt attempt, int status, String reason, long startNanos) {
        WebhookSubscription subscription = attempt.subscription();
        metrics.incrementWebhookDeliveriesFailed();
        metrics.recordWebhookDeliveryDuration(Duration.ofNanos(System.nanoTime() - startNanos));
        log.warn("Webhook delivery to {} failed for event={} after {} attempt(s): {}",
            subscription.url(), attempt.eventName(), attempt.attemptNumber(), reason);
        return DeliveryOutcome.failed(
            subscription.id(), subscription.url(), attempt.attemptNumber(), status, reason);
    }

    private String serialize(String eventName, Object payload) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("webhookEvent", eventName);
        body.put(WebhookEventName.entityOf(eventName), payload);
        body.put("timestamp", Instant.now().toEpochMilli());
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Webhook payload for event " + eventName + " is not serializable", e);
        }
    }
}
