package com.tracker.adapter.out.webhook;

import com.tracker.application.port.out.WebhookTransport;
import com.tracker.domain.model.DeliveryAttempt;
import com.tracker.domain.model.WebhookSubscription;
import com.tracker.infrastructure.config.AppProperties;
import com.tracker.infrastructure.exception.DeliveryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

@Component
public class HttpClientWebhookTransport implements WebhookTransport {

    private static final Logger log = LoggerFactory.getLogger(HttpClientWebhookTransport.class);

    public static final String EVENT_HEADER = "X-Webhook-Event";
    public static final String ATTEMPT_HEADER = "X-Webhook-Delivery";
    public static final String SIGNATURE_HEADER = "X-Webhook-Signature";

    private final HttpClient httpClient;
    private final AppProperties appProperties;

    public HttpClientWebhookTransport(HttpClient webhookHttpClient, AppProperties appProperties) {
        this.httpClient = webhookHttpClient;
        this.appProperties = appProperties;
    }

    @Override
    public CompletableFuture<Integer> deliver(DeliveryAttempt attempt) {
        WebhookSubscription subscription = attempt.subscription();

        HttpRequest.Builder request = HttpRequest.newBuilder()
            .uri(URI.create(subscription.url()))
            .timeout(Duration.ofMillis(appProperties.getWebhook().getRequestTimeoutMs()))
            .header("Content-Type", "application/json")
            .header(EVENT_HEADER, attempt.eventName())
            .header(ATTEMPT_HEADER, String.valueOf(attempt.attemptNumber()))
            .POST(HttpRequest.BodyPublishers.ofString(attempt.body(), StandardCharsets.UTF_8));

        if (subscription.hasSecret()) {
            request.header(SIGNATURE_HEADER, WebhookSigner.sign(attempt.body(), subscription.secret()));
        }

        log.debug("POST {} event={} attempt={}", subscription.url(), attempt.eventName(), attempt.attemptNumber());
        return httpClient.sendAsync(request.build(), HttpResponse.BodyHandlers.discarding())
            .handle((response, error) -> {
                if (error != null) {
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause()
                        : error;
                    throw DeliveryException.network(subscription.url(), cause);
                }
                return response.statusCode();
            });
    }
}
