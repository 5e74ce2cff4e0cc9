package com.tracker.domain.model;

import com.tracker.domain.error.ValidationError.WebhookError;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * An external endpoint subscribed to a set of event names.
 */
public record WebhookSubscription(
    UUID id,
    String url,
    Set<String> events,
    boolean active,
    String secret,
    Instant createdAt
) {

    public WebhookSubscription {
        events = Collections.unmodifiableSet(new LinkedHashSet<>(events));
    }

    /**
     * Validates registration input and builds an active subscription.
     */
    public static Result<WebhookSubscription, WebhookError> create(
            UUID id, String url, Collection<String> events, String secret) {
        if (url == null || url.isBlank()) {
            return Result.failure(WebhookError.UrlEmpty.INSTANCE);
        }
        String trimmedUrl = url.trim();
        if (!isHttpUrl(trimmedUrl)) {
            return Result.failure(new WebhookError.UrlMalformed(trimmedUrl));
        }
        if (events == null || events.isEmpty()) {
            return Result.failure(WebhookError.EventsEmpty.INSTANCE);
        }
        LinkedHashSet<String> normalized = new LinkedHashSet<>();
        for (String event : events) {
            if (event == null || event.isBlank()) {
                return Result.failure(WebhookError.EventNameBlank.INSTANCE);
            }
            normalized.add(event.trim());
        }
        if (secret != null && secret.isBlank()) {
            return Result.failure(WebhookError.SecretBlank.INSTANCE);
        }
        return Result.success(new WebhookSubscription(id, trimmedUrl, normalized, true, secret, Instant.now()));
    }

    /**
     * Exact, case-sensitive membership test. {@code "issue"} does not match {@code "issue_created"}.
     */
    public boolean subscribesTo(String eventName) {
        return eventName != null && events.contains(eventName);
    }

    public boolean hasSecret() {
        return secret != null;
    }

    public WebhookSubscription withActive(boolean active) {
        return new WebhookSubscription(id, url, events, active, secret, createdAt);
    }

    private static boolean isHttpUrl(String value) {
        try {
            URI uri = new URI(value);
            String scheme = uri.getScheme();
            return uri.isAbsolute()
                && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))
                && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
