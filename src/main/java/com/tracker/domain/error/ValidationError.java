package com.tracker.domain.error;

/**
 * Sealed type representing domain validation errors.
 * These are expected business outcomes, not exceptional cases.
 */
public sealed interface ValidationError {

    String message();

    String code();

    // Webhook registration errors
    sealed interface WebhookError extends ValidationError {

        record UrlEmpty() implements WebhookError {
            public static final UrlEmpty INSTANCE = new UrlEmpty();
            @Override
            public String message() {
                return "Webhook URL cannot be empty";
            }

            @Override
            public String code() {
                return "WEBHOOK_URL_EMPTY";
            }
        }

        record UrlMalformed(String value) implements WebhookError {
            @Override
            public String message() {
                return "Webhook URL must be an absolute http(s) URL: " + value;
            }

            @Override
            public String code() {
                return "WEBHOOK_URL_MALFORMED";
            }
        }

        record EventsEmpty() implements WebhookError {
            public static final EventsEmpty INSTANCE = new EventsEmpty();
            @Override
            public String message() {
                return "Webhook must subscribe to at least one event";
            }

            @Override
            public String code() {
                return "WEBHOOK_EVENTS_EMPTY";
            }
        }

        record EventNameBlank() implements WebhookError {
            public static final EventNameBlank INSTANCE = new EventNameBlank();
            @Override
            public String message() {
                return "Webhook event names cannot be blank";
            }

            @Override
            public String code() {
                return "WEBHOOK_EVENT_BLANK";
            }
        }

        record SecretBlank() implements WebhookError {
            public static final SecretBlank INSTANCE = new SecretBlank();
            @Override
            public String message() {
                return "Webhook secret, when provided, cannot be blank";
            }

            @Override
            public String code() {
                return "WEBHOOK_SECRET_BLANK";
            }
        }
    }

    // Issue key parsing errors
    sealed interface IssueKeyError extends ValidationError {

        record InvalidFormat(String value) implements IssueKeyError {
            @Override
            public String message() {
                return "Issue key must look like PREFIX-123: " + value;
            }

            @Override
            public String code() {
                return "ISSUE_KEY_INVALID_FORMAT";
            }
        }
    }
}
