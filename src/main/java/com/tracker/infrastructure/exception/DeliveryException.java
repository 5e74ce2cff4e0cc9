package com.tracker.infrastructure.exception;

/**
 * A single webhook delivery attempt failed. Never escapes the dispatcher.
 */
public class DeliveryException extends RuntimeException {

    private final int statusCode;
    private final boolean retryable;

    private DeliveryException(String message, int statusCode, boolean retryable, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public static DeliveryException forStatus(String url, int statusCode) {
        return new DeliveryException(
            "Webhook " + url + " responded with status " + statusCode,
            statusCode,
            statusCode >= 500 && statusCode <= 599,
            null
        );
    }

    public static DeliveryException network(String url, Throwable cause) {
        return new DeliveryException("Webhook " + url + " unreachable: " + cause.getMessage(), 0, true, cause);
    }

    /**
     * HTTP status of the response, or 0 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
