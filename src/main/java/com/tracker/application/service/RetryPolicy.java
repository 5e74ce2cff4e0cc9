package com.tracker.application.service;

import com.tracker.infrastructure.exception.DeliveryException;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.IntFunction;
import java.util.function.Predicate;

/**
 * How often and when a failed webhook delivery is attempted again.
 */
public final class RetryPolicy {

    private final int maxAttempts;
    private final Predicate<Throwable> retryable;
    private final IntFunction<Duration> delay;

    private RetryPolicy(int maxAttempts, Predicate<Throwable> retryable, IntFunction<Duration> delay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.retryable = retryable;
        this.delay = delay;
    }

    public static RetryPolicy of(int maxAttempts, Predicate<Throwable> retryable, IntFunction<Duration> delay) {
        return new RetryPolicy(maxAttempts, retryable, delay);
    }

    /**
     * Exponential backoff: the wait after attempt {@code n} is {@code initialDelay * multiplier^(n-1)},
     * capped at {@code maxDelay}. Retries network failures and 5xx responses only.
     */
    public static RetryPolicy exponential(int maxAttempts, Duration initialDelay, double multiplier, Duration maxDelay) {
        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0");
        }
        return new RetryPolicy(maxAttempts, RetryPolicy::isTransientDeliveryFailure, attempt -> {
            long millis = (long) (initialDelay.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1)));
            return Duration.ofMillis(Math.min(millis, maxDelay.toMillis()));
        });
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public boolean isRetryable(Throwable error) {
        return retryable.test(unwrap(error));
    }

    /**
     * Wait before the attempt that follows attempt {@code attemptNumber} (1-based).
     */
    public Duration delay(int attemptNumber) {
        return delay.apply(attemptNumber);
    }

    public boolean shouldRetry(int attemptNumber, Throwable error) {
        return attemptNumber < maxAttempts && isRetryable(error);
    }

    static boolean isTransientDeliveryFailure(Throwable error) {
        if (error instanceof DeliveryException deliveryException) {
            return deliveryException.isRetryable();
        }
        return error instanceof IOException;
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
