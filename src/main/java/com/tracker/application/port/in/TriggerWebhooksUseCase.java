package com.tracker.application.port.in;

import java.util.concurrent.CompletableFuture;

/**
 * Notifies subscribers about an entity change.
 * Called once per create/update/delete, after the mutation has been committed.
 */
public interface TriggerWebhooksUseCase {

    /**
     * Delivers the event to every active subscription listening for exactly this name.
     * The returned future completes normally once every delivery has succeeded or given up;
     * notification failures never reach the caller.
     */
    CompletableFuture<Void> trigger(String eventName, Object payload);
}
