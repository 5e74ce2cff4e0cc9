package com.tracker.infrastructure.exception;

import java.util.UUID;

public class WebhookNotFoundException extends BusinessException {

    public WebhookNotFoundException(UUID webhookId) {
        super("WEBHOOK_NOT_FOUND", "Webhook not found: " + webhookId);
    }
}
