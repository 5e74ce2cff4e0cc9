package com.tracker.application.port.in;

import com.tracker.domain.model.WebhookSubscription;

import java.util.UUID;

public interface UpdateWebhookUseCase {
    WebhookSubscription setActive(UUID id, boolean active);
}
