package com.tracker.application.port.in;

import com.tracker.domain.model.WebhookSubscription;

import java.util.List;
import java.util.UUID;

public interface ListWebhooksUseCase {
    List<WebhookSubscription> list();

    WebhookSubscription get(UUID id);
}
