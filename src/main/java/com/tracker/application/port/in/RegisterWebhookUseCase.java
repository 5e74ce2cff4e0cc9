package com.tracker.application.port.in;

import com.tracker.domain.error.ValidationError.WebhookError;
import com.tracker.domain.model.Result;
import com.tracker.domain.model.WebhookSubscription;

import java.util.List;

public interface RegisterWebhookUseCase {
    Result<WebhookSubscription, WebhookError> register(String url, List<String> events, String secret);
}
