package com.tracker.application.port.in;

import java.util.UUID;

public interface RemoveWebhookUseCase {
    void remove(UUID id);
}
