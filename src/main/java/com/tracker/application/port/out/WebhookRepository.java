package com.tracker.application.port.out;

import com.tracker.domain.model.WebhookSubscription;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface WebhookRepository {
    void save(WebhookSubscription subscription);
    List<WebhookSubscription> findAll();
    Optional<WebhookSubscription> findById(UUID id);
    boolean updateActive(UUID id, boolean active);

    /**
     * @return true if a subscription was deleted
     */
    boolean deleteById(UUID id);
}
