package com.tracker.application.service;

import com.tracker.application.port.in.ListWebhooksUseCase;
import com.tracker.application.port.in.RegisterWebhookUseCase;
import com.tracker.application.port.in.RemoveWebhookUseCase;
import com.tracker.application.port.in.UpdateWebhookUseCase;
import com.tracker.application.port.out.IdGenerator;
import com.tracker.application.port.out.WebhookRepository;
import com.tracker.domain.error.ValidationError.WebhookError;
import com.tracker.domain.model.Result;
import com.tracker.domain.model.WebhookSubscription;
import com.tracker.infrastructure.exception.WebhookNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

@Service
public class WebhookRegistryService
        implements RegisterWebhookUseCase, ListWebhooksUseCase, RemoveWebhookUseCase, UpdateWebhookUseCase {

    private static final Logger log = LoggerFactory.getLogger(WebhookRegistryService.class);

    private final WebhookRepository webhookRepository;
    private final IdGenerator idGenerator;

    public WebhookRegistryService(WebhookRepository webhookRepository, IdGenerator idGenerator) {
        this.webhookRepository = webhookRepository;
        this.idGenerator = idGenerator;
    }

    @Override
    public Result<WebhookSubscription, WebhookError> register(String url, List<String> events, String secret) {
        var created = WebhookSubscription.create(idGenerator.generate(), url, events, secret);
        if (created.isFailure()) {
            log.warn("Webhook registration rejected: {}", created.errorOrNull().message());
            return created;
        }

        WebhookSubscription subscription = created.getOrThrow();
        webhookRepository.save(subscription);
        log.info("Webhook registered: id={}, url={}, events={}", subscription.id(), subscription.url(), subscription.events());
        return created;
    }

    @Override
    public List<WebhookSubscription> list() {
        return webhookRepository.findAll();
    }

    @Override
    public WebhookSubscription get(UUID id) {
        return webhookRepository.findById(id)
            .orElseThrow(() -> new WebhookNotFoundException(id));
    }

    @Override
    public void remove(UUID id) {
        if (!webhookRepository.deleteById(id)) {
            log.warn("Webhook removal requested for unknown id={}", id);
            throw new WebhookNotFoundException(id);
        }
        log.info("Webhook removed: id={}", id);
    }

    @Override
    public WebhookSubscription setActive(UUID id, boolean active) {
        if (!webhookRepository.updateActive(id, active)) {
            throw new WebhookNotFoundException(id);
        }
        log.info("Webhook {}: id={}", active ? "resumed" : "paused", id);
        return get(id);
    }
}
