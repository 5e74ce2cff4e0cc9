package com.tracker.adapter.in.web;

import com.tracker.application.port.in.ListWebhooksUseCase;
import com.tracker.application.port.in.RegisterWebhookUseCase;
import com.tracker.application.port.in.RemoveWebhookUseCase;
import com.tracker.application.port.in.UpdateWebhookUseCase;
import com.tracker.domain.error.ValidationError.WebhookError;
import com.tracker.domain.model.Result;
import com.tracker.domain.model.WebhookSubscription;
import com.tracker.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/webhooks")
@Tag(name = "Webhooks", description = "Webhook subscription management")
public class WebhookController {

    private final RegisterWebhookUseCase registerWebhookUseCase;
    private final ListWebhooksUseCase listWebhooksUseCase;
    private final UpdateWebhookUseCase updateWebhookUseCase;
    private final RemoveWebhookUseCase removeWebhookUseCase;

    public WebhookController(
            RegisterWebhookUseCase registerWebhookUseCase,
            ListWebhooksUseCase listWebhooksUseCase,
            UpdateWebhookUseCase updateWebhookUseCase,
            RemoveWebhookUseCase removeWebhookUseCase) {
        this.registerWebhookUseCase = registerWebhookUseCase;
        this.listWebhooksUseCase = listWebhooksUseCase;
        this.updateWebhookUseCase = updateWebhookUseCase;
        this.removeWebhookUseCase = removeWebhookUseCase;
    }

    @PostMapping
    @Operation(summary = "Register a webhook", description = "Subscribes a URL to one or more exact event names, e.g. issue_created")
    public ResponseEntity<?> register(@RequestBody RegisterWebhookRequest request) {
        Result<WebhookSubscription, WebhookError> result =
            registerWebhookUseCase.register(request.url(), request.events(), request.secret());

        return result.<ResponseEntity<?>>fold(
            subscription -> ResponseEntity.status(HttpStatus.CREATED).body(WebhookResponse.from(subscription)),
            this::toErrorResponse);
    }

    @GetMapping
    @Operation(summary = "List webhooks", description = "Returns every registered subscription, oldest first")
    public List<WebhookResponse> list() {
        return listWebhooksUseCase.list().stream()
            .map(WebhookResponse::from)
            .toList();
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a webhook")
    public WebhookResponse get(
            @Parameter(description = "Subscription ID", example = "01890a5d-ac96-774b-bcce-b302099a8057")
            @PathVariable UUID id) {
        return WebhookResponse.from(listWebhooksUseCase.get(id));
    }

    @PatchMapping("/{id}")
    @Operation(summary = "Pause or resume a webhook", description = "Inactive subscriptions are skipped by dispatch")
    public WebhookResponse update(
            @Parameter(description = "Subscription ID") @PathVariable UUID id,
            @Valid @RequestBody UpdateWebhookRequest request) {
        return WebhookResponse.from(updateWebhookUseCase.setActive(id, request.active()));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Remove a webhook")
    public ResponseEntity<Void> remove(@Parameter(description = "Subscription ID") @PathVariable UUID id) {
        removeWebhookUseCase.remove(id);
        return ResponseEntity.noContent().build();
    }

    private ResponseEntity<ErrorResponse> toErrorResponse(WebhookError error) {
        String requestId = RequestContext.getRequestId();
        return ResponseEntity.badRequest()
            .body(new ErrorResponse(error.code(), error.message(), requestId));
    }

    public record RegisterWebhookRequest(String url, List<String> events, String secret) {}

    public record UpdateWebhookRequest(@NotNull Boolean active) {}

    public record ErrorResponse(String error, String message, String requestId) {}

    public record WebhookResponse(
        UUID id,
        String url,
        Set<String> events,
        boolean active,
        boolean hasSecret,
        Instant createdAt
    ) {
        public static WebhookResponse from(WebhookSubscription subscription) {
            return new WebhookResponse(
                subscription.id(),
                subscription.url(),
                subscription.events(),
                subscription.active(),
                subscription.hasSecret(),
                subscription.createdAt());
        }
    }
}
