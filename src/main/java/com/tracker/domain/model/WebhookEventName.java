package com.tracker.domain.model;

import java.util.Locale;

/**
 * Event names follow {@code <entity>_<action>}, e.g. {@code issue_created}, {@code epic_deleted}.
 */
public final class WebhookEventName {

    public static final String DEFAULT_ENTITY = "issue";

    public enum Action {
        CREATED, UPDATED, DELETED;

        String suffix() {
            return "_" + name().toLowerCase(Locale.ROOT);
        }
    }

    private WebhookEventName() {}

    public static String of(String entity, Action action) {
        if (entity == null || entity.isBlank()) {
            throw new IllegalArgumentException("Entity kind cannot be blank");
        }
        return entity.trim().toLowerCase(Locale.ROOT) + action.suffix();
    }

    /**
     * Returns the entity kind an event is about, used as the payload field name.
     * Unrecognised names fall back to {@value #DEFAULT_ENTITY}.
     */
    public static String entityOf(String eventName) {
        if (eventName == null) {
            return DEFAULT_ENTITY;
        }
        for (Action action : Action.values()) {
            String suffix = action.suffix();
            if (eventName.endsWith(suffix) && eventName.length() > suffix.length()) {
                return eventName.substring(0, eventName.length() - suffix.length());
            }
        }
        return DEFAULT_ENTITY;
    }
}
