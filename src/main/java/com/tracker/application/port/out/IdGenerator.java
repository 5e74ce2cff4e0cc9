package com.tracker.application.port.out;

import java.util.UUID;

/**
 * Port for generating unique identifiers for webhook subscriptions.
 */
public interface IdGenerator {

    /**
     * Generates a new time-ordered identifier.
     */
    UUID generate();
}
