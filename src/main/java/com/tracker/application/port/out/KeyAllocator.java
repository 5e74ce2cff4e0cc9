package com.tracker.application.port.out;

/**
 * Port for allocating human-readable entity keys.
 * Called once per entity creation, before the entity row is persisted.
 */
public interface KeyAllocator {

    /**
     * Returns the next key for the prefix, formatted {@code PREFIX-n}.
     * No two calls ever return the same number, however they overlap in time.
     *
     * @throws IllegalArgumentException if the prefix is not a valid key prefix
     * @throws com.tracker.infrastructure.exception.PersistenceException if the counter could not
     *         be advanced; the persisted counter is then unchanged
     */
    String allocate(String prefix);
}
