package com.variance.model;

/**
 * Interface for entities that have a unique string identifier.
 * Used by JsonFileRepository as the storage key.
 */
public interface Identifiable {
    /**
     * Get the unique identifier for this entity. Must be non-empty.
     */
    String getId();
}
