package de.t14d3.folio.core;

/**
 * Lifecycle state of a document within a unit of work.
 */
public enum DocumentState {
    /**
     * Constructed by the application and never persisted or loaded.
     */
    NEW,
    /**
     * Tracked by the unit of work; changes are written on commit.
     */
    MANAGED,
    /**
     * Has an identity in the store but is no longer tracked.
     */
    DETACHED,
    /**
     * Scheduled for deletion on the next commit.
     */
    REMOVED
}
