package de.t14d3.folio.event;

/**
 * Hook points of the document lifecycle.
 */
public enum LifecycleEvent {
    PRE_PERSIST,
    POST_PERSIST,
    PRE_REMOVE,
    POST_REMOVE,
    PRE_UPDATE,
    POST_UPDATE,
    PRE_LOAD,
    POST_LOAD,
    /**
     * Raised once per commit, after change sets are computed and before the
     * first write. The event arguments carry no document.
     */
    ON_FLUSH
}
