package de.t14d3.folio.annotations;

/**
 * Operations of the unit of work that may be cascaded along a reference.
 */
public enum CascadeType {
    /**
     * Persist referenced documents together with the owner, including NEW
     * documents only discovered while computing change sets at commit time.
     */
    PERSIST,

    /**
     * Schedule referenced documents for deletion together with the owner.
     */
    REMOVE,

    /**
     * Merge referenced detached copies into their managed counterparts.
     */
    MERGE,

    /**
     * Detach referenced documents together with the owner.
     */
    DETACH,

    /**
     * Reload referenced documents from the store together with the owner.
     */
    REFRESH,

    /**
     * Shorthand for every other cascade type.
     */
    ALL
}
