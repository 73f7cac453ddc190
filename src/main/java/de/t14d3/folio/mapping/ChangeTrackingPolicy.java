package de.t14d3.folio.mapping;

/**
 * How the unit of work finds out which managed documents changed.
 */
public enum ChangeTrackingPolicy {
    /**
     * Every managed document is compared field by field against its original data on commit.
     */
    DEFERRED_IMPLICIT,

    /**
     * Only documents passed to {@code persist()} since the last commit are compared on commit.
     */
    DEFERRED_EXPLICIT,

    /**
     * The document reports scalar changes itself through
     * {@link de.t14d3.folio.core.NotifyPropertyChanged}. On commit only single
     * associations and collections are compared.
     */
    NOTIFY
}
