package de.t14d3.folio.core;

import java.util.List;
import java.util.Map;

/**
 * Loads the elements of a lazy {@link PersistentCollection}, one call per concrete type.
 */
@FunctionalInterface
public interface CollectionLoader {
    /**
     * @return the loaded documents keyed by identifier; identifiers that do not exist are absent
     */
    Map<Object, Object> loadAll(Class<?> type, List<Object> identifiers);
}
