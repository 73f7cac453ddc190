package de.t14d3.folio.core;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Field-level changes of one document, keyed by field name in detection order.
 */
public final class ChangeSet implements Iterable<Map.Entry<String, FieldChange>> {
    private final Map<String, FieldChange> changes = new LinkedHashMap<>();

    public void put(String fieldName, Object oldValue, Object newValue) {
        changes.put(fieldName, new FieldChange(oldValue, newValue));
    }

    public void put(String fieldName, FieldChange change) {
        changes.put(fieldName, change);
    }

    public FieldChange get(String fieldName) {
        return changes.get(fieldName);
    }

    public boolean contains(String fieldName) {
        return changes.containsKey(fieldName);
    }

    public FieldChange remove(String fieldName) {
        return changes.remove(fieldName);
    }

    /**
     * Adds the changes of {@code fresh}; on conflicting fields the fresh change wins.
     */
    public void merge(ChangeSet fresh) {
        changes.putAll(fresh.changes);
    }

    public Set<String> fieldNames() {
        return Collections.unmodifiableSet(changes.keySet());
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    public int size() {
        return changes.size();
    }

    public Map<String, FieldChange> asMap() {
        return Collections.unmodifiableMap(changes);
    }

    @Override
    public Iterator<Map.Entry<String, FieldChange>> iterator() {
        return asMap().entrySet().iterator();
    }

    @Override
    public String toString() {
        return "ChangeSet" + changes;
    }
}
