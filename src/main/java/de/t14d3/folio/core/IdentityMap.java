package de.t14d3.folio.core;

import de.t14d3.folio.exceptions.UnitOfWorkException;
import de.t14d3.folio.mapping.ClassDescription;
import de.t14d3.folio.mapping.ClassDescriptionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Identity map and lifecycle state tracker.
 * <p>
 * Every document gets a stable integer handle on first sight. State, identifier
 * and original data are kept in side tables keyed by that handle, so documents
 * never need to implement {@code equals}/{@code hashCode} in any particular way.
 * Managed documents are additionally indexed by (root type name, identifier);
 * that index holds at most one instance per key.
 */
public class IdentityMap {
    private static final Logger LOG = LoggerFactory.getLogger(IdentityMap.class);

    private final ClassDescriptionRegistry registry;
    private final Predicate<Object> existsInStore;

    private final Map<Object, Integer> handles = new IdentityHashMap<>();
    private final Map<Integer, Object> documents = new HashMap<>();
    private final Map<Integer, DocumentState> states = new HashMap<>();
    private final Map<Integer, Object> identifiers = new HashMap<>();
    private final Map<Integer, Map<String, Object>> originalData = new HashMap<>();
    private final Map<String, Map<Object, Object>> map = new LinkedHashMap<>();
    private int nextHandle = 1;

    /**
     * @param existsInStore last-resort existence check used by {@link #getState(Object, DocumentState)}
     */
    public IdentityMap(ClassDescriptionRegistry registry, Predicate<Object> existsInStore) {
        this.registry = registry;
        this.existsInStore = existsInStore;
    }

    /**
     * Returns the handle of the document, allocating one on first sight.
     */
    public int handleOf(Object document) {
        Integer handle = handles.get(document);
        if (handle == null) {
            handle = nextHandle++;
            handles.put(document, handle);
            documents.put(handle, document);
        }
        return handle;
    }

    /**
     * Returns the handle of the document or null when it was never seen.
     */
    public Integer findHandle(Object document) {
        return handles.get(document);
    }

    public Object getDocument(int handle) {
        return documents.get(handle);
    }

    /**
     * Forgets everything about the document. A later sight allocates a fresh handle.
     */
    public void release(Object document) {
        Integer handle = handles.remove(document);
        if (handle == null) {
            return;
        }
        Object id = identifiers.remove(handle);
        if (id != null) {
            Map<Object, Object> documentsById = map.get(rootName(document));
            if (documentsById != null && documentsById.get(id) == document) {
                documentsById.remove(id);
            }
        }
        documents.remove(handle);
        states.remove(handle);
        originalData.remove(handle);
    }

    /**
     * Registers a document as managed under the given identifier.
     *
     * @param originalData the original data snapshot, may be null
     * @return false when another instance is already managed under the same key;
     * nothing is changed in that case
     */
    public boolean registerManaged(Object document, Object id, Map<String, Object> originalData) {
        ClassDescription description = registry.describe(document.getClass());
        if (id != null) {
            Object existing = getByIdentity(description.getRootName(), id).orElse(null);
            if (existing != null && existing != document) {
                return false;
            }
        }
        int handle = handleOf(document);
        states.put(handle, DocumentState.MANAGED);
        if (id != null) {
            identifiers.put(handle, id);
        }
        if (originalData != null) {
            this.originalData.put(handle, originalData);
        }
        if (id != null) {
            map.computeIfAbsent(description.getRootName(), k -> new LinkedHashMap<>()).put(id, document);
        }
        return true;
    }

    /**
     * Adds a document whose identifier is known to the identity map.
     *
     * @return false when the key is taken by another instance
     */
    public boolean addToIdentityMap(Object document) {
        Object id = getDocumentIdentifier(document);
        if (id == null) {
            throw UnitOfWorkException.noIdentity(document);
        }
        Map<Object, Object> documentsById = map.computeIfAbsent(rootName(document), k -> new LinkedHashMap<>());
        Object existing = documentsById.get(id);
        if (existing != null) {
            return existing == document;
        }
        documentsById.put(id, document);
        return true;
    }

    /**
     * Removes the document from the identity map and marks it {@link DocumentState#DETACHED}.
     *
     * @return whether the document was in the map
     */
    public boolean removeFromMap(Object document) {
        Integer handle = handles.get(document);
        Object id = handle == null ? null : identifiers.get(handle);
        if (id == null) {
            throw UnitOfWorkException.noIdentity(document);
        }
        Map<Object, Object> documentsById = map.get(rootName(document));
        if (documentsById != null && documentsById.get(id) == document) {
            documentsById.remove(id);
            states.put(handle, DocumentState.DETACHED);
            return true;
        }
        return false;
    }

    public Optional<Object> getByIdentity(Class<?> type, Object id) {
        return getByIdentity(registry.describe(type).getRootName(), id);
    }

    public Optional<Object> getByIdentity(String rootName, Object id) {
        Map<Object, Object> documentsById = map.get(rootName);
        return Optional.ofNullable(documentsById == null ? null : documentsById.get(id));
    }

    /**
     * Looks up a managed document, returning null when it is not in the map.
     */
    public Object tryGetById(Object id, ClassDescription description) {
        return getByIdentity(description.getRootName(), id).orElse(null);
    }

    public boolean containsId(Object id, String rootName) {
        return getByIdentity(rootName, id).isPresent();
    }

    public boolean isInIdentityMap(Object document) {
        Object id = getDocumentIdentifier(document);
        if (id == null) {
            return false;
        }
        return getByIdentity(rootName(document), id).orElse(null) == document;
    }

    /**
     * Resolves the lifecycle state of a document.
     * <p>
     * A recorded state always wins. Otherwise the assumed state is recorded and
     * returned. Without an assumption a document without identifier is NEW, one
     * whose key is taken by another managed instance is DETACHED, and as a last
     * resort the store is asked whether the document exists. Callers that know
     * what to expect should pass an assumed state to avoid that round trip.
     *
     * @param assumedStateIfUnknown may be null
     */
    public DocumentState getState(Object document, DocumentState assumedStateIfUnknown) {
        Integer handle = handles.get(document);
        if (handle != null) {
            DocumentState state = states.get(handle);
            if (state != null) {
                return state;
            }
        }
        if (assumedStateIfUnknown != null) {
            setState(document, assumedStateIfUnknown);
            return assumedStateIfUnknown;
        }

        ClassDescription description = registry.describe(document.getClass());
        DocumentState resolved;
        Object id = description.getIdentifierValue(document);
        if (description.isEmbedded() || id == null) {
            resolved = DocumentState.NEW;
        } else if (containsId(id, description.getRootName())) {
            resolved = DocumentState.DETACHED;
        } else {
            LOG.debug("Checking store for {} with identifier {} to resolve its state", description.getName(), id);
            resolved = existsInStore.test(document) ? DocumentState.DETACHED : DocumentState.NEW;
        }
        setState(document, resolved);
        return resolved;
    }

    /**
     * The recorded state, or null when the document was never resolved.
     */
    public DocumentState getRecordedState(Object document) {
        Integer handle = handles.get(document);
        return handle == null ? null : states.get(handle);
    }

    public void setState(Object document, DocumentState state) {
        states.put(handleOf(document), state);
    }

    public Object getDocumentIdentifier(Object document) {
        Integer handle = handles.get(document);
        return handle == null ? null : identifiers.get(handle);
    }

    public void setDocumentIdentifier(Object document, Object id) {
        identifiers.put(handleOf(document), id);
    }

    /**
     * The original data snapshot, or null when none was taken yet.
     */
    public Map<String, Object> getOriginalDocumentData(Object document) {
        Integer handle = handles.get(document);
        return handle == null ? null : originalData.get(handle);
    }

    public void setOriginalDocumentData(Object document, Map<String, Object> data) {
        originalData.put(handleOf(document), data);
    }

    public void setOriginalDocumentProperty(Object document, String field, Object value) {
        Map<String, Object> data = getOriginalDocumentData(document);
        if (data != null) {
            data.put(field, value);
        }
    }

    /**
     * Detaches the document: it leaves the identity map, loses its identifier
     * and original data, and keeps the recorded state {@link DocumentState#DETACHED}.
     */
    public void detach(Object document) {
        Integer handle = handles.get(document);
        if (handle == null) {
            return;
        }
        if (isInIdentityMap(document)) {
            removeFromMap(document);
        }
        identifiers.remove(handle);
        originalData.remove(handle);
        states.put(handle, DocumentState.DETACHED);
    }

    /**
     * Number of documents in the identity map.
     */
    public int size() {
        int count = 0;
        for (Map<Object, Object> documentsById : map.values()) {
            count += documentsById.size();
        }
        return count;
    }

    /**
     * Snapshot of all documents in the identity map, grouped by root type in first-seen order.
     */
    public List<Object> getManagedDocuments() {
        List<Object> managed = new ArrayList<>();
        for (Map<Object, Object> documentsById : map.values()) {
            managed.addAll(documentsById.values());
        }
        return managed;
    }

    public Map<String, Map<Object, Object>> getIdentityMapEntries() {
        Map<String, Map<Object, Object>> entries = new LinkedHashMap<>();
        map.forEach((root, documentsById) -> entries.put(root, Collections.unmodifiableMap(documentsById)));
        return Collections.unmodifiableMap(entries);
    }

    public void clear() {
        handles.clear();
        documents.clear();
        states.clear();
        identifiers.clear();
        originalData.clear();
        map.clear();
    }

    private String rootName(Object document) {
        return registry.describe(document.getClass()).getRootName();
    }
}
