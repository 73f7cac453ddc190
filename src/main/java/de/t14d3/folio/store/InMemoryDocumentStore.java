package de.t14d3.folio.store;

import de.t14d3.folio.core.DocumentManager;
import de.t14d3.folio.exceptions.FolioException;
import de.t14d3.folio.mapping.ClassDescription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A document store that keeps raw documents in memory, one ordered table per
 * collection. Subclasses of a document class share the collection of their root.
 * <p>
 * Several document managers may share one store; each gets its own persisters.
 * Data handed out or taken in is deep-copied.
 */
public class InMemoryDocumentStore implements DocumentStore {
    private static final Logger LOG = LoggerFactory.getLogger(InMemoryDocumentStore.class);

    private final Map<String, Map<Object, Map<String, Object>>> collections = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> sequences = new ConcurrentHashMap<>();

    @Override
    public DocumentPersister createPersister(ClassDescription description, DocumentManager documentManager) {
        return new InMemoryDocumentPersister(this, description, documentManager.getUnitOfWork());
    }

    /**
     * Next identifier for a document of the given class: a sequence value for
     * numeric identifiers, a random UUID otherwise.
     */
    public Object nextIdentifier(ClassDescription description) {
        Class<?> idType = description.getIdentifierType();
        String collection = description.getCollectionName();
        if (idType == String.class || idType == UUID.class || idType == Object.class) {
            UUID uuid = UUID.randomUUID();
            return idType == UUID.class ? uuid : uuid.toString();
        }
        if (isNumeric(idType)) {
            AtomicLong sequence = sequences.computeIfAbsent(collection, c -> new AtomicLong());
            Map<Object, Map<String, Object>> table = table(collection);
            Object id;
            do {
                id = DocumentDataConverter.convertIdentifier(sequence.incrementAndGet(), idType);
            } while (table.containsKey(id));
            return id;
        }
        throw new FolioException("Cannot generate an identifier of type " + idType.getName()
                + " for " + description.getName());
    }

    /**
     * Stores a new raw document.
     *
     * @throws FolioException if the collection already holds a document with that identifier
     */
    public void insert(String collection, Object id, Map<String, Object> data) {
        Map<Object, Map<String, Object>> table = table(collection);
        if (table.containsKey(id)) {
            throw new FolioException("Duplicate identifier " + id + " in collection " + collection);
        }
        table.put(id, copyOf(data));
    }

    /**
     * Overwrites the given stored fields of a raw document.
     *
     * @return false if the document does not exist
     */
    public boolean update(String collection, Object id, Map<String, Object> fields) {
        Map<String, Object> stored = table(collection).get(id);
        if (stored == null) {
            return false;
        }
        stored.putAll(copyOf(fields));
        return true;
    }

    public boolean delete(String collection, Object id) {
        return table(collection).remove(id) != null;
    }

    public boolean contains(String collection, Object id) {
        return id != null && table(collection).containsKey(id);
    }

    /**
     * A copy of the raw document, or null if it does not exist.
     */
    public Map<String, Object> findRaw(String collection, Object id) {
        Map<String, Object> stored = id == null ? null : table(collection).get(id);
        return stored == null ? null : copyOf(stored);
    }

    /**
     * Copies of every raw document in the collection, in insertion order.
     */
    public List<Map<String, Object>> findAllRaw(String collection) {
        List<Map<String, Object>> result = new ArrayList<>();
        for (Map<String, Object> stored : table(collection).values()) {
            result.add(copyOf(stored));
        }
        return result;
    }

    public int count(String collection) {
        return table(collection).size();
    }

    public Set<String> getCollectionNames() {
        return Collections.unmodifiableSet(collections.keySet());
    }

    /**
     * Drops every stored document and resets the sequences.
     */
    public void clear() {
        LOG.debug("Clearing {} collections", collections.size());
        collections.clear();
        sequences.clear();
    }

    private Map<Object, Map<String, Object>> table(String collection) {
        return collections.computeIfAbsent(collection, c -> Collections.synchronizedMap(new LinkedHashMap<>()));
    }

    private static Map<String, Object> copyOf(Map<String, Object> data) {
        Map<String, Object> copy = new LinkedHashMap<>();
        data.forEach((key, value) -> copy.put(key, DocumentDataConverter.copy(value)));
        return copy;
    }

    private static boolean isNumeric(Class<?> type) {
        return type == Long.class || type == long.class || type == Integer.class || type == int.class;
    }
}
