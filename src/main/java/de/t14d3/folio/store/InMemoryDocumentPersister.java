package de.t14d3.folio.store;

import de.t14d3.folio.core.ChangeSet;
import de.t14d3.folio.core.FieldChange;
import de.t14d3.folio.core.UnitOfWork;
import de.t14d3.folio.exceptions.DocumentNotFoundException;
import de.t14d3.folio.exceptions.FolioException;
import de.t14d3.folio.mapping.ClassDescription;
import de.t14d3.folio.mapping.FieldMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persister of one document class backed by an {@link InMemoryDocumentStore}.
 * Loaded documents are handed to the unit of work, which returns the managed
 * instance for their identity.
 */
public class InMemoryDocumentPersister implements DocumentPersister {
    private static final Logger LOG = LoggerFactory.getLogger(InMemoryDocumentPersister.class);

    private final InMemoryDocumentStore store;
    private final ClassDescription description;
    private final UnitOfWork unitOfWork;
    private final DocumentDataConverter converter;
    private final String collection;

    public InMemoryDocumentPersister(InMemoryDocumentStore store, ClassDescription description, UnitOfWork unitOfWork) {
        if (description.isEmbedded()) {
            throw new FolioException("Embedded document " + description.getName() + " has no persister");
        }
        this.store = store;
        this.description = description;
        this.unitOfWork = unitOfWork;
        this.converter = new DocumentDataConverter(unitOfWork.getClassDescriptionRegistry());
        this.collection = description.getCollectionName();
    }

    @Override
    public ClassDescription getClassDescription() {
        return description;
    }

    /**
     * Assigns all missing identifiers first, so references between documents of
     * the same batch are written with their identifiers.
     */
    @Override
    public List<InsertResult> executeInserts(List<Object> documents) {
        List<InsertResult> results = new ArrayList<>(documents.size());
        for (Object document : documents) {
            Object id = description.getIdentifierValue(document);
            if (id == null) {
                if (!description.isIdentifierGenerated()) {
                    throw new FolioException("Document " + description.getName()
                            + " has no identifier and its identifier is not generated");
                }
                id = store.nextIdentifier(description);
                description.setIdentifierValue(document, id);
            }
            results.add(new InsertResult(id, document));
        }
        for (InsertResult result : results) {
            store.insert(collection, result.identifier(), converter.toData(description, result.document()));
        }
        LOG.debug("Inserted {} documents into {}", results.size(), collection);
        return results;
    }

    @Override
    public void update(Object document, ChangeSet changeSet) {
        Object id = identifierOf(document);
        Map<String, Object> fields = new LinkedHashMap<>();
        for (Map.Entry<String, FieldChange> change : changeSet) {
            FieldMapping mapping = description.getFieldMapping(change.getKey());
            fields.put(mapping.storedName(), converter.toValue(mapping, change.getValue().newValue()));
        }
        if (!store.update(collection, id, fields)) {
            throw new DocumentNotFoundException(description.getType(), id);
        }
        LOG.debug("Updated {} fields of {} {}", fields.size(), collection, id);
    }

    @Override
    public void updateReferences(Object document, List<FieldMapping> references) {
        Object id = identifierOf(document);
        Map<String, Object> fields = new LinkedHashMap<>();
        for (FieldMapping mapping : references) {
            fields.put(mapping.storedName(), converter.toValue(mapping, mapping.getValue(document)));
        }
        if (!store.update(collection, id, fields)) {
            throw new DocumentNotFoundException(description.getType(), id);
        }
        LOG.debug("Updated references {} of {} {}", fields.keySet(), collection, id);
    }

    @Override
    public void delete(Object document) {
        Object id = identifierOf(document);
        store.delete(collection, id);
        LOG.debug("Deleted {} {}", collection, id);
    }

    @Override
    public boolean exists(Object document) {
        return store.contains(collection, description.getIdentifierValue(document));
    }

    @Override
    public void refresh(Object document) {
        Object id = identifierOf(document);
        Map<String, Object> data = store.findRaw(collection, id);
        if (data == null) {
            throw new DocumentNotFoundException(description.getType(), id);
        }
        unitOfWork.getOrCreateDocument(description, data, true);
    }

    @Override
    public Object load(Object id) {
        Map<String, Object> data = store.findRaw(collection, id);
        if (data == null || !isOfType(data)) {
            return null;
        }
        return unitOfWork.getOrCreateDocument(description, data, false);
    }

    @Override
    public List<Object> loadAll(Collection<?> ids) {
        List<Object> documents = new ArrayList<>();
        for (Object id : ids) {
            Object document = load(id);
            if (document != null) {
                documents.add(document);
            }
        }
        return documents;
    }

    @Override
    public List<Object> findAll() {
        List<Object> documents = new ArrayList<>();
        for (Map<String, Object> data : store.findAllRaw(collection)) {
            if (isOfType(data)) {
                documents.add(unitOfWork.getOrCreateDocument(description, data, false));
            }
        }
        return documents;
    }

    /**
     * Whether the stored class is this persister's class or one of its subclasses.
     */
    private boolean isOfType(Map<String, Object> data) {
        Object storedClass = data.get(DocumentDataConverter.CLASS_KEY);
        if (storedClass == null || storedClass.equals(description.getName())) {
            return true;
        }
        Class<?> stored = unitOfWork.getClassDescriptionRegistry().describe(storedClass.toString()).getType();
        return description.getType().isAssignableFrom(stored);
    }

    private Object identifierOf(Object document) {
        Object id = description.getIdentifierValue(document);
        if (id == null) {
            throw new FolioException("Document " + description.getName() + " has no identifier");
        }
        return id;
    }
}
