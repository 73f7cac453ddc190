package de.t14d3.folio.store;

import de.t14d3.folio.core.ChangeSet;
import de.t14d3.folio.mapping.ClassDescription;
import de.t14d3.folio.mapping.FieldMapping;

import java.util.Collection;
import java.util.List;

/**
 * Writes and reads the documents of one class. Calls are synchronous; failures are
 * reported as unchecked exceptions and abort the running commit.
 */
public interface DocumentPersister {

    ClassDescription getClassDescription();

    /**
     * Inserts the documents in the given order. Documents without identifier get
     * one assigned by the store.
     *
     * @return one result per inserted document
     */
    List<InsertResult> executeInserts(List<Object> documents);

    /**
     * Writes the fields named in the change set.
     */
    void update(Object document, ChangeSet changeSet);

    /**
     * Rewrites the given reference fields after the referenced documents got their
     * identifiers in the same commit.
     */
    void updateReferences(Object document, List<FieldMapping> references);

    void delete(Object document);

    boolean exists(Object document);

    /**
     * Overwrites the document's fields with the stored state.
     *
     * @throws de.t14d3.folio.exceptions.DocumentNotFoundException if the document no longer exists
     */
    void refresh(Object document);

    /**
     * Loads a managed document, or returns null when no document has that identifier.
     */
    Object load(Object id);

    /**
     * Loads the managed documents with the given identifiers; missing ones are skipped.
     */
    List<Object> loadAll(Collection<?> ids);

    List<Object> findAll();
}
