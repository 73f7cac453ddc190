package de.t14d3.folio.repository;

import de.t14d3.folio.core.DocumentManager;
import de.t14d3.folio.mapping.ClassDescription;

import java.util.ArrayList;
import java.util.List;

/**
 * Base repository class for document CRUD operations.
 * <p>
 * Provides a convenient base class for document-specific repositories. Writes go
 * through the {@link DocumentManager} and reach the store on {@code flush()};
 * reads return managed instances, so repeated reads within one document manager
 * return the same objects.
 *
 * @param <T> The document type managed by this repository
 *
 * @see DocumentManager
 * @see ClassDescription
 */
public class DocumentRepository<T> {
    protected final DocumentManager documentManager;
    protected final Class<T> documentClass;
    protected final ClassDescription description;

    /**
     * Creates a new repository for the specified document class.
     *
     * @param documentManager the DocumentManager to use for store operations
     * @param documentClass the class of documents managed by this repository
     */
    public DocumentRepository(DocumentManager documentManager, Class<T> documentClass) {
        this.documentManager = documentManager;
        this.documentClass = documentClass;
        this.description = documentManager.getClassDescription(documentClass);
    }

    /**
     * Save a document.
     * <p>
     * A new document is scheduled for insertion; for a managed one this schedules a
     * dirty check where the change tracking policy needs one. Nothing is written
     * before flush() is called.
     *
     * @param document the document to save
     * @return the same document instance
     */
    public T save(T document) {
        documentManager.persist(document);
        return document;
    }

    /**
     * Find a document by its identifier.
     *
     * @param id the identifier of the document
     * @return the document instance if found, null otherwise
     */
    public T find(Object id) {
        return documentManager.find(documentClass, id);
    }

    /**
     * Find all stored documents of this type, including subclasses.
     * <p>
     * Documents that are scheduled for insertion but not flushed yet are not included.
     *
     * @return a list containing all documents of this type
     */
    public List<T> findAll() {
        List<Object> loaded = documentManager.getUnitOfWork().getDocumentPersister(description).findAll();
        List<T> documents = new ArrayList<>(loaded.size());
        for (Object document : loaded) {
            documents.add(documentClass.cast(document));
        }
        return documents;
    }

    /**
     * Delete a document.
     * <p>
     * Marks the document for deletion. The deletion will be performed when flush() is called.
     *
     * @param document the document to delete
     */
    public void delete(T document) {
        documentManager.remove(document);
    }

    /**
     * Delete a document by its identifier.
     * <p>
     * If no document with the given identifier exists, this method does nothing.
     *
     * @param id the identifier of the document to delete
     */
    public void deleteById(Object id) {
        T document = find(id);
        if (document != null) {
            delete(document);
        }
    }

    /**
     * Check if a document exists by identifier.
     *
     * @param id the identifier to check
     * @return true if a document with the given identifier exists, false otherwise
     */
    public boolean existsById(Object id) {
        return find(id) != null;
    }

    /**
     * Count all stored documents of this type.
     *
     * @return the total number of documents
     */
    public long count() {
        return findAll().size();
    }

    protected DocumentManager getDocumentManager() {
        return documentManager;
    }

    protected Class<T> getDocumentClass() {
        return documentClass;
    }
}
