package de.t14d3.folio.core;

import de.t14d3.folio.event.EventManager;
import de.t14d3.folio.event.LifecycleEvent;
import de.t14d3.folio.event.LifecycleListener;
import de.t14d3.folio.exceptions.DocumentManagerClosedException;
import de.t14d3.folio.mapping.ChangeTrackingPolicy;
import de.t14d3.folio.mapping.ClassDescription;
import de.t14d3.folio.mapping.ClassDescriptionRegistry;
import de.t14d3.folio.mapping.FieldMapping;
import de.t14d3.folio.repository.DocumentRepository;
import de.t14d3.folio.store.DocumentStore;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The main interface for working with documents.
 * Manages the document lifecycle through a {@link UnitOfWork} and writes changes
 * to the {@link DocumentStore} on {@link #flush()}.
 * Similar to Doctrine's DocumentManager.
 */
public class DocumentManager {
    private final DocumentStore store;
    private final ClassDescriptionRegistry registry;
    private final EventManager eventManager;
    private final UnitOfWork unitOfWork;
    private final Map<Class<?>, DocumentRepository<?>> repositories;
    private boolean open;

    private DocumentManager(DocumentStore store, ClassDescriptionRegistry registry) {
        this.store = store;
        this.registry = registry;
        this.eventManager = new EventManager();
        this.unitOfWork = new UnitOfWork(this, store, registry, eventManager);
        this.repositories = new HashMap<>();
        this.open = true;
    }

    /**
     * Create a new DocumentManager reading class descriptions from annotations.
     */
    public static DocumentManager create(DocumentStore store) {
        return create(store, new ClassDescriptionRegistry());
    }

    /**
     * Create a new DocumentManager with an existing class description registry.
     */
    public static DocumentManager create(DocumentStore store, ClassDescriptionRegistry registry) {
        if (store == null) {
            throw new IllegalArgumentException("store must not be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        return new DocumentManager(store, registry);
    }

    /**
     * Register a listener for a lifecycle event.
     */
    public DocumentManager withListener(LifecycleEvent event, LifecycleListener listener) {
        eventManager.addListener(event, listener);
        return this;
    }

    /**
     * Policy used for classes that declare none through {@code @ChangeTracking}.
     */
    public DocumentManager withDefaultChangeTrackingPolicy(ChangeTrackingPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy must not be null");
        }
        unitOfWork.setDefaultChangeTrackingPolicy(policy);
        return this;
    }

    /**
     * Make a document managed. It will be inserted on flush.
     */
    public void persist(Object document) {
        ensureOpen();
        requireDocument(document, "persist");
        unitOfWork.persist(document);
    }

    /**
     * Mark a document for removal. It will be deleted on flush.
     */
    public void remove(Object document) {
        ensureOpen();
        requireDocument(document, "remove");
        unitOfWork.remove(document);
    }

    /**
     * Merge the state of a detached document into the managed copy with the same
     * identity and return that copy.
     */
    public <T> T merge(T document) {
        ensureOpen();
        requireDocument(document, "merge");
        @SuppressWarnings("unchecked")
        T managed = (T) unitOfWork.merge(document);
        return managed;
    }

    /**
     * Detach a document. Changes made to it afterwards are not written.
     */
    public void detach(Object document) {
        ensureOpen();
        requireDocument(document, "detach");
        unitOfWork.detach(document);
    }

    /**
     * Overwrite a managed document with its stored state.
     * Any changes made to the document in memory will be lost.
     */
    public void refresh(Object document) {
        ensureOpen();
        requireDocument(document, "refresh");
        unitOfWork.refresh(document);
    }

    /**
     * Write all pending changes to the store.
     */
    public void flush() {
        ensureOpen();
        unitOfWork.commit();
    }

    /**
     * Detach every managed document and drop all pending changes.
     */
    public void clear() {
        ensureOpen();
        unitOfWork.clear();
    }

    /**
     * Find a document by its identifier.
     * The identity map is checked first, then the store.
     *
     * @return the managed document, or null if none exists
     */
    public <T> T find(Class<T> documentClass, Object id) {
        ensureOpen();
        if (id == null) {
            return null;
        }
        ClassDescription description = registry.describe(documentClass);
        Object document = unitOfWork.tryGetById(id, description);
        if (document == null) {
            document = unitOfWork.getDocumentPersister(description).load(id);
        }
        if (document == null || !documentClass.isInstance(document)) {
            return null;
        }
        return documentClass.cast(document);
    }

    /**
     * Get a managed instance that only carries its identifier, without touching
     * the store. An instance already in the identity map is returned as is.
     */
    public <T> T getReference(Class<T> documentClass, Object id) {
        ensureOpen();
        if (id == null) {
            throw new IllegalArgumentException("Cannot get a reference without identifier");
        }
        ClassDescription description = registry.describe(documentClass);
        Object managed = unitOfWork.tryGetById(id, description);
        if (managed != null) {
            return documentClass.cast(managed);
        }
        Object document = description.newInstance();
        description.setIdentifierValue(document, id);
        Map<String, Object> originalData = new LinkedHashMap<>();
        for (FieldMapping mapping : description.getFieldMappings()) {
            originalData.put(mapping.name(), null);
        }
        unitOfWork.registerManaged(document, id, originalData);
        return documentClass.cast(document);
    }

    /**
     * Check whether a document is managed and not scheduled for removal.
     */
    public boolean contains(Object document) {
        ensureOpen();
        requireDocument(document, "check");
        return unitOfWork.isScheduledForInsert(document)
                || (unitOfWork.isInIdentityMap(document) && !unitOfWork.isScheduledForDelete(document));
    }

    /**
     * Get the repository for a document class. Repositories are created once per class.
     */
    public <T> DocumentRepository<T> getRepository(Class<T> documentClass) {
        ensureOpen();
        @SuppressWarnings("unchecked")
        DocumentRepository<T> repository = (DocumentRepository<T>) repositories.computeIfAbsent(documentClass,
                type -> new DocumentRepository<>(this, documentClass));
        return repository;
    }

    public ClassDescription getClassDescription(Class<?> documentClass) {
        return registry.describe(documentClass);
    }

    public ClassDescriptionRegistry getClassDescriptionRegistry() {
        return registry;
    }

    public UnitOfWork getUnitOfWork() {
        return unitOfWork;
    }

    public EventManager getEventManager() {
        return eventManager;
    }

    public DocumentStore getStore() {
        return store;
    }

    /**
     * Close the DocumentManager. Pending changes are discarded.
     */
    public void close() {
        if (!open) {
            return;
        }
        unitOfWork.clear();
        repositories.clear();
        open = false;
    }

    public boolean isOpen() {
        return open;
    }

    private void ensureOpen() {
        if (!open) {
            throw new DocumentManagerClosedException();
        }
    }

    private static void requireDocument(Object document, String operation) {
        if (document == null) {
            throw new IllegalArgumentException("Cannot " + operation + " null document");
        }
    }
}
