package de.t14d3.folio.core;

import de.t14d3.folio.event.EventManager;
import de.t14d3.folio.event.LifecycleEvent;
import de.t14d3.folio.event.LifecycleEventArgs;
import de.t14d3.folio.event.PreLoadEventArgs;
import de.t14d3.folio.event.PreUpdateEventArgs;
import de.t14d3.folio.exceptions.FolioException;
import de.t14d3.folio.exceptions.UnitOfWorkException;
import de.t14d3.folio.mapping.ChangeTrackingPolicy;
import de.t14d3.folio.mapping.ClassDescription;
import de.t14d3.folio.mapping.ClassDescriptionRegistry;
import de.t14d3.folio.mapping.FieldMapping;
import de.t14d3.folio.store.DocumentPersister;
import de.t14d3.folio.store.DocumentReference;
import de.t14d3.folio.store.DocumentStore;
import de.t14d3.folio.store.InsertResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Tracks the documents of one {@link DocumentManager} and writes their changes to
 * the store on {@link #commit()}.
 * <p>
 * Documents are queued for insertion, update or deletion; a document is in at most
 * one of the queues at any time. A commit computes change sets, orders the
 * document classes by their references and then runs, in this order, all inserts,
 * a second pass for references to documents inserted in the same commit, all
 * updates and finally all deletions in reverse order.
 * <p>
 * Not thread-safe: a unit of work belongs to one call stack at a time.
 */
public class UnitOfWork implements PropertyChangedListener {
    private static final Logger LOG = LoggerFactory.getLogger(UnitOfWork.class);

    private final DocumentManager documentManager;
    private final DocumentStore store;
    private final ClassDescriptionRegistry registry;
    private final EventManager eventManager;
    private final IdentityMap identityMap;
    private final ChangeSetComputer changeSetComputer;
    private final CascadeWalker cascadeWalker;
    private final DocumentHydrator hydrator;
    private final CommitOrderCalculator commitOrderCalculator = new CommitOrderCalculator();
    private final CollectionLoader collectionLoader = this::loadCollection;

    private final Map<Class<?>, DocumentPersister> persisters = new HashMap<>();
    private final Map<Integer, Object> documentInsertions = new LinkedHashMap<>();
    private final Map<Integer, Object> documentUpdates = new LinkedHashMap<>();
    private final Map<Integer, Object> documentDeletions = new LinkedHashMap<>();
    private final Map<Integer, ChangeSet> documentChangeSets = new HashMap<>();
    private final Map<Integer, Object> scheduledForDirtyCheck = new LinkedHashMap<>();
    private final Map<Integer, Object> orphanRemovals = new LinkedHashMap<>();
    private final Map<Integer, PendingReferences> pendingReferenceUpdates = new LinkedHashMap<>();
    private final Set<Object> notifying = Collections.newSetFromMap(new IdentityHashMap<>());

    private ChangeTrackingPolicy defaultChangeTrackingPolicy = ChangeTrackingPolicy.DEFERRED_IMPLICIT;
    private boolean commitInProgress;

    private record PendingReferences(Object document, List<FieldMapping> mappings) {
    }

    public UnitOfWork(DocumentManager documentManager, DocumentStore store, ClassDescriptionRegistry registry,
                      EventManager eventManager) {
        this.documentManager = documentManager;
        this.store = store;
        this.registry = registry;
        this.eventManager = eventManager;
        this.identityMap = new IdentityMap(registry, document -> getDocumentPersister(describe(document)).exists(document));
        this.changeSetComputer = new ChangeSetComputer(this, identityMap);
        this.cascadeWalker = new CascadeWalker(this, identityMap);
        this.hydrator = new DocumentHydrator(this, identityMap);
    }

    // ---------------------------------------------------------------- lifecycle operations

    /**
     * Makes a new document managed and queues it for insertion, cascading along
     * references mapped with {@code CascadeType.PERSIST}.
     */
    public void persist(Object document) {
        cascadeWalker.persist(document);
    }

    /**
     * Queues a managed document for deletion, cascading along references mapped
     * with {@code CascadeType.REMOVE}.
     */
    public void remove(Object document) {
        cascadeWalker.remove(document);
    }

    /**
     * Copies the state of a detached document onto its managed copy, loading the
     * copy from the store when it is not in the identity map.
     *
     * @return the managed copy
     */
    public Object merge(Object document) {
        return cascadeWalker.merge(document);
    }

    public void detach(Object document) {
        cascadeWalker.detach(document);
    }

    public void refresh(Object document) {
        cascadeWalker.refresh(document);
    }

    /**
     * Writes all pending changes to the store.
     * <p>
     * On failure the exception propagates, wrapped in a {@link FolioException}
     * naming the phase and class unless it already is one. Writes that completed
     * are not rolled back, and the documents they covered have left their queue;
     * everything else stays queued.
     *
     * @throws UnitOfWorkException of kind COMMIT_ALREADY_IN_PROGRESS when called during a commit
     */
    public void commit() {
        if (commitInProgress) {
            throw UnitOfWorkException.commitAlreadyInProgress();
        }
        commitInProgress = true;
        try {
            changeSetComputer.reset();
            changeSetComputer.computeChangeSets();

            if (documentInsertions.isEmpty() && documentUpdates.isEmpty() && documentDeletions.isEmpty()
                    && orphanRemovals.isEmpty() && pendingReferenceUpdates.isEmpty()) {
                LOG.trace("Nothing to commit");
                scheduledForDirtyCheck.clear();
                return;
            }

            for (Object orphan : new ArrayList<>(orphanRemovals.values())) {
                remove(orphan);
            }

            if (eventManager.hasListeners(LifecycleEvent.ON_FLUSH)) {
                eventManager.dispatchEvent(new LifecycleEventArgs(LifecycleEvent.ON_FLUSH, null, documentManager));
            }

            List<ClassDescription> commitOrder = getCommitOrder();
            LOG.debug("Committing {} insertions, {} updates and {} deletions in order {}",
                    documentInsertions.size(), documentUpdates.size(), documentDeletions.size(), commitOrder);

            if (!documentInsertions.isEmpty()) {
                for (ClassDescription description : commitOrder) {
                    executeInserts(description);
                }
            }
            // includes reference updates left over from a failed commit
            if (!pendingReferenceUpdates.isEmpty()) {
                executeReferenceUpdates();
            }
            if (!documentUpdates.isEmpty()) {
                for (ClassDescription description : commitOrder) {
                    executeUpdates(description);
                }
            }
            if (!documentDeletions.isEmpty()) {
                for (int i = commitOrder.size() - 1; i >= 0; i--) {
                    executeDeletions(commitOrder.get(i));
                }
            }

            for (PersistentCollection<?> collection : changeSetComputer.getVisitedCollections()) {
                collection.takeSnapshot();
            }

            documentInsertions.clear();
            documentUpdates.clear();
            documentDeletions.clear();
            documentChangeSets.clear();
            scheduledForDirtyCheck.clear();
            orphanRemovals.clear();
            pendingReferenceUpdates.clear();
            changeSetComputer.reset();
        } finally {
            commitInProgress = false;
        }
    }

    /**
     * Forgets every tracked document and queued operation.
     */
    public void clear() {
        identityMap.clear();
        documentInsertions.clear();
        documentUpdates.clear();
        documentDeletions.clear();
        documentChangeSets.clear();
        scheduledForDirtyCheck.clear();
        orphanRemovals.clear();
        pendingReferenceUpdates.clear();
        notifying.clear();
        changeSetComputer.reset();
        commitOrderCalculator.clear();
    }

    // ---------------------------------------------------------------- change sets

    /**
     * Computes change sets for all queued insertions and all managed documents
     * eligible under their change tracking policy.
     */
    public void computeChangeSets() {
        changeSetComputer.computeChangeSets();
    }

    public void computeChangeSet(Object document) {
        changeSetComputer.computeChangeSet(document);
    }

    /**
     * Recomputes the change set of a managed document during a commit; changes
     * detected now win over those computed before.
     *
     * @throws UnitOfWorkException of kind INVALID_DOCUMENT_STATE if the document is not managed
     */
    public void recomputeSingleDocumentChangeSet(Object document) {
        changeSetComputer.recompute(describe(document), document);
    }

    /**
     * The change set of the document, empty when none was computed.
     */
    public ChangeSet getDocumentChangeSet(Object document) {
        Integer handle = identityMap.findHandle(document);
        ChangeSet changeSet = handle == null ? null : documentChangeSets.get(handle);
        return changeSet == null ? new ChangeSet() : changeSet;
    }

    public void clearDocumentChangeSet(Object document) {
        Integer handle = identityMap.findHandle(document);
        if (handle != null) {
            documentChangeSets.remove(handle);
        }
    }

    @Override
    public void propertyChanged(Object document, String propertyName, Object oldValue, Object newValue) {
        ClassDescription description = describe(document);
        if (!description.hasField(propertyName) || identityMap.getRecordedState(document) != DocumentState.MANAGED) {
            return;
        }
        ChangeSet changeSet = changeSetFor(identityMap.handleOf(document));
        FieldChange previous = changeSet.get(propertyName);
        changeSet.put(propertyName, previous == null ? oldValue : previous.oldValue(), newValue);
        identityMap.setOriginalDocumentProperty(document, propertyName, newValue);
        scheduleForSynchronization(document);
    }

    // ---------------------------------------------------------------- scheduling

    /**
     * @throws UnitOfWorkException of kind DUPLICATE_SCHEDULE if the document is already queued
     */
    public void scheduleForInsert(Object document) {
        int handle = identityMap.handleOf(document);
        if (documentUpdates.containsKey(handle)) {
            throw UnitOfWorkException.duplicateSchedule(document, "Dirty document can not be scheduled for insertion");
        }
        if (documentDeletions.containsKey(handle)) {
            throw UnitOfWorkException.duplicateSchedule(document, "Removed document can not be scheduled for insertion");
        }
        if (documentInsertions.containsKey(handle)) {
            throw UnitOfWorkException.duplicateSchedule(document, "Document can not be scheduled for insertion twice");
        }
        documentInsertions.put(handle, document);
        if (identityMap.getDocumentIdentifier(document) != null) {
            identityMap.addToIdentityMap(document);
        }
    }

    /**
     * Queues a managed document for update. Documents queued for insertion stay
     * there.
     *
     * @throws UnitOfWorkException of kind NO_IDENTITY without identifier, or of kind
     *                             DUPLICATE_SCHEDULE if the document is queued for deletion
     */
    public void scheduleForUpdate(Object document) {
        int handle = identityMap.handleOf(document);
        if (identityMap.getDocumentIdentifier(document) == null) {
            throw UnitOfWorkException.noIdentity(document);
        }
        if (documentDeletions.containsKey(handle)) {
            throw UnitOfWorkException.duplicateSchedule(document, "Removed document can not be scheduled for update");
        }
        if (!documentUpdates.containsKey(handle) && !documentInsertions.containsKey(handle)) {
            documentUpdates.put(handle, document);
        }
    }

    /**
     * Queues a document for deletion. A document queued for insertion is simply
     * dequeued; one that is not in the identity map is ignored.
     */
    public void scheduleForDelete(Object document) {
        int handle = identityMap.handleOf(document);
        if (documentInsertions.remove(handle) != null) {
            if (identityMap.isInIdentityMap(document)) {
                identityMap.removeFromMap(document);
            }
            documentChangeSets.remove(handle);
            return;
        }
        if (!identityMap.isInIdentityMap(document)) {
            return;
        }
        identityMap.removeFromMap(document);
        documentUpdates.remove(handle);
        scheduledForDirtyCheck.remove(handle);
        documentDeletions.putIfAbsent(handle, document);
    }

    /**
     * Marks a document for change detection on the next commit when its class uses
     * {@link ChangeTrackingPolicy#DEFERRED_EXPLICIT}.
     */
    public void scheduleForDirtyCheck(Object document) {
        scheduledForDirtyCheck.put(identityMap.handleOf(document), document);
    }

    /**
     * Removes the document on the next commit.
     */
    public void scheduleOrphanRemoval(Object document) {
        orphanRemovals.put(identityMap.handleOf(document), document);
    }

    public boolean isScheduledForInsert(Object document) {
        return isQueued(documentInsertions, document);
    }

    public boolean isScheduledForUpdate(Object document) {
        return isQueued(documentUpdates, document);
    }

    public boolean isScheduledForDelete(Object document) {
        return isQueued(documentDeletions, document);
    }

    public boolean isScheduledForDirtyCheck(Object document) {
        return isQueued(scheduledForDirtyCheck, document);
    }

    public boolean isDocumentScheduled(Object document) {
        return isScheduledForInsert(document) || isScheduledForUpdate(document) || isScheduledForDelete(document);
    }

    public List<Object> getScheduledDocumentInsertions() {
        return new ArrayList<>(documentInsertions.values());
    }

    public List<Object> getScheduledDocumentUpdates() {
        return new ArrayList<>(documentUpdates.values());
    }

    public List<Object> getScheduledDocumentDeletions() {
        return new ArrayList<>(documentDeletions.values());
    }

    public boolean hasPendingInsertions() {
        return !documentInsertions.isEmpty();
    }

    // ---------------------------------------------------------------- identity map

    public IdentityMap getIdentityMap() {
        return identityMap;
    }

    public DocumentState getDocumentState(Object document, DocumentState assumedStateIfUnknown) {
        return identityMap.getState(document, assumedStateIfUnknown);
    }

    /**
     * @see IdentityMap#registerManaged(Object, Object, Map)
     */
    public boolean registerManaged(Object document, Object id, Map<String, Object> originalData) {
        boolean registered = identityMap.registerManaged(document, id, originalData);
        if (registered) {
            registerNotifyListener(describe(document), document);
        }
        return registered;
    }

    public boolean isInIdentityMap(Object document) {
        return identityMap.isInIdentityMap(document);
    }

    public Object tryGetById(Object id, ClassDescription description) {
        return identityMap.tryGetById(id, description);
    }

    public Object getDocumentIdentifier(Object document) {
        return identityMap.getDocumentIdentifier(document);
    }

    /**
     * Number of documents in the identity map.
     */
    public int size() {
        return identityMap.size();
    }

    /**
     * Returns the managed document for the stored data, creating and hydrating it
     * when it is not in the identity map yet. An existing document is only
     * overwritten when {@code refresh} is set; pending changes to it are dropped then.
     * <p>
     * A new document enters the identity map before its fields are hydrated, so
     * references back to it resolve to the same instance.
     */
    public Object getOrCreateDocument(ClassDescription description, Map<String, Object> data, boolean refresh) {
        ClassDescription concrete = hydrator.describeStored(data, description.getType());
        Object id = data.get(DocumentHydrator.ID_KEY);
        if (id == null) {
            throw new FolioException("Stored data of " + concrete.getName() + " has no identifier");
        }
        Object document = identityMap.tryGetById(id, concrete);
        if (document != null && !refresh) {
            return document;
        }
        if (document == null) {
            document = concrete.newInstance();
            concrete.setIdentifierValue(document, id);
            registerManaged(document, id, null);
        } else {
            int handle = identityMap.handleOf(document);
            documentUpdates.remove(handle);
            documentChangeSets.remove(handle);
        }

        concrete.invokeLifecycleCallbacks(LifecycleEvent.PRE_LOAD, document);
        if (eventManager.hasListeners(LifecycleEvent.PRE_LOAD)) {
            eventManager.dispatchEvent(new PreLoadEventArgs(document, documentManager, data));
        }
        identityMap.setOriginalDocumentData(document, hydrator.hydrate(concrete, document, data));
        fireEvent(LifecycleEvent.POST_LOAD, concrete, document);
        return document;
    }

    // ---------------------------------------------------------------- configuration

    public DocumentPersister getDocumentPersister(Class<?> type) {
        return getDocumentPersister(describe(type));
    }

    public DocumentPersister getDocumentPersister(ClassDescription description) {
        return persisters.computeIfAbsent(description.getType(),
                type -> store.createPersister(description, documentManager));
    }

    public void setDocumentPersister(Class<?> type, DocumentPersister persister) {
        persisters.put(type, persister);
    }

    public CommitOrderCalculator getCommitOrderCalculator() {
        return commitOrderCalculator;
    }

    public ChangeTrackingPolicy getDefaultChangeTrackingPolicy() {
        return defaultChangeTrackingPolicy;
    }

    public void setDefaultChangeTrackingPolicy(ChangeTrackingPolicy policy) {
        this.defaultChangeTrackingPolicy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * The policy of the class, or the default when the class declares none.
     */
    public ChangeTrackingPolicy getChangeTrackingPolicy(ClassDescription description) {
        ChangeTrackingPolicy policy = description.getChangeTrackingPolicy();
        return policy != null ? policy : defaultChangeTrackingPolicy;
    }

    public ClassDescriptionRegistry getClassDescriptionRegistry() {
        return registry;
    }

    public CollectionLoader getCollectionLoader() {
        return collectionLoader;
    }

    // ---------------------------------------------------------------- collaborators

    ClassDescription describe(Object document) {
        return registry.describe(document.getClass());
    }

    ClassDescription describe(Class<?> type) {
        return registry.describe(type);
    }

    ClassDescription describe(String typeName) {
        return registry.describe(typeName);
    }

    /**
     * NEW to MANAGED: pre-persist hooks, then queued for insertion.
     */
    void persistNew(ClassDescription description, Object document) {
        fireEvent(LifecycleEvent.PRE_PERSIST, description, document);
        identityMap.setState(document, DocumentState.MANAGED);
        Object id = description.getIdentifierValue(document);
        if (id != null) {
            // assigned identifiers enter the identity map right away
            identityMap.setDocumentIdentifier(document, id);
        }
        registerNotifyListener(description, document);
        scheduleForInsert(document);
    }

    /**
     * Makes a removed document managed again, either by dequeuing its deletion or
     * by queuing it for insertion.
     */
    void restoreRemoved(Object document) {
        int handle = identityMap.handleOf(document);
        identityMap.setState(document, DocumentState.MANAGED);
        if (documentDeletions.remove(handle) != null) {
            if (!identityMap.addToIdentityMap(document)) {
                throw UnitOfWorkException.invalidDocumentState(document, DocumentState.REMOVED);
            }
        } else {
            scheduleForInsert(document);
        }
    }

    /**
     * Drops the document from every queue and its change set.
     */
    void unschedule(Object document) {
        Integer handle = identityMap.findHandle(document);
        if (handle == null) {
            return;
        }
        documentInsertions.remove(handle);
        documentUpdates.remove(handle);
        documentDeletions.remove(handle);
        documentChangeSets.remove(handle);
        scheduledForDirtyCheck.remove(handle);
        orphanRemovals.remove(handle);
    }

    /**
     * Queues a managed document with identifier for update unless it is already
     * queued for insertion or deletion.
     */
    void scheduleForSynchronization(Object document) {
        Integer handle = identityMap.findHandle(document);
        if (handle == null || documentInsertions.containsKey(handle) || documentDeletions.containsKey(handle)) {
            return;
        }
        if (identityMap.getRecordedState(document) != DocumentState.MANAGED
                || identityMap.getDocumentIdentifier(document) == null) {
            return;
        }
        scheduleForUpdate(document);
    }

    List<Object> getDirtyCheckCandidates() {
        List<Object> candidates = new ArrayList<>();
        for (Object document : identityMap.getManagedDocuments()) {
            ClassDescription description = describe(document);
            if (description.isEmbedded()) {
                continue;
            }
            if (getChangeTrackingPolicy(description) == ChangeTrackingPolicy.DEFERRED_EXPLICIT
                    && !isScheduledForDirtyCheck(document)) {
                continue;
            }
            candidates.add(document);
        }
        return candidates;
    }

    void putDocumentChangeSet(int handle, ChangeSet changeSet) {
        documentChangeSets.put(handle, changeSet);
    }

    ChangeSet changeSetFor(int handle) {
        return documentChangeSets.computeIfAbsent(handle, h -> new ChangeSet());
    }

    Object findScheduledDeletion(ClassDescription description, Object id) {
        for (Object document : documentDeletions.values()) {
            if (describe(document).getRootName().equals(description.getRootName())
                    && Objects.equals(identityMap.getDocumentIdentifier(document), id)) {
                return document;
            }
        }
        return null;
    }

    /**
     * The managed instance with the same identity as the given document, loading it
     * if needed; the document itself when it has no identifier or does not exist.
     */
    Object findManagedCopy(Object document) {
        ClassDescription description = describe(document);
        Object id = description.getIdentifierValue(document);
        if (id == null) {
            return document;
        }
        Object managed = identityMap.tryGetById(id, description);
        if (managed == null) {
            managed = getDocumentPersister(description).load(id);
        }
        return managed != null ? managed : document;
    }

    /**
     * The managed document a stored reference points to, or null when it no longer exists.
     */
    Object resolveReference(DocumentReference reference) {
        ClassDescription description = describe(reference.type());
        Object managed = identityMap.tryGetById(reference.id(), description);
        if (managed == null) {
            managed = getDocumentPersister(description).load(reference.id());
        }
        return managed;
    }

    DocumentReference referenceTo(Object document) {
        return new DocumentReference(document.getClass(), describe(document).getIdentifierValue(document));
    }

    void fireEvent(LifecycleEvent event, ClassDescription description, Object document) {
        description.invokeLifecycleCallbacks(event, document);
        if (eventManager.hasListeners(event)) {
            eventManager.dispatchEvent(new LifecycleEventArgs(event, document, documentManager));
        }
    }

    // ---------------------------------------------------------------- commit internals

    private List<ClassDescription> getCommitOrder() {
        Map<Class<?>, ClassDescription> types = new LinkedHashMap<>();
        for (Map<Integer, Object> queue : List.of(documentInsertions, documentUpdates, documentDeletions)) {
            for (Object document : queue.values()) {
                types.computeIfAbsent(document.getClass(), this::describe);
            }
        }
        return commitOrderCalculator.calculate(types.values(), this::describe);
    }

    private void executeInserts(ClassDescription description) {
        List<Object> documents = documentsOfType(documentInsertions, description);
        if (documents.isEmpty()) {
            return;
        }
        DocumentPersister persister = getDocumentPersister(description);
        List<PendingReferences> pendingReferences = new ArrayList<>();
        for (Object document : documents) {
            List<FieldMapping> pending = pendingReferenceMappings(description, document);
            if (!pending.isEmpty()) {
                pendingReferences.add(new PendingReferences(document, pending));
            }
        }

        List<InsertResult> results = execute("insert", description, () -> persister.executeInserts(documents));
        for (InsertResult result : results) {
            Object document = result.document();
            if (!Objects.equals(description.getIdentifierValue(document), result.identifier())) {
                description.setIdentifierValue(document, result.identifier());
            }
            identityMap.setDocumentIdentifier(document, result.identifier());
            identityMap.setState(document, DocumentState.MANAGED);
            if (!identityMap.addToIdentityMap(document)) {
                throw new FolioException("Another " + description.getName() + " with identifier "
                        + result.identifier() + " is already managed");
            }
        }
        for (Object document : documents) {
            documentInsertions.remove(identityMap.handleOf(document));
        }
        // kept until written, so a retry after a failed commit still writes them
        for (PendingReferences pending : pendingReferences) {
            pendingReferenceUpdates.put(identityMap.handleOf(pending.document()), pending);
        }
        for (Object document : documents) {
            fireEvent(LifecycleEvent.POST_PERSIST, description, document);
        }
    }

    private void executeReferenceUpdates() {
        for (Map.Entry<Integer, PendingReferences> entry : new ArrayList<>(pendingReferenceUpdates.entrySet())) {
            PendingReferences pending = entry.getValue();
            ClassDescription description = describe(pending.document());
            DocumentPersister persister = getDocumentPersister(description);
            execute("reference update", description, () -> {
                persister.updateReferences(pending.document(), pending.mappings());
                return null;
            });
            pendingReferenceUpdates.remove(entry.getKey());
        }
    }

    private void executeUpdates(ClassDescription description) {
        DocumentPersister persister = getDocumentPersister(description);
        for (Map.Entry<Integer, Object> entry : new ArrayList<>(documentUpdates.entrySet())) {
            Object document = entry.getValue();
            if (document.getClass() != description.getType()) {
                continue;
            }
            int handle = entry.getKey();
            if (description.hasLifecycleCallbacks(LifecycleEvent.PRE_UPDATE)) {
                description.invokeLifecycleCallbacks(LifecycleEvent.PRE_UPDATE, document);
                changeSetComputer.recompute(description, document);
            }
            if (eventManager.hasListeners(LifecycleEvent.PRE_UPDATE)) {
                eventManager.dispatchEvent(new PreUpdateEventArgs(document, documentManager, changeSetFor(handle)));
            }
            ChangeSet changeSet = documentChangeSets.get(handle);
            if (changeSet != null && !changeSet.isEmpty()) {
                execute("update", description, () -> {
                    persister.update(document, changeSet);
                    return null;
                });
                releaseReplacedEmbedded(description, changeSet);
            }
            documentUpdates.remove(handle);
            fireEvent(LifecycleEvent.POST_UPDATE, description, document);
        }
    }

    private void executeDeletions(ClassDescription description) {
        DocumentPersister persister = getDocumentPersister(description);
        for (Map.Entry<Integer, Object> entry : new ArrayList<>(documentDeletions.entrySet())) {
            Object document = entry.getValue();
            if (document.getClass() != description.getType()) {
                continue;
            }
            execute("delete", description, () -> {
                persister.delete(document);
                return null;
            });
            documentDeletions.remove(entry.getKey());
            documentChangeSets.remove(entry.getKey());
            pendingReferenceUpdates.remove(entry.getKey());
            releaseEmbedded(description, document);
            identityMap.release(document);
            fireEvent(LifecycleEvent.POST_REMOVE, description, document);
        }
    }

    /**
     * Forgets the embedded documents a written change set replaced or removed.
     */
    private void releaseReplacedEmbedded(ClassDescription description, ChangeSet changeSet) {
        for (Map.Entry<String, FieldChange> change : changeSet) {
            FieldMapping mapping = description.getFieldMapping(change.getKey());
            if (!mapping.kind().isEmbedded()) {
                continue;
            }
            Set<Object> kept = Collections.newSetFromMap(new IdentityHashMap<>());
            kept.addAll(ChangeSetComputer.values(mapping, change.getValue().newValue()));
            Object oldValue = change.getValue().oldValue();
            Collection<?> previous = oldValue instanceof PersistentCollection<?> collection
                    ? collection.getSnapshot()
                    : ChangeSetComputer.values(mapping, oldValue);
            for (Object embedded : previous) {
                if (!kept.contains(embedded)) {
                    releaseEmbeddedDocument(embedded);
                }
            }
        }
    }

    private void releaseEmbedded(ClassDescription description, Object document) {
        for (FieldMapping mapping : description.getAssociationMappings()) {
            if (mapping.kind().isEmbedded()) {
                for (Object embedded : ChangeSetComputer.values(mapping, mapping.getValue(document))) {
                    releaseEmbeddedDocument(embedded);
                }
            }
        }
    }

    private void releaseEmbeddedDocument(Object embedded) {
        releaseEmbedded(describe(embedded), embedded);
        identityMap.release(embedded);
    }

    /**
     * Reference fields of a document about to be inserted that point to documents
     * which get their identifier later in this commit, directly or through an
     * embedded document.
     */
    private List<FieldMapping> pendingReferenceMappings(ClassDescription description, Object document) {
        List<FieldMapping> pending = new ArrayList<>();
        Set<Object> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        for (FieldMapping mapping : description.getAssociationMappings()) {
            if (hasPendingReference(mapping, mapping.getValue(document), visited)) {
                pending.add(mapping);
            }
        }
        return pending;
    }

    private boolean hasPendingReference(FieldMapping mapping, Object value, Set<Object> visited) {
        for (Object entry : ChangeSetComputer.values(mapping, value)) {
            if (entry == null) {
                continue;
            }
            ClassDescription target = describe(entry);
            if (mapping.kind().isReference()) {
                if (isScheduledForInsert(entry) && target.getIdentifierValue(entry) == null) {
                    return true;
                }
            } else if (visited.add(entry)) {
                for (FieldMapping nested : target.getAssociationMappings()) {
                    if (hasPendingReference(nested, nested.getValue(entry), visited)) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private <T> T execute(String phase, ClassDescription description, Supplier<T> action) {
        try {
            return action.get();
        } catch (FolioException e) {
            LOG.warn("Commit failed during {} of {}: {}", phase, description.getName(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            LOG.warn("Commit failed during {} of {}: {}", phase, description.getName(), e.getMessage());
            throw new FolioException("Commit failed during " + phase + " of " + description.getName(), e);
        }
    }

    private List<Object> documentsOfType(Map<Integer, Object> queue, ClassDescription description) {
        List<Object> documents = new ArrayList<>();
        for (Object document : queue.values()) {
            if (document.getClass() == description.getType()) {
                documents.add(document);
            }
        }
        return documents;
    }

    private boolean isQueued(Map<Integer, Object> queue, Object document) {
        Integer handle = identityMap.findHandle(document);
        return handle != null && queue.containsKey(handle);
    }

    private void registerNotifyListener(ClassDescription description, Object document) {
        if (document instanceof NotifyPropertyChanged notifying
                && getChangeTrackingPolicy(description) == ChangeTrackingPolicy.NOTIFY
                && this.notifying.add(document)) {
            notifying.addPropertyChangedListener(this);
        }
    }

    private Map<Object, Object> loadCollection(Class<?> type, List<Object> ids) {
        ClassDescription description = describe(type);
        Map<Object, Object> loaded = new LinkedHashMap<>();
        for (Object document : getDocumentPersister(description).loadAll(ids)) {
            loaded.put(describe(document).getIdentifierValue(document), document);
        }
        return loaded;
    }
}
