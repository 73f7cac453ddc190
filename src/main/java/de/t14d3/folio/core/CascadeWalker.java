package de.t14d3.folio.core;

import de.t14d3.folio.annotations.CascadeType;
import de.t14d3.folio.event.LifecycleEvent;
import de.t14d3.folio.exceptions.FolioException;
import de.t14d3.folio.exceptions.UnitOfWorkException;
import de.t14d3.folio.mapping.ChangeTrackingPolicy;
import de.t14d3.folio.mapping.ClassDescription;
import de.t14d3.folio.mapping.FieldMapping;
import de.t14d3.folio.store.DocumentReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Implements persist, remove, merge, detach and refresh as walks over the document
 * graph. Each public call starts with an empty identity-based visited set, so
 * cyclic graphs terminate. References are followed when their mapping cascades
 * the operation; embedded documents are always walked. Collections are walked
 * through their wrapped storage and never initialized.
 */
class CascadeWalker {
    private static final Logger LOG = LoggerFactory.getLogger(CascadeWalker.class);

    private final UnitOfWork unitOfWork;
    private final IdentityMap identityMap;

    CascadeWalker(UnitOfWork unitOfWork, IdentityMap identityMap) {
        this.unitOfWork = unitOfWork;
        this.identityMap = identityMap;
    }

    void persist(Object document) {
        doPersist(document, newVisitedSet());
    }

    void remove(Object document) {
        doRemove(document, newVisitedSet());
    }

    Object merge(Object document) {
        return doMerge(document, new IdentityHashMap<>());
    }

    void detach(Object document) {
        doDetach(document, newVisitedSet());
    }

    void refresh(Object document) {
        doRefresh(document, newVisitedSet());
    }

    private void doPersist(Object document, Set<Object> visited) {
        if (!visited.add(document)) {
            return;
        }
        ClassDescription description = unitOfWork.describe(document);
        if (description.isEmbedded()) {
            throw new FolioException("Embedded document " + description.getName()
                    + " can only be persisted through its owner");
        }
        DocumentState state = identityMap.getState(document, DocumentState.NEW);
        LOG.trace("persist {} ({})", description.getName(), state);
        switch (state) {
            case MANAGED -> {
                if (unitOfWork.getChangeTrackingPolicy(description) == ChangeTrackingPolicy.DEFERRED_EXPLICIT) {
                    unitOfWork.scheduleForDirtyCheck(document);
                }
            }
            case NEW -> unitOfWork.persistNew(description, document);
            case REMOVED -> unitOfWork.restoreRemoved(document);
            case DETACHED -> throw UnitOfWorkException.undefinedBehaviorOnDetached(document);
            default -> throw UnitOfWorkException.invalidDocumentState(document, state);
        }
        cascadePersist(description, document, visited);
    }

    private void cascadePersist(ClassDescription description, Object document, Set<Object> visited) {
        for (FieldMapping mapping : description.getAssociationMappings()) {
            if (mapping.kind().isEmbedded()) {
                for (Object embedded : values(mapping, document)) {
                    if (visited.add(embedded)) {
                        cascadePersist(unitOfWork.describe(embedded), embedded, visited);
                    }
                }
            } else if (mapping.isCascade(CascadeType.PERSIST)) {
                for (Object related : values(mapping, document)) {
                    doPersist(related, visited);
                }
            }
        }
    }

    private void doRemove(Object document, Set<Object> visited) {
        if (!visited.add(document)) {
            return;
        }
        ClassDescription description = unitOfWork.describe(document);
        DocumentState state = identityMap.getState(document, null);
        LOG.trace("remove {} ({})", description.getName(), state);
        switch (state) {
            case NEW, REMOVED -> {
                // nothing to remove
            }
            case MANAGED -> {
                unitOfWork.fireEvent(LifecycleEvent.PRE_REMOVE, description, document);
                unitOfWork.scheduleForDelete(document);
                identityMap.setState(document, DocumentState.REMOVED);
            }
            case DETACHED -> throw UnitOfWorkException.detachedCannotBeRemoved(document);
            default -> throw UnitOfWorkException.invalidDocumentState(document, state);
        }
        cascadeRemove(description, document, visited);
    }

    private void cascadeRemove(ClassDescription description, Object document, Set<Object> visited) {
        for (FieldMapping mapping : description.getAssociationMappings()) {
            if (mapping.kind().isEmbedded()) {
                for (Object embedded : values(mapping, document)) {
                    if (visited.add(embedded)) {
                        cascadeRemove(unitOfWork.describe(embedded), embedded, visited);
                    }
                }
            } else if (mapping.isCascade(CascadeType.REMOVE)) {
                for (Object related : values(mapping, document)) {
                    doRemove(related, visited);
                }
            }
        }
    }

    private void doDetach(Object document, Set<Object> visited) {
        if (!visited.add(document)) {
            return;
        }
        ClassDescription description = unitOfWork.describe(document);
        DocumentState state = identityMap.getState(document, DocumentState.DETACHED);
        LOG.trace("detach {} ({})", description.getName(), state);
        switch (state) {
            case MANAGED, REMOVED -> {
                unitOfWork.unschedule(document);
                identityMap.detach(document);
            }
            case NEW, DETACHED -> {
                return;
            }
            default -> throw UnitOfWorkException.invalidDocumentState(document, state);
        }
        cascadeDetach(description, document, visited);
    }

    private void cascadeDetach(ClassDescription description, Object document, Set<Object> visited) {
        for (FieldMapping mapping : description.getAssociationMappings()) {
            if (mapping.kind().isEmbedded()) {
                for (Object embedded : values(mapping, document)) {
                    if (visited.add(embedded)) {
                        identityMap.release(embedded);
                        cascadeDetach(unitOfWork.describe(embedded), embedded, visited);
                    }
                }
            } else if (mapping.isCascade(CascadeType.DETACH)) {
                for (Object related : values(mapping, document)) {
                    doDetach(related, visited);
                }
            }
        }
    }

    private void doRefresh(Object document, Set<Object> visited) {
        if (!visited.add(document)) {
            return;
        }
        ClassDescription description = unitOfWork.describe(document);
        DocumentState state = identityMap.getState(document, null);
        LOG.trace("refresh {} ({})", description.getName(), state);
        if (state != DocumentState.MANAGED) {
            throw UnitOfWorkException.notManaged(document);
        }
        unitOfWork.getDocumentPersister(description).refresh(document);
        cascadeRefresh(description, document, visited);
    }

    private void cascadeRefresh(ClassDescription description, Object document, Set<Object> visited) {
        for (FieldMapping mapping : description.getAssociationMappings()) {
            if (mapping.kind().isEmbedded()) {
                for (Object embedded : values(mapping, document)) {
                    if (visited.add(embedded)) {
                        cascadeRefresh(unitOfWork.describe(embedded), embedded, visited);
                    }
                }
            } else if (mapping.isCascade(CascadeType.REFRESH)) {
                for (Object related : values(mapping, document)) {
                    doRefresh(related, visited);
                }
            }
        }
    }

    private Object doMerge(Object document, Map<Object, Object> visited) {
        Object alreadyMerged = visited.get(document);
        if (alreadyMerged != null) {
            return alreadyMerged;
        }
        ClassDescription description = unitOfWork.describe(document);
        Object id = description.getIdentifierValue(document);
        if (id == null) {
            throw UnitOfWorkException.newDetectedDuringMerge(document);
        }

        DocumentState state = identityMap.getState(document, DocumentState.DETACHED);
        LOG.trace("merge {} ({})", description.getName(), state);
        Object managedCopy;
        if (state == DocumentState.MANAGED) {
            managedCopy = document;
            visited.put(document, managedCopy);
        } else if (state == DocumentState.REMOVED) {
            throw UnitOfWorkException.removedDetectedDuringMerge(document);
        } else {
            managedCopy = identityMap.tryGetById(id, description);
            if (managedCopy == null && unitOfWork.findScheduledDeletion(description, id) != null) {
                throw UnitOfWorkException.removedDetectedDuringMerge(document);
            }
            if (managedCopy != null && identityMap.getState(managedCopy, null) == DocumentState.REMOVED) {
                throw UnitOfWorkException.removedDetectedDuringMerge(document);
            }
            if (managedCopy == null) {
                managedCopy = unitOfWork.getDocumentPersister(description).load(id);
            }
            if (managedCopy == null) {
                throw UnitOfWorkException.newDetectedDuringMerge(document);
            }
            visited.put(document, managedCopy);
            copyState(description, document, managedCopy);
        }
        cascadeMerge(description, document, managedCopy, visited);
        return managedCopy;
    }

    /**
     * Copies the fields of a detached document onto its managed copy. References
     * that merge cascades along are filled in by {@link #cascadeMerge}; other
     * references are resolved to managed documents by identifier.
     */
    private void copyState(ClassDescription description, Object document, Object managedCopy) {
        for (FieldMapping mapping : description.getFieldMappings()) {
            Object value = mapping.getValue(document);
            switch (mapping.kind()) {
                case SCALAR, EMBED_ONE, EMBED_MANY -> mapping.setValue(managedCopy, value);
                case REF_ONE -> {
                    if (!mapping.isCascade(CascadeType.MERGE)) {
                        mapping.setValue(managedCopy, value == null ? null : unitOfWork.findManagedCopy(value));
                    }
                }
                case REF_MANY -> {
                    PersistentCollection<Object> collection;
                    if (mapping.isCascade(CascadeType.MERGE)) {
                        collection = new PersistentCollection<>(new ArrayList<>());
                    } else {
                        List<DocumentReference> references = new ArrayList<>();
                        for (Object related : values(mapping, document)) {
                            references.add(unitOfWork.referenceTo(related));
                        }
                        collection = new PersistentCollection<>(unitOfWork.getCollectionLoader(), references);
                    }
                    collection.setOwner(managedCopy, mapping);
                    collection.setDirty(true);
                    mapping.setValue(managedCopy, collection);
                }
                default -> throw new IllegalStateException("Unknown field kind " + mapping.kind());
            }
        }
    }

    private void cascadeMerge(ClassDescription description, Object document, Object managedCopy,
                              Map<Object, Object> visited) {
        for (FieldMapping mapping : description.getAssociationMappings()) {
            if (!mapping.kind().isReference() || !mapping.isCascade(CascadeType.MERGE)) {
                continue;
            }
            if (mapping.kind() == FieldMapping.Kind.REF_ONE) {
                Object related = mapping.getValue(document);
                Object merged = related == null ? null : doMerge(related, visited);
                if (merged != related || managedCopy != document) {
                    mapping.setValue(managedCopy, merged);
                }
            } else {
                List<Object> merged = new ArrayList<>();
                for (Object related : values(mapping, document)) {
                    merged.add(doMerge(related, visited));
                }
                if (managedCopy != document) {
                    @SuppressWarnings("unchecked")
                    PersistentCollection<Object> target = (PersistentCollection<Object>) mapping.getValue(managedCopy);
                    target.unwrap().addAll(merged);
                }
            }
        }
    }

    private static List<?> values(FieldMapping mapping, Object document) {
        return new ArrayList<>(ChangeSetComputer.values(mapping, mapping.getValue(document)));
    }

    private static Set<Object> newVisitedSet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }
}
