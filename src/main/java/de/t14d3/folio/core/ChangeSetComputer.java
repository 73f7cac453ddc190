package de.t14d3.folio.core;

import de.t14d3.folio.annotations.CascadeType;
import de.t14d3.folio.exceptions.UnitOfWorkException;
import de.t14d3.folio.mapping.ChangeTrackingPolicy;
import de.t14d3.folio.mapping.ClassDescription;
import de.t14d3.folio.mapping.FieldMapping;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Computes field-level change sets by comparing documents against their original
 * data, and discovers new documents reachable through cascade-persist references.
 * <p>
 * Scalars compare by value, single associations and collection instances by
 * reference; a collection changed in place is detected through its dirty flag.
 */
class ChangeSetComputer {
    private final UnitOfWork unitOfWork;
    private final IdentityMap identityMap;
    private final Set<Integer> computed = new HashSet<>();
    private final Set<PersistentCollection<?>> visitedCollections = Collections.newSetFromMap(new IdentityHashMap<>());

    ChangeSetComputer(UnitOfWork unitOfWork, IdentityMap identityMap) {
        this.unitOfWork = unitOfWork;
        this.identityMap = identityMap;
    }

    /**
     * Computes change sets for all queued insertions, then for every managed
     * document that its change tracking policy makes eligible.
     */
    void computeChangeSets() {
        for (Object document : unitOfWork.getScheduledDocumentInsertions()) {
            computeChangeSet(document);
        }
        for (Object document : unitOfWork.getDirtyCheckCandidates()) {
            if (!unitOfWork.isScheduledForInsert(document) && !unitOfWork.isScheduledForDelete(document)
                    && identityMap.getRecordedState(document) == DocumentState.MANAGED) {
                computeChangeSet(document);
            }
        }
    }

    void computeChangeSet(Object document) {
        computeChangeSet(document, unitOfWork.describe(document), document);
    }

    /**
     * Computes the change set of {@code document}, which is {@code rootDocument}
     * itself or a document embedded in it.
     */
    void computeChangeSet(Object rootDocument, ClassDescription description, Object document) {
        int handle = identityMap.handleOf(document);
        if (!computed.add(handle)) {
            return;
        }

        Map<String, Object> actualData = actualData(description, document);
        Map<String, Object> originalData = identityMap.getOriginalDocumentData(document);
        boolean firstSight = originalData == null;

        if (firstSight) {
            if (description.isEmbedded()) {
                identityMap.registerManaged(document, null, actualData);
            } else {
                identityMap.setOriginalDocumentData(document, actualData);
                ChangeSet changeSet = new ChangeSet();
                actualData.forEach((field, value) -> changeSet.put(field, null, value));
                unitOfWork.putDocumentChangeSet(handle, changeSet);
            }
        } else {
            boolean notify = unitOfWork.getChangeTrackingPolicy(description) == ChangeTrackingPolicy.NOTIFY;
            ChangeSet changeSet = diff(description, originalData, actualData, !notify, true);
            if (!changeSet.isEmpty()) {
                identityMap.setOriginalDocumentData(document, actualData);
                mergeChangeSet(handle, changeSet);
                scheduleForSynchronization(rootDocument);
            }
        }

        for (FieldMapping mapping : description.getAssociationMappings()) {
            Object value = mapping.getValue(document);
            if (value != null) {
                computeAssociationChanges(rootDocument, document, firstSight, mapping, value);
            }
        }
    }

    /**
     * Recomputes the change set of a managed document, typically after a
     * pre-update callback modified it. Fresh changes win over already computed ones.
     */
    void recompute(ClassDescription description, Object document) {
        if (identityMap.getRecordedState(document) != DocumentState.MANAGED) {
            throw UnitOfWorkException.invalidDocumentState(document, identityMap.getRecordedState(document));
        }
        Map<String, Object> actualData = actualData(description, document);
        Map<String, Object> originalData = identityMap.getOriginalDocumentData(document);
        ChangeSet fresh = diff(description, originalData == null ? Map.of() : originalData, actualData, true, false);
        if (!fresh.isEmpty()) {
            mergeChangeSet(identityMap.handleOf(document), fresh);
            identityMap.setOriginalDocumentData(document, actualData);
        }
    }

    Collection<PersistentCollection<?>> getVisitedCollections() {
        return visitedCollections;
    }

    /**
     * Starts a new commit cycle.
     */
    void reset() {
        computed.clear();
        visitedCollections.clear();
    }

    private ChangeSet diff(ClassDescription description, Map<String, Object> originalData,
                           Map<String, Object> actualData, boolean includeScalars, boolean scheduleOrphans) {
        ChangeSet changeSet = new ChangeSet();
        for (FieldMapping mapping : description.getFieldMappings()) {
            String field = mapping.name();
            Object originalValue = originalData.get(field);
            Object actualValue = actualData.get(field);
            switch (mapping.kind()) {
                case SCALAR:
                    if (includeScalars && scalarChanged(originalValue, actualValue)) {
                        changeSet.put(field, originalValue, actualValue);
                    }
                    break;
                case EMBED_MANY:
                case REF_MANY:
                    if (originalValue != actualValue
                            || (actualValue instanceof PersistentCollection<?> collection && collection.isDirty())) {
                        changeSet.put(field, originalValue, actualValue);
                    }
                    break;
                default:
                    if (originalValue != actualValue) {
                        changeSet.put(field, originalValue, actualValue);
                        if (scheduleOrphans && mapping.orphanRemoval() && originalValue != null) {
                            unitOfWork.scheduleOrphanRemoval(originalValue);
                        }
                    }
            }
        }
        return changeSet;
    }

    private static boolean scalarChanged(Object originalValue, Object actualValue) {
        if ((originalValue == null) != (actualValue == null)) {
            return true;
        }
        return !Objects.deepEquals(originalValue, actualValue);
    }

    /**
     * Current field values. Plain lists in collection fields are replaced by
     * persistent collections, which are written back to the document.
     */
    private Map<String, Object> actualData(ClassDescription description, Object document) {
        Map<String, Object> actualData = new LinkedHashMap<>();
        for (FieldMapping mapping : description.getFieldMappings()) {
            Object value = mapping.getValue(document);
            if (mapping.kind().isCollection() && value != null && !(value instanceof PersistentCollection)) {
                PersistentCollection<Object> collection = new PersistentCollection<>(new ArrayList<>((Collection<?>) value));
                collection.setOwner(document, mapping);
                collection.setDirty(!collection.isEmpty());
                mapping.setValue(document, collection);
                value = collection;
            }
            actualData.put(mapping.name(), value);
        }
        return actualData;
    }

    private void computeAssociationChanges(Object rootDocument, Object owner, boolean ownerFirstSight,
                                           FieldMapping mapping, Object value) {
        if (value instanceof PersistentCollection<?> collection && collection.isDirty()) {
            visitedCollections.add(collection);
        }
        boolean embedded = mapping.kind().isEmbedded();
        if (!embedded && !mapping.isCascade(CascadeType.PERSIST)) {
            return;
        }

        for (Object entry : values(mapping, value)) {
            if (entry == null) {
                continue;
            }
            ClassDescription target = unitOfWork.describe(entry);
            if (embedded) {
                computeChangeSet(rootDocument, target, entry);
                ChangeSet entryChanges = unitOfWork.getDocumentChangeSet(entry);
                if (!entryChanges.isEmpty() && !ownerFirstSight) {
                    // the embedded document is written as part of its owner
                    int ownerHandle = identityMap.handleOf(owner);
                    ChangeSet ownerChanges = unitOfWork.changeSetFor(ownerHandle);
                    if (!ownerChanges.contains(mapping.name())) {
                        ownerChanges.put(mapping.name(), value, value);
                    }
                    scheduleForSynchronization(rootDocument);
                }
                continue;
            }

            DocumentState state = identityMap.getState(entry, DocumentState.NEW);
            if (state == DocumentState.NEW) {
                unitOfWork.persistNew(target, entry);
                computeChangeSet(entry, target, entry);
            } else if (state == DocumentState.REMOVED) {
                throw UnitOfWorkException.removedDocumentInCollection(entry, mapping.name());
            }
        }
    }

    private void mergeChangeSet(int handle, ChangeSet fresh) {
        unitOfWork.changeSetFor(handle).merge(fresh);
    }

    private void scheduleForSynchronization(Object rootDocument) {
        if (!unitOfWork.describe(rootDocument).isEmbedded()) {
            unitOfWork.scheduleForSynchronization(rootDocument);
        }
    }

    static Collection<?> values(FieldMapping mapping, Object value) {
        if (value == null) {
            return List.of();
        }
        if (!mapping.kind().isCollection()) {
            return Collections.singletonList(value);
        }
        if (value instanceof PersistentCollection<?> collection) {
            return new ArrayList<>(collection.unwrap());
        }
        return new ArrayList<>((Collection<?>) value);
    }
}
