package de.t14d3.folio.exceptions;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when an operation of the unit of work violates one of its invariants.
 * The {@link Kind} tells callers which invariant was hit.
 */
public class UnitOfWorkException extends FolioException {

    public enum Kind {
        INVALID_DOCUMENT_STATE,
        NO_IDENTITY,
        DUPLICATE_SCHEDULE,
        REMOVED_DOCUMENT_IN_COLLECTION,
        COMMIT_ORDER_CYCLE,
        NEW_DETECTED_DURING_MERGE,
        REMOVED_DETECTED_DURING_MERGE,
        COMMIT_ALREADY_IN_PROGRESS,
        UNDEFINED_BEHAVIOR_ON_DETACHED,
        DETACHED_CANNOT_BE_REMOVED,
        NOT_MANAGED
    }

    private final Kind kind;

    public UnitOfWorkException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public static UnitOfWorkException invalidDocumentState(Object document, Object state) {
        return new UnitOfWorkException(Kind.INVALID_DOCUMENT_STATE,
                "Invalid document state " + state + " for " + describe(document));
    }

    public static UnitOfWorkException noIdentity(Object document) {
        return new UnitOfWorkException(Kind.NO_IDENTITY, "The given document has no identity: " + describe(document));
    }

    public static UnitOfWorkException duplicateSchedule(Object document, String reason) {
        return new UnitOfWorkException(Kind.DUPLICATE_SCHEDULE, reason + ": " + describe(document));
    }

    public static UnitOfWorkException removedDocumentInCollection(Object document, String fieldName) {
        return new UnitOfWorkException(Kind.REMOVED_DOCUMENT_IN_COLLECTION,
                "Removed document " + describe(document) + " detected in field '" + fieldName + "'");
    }

    public static UnitOfWorkException commitOrderCycle(List<Class<?>> cycle) {
        String path = cycle.stream().map(Class::getSimpleName).collect(Collectors.joining(" -> "));
        return new UnitOfWorkException(Kind.COMMIT_ORDER_CYCLE,
                "Cyclic dependency between required references: " + path);
    }

    public static UnitOfWorkException newDetectedDuringMerge(Object document) {
        return new UnitOfWorkException(Kind.NEW_DETECTED_DURING_MERGE,
                "New document detected during merge. Persist the new document before merging: " + describe(document));
    }

    public static UnitOfWorkException removedDetectedDuringMerge(Object document) {
        return new UnitOfWorkException(Kind.REMOVED_DETECTED_DURING_MERGE,
                "Removed document detected during merge. Can not merge with a removed document: " + describe(document));
    }

    public static UnitOfWorkException commitAlreadyInProgress() {
        return new UnitOfWorkException(Kind.COMMIT_ALREADY_IN_PROGRESS,
                "A commit is already in progress on this unit of work");
    }

    public static UnitOfWorkException undefinedBehaviorOnDetached(Object document) {
        return new UnitOfWorkException(Kind.UNDEFINED_BEHAVIOR_ON_DETACHED,
                "Behavior of persist() for a detached document is not defined: " + describe(document));
    }

    public static UnitOfWorkException detachedCannotBeRemoved(Object document) {
        return new UnitOfWorkException(Kind.DETACHED_CANNOT_BE_REMOVED,
                "Detached document cannot be removed: " + describe(document));
    }

    public static UnitOfWorkException notManaged(Object document) {
        return new UnitOfWorkException(Kind.NOT_MANAGED, "Document is not managed: " + describe(document));
    }

    private static String describe(Object document) {
        if (document == null) {
            return "null";
        }
        return document.getClass().getName() + "@" + Integer.toHexString(System.identityHashCode(document));
    }
}
