package de.t14d3.folio.store;

/**
 * Identifier assigned to a document by {@link DocumentPersister#executeInserts(java.util.List)}.
 */
public record InsertResult(Object identifier, Object document) {
}
