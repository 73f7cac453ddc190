package de.t14d3.folio.store;

/**
 * Stored form of a reference to another document.
 *
 * @param type the concrete class of the referenced document
 * @param id   its identifier
 */
public record DocumentReference(Class<?> type, Object id) {
}
