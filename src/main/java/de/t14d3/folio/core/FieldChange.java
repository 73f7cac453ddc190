package de.t14d3.folio.core;

/**
 * Old and new value of one field. The old value of a document that was never
 * written is always null.
 */
public record FieldChange(Object oldValue, Object newValue) {
}
