package de.t14d3.folio.mapping;

/**
 * Reads and writes one mapped field of a document instance.
 */
public interface FieldAccessor {
    Object get(Object document);

    void set(Object document, Object value);
}
