package de.t14d3.folio.core;

/**
 * Receives property changes reported by {@link NotifyPropertyChanged} documents.
 */
public interface PropertyChangedListener {
    void propertyChanged(Object document, String propertyName, Object oldValue, Object newValue);
}
