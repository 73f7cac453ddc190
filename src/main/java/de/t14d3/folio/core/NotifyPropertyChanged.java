package de.t14d3.folio.core;

/**
 * Implemented by documents using {@link de.t14d3.folio.mapping.ChangeTrackingPolicy#NOTIFY}.
 * The unit of work registers itself as listener when it starts managing the document;
 * the document calls the listener from its setters.
 *
 * <pre>{@code
 * public void setName(String name) {
 *     if (listener != null && !Objects.equals(this.name, name)) {
 *         listener.propertyChanged(this, "name", this.name, name);
 *     }
 *     this.name = name;
 * }
 * }</pre>
 */
public interface NotifyPropertyChanged {
    void addPropertyChangedListener(PropertyChangedListener listener);
}
