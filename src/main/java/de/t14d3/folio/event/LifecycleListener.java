package de.t14d3.folio.event;

@FunctionalInterface
public interface LifecycleListener {
    void handle(LifecycleEventArgs args);
}
