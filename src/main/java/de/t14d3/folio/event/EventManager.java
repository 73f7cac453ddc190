package de.t14d3.folio.event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps the listeners registered per lifecycle event and dispatches events to them
 * in registration order.
 */
public class EventManager {
    private final Map<LifecycleEvent, List<LifecycleListener>> listeners = new EnumMap<>(LifecycleEvent.class);

    public void addListener(LifecycleEvent event, LifecycleListener listener) {
        if (event == null || listener == null) {
            throw new IllegalArgumentException("event and listener must not be null");
        }
        listeners.computeIfAbsent(event, e -> new ArrayList<>()).add(listener);
    }

    public boolean removeListener(LifecycleEvent event, LifecycleListener listener) {
        List<LifecycleListener> registered = listeners.get(event);
        return registered != null && registered.remove(listener);
    }

    public boolean hasListeners(LifecycleEvent event) {
        List<LifecycleListener> registered = listeners.get(event);
        return registered != null && !registered.isEmpty();
    }

    public List<LifecycleListener> getListeners(LifecycleEvent event) {
        return Collections.unmodifiableList(listeners.getOrDefault(event, List.of()));
    }

    public void dispatchEvent(LifecycleEventArgs args) {
        List<LifecycleListener> registered = listeners.get(args.getEvent());
        if (registered == null) {
            return;
        }
        // copy so listeners may register further listeners while being notified
        for (LifecycleListener listener : new ArrayList<>(registered)) {
            listener.handle(args);
        }
    }
}
