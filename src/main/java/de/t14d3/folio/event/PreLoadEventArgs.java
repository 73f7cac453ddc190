package de.t14d3.folio.event;

import de.t14d3.folio.core.DocumentManager;

import java.util.Map;

/**
 * Arguments of {@link LifecycleEvent#PRE_LOAD}. The raw data may still be
 * modified by listeners before it is hydrated into the document.
 */
public class PreLoadEventArgs extends LifecycleEventArgs {
    private final Map<String, Object> data;

    public PreLoadEventArgs(Object document, DocumentManager documentManager, Map<String, Object> data) {
        super(LifecycleEvent.PRE_LOAD, document, documentManager);
        this.data = data;
    }

    public Map<String, Object> getData() {
        return data;
    }
}
