package de.t14d3.folio.event;

import de.t14d3.folio.core.DocumentManager;

/**
 * Arguments passed to {@link LifecycleListener}s.
 */
public class LifecycleEventArgs {
    private final LifecycleEvent event;
    private final Object document;
    private final DocumentManager documentManager;

    public LifecycleEventArgs(LifecycleEvent event, Object document, DocumentManager documentManager) {
        this.event = event;
        this.document = document;
        this.documentManager = documentManager;
    }

    public LifecycleEvent getEvent() {
        return event;
    }

    /**
     * The document the event is about, or null for {@link LifecycleEvent#ON_FLUSH}.
     */
    public Object getDocument() {
        return document;
    }

    public DocumentManager getDocumentManager() {
        return documentManager;
    }
}
