package de.t14d3.folio.event;

import de.t14d3.folio.core.ChangeSet;
import de.t14d3.folio.core.DocumentManager;

/**
 * Arguments of {@link LifecycleEvent#PRE_UPDATE}, exposing the change set about to be written.
 */
public class PreUpdateEventArgs extends LifecycleEventArgs {
    private final ChangeSet changeSet;

    public PreUpdateEventArgs(Object document, DocumentManager documentManager, ChangeSet changeSet) {
        super(LifecycleEvent.PRE_UPDATE, document, documentManager);
        this.changeSet = changeSet;
    }

    public ChangeSet getChangeSet() {
        return changeSet;
    }

    public boolean hasChangedField(String fieldName) {
        return changeSet.contains(fieldName);
    }
}
