package de.t14d3.folio.store;

import de.t14d3.folio.core.DocumentManager;
import de.t14d3.folio.mapping.ClassDescription;

/**
 * Backing store of a {@link DocumentManager}. The unit of work asks it for one
 * persister per document class and caches the result.
 */
public interface DocumentStore {
    DocumentPersister createPersister(ClassDescription description, DocumentManager documentManager);
}
