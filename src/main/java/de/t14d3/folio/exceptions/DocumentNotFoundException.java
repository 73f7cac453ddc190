package de.t14d3.folio.exceptions;

/**
 * Raised when a document expected to exist in the store is gone.
 */
public class DocumentNotFoundException extends FolioException {
    private final Class<?> documentType;
    private final Object identifier;

    public DocumentNotFoundException(Class<?> documentType, Object identifier) {
        super("The " + documentType.getName() + " document with identifier \"" + identifier + "\" could not be found");
        this.documentType = documentType;
        this.identifier = identifier;
    }

    public Class<?> getDocumentType() {
        return documentType;
    }

    public Object getIdentifier() {
        return identifier;
    }
}
