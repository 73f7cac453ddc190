package de.t14d3.folio.exceptions;

public class DocumentManagerClosedException extends FolioException {
    public DocumentManagerClosedException() {
        super("The DocumentManager is closed");
    }
}
