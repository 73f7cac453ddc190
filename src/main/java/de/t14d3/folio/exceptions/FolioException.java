package de.t14d3.folio.exceptions;

/**
 * Base class of every error raised by Folio.
 */
public class FolioException extends RuntimeException {
    public FolioException(String message) {
        super(message);
    }

    public FolioException(Throwable cause) {
        super(cause);
    }

    public FolioException(String message, Throwable cause) {
        super(message, cause);
    }
}
