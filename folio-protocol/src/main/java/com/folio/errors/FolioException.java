package com.folio.errors;

/**
 * Base of all unchecked exceptions raised by the folio pipeline.
 */
public class FolioException extends RuntimeException {

    public FolioException(String message) {
        super(message);
    }

    public FolioException(String message, Throwable cause) {
        super(message, cause);
    }
}
