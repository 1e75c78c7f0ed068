package com.sheetengine.app.persistence;

/**
 * Raised by a DocumentStore that failed to load or save.
 */
public class DocumentStoreException extends RuntimeException {
    public DocumentStoreException(String message) {
        super(message);
    }

    public DocumentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
