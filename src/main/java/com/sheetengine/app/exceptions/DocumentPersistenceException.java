package com.sheetengine.app.exceptions;

/**
 * Thrown when the document store rejected a save. The in-memory workbook
 * keeps the change; the caller decides whether to retry through flush.
 */
public class DocumentPersistenceException extends RuntimeException {
    public DocumentPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
