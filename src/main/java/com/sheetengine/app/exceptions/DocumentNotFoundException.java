package com.sheetengine.app.exceptions;

/**
 * Thrown when a document ID is neither loaded in memory
 * nor present in the document store.
 */
public class DocumentNotFoundException extends NotFoundException {
    public DocumentNotFoundException(String message) {
        super(message);
    }
}
