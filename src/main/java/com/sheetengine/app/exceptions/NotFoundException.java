package com.sheetengine.app.exceptions;

/**
 * Base type for lookups of documents, sheets or charts that don't exist.
 * Mapped to HTTP 404 by the GlobalExceptionHandler.
 */
public class NotFoundException extends RuntimeException {
    public NotFoundException(String message) {
        super(message);
    }
}
