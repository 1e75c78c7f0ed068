package com.sheetengine.app.exceptions;

/**
 * Thrown when cell or range text doesn't match the A1 grammar,
 * e.g. "Invalid cell reference: 1A".
 */
public class InvalidReferenceException extends ValidationException {
    public InvalidReferenceException(String message) {
        super(message);
    }
}
