package com.sheetengine.app.exceptions;

/**
 * Thrown when a request is malformed: bad range syntax, a cell input
 * carrying both a value and a formula, a non-positive row count, etc.
 */
public class ValidationException extends RuntimeException {
    public ValidationException(String message) {
        super(message);
    }
}
