package com.sheetengine.app.exceptions;

/**
 * Thrown when a well-formed request can't be applied to the current state,
 * for example deleting the last sheet of a workbook.
 */
public class InvalidOperationException extends RuntimeException {
    public InvalidOperationException(String message) {
        super(message);
    }
}
