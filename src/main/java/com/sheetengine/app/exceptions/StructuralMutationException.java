package com.sheetengine.app.exceptions;

/**
 * Thrown when a row/column insert or delete failed internally.
 * The workbook has been rolled back to its state before the operation.
 */
public class StructuralMutationException extends RuntimeException {
    public StructuralMutationException(String message, Throwable cause) {
        super(message, cause);
    }
}
