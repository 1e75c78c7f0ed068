package com.sheetengine.app.exceptions;

/**
 * Thrown when attempting to access a sheet ID
 * that doesn't exist in the workbook.
 */
public class SheetNotFoundException extends NotFoundException {
    public SheetNotFoundException(String message) {
        super(message);
    }
}
