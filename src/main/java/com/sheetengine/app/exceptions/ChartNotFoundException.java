package com.sheetengine.app.exceptions;

public class ChartNotFoundException extends NotFoundException {
    public ChartNotFoundException(String message) {
        super(message);
    }
}
