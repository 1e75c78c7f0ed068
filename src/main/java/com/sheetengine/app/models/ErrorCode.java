package com.sheetengine.app.models;

/**
 * Spreadsheet-style in-cell error sentinels.
 * These are values stored in cells, never thrown.
 */
public enum ErrorCode {
    ERROR("#ERROR!"),
    REF("#REF!"),
    NA("#N/A"),
    CIRC("#CIRC!"),
    DIV0("#DIV/0!");

    private final String text;

    ErrorCode(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    /**
     * Looks up an error by its display text, e.g. "#REF!". Returns null if unknown.
     */
    public static ErrorCode fromText(String text) {
        if (text == null) {
            return null;
        }
        for (ErrorCode code : values()) {
            if (code.text.equalsIgnoreCase(text.trim())) {
                return code;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return text;
    }
}
