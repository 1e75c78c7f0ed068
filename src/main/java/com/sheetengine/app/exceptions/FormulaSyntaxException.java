package com.sheetengine.app.exceptions;

/**
 * Thrown by the formula parser for unbalanced parentheses, unknown
 * characters or trailing input. Never escapes a cell write: the cell
 * keeps its formula text and shows #ERROR!.
 */
public class FormulaSyntaxException extends RuntimeException {
    private final int position;

    public FormulaSyntaxException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
