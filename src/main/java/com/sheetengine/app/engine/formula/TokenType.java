package com.sheetengine.app.engine.formula;

public enum TokenType {
    NUMBER,
    STRING,
    BOOLEAN,
    ERROR,
    CELL_REF,
    IDENTIFIER,
    OPERATOR,
    LPAREN,
    RPAREN,
    COMMA,
    COLON,
    EOF
}
