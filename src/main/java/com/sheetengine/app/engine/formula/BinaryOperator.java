package com.sheetengine.app.engine.formula;

/**
 * Binary operators with their binding strength; higher binds tighter.
 * Comparisons sit below additive operators, multiplicative above.
 */
public enum BinaryOperator {
    EQ("=", 1),
    NE("<>", 1),
    LT("<", 1),
    GT(">", 1),
    LE("<=", 1),
    GE(">=", 1),
    ADD("+", 2),
    SUBTRACT("-", 2),
    MULTIPLY("*", 3),
    DIVIDE("/", 3);

    private final String symbol;
    private final int precedence;

    BinaryOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getPrecedence() {
        return precedence;
    }

    public boolean isComparison() {
        return precedence == 1;
    }

    public static BinaryOperator fromSymbol(String symbol) {
        for (BinaryOperator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        return null;
    }
}
