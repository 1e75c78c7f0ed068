package com.sheetengine.app.engine.formula;

public final class UnaryOpNode implements FormulaNode {

    public enum Operator {
        NEGATE("-"),
        PLUS("+");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    private final Operator operator;
    private final FormulaNode operand;

    public UnaryOpNode(Operator operator, FormulaNode operand) {
        this.operator = operator;
        this.operand = operand;
    }

    public Operator getOperator() {
        return operator;
    }

    public FormulaNode getOperand() {
        return operand;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitUnaryOp(this);
    }

    @Override
    public String toString() {
        return FormulaWriter.write(this);
    }
}
