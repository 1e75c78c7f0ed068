package com.sheetengine.app.engine.formula;

public final class BinaryOpNode implements FormulaNode {
    private final BinaryOperator operator;
    private final FormulaNode left;
    private final FormulaNode right;

    public BinaryOpNode(BinaryOperator operator, FormulaNode left, FormulaNode right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public BinaryOperator getOperator() {
        return operator;
    }

    public FormulaNode getLeft() {
        return left;
    }

    public FormulaNode getRight() {
        return right;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitBinaryOp(this);
    }

    @Override
    public String toString() {
        return FormulaWriter.write(this);
    }
}
