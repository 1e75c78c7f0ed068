package com.sheetengine.app.engine.formula;

/**
 * Reference to a workbook-level named range, resolved at evaluation time.
 */
public final class NameRefNode implements FormulaNode {
    private final String name;

    public NameRefNode(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitNameRef(this);
    }

    @Override
    public String toString() {
        return FormulaWriter.write(this);
    }
}
