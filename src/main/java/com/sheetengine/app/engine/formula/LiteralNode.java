package com.sheetengine.app.engine.formula;

import com.sheetengine.app.models.CellValue;

/**
 * Number, string, boolean or error constant. A reference destroyed by a
 * row/column delete is replaced by an error literal holding #REF!.
 */
public final class LiteralNode implements FormulaNode {
    private final CellValue value;

    public LiteralNode(CellValue value) {
        this.value = value;
    }

    public CellValue getValue() {
        return value;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public String toString() {
        return FormulaWriter.write(this);
    }
}
