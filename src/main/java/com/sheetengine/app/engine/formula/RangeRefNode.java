package com.sheetengine.app.engine.formula;

import com.sheetengine.app.models.CellRange;

public final class RangeRefNode implements FormulaNode {
    private final CellRange range;

    public RangeRefNode(CellRange range) {
        this.range = range;
    }

    public CellRange getRange() {
        return range;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitRangeRef(this);
    }

    @Override
    public String toString() {
        return FormulaWriter.write(this);
    }
}
