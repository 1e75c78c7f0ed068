package com.sheetengine.app.engine.formula;

import com.sheetengine.app.models.CellAddress;

public final class CellRefNode implements FormulaNode {
    private final CellAddress address;

    public CellRefNode(CellAddress address) {
        this.address = address;
    }

    public CellAddress getAddress() {
        return address;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitCellRef(this);
    }

    @Override
    public String toString() {
        return FormulaWriter.write(this);
    }
}
