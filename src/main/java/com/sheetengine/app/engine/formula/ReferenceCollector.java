package com.sheetengine.app.engine.formula;

import com.sheetengine.app.models.CellAddress;
import com.sheetengine.app.models.CellRange;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Walks an AST and gathers its precedents. Every branch is visited, IF's
 * untaken one included, so edges do not depend on current values.
 */
public final class ReferenceCollector implements FormulaVisitor<Void> {

    private final Set<CellAddress> cells = new LinkedHashSet<>();
    private final Set<CellRange> ranges = new LinkedHashSet<>();
    private final Set<String> names = new LinkedHashSet<>();

    private ReferenceCollector() {
    }

    public static FormulaReferences collect(FormulaNode node) {
        if (node == null) {
            return FormulaReferences.NONE;
        }
        ReferenceCollector collector = new ReferenceCollector();
        node.accept(collector);
        return new FormulaReferences(collector.cells, collector.ranges, collector.names);
    }

    @Override
    public Void visitLiteral(LiteralNode node) {
        return null;
    }

    @Override
    public Void visitCellRef(CellRefNode node) {
        cells.add(node.getAddress());
        return null;
    }

    @Override
    public Void visitRangeRef(RangeRefNode node) {
        ranges.add(node.getRange());
        return null;
    }

    @Override
    public Void visitNameRef(NameRefNode node) {
        names.add(node.getName());
        return null;
    }

    @Override
    public Void visitFunctionCall(FunctionCallNode node) {
        for (FormulaNode arg : node.getArguments()) {
            arg.accept(this);
        }
        return null;
    }

    @Override
    public Void visitBinaryOp(BinaryOpNode node) {
        node.getLeft().accept(this);
        node.getRight().accept(this);
        return null;
    }

    @Override
    public Void visitUnaryOp(UnaryOpNode node) {
        node.getOperand().accept(this);
        return null;
    }
}
