package com.sheetengine.app.engine.structure;

import com.sheetengine.app.engine.formula.BinaryOpNode;
import com.sheetengine.app.engine.formula.CellRefNode;
import com.sheetengine.app.engine.formula.FormulaNode;
import com.sheetengine.app.engine.formula.FormulaVisitor;
import com.sheetengine.app.engine.formula.FunctionCallNode;
import com.sheetengine.app.engine.formula.LiteralNode;
import com.sheetengine.app.engine.formula.NameRefNode;
import com.sheetengine.app.engine.formula.RangeRefNode;
import com.sheetengine.app.engine.formula.UnaryOpNode;
import com.sheetengine.app.models.CellAddress;
import com.sheetengine.app.models.CellRange;
import com.sheetengine.app.models.CellValue;
import com.sheetengine.app.models.ErrorCode;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites the references of an AST for a structural shift. Untouched
 * subtrees are returned as-is, so an unchanged formula comes back as the
 * same instance. A reference whose target was deleted becomes a #REF!
 * literal; nothing points back at the old cell afterwards.
 */
public final class ReferenceRebaser implements FormulaVisitor<FormulaNode> {

    private final StructuralShift shift;

    public ReferenceRebaser(StructuralShift shift) {
        this.shift = shift;
    }

    public FormulaNode rebase(FormulaNode node) {
        return node.accept(this);
    }

    @Override
    public FormulaNode visitLiteral(LiteralNode node) {
        return node;
    }

    @Override
    public FormulaNode visitCellRef(CellRefNode node) {
        CellAddress mapped = shift.mapAddress(node.getAddress());
        if (mapped == null) {
            return brokenReference();
        }
        return mapped.equals(node.getAddress()) ? node : new CellRefNode(mapped);
    }

    @Override
    public FormulaNode visitRangeRef(RangeRefNode node) {
        CellRange mapped = shift.mapRange(node.getRange());
        if (mapped == null) {
            return brokenReference();
        }
        return mapped.equals(node.getRange()) ? node : new RangeRefNode(mapped);
    }

    @Override
    public FormulaNode visitNameRef(NameRefNode node) {
        // Names are rebased on the workbook, not in formulas
        return node;
    }

    @Override
    public FormulaNode visitFunctionCall(FunctionCallNode node) {
        List<FormulaNode> args = new ArrayList<>(node.getArguments().size());
        boolean changed = false;
        for (FormulaNode arg : node.getArguments()) {
            FormulaNode rebased = arg.accept(this);
            changed |= rebased != arg;
            args.add(rebased);
        }
        return changed ? new FunctionCallNode(node.getName(), args) : node;
    }

    @Override
    public FormulaNode visitBinaryOp(BinaryOpNode node) {
        FormulaNode left = node.getLeft().accept(this);
        FormulaNode right = node.getRight().accept(this);
        if (left == node.getLeft() && right == node.getRight()) {
            return node;
        }
        return new BinaryOpNode(node.getOperator(), left, right);
    }

    @Override
    public FormulaNode visitUnaryOp(UnaryOpNode node) {
        FormulaNode operand = node.getOperand().accept(this);
        return operand == node.getOperand() ? node : new UnaryOpNode(node.getOperator(), operand);
    }

    private static FormulaNode brokenReference() {
        return new LiteralNode(CellValue.error(ErrorCode.REF));
    }
}
