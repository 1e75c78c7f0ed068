package com.sheetengine.app.engine.formula;

import com.sheetengine.app.engine.functions.FunctionDefinition;
import com.sheetengine.app.models.CellRange;
import com.sheetengine.app.models.CellValue;
import com.sheetengine.app.models.DateSystem;
import com.sheetengine.app.models.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collections;
import java.util.List;

/**
 * Interprets a formula AST against cached precedent values.
 * References read cached values only; ordering is the scheduler's job.
 * Error operands short-circuit the enclosing expression, except inside
 * functions that evaluate their arguments lazily (IF).
 */
public class Evaluator implements FormulaVisitor<CellValue> {

    private static final Logger logger = LoggerFactory.getLogger(Evaluator.class);

    private final EvaluationContext context;

    public Evaluator(EvaluationContext context) {
        this.context = context;
    }

    public static CellValue evaluate(FormulaNode node, EvaluationContext context) {
        return new Evaluator(context).evaluate(node);
    }

    public CellValue evaluate(FormulaNode node) {
        return node.accept(this);
    }

    /**
     * Resolves a reference-like argument (cell, range or name) to a range view.
     * Returns null for any other expression.
     */
    public RangeView rangeOf(FormulaNode node) {
        if (node instanceof RangeRefNode) {
            return new RangeView(context.currentSheet(), ((RangeRefNode) node).getRange());
        }
        if (node instanceof CellRefNode) {
            return new RangeView(context.currentSheet(),
                    CellRange.single(((CellRefNode) node).getAddress()));
        }
        if (node instanceof NameRefNode) {
            return context.resolveName(((NameRefNode) node).getName());
        }
        return null;
    }

    /**
     * Values of an argument: lazily over the cells for references,
     * a single value for anything else.
     */
    public Iterable<CellValue> values(FormulaNode node) {
        if (node instanceof NameRefNode && context.resolveName(((NameRefNode) node).getName()) == null) {
            return Collections.singletonList(CellValue.error(ErrorCode.REF));
        }
        RangeView view = rangeOf(node);
        if (view != null) {
            return view.values();
        }
        return Collections.singletonList(evaluate(node));
    }

    public Clock clock() {
        return context.clock();
    }

    public DateSystem dateSystem() {
        return context.dateSystem();
    }

    @Override
    public CellValue visitLiteral(LiteralNode node) {
        return node.getValue();
    }

    @Override
    public CellValue visitCellRef(CellRefNode node) {
        return context.currentSheet().valueAt(node.getAddress());
    }

    @Override
    public CellValue visitRangeRef(RangeRefNode node) {
        // A multi-cell range is not a scalar
        if (node.getRange().isSingleCell()) {
            return context.currentSheet().valueAt(node.getRange().getStart());
        }
        return CellValue.error(ErrorCode.ERROR);
    }

    @Override
    public CellValue visitNameRef(NameRefNode node) {
        RangeView view = context.resolveName(node.getName());
        if (view == null) {
            return CellValue.error(ErrorCode.REF);
        }
        if (view.getRange().isSingleCell()) {
            return view.get(1, 1);
        }
        return CellValue.error(ErrorCode.ERROR);
    }

    @Override
    public CellValue visitFunctionCall(FunctionCallNode node) {
        FunctionDefinition definition = context.functions().lookup(node.getName());
        if (definition == null) {
            logger.debug("Unknown function {}", node.getName());
            return CellValue.error(ErrorCode.ERROR);
        }
        List<FormulaNode> args = node.getArguments();
        if (!definition.acceptsArity(args.size())) {
            logger.debug("Function {} called with {} arguments", node.getName(), args.size());
            return CellValue.error(ErrorCode.ERROR);
        }
        try {
            CellValue result = definition.getHandler().apply(args, this);
            return result == null ? CellValue.BLANK : result;
        } catch (RuntimeException e) {
            logger.debug("Function {} failed: {}", node.getName(), e.getMessage());
            return CellValue.error(ErrorCode.ERROR);
        }
    }

    @Override
    public CellValue visitBinaryOp(BinaryOpNode node) {
        CellValue left = evaluate(node.getLeft());
        if (left.isError()) {
            return left;
        }
        CellValue right = evaluate(node.getRight());
        if (right.isError()) {
            return right;
        }
        switch (node.getOperator()) {
            case ADD:
                return CellValue.number(left.toNumber() + right.toNumber());
            case SUBTRACT:
                return CellValue.number(left.toNumber() - right.toNumber());
            case MULTIPLY:
                return CellValue.number(left.toNumber() * right.toNumber());
            case DIVIDE:
                double divisor = right.toNumber();
                if (divisor == 0d) {
                    return CellValue.error(ErrorCode.DIV0);
                }
                return CellValue.number(left.toNumber() / divisor);
            case EQ:
                return CellValue.bool(Coercions.looseEquals(left, right));
            case NE:
                return CellValue.bool(!Coercions.looseEquals(left, right));
            case LT:
                return CellValue.bool(Coercions.compare(left, right) < 0);
            case GT:
                return CellValue.bool(Coercions.compare(left, right) > 0);
            case LE:
                return CellValue.bool(Coercions.compare(left, right) <= 0);
            case GE:
                return CellValue.bool(Coercions.compare(left, right) >= 0);
            default:
                return CellValue.error(ErrorCode.ERROR);
        }
    }

    @Override
    public CellValue visitUnaryOp(UnaryOpNode node) {
        CellValue operand = evaluate(node.getOperand());
        if (operand.isError()) {
            return operand;
        }
        if (node.getOperator() == UnaryOpNode.Operator.NEGATE) {
            return CellValue.number(-operand.toNumber());
        }
        return CellValue.number(operand.toNumber());
    }
}
