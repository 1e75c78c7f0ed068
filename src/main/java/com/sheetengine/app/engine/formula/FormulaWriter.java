package com.sheetengine.app.engine.formula;

import com.sheetengine.app.models.CellValue;

import java.util.stream.Collectors;

/**
 * Renders an AST back to formula text, adding parentheses only where the
 * tree shape differs from what precedence and left associativity imply.
 * The output re-parses to an equivalent tree.
 */
public final class FormulaWriter implements FormulaVisitor<String> {

    private static final FormulaWriter INSTANCE = new FormulaWriter();

    private FormulaWriter() {
    }

    /**
     * Text without the leading '='.
     */
    public static String write(FormulaNode node) {
        return node.accept(INSTANCE);
    }

    /**
     * Text with the leading '=', as stored on a cell.
     */
    public static String toFormulaText(FormulaNode node) {
        return "=" + write(node);
    }

    @Override
    public String visitLiteral(LiteralNode node) {
        CellValue value = node.getValue();
        if (value.isString()) {
            return "\"" + value.getString().replace("\"", "\"\"") + "\"";
        }
        if (value.isBlank()) {
            return "\"\"";
        }
        return value.toText();
    }

    @Override
    public String visitCellRef(CellRefNode node) {
        return node.getAddress().toString();
    }

    @Override
    public String visitRangeRef(RangeRefNode node) {
        return node.getRange().toString();
    }

    @Override
    public String visitNameRef(NameRefNode node) {
        return node.getName();
    }

    @Override
    public String visitFunctionCall(FunctionCallNode node) {
        return node.getName() + "(" + node.getArguments().stream()
                .map(FormulaWriter::write)
                .collect(Collectors.joining(",")) + ")";
    }

    @Override
    public String visitBinaryOp(BinaryOpNode node) {
        int precedence = node.getOperator().getPrecedence();
        String left = write(node.getLeft());
        if (bindsLooser(node.getLeft(), precedence)) {
            left = "(" + left + ")";
        }
        String right = write(node.getRight());
        // Right operand at equal precedence needs parentheses to stay right-grouped
        if (bindsLooser(node.getRight(), precedence + 1)) {
            right = "(" + right + ")";
        }
        return left + node.getOperator().getSymbol() + right;
    }

    @Override
    public String visitUnaryOp(UnaryOpNode node) {
        String operand = write(node.getOperand());
        if (node.getOperand() instanceof BinaryOpNode) {
            operand = "(" + operand + ")";
        }
        return node.getOperator().getSymbol() + operand;
    }

    private static boolean bindsLooser(FormulaNode child, int precedence) {
        return child instanceof BinaryOpNode
                && ((BinaryOpNode) child).getOperator().getPrecedence() < precedence;
    }
}
