package com.sheetengine.app.engine.formula;

import com.sheetengine.app.engine.address.AddressCodec;
import com.sheetengine.app.exceptions.FormulaSyntaxException;
import com.sheetengine.app.exceptions.InvalidReferenceException;
import com.sheetengine.app.models.CellAddress;
import com.sheetengine.app.models.CellRange;
import com.sheetengine.app.models.CellValue;
import com.sheetengine.app.models.ErrorCode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Precedence-climbing parser for formula text.
 *
 * <pre>
 * comparison := additive (( = | &lt;&gt; | &lt; | &gt; | &lt;= | &gt;= ) additive)*
 * additive   := term (( + | - ) term)*
 * term       := unary (( * | / ) unary)*
 * unary      := ( - | + ) unary | primary
 * primary    := NUMBER | STRING | BOOLEAN | ERROR
 *             | CELL_REF [ : CELL_REF ]
 *             | IDENTIFIER ( args? ) | IDENTIFIER
 *             | ( comparison )
 * </pre>
 *
 * All binary operators are left-associative.
 */
public final class FormulaParser {
    private final List<Token> tokens;
    private int index;

    private FormulaParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses a formula. A leading '=' is tolerated and stripped.
     *
     * @throws FormulaSyntaxException if the text is not a valid formula
     */
    public static FormulaNode parse(String formula) {
        String body = stripEquals(formula);
        if (body.trim().isEmpty()) {
            throw new FormulaSyntaxException("Empty formula", 0);
        }
        FormulaParser parser = new FormulaParser(Tokenizer.tokenize(body));
        FormulaNode node = parser.parseExpression(0);
        Token trailing = parser.peek();
        if (!trailing.is(TokenType.EOF)) {
            throw new FormulaSyntaxException("Unexpected token " + trailing, trailing.getPosition());
        }
        return node;
    }

    public static String stripEquals(String formula) {
        if (formula == null) {
            return "";
        }
        String trimmed = formula.trim();
        return trimmed.startsWith("=") ? trimmed.substring(1) : trimmed;
    }

    /**
     * Parses binary operators whose precedence is at least minPrecedence.
     */
    private FormulaNode parseExpression(int minPrecedence) {
        FormulaNode left = parseUnary();
        while (true) {
            Token token = peek();
            if (!token.is(TokenType.OPERATOR)) {
                return left;
            }
            BinaryOperator op = BinaryOperator.fromSymbol(token.getText());
            if (op == null || op.getPrecedence() < minPrecedence) {
                return left;
            }
            advance();
            // +1 gives left associativity
            FormulaNode right = parseExpression(op.getPrecedence() + 1);
            left = new BinaryOpNode(op, left, right);
        }
    }

    private FormulaNode parseUnary() {
        Token token = peek();
        if (token.isOperator("-")) {
            advance();
            return new UnaryOpNode(UnaryOpNode.Operator.NEGATE, parseUnary());
        }
        if (token.isOperator("+")) {
            advance();
            return new UnaryOpNode(UnaryOpNode.Operator.PLUS, parseUnary());
        }
        return parsePrimary();
    }

    private FormulaNode parsePrimary() {
        Token token = advance();
        switch (token.getType()) {
            case NUMBER:
                return new LiteralNode(CellValue.number(new BigDecimal(token.getText()).doubleValue()));
            case STRING:
                return new LiteralNode(CellValue.string(token.getText()));
            case BOOLEAN:
                return new LiteralNode(CellValue.bool("TRUE".equals(token.getText())));
            case ERROR:
                return new LiteralNode(CellValue.error(ErrorCode.fromText(token.getText())));
            case CELL_REF:
                return parseReference(token);
            case IDENTIFIER:
                if (peek().is(TokenType.LPAREN)) {
                    return parseFunctionCall(token);
                }
                return new NameRefNode(token.getText());
            case LPAREN:
                FormulaNode inner = parseExpression(0);
                expect(TokenType.RPAREN, "Missing closing parenthesis");
                return inner;
            case EOF:
                throw new FormulaSyntaxException("Unexpected end of formula", token.getPosition());
            default:
                throw new FormulaSyntaxException("Unexpected token " + token, token.getPosition());
        }
    }

    private FormulaNode parseReference(Token startToken) {
        CellAddress start = decode(startToken);
        if (!peek().is(TokenType.COLON)) {
            return new CellRefNode(start);
        }
        advance();
        Token endToken = advance();
        if (!endToken.is(TokenType.CELL_REF)) {
            throw new FormulaSyntaxException("Expected cell reference after ':'", endToken.getPosition());
        }
        CellAddress end = decode(endToken);
        return new RangeRefNode(CellRange.of(start, end));
    }

    private CellAddress decode(Token token) {
        try {
            return AddressCodec.decode(token.getText());
        } catch (InvalidReferenceException e) {
            throw new FormulaSyntaxException(e.getMessage(), token.getPosition());
        }
    }

    private FormulaNode parseFunctionCall(Token nameToken) {
        expect(TokenType.LPAREN, "Expected '('");
        List<FormulaNode> args = new ArrayList<>();
        if (peek().is(TokenType.RPAREN)) {
            advance();
            return new FunctionCallNode(nameToken.getText(), args);
        }
        while (true) {
            args.add(parseExpression(0));
            Token separator = advance();
            if (separator.is(TokenType.RPAREN)) {
                return new FunctionCallNode(nameToken.getText(), args);
            }
            if (!separator.is(TokenType.COMMA)) {
                throw new FormulaSyntaxException(
                        "Expected ',' or ')' in call to " + nameToken.getText(), separator.getPosition());
            }
        }
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token advance() {
        Token token = tokens.get(index);
        if (!token.is(TokenType.EOF)) {
            index++;
        }
        return token;
    }

    private void expect(TokenType type, String message) {
        Token token = advance();
        if (!token.is(type)) {
            throw new FormulaSyntaxException(message, token.getPosition());
        }
    }
}
