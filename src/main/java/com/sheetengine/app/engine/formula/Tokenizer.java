package com.sheetengine.app.engine.formula;

import com.sheetengine.app.engine.address.AddressCodec;
import com.sheetengine.app.exceptions.FormulaSyntaxException;
import com.sheetengine.app.models.ErrorCode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Splits formula text (without the leading '=') into tokens.
 * Cell references, function names and booleans are upper-cased;
 * string literal contents keep their case.
 */
public final class Tokenizer {
    private final String input;
    private int pos;

    public Tokenizer(String input) {
        this.input = input;
    }

    public static List<Token> tokenize(String input) {
        return new Tokenizer(input).readAll();
    }

    public List<Token> readAll() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            Token token = next();
            tokens.add(token);
            if (token.is(TokenType.EOF)) {
                return tokens;
            }
        }
    }

    private Token next() {
        skipWhitespace();
        if (pos >= input.length()) {
            return new Token(TokenType.EOF, null, pos);
        }
        int start = pos;
        char c = input.charAt(pos);

        if (Character.isDigit(c) || (c == '.' && pos + 1 < input.length() && Character.isDigit(input.charAt(pos + 1)))) {
            return readNumber();
        }
        if (c == '"') {
            return readString();
        }
        if (c == '#') {
            return readError();
        }
        if (Character.isLetter(c) || c == '_') {
            return readWord();
        }
        switch (c) {
            case '(':
                pos++;
                return new Token(TokenType.LPAREN, "(", start);
            case ')':
                pos++;
                return new Token(TokenType.RPAREN, ")", start);
            case ',':
                pos++;
                return new Token(TokenType.COMMA, ",", start);
            case ':':
                pos++;
                return new Token(TokenType.COLON, ":", start);
            case '+':
            case '-':
            case '*':
            case '/':
            case '=':
                pos++;
                return new Token(TokenType.OPERATOR, String.valueOf(c), start);
            case '<':
                pos++;
                if (peek('>') || peek('=')) {
                    return new Token(TokenType.OPERATOR, "<" + input.charAt(pos++), start);
                }
                return new Token(TokenType.OPERATOR, "<", start);
            case '>':
                pos++;
                if (peek('=')) {
                    pos++;
                    return new Token(TokenType.OPERATOR, ">=", start);
                }
                return new Token(TokenType.OPERATOR, ">", start);
            default:
                throw new FormulaSyntaxException("Unexpected character '" + c + "'", start);
        }
    }

    private boolean peek(char expected) {
        return pos < input.length() && input.charAt(pos) == expected;
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    private Token readNumber() {
        int start = pos;
        while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
            pos++;
        }
        if (peek('.')) {
            pos++;
            while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                pos++;
            }
        }
        if (pos < input.length() && (input.charAt(pos) == 'e' || input.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (peek('+') || peek('-')) {
                pos++;
            }
            if (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                    pos++;
                }
            } else {
                // Not an exponent after all, e.g. "2E" would be a number then a name
                pos = mark;
            }
        }
        return new Token(TokenType.NUMBER, input.substring(start, pos), start);
    }

    private Token readString() {
        int start = pos;
        pos++; // opening quote
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '"') {
                if (pos + 1 < input.length() && input.charAt(pos + 1) == '"') {
                    sb.append('"');
                    pos += 2;
                    continue;
                }
                pos++;
                return new Token(TokenType.STRING, sb.toString(), start);
            }
            sb.append(c);
            pos++;
        }
        throw new FormulaSyntaxException("Unterminated string literal", start);
    }

    private Token readError() {
        int start = pos;
        String rest = input.substring(pos).toUpperCase(Locale.ROOT);
        for (ErrorCode code : ErrorCode.values()) {
            if (rest.startsWith(code.getText())) {
                pos += code.getText().length();
                return new Token(TokenType.ERROR, code.getText(), start);
            }
        }
        throw new FormulaSyntaxException("Unknown error literal", start);
    }

    private Token readWord() {
        int start = pos;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '.') {
                pos++;
            } else {
                break;
            }
        }
        String word = input.substring(start, pos).toUpperCase(Locale.ROOT);
        if (AddressCodec.isCellReference(word)) {
            return new Token(TokenType.CELL_REF, word, start);
        }
        if (word.equals("TRUE") || word.equals("FALSE")) {
            // TRUE() and FALSE() are function-call spellings of the same constants
            if (!nextIsOpenParen()) {
                return new Token(TokenType.BOOLEAN, word, start);
            }
        }
        return new Token(TokenType.IDENTIFIER, word, start);
    }

    private boolean nextIsOpenParen() {
        int p = pos;
        while (p < input.length() && Character.isWhitespace(input.charAt(p))) {
            p++;
        }
        return p < input.length() && input.charAt(p) == '(';
    }
}
