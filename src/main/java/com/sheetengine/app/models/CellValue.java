package com.sheetengine.app.models;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Objects;

/**
 * Typed value held by a cell: blank, number, string, boolean or an error sentinel.
 * Instances are immutable; use the static factories.
 */
public final class CellValue {

    public enum Type {
        BLANK,
        NUMBER,
        STRING,
        BOOLEAN,
        ERROR
    }

    public static final CellValue BLANK = new CellValue(Type.BLANK, 0d, null, false, null);
    public static final CellValue TRUE = new CellValue(Type.BOOLEAN, 0d, null, true, null);
    public static final CellValue FALSE = new CellValue(Type.BOOLEAN, 0d, null, false, null);
    public static final CellValue ZERO = new CellValue(Type.NUMBER, 0d, null, false, null);

    private final Type type;
    private final double number;
    private final String text;
    private final boolean bool;
    private final ErrorCode error;

    private CellValue(Type type, double number, String text, boolean bool, ErrorCode error) {
        this.type = type;
        this.number = number;
        this.text = text;
        this.bool = bool;
        this.error = error;
    }

    public static CellValue number(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return error(ErrorCode.ERROR);
        }
        return new CellValue(Type.NUMBER, value, null, false, null);
    }

    public static CellValue string(String value) {
        return new CellValue(Type.STRING, 0d, value == null ? "" : value, false, null);
    }

    public static CellValue bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static CellValue error(ErrorCode code) {
        return new CellValue(Type.ERROR, 0d, null, false, Objects.requireNonNull(code));
    }

    /**
     * Converts a plain Java/JSON value (Number, String, Boolean, null) into a CellValue.
     * Strings spelling an error code stay strings; only the engine produces errors.
     */
    public static CellValue fromObject(Object raw) {
        if (raw == null) {
            return BLANK;
        }
        if (raw instanceof CellValue) {
            return (CellValue) raw;
        }
        if (raw instanceof Number) {
            return number(((Number) raw).doubleValue());
        }
        if (raw instanceof Boolean) {
            return bool((Boolean) raw);
        }
        String s = raw.toString();
        return s.isEmpty() ? BLANK : string(s);
    }

    public Type getType() {
        return type;
    }

    public boolean isBlank() {
        return type == Type.BLANK;
    }

    public boolean isNumber() {
        return type == Type.NUMBER;
    }

    public boolean isString() {
        return type == Type.STRING;
    }

    public boolean isBoolean() {
        return type == Type.BOOLEAN;
    }

    public boolean isError() {
        return type == Type.ERROR;
    }

    public double getNumber() {
        return number;
    }

    public String getString() {
        return text;
    }

    public boolean getBoolean() {
        return bool;
    }

    public ErrorCode getError() {
        return error;
    }

    /**
     * True for numbers and for strings that parse as a number.
     */
    public boolean isNumeric() {
        if (type == Type.NUMBER) {
            return true;
        }
        return type == Type.STRING && parseNumber(text) != null;
    }

    /**
     * Arithmetic coercion: blank and non-numeric text become 0, booleans 1/0.
     * Callers must handle errors before coercing.
     */
    public double toNumber() {
        switch (type) {
            case NUMBER:
                return number;
            case BOOLEAN:
                return bool ? 1d : 0d;
            case STRING:
                Double parsed = parseNumber(text);
                return parsed == null ? 0d : parsed;
            default:
                return 0d;
        }
    }

    public String toText() {
        switch (type) {
            case NUMBER:
                return formatNumber(number);
            case STRING:
                return text;
            case BOOLEAN:
                return bool ? "TRUE" : "FALSE";
            case ERROR:
                return error.getText();
            default:
                return "";
        }
    }

    public boolean toBoolean() {
        switch (type) {
            case BOOLEAN:
                return bool;
            case NUMBER:
                return number != 0d;
            case STRING:
                String s = text.trim();
                if (s.equalsIgnoreCase("true")) {
                    return true;
                }
                if (s.equalsIgnoreCase("false")) {
                    return false;
                }
                Double parsed = parseNumber(s);
                if (parsed != null) {
                    return parsed != 0d;
                }
                return !s.isEmpty();
            default:
                return false;
        }
    }

    /**
     * Plain Java representation for JSON responses: Long for integral numbers,
     * Double otherwise, String for text and error codes, Boolean, or null for blank.
     */
    public Object toJavaObject() {
        switch (type) {
            case NUMBER:
                if (number == Math.rint(number) && Math.abs(number) < 1e15) {
                    return (long) number;
                }
                return number;
            case STRING:
                return text;
            case BOOLEAN:
                return bool;
            case ERROR:
                return error.getText();
            default:
                return null;
        }
    }

    /**
     * Parses text as a decimal number. Returns null for blank or non-numeric text.
     */
    public static Double parseNumber(String s) {
        if (s == null) {
            return null;
        }
        String t = s.trim();
        if (t.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(t).doubleValue();
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static String formatNumber(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellValue)) {
            return false;
        }
        CellValue that = (CellValue) o;
        if (type != that.type) {
            return false;
        }
        switch (type) {
            case NUMBER:
                return Double.compare(number, that.number) == 0;
            case STRING:
                return text.equals(that.text);
            case BOOLEAN:
                return bool == that.bool;
            case ERROR:
                return error == that.error;
            default:
                return true;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, number, text, bool, error);
    }

    @Override
    public String toString() {
        if (type == Type.STRING) {
            return "\"" + text + "\"";
        }
        if (type == Type.BLANK) {
            return "<blank>";
        }
        return toText().toUpperCase(Locale.ROOT);
    }
}
