package com.sheetengine.app.engine.formula;

import com.sheetengine.app.models.CellValue;

/**
 * Comparison rules shared by operators, lookups and sorting.
 */
public final class Coercions {

    private Coercions() {
    }

    /**
     * Loose equality: text compares case-insensitively, numbers compare with
     * numeric text and booleans numerically, blank equals 0, "" and FALSE.
     */
    public static boolean looseEquals(CellValue a, CellValue b) {
        if (a.isBlank() || b.isBlank()) {
            CellValue other = a.isBlank() ? b : a;
            return other.isBlank()
                    || (other.isNumber() && other.getNumber() == 0d)
                    || (other.isString() && other.getString().isEmpty())
                    || (other.isBoolean() && !other.getBoolean());
        }
        if (a.isString() && b.isString()) {
            return a.getString().equalsIgnoreCase(b.getString());
        }
        if (isNumberLike(a) && isNumberLike(b)) {
            return Double.compare(a.toNumber(), b.toNumber()) == 0;
        }
        return a.toText().equalsIgnoreCase(b.toText());
    }

    /**
     * Ordering for comparison operators: numeric when both sides coerce to
     * numbers, otherwise case-insensitive text.
     */
    public static int compare(CellValue a, CellValue b) {
        if (isNumberLike(a) && isNumberLike(b)) {
            return Double.compare(a.toNumber(), b.toNumber());
        }
        return a.toText().compareToIgnoreCase(b.toText());
    }

    /**
     * Ordering for lookups and sorting: numbers before text, numbers
     * numerically, text case-insensitively.
     */
    public static int lookupCompare(CellValue a, CellValue b) {
        boolean aNumeric = a.isNumeric();
        boolean bNumeric = b.isNumeric();
        if (aNumeric && bNumeric) {
            return Double.compare(a.toNumber(), b.toNumber());
        }
        if (aNumeric != bNumeric) {
            return aNumeric ? -1 : 1;
        }
        return a.toText().compareToIgnoreCase(b.toText());
    }

    /**
     * Exact lookup match; an empty table cell never matches.
     */
    public static boolean lookupMatches(CellValue lookup, CellValue candidate) {
        return !candidate.isBlank() && looseEquals(lookup, candidate);
    }

    private static boolean isNumberLike(CellValue value) {
        return value.isNumber() || value.isBoolean() || value.isBlank() || value.isNumeric();
    }
}
