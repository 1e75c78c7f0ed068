package com.sheetengine.app.engine.functions;

import com.sheetengine.app.engine.formula.Coercions;
import com.sheetengine.app.engine.formula.Evaluator;
import com.sheetengine.app.engine.formula.FormulaNode;
import com.sheetengine.app.engine.formula.NameRefNode;
import com.sheetengine.app.engine.formula.RangeView;
import com.sheetengine.app.models.CellValue;
import com.sheetengine.app.models.ErrorCode;

import java.util.List;

/**
 * VLOOKUP, HLOOKUP, INDEX and MATCH.
 * <p>
 * Approximate matching assumes the lookup vector is sorted (ascending for
 * VLOOKUP/HLOOKUP and MATCH type 1, descending for MATCH type -1) and stops
 * at the first value past the lookup value. Ordering puts numbers before
 * text and compares text case-insensitively.
 */
final class LookupFunctions {

    private LookupFunctions() {
    }

    static void registerAll(FunctionRegistry registry) {
        registry.register("VLOOKUP", 3, 4, (args, ev) -> lookup(args, ev, true));
        registry.register("HLOOKUP", 3, 4, (args, ev) -> lookup(args, ev, false));
        registry.register("INDEX", 2, 3, LookupFunctions::index);
        registry.register("MATCH", 2, 3, LookupFunctions::match);
    }

    /**
     * VLOOKUP when vertical, HLOOKUP otherwise. The fourth argument is the
     * exact flag: FALSE (default) selects the largest key not above the value,
     * TRUE requires equality.
     */
    static CellValue lookup(List<FormulaNode> args, Evaluator evaluator, boolean vertical) {
        CellValue needle = evaluator.evaluate(args.get(0));
        if (needle.isError()) {
            return needle;
        }
        RangeView table = evaluator.rangeOf(args.get(1));
        if (table == null) {
            return missingRange(args.get(1));
        }
        CellValue indexValue = evaluator.evaluate(args.get(2));
        if (indexValue.isError()) {
            return indexValue;
        }
        boolean exact = false;
        if (args.size() > 3) {
            CellValue flag = evaluator.evaluate(args.get(3));
            if (flag.isError()) {
                return flag;
            }
            exact = flag.toBoolean();
        }

        int index = (int) indexValue.toNumber();
        int span = vertical ? table.width() : table.height();
        if (index < 1) {
            return CellValue.error(ErrorCode.ERROR);
        }
        if (index > span) {
            return CellValue.error(ErrorCode.REF);
        }

        int length = vertical ? table.height() : table.width();
        int found = exact
                ? findExact(table, needle, length, vertical)
                : findAscending(table, needle, length, vertical);
        if (found == 0) {
            return CellValue.error(ErrorCode.NA);
        }
        return vertical ? table.get(found, index) : table.get(index, found);
    }

    /**
     * INDEX(range, row[, col]). On a single-row range the two-argument form
     * takes the second argument as the column.
     */
    static CellValue index(List<FormulaNode> args, Evaluator evaluator) {
        RangeView range = evaluator.rangeOf(args.get(0));
        if (range == null) {
            return missingRange(args.get(0));
        }
        CellValue first = evaluator.evaluate(args.get(1));
        if (first.isError()) {
            return first;
        }
        int row;
        int col;
        if (args.size() > 2) {
            CellValue second = evaluator.evaluate(args.get(2));
            if (second.isError()) {
                return second;
            }
            row = (int) first.toNumber();
            col = (int) second.toNumber();
        } else if (range.height() == 1 && range.width() > 1) {
            row = 1;
            col = (int) first.toNumber();
        } else {
            row = (int) first.toNumber();
            col = 1;
        }
        if (row < 1 || col < 1 || row > range.height() || col > range.width()) {
            return CellValue.error(ErrorCode.REF);
        }
        return range.get(row, col);
    }

    /**
     * MATCH(value, range[, type]). Type 0 is exact, 1 (default) largest
     * not above, -1 smallest not below. Only one-dimensional ranges match.
     */
    static CellValue match(List<FormulaNode> args, Evaluator evaluator) {
        CellValue needle = evaluator.evaluate(args.get(0));
        if (needle.isError()) {
            return needle;
        }
        RangeView range = evaluator.rangeOf(args.get(1));
        if (range == null) {
            return missingRange(args.get(1));
        }
        int type = 1;
        if (args.size() > 2) {
            CellValue typeValue = evaluator.evaluate(args.get(2));
            if (typeValue.isError()) {
                return typeValue;
            }
            type = (int) Math.signum(typeValue.toNumber());
        }
        if (range.height() > 1 && range.width() > 1) {
            return CellValue.error(ErrorCode.NA);
        }
        boolean vertical = range.width() == 1;
        int length = vertical ? range.height() : range.width();
        int found;
        if (type == 0) {
            found = findExact(range, needle, length, vertical);
        } else if (type > 0) {
            found = findAscending(range, needle, length, vertical);
        } else {
            found = findDescending(range, needle, length, vertical);
        }
        return found == 0 ? CellValue.error(ErrorCode.NA) : CellValue.number(found);
    }

    private static int findExact(RangeView range, CellValue needle, int length, boolean vertical) {
        for (int i = 1; i <= length; i++) {
            if (Coercions.lookupMatches(needle, keyAt(range, i, vertical))) {
                return i;
            }
        }
        return 0;
    }

    private static int findAscending(RangeView range, CellValue needle, int length, boolean vertical) {
        int best = 0;
        for (int i = 1; i <= length; i++) {
            CellValue key = keyAt(range, i, vertical);
            if (key.isBlank() || key.isError()) {
                continue;
            }
            if (Coercions.lookupCompare(key, needle) > 0) {
                break;
            }
            best = i;
        }
        return best;
    }

    private static int findDescending(RangeView range, CellValue needle, int length, boolean vertical) {
        int best = 0;
        for (int i = 1; i <= length; i++) {
            CellValue key = keyAt(range, i, vertical);
            if (key.isBlank() || key.isError()) {
                continue;
            }
            if (Coercions.lookupCompare(key, needle) < 0) {
                break;
            }
            best = i;
        }
        return best;
    }

    private static CellValue keyAt(RangeView range, int i, boolean vertical) {
        return vertical ? range.get(i, 1) : range.get(1, i);
    }

    private static CellValue missingRange(FormulaNode node) {
        // An unresolved name is a broken reference; any other non-reference is a value error
        return CellValue.error(node instanceof NameRefNode ? ErrorCode.REF : ErrorCode.ERROR);
    }
}
