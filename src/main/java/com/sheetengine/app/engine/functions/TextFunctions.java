package com.sheetengine.app.engine.functions;

import com.sheetengine.app.engine.formula.Evaluator;
import com.sheetengine.app.engine.formula.FormulaNode;
import com.sheetengine.app.models.CellValue;
import com.sheetengine.app.models.ErrorCode;

import java.util.List;
import java.util.Locale;

/**
 * Text functions. Positions are 1-based; lengths past the end of the text
 * are clamped, negative lengths are an error.
 */
final class TextFunctions {

    private TextFunctions() {
    }

    static void registerAll(FunctionRegistry registry) {
        registry.register("CONCATENATE", 1, FunctionDefinition.UNBOUNDED, TextFunctions::concatenate);
        registry.register("LEFT", 1, 2, TextFunctions::left);
        registry.register("RIGHT", 1, 2, TextFunctions::right);
        registry.register("MID", 3, 3, TextFunctions::mid);
        registry.register("LEN", 1, 1, TextFunctions::len);
        registry.register("UPPER", 1, 1, (args, ev) -> mapText(args, ev, s -> s.toUpperCase(Locale.ROOT)));
        registry.register("LOWER", 1, 1, (args, ev) -> mapText(args, ev, s -> s.toLowerCase(Locale.ROOT)));
        registry.alias("CONCAT", "CONCATENATE");
    }

    static CellValue concatenate(List<FormulaNode> args, Evaluator evaluator) {
        StringBuilder sb = new StringBuilder();
        for (FormulaNode arg : args) {
            for (CellValue value : evaluator.values(arg)) {
                if (value.isError()) {
                    return value;
                }
                sb.append(value.toText());
            }
        }
        return CellValue.string(sb.toString());
    }

    static CellValue left(List<FormulaNode> args, Evaluator evaluator) {
        CellValue text = evaluator.evaluate(args.get(0));
        CellValue count = args.size() > 1 ? evaluator.evaluate(args.get(1)) : CellValue.number(1);
        CellValue error = firstError(text, count);
        if (error != null) {
            return error;
        }
        int n = (int) count.toNumber();
        if (n < 0) {
            return CellValue.error(ErrorCode.ERROR);
        }
        String s = text.toText();
        return CellValue.string(s.substring(0, Math.min(n, s.length())));
    }

    static CellValue right(List<FormulaNode> args, Evaluator evaluator) {
        CellValue text = evaluator.evaluate(args.get(0));
        CellValue count = args.size() > 1 ? evaluator.evaluate(args.get(1)) : CellValue.number(1);
        CellValue error = firstError(text, count);
        if (error != null) {
            return error;
        }
        int n = (int) count.toNumber();
        if (n < 0) {
            return CellValue.error(ErrorCode.ERROR);
        }
        String s = text.toText();
        return CellValue.string(s.substring(Math.max(0, s.length() - n)));
    }

    static CellValue mid(List<FormulaNode> args, Evaluator evaluator) {
        CellValue text = evaluator.evaluate(args.get(0));
        CellValue start = evaluator.evaluate(args.get(1));
        CellValue count = evaluator.evaluate(args.get(2));
        CellValue error = firstError(text, start, count);
        if (error != null) {
            return error;
        }
        int from = (int) start.toNumber();
        int n = (int) count.toNumber();
        if (from < 1 || n < 0) {
            return CellValue.error(ErrorCode.ERROR);
        }
        String s = text.toText();
        if (from > s.length()) {
            return CellValue.string("");
        }
        int begin = from - 1;
        return CellValue.string(s.substring(begin, Math.min(s.length(), begin + n)));
    }

    static CellValue len(List<FormulaNode> args, Evaluator evaluator) {
        CellValue text = evaluator.evaluate(args.get(0));
        if (text.isError()) {
            return text;
        }
        return CellValue.number(text.toText().length());
    }

    private static CellValue mapText(List<FormulaNode> args, Evaluator evaluator,
                                     java.util.function.UnaryOperator<String> mapper) {
        CellValue text = evaluator.evaluate(args.get(0));
        if (text.isError()) {
            return text;
        }
        return CellValue.string(mapper.apply(text.toText()));
    }

    private static CellValue firstError(CellValue... values) {
        for (CellValue value : values) {
            if (value.isError()) {
                return value;
            }
        }
        return null;
    }
}
