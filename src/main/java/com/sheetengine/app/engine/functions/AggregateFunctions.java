package com.sheetengine.app.engine.functions;

import com.sheetengine.app.engine.formula.Evaluator;
import com.sheetengine.app.engine.formula.FormulaNode;
import com.sheetengine.app.models.CellValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * SUM, AVERAGE, COUNT, COUNTA, MIN, MAX, MEDIAN, STDEV.
 * Arguments may mix ranges and scalars. Ranges are streamed cell by cell;
 * only MEDIAN has to hold its numbers in memory.
 */
final class AggregateFunctions {

    private AggregateFunctions() {
    }

    static void registerAll(FunctionRegistry registry) {
        registry.register("SUM", 1, FunctionDefinition.UNBOUNDED, AggregateFunctions::sum);
        registry.register("AVERAGE", 1, FunctionDefinition.UNBOUNDED, AggregateFunctions::average);
        registry.register("COUNT", 1, FunctionDefinition.UNBOUNDED, AggregateFunctions::count);
        registry.register("COUNTA", 1, FunctionDefinition.UNBOUNDED, AggregateFunctions::countA);
        registry.register("MIN", 1, FunctionDefinition.UNBOUNDED, (args, ev) -> extreme(args, ev, true));
        registry.register("MAX", 1, FunctionDefinition.UNBOUNDED, (args, ev) -> extreme(args, ev, false));
        registry.register("MEDIAN", 1, FunctionDefinition.UNBOUNDED, AggregateFunctions::median);
        registry.register("STDEV", 1, FunctionDefinition.UNBOUNDED, AggregateFunctions::stdev);
        registry.alias("AVG", "AVERAGE");
    }

    /**
     * Non-numeric values add 0; errors propagate.
     */
    static CellValue sum(List<FormulaNode> args, Evaluator evaluator) {
        double total = 0d;
        for (FormulaNode arg : args) {
            for (CellValue value : evaluator.values(arg)) {
                if (value.isError()) {
                    return value;
                }
                if (value.isNumeric()) {
                    total += value.toNumber();
                }
            }
        }
        return CellValue.number(total);
    }

    /**
     * Counts numeric values only; errors and text are skipped.
     */
    static CellValue count(List<FormulaNode> args, Evaluator evaluator) {
        long n = 0;
        for (FormulaNode arg : args) {
            for (CellValue value : evaluator.values(arg)) {
                if (!value.isError() && value.isNumeric()) {
                    n++;
                }
            }
        }
        return CellValue.number(n);
    }

    /**
     * Counts every non-blank value, errors included.
     */
    static CellValue countA(List<FormulaNode> args, Evaluator evaluator) {
        long n = 0;
        for (FormulaNode arg : args) {
            for (CellValue value : evaluator.values(arg)) {
                if (!value.isBlank()) {
                    n++;
                }
            }
        }
        return CellValue.number(n);
    }

    static CellValue average(List<FormulaNode> args, Evaluator evaluator) {
        double total = 0d;
        long n = 0;
        for (FormulaNode arg : args) {
            for (CellValue value : evaluator.values(arg)) {
                if (value.isError()) {
                    return value;
                }
                if (value.isNumeric()) {
                    total += value.toNumber();
                    n++;
                }
            }
        }
        return n == 0 ? CellValue.ZERO : CellValue.number(total / n);
    }

    private static CellValue extreme(List<FormulaNode> args, Evaluator evaluator, boolean min) {
        Double best = null;
        for (FormulaNode arg : args) {
            for (CellValue value : evaluator.values(arg)) {
                if (value.isError()) {
                    return value;
                }
                if (value.isNumeric()) {
                    double d = value.toNumber();
                    if (best == null || (min ? d < best : d > best)) {
                        best = d;
                    }
                }
            }
        }
        return best == null ? CellValue.ZERO : CellValue.number(best);
    }

    static CellValue median(List<FormulaNode> args, Evaluator evaluator) {
        List<Double> numbers = new ArrayList<>();
        for (FormulaNode arg : args) {
            for (CellValue value : evaluator.values(arg)) {
                if (value.isError()) {
                    return value;
                }
                if (value.isNumeric()) {
                    numbers.add(value.toNumber());
                }
            }
        }
        if (numbers.isEmpty()) {
            return CellValue.ZERO;
        }
        Collections.sort(numbers);
        int mid = numbers.size() / 2;
        if (numbers.size() % 2 == 0) {
            return CellValue.number((numbers.get(mid - 1) + numbers.get(mid)) / 2d);
        }
        return CellValue.number(numbers.get(mid));
    }

    /**
     * Sample standard deviation (n - 1 denominator), computed in one pass
     * with Welford's update. Fewer than two numbers gives 0.
     */
    static CellValue stdev(List<FormulaNode> args, Evaluator evaluator) {
        long n = 0;
        double mean = 0d;
        double m2 = 0d;
        for (FormulaNode arg : args) {
            for (CellValue value : evaluator.values(arg)) {
                if (value.isError()) {
                    return value;
                }
                if (value.isNumeric()) {
                    double x = value.toNumber();
                    n++;
                    double delta = x - mean;
                    mean += delta / n;
                    m2 += delta * (x - mean);
                }
            }
        }
        if (n < 2) {
            return CellValue.ZERO;
        }
        return CellValue.number(Math.sqrt(m2 / (n - 1)));
    }
}
