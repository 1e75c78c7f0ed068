package com.sheetengine.app.engine.functions;

import com.sheetengine.app.engine.formula.Evaluator;
import com.sheetengine.app.engine.formula.FormulaNode;
import com.sheetengine.app.models.CellValue;

import java.util.List;

final class LogicalFunctions {

    private LogicalFunctions() {
    }

    static void registerAll(FunctionRegistry registry) {
        registry.register("IF", 2, 3, LogicalFunctions::ifFunction);
        registry.register("AND", 1, FunctionDefinition.UNBOUNDED, (args, ev) -> combine(args, ev, true));
        registry.register("OR", 1, FunctionDefinition.UNBOUNDED, (args, ev) -> combine(args, ev, false));
        registry.register("NOT", 1, 1, LogicalFunctions::not);
        registry.register("TRUE", 0, 0, (args, ev) -> CellValue.TRUE);
        registry.register("FALSE", 0, 0, (args, ev) -> CellValue.FALSE);
    }

    /**
     * Only the taken branch is evaluated, so an error in the other branch
     * never surfaces. A missing false branch yields FALSE.
     */
    static CellValue ifFunction(List<FormulaNode> args, Evaluator evaluator) {
        CellValue condition = evaluator.evaluate(args.get(0));
        if (condition.isError()) {
            return condition;
        }
        if (condition.toBoolean()) {
            return evaluator.evaluate(args.get(1));
        }
        return args.size() > 2 ? evaluator.evaluate(args.get(2)) : CellValue.FALSE;
    }

    /**
     * AND when all is true, OR otherwise. Blank cells inside ranges are skipped.
     */
    private static CellValue combine(List<FormulaNode> args, Evaluator evaluator, boolean all) {
        boolean result = all;
        for (FormulaNode arg : args) {
            for (CellValue value : evaluator.values(arg)) {
                if (value.isError()) {
                    return value;
                }
                if (value.isBlank()) {
                    continue;
                }
                if (all) {
                    result &= value.toBoolean();
                } else {
                    result |= value.toBoolean();
                }
            }
        }
        return CellValue.bool(result);
    }

    static CellValue not(List<FormulaNode> args, Evaluator evaluator) {
        CellValue value = evaluator.evaluate(args.get(0));
        if (value.isError()) {
            return value;
        }
        return CellValue.bool(!value.toBoolean());
    }
}
