package com.sheetengine.app.engine.functions;

import com.sheetengine.app.engine.formula.Evaluator;
import com.sheetengine.app.engine.formula.FormulaNode;
import com.sheetengine.app.models.CellValue;

import java.util.List;

/**
 * Handler for a built-in function. Arguments arrive unevaluated so that a
 * handler decides which of them to evaluate, and when.
 */
@FunctionalInterface
public interface FormulaFunction {

    CellValue apply(List<FormulaNode> args, Evaluator evaluator);
}
