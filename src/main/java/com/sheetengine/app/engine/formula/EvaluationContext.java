package com.sheetengine.app.engine.formula;

import com.sheetengine.app.engine.functions.FunctionRegistry;
import com.sheetengine.app.models.DateSystem;

import java.time.Clock;

/**
 * Everything an evaluation needs from its surroundings. The engine supplies
 * an implementation bound to the sheet that owns the formula.
 */
public interface EvaluationContext {

    SheetReader currentSheet();

    /**
     * Resolves a named range, or returns null when the name is unknown or
     * its range was destroyed by a structural delete.
     */
    RangeView resolveName(String name);

    FunctionRegistry functions();

    Clock clock();

    DateSystem dateSystem();
}
