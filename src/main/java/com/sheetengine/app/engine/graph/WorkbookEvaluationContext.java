package com.sheetengine.app.engine.graph;

import com.sheetengine.app.engine.formula.EvaluationContext;
import com.sheetengine.app.engine.formula.RangeView;
import com.sheetengine.app.engine.formula.SheetReader;
import com.sheetengine.app.engine.functions.FunctionRegistry;
import com.sheetengine.app.models.DateSystem;
import com.sheetengine.app.models.NamedRange;
import com.sheetengine.app.models.Sheet;
import com.sheetengine.app.models.Workbook;

import java.time.Clock;

/**
 * Evaluation context for formulas on one sheet of a workbook.
 */
public class WorkbookEvaluationContext implements EvaluationContext {

    private final Workbook workbook;
    private final Sheet sheet;
    private final FunctionRegistry functions;
    private final Clock clock;

    public WorkbookEvaluationContext(Workbook workbook, Sheet sheet, FunctionRegistry functions, Clock clock) {
        this.workbook = workbook;
        this.sheet = sheet;
        this.functions = functions;
        this.clock = clock;
    }

    @Override
    public SheetReader currentSheet() {
        return sheet.getGrid();
    }

    @Override
    public RangeView resolveName(String name) {
        NamedRange named = workbook.findNamedRange(name);
        if (named == null || named.isBroken()) {
            return null;
        }
        Sheet target = workbook.findSheet(named.getSheetId());
        if (target == null) {
            return null;
        }
        return new RangeView(target.getGrid(), named.getRange());
    }

    @Override
    public FunctionRegistry functions() {
        return functions;
    }

    @Override
    public Clock clock() {
        return clock;
    }

    @Override
    public DateSystem dateSystem() {
        return workbook.getSettings().getDateSystem();
    }
}
