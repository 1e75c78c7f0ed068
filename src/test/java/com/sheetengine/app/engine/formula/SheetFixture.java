package com.sheetengine.app.engine.formula;

import com.sheetengine.app.engine.functions.FunctionRegistry;
import com.sheetengine.app.engine.graph.WorkbookEvaluationContext;
import com.sheetengine.app.models.CellAddress;
import com.sheetengine.app.models.CellValue;
import com.sheetengine.app.models.ErrorCode;
import com.sheetengine.app.models.Sheet;
import com.sheetengine.app.models.Workbook;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * One-sheet workbook for evaluating formulas directly, without the scheduler.
 */
public class SheetFixture {

    public static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-15T10:30:45Z"), ZoneOffset.UTC);

    private final Workbook workbook = new Workbook("doc-test", "Test");
    private final Sheet sheet = new Sheet("sheet1", "Sheet1", 100, 26);
    private final FunctionRegistry functions = FunctionRegistry.standard();

    public SheetFixture() {
        workbook.addSheet(sheet);
    }

    public SheetFixture set(String address, Object value) {
        sheet.getGrid().getOrCreate(CellAddress.parse(address)).setLiteral(CellValue.fromObject(value));
        return this;
    }

    public SheetFixture error(String address, ErrorCode code) {
        sheet.getGrid().getOrCreate(CellAddress.parse(address)).setLiteral(CellValue.error(code));
        return this;
    }

    public CellValue eval(String formula) {
        return Evaluator.evaluate(FormulaParser.parse(formula),
                new WorkbookEvaluationContext(workbook, sheet, functions, CLOCK));
    }

    public double number(String formula) {
        CellValue value = eval(formula);
        if (!value.isNumber()) {
            throw new AssertionError(formula + " gave " + value + ", expected a number");
        }
        return value.getNumber();
    }

    public Workbook getWorkbook() {
        return workbook;
    }

    public Sheet getSheet() {
        return sheet;
    }
}
