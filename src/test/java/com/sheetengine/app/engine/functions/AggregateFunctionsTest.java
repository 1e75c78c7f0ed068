package com.sheetengine.app.engine.functions;

import com.sheetengine.app.engine.formula.SheetFixture;
import com.sheetengine.app.models.CellValue;
import com.sheetengine.app.models.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AggregateFunctionsTest {

    private SheetFixture sheet;

    @BeforeEach
    void setUp() {
        // B1:B5 = 2, 4, "x", <blank>, "6"
        sheet = new SheetFixture()
                .set("B1", 2)
                .set("B2", 4)
                .set("B3", "x")
                .set("B5", "6");
    }

    @Test
    void testEmptyRangeAggregatesAreZero() {
        assertEquals(0, sheet.number("=SUM(H1:H10)"));
        assertEquals(0, sheet.number("=AVERAGE(H1:H10)"));
        assertEquals(0, sheet.number("=COUNT(H1:H10)"));
        assertEquals(0, sheet.number("=COUNTA(H1:H10)"));
        assertEquals(0, sheet.number("=MEDIAN(H1:H10)"));
        assertEquals(0, sheet.number("=MIN(H1:H10)"));
        assertEquals(0, sheet.number("=MAX(H1:H10)"));
    }

    @Test
    void testSumAndCountTreatNonNumericDifferently() {
        assertEquals(12, sheet.number("=SUM(B1:B5)"));
        assertEquals(3, sheet.number("=COUNT(B1:B5)"));
        assertEquals(4, sheet.number("=COUNTA(B1:B5)"));
        assertEquals(22, sheet.number("=SUM(B1:B5, 10)"));
    }

    @Test
    void testAverageMedianMinMaxIgnoreText() {
        assertEquals(4, sheet.number("=AVERAGE(B1:B5)"));
        assertEquals(4, sheet.number("=AVG(B1:B5)"));
        assertEquals(4, sheet.number("=MEDIAN(B1:B5)"));
        assertEquals(3, sheet.number("=MEDIAN(B1:B2)"));
        assertEquals(2, sheet.number("=MIN(B1:B5)"));
        assertEquals(6, sheet.number("=MAX(B1:B5)"));
        assertEquals(0, sheet.number("=AVERAGE(B3)"));
    }

    @Test
    void testStdevIsSampleDeviation() {
        assertEquals(2, sheet.number("=STDEV(B1:B5)"), 1e-9);
        assertEquals(0, sheet.number("=STDEV(B1)"));
    }

    @Test
    void testErrorsPropagateExceptInCount() {
        sheet.error("B4", ErrorCode.DIV0);
        assertEquals(CellValue.error(ErrorCode.DIV0), sheet.eval("=SUM(B1:B5)"));
        assertEquals(CellValue.error(ErrorCode.DIV0), sheet.eval("=AVERAGE(B1:B5)"));
        assertEquals(3, sheet.number("=COUNT(B1:B5)"));
        assertEquals(5, sheet.number("=COUNTA(B1:B5)"));
    }
}
