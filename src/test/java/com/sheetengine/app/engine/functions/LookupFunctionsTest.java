package com.sheetengine.app.engine.functions;

import com.sheetengine.app.engine.formula.SheetFixture;
import com.sheetengine.app.models.CellValue;
import com.sheetengine.app.models.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LookupFunctionsTest {

    private SheetFixture sheet;

    @BeforeEach
    void setUp() {
        // A1:B3 = ("x",1), ("y",2), ("z",3); D1:D4 = 10, 20, 30, 40; D6:G6 = 5, 15, 25, 35
        sheet = new SheetFixture()
                .set("A1", "x").set("B1", 1)
                .set("A2", "y").set("B2", 2)
                .set("A3", "z").set("B3", 3)
                .set("D1", 10).set("D2", 20).set("D3", 30).set("D4", 40)
                .set("D6", 5).set("E6", 15).set("F6", 25).set("G6", 35);
    }

    @Test
    void testVlookup() {
        assertEquals(2, sheet.number("=VLOOKUP(\"y\", A1:B3, 2, FALSE)"));
        assertEquals(CellValue.error(ErrorCode.NA), sheet.eval("=VLOOKUP(\"w\", A1:B3, 2, FALSE)"));
        // Approximate: largest key not above the value
        assertEquals(2, sheet.number("=VLOOKUP(\"yy\", A1:B3, 2)"));
        assertEquals(CellValue.string("z"), sheet.eval("=VLOOKUP(\"Z\", A1:B3, 1, TRUE)"));
        assertEquals(CellValue.error(ErrorCode.NA), sheet.eval("=VLOOKUP(\"yy\", A1:B3, 2, TRUE)"));
    }

    @Test
    void testVlookupColumnIndexBounds() {
        assertEquals(CellValue.error(ErrorCode.REF), sheet.eval("=VLOOKUP(\"y\", A1:B3, 3, FALSE)"));
        assertEquals(CellValue.error(ErrorCode.ERROR), sheet.eval("=VLOOKUP(\"y\", A1:B3, 0, FALSE)"));
        assertEquals(CellValue.error(ErrorCode.ERROR), sheet.eval("=VLOOKUP(\"y\", 5, 1)"));
    }

    @Test
    void testHlookup() {
        sheet.set("D7", "a").set("E7", "b").set("F7", "c").set("G7", "d");
        assertEquals(CellValue.string("b"), sheet.eval("=HLOOKUP(16, D6:G7, 2)"));
        assertEquals(CellValue.string("c"), sheet.eval("=HLOOKUP(25, D6:G7, 2, TRUE)"));
        assertEquals(CellValue.error(ErrorCode.NA), sheet.eval("=HLOOKUP(1, D6:G7, 2)"));
    }

    @Test
    void testIndex() {
        assertEquals(CellValue.string("z"), sheet.eval("=INDEX(A1:B3, 3, 1)"));
        assertEquals(2, sheet.number("=INDEX(A1:B3, 2, 2)"));
        assertEquals(30, sheet.number("=INDEX(D1:D4, 3)"));
        assertEquals(25, sheet.number("=INDEX(D6:G6, 3)"));
        assertEquals(CellValue.error(ErrorCode.REF), sheet.eval("=INDEX(A1:B3, 4, 1)"));
        assertEquals(CellValue.error(ErrorCode.REF), sheet.eval("=INDEX(A1:B3, 1, 0)"));
    }

    @Test
    void testMatch() {
        assertEquals(3, sheet.number("=MATCH(30, D1:D4, 0)"));
        assertEquals(2, sheet.number("=MATCH(25, D1:D4, 1)"));
        assertEquals(2, sheet.number("=MATCH(25, D1:D4)"));
        assertEquals(2, sheet.number("=MATCH(\"Y\", A1:A3, 0)"));
        assertEquals(4, sheet.number("=MATCH(35, D6:G6, 0)"));
        assertEquals(CellValue.error(ErrorCode.NA), sheet.eval("=MATCH(5, D1:D4, 1)"));
        assertEquals(CellValue.error(ErrorCode.NA), sheet.eval("=MATCH(31, D1:D4, 0)"));
        assertEquals(CellValue.error(ErrorCode.NA), sheet.eval("=MATCH(1, A1:B3, 0)"));

        // Descending vector, smallest value not below the lookup value
        sheet.set("H1", 40).set("H2", 30).set("H3", 20).set("H4", 10);
        assertEquals(2, sheet.number("=MATCH(25, H1:H4, -1)"));
        assertEquals(CellValue.error(ErrorCode.NA), sheet.eval("=MATCH(50, H1:H4, -1)"));
    }
}
