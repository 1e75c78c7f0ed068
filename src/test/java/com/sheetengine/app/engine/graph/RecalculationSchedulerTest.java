package com.sheetengine.app.engine.graph;

import com.sheetengine.app.engine.formula.FormulaNode;
import com.sheetengine.app.engine.formula.FormulaParser;
import com.sheetengine.app.engine.formula.ReferenceCollector;
import com.sheetengine.app.engine.formula.SheetFixture;
import com.sheetengine.app.engine.functions.FunctionRegistry;
import com.sheetengine.app.models.CellAddress;
import com.sheetengine.app.models.CellRange;
import com.sheetengine.app.models.CellValue;
import com.sheetengine.app.models.ErrorCode;
import com.sheetengine.app.models.NamedRange;
import com.sheetengine.app.models.Sheet;
import com.sheetengine.app.models.Workbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RecalculationSchedulerTest {

    private Workbook workbook;
    private Sheet sheet;
    private RecalculationScheduler scheduler;

    @BeforeEach
    void setUp() {
        workbook = new Workbook("doc", "Graph");
        sheet = new Sheet("sheet1", "Sheet1", 100, 26);
        workbook.addSheet(sheet);
        scheduler = new RecalculationScheduler(FunctionRegistry.standard(), SheetFixture.CLOCK);
    }

    private CellKey key(String address) {
        return CellKey.of("sheet1", CellAddress.parse(address));
    }

    private void literal(String address, Object value) {
        sheet.getGrid().getOrCreate(CellAddress.parse(address)).setLiteral(CellValue.fromObject(value));
        workbook.getGraph().clearDependencies(key(address));
    }

    private void formula(String address, String text) {
        FormulaNode node = FormulaParser.parse(text);
        sheet.getGrid().getOrCreate(CellAddress.parse(address)).setFormula(text, node);
        workbook.getGraph().setPrecedents(key(address), ReferenceCollector.collect(node));
    }

    private CellValue value(String address) {
        return sheet.getGrid().valueAt(CellAddress.parse(address));
    }

    /**
     * A1 feeds B1 and C1, both feed D1: D1 is evaluated once, after both.
     */
    @Test
    void testDiamondEvaluatesSinkOnce() {
        literal("A1", 1);
        formula("B1", "=A1+1");
        formula("C1", "=A1*2");
        formula("D1", "=B1+C1");
        scheduler.recalculateAll(workbook);
        assertEquals(CellValue.number(4), value("D1"));

        literal("A1", 5);
        RecalculationResult result = scheduler.recalculate(workbook, List.of(key("A1")));

        assertEquals(CellValue.number(16), value("D1"));
        assertEquals(1, result.evaluationCount(key("D1")));
        assertEquals(3, result.getEvaluated().size());
        List<CellKey> order = result.getEvaluated();
        assertTrue(order.indexOf(key("B1")) < order.indexOf(key("D1")));
        assertTrue(order.indexOf(key("C1")) < order.indexOf(key("D1")));
        assertTrue(result.getChanged().containsKey(key("D1")));
    }

    @Test
    void testMutualReferenceIsCircular() {
        formula("A1", "=B1");
        formula("B1", "=A1");
        formula("C1", "=A1+1");
        RecalculationResult result = scheduler.recalculateAll(workbook);

        assertEquals(CellValue.error(ErrorCode.CIRC), value("A1"));
        assertEquals(CellValue.error(ErrorCode.CIRC), value("B1"));
        // Reads a cycle member, so it sees #CIRC! without being part of the cycle
        assertEquals(CellValue.error(ErrorCode.CIRC), value("C1"));
        assertEquals(2, result.getCircular().size());
        assertFalse(result.getCircular().contains(key("C1")));
    }

    @Test
    void testSelfReferenceAndBreakingTheCycle() {
        formula("A1", "=B1");
        formula("B1", "=A1+B1");
        scheduler.recalculateAll(workbook);
        assertEquals(CellValue.error(ErrorCode.CIRC), value("B1"));

        literal("B1", 3);
        scheduler.recalculate(workbook, List.of(key("B1")));
        assertEquals(CellValue.number(3), value("A1"));
    }

    /**
     * C1 is reached through B1 before A1 closes the loop, and COUNT swallows
     * the error it reads. All three cells still belong to one cycle.
     */
    @Test
    void testCycleReachedThroughAFinishedCellIsCircular() {
        formula("C1", "=A1");
        formula("B1", "=COUNT(C1)");
        formula("A1", "=C1+B1");
        formula("D1", "=COUNTA(B1)");

        RecalculationResult result = scheduler.recalculateAll(workbook);
        for (String address : List.of("A1", "B1", "C1")) {
            assertEquals(CellValue.error(ErrorCode.CIRC), value(address), address);
            assertTrue(result.getCircular().contains(key(address)), address);
        }
        assertEquals(CellValue.error(ErrorCode.CIRC), value("D1"));
        assertFalse(result.getCircular().contains(key("D1")));

        for (String root : List.of("A1", "B1", "C1")) {
            result = scheduler.recalculate(workbook, List.of(key(root)));
            assertEquals(Set.of(key("A1"), key("B1"), key("C1")), result.getCircular(), root);
            assertEquals(CellValue.error(ErrorCode.CIRC), value("B1"), root);
            assertEquals(CellValue.error(ErrorCode.CIRC), value("D1"), root);
        }
    }

    @Test
    void testComponentsComeAfterWhatTheyRead() {
        CellKey a = key("A1");
        CellKey b = key("B1");
        CellKey c = key("C1");
        CellKey d = key("D1");
        Map<CellKey, List<CellKey>> precedents = new HashMap<>();
        precedents.put(d, List.of(b));
        precedents.put(b, List.of(c));
        precedents.put(c, List.of(a));
        precedents.put(a, List.of(c, b));
        Set<CellKey> nodes = new LinkedHashSet<>(List.of(d, b, c, a));

        List<List<CellKey>> components = RecalculationScheduler.components(nodes, precedents);

        assertEquals(2, components.size());
        assertEquals(Set.of(a, b, c), new HashSet<>(components.get(0)));
        assertEquals(List.of(d), components.get(1));
    }

    @Test
    void testRangeAndNameDependents() {
        literal("A1", 1);
        literal("A2", 2);
        literal("A3", 3);
        workbook.putNamedRange(new NamedRange("Data", "sheet1", CellRange.parse("A2:A3")));
        formula("E1", "=SUM(A1:A3)");
        formula("F1", "=SUM(Data)");
        scheduler.recalculateAll(workbook);
        assertEquals(CellValue.number(6), value("E1"));
        assertEquals(CellValue.number(5), value("F1"));

        literal("A3", 10);
        RecalculationResult result = scheduler.recalculate(workbook, List.of(key("A3")));
        assertEquals(CellValue.number(13), value("E1"));
        assertEquals(CellValue.number(12), value("F1"));
        assertEquals(2, result.getEvaluated().size());

        // A1 is outside the name, so only E1 runs
        literal("A1", 0);
        result = scheduler.recalculate(workbook, List.of(key("A1")));
        assertEquals(List.of(key("E1")), result.getEvaluated());
    }

    @Test
    void testErrorsStayOnTheirOwnEdges() {
        literal("A1", 0);
        formula("B1", "=10/A1");
        formula("C1", "=B1+1");
        formula("D1", "=A1+1");
        scheduler.recalculateAll(workbook);

        assertEquals(CellValue.error(ErrorCode.DIV0), value("B1"));
        assertEquals(CellValue.error(ErrorCode.DIV0), value("C1"));
        assertEquals(CellValue.number(1), value("D1"));
    }

    @Test
    void testUnparseableFormulaEvaluatesToError() {
        sheet.getGrid().getOrCreate(CellAddress.parse("A1")).setFormula("=SUM(", null);
        scheduler.recalculateAll(workbook);
        assertEquals(CellValue.error(ErrorCode.ERROR), value("A1"));
    }

    @Test
    void testEvaluateOnlyLeavesDependentsStale() {
        literal("A1", 1);
        formula("B1", "=A1*10");
        formula("C1", "=B1+1");
        scheduler.recalculateAll(workbook);

        formula("B1", "=A1*100");
        RecalculationResult result = scheduler.evaluateOnly(workbook, List.of(key("B1")));
        assertEquals(List.of(key("B1")), result.getEvaluated());
        assertEquals(CellValue.number(100), value("B1"));
        assertEquals(CellValue.number(11), value("C1"));
    }

    @Test
    void testRoundingToPrecision() {
        assertEquals(CellValue.number(0.333), RecalculationScheduler.round(CellValue.number(1d / 3), 3));
        assertEquals(CellValue.number(0.3), RecalculationScheduler.round(CellValue.number(0.1 + 0.2), 15));
        assertEquals(CellValue.string("x"), RecalculationScheduler.round(CellValue.string("x"), 3));

        workbook.getSettings().setPrecision(4);
        formula("A1", "=2/3");
        scheduler.recalculateAll(workbook);
        assertEquals(CellValue.number(0.6667), value("A1"));
    }

    @Test
    void testRebuildGraphFromStoredFormulas() {
        literal("A1", 2);
        formula("B1", "=A1*A1");
        workbook.getGraph().clear();
        scheduler.rebuildGraph(workbook);

        assertEquals(1, workbook.getGraph().size());
        assertTrue(workbook.getGraph().dependentsOf(key("A1"), workbook.getNamedRanges()).contains(key("B1")));
    }
}
