package com.sheetengine.app.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sheetengine.app.config.EngineProperties;
import com.sheetengine.app.engine.formula.SheetFixture;
import com.sheetengine.app.engine.functions.FunctionRegistry;
import com.sheetengine.app.exceptions.ChartNotFoundException;
import com.sheetengine.app.exceptions.DocumentNotFoundException;
import com.sheetengine.app.exceptions.DocumentPersistenceException;
import com.sheetengine.app.exceptions.InvalidOperationException;
import com.sheetengine.app.exceptions.InvalidReferenceException;
import com.sheetengine.app.exceptions.MutationTimeoutException;
import com.sheetengine.app.exceptions.NotFoundException;
import com.sheetengine.app.exceptions.SheetNotFoundException;
import com.sheetengine.app.exceptions.ValidationException;
import com.sheetengine.app.models.CalculationMode;
import com.sheetengine.app.models.CellInput;
import com.sheetengine.app.models.CellValue;
import com.sheetengine.app.models.CellView;
import com.sheetengine.app.models.ChartSpec;
import com.sheetengine.app.models.RangeInput;
import com.sheetengine.app.models.SortOptions;
import com.sheetengine.app.persistence.DocumentStoreException;
import com.sheetengine.app.persistence.InMemoryDocumentCache;
import com.sheetengine.app.persistence.InMemoryDocumentStore;
import com.sheetengine.app.persistence.WorkbookSerializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for WorkbookService, wired by hand against the in-memory store
 * and cache (no HTTP or Spring context).
 */
class WorkbookServiceTest {

    private FlakyStore store;
    private InMemoryDocumentCache cache;
    private EngineProperties properties;
    private FunctionRegistry functions;
    private List<String> events;
    private WorkbookService service;
    private String documentId;

    @BeforeEach
    void setUp() {
        store = new FlakyStore();
        cache = new InMemoryDocumentCache(SheetFixture.CLOCK);
        properties = new EngineProperties();
        functions = FunctionRegistry.standard();
        events = Collections.synchronizedList(new ArrayList<>());
        service = newService();
        documentId = service.createDocument("Budget");
    }

    private WorkbookService newService() {
        return new WorkbookService(store, cache,
                (doc, sheet, address, value) -> events.add(sheet + "!" + address + "=" + value),
                new WorkbookSerializer(new ObjectMapper()), properties, functions, SheetFixture.CLOCK);
    }

    private CellView set(String address, Object value) {
        return service.setCell(documentId, "sheet1", address, CellInput.value(value));
    }

    private CellView formula(String address, String text) {
        return service.setCell(documentId, "sheet1", address, CellInput.formula(text));
    }

    private Object value(String address) {
        return service.getCell(documentId, "sheet1", address).getValue();
    }

    /**
     * Writing a precedent recalculates dependents and publishes both changes, edited cell first.
     */
    @Test
    void testSetCellPropagatesAndPublishes() {
        set("A1", 1);
        CellView b1 = formula("B1", "A1*2");
        assertEquals("=A1*2", b1.getFormula());
        assertEquals(2L, b1.getValue());

        events.clear();
        set("A1", 5);

        assertEquals(10L, value("B1"));
        assertEquals(List.of("sheet1!A1=5", "sheet1!B1=10"), events);
        assertEquals(Map.of("A1", 5L, "B1", 10L), service.getSheetValues(documentId, "sheet1"));
        assertEquals(Map.of("B1", "=A1*2"), service.getFormulas(documentId, "sheet1"));
    }

    /**
     * insertFunction writes the call as a formula and recalculates like setCell.
     */
    @Test
    void testInsertFunction() {
        set("A1", 1);
        set("A2", 2);
        set("A3", 3);

        CellView sum = service.insertFunction(documentId, "sheet1", "B1", "sum", List.of("A1:A3", "10"));
        assertEquals("=SUM(A1:A3,10)", sum.getFormula());
        assertEquals(16L, sum.getValue());

        set("A1", 5);
        assertEquals(20L, value("B1"));
        assertEquals(Map.of("B1", "=SUM(A1:A3,10)"), service.getFormulas(documentId, "sheet1"));

        assertThrows(ValidationException.class, () ->
                service.insertFunction(documentId, "sheet1", "B2", "NOPE", List.of("A1")));
        assertThrows(ValidationException.class, () ->
                service.insertFunction(documentId, "sheet1", "B2", null, List.of("A1")));
        assertThrows(ValidationException.class, () ->
                service.insertFunction(documentId, "sheet1", "B2", "SUM", Arrays.asList("A1", " ")));
        assertNull(value("B2"));
    }

    @Test
    void testCellInputValidation() {
        assertThrows(ValidationException.class, () ->
                service.setCell(documentId, "sheet1", "A1", new CellInput(1, "=2", null)));
        assertThrows(InvalidReferenceException.class, () -> set("1A", 1));
        assertThrows(SheetNotFoundException.class, () ->
                service.setCell(documentId, "nope", "A1", CellInput.value(1)));
        assertThrows(DocumentNotFoundException.class, () -> service.getDocument("missing"));
    }

    @Test
    void testUnparseableFormulaIsStoredAsError() {
        CellView view = formula("A1", "=SUM(");
        assertEquals("=SUM(", view.getFormula());
        assertEquals("#ERROR!", view.getValue());
    }

    @Test
    void testFormatOnlyInputKeepsValue() {
        set("A1", 3);
        service.setCell(documentId, "sheet1", "A1", new CellInput(null, null, Map.of("bold", true)));
        service.setCell(documentId, "sheet1", "A1", new CellInput(null, null, Map.of("color", "red")));

        CellView view = service.getCell(documentId, "sheet1", "A1");
        assertEquals(3L, view.getValue());
        assertEquals(Map.of("bold", true, "color", "red"), view.getFormat());
    }

    @Test
    void testManualModeDefersDependents() {
        service.updateSettings(documentId, CalculationMode.MANUAL, null, null);
        set("A1", 1);
        assertEquals(2L, formula("B1", "=A1*2").getValue());
        formula("C1", "=B1+1");

        set("A1", 5);
        assertEquals(2L, value("B1"));
        assertEquals(true, service.getDocument(documentId).get("recalculationPending"));

        service.recalculate(documentId);
        assertEquals(10L, value("B1"));
        assertEquals(11L, value("C1"));
        assertEquals(false, service.getDocument(documentId).get("recalculationPending"));
    }

    @Test
    void testSwitchingBackToAutoRecalculates() {
        set("A1", 1);
        formula("B1", "=A1+1");
        service.updateSettings(documentId, CalculationMode.MANUAL, null, null);
        set("A1", 41);

        service.updateSettings(documentId, CalculationMode.AUTO, null, null);
        assertEquals(42L, value("B1"));
        assertThrows(ValidationException.class, () -> service.updateSettings(documentId, null, 0, null));
    }

    @Test
    void testSetRangeWritesGridAnchoredAtTopLeft() {
        RangeInput input = new RangeInput(
                Arrays.asList(Arrays.asList(1, 2), Arrays.asList(3, null)),
                Arrays.asList(Arrays.asList(null, null), Arrays.asList(null, "=A1+B1+A2")),
                null);

        List<CellView> views = service.setRange(documentId, "sheet1", "A1:B2", input);

        assertEquals(4, views.size());
        assertEquals(6L, value("B2"));
        assertEquals(Arrays.asList("A1", "B1", "A2", "B2"),
                Arrays.asList(views.get(0).getAddress(), views.get(1).getAddress(),
                        views.get(2).getAddress(), views.get(3).getAddress()));
        assertTrue(events.contains("sheet1!A1:B2=null"));
    }

    @Test
    void testSetRangeRejectsBadInputWithoutWriting() {
        RangeInput oversized = new RangeInput(
                Arrays.asList(Arrays.asList(1), Arrays.asList(2), Arrays.asList(3)), null, null);
        assertThrows(ValidationException.class, () -> service.setRange(documentId, "sheet1", "A1:A2", oversized));

        RangeInput conflicting = new RangeInput(
                Arrays.asList(Arrays.asList(1, 2)), Arrays.asList(Arrays.asList(null, "=1")), null);
        assertThrows(ValidationException.class, () -> service.setRange(documentId, "sheet1", "A1:B1", conflicting));

        assertTrue(service.getSheetValues(documentId, "sheet1").isEmpty());
    }

    @Test
    void testClearRangeBlanksDependents() {
        set("A1", 2);
        set("A2", 3);
        formula("B1", "=SUM(A1:A2)");

        service.clearRange(documentId, "sheet1", "A1:A2");

        assertEquals(0L, value("B1"));
        assertNull(value("A1"));
    }

    @Test
    void testSheetLifecycle() {
        String data = service.createSheet(documentId, "Data");
        assertEquals("sheet2", data);
        assertThrows(InvalidOperationException.class, () -> service.createSheet(documentId, "data"));

        service.setCell(documentId, data, "A1", CellInput.value(4));
        service.defineName(documentId, "Vals", data, "A1:A2");
        assertEquals(4L, formula("A1", "=SUM(Vals)").getValue());
        service.setActiveSheet(documentId, data);

        service.deleteSheet(documentId, data);

        assertEquals("#REF!", value("A1"));
        assertEquals("sheet1", service.getDocument(documentId).get("activeSheet"));
        assertThrows(InvalidOperationException.class, () -> service.deleteSheet(documentId, "sheet1"));
    }

    @Test
    void testStructuralEditThroughService() {
        set("A1", 1);
        set("A2", 2);
        formula("B1", "=SUM(A1:A2)");
        events.clear();

        service.insertRows(documentId, "sheet1", 2, 1);

        assertEquals("=SUM(A1:A3)", service.getFormulas(documentId, "sheet1").get("B1"));
        assertEquals(2L, value("A3"));
        assertTrue(events.contains("sheet1!A2:Z2=null"));

        service.deleteColumns(documentId, "sheet1", 1, 1);
        assertEquals("#REF!", value("A1"));
        assertThrows(ValidationException.class, () -> service.insertRows(documentId, "sheet1", 0, 1));
    }

    /**
     * Rows move as a whole; blanks sink to the bottom; formulas are replaced by their values.
     */
    @Test
    void testSortRange() {
        set("A1", "Name");
        set("B1", "Score");
        set("A2", "b");
        formula("B2", "=1+1");
        set("A3", "a");
        set("A4", "c");
        set("B4", 1);
        service.setCell(documentId, "sheet1", "A4", new CellInput(null, null, Map.of("bold", true)));

        service.sortRange(documentId, "sheet1", "A1:B4", new SortOptions(1, true, true));

        assertEquals("Name", value("A1"));
        assertEquals("c", value("A2"));
        assertEquals(1L, value("B2"));
        assertEquals(Map.of("bold", true), service.getCell(documentId, "sheet1", "A2").getFormat());
        assertEquals("b", value("A3"));
        assertEquals(2L, value("B3"));
        assertEquals("a", value("A4"));
        assertNull(value("B4"));
        assertTrue(service.getFormulas(documentId, "sheet1").isEmpty());

        assertThrows(ValidationException.class, () ->
                service.sortRange(documentId, "sheet1", "A1:B4", new SortOptions(2, true, false)));
    }

    @Test
    void testSortDescendingKeepsBlanksLast() {
        set("A1", 1);
        set("A3", 3);
        set("A4", "10");

        service.sortRange(documentId, "sheet1", "A1:A4", new SortOptions(0, false, false));

        assertEquals("10", value("A1"));
        assertEquals(3L, value("A2"));
        assertEquals(1L, value("A3"));
        assertNull(value("A4"));
    }

    /**
     * Numbers, numeric text and plain text mixed in one column. Numbers come
     * first, so 2 < "10" < "1a" holds across a run long enough to merge.
     */
    @Test
    void testSortMixedNumbersAndText() {
        Object[] pattern = {"1a", 2, "10", "b", 7};
        for (int i = 0; i < 40; i++) {
            set("A" + (i + 1), pattern[i % pattern.length]);
        }

        service.sortRange(documentId, "sheet1", "A1:A40", new SortOptions(0, true, false));

        List<Object> expected = new ArrayList<>();
        for (Object sorted : new Object[]{2L, 7L, "10", "1a", "b"}) {
            expected.addAll(Collections.nCopies(8, sorted));
        }
        for (int i = 0; i < 40; i++) {
            assertEquals(expected.get(i), value("A" + (i + 1)), "A" + (i + 1));
        }
    }

    @Test
    void testNamedRanges() {
        set("A1", 1);
        set("A2", 2);
        formula("C1", "=SUM(total)");
        assertEquals("#REF!", value("C1"));

        service.defineName(documentId, "Total", "sheet1", "A1:A2");
        assertEquals(3L, value("C1"));
        assertEquals(Map.of("Total", "sheet1!A1:A2"), service.getNames(documentId));

        service.removeName(documentId, "TOTAL");
        assertEquals("#REF!", value("C1"));

        assertThrows(NotFoundException.class, () -> service.removeName(documentId, "Total"));
        assertThrows(ValidationException.class, () -> service.defineName(documentId, "B2", "sheet1", "A1"));
        assertThrows(ValidationException.class, () -> service.defineName(documentId, "1st", "sheet1", "A1"));
        assertThrows(ValidationException.class, () -> service.defineName(documentId, "true", "sheet1", "A1"));
    }

    @Test
    void testChartLifecycle() {
        ChartSpec chart = service.createChart(documentId, "sheet1", new ChartSpec("bar", null, "A1:B5"));

        assertEquals("chart_1", chart.getId());
        assertEquals("Chart", chart.getTitle());
        assertEquals(100, chart.getPosition().get("x"));
        assertEquals(400, chart.getSize().get("width"));
        assertEquals("2024-03-15T10:30:45Z", chart.getCreatedAt());

        ChartSpec patch = new ChartSpec(null, "Sales", null);
        ChartSpec updated = service.updateChart(documentId, "sheet1", "chart_1", patch);
        assertEquals("Sales", updated.getTitle());
        assertEquals("bar", updated.getType());
        assertNotNull(updated.getUpdatedAt());

        service.deleteChart(documentId, "sheet1", "chart_1");
        assertThrows(ChartNotFoundException.class, () ->
                service.updateChart(documentId, "sheet1", "chart_1", patch));
        assertThrows(InvalidReferenceException.class, () ->
                service.createChart(documentId, "sheet1", new ChartSpec("bar", null, "A0:B")));
    }

    @Test
    void testFilterIsStoredWithDocument() throws Exception {
        service.applyFilter(documentId, "sheet1", "C10:A1", List.of(Map.of("column", 0, "op", "gt", "value", 3)));

        JsonNode content = new ObjectMapper().readTree(service.exportContent(documentId));
        JsonNode filter = content.at("/sheets/0/filters").get("A1:C10");
        assertEquals("gt", filter.at("/predicates/0/op").asText());
        assertEquals("2024-03-15T10:30:45Z", filter.get("appliedAt").asText());
    }

    @Test
    void testReopenFromStore() {
        set("A1", 4);
        formula("B1", "=A1*A1");

        WorkbookService reopened = newService();
        Map<String, Object> summary = reopened.openDocument(documentId);

        assertEquals("Budget", summary.get("title"));
        assertEquals(16L, reopened.getCell(documentId, "sheet1", "B1").getValue());
        assertEquals(Map.of("B1", Collections.singleton("A1")),
                reopened.getForwardDependencies(documentId, "sheet1"));
        assertEquals(Map.of("A1", Collections.singleton("B1")),
                reopened.getReverseDependencies(documentId, "sheet1"));
    }

    /**
     * A failed save surfaces as an error, the edit stays in memory and a flush retries it.
     */
    @Test
    void testFailedSaveCanBeFlushedLater() {
        store.failing = true;
        assertThrows(DocumentPersistenceException.class, () -> set("A1", 7));

        Map<String, Object> summary = service.getDocument(documentId);
        assertTrue((Long) summary.get("persistedVersion") < (Long) summary.get("version"));
        assertEquals(7L, value("A1"));

        store.failing = false;
        long persisted = service.flush(documentId);
        assertEquals(service.getDocument(documentId).get("version"), persisted);
        assertTrue(store.load(documentId).orElseThrow().contains("\"A1\":{\"value\":7}"));
        assertEquals(persisted, service.flush(documentId));
    }

    /**
     * A writer holding the document past the lock timeout makes a second writer give up.
     */
    @Test
    void testConcurrentWriterTimesOut() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        functions.register("HOLD", 0, 0, (args, evaluator) -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return CellValue.number(1);
        });
        properties.setLockTimeout(Duration.ofMillis(100));

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<CellView> slow = executor.submit(() -> formula("A1", "=HOLD()"));
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            assertThrows(MutationTimeoutException.class, () -> set("B1", 2));

            release.countDown();
            assertEquals(1L, slow.get(5, TimeUnit.SECONDS).getValue());
            assertEquals(2L, set("B1", 2).getValue());
        } finally {
            executor.shutdownNow();
        }
    }

    private static final class FlakyStore extends InMemoryDocumentStore {
        private volatile boolean failing;

        @Override
        public void save(String documentId, String content) {
            if (failing) {
                throw new DocumentStoreException("store unavailable");
            }
            super.save(documentId, content);
        }
    }
}
