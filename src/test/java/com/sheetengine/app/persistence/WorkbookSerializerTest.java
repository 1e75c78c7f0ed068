package com.sheetengine.app.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sheetengine.app.engine.formula.FormulaParser;
import com.sheetengine.app.exceptions.ValidationException;
import com.sheetengine.app.models.CalculationMode;
import com.sheetengine.app.models.Cell;
import com.sheetengine.app.models.CellAddress;
import com.sheetengine.app.models.CellRange;
import com.sheetengine.app.models.CellValue;
import com.sheetengine.app.models.DateSystem;
import com.sheetengine.app.models.ErrorCode;
import com.sheetengine.app.models.NamedRange;
import com.sheetengine.app.models.Sheet;
import com.sheetengine.app.models.SortOptions;
import com.sheetengine.app.models.Workbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WorkbookSerializerTest {

    private WorkbookSerializer serializer;
    private Workbook workbook;
    private Sheet sheet;

    @BeforeEach
    void setUp() {
        serializer = new WorkbookSerializer(new ObjectMapper());
        workbook = new Workbook("doc-1", "Budget");
        sheet = new Sheet("sheet1", "Sheet1", 1000, 26);
        workbook.addSheet(sheet);
    }

    @Test
    void testDocumentShape() {
        sheet.getGrid().getOrCreate(CellAddress.parse("A1")).setLiteral(CellValue.number(1));
        Cell b1 = sheet.getGrid().getOrCreate(CellAddress.parse("B1"));
        b1.setFormula("=A1*2", FormulaParser.parse("=A1*2"));
        b1.setValue(CellValue.number(2));
        workbook.putNamedRange(new NamedRange("Sales", "sheet1", CellRange.parse("A1:A10")));

        JsonNode json = serializer.toJson(workbook);

        assertEquals("Budget", json.get("title").asText());
        assertEquals("sheet1", json.get("activeSheet").asText());
        assertEquals("auto", json.at("/settings/calculation").asText());
        assertEquals(15, json.at("/settings/precision").asInt());
        assertEquals("1900", json.at("/settings/dateSystem").asText());
        assertEquals("sheet1!A1:A10", json.at("/namedRanges/Sales").asText());
        assertEquals(1, json.at("/sheets/0/cells/A1/value").asInt());
        assertEquals("=A1*2", json.at("/sheets/0/cells/B1/formula").asText());
        assertEquals(2, json.at("/sheets/0/cells/B1/value").asInt());
        assertFalse(json.at("/sheets/0/cells/A1").has("formula"));
    }

    @Test
    void testReloadRestoresCellsSettingsAndMetadata() {
        sheet.getGrid().getOrCreate(CellAddress.parse("A1")).setLiteral(CellValue.string("#N/A"));
        sheet.getGrid().getOrCreate(CellAddress.parse("A2")).setLiteral(CellValue.error(ErrorCode.NA));
        Cell c1 = sheet.getGrid().getOrCreate(CellAddress.parse("C1"));
        c1.setFormula("=SUM(A1:A2)", FormulaParser.parse("=SUM(A1:A2)"));
        c1.setValue(CellValue.error(ErrorCode.NA));
        sheet.getRowHeights().put(2, 30.0);
        sheet.getHiddenCols().add(3);
        sheet.getMergedCells().add(CellRange.parse("D1:E2"));
        sheet.setSort("A1:C5", new SortOptions(1, false, true));
        workbook.getSettings().setCalculationMode(CalculationMode.MANUAL);
        workbook.getSettings().setDateSystem(DateSystem.SYSTEM_1904);
        workbook.putNamedRange(new NamedRange("Gone", "sheet1", null));

        Workbook loaded = serializer.deserialize("doc-1", serializer.serialize(workbook), 100, 10);
        Sheet reloaded = loaded.getSheet("sheet1");

        assertEquals(CellValue.string("#N/A"), reloaded.getGrid().valueAt(CellAddress.parse("A1")));
        assertEquals(CellValue.error(ErrorCode.NA), reloaded.getGrid().valueAt(CellAddress.parse("A2")));
        assertEquals("=SUM(A1:A2)", reloaded.getGrid().get(CellAddress.parse("C1")).getFormulaText());
        assertNotNull(reloaded.getGrid().get(CellAddress.parse("C1")).getFormula());
        // The cached value is shown until the load-time recalculation replaces it
        assertEquals("#N/A", reloaded.getGrid().get(CellAddress.parse("C1")).getValue().toText());
        assertEquals(1000, reloaded.getRows());
        assertEquals(30.0, reloaded.getRowHeights().get(2));
        assertTrue(reloaded.getHiddenCols().contains(3));
        assertEquals(CellRange.parse("D1:E2"), reloaded.getMergedCells().get(0));
        assertEquals("A1:C5", reloaded.getSortRange());
        assertFalse(reloaded.getSort().isAscending());
        assertEquals(CalculationMode.MANUAL, loaded.getSettings().getCalculationMode());
        assertEquals(DateSystem.SYSTEM_1904, loaded.getSettings().getDateSystem());
        assertTrue(loaded.findNamedRange("gone").isBroken());
    }

    @Test
    void testUnparseableFormulaIsKeptAsText() {
        String content = "{\"title\":\"T\",\"sheets\":[{\"id\":\"sheet1\",\"name\":\"S\","
                + "\"cells\":{\"A1\":{\"value\":null,\"formula\":\"=SUM(\"}}}]}";

        Workbook loaded = serializer.deserialize("doc-2", content, 100, 10);
        Cell cell = loaded.getSheet("sheet1").getGrid().get(CellAddress.parse("A1"));

        assertEquals("=SUM(", cell.getFormulaText());
        assertNull(cell.getFormula());
        assertEquals(100, loaded.getSheet("sheet1").getRows());
    }

    @Test
    void testParseNamedRange() {
        NamedRange named = WorkbookSerializer.parseNamedRange("Totals", "sheet2!B1:B9");
        assertEquals("sheet2", named.getSheetId());
        assertEquals(CellRange.parse("B1:B9"), named.getRange());

        assertTrue(WorkbookSerializer.parseNamedRange("X", "sheet1!#REF!").isBroken());
        assertThrows(ValidationException.class, () -> WorkbookSerializer.parseNamedRange("X", "A1:A2"));
    }

    @Test
    void testRejectsContentThatIsNotAWorkbook() {
        assertThrows(ValidationException.class, () -> serializer.deserialize("d", "{not json", 100, 10));
        assertThrows(ValidationException.class, () -> serializer.deserialize("d", "[1,2]", 100, 10));
        assertThrows(ValidationException.class, () -> serializer.deserialize("d", "{\"sheets\":[]}", 100, 10));
    }
}
