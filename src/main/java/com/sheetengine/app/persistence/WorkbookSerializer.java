package com.sheetengine.app.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sheetengine.app.engine.formula.FormulaNode;
import com.sheetengine.app.engine.formula.FormulaParser;
import com.sheetengine.app.exceptions.FormulaSyntaxException;
import com.sheetengine.app.exceptions.ValidationException;
import com.sheetengine.app.models.CalculationMode;
import com.sheetengine.app.models.Cell;
import com.sheetengine.app.models.CellAddress;
import com.sheetengine.app.models.CellRange;
import com.sheetengine.app.models.CellValue;
import com.sheetengine.app.models.ChartSpec;
import com.sheetengine.app.models.DateSystem;
import com.sheetengine.app.models.ErrorCode;
import com.sheetengine.app.models.FilterSpec;
import com.sheetengine.app.models.NamedRange;
import com.sheetengine.app.models.Sheet;
import com.sheetengine.app.models.SortOptions;
import com.sheetengine.app.models.Workbook;
import com.sheetengine.app.models.WorkbookSettings;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Converts workbooks to and from the document JSON kept in the store:
 *
 * <pre>
 * {"title":"...","activeSheet":"sheet1",
 *  "settings":{"calculation":"auto","precision":15,"dateSystem":"1900"},
 *  "namedRanges":{"Sales":"sheet1!A1:A10"},
 *  "sheets":[{"id":"sheet1","name":"Sheet1","rows":1000,"cols":26,
 *    "cells":{"A1":{"value":1},"B1":{"value":2,"formula":"=A1*2"}}, ...}]}
 * </pre>
 *
 * Loading restores cells and their stored values; the caller rebuilds the
 * dependency graph and recalculates.
 */
public class WorkbookSerializer {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() {
    };
    private static final TypeReference<List<Map<String, Object>>> LIST_OF_MAPS =
            new TypeReference<List<Map<String, Object>>>() {
            };

    private final ObjectMapper mapper;

    public WorkbookSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String serialize(Workbook workbook) {
        try {
            return mapper.writeValueAsString(toJson(workbook));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize workbook " + workbook.getId(), e);
        }
    }

    public ObjectNode toJson(Workbook workbook) {
        ObjectNode root = mapper.createObjectNode();
        root.put("id", workbook.getId());
        root.put("title", workbook.getTitle());
        root.put("activeSheet", workbook.getActiveSheetId());

        WorkbookSettings settings = workbook.getSettings();
        ObjectNode settingsNode = root.putObject("settings");
        settingsNode.put("calculation", settings.getCalculationMode().name().toLowerCase(Locale.ROOT));
        settingsNode.put("precision", settings.getPrecision());
        settingsNode.put("dateSystem", settings.getDateSystem().getLabel());

        ObjectNode names = root.putObject("namedRanges");
        for (NamedRange named : workbook.getNamedRanges().values()) {
            names.put(named.getName(), named.toString());
        }

        ArrayNode sheets = root.putArray("sheets");
        for (Sheet sheet : workbook.getSheets()) {
            sheets.add(sheetToJson(sheet));
        }
        return root;
    }

    private ObjectNode sheetToJson(Sheet sheet) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", sheet.getId());
        node.put("name", sheet.getName());
        node.put("rows", sheet.getRows());
        node.put("cols", sheet.getCols());

        ObjectNode cells = node.putObject("cells");
        List<Cell> ordered = new ArrayList<>(sheet.getGrid().cells());
        ordered.sort((a, b) -> a.getAddress().compareTo(b.getAddress()));
        for (Cell cell : ordered) {
            cells.set(cell.getAddress().toString(), cellToJson(cell));
        }

        node.set("rowHeights", mapper.valueToTree(sheet.getRowHeights()));
        node.set("colWidths", mapper.valueToTree(sheet.getColWidths()));
        node.set("hiddenRows", mapper.valueToTree(sheet.getHiddenRows()));
        node.set("hiddenCols", mapper.valueToTree(sheet.getHiddenCols()));
        node.put("frozenRows", sheet.getFrozenRows());
        node.put("frozenCols", sheet.getFrozenCols());
        ArrayNode merged = node.putArray("mergedCells");
        sheet.getMergedCells().forEach(range -> merged.add(range.toString()));
        node.set("charts", mapper.valueToTree(sheet.getCharts()));
        node.set("filters", mapper.valueToTree(sheet.getFilters()));

        ObjectNode sort = node.putObject("sort");
        if (sheet.getSort() != null) {
            sort.put("range", sheet.getSortRange());
            sort.put("column", sheet.getSort().getColumn());
            sort.put("ascending", sheet.getSort().isAscending());
            sort.put("hasHeaders", sheet.getSort().isHasHeaders());
        }
        return node;
    }

    private ObjectNode cellToJson(Cell cell) {
        ObjectNode node = mapper.createObjectNode();
        CellValue value = cell.getValue();
        node.set("value", mapper.valueToTree(value.toJavaObject()));
        if (cell.isFormula()) {
            node.put("formula", cell.getFormulaText());
        } else if (value.isError()) {
            // Flattened error literal; keeps it from reloading as plain text
            node.put("error", true);
        }
        if (cell.getFormat() != null && !cell.getFormat().isEmpty()) {
            node.set("format", mapper.valueToTree(cell.getFormat()));
        }
        return node;
    }

    // ------------------------
    // Loading
    // ------------------------

    /**
     * @throws ValidationException when the content is not a workbook document
     */
    public Workbook deserialize(String documentId, String content, int defaultRows, int defaultCols) {
        JsonNode root;
        try {
            root = mapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Document " + documentId + " is not valid JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            throw new ValidationException("Document " + documentId + " is not a workbook");
        }

        Workbook workbook = new Workbook(documentId, root.path("title").asText("Untitled"));
        JsonNode settingsNode = root.path("settings");
        WorkbookSettings settings = new WorkbookSettings();
        if (settingsNode.hasNonNull("calculation")) {
            settings.setCalculationMode(CalculationMode.fromValue(settingsNode.get("calculation").asText()));
        }
        if (settingsNode.hasNonNull("precision")) {
            settings.setPrecision(settingsNode.get("precision").asInt());
        }
        if (settingsNode.hasNonNull("dateSystem")) {
            settings.setDateSystem(DateSystem.fromValue(settingsNode.get("dateSystem").asText()));
        }
        workbook.setSettings(settings);

        for (JsonNode sheetNode : root.path("sheets")) {
            String sheetId = sheetNode.path("id").asText(null);
            if (sheetId == null) {
                sheetId = workbook.nextSheetId();
            }
            Sheet sheet = new Sheet(sheetId, sheetNode.path("name").asText(sheetId),
                    sheetNode.path("rows").asInt(defaultRows), sheetNode.path("cols").asInt(defaultCols));
            readSheet(sheetNode, sheet);
            workbook.addSheet(sheet);
        }
        if (workbook.getSheets().isEmpty()) {
            throw new ValidationException("Document " + documentId + " has no sheets");
        }
        String active = root.path("activeSheet").asText(null);
        if (active != null && workbook.findSheet(active) != null) {
            workbook.setActiveSheetId(active);
        }

        Iterator<Map.Entry<String, JsonNode>> names = root.path("namedRanges").fields();
        while (names.hasNext()) {
            Map.Entry<String, JsonNode> entry = names.next();
            workbook.putNamedRange(parseNamedRange(entry.getKey(), entry.getValue().asText()));
        }
        return workbook;
    }

    private void readSheet(JsonNode node, Sheet sheet) {
        Iterator<Map.Entry<String, JsonNode>> cells = node.path("cells").fields();
        while (cells.hasNext()) {
            Map.Entry<String, JsonNode> entry = cells.next();
            CellAddress address = CellAddress.parse(entry.getKey());
            Cell cell = readCell(address, entry.getValue());
            sheet.ensureCapacity(address);
            sheet.getGrid().set(cell);
        }

        sheet.setRowHeights(readIndexMap(node.path("rowHeights")));
        sheet.setColWidths(readIndexMap(node.path("colWidths")));
        sheet.setHiddenRows(readIndexSet(node.path("hiddenRows")));
        sheet.setHiddenCols(readIndexSet(node.path("hiddenCols")));
        sheet.setFrozenRows(node.path("frozenRows").asInt(0));
        sheet.setFrozenCols(node.path("frozenCols").asInt(0));

        List<CellRange> merged = new ArrayList<>();
        for (JsonNode range : node.path("mergedCells")) {
            merged.add(CellRange.parse(range.asText()));
        }
        sheet.setMergedCells(merged);

        for (JsonNode chartNode : node.path("charts")) {
            sheet.getCharts().add(mapper.convertValue(chartNode, ChartSpec.class));
        }

        Iterator<Map.Entry<String, JsonNode>> filters = node.path("filters").fields();
        while (filters.hasNext()) {
            Map.Entry<String, JsonNode> entry = filters.next();
            FilterSpec spec = new FilterSpec(
                    mapper.convertValue(entry.getValue().path("predicates"), LIST_OF_MAPS),
                    entry.getValue().path("appliedAt").asText(null));
            sheet.getFilters().put(CellRange.parse(entry.getKey()).toString(), spec);
        }

        JsonNode sort = node.path("sort");
        if (sort.hasNonNull("range")) {
            sheet.setSort(CellRange.parse(sort.get("range").asText()).toString(), new SortOptions(
                    sort.path("column").asInt(0),
                    sort.path("ascending").asBoolean(true),
                    sort.path("hasHeaders").asBoolean(false)));
        }
    }

    private Cell readCell(CellAddress address, JsonNode node) {
        Cell cell = new Cell(address);
        Object raw = mapper.convertValue(node.get("value"), Object.class);
        if (node.hasNonNull("formula")) {
            String text = node.get("formula").asText();
            cell.setFormula(text.startsWith("=") ? text : "=" + text, parseOrNull(text));
            cell.setValue(CellValue.fromObject(raw));
        } else if (node.path("error").asBoolean(false) && ErrorCode.fromText(String.valueOf(raw)) != null) {
            cell.setLiteral(CellValue.error(ErrorCode.fromText(String.valueOf(raw))));
        } else {
            cell.setLiteral(CellValue.fromObject(raw));
        }
        if (node.has("format") && node.get("format").isObject()) {
            cell.setFormat(mapper.convertValue(node.get("format"), MAP_TYPE));
        }
        return cell;
    }

    private static FormulaNode parseOrNull(String text) {
        try {
            return FormulaParser.parse(text);
        } catch (FormulaSyntaxException e) {
            return null;
        }
    }

    /**
     * "sheet1!A1:A10"; "sheet1!#REF!" is a broken name.
     */
    static NamedRange parseNamedRange(String name, String text) {
        int bang = text.indexOf('!');
        if (bang <= 0) {
            throw new ValidationException("Named range " + name + " has no sheet: " + text);
        }
        String sheetId = text.substring(0, bang);
        String rangeText = text.substring(bang + 1);
        if (ErrorCode.REF.getText().equals(rangeText)) {
            return new NamedRange(name, sheetId, null);
        }
        return new NamedRange(name, sheetId, CellRange.parse(rangeText));
    }

    private static Map<Integer, Double> readIndexMap(JsonNode node) {
        Map<Integer, Double> result = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            result.put(Integer.parseInt(entry.getKey()), entry.getValue().asDouble());
        }
        return result;
    }

    private static TreeSet<Integer> readIndexSet(JsonNode node) {
        TreeSet<Integer> result = new TreeSet<>();
        for (JsonNode value : node) {
            result.add(value.asInt());
        }
        return result;
    }
}
