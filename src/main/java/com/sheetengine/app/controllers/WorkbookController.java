package com.sheetengine.app.controllers;

import com.sheetengine.app.engine.graph.RecalculationResult;
import com.sheetengine.app.exceptions.ValidationException;
import com.sheetengine.app.models.CalculationMode;
import com.sheetengine.app.models.CellInput;
import com.sheetengine.app.models.CellView;
import com.sheetengine.app.models.ChartSpec;
import com.sheetengine.app.models.DateSystem;
import com.sheetengine.app.models.RangeInput;
import com.sheetengine.app.models.SortOptions;
import com.sheetengine.app.models.WorkbookSettings;
import com.sheetengine.app.services.WorkbookService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST endpoints for spreadsheet documents.
 * "/documents" is the base path; sheets, cells and ranges nest under it.
 */
@RestController
@RequestMapping("/documents")
public class WorkbookController {

    @Autowired
    private WorkbookService workbookService;

    /**
     * POST /documents
     * Body: { "title": "Budget" } (optional).
     * Creates a document with one empty sheet and returns its id.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> createDocument(@RequestBody(required = false) Map<String, String> request) {
        String title = request == null ? null : request.get("title");
        String id = workbookService.createDocument(title);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("id", id));
    }

    /**
     * GET /documents/{documentId}
     * Opens the document if needed and returns its sheets, settings and versions.
     */
    @GetMapping("/{documentId}")
    public ResponseEntity<Map<String, Object>> getDocument(@PathVariable String documentId) {
        return ResponseEntity.ok(workbookService.openDocument(documentId));
    }

    /**
     * GET /documents/{documentId}/content
     * The persisted JSON form of the document.
     */
    @GetMapping(value = "/{documentId}/content", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> exportContent(@PathVariable String documentId) {
        return ResponseEntity.ok(workbookService.exportContent(documentId));
    }

    /**
     * POST /documents/{documentId}/flush
     * Retries saving unsaved changes. 502 if the store still fails.
     */
    @PostMapping("/{documentId}/flush")
    public ResponseEntity<Map<String, Long>> flush(@PathVariable String documentId) {
        return ResponseEntity.ok(Map.of("persistedVersion", workbookService.flush(documentId)));
    }

    @PostMapping("/{documentId}/recalculate")
    public ResponseEntity<Map<String, Object>> recalculate(@PathVariable String documentId) {
        RecalculationResult result = workbookService.recalculate(documentId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("evaluated", result.getEvaluated().size());
        body.put("changed", result.getChanged().size());
        body.put("circular", result.getCircular().size());
        return ResponseEntity.ok(body);
    }

    /**
     * PATCH /documents/{documentId}/settings
     * Body: any of { "calculationMode": "manual", "precision": 10, "dateSystem": "1904" }.
     */
    @PatchMapping("/{documentId}/settings")
    public ResponseEntity<WorkbookSettings> updateSettings(@PathVariable String documentId,
                                                           @RequestBody Map<String, Object> request) {
        CalculationMode mode = null;
        DateSystem dateSystem = null;
        Integer precision = null;
        try {
            if (request.get("calculationMode") != null) {
                mode = CalculationMode.fromValue(request.get("calculationMode").toString());
            }
            if (request.get("dateSystem") != null) {
                dateSystem = DateSystem.fromValue(request.get("dateSystem").toString());
            }
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }
        if (request.get("precision") instanceof Number) {
            precision = ((Number) request.get("precision")).intValue();
        } else if (request.get("precision") != null) {
            throw new ValidationException("precision must be a number");
        }
        return ResponseEntity.ok(workbookService.updateSettings(documentId, mode, precision, dateSystem));
    }

    // ------------------------
    // Sheets
    // ------------------------

    @PostMapping("/{documentId}/sheets")
    public ResponseEntity<Map<String, String>> createSheet(@PathVariable String documentId,
                                                           @RequestBody(required = false) Map<String, String> request) {
        String name = request == null ? null : request.get("name");
        String sheetId = workbookService.createSheet(documentId, name);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("sheetId", sheetId));
    }

    @DeleteMapping("/{documentId}/sheets/{sheetId}")
    public ResponseEntity<Void> deleteSheet(@PathVariable String documentId, @PathVariable String sheetId) {
        workbookService.deleteSheet(documentId, sheetId);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{documentId}/activeSheet/{sheetId}")
    public ResponseEntity<Void> setActiveSheet(@PathVariable String documentId, @PathVariable String sheetId) {
        workbookService.setActiveSheet(documentId, sheetId);
        return ResponseEntity.ok().build();
    }

    /**
     * GET /documents/{documentId}/sheets/{sheetId}
     * Returns the computed values of the sheet's populated cells,
     * in the format: { "A1": 10, "B2": "hello", "C3": "#DIV/0!" }.
     */
    @GetMapping("/{documentId}/sheets/{sheetId}")
    public ResponseEntity<Map<String, Object>> getSheetValues(@PathVariable String documentId,
                                                              @PathVariable String sheetId) {
        return ResponseEntity.ok(workbookService.getSheetValues(documentId, sheetId));
    }

    @GetMapping("/{documentId}/sheets/{sheetId}/formulas")
    public ResponseEntity<Map<String, String>> getFormulas(@PathVariable String documentId,
                                                           @PathVariable String sheetId) {
        return ResponseEntity.ok(workbookService.getFormulas(documentId, sheetId));
    }

    /**
     * GET /documents/{documentId}/sheets/{sheetId}/forwardDependencies
     * For each formula cell => the cells, ranges and names it reads.
     */
    @GetMapping("/{documentId}/sheets/{sheetId}/forwardDependencies")
    public ResponseEntity<Map<String, Set<String>>> getForwardDependencies(@PathVariable String documentId,
                                                                           @PathVariable String sheetId) {
        return ResponseEntity.ok(workbookService.getForwardDependencies(documentId, sheetId));
    }

    /**
     * GET /documents/{documentId}/sheets/{sheetId}/reverseDependencies
     * For each referenced cell or range => the formula cells reading it.
     */
    @GetMapping("/{documentId}/sheets/{sheetId}/reverseDependencies")
    public ResponseEntity<Map<String, Set<String>>> getReverseDependencies(@PathVariable String documentId,
                                                                           @PathVariable String sheetId) {
        return ResponseEntity.ok(workbookService.getReverseDependencies(documentId, sheetId));
    }

    // ------------------------
    // Cells and ranges
    // ------------------------

    /**
     * PUT /documents/{documentId}/sheets/{sheetId}/cells/{address}
     * Body: { "value": 42 } or { "formula": "=A1*2" }, optionally with "format".
     * Returns the cell after recalculation.
     */
    @PutMapping("/{documentId}/sheets/{sheetId}/cells/{address}")
    public ResponseEntity<CellView> setCell(@PathVariable String documentId, @PathVariable String sheetId,
                                            @PathVariable String address, @RequestBody CellInput input) {
        return ResponseEntity.ok(workbookService.setCell(documentId, sheetId, address, input));
    }

    /**
     * POST /documents/{documentId}/sheets/{sheetId}/cells/{address}/function
     * Body: { "functionName": "SUM", "parameters": ["A1:A3", 10] }.
     * Writes =SUM(A1:A3,10) into the cell and returns it after recalculation.
     */
    @PostMapping("/{documentId}/sheets/{sheetId}/cells/{address}/function")
    public ResponseEntity<CellView> insertFunction(@PathVariable String documentId, @PathVariable String sheetId,
                                                   @PathVariable String address,
                                                   @RequestBody Map<String, Object> request) {
        Object functionName = request.get("functionName");
        Object raw = request.get("parameters");
        List<String> parameters = new ArrayList<>();
        if (raw instanceof List) {
            for (Object parameter : (List<?>) raw) {
                parameters.add(parameter == null ? null : parameter.toString());
            }
        } else if (raw != null) {
            throw new ValidationException("parameters must be a list");
        }
        return ResponseEntity.ok(workbookService.insertFunction(documentId, sheetId, address,
                functionName == null ? null : functionName.toString(), parameters));
    }

    @GetMapping("/{documentId}/sheets/{sheetId}/cells/{address}")
    public ResponseEntity<CellView> getCell(@PathVariable String documentId, @PathVariable String sheetId,
                                            @PathVariable String address) {
        return ResponseEntity.ok(workbookService.getCell(documentId, sheetId, address));
    }

    /**
     * PUT /documents/{documentId}/sheets/{sheetId}/ranges/{range}
     * Body: { "values": [[1, 2], [3, 4]] } and/or "formulas", "formats" grids.
     */
    @PutMapping("/{documentId}/sheets/{sheetId}/ranges/{range}")
    public ResponseEntity<List<CellView>> setRange(@PathVariable String documentId, @PathVariable String sheetId,
                                                   @PathVariable String range, @RequestBody RangeInput input) {
        return ResponseEntity.ok(workbookService.setRange(documentId, sheetId, range, input));
    }

    @DeleteMapping("/{documentId}/sheets/{sheetId}/ranges/{range}")
    public ResponseEntity<Void> clearRange(@PathVariable String documentId, @PathVariable String sheetId,
                                           @PathVariable String range) {
        workbookService.clearRange(documentId, sheetId, range);
        return ResponseEntity.noContent().build();
    }

    // ------------------------
    // Structural edits
    // ------------------------

    /**
     * POST /documents/{documentId}/sheets/{sheetId}/rows/insert?at=2&count=1
     * Inserts rows before row {@code at}; formulas are rebased.
     */
    @PostMapping("/{documentId}/sheets/{sheetId}/rows/insert")
    public ResponseEntity<Void> insertRows(@PathVariable String documentId, @PathVariable String sheetId,
                                           @RequestParam int at, @RequestParam(defaultValue = "1") int count) {
        workbookService.insertRows(documentId, sheetId, at, count);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/{documentId}/sheets/{sheetId}/rows/delete")
    public ResponseEntity<Void> deleteRows(@PathVariable String documentId, @PathVariable String sheetId,
                                           @RequestParam int at, @RequestParam(defaultValue = "1") int count) {
        workbookService.deleteRows(documentId, sheetId, at, count);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/{documentId}/sheets/{sheetId}/columns/insert")
    public ResponseEntity<Void> insertColumns(@PathVariable String documentId, @PathVariable String sheetId,
                                              @RequestParam int at, @RequestParam(defaultValue = "1") int count) {
        workbookService.insertColumns(documentId, sheetId, at, count);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/{documentId}/sheets/{sheetId}/columns/delete")
    public ResponseEntity<Void> deleteColumns(@PathVariable String documentId, @PathVariable String sheetId,
                                              @RequestParam int at, @RequestParam(defaultValue = "1") int count) {
        workbookService.deleteColumns(documentId, sheetId, at, count);
        return ResponseEntity.ok().build();
    }

    // ------------------------
    // Charts, filters, sorting
    // ------------------------

    @PostMapping("/{documentId}/sheets/{sheetId}/charts")
    public ResponseEntity<ChartSpec> createChart(@PathVariable String documentId, @PathVariable String sheetId,
                                                 @RequestBody ChartSpec chart) {
        return ResponseEntity.status(HttpStatus.CREATED).body(workbookService.createChart(documentId, sheetId, chart));
    }

    @PatchMapping("/{documentId}/sheets/{sheetId}/charts/{chartId}")
    public ResponseEntity<ChartSpec> updateChart(@PathVariable String documentId, @PathVariable String sheetId,
                                                 @PathVariable String chartId, @RequestBody ChartSpec patch) {
        return ResponseEntity.ok(workbookService.updateChart(documentId, sheetId, chartId, patch));
    }

    @DeleteMapping("/{documentId}/sheets/{sheetId}/charts/{chartId}")
    public ResponseEntity<Void> deleteChart(@PathVariable String documentId, @PathVariable String sheetId,
                                            @PathVariable String chartId) {
        workbookService.deleteChart(documentId, sheetId, chartId);
        return ResponseEntity.noContent().build();
    }

    /**
     * PUT /documents/{documentId}/sheets/{sheetId}/filters/{range}
     * Body: a list of predicates, stored as given.
     */
    @PutMapping("/{documentId}/sheets/{sheetId}/filters/{range}")
    public ResponseEntity<Void> applyFilter(@PathVariable String documentId, @PathVariable String sheetId,
                                            @PathVariable String range,
                                            @RequestBody List<Map<String, Object>> predicates) {
        workbookService.applyFilter(documentId, sheetId, range, predicates);
        return ResponseEntity.ok().build();
    }

    /**
     * POST /documents/{documentId}/sheets/{sheetId}/sort/{range}
     * Body: { "column": 0, "ascending": true, "hasHeaders": false }.
     */
    @PostMapping("/{documentId}/sheets/{sheetId}/sort/{range}")
    public ResponseEntity<Void> sortRange(@PathVariable String documentId, @PathVariable String sheetId,
                                          @PathVariable String range, @RequestBody SortOptions options) {
        workbookService.sortRange(documentId, sheetId, range, options);
        return ResponseEntity.ok().build();
    }

    // ------------------------
    // Named ranges
    // ------------------------

    @GetMapping("/{documentId}/names")
    public ResponseEntity<Map<String, String>> getNames(@PathVariable String documentId) {
        return ResponseEntity.ok(workbookService.getNames(documentId));
    }

    /**
     * PUT /documents/{documentId}/names/{name}
     * Body: { "sheetId": "sheet1", "range": "A1:A10" }.
     */
    @PutMapping("/{documentId}/names/{name}")
    public ResponseEntity<Void> defineName(@PathVariable String documentId, @PathVariable String name,
                                           @RequestBody Map<String, String> request) {
        workbookService.defineName(documentId, name, request.get("sheetId"), request.get("range"));
        return ResponseEntity.ok().build();
    }

    @DeleteMapping("/{documentId}/names/{name}")
    public ResponseEntity<Void> removeName(@PathVariable String documentId, @PathVariable String name) {
        workbookService.removeName(documentId, name);
        return ResponseEntity.noContent().build();
    }
}
