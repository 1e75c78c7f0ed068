package com.sheetengine.app.engine.structure;

import com.sheetengine.app.engine.formula.FormulaNode;
import com.sheetengine.app.engine.formula.FormulaWriter;
import com.sheetengine.app.engine.graph.RecalculationResult;
import com.sheetengine.app.engine.graph.RecalculationScheduler;
import com.sheetengine.app.engine.grid.GridStore;
import com.sheetengine.app.exceptions.StructuralMutationException;
import com.sheetengine.app.exceptions.ValidationException;
import com.sheetengine.app.models.Cell;
import com.sheetengine.app.models.CellRange;
import com.sheetengine.app.models.FilterSpec;
import com.sheetengine.app.models.NamedRange;
import com.sheetengine.app.models.Sheet;
import com.sheetengine.app.models.Workbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Row and column insert/delete.
 * <p>
 * Each operation shifts the sheet's grid into a new store, rebases every
 * formula on the sheet and every name pointing at it, moves row/column
 * metadata, merged ranges and filters, then rebuilds the dependency graph and
 * recalculates the whole workbook. If any step throws, every sheet, name and
 * edge is put back as it was and a StructuralMutationException is raised.
 * Callers hold the document write lock.
 */
public class StructuralMutationEngine {

    private static final Logger logger = LoggerFactory.getLogger(StructuralMutationEngine.class);

    private final RecalculationScheduler scheduler;

    public StructuralMutationEngine(RecalculationScheduler scheduler) {
        this.scheduler = scheduler;
    }

    public RecalculationResult insertRows(Workbook workbook, Sheet sheet, int at, int count) {
        return apply(workbook, sheet, StructuralShift.insert(StructuralShift.Axis.ROWS, at, count));
    }

    public RecalculationResult insertColumns(Workbook workbook, Sheet sheet, int at, int count) {
        return apply(workbook, sheet, StructuralShift.insert(StructuralShift.Axis.COLUMNS, at, count));
    }

    public RecalculationResult deleteRows(Workbook workbook, Sheet sheet, int at, int count) {
        return apply(workbook, sheet, StructuralShift.delete(StructuralShift.Axis.ROWS, at, count));
    }

    public RecalculationResult deleteColumns(Workbook workbook, Sheet sheet, int at, int count) {
        return apply(workbook, sheet, StructuralShift.delete(StructuralShift.Axis.COLUMNS, at, count));
    }

    RecalculationResult apply(Workbook workbook, Sheet sheet, StructuralShift shift) {
        if (shift.getAt() < 1) {
            throw new ValidationException("Position must be >= 1, got " + shift.getAt());
        }
        if (shift.getCount() < 1) {
            throw new ValidationException("Count must be >= 1, got " + shift.getCount());
        }

        List<Sheet.Snapshot> snapshots = new ArrayList<>();
        for (Sheet s : workbook.getSheets()) {
            snapshots.add(s.snapshot());
        }
        Map<String, NamedRange> previousNames = workbook.getNamedRanges();

        try {
            for (Sheet s : workbook.getSheets()) {
                // Other sheets get a private copy too: the recalculation below writes values into them
                s.setGrid(s == sheet ? rebaseFormulas(shift.apply(s.getGrid()), shift) : s.getGrid().copy());
            }
            shiftMetadata(sheet, shift);
            workbook.setNamedRanges(rebaseNames(previousNames, sheet.getId(), shift));

            scheduler.rebuildGraph(workbook);
            RecalculationResult result = scheduler.recalculateAll(workbook);
            logger.debug("Applied {} on {}/{}", shift, workbook.getId(), sheet.getId());
            return result;
        } catch (RuntimeException e) {
            for (Sheet.Snapshot snapshot : snapshots) {
                snapshot.restore();
            }
            workbook.setNamedRanges(previousNames);
            scheduler.rebuildGraph(workbook);
            logger.error("Rolled back {} on {}/{}", shift, workbook.getId(), sheet.getId(), e);
            throw new StructuralMutationException("Failed to " + shift + " on sheet " + sheet.getId(), e);
        }
    }

    private static GridStore rebaseFormulas(GridStore grid, StructuralShift shift) {
        ReferenceRebaser rebaser = new ReferenceRebaser(shift);
        for (Cell cell : grid.formulaCells()) {
            FormulaNode formula = cell.getFormula();
            if (formula == null) {
                continue;
            }
            FormulaNode rebased = rebaser.rebase(formula);
            if (rebased != formula) {
                cell.setFormula(FormulaWriter.toFormulaText(rebased), rebased);
            }
        }
        return grid;
    }

    private static Map<String, NamedRange> rebaseNames(Map<String, NamedRange> names, String sheetId,
                                                       StructuralShift shift) {
        Map<String, NamedRange> rebased = new LinkedHashMap<>();
        for (Map.Entry<String, NamedRange> entry : names.entrySet()) {
            NamedRange named = entry.getValue();
            if (named.getSheetId().equals(sheetId) && !named.isBroken()) {
                named = named.withRange(shift.mapRange(named.getRange()));
            }
            rebased.put(entry.getKey(), named);
        }
        return rebased;
    }

    private static void shiftMetadata(Sheet sheet, StructuralShift shift) {
        boolean rows = shift.getAxis() == StructuralShift.Axis.ROWS;
        if (rows) {
            sheet.setRows(shift.resize(sheet.getRows()));
            sheet.setRowHeights(shiftKeys(sheet.getRowHeights(), shift));
            sheet.setHiddenRows(shiftIndices(sheet.getHiddenRows(), shift));
        } else {
            sheet.setCols(shift.resize(sheet.getCols()));
            sheet.setColWidths(shiftKeys(sheet.getColWidths(), shift));
            sheet.setHiddenCols(shiftIndices(sheet.getHiddenCols(), shift));
        }

        List<CellRange> merged = new ArrayList<>();
        for (CellRange range : sheet.getMergedCells()) {
            CellRange mapped = shift.mapRange(range);
            if (mapped != null) {
                merged.add(mapped);
            }
        }
        sheet.setMergedCells(merged);

        Map<String, FilterSpec> filters = new LinkedHashMap<>();
        for (Map.Entry<String, FilterSpec> entry : sheet.getFilters().entrySet()) {
            CellRange mapped = shift.mapRange(CellRange.parse(entry.getKey()));
            if (mapped != null) {
                filters.put(mapped.toString(), entry.getValue());
            }
        }
        sheet.setFilters(filters);

        if (sheet.getSortRange() != null) {
            CellRange mapped = shift.mapRange(CellRange.parse(sheet.getSortRange()));
            sheet.setSort(mapped == null ? null : mapped.toString(), mapped == null ? null : sheet.getSort());
        }
    }

    private static Map<Integer, Double> shiftKeys(Map<Integer, Double> source, StructuralShift shift) {
        Map<Integer, Double> shifted = new TreeMap<>();
        for (Map.Entry<Integer, Double> entry : source.entrySet()) {
            int index = shift.mapIndex(entry.getKey());
            if (index > 0) {
                shifted.put(index, entry.getValue());
            }
        }
        return shifted;
    }

    private static Set<Integer> shiftIndices(Set<Integer> source, StructuralShift shift) {
        Set<Integer> shifted = new TreeSet<>();
        for (Integer value : source) {
            int index = shift.mapIndex(value);
            if (index > 0) {
                shifted.add(index);
            }
        }
        return shifted;
    }
}
