package com.sheetengine.app.models;

import com.sheetengine.app.engine.grid.GridStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Represents one sheet of a workbook:
 * - id ("sheet1", "sheet2", ...) and display name
 * - rows/cols capacity
 * - the sparse GridStore holding its cells
 * - row/column metadata, merged ranges, charts, filters and the last sort
 * <p>
 * Charts, filters and formats are stored for clients and never computed.
 * The document lock lives on the Workbook, not here.
 */
public class Sheet {

    private final String id;
    private String name;
    private int rows;
    private int cols;
    private GridStore grid = new GridStore();

    private Map<Integer, Double> rowHeights = new TreeMap<>();
    private Map<Integer, Double> colWidths = new TreeMap<>();
    private Set<Integer> hiddenRows = new TreeSet<>();
    private Set<Integer> hiddenCols = new TreeSet<>();
    private int frozenRows;
    private int frozenCols;
    private List<CellRange> mergedCells = new ArrayList<>();
    private final List<ChartSpec> charts = new ArrayList<>();
    // Keyed by normalized range text, e.g. "A1:C20"
    private Map<String, FilterSpec> filters = new LinkedHashMap<>();
    private String sortRange;
    private SortOptions sort;

    public Sheet(String id, String name, int rows, int cols) {
        this.id = id;
        this.name = name;
        this.rows = rows;
        this.cols = cols;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public int getRows() {
        return rows;
    }

    public void setRows(int rows) {
        this.rows = rows;
    }

    public int getCols() {
        return cols;
    }

    public void setCols(int cols) {
        this.cols = cols;
    }

    /**
     * Grows capacity so the address fits; writes beyond the edge extend the sheet.
     */
    public void ensureCapacity(CellAddress address) {
        rows = Math.max(rows, address.getRow());
        cols = Math.max(cols, address.getCol());
    }

    public GridStore getGrid() {
        return grid;
    }

    public void setGrid(GridStore grid) {
        this.grid = grid;
    }

    public Map<Integer, Double> getRowHeights() {
        return rowHeights;
    }

    public void setRowHeights(Map<Integer, Double> rowHeights) {
        this.rowHeights = rowHeights;
    }

    public Map<Integer, Double> getColWidths() {
        return colWidths;
    }

    public void setColWidths(Map<Integer, Double> colWidths) {
        this.colWidths = colWidths;
    }

    public Set<Integer> getHiddenRows() {
        return hiddenRows;
    }

    public void setHiddenRows(Set<Integer> hiddenRows) {
        this.hiddenRows = hiddenRows;
    }

    public Set<Integer> getHiddenCols() {
        return hiddenCols;
    }

    public void setHiddenCols(Set<Integer> hiddenCols) {
        this.hiddenCols = hiddenCols;
    }

    public int getFrozenRows() {
        return frozenRows;
    }

    public void setFrozenRows(int frozenRows) {
        this.frozenRows = frozenRows;
    }

    public int getFrozenCols() {
        return frozenCols;
    }

    public void setFrozenCols(int frozenCols) {
        this.frozenCols = frozenCols;
    }

    public List<CellRange> getMergedCells() {
        return mergedCells;
    }

    public void setMergedCells(List<CellRange> mergedCells) {
        this.mergedCells = mergedCells;
    }

    public List<ChartSpec> getCharts() {
        return charts;
    }

    public ChartSpec findChart(String chartId) {
        for (ChartSpec chart : charts) {
            if (chart.getId().equals(chartId)) {
                return chart;
            }
        }
        return null;
    }

    public Map<String, FilterSpec> getFilters() {
        return filters;
    }

    public void setFilters(Map<String, FilterSpec> filters) {
        this.filters = filters;
    }

    public String getSortRange() {
        return sortRange;
    }

    public SortOptions getSort() {
        return sort;
    }

    public void setSort(String sortRange, SortOptions sort) {
        this.sortRange = sortRange;
        this.sort = sort;
    }

    public Snapshot snapshot() {
        return new Snapshot(this);
    }

    /**
     * Everything a structural edit can change, captured so it can be put back.
     * Collections are copied; the grid is held by reference because shifts
     * never mutate a store in place.
     */
    public static final class Snapshot {
        private final Sheet sheet;
        private final GridStore grid;
        private final int rows;
        private final int cols;
        private final Map<Integer, Double> rowHeights;
        private final Map<Integer, Double> colWidths;
        private final Set<Integer> hiddenRows;
        private final Set<Integer> hiddenCols;
        private final List<CellRange> mergedCells;
        private final Map<String, FilterSpec> filters;
        private final String sortRange;
        private final SortOptions sort;

        private Snapshot(Sheet sheet) {
            this.sheet = sheet;
            this.grid = sheet.grid;
            this.rows = sheet.rows;
            this.cols = sheet.cols;
            this.rowHeights = new TreeMap<>(sheet.rowHeights);
            this.colWidths = new TreeMap<>(sheet.colWidths);
            this.hiddenRows = new TreeSet<>(sheet.hiddenRows);
            this.hiddenCols = new TreeSet<>(sheet.hiddenCols);
            this.mergedCells = new ArrayList<>(sheet.mergedCells);
            this.filters = new LinkedHashMap<>(sheet.filters);
            this.sortRange = sheet.sortRange;
            this.sort = sheet.sort;
        }

        public GridStore getGrid() {
            return grid;
        }

        public void restore() {
            sheet.grid = grid;
            sheet.rows = rows;
            sheet.cols = cols;
            sheet.rowHeights = rowHeights;
            sheet.colWidths = colWidths;
            sheet.hiddenRows = hiddenRows;
            sheet.hiddenCols = hiddenCols;
            sheet.mergedCells = mergedCells;
            sheet.filters = filters;
            sheet.sortRange = sortRange;
            sheet.sort = sort;
        }
    }
}
