package com.sheetengine.app.engine.grid;

import com.sheetengine.app.engine.address.RangeResolver;
import com.sheetengine.app.engine.formula.SheetReader;
import com.sheetengine.app.models.Cell;
import com.sheetengine.app.models.CellAddress;
import com.sheetengine.app.models.CellRange;
import com.sheetengine.app.models.CellValue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Sparse cell storage for one sheet, keyed by address.
 * <p>
 * Point writes mutate in place (callers hold the document write lock).
 * Row/column shifts never touch the receiver: they return a new store made
 * of copied cells, so the previous store stays a valid snapshot until the
 * caller swaps the reference.
 */
public class GridStore implements SheetReader {

    private final Map<CellAddress, Cell> cells;

    public GridStore() {
        this.cells = new HashMap<>();
    }

    private GridStore(Map<CellAddress, Cell> cells) {
        this.cells = cells;
    }

    public Cell get(CellAddress address) {
        return cells.get(address);
    }

    /**
     * Returns the cell at the address, creating an empty one on first write.
     */
    public Cell getOrCreate(CellAddress address) {
        return cells.computeIfAbsent(address, Cell::new);
    }

    public void set(Cell cell) {
        cells.put(cell.getAddress(), cell);
    }

    public Cell remove(CellAddress address) {
        return cells.remove(address);
    }

    @Override
    public CellValue valueAt(CellAddress address) {
        Cell cell = cells.get(address);
        return cell == null ? CellValue.BLANK : cell.getValue();
    }

    public int size() {
        return cells.size();
    }

    public Collection<Cell> cells() {
        return Collections.unmodifiableCollection(cells.values());
    }

    public List<Cell> formulaCells() {
        List<Cell> result = new ArrayList<>();
        for (Cell cell : cells.values()) {
            if (cell.isFormula()) {
                result.add(cell);
            }
        }
        return result;
    }

    /**
     * Formula cells inside the range. Walks whichever is smaller: the range
     * or the populated cells.
     */
    public List<Cell> formulaCellsIn(CellRange range) {
        List<Cell> result = new ArrayList<>();
        if (range.area() < cells.size()) {
            for (CellAddress address : RangeResolver.expand(range)) {
                Cell cell = cells.get(address);
                if (cell != null && cell.isFormula()) {
                    result.add(cell);
                }
            }
        } else {
            for (Cell cell : cells.values()) {
                if (cell.isFormula() && range.contains(cell.getAddress())) {
                    result.add(cell);
                }
            }
        }
        return result;
    }

    /**
     * Removes every populated cell in the range.
     */
    public List<Cell> clear(CellRange range) {
        List<Cell> removed = new ArrayList<>();
        cells.values().removeIf(cell -> {
            if (range.contains(cell.getAddress())) {
                removed.add(cell);
                return true;
            }
            return false;
        });
        return removed;
    }

    /**
     * Deep copy; used as a rollback snapshot before in-place edits.
     */
    public GridStore copy() {
        Map<CellAddress, Cell> copied = new HashMap<>(cells.size() * 2);
        for (Cell cell : cells.values()) {
            copied.put(cell.getAddress(), new Cell(cell, cell.getAddress()));
        }
        return new GridStore(copied);
    }

    // ------------------------
    // Structural shifts
    // ------------------------

    public GridStore insertRows(int at, int count) {
        return shift(true, at, 0, count);
    }

    public GridStore insertColumns(int at, int count) {
        return shift(false, at, 0, count);
    }

    public GridStore deleteRows(int at, int count) {
        return shift(true, at, count, -count);
    }

    public GridStore deleteColumns(int at, int count) {
        return shift(false, at, count, -count);
    }

    /**
     * Drops cells in [at, at + removed) on the chosen axis, then moves every
     * cell at or after {@code at + removed} by {@code delta}.
     */
    private GridStore shift(boolean rows, int at, int removed, int delta) {
        Map<CellAddress, Cell> shifted = new HashMap<>(cells.size() * 2);
        int removedEnd = at + removed;
        for (Cell cell : cells.values()) {
            CellAddress address = cell.getAddress();
            int index = rows ? address.getRow() : address.getCol();
            if (index >= at && index < removedEnd) {
                continue;
            }
            CellAddress target = address;
            if (index >= removedEnd) {
                target = rows ? address.withRow(index + delta) : address.withCol(index + delta);
            }
            shifted.put(target, new Cell(cell, target));
        }
        return new GridStore(shifted);
    }
}
