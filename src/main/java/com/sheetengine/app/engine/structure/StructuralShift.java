package com.sheetengine.app.engine.structure;

import com.sheetengine.app.engine.grid.GridStore;
import com.sheetengine.app.models.CellAddress;
import com.sheetengine.app.models.CellRange;

import java.util.Locale;

/**
 * One row or column insert/delete, and how it maps positions.
 * <p>
 * Insert: indices at or after {@code at} move by {@code +count}; a range
 * with start before {@code at} and end at or after it grows.
 * Delete: indices in [at, at + count) disappear, later ones move by
 * {@code -count}; ranges shrink and vanish once every index is gone.
 */
public final class StructuralShift {

    public enum Axis {
        ROWS, COLUMNS
    }

    private final Axis axis;
    private final int at;
    private final int count;
    private final boolean insert;

    private StructuralShift(Axis axis, int at, int count, boolean insert) {
        this.axis = axis;
        this.at = at;
        this.count = count;
        this.insert = insert;
    }

    public static StructuralShift insert(Axis axis, int at, int count) {
        return new StructuralShift(axis, at, count, true);
    }

    public static StructuralShift delete(Axis axis, int at, int count) {
        return new StructuralShift(axis, at, count, false);
    }

    public Axis getAxis() {
        return axis;
    }

    public int getAt() {
        return at;
    }

    public int getCount() {
        return count;
    }

    public boolean isInsert() {
        return insert;
    }

    /**
     * New index, or -1 when the index was deleted.
     */
    public int mapIndex(int index) {
        if (index < at) {
            return index;
        }
        if (insert) {
            return index + count;
        }
        return index < at + count ? -1 : index - count;
    }

    /**
     * New address, or null when the cell was deleted.
     */
    public CellAddress mapAddress(CellAddress address) {
        if (axis == Axis.ROWS) {
            int row = mapIndex(address.getRow());
            return row < 0 ? null : address.withRow(row);
        }
        int col = mapIndex(address.getCol());
        return col < 0 ? null : address.withCol(col);
    }

    /**
     * New range, or null when every row (column) of it was deleted.
     */
    public CellRange mapRange(CellRange range) {
        int start = axis == Axis.ROWS ? range.getStartRow() : range.getStartCol();
        int end = axis == Axis.ROWS ? range.getEndRow() : range.getEndCol();
        int newStart;
        int newEnd;
        if (insert) {
            newStart = start >= at ? start + count : start;
            newEnd = end >= at ? end + count : end;
        } else {
            int bandEnd = at + count - 1;
            newStart = start < at ? start : (start > bandEnd ? start - count : at);
            newEnd = end < at ? end : (end > bandEnd ? end - count : at - 1);
            if (newStart > newEnd) {
                return null;
            }
        }
        if (axis == Axis.ROWS) {
            return new CellRange(newStart, range.getStartCol(), newEnd, range.getEndCol());
        }
        return new CellRange(range.getStartRow(), newStart, range.getEndRow(), newEnd);
    }

    public GridStore apply(GridStore grid) {
        if (axis == Axis.ROWS) {
            return insert ? grid.insertRows(at, count) : grid.deleteRows(at, count);
        }
        return insert ? grid.insertColumns(at, count) : grid.deleteColumns(at, count);
    }

    /**
     * Capacity after the shift; never below 1.
     */
    public int resize(int capacity) {
        return insert ? capacity + count : Math.max(1, capacity - count);
    }

    @Override
    public String toString() {
        return (insert ? "insert " : "delete ") + count + " " + axis.name().toLowerCase(Locale.ROOT) + " at " + at;
    }
}
