package com.sheetengine.app.models;

import com.sheetengine.app.engine.address.AddressCodec;
import com.sheetengine.app.engine.address.RangeResolver;

/**
 * Inclusive rectangle of cells. Always normalized: start <= end on both axes.
 */
public final class CellRange {
    private final int startRow;
    private final int startCol;
    private final int endRow;
    private final int endCol;

    public CellRange(int startRow, int startCol, int endRow, int endCol) {
        this.startRow = Math.min(startRow, endRow);
        this.endRow = Math.max(startRow, endRow);
        this.startCol = Math.min(startCol, endCol);
        this.endCol = Math.max(startCol, endCol);
        if (this.startRow < 1 || this.startCol < 1) {
            throw new IllegalArgumentException("Range bounds must be >= 1: " + this.startRow + "," + this.startCol);
        }
    }

    public static CellRange of(CellAddress start, CellAddress end) {
        return new CellRange(start.getRow(), start.getCol(), end.getRow(), end.getCol());
    }

    public static CellRange single(CellAddress address) {
        return of(address, address);
    }

    public static CellRange parse(String text) {
        return RangeResolver.parseRange(text);
    }

    public int getStartRow() {
        return startRow;
    }

    public int getStartCol() {
        return startCol;
    }

    public int getEndRow() {
        return endRow;
    }

    public int getEndCol() {
        return endCol;
    }

    public CellAddress getStart() {
        return new CellAddress(startRow, startCol);
    }

    public CellAddress getEnd() {
        return new CellAddress(endRow, endCol);
    }

    public int height() {
        return endRow - startRow + 1;
    }

    public int width() {
        return endCol - startCol + 1;
    }

    /** Number of addresses covered; long because wide ranges overflow int. */
    public long area() {
        return (long) height() * width();
    }

    public boolean isSingleCell() {
        return startRow == endRow && startCol == endCol;
    }

    public boolean contains(CellAddress address) {
        return contains(address.getRow(), address.getCol());
    }

    public boolean contains(int row, int col) {
        return row >= startRow && row <= endRow && col >= startCol && col <= endCol;
    }

    /**
     * Address at the given 1-based offsets from the top-left corner.
     */
    public CellAddress offset(int rowOffset, int colOffset) {
        return new CellAddress(startRow + rowOffset - 1, startCol + colOffset - 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellRange)) {
            return false;
        }
        CellRange that = (CellRange) o;
        return startRow == that.startRow && startCol == that.startCol
                && endRow == that.endRow && endCol == that.endCol;
    }

    @Override
    public int hashCode() {
        int result = startRow;
        result = 31 * result + startCol;
        result = 31 * result + endRow;
        result = 31 * result + endCol;
        return result;
    }

    /**
     * Renders "A1:C10"; a single-cell range still renders both corners.
     */
    @Override
    public String toString() {
        return AddressCodec.encode(startRow, startCol) + ":" + AddressCodec.encode(endRow, endCol);
    }
}
