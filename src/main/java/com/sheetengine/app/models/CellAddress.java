package com.sheetengine.app.models;

import com.sheetengine.app.engine.address.AddressCodec;

/**
 * Immutable 1-based (row, col) coordinate of a cell inside a sheet.
 * Used as the key of the sparse grid, so equality is purely positional.
 */
public final class CellAddress implements Comparable<CellAddress> {
    private final int row;
    private final int col;

    public CellAddress(int row, int col) {
        if (row < 1 || col < 1) {
            throw new IllegalArgumentException("Row and column must be >= 1, got (" + row + "," + col + ")");
        }
        this.row = row;
        this.col = col;
    }

    public static CellAddress of(int row, int col) {
        return new CellAddress(row, col);
    }

    /**
     * Parses "B3"-style text. Throws InvalidReferenceException for bad input.
     */
    public static CellAddress parse(String text) {
        return AddressCodec.decode(text);
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    public CellAddress withRow(int newRow) {
        return new CellAddress(newRow, col);
    }

    public CellAddress withCol(int newCol) {
        return new CellAddress(row, newCol);
    }

    // Row-major ordering
    @Override
    public int compareTo(CellAddress other) {
        if (row != other.row) {
            return Integer.compare(row, other.row);
        }
        return Integer.compare(col, other.col);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellAddress)) {
            return false;
        }
        CellAddress that = (CellAddress) o;
        return row == that.row && col == that.col;
    }

    @Override
    public int hashCode() {
        return 31 * row + col;
    }

    @Override
    public String toString() {
        return AddressCodec.encode(row, col);
    }
}
