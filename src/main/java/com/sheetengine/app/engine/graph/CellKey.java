package com.sheetengine.app.engine.graph;

import com.sheetengine.app.models.CellAddress;

/**
 * Workbook-wide identity of a cell: sheet id plus address.
 */
public final class CellKey implements Comparable<CellKey> {
    private final String sheetId;
    private final CellAddress address;

    public CellKey(String sheetId, CellAddress address) {
        this.sheetId = sheetId;
        this.address = address;
    }

    public static CellKey of(String sheetId, CellAddress address) {
        return new CellKey(sheetId, address);
    }

    public static CellKey of(String sheetId, int row, int col) {
        return new CellKey(sheetId, CellAddress.of(row, col));
    }

    public String getSheetId() {
        return sheetId;
    }

    public CellAddress getAddress() {
        return address;
    }

    @Override
    public int compareTo(CellKey other) {
        int bySheet = sheetId.compareTo(other.sheetId);
        return bySheet != 0 ? bySheet : address.compareTo(other.address);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellKey)) {
            return false;
        }
        CellKey that = (CellKey) o;
        return sheetId.equals(that.sheetId) && address.equals(that.address);
    }

    @Override
    public int hashCode() {
        return 31 * sheetId.hashCode() + address.hashCode();
    }

    @Override
    public String toString() {
        return sheetId + "!" + address;
    }
}
