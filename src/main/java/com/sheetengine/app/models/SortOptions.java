package com.sheetengine.app.models;

/**
 * Sort request: {@code column} is the 0-based offset of the key column
 * inside the sorted range.
 */
public class SortOptions {
    private int column;
    private boolean ascending = true;
    private boolean hasHeaders;

    public SortOptions() {
    }

    public SortOptions(int column, boolean ascending, boolean hasHeaders) {
        this.column = column;
        this.ascending = ascending;
        this.hasHeaders = hasHeaders;
    }

    public int getColumn() {
        return column;
    }

    public void setColumn(int column) {
        this.column = column;
    }

    public boolean isAscending() {
        return ascending;
    }

    public void setAscending(boolean ascending) {
        this.ascending = ascending;
    }

    public boolean isHasHeaders() {
        return hasHeaders;
    }

    public void setHasHeaders(boolean hasHeaders) {
        this.hasHeaders = hasHeaders;
    }
}
