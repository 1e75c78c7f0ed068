package com.sheetengine.app.models;

/**
 * A workbook-level name bound to a range on one sheet. The range becomes
 * null when a structural delete removes every cell it covered; the name
 * then evaluates to #REF!.
 */
public class NamedRange {
    private final String name;
    private final String sheetId;
    private final CellRange range;

    public NamedRange(String name, String sheetId, CellRange range) {
        this.name = name;
        this.sheetId = sheetId;
        this.range = range;
    }

    public String getName() {
        return name;
    }

    public String getSheetId() {
        return sheetId;
    }

    public CellRange getRange() {
        return range;
    }

    public boolean isBroken() {
        return range == null;
    }

    public NamedRange withRange(CellRange newRange) {
        return new NamedRange(name, sheetId, newRange);
    }

    /**
     * "sheet1!A1:A10", or "sheet1!#REF!" once broken.
     */
    @Override
    public String toString() {
        return sheetId + "!" + (range == null ? ErrorCode.REF.getText() : range.toString());
    }
}
