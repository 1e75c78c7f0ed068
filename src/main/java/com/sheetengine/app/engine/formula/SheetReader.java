package com.sheetengine.app.engine.formula;

import com.sheetengine.app.models.CellAddress;
import com.sheetengine.app.models.CellValue;

/**
 * Read-only view of cached cell values on one sheet.
 */
public interface SheetReader {

    /**
     * Cached value at the address, or BLANK if no cell is stored there.
     */
    CellValue valueAt(CellAddress address);
}
