package com.sheetengine.app.engine.formula;

import com.sheetengine.app.engine.address.RangeResolver;
import com.sheetengine.app.models.CellAddress;
import com.sheetengine.app.models.CellRange;
import com.sheetengine.app.models.CellValue;

import java.util.Iterator;

/**
 * A range bound to the sheet it reads from. Values are fetched on demand.
 */
public final class RangeView {
    private final SheetReader reader;
    private final CellRange range;

    public RangeView(SheetReader reader, CellRange range) {
        this.reader = reader;
        this.range = range;
    }

    public CellRange getRange() {
        return range;
    }

    public int height() {
        return range.height();
    }

    public int width() {
        return range.width();
    }

    /**
     * Value at 1-based offsets inside the range; caller checks bounds.
     */
    public CellValue get(int rowOffset, int colOffset) {
        return reader.valueAt(range.offset(rowOffset, colOffset));
    }

    /**
     * Row-major lazy stream of values.
     */
    public Iterable<CellValue> values() {
        return () -> new Iterator<CellValue>() {
            private final Iterator<CellAddress> addresses = RangeResolver.expand(range).iterator();

            @Override
            public boolean hasNext() {
                return addresses.hasNext();
            }

            @Override
            public CellValue next() {
                return reader.valueAt(addresses.next());
            }
        };
    }
}
