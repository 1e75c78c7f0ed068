package com.sheetengine.app.engine.address;

import com.sheetengine.app.exceptions.InvalidReferenceException;
import com.sheetengine.app.models.CellAddress;
import com.sheetengine.app.models.CellRange;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.regex.Pattern;

/**
 * Parses "A1:C10" text into normalized ranges and expands ranges lazily.
 */
public final class RangeResolver {

    private static final Pattern RANGE_PATTERN = Pattern.compile("^[A-Z]+[0-9]+(:[A-Z]+[0-9]+)?$");

    private RangeResolver() {
    }

    /**
     * A bare "A1" yields a single-cell range; "C3:A1" is normalized to "A1:C3".
     */
    public static CellRange parseRange(String text) {
        if (text == null || !RANGE_PATTERN.matcher(text.trim()).matches()) {
            throw new InvalidReferenceException("Invalid range: " + text);
        }
        String[] parts = text.trim().split(":");
        CellAddress start = AddressCodec.decode(parts[0]);
        CellAddress end = parts.length > 1 ? AddressCodec.decode(parts[1]) : start;
        return CellRange.of(start, end);
    }

    /**
     * Row-major lazy sequence of the addresses in the range. Nothing is
     * materialized, so iterating a huge range only costs the iteration.
     */
    public static Iterable<CellAddress> expand(CellRange range) {
        return () -> new AddressIterator(range);
    }

    private static final class AddressIterator implements Iterator<CellAddress> {
        private final CellRange range;
        private int row;
        private int col;

        AddressIterator(CellRange range) {
            this.range = range;
            this.row = range.getStartRow();
            this.col = range.getStartCol();
        }

        @Override
        public boolean hasNext() {
            return row <= range.getEndRow();
        }

        @Override
        public CellAddress next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            CellAddress current = new CellAddress(row, col);
            if (col == range.getEndCol()) {
                col = range.getStartCol();
                row++;
            } else {
                col++;
            }
            return current;
        }
    }
}
