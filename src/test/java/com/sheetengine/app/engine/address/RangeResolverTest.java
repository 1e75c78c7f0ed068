package com.sheetengine.app.engine.address;

import com.sheetengine.app.exceptions.InvalidReferenceException;
import com.sheetengine.app.models.CellAddress;
import com.sheetengine.app.models.CellRange;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RangeResolverTest {

    @Test
    void testSingleCellRange() {
        CellRange range = RangeResolver.parseRange("B3");
        assertTrue(range.isSingleCell());
        assertEquals(CellAddress.of(3, 2), range.getStart());
    }

    @Test
    void testReversedBoundsAreNormalized() {
        CellRange range = RangeResolver.parseRange("C3:A1");
        assertEquals("A1:C3", range.toString());
        assertEquals(RangeResolver.parseRange("A1:C3"), range);

        // Mixed corners normalize per component
        assertEquals("A1:C3", RangeResolver.parseRange("A3:C1").toString());
    }

    @Test
    void testInvalidRangesAreRejected() {
        assertThrows(InvalidReferenceException.class, () -> RangeResolver.parseRange("A1:"));
        assertThrows(InvalidReferenceException.class, () -> RangeResolver.parseRange("A1:B2:C3"));
        assertThrows(InvalidReferenceException.class, () -> RangeResolver.parseRange("Sheet1!A1"));
        assertThrows(InvalidReferenceException.class, () -> RangeResolver.parseRange(null));
    }

    @Test
    void testExpandIsRowMajor() {
        List<String> addresses = new ArrayList<>();
        for (CellAddress address : RangeResolver.expand(RangeResolver.parseRange("A1:B2"))) {
            addresses.add(address.toString());
        }
        assertEquals(List.of("A1", "B1", "A2", "B2"), addresses);
    }

    /**
     * A huge range is walked lazily; taking a few addresses costs a few steps.
     */
    @Test
    void testExpandIsLazy() {
        CellRange huge = new CellRange(1, 1, 1_000_000, 16_384);
        Iterator<CellAddress> it = RangeResolver.expand(huge).iterator();
        assertEquals(CellAddress.of(1, 1), it.next());
        assertEquals(CellAddress.of(1, 2), it.next());
        assertTrue(it.hasNext());
    }
}
