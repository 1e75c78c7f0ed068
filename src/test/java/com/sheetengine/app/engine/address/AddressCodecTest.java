package com.sheetengine.app.engine.address;

import com.sheetengine.app.exceptions.InvalidReferenceException;
import com.sheetengine.app.models.CellAddress;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AddressCodecTest {

    @Test
    void testEncodeKnownColumns() {
        assertEquals("A1", AddressCodec.encode(1, 1));
        assertEquals("Z9", AddressCodec.encode(9, 26));
        assertEquals("AA10", AddressCodec.encode(10, 27));
        assertEquals("AZ1", AddressCodec.encode(1, 52));
        assertEquals("BA1", AddressCodec.encode(1, 53));
        assertEquals("ZZZ1", AddressCodec.encode(1, 18278));
    }

    /**
     * Every column up to ZZZ survives encode -> decode.
     */
    @Test
    void testRoundTripAllColumns() {
        for (int col = 1; col <= 18278; col++) {
            int row = (col % 1000) + 1;
            CellAddress decoded = AddressCodec.decode(AddressCodec.encode(row, col));
            assertEquals(row, decoded.getRow());
            assertEquals(col, decoded.getCol(), "column " + col);
        }
    }

    @Test
    void testDecodeRejectsMalformedReferences() {
        assertThrows(InvalidReferenceException.class, () -> AddressCodec.decode("1A"));
        assertThrows(InvalidReferenceException.class, () -> AddressCodec.decode("A0"));
        assertThrows(InvalidReferenceException.class, () -> AddressCodec.decode("a1"));
        assertThrows(InvalidReferenceException.class, () -> AddressCodec.decode(""));
        assertThrows(InvalidReferenceException.class, () -> AddressCodec.decode(null));
    }

    @Test
    void testColumnLetters() {
        assertEquals(28, AddressCodec.lettersToColumn("AB"));
        assertEquals("AB", AddressCodec.columnToLetters(28));
        assertThrows(InvalidReferenceException.class, () -> AddressCodec.columnToLetters(0));
    }
}
