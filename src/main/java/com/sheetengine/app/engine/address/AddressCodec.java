package com.sheetengine.app.engine.address;

import com.sheetengine.app.exceptions.InvalidReferenceException;
import com.sheetengine.app.models.CellAddress;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bijective conversion between 1-based (row, col) pairs and "A1"-style text.
 * Columns use bijective base-26: A=1 ... Z=26, AA=27, ... ZZZ=18278.
 */
public final class AddressCodec {

    private static final Pattern CELL_PATTERN = Pattern.compile("^([A-Z]+)([0-9]+)$");

    private AddressCodec() {
    }

    public static String encode(int row, int col) {
        if (row < 1 || col < 1) {
            throw new InvalidReferenceException("Row and column must be >= 1, got (" + row + "," + col + ")");
        }
        return columnToLetters(col) + row;
    }

    public static String encode(CellAddress address) {
        return encode(address.getRow(), address.getCol());
    }

    public static CellAddress decode(String ref) {
        if (ref == null) {
            throw new InvalidReferenceException("Cell reference is null");
        }
        Matcher matcher = CELL_PATTERN.matcher(ref.trim());
        if (!matcher.matches()) {
            throw new InvalidReferenceException("Invalid cell reference: " + ref);
        }
        int col = lettersToColumn(matcher.group(1));
        int row;
        try {
            row = Integer.parseInt(matcher.group(2));
        } catch (NumberFormatException e) {
            throw new InvalidReferenceException("Row out of range in reference: " + ref);
        }
        if (row < 1) {
            throw new InvalidReferenceException("Row must be >= 1 in reference: " + ref);
        }
        return new CellAddress(row, col);
    }

    public static boolean isCellReference(String text) {
        return text != null && CELL_PATTERN.matcher(text).matches();
    }

    public static String columnToLetters(int col) {
        if (col < 1) {
            throw new InvalidReferenceException("Column must be >= 1, got " + col);
        }
        StringBuilder sb = new StringBuilder();
        int n = col;
        while (n > 0) {
            n--;
            sb.append((char) ('A' + (n % 26)));
            n /= 26;
        }
        return sb.reverse().toString();
    }

    public static int lettersToColumn(String letters) {
        long col = 0;
        for (int i = 0; i < letters.length(); i++) {
            char c = letters.charAt(i);
            if (c < 'A' || c > 'Z') {
                throw new InvalidReferenceException("Invalid column letters: " + letters);
            }
            col = col * 26 + (c - 'A' + 1);
            if (col > Integer.MAX_VALUE) {
                throw new InvalidReferenceException("Column out of range: " + letters);
            }
        }
        return (int) col;
    }
}
