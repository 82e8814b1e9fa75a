package com.napkin.engine.formula;

import com.napkin.engine.models.CellCoordinate;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts between spreadsheet labels ("AA12") and zero-based coordinates.
 * Columns use the usual bijective base-26 scheme: A=0 .. Z=25, AA=26, AB=27, ...
 */
public final class CellReferences {

    // Regex to identify a cell label: letters followed by a 1-based row number
    private static final Pattern LABEL_PATTERN = Pattern.compile("^([A-Z]+)([0-9]+)$");

    private CellReferences() {
    }

    /**
     * Decodes a label such as "b7" into (6, 1).
     * Letters are upper-cased first; the row must be a positive integer.
     */
    public static CellCoordinate decode(String label) {
        CellCoordinate coordinate = tryDecode(label);
        if (coordinate == null) {
            throw invalid(String.valueOf(label));
        }
        return coordinate;
    }

    /**
     * Same as {@link #decode(String)} but returns null instead of throwing.
     */
    public static CellCoordinate tryDecode(String label) {
        if (label == null) {
            return null;
        }
        Matcher matcher = LABEL_PATTERN.matcher(label.trim().toUpperCase(Locale.ROOT));
        if (!matcher.matches()) {
            return null;
        }
        String digits = matcher.group(2).replaceFirst("^0+(?=.)", "");
        String letters = matcher.group(1);
        // longer than any int row or column
        if (digits.length() > 10 || letters.length() > 6) {
            return null;
        }
        long row = Long.parseLong(digits);
        if (row <= 0 || row > Integer.MAX_VALUE) {
            return null;
        }
        return new CellCoordinate((int) (row - 1), columnIndex(letters));
    }

    /**
     * Encodes a zero-based coordinate, e.g. (0, 26) -> "AA1".
     */
    public static String encode(int row, int column) {
        if (row < 0) {
            throw new IllegalArgumentException("Row index must be non-negative: " + row);
        }
        return columnLabel(column) + (row + 1);
    }

    public static String encode(CellCoordinate coordinate) {
        return encode(coordinate.getRow(), coordinate.getColumn());
    }

    /**
     * "A1" when both corners are the same cell, "A1:C3" otherwise.
     */
    public static String rangeLabel(CellCoordinate start, CellCoordinate end) {
        if (start.equals(end)) {
            return encode(start);
        }
        return encode(start) + ":" + encode(end);
    }

    /**
     * Column letters to zero-based index. Letters must already be A-Z.
     */
    public static int columnIndex(String letters) {
        if (letters == null || letters.isEmpty()) {
            throw invalid(String.valueOf(letters));
        }
        long index = 0;
        for (int i = 0; i < letters.length(); i++) {
            char c = Character.toUpperCase(letters.charAt(i));
            if (c < 'A' || c > 'Z') {
                throw invalid(letters);
            }
            index = index * 26 + (c - 'A' + 1);
            if (index - 1 > Integer.MAX_VALUE) {
                throw invalid(letters);
            }
        }
        return (int) (index - 1);
    }

    /**
     * Zero-based index to column letters, e.g. 27 -> "AB".
     */
    public static String columnLabel(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Column index must be non-negative: " + index);
        }
        StringBuilder sb = new StringBuilder();
        long col = (long) index + 1;
        while (col > 0) {
            int remainder = (int) ((col - 1) % 26);
            sb.insert(0, (char) ('A' + remainder));
            col = (col - 1) / 26;
        }
        return sb.toString();
    }

    private static FormulaException invalid(String label) {
        return new FormulaException(FormulaErrorType.INVALID_REFERENCE, "Invalid cell reference: " + label);
    }
}
