package ru.tigran.researchsignalengine.model;

/**
 * Composite key of a matrix cell: row (location) label and column (category) label.
 */
public record CellKey(String row, String column) {

    public static CellKey of(String row, String column) {
        return new CellKey(row, column);
    }

    @Override
    public String toString() {
        return row + "|" + column;
    }
}
