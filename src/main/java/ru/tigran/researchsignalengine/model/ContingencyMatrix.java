package ru.tigran.researchsignalengine.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Row x column contingency table of quote contributions.
 *
 * Every (row, column) cell exists from construction on, zeroed.
 * Totals count contributions, not weighted mass. A contribution whose row or
 * column label is unknown is dropped without touching any cell or total.
 *
 * Only {@link #accept(QuoteContribution)} mutates the matrix; callers outside
 * the builder see unmodifiable views.
 */
public class ContingencyMatrix {

    private final List<String> rowLabels;
    private final List<String> columnLabels;
    private final Map<CellKey, MatrixCell> cells = new LinkedHashMap<>();
    private final Map<String, Integer> rowTotals = new LinkedHashMap<>();
    private final Map<String, Integer> columnTotals = new LinkedHashMap<>();
    private int grandTotal;

    public ContingencyMatrix(List<String> rowLabels, List<String> columnLabels) {
        this.rowLabels = List.copyOf(rowLabels);
        this.columnLabels = List.copyOf(columnLabels);
        for (String row : this.rowLabels) {
            rowTotals.put(row, 0);
        }
        for (String column : this.columnLabels) {
            columnTotals.put(column, 0);
        }
        for (String row : this.rowLabels) {
            for (String column : this.columnLabels) {
                cells.put(CellKey.of(row, column), new MatrixCell());
            }
        }
    }

    public static ContingencyMatrix empty() {
        return new ContingencyMatrix(List.of(), List.of());
    }

    /**
     * Adds one contribution to its cell and to the row, column and grand totals.
     *
     * @param contribution contribution to add
     * @return false if the contribution references an unknown row or column
     */
    public boolean accept(QuoteContribution contribution) {
        MatrixCell cell = cells.get(contribution.cellKey());
        if (cell == null) {
            return false;
        }
        cell.add(contribution.participantId(), contribution.intensity(), contribution.weight());
        rowTotals.merge(contribution.rowLabel(), 1, Integer::sum);
        columnTotals.merge(contribution.columnLabel(), 1, Integer::sum);
        grandTotal++;
        return true;
    }

    public MatrixCell cell(String row, String column) {
        return cells.get(CellKey.of(row, column));
    }

    public List<String> getRowLabels() {
        return rowLabels;
    }

    public List<String> getColumnLabels() {
        return columnLabels;
    }

    public Map<CellKey, MatrixCell> getCells() {
        return Collections.unmodifiableMap(cells);
    }

    public int rowTotal(String row) {
        return rowTotals.getOrDefault(row, 0);
    }

    public int columnTotal(String column) {
        return columnTotals.getOrDefault(column, 0);
    }

    public Map<String, Integer> getRowTotals() {
        return Collections.unmodifiableMap(rowTotals);
    }

    public Map<String, Integer> getColumnTotals() {
        return Collections.unmodifiableMap(columnTotals);
    }

    public int getGrandTotal() {
        return grandTotal;
    }
}
