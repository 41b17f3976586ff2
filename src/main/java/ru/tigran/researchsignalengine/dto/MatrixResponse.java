package ru.tigran.researchsignalengine.dto;

import java.util.List;
import java.util.Map;

/**
 * Contingency matrix serialised for the client. Cells are listed in row-major order.
 */
public record MatrixResponse(
        List<String> rowLabels,
        List<String> columnLabels,
        List<MatrixCellResponse> cells,
        Map<String, Integer> rowTotals,
        Map<String, Integer> columnTotals,
        int grandTotal
) {
}
