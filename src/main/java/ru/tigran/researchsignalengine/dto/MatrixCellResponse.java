package ru.tigran.researchsignalengine.dto;

import java.util.List;
import java.util.Map;

/**
 * @param adjustedResidual deviation from independence, for heat-map colouring (2 decimals)
 */
public record MatrixCellResponse(
        String row,
        String column,
        int count,
        double weightedCount,
        Map<String, Integer> participants,
        List<Integer> intensities,
        double adjustedResidual
) {
}
