package ru.tigran.researchsignalengine.model;

import java.util.List;

/**
 * Complete output of one analysis run.
 *
 * @param sectionMatrix sections x categories
 * @param themeMatrix themes x categories
 * @param signals merged signals sorted by composite score, truncated to top-N
 * @param totalParticipants participant count used for normalization
 * @param categories canonical column order
 */
public record AnalysisResult(
        ContingencyMatrix sectionMatrix,
        ContingencyMatrix themeMatrix,
        List<Signal> signals,
        int totalParticipants,
        List<String> categories
) {
    public AnalysisResult {
        signals = List.copyOf(signals);
        categories = List.copyOf(categories);
    }

    public static AnalysisResult empty() {
        return new AnalysisResult(
                ContingencyMatrix.empty(),
                ContingencyMatrix.empty(),
                List.of(),
                0,
                List.of()
        );
    }
}
