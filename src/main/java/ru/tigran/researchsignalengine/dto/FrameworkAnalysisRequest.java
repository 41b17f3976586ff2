package ru.tigran.researchsignalengine.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Map;

/**
 * Runs one tag analysis per codebook framework.
 *
 * @param analysis shared quotes, rows, groups and tag associations
 * @param frameworks framework name -> group names analysed together
 */
public record FrameworkAnalysisRequest(
        @NotNull(message = "Analysis cannot be null")
        @Valid
        TagAnalysisRequest analysis,

        @NotEmpty(message = "Frameworks cannot be empty")
        Map<String, @NotEmpty(message = "Each framework needs at least one group") List<String>> frameworks
) {
}
