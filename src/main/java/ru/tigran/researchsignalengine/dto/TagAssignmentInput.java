package ru.tigran.researchsignalengine.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Tag applied to a quote by a researcher. Counts with full weight.
 */
public record TagAssignmentInput(
        @NotNull(message = "Quote ID cannot be null")
        Long quoteId,

        @NotBlank(message = "Tag name cannot be blank")
        String tagName
) {
}
