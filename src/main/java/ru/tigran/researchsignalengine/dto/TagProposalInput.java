package ru.tigran.researchsignalengine.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import ru.tigran.researchsignalengine.model.ProposalStatus;

/**
 * Tag proposed for a quote by the auto-coder.
 * Pending proposals count with their confidence as weight; rejected ones do not count.
 */
public record TagProposalInput(
        @NotNull(message = "Quote ID cannot be null")
        Long quoteId,

        @NotBlank(message = "Tag name cannot be blank")
        String tagName,

        @NotNull(message = "Confidence cannot be null")
        @DecimalMin(value = "0.0", message = "Confidence must be between 0.0 and 1.0")
        @DecimalMax(value = "1.0", message = "Confidence must be between 0.0 and 1.0")
        Double confidence,

        @NotNull(message = "Proposal status cannot be null")
        ProposalStatus status
) {
}
