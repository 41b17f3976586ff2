package ru.tigran.researchsignalengine.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Quote as supplied for codebook tag analysis.
 *
 * @param id quote identifier referenced by tag associations
 * @param segmentIndex 0-based ordinal in the session transcript, null if unknown
 * @param sectionLabel section the quote is clustered under, null if none
 * @param themeLabel theme the quote is grouped under, null if none
 */
public record TaggedQuoteInput(
        @NotNull(message = "Quote ID cannot be null")
        Long id,

        @NotNull(message = "Quote text cannot be null")
        String text,

        @NotBlank(message = "Participant ID cannot be blank")
        String participantId,

        @NotBlank(message = "Session ID cannot be blank")
        String sessionId,

        @NotNull(message = "Start time cannot be null")
        @PositiveOrZero(message = "Start time must not be negative")
        Double startSeconds,

        @NotNull(message = "Intensity cannot be null")
        @Min(value = 1, message = "Intensity must be between 1 and 3")
        @Max(value = 3, message = "Intensity must be between 1 and 3")
        Integer intensity,

        @PositiveOrZero(message = "Segment index must not be negative")
        Integer segmentIndex,

        String sectionLabel,

        String themeLabel
) {
}
