package ru.tigran.researchsignalengine.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import ru.tigran.researchsignalengine.model.Sentiment;

/**
 * Extracted quote as supplied for sentiment analysis.
 * The grouping (section or theme) is given by the enclosing element.
 *
 * @param sentiment single dominant sentiment, null for purely descriptive quotes
 */
public record QuoteInput(
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

        Sentiment sentiment
) {
}
