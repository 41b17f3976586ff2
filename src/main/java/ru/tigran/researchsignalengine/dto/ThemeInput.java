package ru.tigran.researchsignalengine.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import ru.tigran.researchsignalengine.validation.Labeled;

import java.util.List;

/**
 * Emergent theme with its quotes. Themes become matrix rows in the given order.
 */
public record ThemeInput(
        @NotBlank(message = "Theme label cannot be blank")
        String label,

        @NotNull(message = "Theme quotes cannot be null")
        List<@Valid QuoteInput> quotes
) implements Labeled {
}
