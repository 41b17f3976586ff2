package ru.tigran.researchsignalengine.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import ru.tigran.researchsignalengine.validation.Labeled;

import java.util.List;

/**
 * Product screen/section with the quotes clustered under it.
 * Sections become matrix rows ordered by displayOrder.
 */
public record SectionInput(
        @NotBlank(message = "Section label cannot be blank")
        String label,

        int displayOrder,

        @NotNull(message = "Section quotes cannot be null")
        List<@Valid QuoteInput> quotes
) implements Labeled {
}
