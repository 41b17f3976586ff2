package ru.tigran.researchsignalengine.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import ru.tigran.researchsignalengine.validation.UniqueLabels;

import java.util.List;

/**
 * Request DTO for sentiment analysis (sections/themes x sentiment vocabulary).
 *
 * - totalParticipants: optional; when absent, distinct "p"-prefixed participant IDs across all quotes
 * - topN: optional, 1-100; default comes from analysis.default-top-n
 */
public record SentimentAnalysisRequest(
        @NotNull(message = "Sections cannot be null")
        @UniqueLabels(message = "Section labels must be unique")
        List<@Valid SectionInput> sections,

        @NotNull(message = "Themes cannot be null")
        @UniqueLabels(message = "Theme labels must be unique")
        List<@Valid ThemeInput> themes,

        @PositiveOrZero(message = "Total participants must not be negative")
        Integer totalParticipants,

        @Min(value = 1, message = "topN must be at least 1")
        @Max(value = 100, message = "topN must not exceed 100")
        Integer topN
) {
}
