package ru.tigran.researchsignalengine.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import ru.tigran.researchsignalengine.validation.UniqueLabels;

import java.util.List;

/**
 * Request DTO for codebook tag analysis (sections/themes x codebook groups).
 *
 * Structure:
 * - quotes: quotes with their section/theme placement
 * - sectionLabels: section rows in display order
 * - themeLabels: theme rows in display order
 * - groups: codebook groups in display order (matrix columns)
 * - acceptedTags / proposedTags: tag associations (optional)
 * - groupFilter: group names to include; when absent, all groups except "Uncategorised"
 * - topN: optional, 1-100
 */
public record TagAnalysisRequest(
        @NotNull(message = "Quotes cannot be null")
        List<@Valid TaggedQuoteInput> quotes,

        @NotNull(message = "Section labels cannot be null")
        @UniqueLabels(message = "Section labels must be unique")
        List<@NotBlank(message = "Section labels cannot be blank") String> sectionLabels,

        @NotNull(message = "Theme labels cannot be null")
        @UniqueLabels(message = "Theme labels must be unique")
        List<@NotBlank(message = "Theme labels cannot be blank") String> themeLabels,

        @NotNull(message = "Groups cannot be null")
        @UniqueLabels(message = "Group names must be unique")
        List<@Valid CodebookGroupInput> groups,

        List<@Valid TagAssignmentInput> acceptedTags,

        List<@Valid TagProposalInput> proposedTags,

        List<@NotBlank(message = "Group filter entries cannot be blank") String> groupFilter,

        @Min(value = 1, message = "topN must be at least 1")
        @Max(value = 100, message = "topN must not exceed 100")
        Integer topN
) {
    public TagAnalysisRequest {
        acceptedTags = acceptedTags == null ? List.of() : acceptedTags;
        proposedTags = proposedTags == null ? List.of() : proposedTags;
    }

    /**
     * Same request restricted to another group filter.
     * Used to split one study into per-framework analyses.
     */
    public TagAnalysisRequest withGroupFilter(List<String> filter) {
        return new TagAnalysisRequest(quotes, sectionLabels, themeLabels, groups,
                acceptedTags, proposedTags, filter, topN);
    }
}
