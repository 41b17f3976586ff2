package ru.tigran.researchsignalengine.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import ru.tigran.researchsignalengine.validation.Labeled;

import java.util.List;

/**
 * Codebook group and the tag names that belong to it.
 * A quote counts in a group column if it carries any tag of the group.
 */
public record CodebookGroupInput(
        @NotBlank(message = "Group name cannot be blank")
        String name,

        @NotNull(message = "Tag names cannot be null")
        List<@NotBlank(message = "Tag names cannot be blank") String> tagNames
) implements Labeled {

    @Override
    public String label() {
        return name;
    }
}
