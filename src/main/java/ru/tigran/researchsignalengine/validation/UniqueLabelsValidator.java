package ru.tigran.researchsignalengine.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Валидатор для {@link UniqueLabels}.
 * null-коллекции считаются валидными: обязательность проверяет @NotNull.
 */
public class UniqueLabelsValidator implements ConstraintValidator<UniqueLabels, Collection<?>> {

    @Override
    public boolean isValid(Collection<?> values, ConstraintValidatorContext context) {
        if (values == null) {
            return true;
        }

        Set<String> seen = new HashSet<>();
        for (Object value : values) {
            String label = value instanceof Labeled labeled ? labeled.label() : String.valueOf(value);
            if (label != null && !seen.add(label)) {
                return false;
            }
        }
        return true;
    }
}
