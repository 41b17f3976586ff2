package ru.tigran.researchsignalengine.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Проверяет, что метки в списке (строки или {@link Labeled} элементы) не повторяются.
 * Метки строк и столбцов матрицы должны быть уникальны, иначе ячейки сливаются.
 */
@Target({ElementType.FIELD, ElementType.PARAMETER, ElementType.RECORD_COMPONENT})
@Retention(RetentionPolicy.RUNTIME)
@Constraint(validatedBy = UniqueLabelsValidator.class)
public @interface UniqueLabels {
    String message() default "Labels must be unique";
    Class<?>[] groups() default {};
    Class<? extends Payload>[] payload() default {};
}
