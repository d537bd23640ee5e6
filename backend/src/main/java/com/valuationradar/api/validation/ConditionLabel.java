package com.valuationradar.api.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.*;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Absent, or one of the standard condition labels (Poor, Good, Excellent, Near Mint, Mint) or enum names.
 * Error code for API: INVALID_CONDITION.
 */
@Target({FIELD, PARAMETER, RECORD_COMPONENT})
@Retention(RUNTIME)
@Documented
@Constraint(validatedBy = ConditionLabelValidator.class)
public @interface ConditionLabel {

    String message() default "INVALID_CONDITION";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
