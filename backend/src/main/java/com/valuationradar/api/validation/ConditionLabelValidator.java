package com.valuationradar.api.validation;

import com.valuationradar.domain.StandardCondition;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class ConditionLabelValidator implements ConstraintValidator<ConditionLabel, String> {

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value == null || StandardCondition.fromLabel(value).isPresent();
    }
}
