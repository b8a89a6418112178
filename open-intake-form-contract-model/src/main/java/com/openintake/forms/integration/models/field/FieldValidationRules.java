package com.openintake.forms.integration.models.field;

import com.openintake.forms.integration.contract.field.IOpenIntakeFieldDefinition.IOpenIntakeFieldValidationRules;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Data;

import java.io.Serializable;

@Data
@Builder(toBuilder = true)
public class FieldValidationRules implements IOpenIntakeFieldValidationRules, Serializable {
    private static final long serialVersionUID = 1L;

    @PositiveOrZero
    private final Integer minLength;
    @PositiveOrZero
    private final Integer maxLength;
    private final String pattern;
    private final Double minValue;
    private final Double maxValue;
}
