package com.openintake.forms.core.engine.navigation;

import com.openintake.forms.core.engine.render.FieldValidationError;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of validating the fields of one step.
 */
@Data
@Builder
public class StepValidationReport {

    private final int step;

    /**
     * Labels of the unmet required fields, in step order.
     */
    @Builder.Default
    private final List<String> missingFields = List.of();

    @Builder.Default
    private final List<String> missingFieldNames = List.of();

    @Builder.Default
    private final List<FieldValidationError> validationErrors = List.of();

    public static StepValidationReport valid(int step) {
        return StepValidationReport.builder().step(step).build();
    }

    public boolean isValid() {
        return missingFields.isEmpty() && validationErrors.isEmpty();
    }

    public List<String> getErrorMessages() {
        return validationErrors.stream().map(FieldValidationError::getMessage).collect(Collectors.toList());
    }
}
