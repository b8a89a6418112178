package com.openintake.forms.core.engine.dependent;

import com.openintake.forms.integration.enumerations.OpenIntakeDependentMode;
import com.openintake.forms.integration.models.field.FieldOption;
import lombok.Data;

import java.util.List;

/**
 * Resolved option set and input mode of a dependent field.
 */
@Data
public class DependentResolution {

    private final OpenIntakeDependentMode mode;
    private final List<FieldOption> options;

    /**
     * Text shown in place of the input when the field is blocked. Null otherwise.
     */
    private final String placeholder;

    public static DependentResolution blocked(String placeholder) {
        return new DependentResolution(OpenIntakeDependentMode.BLOCKED, List.of(), placeholder);
    }

    public static DependentResolution options(List<FieldOption> options) {
        return new DependentResolution(OpenIntakeDependentMode.OPTIONS, List.copyOf(options), null);
    }

    public static DependentResolution freeText() {
        return new DependentResolution(OpenIntakeDependentMode.FREE_TEXT, List.of(), null);
    }

    public boolean isEditable() {
        return mode != OpenIntakeDependentMode.BLOCKED;
    }
}
