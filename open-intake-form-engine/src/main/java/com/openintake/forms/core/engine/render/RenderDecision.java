package com.openintake.forms.core.engine.render;

import com.openintake.forms.integration.enumerations.OpenIntakeDependentMode;
import com.openintake.forms.integration.enumerations.OpenIntakeFieldType;
import com.openintake.forms.integration.enumerations.OpenIntakeRenderCategory;
import com.openintake.forms.integration.models.field.FieldOption;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * How to draw one field right now, given the current form values.
 */
@Data
@Builder(toBuilder = true)
public class RenderDecision {

    private final String fieldName;

    private final String label;

    private final OpenIntakeFieldType type;

    private final OpenIntakeRenderCategory category;

    /**
     * Current value in the shape the category expects.
     */
    private final Object normalizedValue;

    /**
     * Options to offer. For dependent fields these are the options of the current parent value.
     */
    @Builder.Default
    private final List<FieldOption> options = List.of();

    /**
     * Null for independent fields.
     */
    private final OpenIntakeDependentMode dependentMode;

    private final String placeholder;

    /**
     * False when the field is blocked by an unset parent or has no selectable options.
     */
    @Builder.Default
    private final boolean editable = true;

    public boolean isBlocked() {
        return dependentMode == OpenIntakeDependentMode.BLOCKED;
    }

    public boolean isDelegatedWidget() {
        return category != null && category.isDelegatedWidget();
    }
}
