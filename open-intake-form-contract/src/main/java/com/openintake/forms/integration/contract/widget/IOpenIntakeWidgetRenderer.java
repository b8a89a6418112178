package com.openintake.forms.integration.contract.widget;

import com.openintake.forms.integration.contract.field.IOpenIntakeFieldDefinition;
import com.openintake.forms.integration.enumerations.OpenIntakeRenderCategory;

import java.util.Set;
import java.util.function.Consumer;

/**
 * Presentation component for the rich widgets the engine does not draw itself
 * (rich text editor, diagram editor, file picker).
 */
public interface IOpenIntakeWidgetRenderer {

    Set<OpenIntakeRenderCategory> getSupportedCategories();

    /**
     * Draws the widget for a field.
     *
     * @param field    the field being drawn
     * @param value    the normalized current value
     * @param onChange receives each new value the user produces
     * @return an opaque handle to the drawn widget
     */
    Object renderWidget(IOpenIntakeFieldDefinition field, Object value, Consumer<Object> onChange);
}
