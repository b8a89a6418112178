package com.openintake.forms.core.engine.navigation;

import com.openintake.forms.core.engine.registry.FieldRegistry;
import com.openintake.forms.core.engine.render.IOpenIntakeFieldTypeResolver;
import com.openintake.forms.integration.models.field.FieldDefinition;
import lombok.Getter;
import lombok.ToString;

/**
 * A field value that has just changed.
 */
@Getter
@ToString(exclude = {"registry", "typeResolver"})
public class FieldChangeEvent {

    private final String fieldName;
    private final Object previousValue;
    private final Object newValue;
    private final FieldRegistry registry;
    private final IOpenIntakeFieldTypeResolver typeResolver;

    public FieldChangeEvent(String fieldName, Object previousValue, Object newValue,
                            FieldRegistry registry, IOpenIntakeFieldTypeResolver typeResolver) {
        this.fieldName = fieldName;
        this.previousValue = previousValue;
        this.newValue = newValue;
        this.registry = registry;
        this.typeResolver = typeResolver;
    }

    /**
     * The value a field holds once cleared: an empty list for list fields, false for
     * checkboxes, an empty string otherwise.
     */
    public Object emptyValueOf(String name) {
        FieldDefinition field = registry.get(name);
        return field == null ? "" : typeResolver.emptyValue(field);
    }
}
