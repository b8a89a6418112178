package com.openintake.forms.core.engine.render;

import com.openintake.forms.integration.contract.field.IOpenIntakeFieldDefinition;

import java.util.Map;

/**
 * Decides how a field is drawn and validated. The only place that branches on field type.
 */
public interface IOpenIntakeFieldTypeResolver {

    /**
     * Resolves the render category and normalized value of a field.
     *
     * @param field         the merged field definition
     * @param rawValue      the stored value, any shape
     * @param currentValues all current form values, used to resolve dependencies
     */
    RenderDecision resolve(IOpenIntakeFieldDefinition field, Object rawValue, Map<String, Object> currentValues);

    /**
     * Normalizes a raw value to the field's value shape.
     */
    Object normalize(IOpenIntakeFieldDefinition field, Object rawValue);

    /**
     * The empty value of the field's shape.
     */
    Object emptyValue(IOpenIntakeFieldDefinition field);

    /**
     * Whether a normalized value satisfies the field when it is required.
     */
    boolean isRequirementSatisfied(IOpenIntakeFieldDefinition field, Object normalizedValue);
}
