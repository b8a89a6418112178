package com.openintake.forms.core.engine.render;

import com.openintake.forms.integration.contract.field.IOpenIntakeFieldDefinition;

import java.util.Collection;
import java.util.Map;

/**
 * Decides whether a value satisfies a required field.
 * Boolean fields need an explicit {@code true}; every other field needs a value that is
 * not null, not a blank string and not an empty collection.
 */
public final class RequiredValueChecker {

    private RequiredValueChecker() {
    }

    public static boolean isSatisfied(IOpenIntakeFieldDefinition field, Object value) {
        if (FieldTypeDispatchTable.shapeOf(field) == ValueShape.BOOLEAN) {
            return Boolean.TRUE.equals(value);
        }
        return isPresent(value);
    }

    public static boolean isPresent(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof String text) {
            return !text.trim().isEmpty();
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        return true;
    }
}
