package com.openintake.forms.core.engine.render;

import com.openintake.forms.integration.contract.field.IOpenIntakeFieldDefinition;
import com.openintake.forms.integration.enumerations.OpenIntakeFieldType;
import com.openintake.forms.integration.enumerations.OpenIntakeRenderCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Single lookup table deciding how each field type is drawn and what value shape it stores.
 * Every {@link OpenIntakeFieldType} has exactly one row.
 */
public final class FieldTypeDispatchTable {

    private static final Map<OpenIntakeFieldType, FieldTypeRule> RULES;

    static {
        Map<OpenIntakeFieldType, FieldTypeRule> rules = new EnumMap<>(OpenIntakeFieldType.class);
        rules.put(OpenIntakeFieldType.TEXT, FieldTypeRule.fixed(OpenIntakeRenderCategory.PLAIN_TEXT, ValueShape.SCALAR));
        rules.put(OpenIntakeFieldType.TEXTAREA, FieldTypeRule.fixed(OpenIntakeRenderCategory.PLAIN_TEXT, ValueShape.SCALAR));
        rules.put(OpenIntakeFieldType.EMAIL, FieldTypeRule.fixed(OpenIntakeRenderCategory.PLAIN_TEXT, ValueShape.SCALAR));
        rules.put(OpenIntakeFieldType.URL, FieldTypeRule.fixed(OpenIntakeRenderCategory.PLAIN_TEXT, ValueShape.SCALAR));
        rules.put(OpenIntakeFieldType.NUMBER, FieldTypeRule.fixed(OpenIntakeRenderCategory.NUMERIC, ValueShape.SCALAR));
        rules.put(OpenIntakeFieldType.DATE, FieldTypeRule.fixed(OpenIntakeRenderCategory.DATE, ValueShape.SCALAR));
        rules.put(OpenIntakeFieldType.SELECT, FieldTypeRule.fixed(OpenIntakeRenderCategory.SINGLE_SELECT, ValueShape.SCALAR));
        rules.put(OpenIntakeFieldType.MULTI_SELECT, FieldTypeRule.fixed(OpenIntakeRenderCategory.MULTI_SELECT, ValueShape.LIST));
        rules.put(OpenIntakeFieldType.DEPENDENT_SELECT, FieldTypeRule.fixed(OpenIntakeRenderCategory.DEPENDENT_SELECT, ValueShape.SCALAR));
        rules.put(OpenIntakeFieldType.CHECKBOX, FieldTypeRule.fixed(OpenIntakeRenderCategory.BOOLEAN, ValueShape.BOOLEAN));
        rules.put(OpenIntakeFieldType.FILE, FieldTypeRule.fixed(OpenIntakeRenderCategory.FILE, ValueShape.SCALAR));
        rules.put(OpenIntakeFieldType.RICH_TEXT, FieldTypeRule.fixed(OpenIntakeRenderCategory.RICH_TEXT, ValueShape.SCALAR));
        rules.put(OpenIntakeFieldType.DIAGRAM, FieldTypeRule.fixed(OpenIntakeRenderCategory.DIAGRAM, ValueShape.SCALAR));
        // json with options is a checklist of the options
        rules.put(OpenIntakeFieldType.JSON, FieldTypeRule.conditional(
                OpenIntakeRenderCategory.STRUCTURED, ValueShape.SCALAR,
                FieldTypeDispatchTable::hasOptions,
                OpenIntakeRenderCategory.MULTI_SELECT, ValueShape.LIST));
        RULES = Collections.unmodifiableMap(rules);
    }

    private FieldTypeDispatchTable() {
    }

    public static FieldTypeRule ruleFor(OpenIntakeFieldType type) {
        return RULES.get(type == null ? OpenIntakeFieldType.TEXT : type);
    }

    public static OpenIntakeRenderCategory categoryOf(IOpenIntakeFieldDefinition field) {
        return ruleFor(field.getType()).categoryFor(field);
    }

    public static ValueShape shapeOf(IOpenIntakeFieldDefinition field) {
        return ruleFor(field.getType()).shapeFor(field);
    }

    private static boolean hasOptions(IOpenIntakeFieldDefinition field) {
        return field.getOptions() != null && !field.getOptions().isEmpty();
    }
}
