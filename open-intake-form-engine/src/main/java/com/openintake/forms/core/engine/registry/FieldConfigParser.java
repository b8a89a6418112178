package com.openintake.forms.core.engine.registry;

import com.openintake.forms.core.util.CastUtil;
import com.openintake.forms.core.util.CommonUtil;
import com.openintake.forms.integration.contract.field.IOpenIntakeRawFieldDescriptor;
import com.openintake.forms.integration.enumerations.OpenIntakeFieldType;
import com.openintake.forms.integration.models.field.FieldDefinition;
import com.openintake.forms.integration.models.field.FieldDependency;
import com.openintake.forms.integration.models.field.FieldOption;
import com.openintake.forms.integration.models.field.FieldValidationRules;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Interprets a raw descriptor's source specific {@code field_config} into a typed definition.
 *
 * <h2>Accepted shapes</h2>
 * <ul>
 *   <li>{@code options}: list of {@code {value, label}} maps or bare strings</li>
 *   <li>{@code depends_on} with {@code options_by_parent_value} or the legacy {@code dependent_options}</li>
 *   <li>{@code allow_custom_value} or the legacy {@code allow_custom}</li>
 *   <li>{@code clear_on_parent_change}, true unless explicitly false</li>
 *   <li>validation rules at the top level or nested under {@code validation}</li>
 *   <li>{@code master_data_list_id}</li>
 * </ul>
 * Malformed entries are skipped; the field itself is always kept.
 */
@Slf4j
public class FieldConfigParser {

    private static final Map<String, OpenIntakeFieldType> TYPE_ALIASES = Map.of(
            "file_upload", OpenIntakeFieldType.FILE,
            "mermaid_diagram", OpenIntakeFieldType.DIAGRAM,
            "architecture_diagram", OpenIntakeFieldType.DIAGRAM,
            "boolean", OpenIntakeFieldType.CHECKBOX,
            "multiselect", OpenIntakeFieldType.MULTI_SELECT,
            "dropdown", OpenIntakeFieldType.SELECT,
            "richtext", OpenIntakeFieldType.RICH_TEXT);

    private static final String[] VALIDATION_KEYS = {"min_length", "max_length", "pattern", "min_value", "max_value"};

    public FieldDefinition parse(IOpenIntakeRawFieldDescriptor descriptor) {
        Map<String, Object> config = CommonUtil.nonNullMap(descriptor.getFieldConfig());
        OpenIntakeFieldType type = resolveType(descriptor.getFieldName(), descriptor.getFieldType());

        return FieldDefinition.builder()
                .name(normalizeName(descriptor.getFieldName()))
                .label(descriptor.getLabel())
                .description(descriptor.getDescription())
                .category(descriptor.getCategory())
                .type(type)
                .required(descriptor.isRequired())
                .options(parseOptions(config.get("options")))
                .dependency(parseDependency(config))
                .validation(parseValidation(config))
                .masterDataListId(asNonBlankString(config.get("master_data_list_id")))
                .provenance(descriptor.getProvenance())
                .build();
    }

    /**
     * Canonical type for a stored type name. Aliases are mapped; unknown names become text.
     */
    public OpenIntakeFieldType resolveType(String fieldName, String fieldType) {
        if (CommonUtil.isNullOrBlank(fieldType)) {
            return OpenIntakeFieldType.TEXT;
        }
        String key = fieldType.trim().toLowerCase(Locale.ROOT);
        return OpenIntakeFieldType.fromWireName(key)
                .orElseGet(() -> {
                    OpenIntakeFieldType alias = TYPE_ALIASES.get(key);
                    if (alias == null) {
                        log.debug("Unknown field type '{}' on field {}, rendering as text", fieldType, fieldName);
                        return OpenIntakeFieldType.TEXT;
                    }
                    return alias;
                });
    }

    /**
     * Lower-cases the name and replaces characters outside {@code [a-z0-9_]} with underscores.
     */
    public static String normalizeName(String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
        if (!normalized.equals(name)) {
            log.debug("Field name '{}' normalized to '{}'", name, normalized);
        }
        return normalized;
    }

    public List<FieldOption> parseOptions(Object raw) {
        if (!(raw instanceof Collection<?> entries)) {
            return Collections.emptyList();
        }
        List<FieldOption> options = new ArrayList<>();
        for (Object entry : entries) {
            if (entry instanceof Map<?, ?> map) {
                Object value = map.get("value");
                if (value == null) {
                    log.debug("Skipping option without value: {}", map);
                    continue;
                }
                Object label = map.get("label");
                options.add(FieldOption.of(value.toString(), label == null ? null : label.toString()));
            } else if (entry != null) {
                options.add(FieldOption.of(entry.toString()));
            }
        }
        return Collections.unmodifiableList(options);
    }

    private FieldDependency parseDependency(Map<String, Object> config) {
        String dependsOn = asNonBlankString(config.get("depends_on"));
        if (dependsOn == null) {
            return null;
        }
        Object rawByParent = config.containsKey("options_by_parent_value")
                ? config.get("options_by_parent_value")
                : config.get("dependent_options");

        Map<String, List<FieldOption>> optionsByParent = new LinkedHashMap<>();
        if (rawByParent instanceof Map<?, ?> byParent) {
            byParent.forEach((parentValue, options) -> {
                if (parentValue != null) {
                    optionsByParent.put(parentValue.toString(), parseOptions(options));
                }
            });
        }

        Object allowCustom = config.containsKey("allow_custom_value")
                ? config.get("allow_custom_value")
                : config.get("allow_custom");
        Object clearOnChange = config.get("clear_on_parent_change");

        return FieldDependency.builder()
                .dependsOn(normalizeName(dependsOn))
                .dependsOnLabel(asNonBlankString(config.get("depends_on_label")))
                .optionsByParentValue(Collections.unmodifiableMap(optionsByParent))
                .allowCustomValue(CastUtil.castAsBoolean(allowCustom))
                .clearOnParentChange(clearOnChange == null || CastUtil.castAsBoolean(clearOnChange))
                .build();
    }

    @SuppressWarnings("unchecked")
    private FieldValidationRules parseValidation(Map<String, Object> config) {
        Map<String, Object> source = config.get("validation") instanceof Map
                ? (Map<String, Object>) config.get("validation")
                : config;
        boolean present = false;
        for (String key : VALIDATION_KEYS) {
            if (source.get(key) != null) {
                present = true;
                break;
            }
        }
        if (!present) {
            return null;
        }
        return FieldValidationRules.builder()
                .minLength(CastUtil.castAsIntegerOrNull(source.get("min_length")))
                .maxLength(CastUtil.castAsIntegerOrNull(source.get("max_length")))
                .pattern(asNonBlankString(source.get("pattern")))
                .minValue(CastUtil.castAsDoubleOrNull(source.get("min_value")))
                .maxValue(CastUtil.castAsDoubleOrNull(source.get("max_value")))
                .build();
    }

    private static String asNonBlankString(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }
}
