package com.openintake.forms.core.engine.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.openintake.forms.core.engine.misc.OpenIntakeObjectMapper;
import com.openintake.forms.core.util.CastUtil;
import com.openintake.forms.core.util.CommonUtil;
import com.openintake.forms.integration.contract.field.IOpenIntakeFieldDefinition;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Coerces a raw stored value into the shape its field type expects.
 * <ul>
 *   <li>list fields: a list is kept, a JSON array string is parsed, a comma joined string is
 *       split and any other scalar becomes a single element list</li>
 *   <li>scalar fields: a list collapses to its first element, or to an empty string</li>
 *   <li>boolean fields: coerced to {@code true} or {@code false}</li>
 * </ul>
 */
@Slf4j
public class FieldValueNormalizer {

    private final OpenIntakeObjectMapper objectMapper;

    public FieldValueNormalizer(OpenIntakeObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Object normalize(IOpenIntakeFieldDefinition field, Object rawValue) {
        switch (FieldTypeDispatchTable.shapeOf(field)) {
            case LIST:
                return toList(rawValue);
            case BOOLEAN:
                return CastUtil.castAsBoolean(firstOf(rawValue));
            case SCALAR:
            default:
                return toScalar(rawValue);
        }
    }

    /**
     * The empty value of the field's shape.
     */
    public Object emptyValue(IOpenIntakeFieldDefinition field) {
        switch (FieldTypeDispatchTable.shapeOf(field)) {
            case LIST:
                return Collections.emptyList();
            case BOOLEAN:
                return Boolean.FALSE;
            case SCALAR:
            default:
                return "";
        }
    }

    public List<Object> toList(Object rawValue) {
        if (rawValue == null) {
            return Collections.emptyList();
        }
        if (rawValue instanceof Collection<?> collection) {
            return collection.stream().filter(Objects::nonNull).collect(Collectors.toList());
        }
        if (rawValue instanceof Object[] array) {
            List<Object> values = new ArrayList<>();
            for (Object item : array) {
                if (item != null) {
                    values.add(item);
                }
            }
            return values;
        }
        if (rawValue instanceof String text) {
            String trimmed = text.trim();
            if (trimmed.isEmpty()) {
                return Collections.emptyList();
            }
            if (trimmed.startsWith("[") && trimmed.endsWith("]")) {
                try {
                    return objectMapper.readList(trimmed).stream()
                            .filter(Objects::nonNull)
                            .collect(Collectors.toList());
                } catch (JsonProcessingException e) {
                    log.debug("Value '{}' looks like a JSON array but does not parse, splitting on commas", trimmed);
                }
            }
            if (trimmed.indexOf(CommonUtil.COMMA_SEPARATOR_CHAR) >= 0) {
                return new ArrayList<>(CommonUtil.csvToList(trimmed));
            }
            return List.of(trimmed);
        }
        return List.of(rawValue);
    }

    public Object toScalar(Object rawValue) {
        if (rawValue == null) {
            return "";
        }
        if (rawValue instanceof Collection<?> || rawValue instanceof Object[]) {
            Object first = firstOf(rawValue);
            return first == null ? "" : first;
        }
        return rawValue;
    }

    private static Object firstOf(Object rawValue) {
        if (rawValue instanceof Collection<?> collection) {
            return collection.isEmpty() ? null : collection.iterator().next();
        }
        if (rawValue instanceof Object[] array) {
            return array.length == 0 ? null : array[0];
        }
        return rawValue;
    }
}
