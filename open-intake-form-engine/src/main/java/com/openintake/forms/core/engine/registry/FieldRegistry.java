package com.openintake.forms.core.engine.registry;

import com.openintake.forms.integration.models.field.FieldDefinition;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deduplicated map from field name to its merged definition, in registration order.
 */
public final class FieldRegistry {

    private static final FieldRegistry EMPTY = new FieldRegistry(new LinkedHashMap<>());

    private final Map<String, FieldDefinition> fields;

    private FieldRegistry(Map<String, FieldDefinition> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static FieldRegistry of(Map<String, FieldDefinition> fields) {
        return new FieldRegistry(new LinkedHashMap<>(fields));
    }

    public static FieldRegistry of(List<FieldDefinition> fields) {
        Map<String, FieldDefinition> byName = new LinkedHashMap<>();
        fields.forEach(field -> byName.putIfAbsent(field.getName(), field));
        return new FieldRegistry(byName);
    }

    public static FieldRegistry empty() {
        return EMPTY;
    }

    public FieldDefinition get(String name) {
        return fields.get(name);
    }

    public boolean contains(String name) {
        return fields.containsKey(name);
    }

    public Set<String> names() {
        return fields.keySet();
    }

    public Collection<FieldDefinition> fields() {
        return fields.values();
    }

    public Map<String, FieldDefinition> asMap() {
        return fields;
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    @Override
    public String toString() {
        return "FieldRegistry" + fields.keySet();
    }
}
