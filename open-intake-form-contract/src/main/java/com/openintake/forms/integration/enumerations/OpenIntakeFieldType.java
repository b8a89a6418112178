package com.openintake.forms.integration.enumerations;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Canonical field types understood by the form engine.
 * Each constant carries the wire name used in persisted field descriptors.
 */
public enum OpenIntakeFieldType {

    TEXT("text"),
    TEXTAREA("textarea"),
    NUMBER("number"),
    EMAIL("email"),
    URL("url"),
    DATE("date"),
    SELECT("select"),
    MULTI_SELECT("multi_select"),
    DEPENDENT_SELECT("dependent_select"),
    CHECKBOX("checkbox"),
    FILE("file"),
    JSON("json"),
    RICH_TEXT("rich_text"),
    DIAGRAM("diagram");

    private static final Map<String, OpenIntakeFieldType> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(OpenIntakeFieldType::getWireName, Function.identity()));

    private final String wireName;

    OpenIntakeFieldType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Exact lookup by wire name. Aliases are not resolved here.
     */
    public static Optional<OpenIntakeFieldType> fromWireName(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_WIRE_NAME.get(wireName.trim().toLowerCase(Locale.ROOT)));
    }
}
