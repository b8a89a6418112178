package com.openintake.forms.core.util;

import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

public final class CommonUtil {
    public static final char COMMA_SEPARATOR_CHAR = ',';
    public static final String COMMA_SEPARATOR = String.valueOf(COMMA_SEPARATOR_CHAR);

    private CommonUtil() {
    }

    public static boolean isNullOrBlank(final String str) {
        return StringUtils.isBlank(str);
    }

    public static boolean isNotBlank(final String str) {
        return StringUtils.isNotBlank(str);
    }

    public static <T> boolean isNotEmpty(final Collection<T> collection) {
        return collection != null && !collection.isEmpty();
    }

    /**
     * Splits a comma separated string into trimmed, non-blank entries in their original order.
     */
    public static List<String> csvToList(final String commaSeparatedValues) {
        return Optional
            .ofNullable(commaSeparatedValues)
            .filter(CommonUtil::isNotBlank)
            .map(str -> Arrays.stream(str.split(COMMA_SEPARATOR))
                    .map(String::trim)
                    .filter(CommonUtil::isNotBlank)
                    .collect(Collectors.toList()))
            .orElse(Collections.emptyList());
    }

    public static <T> List<T> nonNullList(List<T> list) {
        return Optional.ofNullable(list).orElse(Collections.emptyList());
    }

    public static <K, V> Map<K, V> nonNullMap(Map<K, V> map) {
        return Optional.ofNullable(map).orElse(Collections.emptyMap());
    }

    /**
     * Whether any of the given texts contains the keyword, ignoring case.
     */
    public static boolean anyContainsIgnoreCase(String keyword, String... texts) {
        if (isNullOrBlank(keyword)) {
            return false;
        }
        for (String text : texts) {
            if (StringUtils.containsIgnoreCase(text, keyword)) {
                return true;
            }
        }
        return false;
    }
}
