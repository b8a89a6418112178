package com.openintake.forms.core.util;

import java.util.Collection;

public class CastUtil {

    private CastUtil() {}

    public static Boolean castAsBoolean(Object e) {
        if (e instanceof Boolean bool) {
            return bool;
        }
        if (e instanceof Number number) {
            return number.intValue() == 1;
        }
        if (e instanceof String s) {
            String trimmed = s.trim();
            return "true".equalsIgnoreCase(trimmed) || "yes".equalsIgnoreCase(trimmed)
                    || "on".equalsIgnoreCase(trimmed) || "1".equals(trimmed);
        }
        return false;
    }

    /**
     * Parses a numeric value, returning null when the value is not a number.
     */
    public static Double castAsDoubleOrNull(Object e) {
        if (e instanceof Number number) {
            return number.doubleValue();
        }
        if (e instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    public static Integer castAsIntegerOrNull(Object e) {
        Double value = castAsDoubleOrNull(e);
        return value == null ? null : value.intValue();
    }

    public static String castAsString(Object e) {
        if (e == null) {
            return "";
        }
        if (e instanceof String string) {
            return string;
        }
        if (e instanceof Collection<?> collection) {
            return collection.isEmpty() ? "" : castAsString(collection.iterator().next());
        }
        return e.toString();
    }
}
