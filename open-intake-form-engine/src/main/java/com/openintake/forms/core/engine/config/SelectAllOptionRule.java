package com.openintake.forms.core.engine.config;

import lombok.Data;

/**
 * A multi-select field whose sentinel option stands for "every option".
 */
@Data
public class SelectAllOptionRule {
    private final String fieldName;
    private final String sentinelValue;

    public static SelectAllOptionRule of(String fieldName, String sentinelValue) {
        return new SelectAllOptionRule(fieldName, sentinelValue);
    }
}
