package com.openintake.forms.core.engine.render;

import lombok.Data;

/**
 * A format rule broken by a field's value.
 */
@Data
public class FieldValidationError {

    public enum Code {
        MIN_LENGTH,
        MAX_LENGTH,
        PATTERN,
        MIN_VALUE,
        MAX_VALUE,
        NOT_A_NUMBER,
        EMAIL,
        URL
    }

    private final String fieldName;
    private final String label;
    private final Code code;
    private final String message;
}
