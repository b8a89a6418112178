package com.openintake.forms.integration.enumerations;

public enum OpenIntakeErrorCategory {
    CONFIGURATION_ERROR,
    ACCESS_DENIED,
    VALIDATION_FAILURE,
    SOURCE_UNAVAILABLE,
    NOT_CONFIGURED,
    INTERNAL_ERROR
}
