package com.openintake.forms.integration.enumerations;

/**
 * Outcome of resolving a dependent field against its parent's current value.
 */
public enum OpenIntakeDependentMode {

    /**
     * The field cannot be edited yet, shown with a placeholder.
     */
    BLOCKED,

    /**
     * The field is drawn as a dropdown of the resolved options.
     */
    OPTIONS,

    /**
     * No options exist for the parent value but custom values are allowed.
     */
    FREE_TEXT
}
