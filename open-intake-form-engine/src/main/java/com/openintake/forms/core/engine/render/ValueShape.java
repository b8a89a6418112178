package com.openintake.forms.core.engine.render;

/**
 * Shape a normalized value takes.
 */
public enum ValueShape {
    SCALAR,
    LIST,
    BOOLEAN
}
