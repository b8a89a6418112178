package com.openintake.forms.integration.enumerations;

/**
 * How a field is drawn. Closed set; every field type maps to exactly one category.
 */
public enum OpenIntakeRenderCategory {
    PLAIN_TEXT,
    SINGLE_SELECT,
    MULTI_SELECT,
    DEPENDENT_SELECT,
    NUMERIC,
    DATE,
    BOOLEAN,
    STRUCTURED,
    RICH_TEXT,
    DIAGRAM,
    FILE;

    /**
     * Categories drawn by an external widget rather than a plain input.
     */
    public boolean isDelegatedWidget() {
        return this == RICH_TEXT || this == DIAGRAM || this == FILE;
    }
}
