package com.openintake.forms.core.models;

import lombok.Data;

import java.io.Serializable;

/**
 * One structural problem found in a layout. {@code sectionId} is null for layout-level problems.
 */
@Data
public class LayoutViolation implements Serializable {
    private final String sectionId;
    private final String propertyPath;
    private final String message;

    public static LayoutViolation ofLayout(String propertyPath, String message) {
        return new LayoutViolation(null, propertyPath, message);
    }

    public static LayoutViolation ofSection(String sectionId, String propertyPath, String message) {
        return new LayoutViolation(sectionId, propertyPath, message);
    }
}
