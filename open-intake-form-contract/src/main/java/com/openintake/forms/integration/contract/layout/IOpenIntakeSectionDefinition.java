package com.openintake.forms.integration.contract.layout;

import java.util.List;

/**
 * One step of a multi-step form.
 */
public interface IOpenIntakeSectionDefinition {

    String getId();

    String getTitle();

    String getDescription();

    /**
     * Display position. Unique within a layout.
     */
    Integer getOrder();

    /**
     * Ordered field references. A field name appears in at most one section of a layout.
     */
    List<String> getFieldNames();

    /**
     * Subset of {@link #getFieldNames()} forced required regardless of the field default.
     */
    List<String> getRequiredOverrides();
}
