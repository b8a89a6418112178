package com.openintake.forms.integration.contract.field;

import com.openintake.forms.integration.enumerations.OpenIntakeFieldProvenance;

import java.util.Map;

/**
 * A field as delivered by one source catalog, before merging.
 * <p>
 * {@link #getFieldConfig()} is an untyped nested structure whose shape differs per source.
 * It is interpreted once, at the registry boundary.
 */
public interface IOpenIntakeRawFieldDescriptor {

    String getFieldName();

    String getLabel();

    /**
     * Type name as stored by the source. May be an alias or an unknown value.
     */
    String getFieldType();

    String getDescription();

    String getCategory();

    boolean isRequired();

    /**
     * Source specific configuration. May be null or empty.
     */
    Map<String, Object> getFieldConfig();

    OpenIntakeFieldProvenance getProvenance();
}
