package com.openintake.forms.integration.enumerations;

import java.util.Arrays;
import java.util.Optional;

/**
 * Identifies the catalog a field definition was loaded from.
 * Used for merge precedence in the field registry and for locating
 * the compliance step of a layout.
 */
public enum OpenIntakeFieldProvenance {

    /**
     * Fields declared by the entity schema itself. Carry the canonical enumerations.
     */
    ENTITY_SCHEMA("entity_schema"),

    /**
     * Metadata columns of the entity (status, owner, timestamps).
     */
    ENTITY_METADATA("entity_metadata"),

    /**
     * Tenant-defined custom fields.
     */
    CUSTOM_FIELD("custom_field"),

    /**
     * Dropdowns backed by a master-data list.
     */
    MASTER_DATA("master_data"),

    /**
     * Compliance requirement questions.
     */
    REQUIREMENT("requirement"),

    /**
     * Attributes of the logged in user.
     */
    CURRENT_USER("current_user"),

    /**
     * Attributes of the workflow ticket the submission belongs to.
     */
    WORKFLOW_TICKET("workflow_ticket");

    private final String sourceName;

    OpenIntakeFieldProvenance(String sourceName) {
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }

    public static Optional<OpenIntakeFieldProvenance> fromSourceName(String sourceName) {
        return Arrays.stream(values())
                .filter(p -> p.sourceName.equalsIgnoreCase(sourceName))
                .findFirst();
    }
}
