package com.openintake.forms.integration.contract.field;

import com.openintake.forms.integration.enumerations.OpenIntakeFieldProvenance;
import com.openintake.forms.integration.enumerations.OpenIntakeFieldType;

import java.util.List;
import java.util.Set;

/**
 * The merged, canonical description of one form field.
 * <p>
 * Instances are produced by the field registry from raw descriptors and are the only
 * representation downstream components inspect. Configuration that arrived in any of
 * the supported shapes has already been normalized into {@link #getOptions()},
 * {@link #getDependency()} and {@link #getValidation()}.
 */
public interface IOpenIntakeFieldDefinition {

    /**
     * Unique, stable identifier, format {@code [a-z0-9_]+}.
     */
    String getName();

    /**
     * Display label.
     */
    String getLabel();

    /**
     * Help text.
     */
    String getDescription();

    /**
     * Grouping hint supplied by the source catalog, used by step auto-assignment.
     */
    String getCategory();

    OpenIntakeFieldType getType();

    /**
     * Default required flag. A section may force a field required regardless of this value.
     */
    boolean isRequired();

    IOpenIntakeFieldValidationRules getValidation();

    /**
     * Ordered options for select-like types. Never null.
     */
    List<? extends IOpenIntakeFieldOption> getOptions();

    /**
     * Parent/child dependency, or null for independent fields.
     */
    IOpenIntakeFieldDependency getDependency();

    /**
     * Master-data list backing this field's options, or null.
     */
    String getMasterDataListId();

    /**
     * The catalog that supplied the surviving definition.
     */
    OpenIntakeFieldProvenance getProvenance();

    /**
     * Whether the definition carries any type-specific configuration.
     * A configured definition is never replaced by an unconfigured one.
     */
    default boolean isConfigured() {
        return (getOptions() != null && !getOptions().isEmpty())
                || getDependency() != null
                || getMasterDataListId() != null
                || (getValidation() != null && !getValidation().isEmpty());
    }

    /**
     * Interface for a single selectable option.
     */
    interface IOpenIntakeFieldOption {

        /**
         * Stored value.
         */
        String getValue();

        /**
         * Display label. Defaults to the value when the source did not supply one.
         */
        String getLabel();
    }

    /**
     * Interface for the dependency of a child field on a parent field.
     */
    interface IOpenIntakeFieldDependency {

        /**
         * Name of the parent field.
         */
        String getDependsOn();

        /**
         * Label of the parent field, used for the blocked placeholder text.
         */
        String getDependsOnLabel();

        /**
         * Parent values that have an option list configured.
         */
        Set<String> getParentValues();

        /**
         * Options for the given parent value. Empty when none are configured. Never null.
         */
        List<? extends IOpenIntakeFieldOption> optionsFor(String parentValue);

        /**
         * Whether a free text value is accepted when no options exist for the parent value.
         */
        boolean isAllowCustomValue();

        /**
         * Whether the child value is cleared when the parent value changes.
         */
        boolean isClearOnParentChange();
    }

    /**
     * Interface for format validation rules. Any rule may be null.
     */
    interface IOpenIntakeFieldValidationRules {

        Integer getMinLength();

        Integer getMaxLength();

        String getPattern();

        Double getMinValue();

        Double getMaxValue();

        default boolean isEmpty() {
            return getMinLength() == null && getMaxLength() == null && getPattern() == null
                    && getMinValue() == null && getMaxValue() == null;
        }
    }
}
