package com.openintake.forms.integration.models.field;

import com.openintake.forms.integration.contract.field.IOpenIntakeFieldDefinition;
import com.openintake.forms.integration.enumerations.OpenIntakeFieldProvenance;
import com.openintake.forms.integration.enumerations.OpenIntakeFieldType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;

/**
 * Standard implementation of a merged field definition.
 * <p>
 * Immutable; use {@code toBuilder()} or the {@code with*} methods to derive variants.
 *
 * <pre>{@code
 * FieldDefinition vendor = FieldDefinition.builder()
 *     .name("llm_vendor")
 *     .label("LLM Vendor")
 *     .type(OpenIntakeFieldType.SELECT)
 *     .options(List.of(FieldOption.of("OpenAI"), FieldOption.of("Anthropic")))
 *     .provenance(OpenIntakeFieldProvenance.ENTITY_SCHEMA)
 *     .build();
 * }</pre>
 */
@Data
@Builder(toBuilder = true)
@With
public class FieldDefinition implements IOpenIntakeFieldDefinition, Serializable {

    private static final long serialVersionUID = 1L;

    @NotBlank
    @Pattern(regexp = "[a-z0-9_]+")
    private final String name;

    private final String label;

    private final String description;

    private final String category;

    @NotNull
    @Builder.Default
    private final OpenIntakeFieldType type = OpenIntakeFieldType.TEXT;

    private final boolean required;

    @Valid
    private final FieldValidationRules validation;

    @Valid
    @Builder.Default
    private final List<FieldOption> options = Collections.emptyList();

    @Valid
    private final FieldDependency dependency;

    private final String masterDataListId;

    private final OpenIntakeFieldProvenance provenance;

    /**
     * Label to show, falling back to the field name.
     */
    public String getDisplayLabel() {
        return label == null || label.isBlank() ? name : label;
    }
}
