package com.openintake.forms.integration.models.layout;

import com.openintake.forms.integration.contract.layout.IOpenIntakeSectionDefinition;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Data
@Builder(toBuilder = true)
@With
public class SectionDefinition implements IOpenIntakeSectionDefinition, Serializable {

    private static final long serialVersionUID = 1L;

    @NotBlank
    private final String id;

    @NotBlank
    private final String title;

    private final String description;

    @NotNull
    private final Integer order;

    @Builder.Default
    private final List<@NotBlank String> fieldNames = Collections.emptyList();

    @Builder.Default
    private final List<String> requiredOverrides = Collections.emptyList();

    public static SectionDefinition from(IOpenIntakeSectionDefinition section) {
        if (section instanceof SectionDefinition) {
            return (SectionDefinition) section;
        }
        return SectionDefinition.builder()
                .id(section.getId())
                .title(section.getTitle())
                .description(section.getDescription())
                .order(section.getOrder())
                .fieldNames(section.getFieldNames() == null
                        ? Collections.emptyList() : new ArrayList<>(section.getFieldNames()))
                .requiredOverrides(section.getRequiredOverrides() == null
                        ? Collections.emptyList() : new ArrayList<>(section.getRequiredOverrides()))
                .build();
    }
}
