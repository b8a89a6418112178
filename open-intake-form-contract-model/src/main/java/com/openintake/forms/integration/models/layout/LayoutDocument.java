package com.openintake.forms.integration.models.layout;

import com.openintake.forms.integration.contract.layout.IOpenIntakeLayoutDocument;
import com.openintake.forms.integration.contract.layout.IOpenIntakeSectionDefinition;
import com.openintake.forms.integration.enumerations.OpenIntakeLayoutType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.io.Serializable;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Standard implementation of a layout document.
 *
 * <pre>{@code
 * LayoutDocument layout = LayoutDocument.builder()
 *     .id("layout-1")
 *     .screenId("agent_submission")
 *     .tenantId("tenant-a")
 *     .layoutType(OpenIntakeLayoutType.SUBMISSION)
 *     .sections(List.of(basics, compliance))
 *     .isActive(true)
 *     .isDefault(true)
 *     .build();
 * }</pre>
 */
@Data
@Builder(toBuilder = true)
@With
public class LayoutDocument implements IOpenIntakeLayoutDocument, Serializable {

    private static final long serialVersionUID = 1L;

    @NotBlank
    private final String id;

    private final String name;

    @NotBlank
    private final String screenId;

    private final String tenantId;

    @NotNull
    @Builder.Default
    private final OpenIntakeLayoutType layoutType = OpenIntakeLayoutType.SUBMISSION;

    @Valid
    @Builder.Default
    private final List<SectionDefinition> sections = Collections.emptyList();

    private final boolean isActive;

    private final boolean isDefault;

    private final boolean isTemplate;

    /**
     * Copy with sections sorted by order. Sections without an order keep their position at the end.
     */
    public LayoutDocument withSortedSections() {
        List<SectionDefinition> sorted = sections.stream()
                .sorted(Comparator.comparing(SectionDefinition::getOrder,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .collect(Collectors.toList());
        return withSections(sorted);
    }

    public static LayoutDocument from(IOpenIntakeLayoutDocument layout) {
        if (layout instanceof LayoutDocument) {
            return (LayoutDocument) layout;
        }
        List<? extends IOpenIntakeSectionDefinition> source =
                layout.getSections() == null ? Collections.emptyList() : layout.getSections();
        return LayoutDocument.builder()
                .id(layout.getId())
                .name(layout.getName())
                .screenId(layout.getScreenId())
                .tenantId(layout.getTenantId())
                .layoutType(Objects.requireNonNullElse(layout.getLayoutType(), OpenIntakeLayoutType.SUBMISSION))
                .sections(source.stream().map(SectionDefinition::from).collect(Collectors.toList()))
                .isActive(layout.isActive())
                .isDefault(layout.isDefault())
                .isTemplate(layout.isTemplate())
                .build();
    }
}
