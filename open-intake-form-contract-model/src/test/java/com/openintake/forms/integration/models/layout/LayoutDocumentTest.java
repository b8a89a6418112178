package com.openintake.forms.integration.models.layout;

import com.openintake.forms.integration.contract.layout.IOpenIntakeLayoutDocument;
import com.openintake.forms.integration.contract.layout.IOpenIntakeSectionDefinition;
import com.openintake.forms.integration.enumerations.OpenIntakeLayoutType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class LayoutDocumentTest {

    @Test
    @DisplayName("should sort sections by order and keep unordered sections last")
    void shouldSortSectionsByOrder() {
        // Given
        LayoutDocument layout = LayoutDocument.builder()
                .id("layout-1")
                .screenId("agent_submission")
                .sections(List.of(
                        section("review", 3),
                        section("unordered", null),
                        section("basics", 1),
                        section("ai", 2)))
                .build();

        // When
        LayoutDocument sorted = layout.withSortedSections();

        // Then
        assertEquals(List.of("basics", "ai", "review", "unordered"),
                sorted.getSections().stream().map(SectionDefinition::getId).collect(Collectors.toList()));
        assertEquals("review", layout.getSections().get(0).getId());
    }

    @Test
    @DisplayName("should default to an inactive submission layout without sections")
    void shouldApplyDefaults() {
        LayoutDocument layout = LayoutDocument.builder().id("layout-1").screenId("screen").build();

        assertEquals(OpenIntakeLayoutType.SUBMISSION, layout.getLayoutType());
        assertTrue(layout.getSections().isEmpty());
        assertFalse(layout.isActive());
        assertFalse(layout.isDefault());
        assertFalse(layout.isTemplate());
    }

    @Test
    @DisplayName("should copy foreign layout implementations")
    void shouldCopyForeignImplementation() {
        // Given
        IOpenIntakeSectionDefinition foreignSection = new IOpenIntakeSectionDefinition() {
            public String getId() { return "s1"; }
            public String getTitle() { return "Basics"; }
            public String getDescription() { return null; }
            public Integer getOrder() { return 1; }
            public List<String> getFieldNames() { return List.of("name"); }
            public List<String> getRequiredOverrides() { return null; }
        };
        IOpenIntakeLayoutDocument foreign = new IOpenIntakeLayoutDocument() {
            public String getId() { return "layout-9"; }
            public String getName() { return "Imported"; }
            public String getScreenId() { return "screen"; }
            public String getTenantId() { return "tenant-a"; }
            public OpenIntakeLayoutType getLayoutType() { return null; }
            public List<? extends IOpenIntakeSectionDefinition> getSections() { return List.of(foreignSection); }
            public boolean isActive() { return true; }
            public boolean isDefault() { return true; }
            public boolean isTemplate() { return false; }
        };

        // When
        LayoutDocument copy = LayoutDocument.from(foreign);

        // Then
        assertEquals(OpenIntakeLayoutType.SUBMISSION, copy.getLayoutType());
        assertEquals(List.of("name"), copy.getSections().get(0).getFieldNames());
        assertTrue(copy.getSections().get(0).getRequiredOverrides().isEmpty());
        assertTrue(copy.isActive());
        assertTrue(copy.isDefault());
    }

    private static SectionDefinition section(String id, Integer order) {
        return SectionDefinition.builder().id(id).title(id).order(order).build();
    }
}
