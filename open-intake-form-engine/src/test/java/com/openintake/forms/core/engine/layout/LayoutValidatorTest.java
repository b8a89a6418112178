package com.openintake.forms.core.engine.layout;

import com.openintake.forms.core.models.LayoutViolation;
import com.openintake.forms.integration.models.layout.LayoutDocument;
import com.openintake.forms.integration.models.layout.SectionDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.openintake.forms.core.engine.FormTestFixtures.layout;
import static com.openintake.forms.core.engine.FormTestFixtures.section;
import static org.junit.jupiter.api.Assertions.*;

class LayoutValidatorTest {

    private final LayoutValidator validator = new LayoutValidator();

    @Test
    @DisplayName("should accept a well formed layout")
    void shouldAcceptValidLayout() {
        LayoutDocument layout = layout("layout-1",
                section("basics", 1, "name", "type"),
                section("ai", 2, "llm_vendor", "llm_model").withRequiredOverrides(List.of("llm_vendor")));

        assertTrue(validator.validate(layout).isEmpty());
    }

    @Nested
    @DisplayName("Constraint Violations")
    class ConstraintTests {

        @Test
        @DisplayName("should report a missing screen id at layout level")
        void shouldReportMissingScreenId() {
            List<LayoutViolation> violations = validator.validate(
                    layout("layout-1", section("basics", 1, "name")).withScreenId(null));

            assertEquals(1, violations.size());
            assertNull(violations.get(0).getSectionId());
            assertEquals("screenId", violations.get(0).getPropertyPath());
        }

        @Test
        @DisplayName("should attribute a section constraint to the section id")
        void shouldAttributeSectionViolation() {
            List<LayoutViolation> violations = validator.validate(
                    layout("layout-1", section("basics", 1, "name").withTitle(" ")));

            assertEquals(1, violations.size());
            assertEquals("basics", violations.get(0).getSectionId());
            assertEquals("title", violations.get(0).getPropertyPath());
        }

        @Test
        @DisplayName("should use the section index when the section has no id")
        void shouldUseIndexWithoutSectionId() {
            List<LayoutViolation> violations = validator.validate(
                    layout("layout-1", section("basics", 1, "name"), section("x", 2).withId(null)));

            assertEquals("sections[1]", violations.get(0).getSectionId());
            assertEquals("id", violations.get(0).getPropertyPath());
        }
    }

    @Nested
    @DisplayName("Structural Rules")
    class StructureTests {

        @Test
        @DisplayName("should reject duplicate section ids and orders")
        void shouldRejectDuplicateIdsAndOrders() {
            List<LayoutViolation> violations = validator.validate(layout("layout-1",
                    section("basics", 1, "name"),
                    section("basics", 1, "type")));

            assertEquals(2, violations.size());
            assertTrue(violations.stream().anyMatch(v -> "id".equals(v.getPropertyPath())));
            assertTrue(violations.stream().anyMatch(v -> v.getMessage().contains("order 1 already used")));
        }

        @Test
        @DisplayName("should reject a field placed in two sections")
        void shouldRejectFieldInTwoSections() {
            List<LayoutViolation> violations = validator.validate(layout("layout-1",
                    section("basics", 1, "name"),
                    section("review", 2, "name")));

            assertEquals(1, violations.size());
            assertEquals("review", violations.get(0).getSectionId());
            assertEquals("field 'name' already placed in section 'basics'", violations.get(0).getMessage());
        }

        @Test
        @DisplayName("should reject a required override for a field outside the section")
        void shouldRejectForeignRequiredOverride() {
            SectionDefinition basics = section("basics", 1, "name").withRequiredOverrides(List.of("budget"));

            List<LayoutViolation> violations = validator.validate(layout("layout-1", basics));

            assertEquals("requiredOverrides", violations.get(0).getPropertyPath());
        }

        @Test
        @DisplayName("should reject a template marked as default")
        void shouldRejectDefaultTemplate() {
            List<LayoutViolation> violations = validator.validate(
                    layout("layout-1", section("basics", 1, "name")).withTemplate(true));

            assertEquals(1, violations.size());
            assertEquals("isDefault", violations.get(0).getPropertyPath());
        }
    }
}
