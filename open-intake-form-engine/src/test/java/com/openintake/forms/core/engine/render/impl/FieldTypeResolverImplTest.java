package com.openintake.forms.core.engine.render.impl;

import com.openintake.forms.core.engine.dependent.impl.DependentFieldResolverImpl;
import com.openintake.forms.core.engine.misc.OpenIntakeObjectMapper;
import com.openintake.forms.core.engine.render.FieldValueNormalizer;
import com.openintake.forms.core.engine.render.IOpenIntakeFieldTypeResolver;
import com.openintake.forms.core.engine.render.RenderDecision;
import com.openintake.forms.integration.enumerations.OpenIntakeDependentMode;
import com.openintake.forms.integration.enumerations.OpenIntakeFieldType;
import com.openintake.forms.integration.enumerations.OpenIntakeRenderCategory;
import com.openintake.forms.integration.models.field.FieldDefinition;
import com.openintake.forms.integration.models.field.FieldDependency;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static com.openintake.forms.core.engine.FormTestFixtures.field;
import static com.openintake.forms.core.engine.FormTestFixtures.modelField;
import static com.openintake.forms.core.engine.FormTestFixtures.multiSelectField;
import static com.openintake.forms.core.engine.FormTestFixtures.options;
import static com.openintake.forms.core.engine.FormTestFixtures.selectField;
import static org.junit.jupiter.api.Assertions.*;

class FieldTypeResolverImplTest {

    private final IOpenIntakeFieldTypeResolver resolver = new FieldTypeResolverImpl(
            DependentFieldResolverImpl.getInstance(),
            new FieldValueNormalizer(OpenIntakeObjectMapper.getInstance()));

    @Nested
    @DisplayName("Render Categories")
    class CategoryTests {

        @ParameterizedTest
        @CsvSource({
                "TEXT, PLAIN_TEXT",
                "EMAIL, PLAIN_TEXT",
                "NUMBER, NUMERIC",
                "DATE, DATE",
                "SELECT, SINGLE_SELECT",
                "MULTI_SELECT, MULTI_SELECT",
                "CHECKBOX, BOOLEAN",
                "JSON, STRUCTURED",
                "RICH_TEXT, RICH_TEXT",
                "DIAGRAM, DIAGRAM",
                "FILE, FILE"
        })
        @DisplayName("should map each field type to its render category")
        void shouldMapTypeToCategory(OpenIntakeFieldType type, OpenIntakeRenderCategory expected) {
            RenderDecision decision = resolver.resolve(field("f", "F", type), null, Map.of());

            assertEquals(expected, decision.getCategory());
            assertTrue(decision.isEditable());
            assertNull(decision.getDependentMode());
        }

        @Test
        @DisplayName("should render a json field with options as a multi select")
        void shouldRenderJsonWithOptionsAsChecklist() {
            // Given
            FieldDefinition capabilities = field("capabilities", "Capabilities", OpenIntakeFieldType.JSON)
                    .withOptions(options("Search", "Summarize"));

            // When
            RenderDecision decision = resolver.resolve(capabilities, "[\"Search\"]", Map.of());

            // Then
            assertEquals(OpenIntakeRenderCategory.MULTI_SELECT, decision.getCategory());
            assertEquals(List.of("Search"), decision.getNormalizedValue());
        }

        @Test
        @DisplayName("should flag delegated widgets")
        void shouldFlagDelegatedWidgets() {
            assertTrue(resolver.resolve(field("diagram", "Diagram", OpenIntakeFieldType.DIAGRAM), null, Map.of())
                    .isDelegatedWidget());
            assertFalse(resolver.resolve(field("name", "Name", OpenIntakeFieldType.TEXT), null, Map.of())
                    .isDelegatedWidget());
        }
    }

    @Nested
    @DisplayName("Value Normalization")
    class NormalizationTests {

        @Test
        @DisplayName("should wrap a scalar stored for a multi select into a list")
        void shouldWrapScalar() {
            FieldDefinition regions = multiSelectField("regions", "Regions", "EU", "US");

            assertEquals(List.of("EU"), resolver.normalize(regions, "EU"));
        }

        @Test
        @DisplayName("should split a comma joined string for a multi select")
        void shouldSplitCommaJoinedString() {
            FieldDefinition regions = multiSelectField("regions", "Regions", "EU", "US");

            assertEquals(List.of("EU", "US"), resolver.normalize(regions, "EU, US"));
        }

        @Test
        @DisplayName("should collapse a list stored for a scalar field to its first element")
        void shouldCollapseList() {
            FieldDefinition type = selectField("type", "Type", "Chatbot", "Copilot");

            assertEquals("Chatbot", resolver.normalize(type, List.of("Chatbot", "Copilot")));
            assertEquals("", resolver.normalize(type, List.of()));
            assertEquals("", resolver.normalize(type, null));
        }

        @Test
        @DisplayName("should coerce checkbox values to booleans")
        void shouldCoerceBooleans() {
            FieldDefinition consent = field("consent", "Consent", OpenIntakeFieldType.CHECKBOX);

            assertEquals(Boolean.TRUE, resolver.normalize(consent, "true"));
            assertEquals(Boolean.FALSE, resolver.normalize(consent, null));
            assertEquals(Boolean.FALSE, resolver.emptyValue(consent));
        }

        @Test
        @DisplayName("should require an explicit true for a required checkbox")
        void shouldRequireTrueForCheckbox() {
            FieldDefinition consent = field("consent", "Consent", OpenIntakeFieldType.CHECKBOX);

            assertTrue(resolver.isRequirementSatisfied(consent, true));
            assertFalse(resolver.isRequirementSatisfied(consent, false));
            assertFalse(resolver.isRequirementSatisfied(field("name", "Name", OpenIntakeFieldType.TEXT), "  "));
        }
    }

    @Nested
    @DisplayName("Dependent Fields")
    class DependentTests {

        @Test
        @DisplayName("should block the model picker until a vendor is chosen")
        void shouldBlockUntilParentChosen() {
            RenderDecision decision = resolver.resolve(modelField(), null, Map.of());

            assertTrue(decision.isBlocked());
            assertFalse(decision.isEditable());
            assertEquals("Select LLM Vendor first", decision.getPlaceholder());
            assertEquals(OpenIntakeRenderCategory.DEPENDENT_SELECT, decision.getCategory());
        }

        @Test
        @DisplayName("should render free text for a vendor outside the catalog")
        void shouldRenderFreeTextForOther() {
            RenderDecision decision = resolver.resolve(modelField(), "my-model", Map.of("llm_vendor", "Other"));

            assertEquals(OpenIntakeDependentMode.FREE_TEXT, decision.getDependentMode());
            assertEquals(OpenIntakeRenderCategory.PLAIN_TEXT, decision.getCategory());
            assertEquals("my-model", decision.getNormalizedValue());
        }

        @Test
        @DisplayName("should keep the multi select category for a list shaped dependent field")
        void shouldKeepListCategory() {
            // Given
            FieldDefinition certifications = multiSelectField("certifications", "Certifications")
                    .withDependency(FieldDependency.builder()
                            .dependsOn("regions")
                            .optionsByParentValue(Map.of("EU", options("GDPR")))
                            .build());

            // When
            RenderDecision decision = resolver.resolve(certifications, null, Map.of("regions", List.of("EU")));

            // Then
            assertEquals(OpenIntakeRenderCategory.MULTI_SELECT, decision.getCategory());
            assertEquals(OpenIntakeDependentMode.OPTIONS, decision.getDependentMode());
            assertEquals(options("GDPR"), decision.getOptions());
        }
    }
}
