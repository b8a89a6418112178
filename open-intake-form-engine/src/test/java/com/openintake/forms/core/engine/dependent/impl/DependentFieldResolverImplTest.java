package com.openintake.forms.core.engine.dependent.impl;

import com.openintake.forms.core.engine.dependent.DependentResolution;
import com.openintake.forms.core.engine.dependent.IOpenIntakeDependentFieldResolver;
import com.openintake.forms.integration.enumerations.OpenIntakeDependentMode;
import com.openintake.forms.integration.models.field.FieldDependency;
import com.openintake.forms.integration.models.field.FieldOption;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.openintake.forms.core.engine.FormTestFixtures.modelField;
import static com.openintake.forms.core.engine.FormTestFixtures.options;
import static org.junit.jupiter.api.Assertions.*;

class DependentFieldResolverImplTest {

    private final IOpenIntakeDependentFieldResolver resolver = DependentFieldResolverImpl.getInstance();
    private final FieldDependency modelDependency = modelField().getDependency();

    @Nested
    @DisplayName("Resolution Modes")
    class ModeTests {

        @Test
        @DisplayName("should block the child until the parent has a value")
        void shouldBlockWithoutParentValue() {
            // When
            DependentResolution resolution = resolver.resolve(null, modelDependency);

            // Then
            assertEquals(OpenIntakeDependentMode.BLOCKED, resolution.getMode());
            assertEquals("Select LLM Vendor first", resolution.getPlaceholder());
            assertFalse(resolution.isEditable());
        }

        @Test
        @DisplayName("should offer the options configured for the parent value")
        void shouldOfferOptions() {
            DependentResolution resolution = resolver.resolve("OpenAI", modelDependency);

            assertEquals(OpenIntakeDependentMode.OPTIONS, resolution.getMode());
            assertEquals(options("GPT-4", "GPT-4o"), resolution.getOptions());
        }

        @Test
        @DisplayName("should fall back to free text for an unlisted vendor when custom values are allowed")
        void shouldAllowFreeTextForOther() {
            DependentResolution resolution = resolver.resolve("Other", modelDependency);

            assertEquals(OpenIntakeDependentMode.FREE_TEXT, resolution.getMode());
            assertTrue(resolution.getOptions().isEmpty());
            assertNull(resolution.getPlaceholder());
        }

        @Test
        @DisplayName("should block an unlisted parent value when custom values are not allowed")
        void shouldBlockWithoutOptions() {
            DependentResolution resolution = resolver.resolve("Other", modelDependency.withAllowCustomValue(false));

            assertEquals(OpenIntakeDependentMode.BLOCKED, resolution.getMode());
            assertEquals("No options available for Other", resolution.getPlaceholder());
        }

        @Test
        @DisplayName("should treat a field without dependency as free text")
        void shouldTreatIndependentFieldAsFreeText() {
            assertEquals(OpenIntakeDependentMode.FREE_TEXT, resolver.resolve("anything", null).getMode());
        }

        @Test
        @DisplayName("should use the parent field name when no label is configured")
        void shouldUseParentNameInPlaceholder() {
            DependentResolution resolution = resolver.resolve("  ", modelDependency.withDependsOnLabel(null));

            assertEquals("Select llm_vendor first", resolution.getPlaceholder());
        }
    }

    @Nested
    @DisplayName("List Parents")
    class ListParentTests {

        @Test
        @DisplayName("should union the options of every selected parent value without duplicates")
        void shouldUnionOptions() {
            // Given
            FieldDependency dependency = FieldDependency.builder()
                    .dependsOn("regions")
                    .optionsByParentValue(Map.of(
                            "EU", options("GDPR", "ISO 27001"),
                            "US", options("SOC 2", "ISO 27001")))
                    .build();

            // When
            DependentResolution resolution = resolver.resolve(List.of("EU", "US"), dependency);

            // Then
            assertEquals(List.of("GDPR", "ISO 27001", "SOC 2"),
                    resolution.getOptions().stream().map(FieldOption::getValue).collect(Collectors.toList()));
        }

        @Test
        @DisplayName("should block an empty list parent")
        void shouldBlockEmptyList() {
            assertEquals(OpenIntakeDependentMode.BLOCKED, resolver.resolve(List.of(), modelDependency).getMode());
        }
    }

    @Test
    @DisplayName("should return exactly one mode for every combination of parent value and dependency")
    void shouldBeTotal() {
        // Given
        List<Object> parentValues = new ArrayList<>(Arrays.asList(null, "", "OpenAI", "Other", 42,
                List.of(), List.of("OpenAI", "Unknown"), Arrays.asList(null, " ")));
        List<FieldDependency> dependencies = Arrays.asList(null, modelDependency,
                modelDependency.withAllowCustomValue(false),
                FieldDependency.builder().dependsOn("x").optionsByParentValue(null).build());

        // When / Then
        for (Object parentValue : parentValues) {
            for (FieldDependency dependency : dependencies) {
                DependentResolution resolution = assertDoesNotThrow(() -> resolver.resolve(parentValue, dependency));
                assertNotNull(resolution.getMode());
                assertNotNull(resolution.getOptions());
                assertEquals(resolution.getMode() == OpenIntakeDependentMode.BLOCKED, resolution.getPlaceholder() != null);
            }
        }
    }
}
