package com.openintake.forms.core.engine.registry;

import com.openintake.forms.integration.enumerations.OpenIntakeFieldProvenance;
import com.openintake.forms.integration.enumerations.OpenIntakeFieldType;
import com.openintake.forms.integration.models.field.FieldDefinition;
import com.openintake.forms.integration.models.field.FieldOption;
import com.openintake.forms.integration.models.field.RawFieldDescriptor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static com.openintake.forms.core.engine.FormTestFixtures.descriptor;
import static org.junit.jupiter.api.Assertions.*;

class FieldConfigParserTest {

    private final FieldConfigParser parser = new FieldConfigParser();

    @Nested
    @DisplayName("Type Resolution")
    class TypeTests {

        @ParameterizedTest
        @CsvSource({
                "text, TEXT",
                "Multi_Select, MULTI_SELECT",
                "file_upload, FILE",
                "mermaid_diagram, DIAGRAM",
                "boolean, CHECKBOX",
                "dropdown, SELECT",
                "hologram, TEXT"
        })
        @DisplayName("should map wire names and aliases, defaulting unknown names to text")
        void shouldResolveType(String wireName, OpenIntakeFieldType expected) {
            assertEquals(expected, parser.resolveType("field", wireName));
        }

        @Test
        @DisplayName("should default a missing type to text")
        void shouldDefaultMissingType() {
            assertEquals(OpenIntakeFieldType.TEXT, parser.resolveType("field", null));
        }
    }

    @Nested
    @DisplayName("Configuration")
    class ConfigurationTests {

        @Test
        @DisplayName("should parse options given as maps or bare strings")
        void shouldParseOptions() {
            List<FieldOption> options = parser.parseOptions(List.of(
                    Map.of("value", "gpt-4", "label", "GPT-4"),
                    "Claude",
                    Map.of("label", "missing value")));

            assertEquals(List.of(FieldOption.of("gpt-4", "GPT-4"), FieldOption.of("Claude")), options);
        }

        @Test
        @DisplayName("should read the legacy dependency keys")
        void shouldReadLegacyDependencyKeys() {
            // Given
            RawFieldDescriptor raw = descriptor("llm_model", "LLM Model", "dependent_select", Map.of(
                    "depends_on", "LLM Vendor",
                    "dependent_options", Map.of("OpenAI", List.of("GPT-4")),
                    "allow_custom", true));

            // When
            FieldDefinition field = parser.parse(raw);

            // Then
            assertEquals("llm_vendor", field.getDependency().getDependsOn());
            assertTrue(field.getDependency().isAllowCustomValue());
            assertTrue(field.getDependency().isClearOnParentChange());
            assertEquals(List.of(FieldOption.of("GPT-4")), field.getDependency().optionsFor("OpenAI"));
        }

        @Test
        @DisplayName("should prefer the current dependency keys and honor clear_on_parent_change=false")
        void shouldPreferCurrentKeys() {
            RawFieldDescriptor raw = descriptor("sub_category", "Sub Category", "dependent_select", Map.of(
                    "depends_on", "category",
                    "options_by_parent_value", Map.of("Support", List.of("Tier 1")),
                    "dependent_options", Map.of("Support", List.of("ignored")),
                    "allow_custom_value", "false",
                    "clear_on_parent_change", false));

            FieldDefinition field = parser.parse(raw);

            assertEquals(List.of(FieldOption.of("Tier 1")), field.getDependency().optionsFor("Support"));
            assertFalse(field.getDependency().isAllowCustomValue());
            assertFalse(field.getDependency().isClearOnParentChange());
        }

        @Test
        @DisplayName("should read validation rules at the top level or nested")
        void shouldReadValidationRules() {
            FieldDefinition topLevel = parser.parse(descriptor("name", "Name", "text",
                    Map.of("min_length", 3, "max_length", "40")));
            FieldDefinition nested = parser.parse(descriptor("budget", "Budget", "number",
                    Map.of("validation", Map.of("min_value", 0, "max_value", 1000.5))));

            assertEquals(3, topLevel.getValidation().getMinLength());
            assertEquals(40, topLevel.getValidation().getMaxLength());
            assertEquals(0.0, nested.getValidation().getMinValue());
            assertEquals(1000.5, nested.getValidation().getMaxValue());
        }

        @Test
        @DisplayName("should keep the field when the configuration is malformed")
        void shouldKeepFieldWithMalformedConfig() {
            FieldDefinition field = parser.parse(descriptor("Agent Name", "Agent Name", "select",
                    Map.of("options", "not-a-list", "depends_on", " ")));

            assertEquals("agent_name", field.getName());
            assertTrue(field.getOptions().isEmpty());
            assertNull(field.getDependency());
            assertFalse(field.isConfigured());
        }

        @Test
        @DisplayName("should carry the descriptor provenance")
        void shouldCarryProvenance() {
            RawFieldDescriptor raw = descriptor("owner", "Owner", "text", Map.of())
                    .withProvenance(OpenIntakeFieldProvenance.CURRENT_USER);

            assertEquals(OpenIntakeFieldProvenance.CURRENT_USER, parser.parse(raw).getProvenance());
        }
    }
}
