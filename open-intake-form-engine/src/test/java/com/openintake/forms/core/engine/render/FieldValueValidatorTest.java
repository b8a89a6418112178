package com.openintake.forms.core.engine.render;

import com.openintake.forms.integration.enumerations.OpenIntakeFieldType;
import com.openintake.forms.integration.models.field.FieldDefinition;
import com.openintake.forms.integration.models.field.FieldValidationRules;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.openintake.forms.core.engine.FormTestFixtures.field;
import static org.junit.jupiter.api.Assertions.*;

class FieldValueValidatorTest {

    private final FieldValueValidator validator = new FieldValueValidator();

    @Test
    @DisplayName("should leave empty values to the required check")
    void shouldIgnoreEmptyValues() {
        FieldDefinition email = field("contact", "Contact", OpenIntakeFieldType.EMAIL);

        assertTrue(validator.validate(email, "Contact", "").isEmpty());
        assertTrue(validator.validate(email, "Contact", null).isEmpty());
    }

    @Test
    @DisplayName("should reject malformed email and url values")
    void shouldRejectMalformedEmailAndUrl() {
        List<FieldValidationError> email = validator.validate(
                field("contact", "Contact", OpenIntakeFieldType.EMAIL), "Contact", "not-an-email");
        List<FieldValidationError> url = validator.validate(
                field("docs", "Docs", OpenIntakeFieldType.URL), "Docs", "docs");

        assertEquals(FieldValidationError.Code.EMAIL, email.get(0).getCode());
        assertEquals("Contact must be a valid email address", email.get(0).getMessage());
        assertEquals(FieldValidationError.Code.URL, url.get(0).getCode());
        assertTrue(validator.validate(field("docs", "Docs", OpenIntakeFieldType.URL), "Docs",
                "https://example.com/agent").isEmpty());
    }

    @Test
    @DisplayName("should check length and pattern rules")
    void shouldCheckLengthAndPattern() {
        // Given
        FieldDefinition version = field("version", "Version", OpenIntakeFieldType.TEXT)
                .withValidation(FieldValidationRules.builder().minLength(3).pattern("\\d+\\.\\d+").build());

        // When
        List<FieldValidationError> errors = validator.validate(version, "Version", "v1");

        // Then
        assertEquals(2, errors.size());
        assertEquals(FieldValidationError.Code.MIN_LENGTH, errors.get(0).getCode());
        assertEquals(FieldValidationError.Code.PATTERN, errors.get(1).getCode());
        assertTrue(validator.validate(version, "Version", "1.2").isEmpty());
    }

    @Test
    @DisplayName("should check numeric ranges")
    void shouldCheckNumericRanges() {
        FieldDefinition budget = field("budget", "Budget", OpenIntakeFieldType.NUMBER)
                .withValidation(FieldValidationRules.builder().minValue(0.0).maxValue(100.0).build());

        assertEquals(FieldValidationError.Code.MAX_VALUE, validator.validate(budget, "Budget", "150").get(0).getCode());
        assertEquals(FieldValidationError.Code.NOT_A_NUMBER, validator.validate(budget, "Budget", "lots").get(0).getCode());
        assertTrue(validator.validate(budget, "Budget", 42).isEmpty());
    }

    @Test
    @DisplayName("should ignore an invalid pattern instead of failing")
    void shouldIgnoreInvalidPattern() {
        FieldDefinition name = field("name", "Name", OpenIntakeFieldType.TEXT)
                .withValidation(FieldValidationRules.builder().pattern("([").build());

        assertTrue(validator.validate(name, "Name", "anything").isEmpty());
    }
}
