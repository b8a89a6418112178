package com.openintake.forms.core.engine.render;

import com.openintake.forms.core.util.CastUtil;
import com.openintake.forms.integration.contract.field.IOpenIntakeFieldDefinition;
import com.openintake.forms.integration.contract.field.IOpenIntakeFieldDefinition.IOpenIntakeFieldValidationRules;
import com.openintake.forms.integration.enumerations.OpenIntakeFieldType;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Applies format rules to non-empty scalar values. Empty values are left to the required check.
 */
@Slf4j
public class FieldValueValidator {

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    private final Map<String, Pattern> patternCache = new ConcurrentHashMap<>();

    public List<FieldValidationError> validate(IOpenIntakeFieldDefinition field, String label, Object value) {
        List<FieldValidationError> errors = new ArrayList<>();
        if (!RequiredValueChecker.isPresent(value) || FieldTypeDispatchTable.shapeOf(field) != ValueShape.SCALAR) {
            return errors;
        }

        String text = CastUtil.castAsString(value).trim();
        OpenIntakeFieldType type = field.getType();

        if (type == OpenIntakeFieldType.EMAIL && !EMAIL_PATTERN.matcher(text).matches()) {
            errors.add(error(field, label, FieldValidationError.Code.EMAIL, label + " must be a valid email address"));
        }
        if (type == OpenIntakeFieldType.URL && !isUrl(text)) {
            errors.add(error(field, label, FieldValidationError.Code.URL, label + " must be a valid URL"));
        }

        Double number = null;
        if (type == OpenIntakeFieldType.NUMBER) {
            number = CastUtil.castAsDoubleOrNull(value);
            if (number == null) {
                errors.add(error(field, label, FieldValidationError.Code.NOT_A_NUMBER, label + " must be a number"));
            }
        }

        IOpenIntakeFieldValidationRules rules = field.getValidation();
        if (rules == null) {
            return errors;
        }
        if (rules.getMinLength() != null && text.length() < rules.getMinLength()) {
            errors.add(error(field, label, FieldValidationError.Code.MIN_LENGTH,
                    label + " must be at least " + rules.getMinLength() + " characters"));
        }
        if (rules.getMaxLength() != null && text.length() > rules.getMaxLength()) {
            errors.add(error(field, label, FieldValidationError.Code.MAX_LENGTH,
                    label + " must be at most " + rules.getMaxLength() + " characters"));
        }
        if (rules.getPattern() != null) {
            Pattern pattern = compile(rules.getPattern(), field.getName());
            if (pattern != null && !pattern.matcher(text).matches()) {
                errors.add(error(field, label, FieldValidationError.Code.PATTERN, label + " has an invalid format"));
            }
        }
        if (rules.getMinValue() != null || rules.getMaxValue() != null) {
            Double numeric = number != null ? number : CastUtil.castAsDoubleOrNull(value);
            if (numeric != null && rules.getMinValue() != null && numeric < rules.getMinValue()) {
                errors.add(error(field, label, FieldValidationError.Code.MIN_VALUE,
                        label + " must be at least " + rules.getMinValue()));
            }
            if (numeric != null && rules.getMaxValue() != null && numeric > rules.getMaxValue()) {
                errors.add(error(field, label, FieldValidationError.Code.MAX_VALUE,
                        label + " must be at most " + rules.getMaxValue()));
            }
        }
        return errors;
    }

    private Pattern compile(String regex, String fieldName) {
        Pattern cached = patternCache.get(regex);
        if (cached != null) {
            return cached;
        }
        try {
            Pattern pattern = Pattern.compile(regex);
            patternCache.put(regex, pattern);
            return pattern;
        } catch (PatternSyntaxException e) {
            log.warn("Ignoring invalid validation pattern on field {}: {}", fieldName, e.getDescription());
            return null;
        }
    }

    private static boolean isUrl(String text) {
        try {
            URI uri = new URI(text);
            return uri.getScheme() != null && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static FieldValidationError error(IOpenIntakeFieldDefinition field, String label,
                                              FieldValidationError.Code code, String message) {
        return new FieldValidationError(field.getName(), label, code, message);
    }
}
