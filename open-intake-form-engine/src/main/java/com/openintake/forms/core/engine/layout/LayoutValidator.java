package com.openintake.forms.core.engine.layout;

import com.openintake.forms.core.models.LayoutViolation;
import com.openintake.forms.core.util.CommonUtil;
import com.openintake.forms.integration.models.layout.LayoutDocument;
import com.openintake.forms.integration.models.layout.SectionDefinition;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks a layout's structural invariants before it is stored.
 *
 * <h2>Checks</h2>
 * <ul>
 *   <li>bean constraints on the layout and its sections (ids, titles, orders)</li>
 *   <li>section ids and orders are unique within the layout</li>
 *   <li>a field appears in at most one section, and at most once in it</li>
 *   <li>required overrides reference fields of their own section</li>
 *   <li>templates are never default</li>
 * </ul>
 * Every problem is reported; validation does not stop at the first one.
 */
public class LayoutValidator {

    private static final Pattern SECTION_PATH = Pattern.compile("^sections\\[(\\d+)]\\.?(.*)$");

    private volatile ValidatorFactory validatorFactory;

    public List<LayoutViolation> validate(LayoutDocument layout) {
        List<LayoutViolation> violations = new ArrayList<>(constraintViolations(layout));
        List<SectionDefinition> sections = CommonUtil.nonNullList(layout.getSections());

        Set<String> sectionIds = new HashSet<>();
        Map<Integer, String> orders = new HashMap<>();
        Map<String, String> fieldOwners = new HashMap<>();

        for (int index = 0; index < sections.size(); index++) {
            SectionDefinition section = sections.get(index);
            if (section == null) {
                violations.add(LayoutViolation.ofLayout("sections[" + index + "]", "section must not be null"));
                continue;
            }
            String sectionKey = sectionKey(section, index);

            if (CommonUtil.isNotBlank(section.getId()) && !sectionIds.add(section.getId())) {
                violations.add(LayoutViolation.ofSection(sectionKey, "id",
                        "duplicate section id '" + section.getId() + "'"));
            }
            if (section.getOrder() != null) {
                String orderOwner = orders.putIfAbsent(section.getOrder(), sectionKey);
                if (orderOwner != null) {
                    violations.add(LayoutViolation.ofSection(sectionKey, "order",
                            "order " + section.getOrder() + " already used by section '" + orderOwner + "'"));
                }
            }

            List<String> fieldNames = CommonUtil.nonNullList(section.getFieldNames());
            for (String fieldName : fieldNames) {
                if (fieldName == null) {
                    continue;
                }
                String owner = fieldOwners.putIfAbsent(fieldName, sectionKey);
                if (owner != null) {
                    String where = owner.equals(sectionKey) ? "more than once in this section" : "in section '" + owner + "'";
                    violations.add(LayoutViolation.ofSection(sectionKey, "fieldNames",
                            "field '" + fieldName + "' already placed " + where));
                }
            }
            for (String override : CommonUtil.nonNullList(section.getRequiredOverrides())) {
                if (!fieldNames.contains(override)) {
                    violations.add(LayoutViolation.ofSection(sectionKey, "requiredOverrides",
                            "required field '" + override + "' is not part of the section"));
                }
            }
        }

        if (layout.isTemplate() && layout.isDefault()) {
            violations.add(LayoutViolation.ofLayout("isDefault", "a template layout cannot be the default layout"));
        }
        return violations;
    }

    private List<LayoutViolation> constraintViolations(LayoutDocument layout) {
        Set<ConstraintViolation<LayoutDocument>> violations = getValidatorFactory().getValidator().validate(layout);
        List<LayoutViolation> result = new ArrayList<>();
        violations.stream()
                .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .forEach(violation -> result.add(toLayoutViolation(layout, violation)));
        return result;
    }

    private static LayoutViolation toLayoutViolation(LayoutDocument layout, ConstraintViolation<LayoutDocument> violation) {
        String path = violation.getPropertyPath().toString();
        Matcher matcher = SECTION_PATH.matcher(path);
        if (!matcher.matches()) {
            return LayoutViolation.ofLayout(path, violation.getMessage());
        }
        int index = Integer.parseInt(matcher.group(1));
        List<SectionDefinition> sections = layout.getSections();
        String sectionKey = index < sections.size() && sections.get(index) != null
                ? sectionKey(sections.get(index), index)
                : "sections[" + index + "]";
        return LayoutViolation.ofSection(sectionKey, matcher.group(2), violation.getMessage());
    }

    private static String sectionKey(SectionDefinition section, int index) {
        return CommonUtil.isNotBlank(section.getId()) ? section.getId() : "sections[" + index + "]";
    }

    private ValidatorFactory getValidatorFactory() {
        if (validatorFactory == null) {
            synchronized (this) {
                if (validatorFactory == null) {
                    validatorFactory = Validation.byDefaultProvider()
                            .configure()
                            .messageInterpolator(new ParameterMessageInterpolator())
                            .buildValidatorFactory();
                }
            }
        }
        return validatorFactory;
    }
}
