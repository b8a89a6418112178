package com.openintake.forms.core.engine.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.openintake.forms.core.engine.misc.OpenIntakeObjectMapper;
import com.openintake.forms.core.exception.serialization.LayoutSerializationException;
import com.openintake.forms.core.util.CastUtil;
import com.openintake.forms.integration.contract.access.IOpenIntakeFieldAccessRule;
import com.openintake.forms.integration.contract.layout.IOpenIntakeLayoutDocument;
import com.openintake.forms.integration.contract.layout.IOpenIntakeSectionDefinition;
import com.openintake.forms.integration.contract.submission.IOpenIntakeSubmissionState;
import com.openintake.forms.integration.enumerations.OpenIntakeLayoutType;
import com.openintake.forms.integration.enumerations.OpenIntakeSubmissionStatus;
import com.openintake.forms.integration.models.access.FieldAccessRule;
import com.openintake.forms.integration.models.layout.LayoutDocument;
import com.openintake.forms.integration.models.layout.SectionDefinition;
import com.openintake.forms.integration.models.submission.SubmissionState;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Converts layouts, access rules and submission states to and from their persisted JSON shapes.
 *
 * <p>Keys are snake_case. Sections written before {@code field_names} and
 * {@code required_overrides} existed carry {@code fields} and {@code required_fields}; both
 * are read, only the current keys are written.</p>
 */
@Slf4j
public final class LayoutDocumentSerializer {

    private LayoutDocumentSerializer() {
        // Utility class
    }

    // ========================================================================
    // LAYOUT
    // ========================================================================

    public static String toJson(IOpenIntakeLayoutDocument layout) throws LayoutSerializationException {
        try {
            return OpenIntakeObjectMapper.getInstance().write(layoutToMap(layout));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize layout {}: {}", layout.getId(), e.getMessage(), e);
            throw new LayoutSerializationException("Failed to serialize layout " + layout.getId(), e);
        }
    }

    public static LayoutDocument fromJson(String json) throws LayoutSerializationException {
        try {
            return mapToLayout(OpenIntakeObjectMapper.getInstance().readMap(json));
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize layout: {}", e.getMessage(), e);
            throw new LayoutSerializationException("Failed to deserialize layout", e);
        }
    }

    public static Map<String, Object> layoutToMap(IOpenIntakeLayoutDocument layout) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", layout.getId());
        putIfNotNull(map, "name", layout.getName());
        map.put("screen_id", layout.getScreenId());
        putIfNotNull(map, "tenant_id", layout.getTenantId());
        OpenIntakeLayoutType layoutType = layout.getLayoutType() == null ? OpenIntakeLayoutType.SUBMISSION : layout.getLayoutType();
        map.put("layout_type", layoutType.getWireName());
        List<Map<String, Object>> sections = new ArrayList<>();
        if (layout.getSections() != null) {
            for (IOpenIntakeSectionDefinition section : layout.getSections()) {
                sections.add(sectionToMap(section));
            }
        }
        map.put("sections", sections);
        map.put("is_active", layout.isActive());
        map.put("is_default", layout.isDefault());
        map.put("is_template", layout.isTemplate());
        return map;
    }

    public static LayoutDocument mapToLayout(Map<String, Object> map) throws LayoutSerializationException {
        String id = stringOrNull(map.get("id"));
        if (id == null) {
            throw new LayoutSerializationException("Layout document has no id");
        }
        OpenIntakeLayoutType layoutType;
        try {
            String rawType = stringOrNull(map.get("layout_type"));
            layoutType = rawType == null ? OpenIntakeLayoutType.SUBMISSION : OpenIntakeLayoutType.fromWireName(rawType);
        } catch (IllegalArgumentException e) {
            throw new LayoutSerializationException("Layout " + id + ": " + e.getMessage(), e);
        }

        List<SectionDefinition> sections = new ArrayList<>();
        Object rawSections = map.get("sections");
        if (rawSections != null && !(rawSections instanceof Collection<?>)) {
            throw new LayoutSerializationException("Layout " + id + ": sections must be a list");
        }
        if (rawSections != null) {
            for (Object rawSection : (Collection<?>) rawSections) {
                if (!(rawSection instanceof Map<?, ?>)) {
                    throw new LayoutSerializationException("Layout " + id + ": every section must be an object");
                }
                sections.add(mapToSection(asStringKeyed((Map<?, ?>) rawSection)));
            }
        }

        return LayoutDocument.builder()
                .id(id)
                .name(stringOrNull(map.get("name")))
                .screenId(stringOrNull(map.get("screen_id")))
                .tenantId(stringOrNull(map.get("tenant_id")))
                .layoutType(layoutType)
                .sections(sections)
                .isActive(Boolean.TRUE.equals(CastUtil.castAsBoolean(map.get("is_active"))))
                .isDefault(Boolean.TRUE.equals(CastUtil.castAsBoolean(map.get("is_default"))))
                .isTemplate(Boolean.TRUE.equals(CastUtil.castAsBoolean(map.get("is_template"))))
                .build();
    }

    public static Map<String, Object> sectionToMap(IOpenIntakeSectionDefinition section) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", section.getId());
        map.put("title", section.getTitle());
        putIfNotNull(map, "description", section.getDescription());
        map.put("order", section.getOrder());
        map.put("field_names", section.getFieldNames() == null ? List.of() : new ArrayList<>(section.getFieldNames()));
        map.put("required_overrides",
                section.getRequiredOverrides() == null ? List.of() : new ArrayList<>(section.getRequiredOverrides()));
        return map;
    }

    /**
     * Missing ids, titles and orders are kept as null so that layout validation reports them.
     */
    public static SectionDefinition mapToSection(Map<String, Object> map) {
        Object fieldNames = map.containsKey("field_names") ? map.get("field_names") : map.get("fields");
        Object overrides = map.containsKey("required_overrides") ? map.get("required_overrides") : map.get("required_fields");
        return SectionDefinition.builder()
                .id(stringOrNull(map.get("id")))
                .title(stringOrNull(map.get("title")))
                .description(stringOrNull(map.get("description")))
                .order(CastUtil.castAsIntegerOrNull(map.get("order")))
                .fieldNames(stringList(fieldNames))
                .requiredOverrides(stringList(overrides))
                .build();
    }

    // ========================================================================
    // ACCESS RULES
    // ========================================================================

    public static Map<String, Object> ruleToMap(IOpenIntakeFieldAccessRule rule) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("field_name", rule.getFieldName());
        map.put("role", rule.getRole());
        map.put("can_view", rule.isCanView());
        map.put("can_edit", rule.isCanEdit());
        return map;
    }

    public static FieldAccessRule mapToRule(Map<String, Object> map) {
        return FieldAccessRule.builder()
                .fieldName(stringOrNull(map.get("field_name")))
                .role(stringOrNull(map.get("role")))
                .canView(Boolean.TRUE.equals(CastUtil.castAsBoolean(map.get("can_view"))))
                .canEdit(Boolean.TRUE.equals(CastUtil.castAsBoolean(map.get("can_edit"))))
                .build();
    }

    /**
     * The per-field role permission format used by the designer: {@code {role: {view, edit}}}.
     */
    public static Map<String, Map<String, Boolean>> toRolePermissions(String fieldName,
                                                                      Collection<? extends IOpenIntakeFieldAccessRule> rules) {
        Map<String, Map<String, Boolean>> permissions = new LinkedHashMap<>();
        for (IOpenIntakeFieldAccessRule rule : rules) {
            if (fieldName.equals(rule.getFieldName())) {
                Map<String, Boolean> flags = new LinkedHashMap<>();
                flags.put("view", rule.isCanView());
                flags.put("edit", rule.isCanEdit());
                permissions.put(rule.getRole(), flags);
            }
        }
        return permissions;
    }

    public static List<FieldAccessRule> fromRolePermissions(String fieldName, Map<String, Map<String, Boolean>> permissions) {
        List<FieldAccessRule> rules = new ArrayList<>();
        permissions.forEach((role, flags) -> rules.add(FieldAccessRule.builder()
                .fieldName(fieldName)
                .role(role)
                .canView(flags != null && Boolean.TRUE.equals(flags.get("view")))
                .canEdit(flags != null && Boolean.TRUE.equals(flags.get("edit")))
                .build()));
        return rules;
    }

    // ========================================================================
    // SUBMISSION STATE
    // ========================================================================

    public static Map<String, Object> submissionToMap(IOpenIntakeSubmissionState state) {
        Map<String, Object> map = new LinkedHashMap<>();
        putIfNotNull(map, "record_id", state.getRecordId());
        map.put("values", state.getValues() == null ? Map.of() : new LinkedHashMap<>(state.getValues()));
        map.put("current_step", state.getCurrentStep());
        OpenIntakeSubmissionStatus status = state.getStatus() == null ? OpenIntakeSubmissionStatus.DRAFT : state.getStatus();
        map.put("status", status.name().toLowerCase(Locale.ROOT));
        return map;
    }

    public static SubmissionState mapToSubmission(Map<String, Object> map) throws LayoutSerializationException {
        Object values = map.get("values");
        if (values != null && !(values instanceof Map<?, ?>)) {
            throw new LayoutSerializationException("Submission values must be an object");
        }
        OpenIntakeSubmissionStatus status;
        String rawStatus = stringOrNull(map.get("status"));
        try {
            status = rawStatus == null
                    ? OpenIntakeSubmissionStatus.DRAFT
                    : OpenIntakeSubmissionStatus.valueOf(rawStatus.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new LayoutSerializationException("Unknown submission status: " + rawStatus, e);
        }
        Integer step = CastUtil.castAsIntegerOrNull(map.get("current_step"));
        return SubmissionState.builder()
                .recordId(stringOrNull(map.get("record_id")))
                .values(values == null ? Collections.emptyMap() : asStringKeyed((Map<?, ?>) values))
                .currentStep(step == null ? 1 : Math.max(1, step))
                .status(status)
                .build();
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private static void putIfNotNull(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private static List<String> stringList(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?>) {
            List<String> result = new ArrayList<>();
            for (Object element : (Collection<?>) value) {
                if (element != null) {
                    result.add(String.valueOf(element));
                }
            }
            return result;
        }
        return List.of(String.valueOf(value));
    }

    private static Map<String, Object> asStringKeyed(Map<?, ?> map) {
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((key, value) -> result.put(String.valueOf(key), value));
        return result;
    }
}
