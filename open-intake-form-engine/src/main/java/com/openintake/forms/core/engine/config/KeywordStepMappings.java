package com.openintake.forms.core.engine.config;

import com.openintake.forms.core.util.CommonUtil;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keyword table used to pre-populate a new layout.
 * <p>
 * Each entry maps a step keyword, matched against a step's title or description, to the
 * field keywords that belong to that step. Entries keep their declaration order.
 */
@ToString
@EqualsAndHashCode
public final class KeywordStepMappings {

    private final Map<String, List<String>> mappings;

    private KeywordStepMappings(Map<String, List<String>> mappings) {
        this.mappings = Collections.unmodifiableMap(mappings);
    }

    public static KeywordStepMappings of(Map<String, List<String>> mappings) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        mappings.forEach((step, keywords) -> copy.put(step.toLowerCase(), List.copyOf(keywords)));
        return new KeywordStepMappings(copy);
    }

    public static KeywordStepMappings empty() {
        return new KeywordStepMappings(new LinkedHashMap<>());
    }

    /**
     * Mapping used by the vendor agent submission form.
     */
    public static KeywordStepMappings defaultMappings() {
        Map<String, List<String>> mappings = new LinkedHashMap<>();
        mappings.put("agent details", List.of("name", "type", "category", "description", "version", "status"));
        mappings.put("ai configuration", List.of("llm_vendor", "llm_model", "deployment_type", "ai_provider", "model_name"));
        mappings.put("data & operations", List.of("data_types", "data_categories", "capabilities", "regions",
                "operational_regions", "data_handling"));
        mappings.put("integrations", List.of("connections", "integrations", "external_systems", "api_connections",
                "system_integrations"));
        mappings.put("compliance & review", List.of("compliance", "requirements", "frameworks", "review", "submit"));
        return new KeywordStepMappings(mappings);
    }

    public Map<String, List<String>> asMap() {
        return mappings;
    }

    /**
     * Field keywords of every entry whose step keyword occurs in the step title or description.
     */
    public List<String> keywordsForStep(String title, String description) {
        Set<String> keywords = new LinkedHashSet<>();
        mappings.forEach((stepKeyword, fieldKeywords) -> {
            if (CommonUtil.anyContainsIgnoreCase(stepKeyword, title, description)) {
                keywords.addAll(fieldKeywords);
            }
        });
        return new ArrayList<>(keywords);
    }
}
