package com.openintake.forms.core.engine.assignment.impl;

import com.openintake.forms.core.engine.assignment.IOpenIntakeAutoAssignmentHeuristic;
import com.openintake.forms.core.engine.config.KeywordStepMappings;
import com.openintake.forms.core.engine.registry.FieldRegistry;
import com.openintake.forms.core.util.CommonUtil;
import com.openintake.forms.integration.contract.layout.IOpenIntakeSectionDefinition;
import com.openintake.forms.integration.models.field.FieldDefinition;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Matches each field's name, label, description and category against the keywords of a step.
 */
@Slf4j
public class KeywordAutoAssignmentHeuristic implements IOpenIntakeAutoAssignmentHeuristic {

    private final KeywordStepMappings mappings;

    public KeywordAutoAssignmentHeuristic(KeywordStepMappings mappings) {
        this.mappings = mappings;
    }

    @Override
    public Map<String, List<String>> assign(List<? extends IOpenIntakeSectionDefinition> steps,
                                            FieldRegistry registry, Set<String> reserved) {
        Set<String> used = new HashSet<>(reserved);
        Map<String, List<String>> assignments = new LinkedHashMap<>();

        List<IOpenIntakeSectionDefinition> ordered = new ArrayList<>(steps);
        ordered.sort(Comparator.comparing(IOpenIntakeSectionDefinition::getOrder,
                Comparator.nullsLast(Comparator.naturalOrder())));

        for (IOpenIntakeSectionDefinition step : ordered) {
            used.addAll(CommonUtil.nonNullList(step.getFieldNames()));
        }

        for (IOpenIntakeSectionDefinition step : ordered) {
            List<String> keywords = mappings.keywordsForStep(step.getTitle(), step.getDescription());
            List<String> assigned = new ArrayList<>();
            if (!keywords.isEmpty()) {
                for (FieldDefinition field : registry.fields()) {
                    if (!used.contains(field.getName()) && matches(field, keywords)) {
                        assigned.add(field.getName());
                        used.add(field.getName());
                    }
                }
            }
            assignments.put(step.getId(), assigned);
            log.debug("Step '{}' auto-assigned fields {}", step.getTitle(), assigned);
        }
        return assignments;
    }

    private static boolean matches(FieldDefinition field, List<String> keywords) {
        for (String keyword : keywords) {
            if (CommonUtil.anyContainsIgnoreCase(keyword, field.getName(), field.getLabel(),
                    field.getDescription(), field.getCategory())) {
                return true;
            }
        }
        return false;
    }
}
