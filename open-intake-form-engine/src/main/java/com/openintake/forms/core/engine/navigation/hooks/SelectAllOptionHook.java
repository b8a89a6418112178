package com.openintake.forms.core.engine.navigation.hooks;

import com.openintake.forms.core.engine.config.SelectAllOptionRule;
import com.openintake.forms.core.engine.navigation.FieldChangeEvent;
import com.openintake.forms.core.engine.navigation.IOpenIntakeFieldChangeHook;
import com.openintake.forms.integration.models.field.FieldDefinition;
import com.openintake.forms.integration.models.field.FieldOption;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Keeps a multi-select's sentinel option in step with the rest of the selection.
 * <ul>
 *   <li>selecting the sentinel selects every option</li>
 *   <li>deselecting the sentinel clears the selection</li>
 *   <li>deselecting any other option drops the sentinel</li>
 *   <li>selecting the last unselected option adds the sentinel</li>
 * </ul>
 */
public class SelectAllOptionHook implements IOpenIntakeFieldChangeHook {

    private final SelectAllOptionRule rule;

    public SelectAllOptionHook(SelectAllOptionRule rule) {
        this.rule = rule;
    }

    @Override
    public boolean appliesTo(String fieldName) {
        return rule.getFieldName().equals(fieldName);
    }

    @Override
    public Set<String> apply(FieldChangeEvent event, Map<String, Object> values) {
        FieldDefinition field = event.getRegistry().get(rule.getFieldName());
        if (field == null || field.getOptions().isEmpty()) {
            return Set.of();
        }
        String sentinel = rule.getSentinelValue();
        List<String> allValues = field.getOptions().stream().map(FieldOption::getValue).collect(Collectors.toList());
        List<String> others = allValues.stream().filter(value -> !value.equals(sentinel)).collect(Collectors.toList());

        List<String> previous = asStrings(event.getPreviousValue());
        List<String> current = asStrings(values.get(rule.getFieldName()));
        boolean hadSentinel = previous.contains(sentinel);
        boolean hasSentinel = current.contains(sentinel);

        List<Object> adjusted;
        if (hasSentinel && !hadSentinel) {
            adjusted = new ArrayList<>(allValues);
        } else if (!hasSentinel && hadSentinel) {
            adjusted = new ArrayList<>();
        } else if (hasSentinel && !current.containsAll(others)) {
            adjusted = new ArrayList<>(current);
            adjusted.remove(sentinel);
        } else if (!hasSentinel && !others.isEmpty() && current.containsAll(others)) {
            adjusted = new ArrayList<>(allValues);
        } else {
            return Set.of();
        }
        values.put(rule.getFieldName(), adjusted);
        return Set.of(rule.getFieldName());
    }

    private static List<String> asStrings(Object value) {
        if (!(value instanceof Collection<?>)) {
            return value == null || "".equals(value) ? List.of() : List.of(String.valueOf(value));
        }
        List<String> result = new ArrayList<>();
        for (Object element : (Collection<?>) value) {
            result.add(String.valueOf(element));
        }
        return result;
    }
}
