package com.openintake.forms.core.engine.navigation.hooks;

import com.openintake.forms.core.engine.navigation.FieldChangeEvent;
import com.openintake.forms.core.engine.navigation.IOpenIntakeFieldChangeHook;
import com.openintake.forms.core.engine.render.RequiredValueChecker;
import com.openintake.forms.integration.models.field.FieldDefinition;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Clears the children of a changed parent, then their children in turn.
 * Only dependencies with {@code clear_on_parent_change} are cleared. Exempt fields keep their
 * value, since another hook owns their reset. Once that hook has emptied an exempt field, the
 * cascade continues below it.
 */
@Slf4j
public class DependentClearHook implements IOpenIntakeFieldChangeHook {

    private final Set<String> exemptFields;

    public DependentClearHook(Set<String> exemptFields) {
        this.exemptFields = Set.copyOf(exemptFields);
    }

    @Override
    public boolean appliesTo(String fieldName) {
        return true;
    }

    @Override
    public Set<String> apply(FieldChangeEvent event, Map<String, Object> values) {
        Set<String> cleared = new LinkedHashSet<>();
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> parents = new ArrayDeque<>();
        parents.add(event.getFieldName());
        while (!parents.isEmpty()) {
            String parent = parents.poll();
            for (FieldDefinition child : event.getRegistry().fields()) {
                if (child.getDependency() == null
                        || !parent.equals(child.getDependency().getDependsOn())
                        || !child.getDependency().isClearOnParentChange()
                        || child.getName().equals(event.getFieldName())
                        || visited.contains(child.getName())) {
                    continue;
                }
                if (exemptFields.contains(child.getName())) {
                    if (!RequiredValueChecker.isPresent(values.get(child.getName()))) {
                        visited.add(child.getName());
                        parents.add(child.getName());
                    }
                    continue;
                }
                if (RequiredValueChecker.isPresent(values.get(child.getName()))) {
                    values.put(child.getName(), event.emptyValueOf(child.getName()));
                    cleared.add(child.getName());
                    log.debug("Cleared {} after its parent {} changed", child.getName(), parent);
                }
                visited.add(child.getName());
                parents.add(child.getName());
            }
        }
        return cleared;
    }
}
