package com.openintake.forms.integration.models.field;

import com.openintake.forms.integration.contract.field.IOpenIntakeFieldDefinition.IOpenIntakeFieldDependency;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dependency of a child field on a parent field.
 * <p>
 * Options are keyed by the parent value they apply to. A parent value without an entry
 * resolves to an empty option list.
 */
@Data
@Builder(toBuilder = true)
@With
public class FieldDependency implements IOpenIntakeFieldDependency, Serializable {
    private static final long serialVersionUID = 1L;

    @NotBlank
    private final String dependsOn;

    private final String dependsOnLabel;

    @Builder.Default
    private final Map<String, List<FieldOption>> optionsByParentValue = Collections.emptyMap();

    private final boolean allowCustomValue;

    @Builder.Default
    private final boolean clearOnParentChange = true;

    @Override
    public Set<String> getParentValues() {
        return optionsByParentValue == null ? Collections.emptySet() : optionsByParentValue.keySet();
    }

    @Override
    public List<FieldOption> optionsFor(String parentValue) {
        if (parentValue == null || optionsByParentValue == null) {
            return Collections.emptyList();
        }
        List<FieldOption> options = optionsByParentValue.get(parentValue);
        return options == null ? Collections.emptyList() : options;
    }
}
