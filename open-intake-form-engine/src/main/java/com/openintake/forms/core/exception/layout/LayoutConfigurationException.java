package com.openintake.forms.core.exception.layout;

import com.openintake.forms.core.exception.codes.OpenIntakeInternalErrorCodes;
import com.openintake.forms.core.models.LayoutViolation;
import com.openintake.forms.integration.exception.OpenIntakeFormRuntimeException;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A layout write was rejected because the document breaks a structural invariant.
 * Nothing of the rejected document was stored.
 */
public class LayoutConfigurationException extends OpenIntakeFormRuntimeException {

    private final String layoutId;
    private final List<LayoutViolation> violations;

    public LayoutConfigurationException(OpenIntakeInternalErrorCodes errorCode, String layoutId,
                                        List<LayoutViolation> violations) {
        super(errorCode, Map.of("layoutId", String.valueOf(layoutId),
                "violations", String.valueOf(violations.size())), null, violations);
        this.layoutId = layoutId;
        this.violations = List.copyOf(violations);
    }

    public LayoutConfigurationException(String layoutId, List<LayoutViolation> violations) {
        this(OpenIntakeInternalErrorCodes.LAYOUT_STRUCTURE_INVALID, layoutId, violations);
    }

    public String getLayoutId() {
        return layoutId;
    }

    public List<LayoutViolation> getViolations() {
        return violations;
    }

    /**
     * Ids of the sections named by at least one violation, in report order.
     */
    public Set<String> getOffendingSectionIds() {
        return violations.stream()
                .map(LayoutViolation::getSectionId)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
