package com.openintake.forms.core.engine.assignment;

import com.openintake.forms.core.engine.registry.FieldRegistry;
import com.openintake.forms.integration.contract.layout.IOpenIntakeSectionDefinition;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Designer-time classification of registry fields into steps by keyword.
 */
public interface IOpenIntakeAutoAssignmentHeuristic {

    /**
     * Assigns registry fields to steps. Steps are scanned in display order and a field goes to
     * the first step whose keywords it matches; each field is assigned at most once.
     *
     * @param steps    the steps to fill
     * @param registry all known fields
     * @param reserved field names already placed, never assigned again
     * @return step id mapped to the newly assigned field names, in registry order
     */
    Map<String, List<String>> assign(List<? extends IOpenIntakeSectionDefinition> steps,
                                     FieldRegistry registry, Set<String> reserved);
}
