package com.openintake.forms.core.engine.dependent;

import com.openintake.forms.integration.contract.field.IOpenIntakeFieldDefinition.IOpenIntakeFieldDependency;

/**
 * Computes a child field's options from its parent's current value.
 */
public interface IOpenIntakeDependentFieldResolver {

    /**
     * Resolves the child field. Total: returns exactly one mode for every input and never throws.
     *
     * @param parentValue current value of the parent field, scalar or list
     * @param dependency  the child's dependency, may be null
     */
    DependentResolution resolve(Object parentValue, IOpenIntakeFieldDependency dependency);
}
