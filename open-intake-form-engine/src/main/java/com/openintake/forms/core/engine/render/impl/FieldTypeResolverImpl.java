package com.openintake.forms.core.engine.render.impl;

import com.openintake.forms.core.engine.dependent.DependentResolution;
import com.openintake.forms.core.engine.dependent.IOpenIntakeDependentFieldResolver;
import com.openintake.forms.core.engine.render.FieldTypeDispatchTable;
import com.openintake.forms.core.engine.render.FieldValueNormalizer;
import com.openintake.forms.core.engine.render.IOpenIntakeFieldTypeResolver;
import com.openintake.forms.core.engine.render.RenderDecision;
import com.openintake.forms.core.engine.render.RequiredValueChecker;
import com.openintake.forms.core.engine.render.ValueShape;
import com.openintake.forms.integration.contract.field.IOpenIntakeFieldDefinition;
import com.openintake.forms.integration.contract.field.IOpenIntakeFieldDefinition.IOpenIntakeFieldDependency;
import com.openintake.forms.integration.contract.field.IOpenIntakeFieldDefinition.IOpenIntakeFieldOption;
import com.openintake.forms.integration.enumerations.OpenIntakeDependentMode;
import com.openintake.forms.integration.enumerations.OpenIntakeRenderCategory;
import com.openintake.forms.integration.models.field.FieldOption;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class FieldTypeResolverImpl implements IOpenIntakeFieldTypeResolver {

    private final IOpenIntakeDependentFieldResolver dependentFieldResolver;
    private final FieldValueNormalizer normalizer;

    public FieldTypeResolverImpl(IOpenIntakeDependentFieldResolver dependentFieldResolver,
                                 FieldValueNormalizer normalizer) {
        this.dependentFieldResolver = dependentFieldResolver;
        this.normalizer = normalizer;
    }

    @Override
    public RenderDecision resolve(IOpenIntakeFieldDefinition field, Object rawValue, Map<String, Object> currentValues) {
        RenderDecision.RenderDecisionBuilder decision = RenderDecision.builder()
                .fieldName(field.getName())
                .label(field.getLabel() == null || field.getLabel().isBlank() ? field.getName() : field.getLabel())
                .type(field.getType())
                .category(FieldTypeDispatchTable.categoryOf(field))
                .normalizedValue(normalize(field, rawValue))
                .options(copyOptions(field.getOptions()));

        IOpenIntakeFieldDependency dependency = field.getDependency();
        if (dependency == null) {
            return decision.build();
        }

        Object parentValue = currentValues == null ? null : currentValues.get(dependency.getDependsOn());
        DependentResolution resolution = dependentFieldResolver.resolve(parentValue, dependency);
        decision.dependentMode(resolution.getMode())
                .placeholder(resolution.getPlaceholder())
                .editable(resolution.isEditable())
                .options(resolution.getOptions());

        if (resolution.getMode() == OpenIntakeDependentMode.FREE_TEXT) {
            decision.category(OpenIntakeRenderCategory.PLAIN_TEXT);
        } else if (FieldTypeDispatchTable.shapeOf(field) != ValueShape.LIST) {
            decision.category(OpenIntakeRenderCategory.DEPENDENT_SELECT);
        }
        return decision.build();
    }

    @Override
    public Object normalize(IOpenIntakeFieldDefinition field, Object rawValue) {
        return normalizer.normalize(field, rawValue);
    }

    @Override
    public Object emptyValue(IOpenIntakeFieldDefinition field) {
        return normalizer.emptyValue(field);
    }

    @Override
    public boolean isRequirementSatisfied(IOpenIntakeFieldDefinition field, Object normalizedValue) {
        return RequiredValueChecker.isSatisfied(field, normalizedValue);
    }

    private static List<FieldOption> copyOptions(List<? extends IOpenIntakeFieldOption> options) {
        if (options == null) {
            return List.of();
        }
        return options.stream()
                .map(option -> option instanceof FieldOption
                        ? (FieldOption) option
                        : FieldOption.of(option.getValue(), option.getLabel()))
                .collect(Collectors.toList());
    }
}
