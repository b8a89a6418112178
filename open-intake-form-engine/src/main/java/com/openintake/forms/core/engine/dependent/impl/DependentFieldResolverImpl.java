package com.openintake.forms.core.engine.dependent.impl;

import com.openintake.forms.core.engine.dependent.DependentResolution;
import com.openintake.forms.core.engine.dependent.IOpenIntakeDependentFieldResolver;
import com.openintake.forms.integration.contract.field.IOpenIntakeFieldDefinition.IOpenIntakeFieldDependency;
import com.openintake.forms.integration.contract.field.IOpenIntakeFieldDefinition.IOpenIntakeFieldOption;
import com.openintake.forms.integration.models.field.FieldOption;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolution rules:
 * <ol>
 *   <li>no dependency: free text</li>
 *   <li>parent empty: blocked, with a "select the parent first" placeholder</li>
 *   <li>options configured for the parent value: options</li>
 *   <li>no options and custom values allowed: free text</li>
 *   <li>no options and no custom values: blocked, with a "no options" placeholder</li>
 * </ol>
 * A list-valued parent resolves to the union of the options of each of its values.
 */
public class DependentFieldResolverImpl implements IOpenIntakeDependentFieldResolver {

    private DependentFieldResolverImpl() {}

    private static final class SingletonHelper {
        private static final DependentFieldResolverImpl INSTANCE = new DependentFieldResolverImpl();
    }

    public static IOpenIntakeDependentFieldResolver getInstance() {
        return SingletonHelper.INSTANCE;
    }

    @Override
    public DependentResolution resolve(Object parentValue, IOpenIntakeFieldDependency dependency) {
        if (dependency == null) {
            return DependentResolution.freeText();
        }
        List<String> parentValues = parentValues(parentValue);
        if (parentValues.isEmpty()) {
            return DependentResolution.blocked("Select " + parentLabel(dependency) + " first");
        }

        Map<String, FieldOption> options = new LinkedHashMap<>();
        for (String value : parentValues) {
            List<? extends IOpenIntakeFieldOption> resolved = dependency.optionsFor(value);
            if (resolved == null) {
                continue;
            }
            for (IOpenIntakeFieldOption option : resolved) {
                if (option != null && option.getValue() != null) {
                    options.putIfAbsent(option.getValue(), FieldOption.of(option.getValue(), option.getLabel()));
                }
            }
        }

        if (!options.isEmpty()) {
            return DependentResolution.options(new ArrayList<>(options.values()));
        }
        if (dependency.isAllowCustomValue()) {
            return DependentResolution.freeText();
        }
        return DependentResolution.blocked("No options available for " + String.join(", ", parentValues));
    }

    private static String parentLabel(IOpenIntakeFieldDependency dependency) {
        if (dependency.getDependsOnLabel() != null && !dependency.getDependsOnLabel().isBlank()) {
            return dependency.getDependsOnLabel();
        }
        return dependency.getDependsOn() == null ? "the parent field" : dependency.getDependsOn();
    }

    private static List<String> parentValues(Object parentValue) {
        List<String> values = new ArrayList<>();
        if (parentValue instanceof Collection<?> collection) {
            for (Object item : collection) {
                addIfPresent(values, item);
            }
        } else {
            addIfPresent(values, parentValue);
        }
        return values;
    }

    private static void addIfPresent(List<String> values, Object item) {
        if (item == null) {
            return;
        }
        String text = item.toString().trim();
        if (!text.isEmpty()) {
            values.add(text);
        }
    }
}
