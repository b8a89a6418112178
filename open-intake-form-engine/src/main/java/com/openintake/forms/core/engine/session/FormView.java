package com.openintake.forms.core.engine.session;

import com.openintake.forms.core.engine.access.AccessRuleSet;
import com.openintake.forms.core.engine.registry.FieldRegistry;
import com.openintake.forms.integration.contract.IOpenIntakeFormContext;
import com.openintake.forms.integration.enumerations.OpenIntakeFieldProvenance;
import com.openintake.forms.integration.models.layout.LayoutDocument;
import com.openintake.forms.integration.models.layout.SectionDefinition;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Set;

/**
 * Everything a screen needs before it can draw a form: the joined result of the field
 * sources, the layout and the access rules for one context.
 */
@Data
@Builder(toBuilder = true)
public class FormView {

    private final FormViewState state;

    private final IOpenIntakeFormContext context;

    private final LayoutDocument layout;

    @Builder.Default
    private final FieldRegistry registry = FieldRegistry.empty();

    private final AccessRuleSet accessRules;

    /**
     * Sources that failed or timed out and were treated as empty.
     */
    @Builder.Default
    private final Set<OpenIntakeFieldProvenance> unavailableSources = Set.of();

    private final Throwable error;

    public static FormView loading(IOpenIntakeFormContext context) {
        return FormView.builder().state(FormViewState.LOADING).context(context).build();
    }

    public static FormView notConfigured(IOpenIntakeFormContext context, FieldRegistry registry,
                                         Set<OpenIntakeFieldProvenance> unavailableSources) {
        return FormView.builder()
                .state(FormViewState.NOT_CONFIGURED)
                .context(context)
                .registry(registry)
                .unavailableSources(unavailableSources)
                .build();
    }

    public static FormView failed(IOpenIntakeFormContext context, Throwable error) {
        return FormView.builder().state(FormViewState.FAILED).context(context).error(error).build();
    }

    public boolean isReady() {
        return state == FormViewState.READY;
    }

    public List<SectionDefinition> getSteps() {
        return layout == null ? List.of() : layout.getSections();
    }
}
