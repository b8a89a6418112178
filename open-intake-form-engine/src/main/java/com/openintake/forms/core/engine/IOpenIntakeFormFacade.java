package com.openintake.forms.core.engine;

import com.openintake.forms.core.engine.access.IOpenIntakeRoleAccessEvaluator;
import com.openintake.forms.core.engine.assignment.IOpenIntakeAutoAssignmentHeuristic;
import com.openintake.forms.core.engine.config.OpenIntakeFormEngineConfig;
import com.openintake.forms.core.engine.dependent.IOpenIntakeDependentFieldResolver;
import com.openintake.forms.core.engine.layout.IOpenIntakeLayoutService;
import com.openintake.forms.core.engine.provenance.IOpenIntakeFieldProvenanceLoader;
import com.openintake.forms.core.engine.registry.FieldRegistry;
import com.openintake.forms.core.engine.registry.IOpenIntakeFieldRegistryBuilder;
import com.openintake.forms.core.engine.render.IOpenIntakeFieldTypeResolver;
import com.openintake.forms.core.engine.session.FormSession;
import com.openintake.forms.integration.contract.IOpenIntakeFormContext;
import com.openintake.forms.integration.contract.layout.IOpenIntakeLayoutDocument;
import reactor.core.publisher.Mono;

public interface IOpenIntakeFormFacade {

    OpenIntakeFormEngineConfig getConfig();

    IOpenIntakeFieldProvenanceLoader getProvenanceLoader();

    IOpenIntakeFieldRegistryBuilder getRegistryBuilder();

    IOpenIntakeFieldTypeResolver getTypeResolver();

    IOpenIntakeDependentFieldResolver getDependentFieldResolver();

    IOpenIntakeLayoutService getLayoutService();

    IOpenIntakeRoleAccessEvaluator getAccessEvaluator();

    IOpenIntakeAutoAssignmentHeuristic getAutoAssignmentHeuristic();

    /**
     * A session that has not loaded anything yet.
     */
    FormSession newSession();

    /**
     * Opens a session for a new submission and emits it once loading has settled.
     */
    Mono<FormSession> openSession(IOpenIntakeFormContext context);

    /**
     * Opens a session resuming a stored draft.
     */
    Mono<FormSession> openSession(IOpenIntakeFormContext context, String recordId);

    /**
     * The merged field registry of a context, as the designer sees it.
     */
    Mono<FieldRegistry> loadFieldRegistry(IOpenIntakeFormContext context);

    /**
     * The active layout of a screen in its persisted JSON shape. Empty when none is published.
     */
    Mono<String> exportLayout(String screenId);

    /**
     * Reads a layout from its persisted JSON shape and saves it.
     */
    Mono<IOpenIntakeLayoutDocument> importLayout(String json, IOpenIntakeFormContext actor);
}
