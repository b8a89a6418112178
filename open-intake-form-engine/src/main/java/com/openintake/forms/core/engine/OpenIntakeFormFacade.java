package com.openintake.forms.core.engine;

import com.openintake.forms.core.engine.access.IOpenIntakeRoleAccessEvaluator;
import com.openintake.forms.core.engine.access.impl.RoleAccessEvaluatorImpl;
import com.openintake.forms.core.engine.assignment.IOpenIntakeAutoAssignmentHeuristic;
import com.openintake.forms.core.engine.assignment.impl.KeywordAutoAssignmentHeuristic;
import com.openintake.forms.core.engine.config.OpenIntakeFormEngineConfig;
import com.openintake.forms.core.engine.dependent.IOpenIntakeDependentFieldResolver;
import com.openintake.forms.core.engine.dependent.impl.DependentFieldResolverImpl;
import com.openintake.forms.core.engine.layout.IOpenIntakeLayoutService;
import com.openintake.forms.core.engine.layout.LayoutValidator;
import com.openintake.forms.core.engine.layout.impl.InMemoryLayoutRepository;
import com.openintake.forms.core.engine.layout.impl.LayoutServiceImpl;
import com.openintake.forms.core.engine.misc.OpenIntakeObjectMapper;
import com.openintake.forms.core.engine.navigation.IOpenIntakeFieldChangeHook;
import com.openintake.forms.core.engine.navigation.hooks.FieldChangeHooks;
import com.openintake.forms.core.engine.provenance.IOpenIntakeFieldProvenanceLoader;
import com.openintake.forms.core.engine.provenance.impl.FieldProvenanceLoaderImpl;
import com.openintake.forms.core.engine.registry.FieldConfigParser;
import com.openintake.forms.core.engine.registry.FieldRegistry;
import com.openintake.forms.core.engine.registry.IOpenIntakeFieldRegistryBuilder;
import com.openintake.forms.core.engine.registry.impl.FieldRegistryBuilderImpl;
import com.openintake.forms.core.engine.render.FieldValueNormalizer;
import com.openintake.forms.core.engine.render.FieldValueValidator;
import com.openintake.forms.core.engine.render.IOpenIntakeFieldTypeResolver;
import com.openintake.forms.core.engine.render.impl.FieldTypeResolverImpl;
import com.openintake.forms.core.engine.serialization.LayoutDocumentSerializer;
import com.openintake.forms.core.engine.session.FormSession;
import com.openintake.forms.core.engine.session.FormSessionLoader;
import com.openintake.forms.core.exception.serialization.LayoutSerializationException;
import com.openintake.forms.integration.contract.IOpenIntakeFormContext;
import com.openintake.forms.integration.contract.access.IOpenIntakeAccessRuleRepository;
import com.openintake.forms.integration.contract.layout.IOpenIntakeLayoutDocument;
import com.openintake.forms.integration.contract.layout.IOpenIntakeLayoutRepository;
import com.openintake.forms.integration.contract.source.IOpenIntakeFieldSourceProvider;
import com.openintake.forms.integration.contract.source.IOpenIntakeMasterDataProvider;
import com.openintake.forms.integration.contract.submission.IOpenIntakeDraftRepository;
import com.openintake.forms.integration.contract.widget.IOpenIntakeWidgetRenderer;
import lombok.Builder;
import lombok.Singular;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Wires the engine components around the collaborators a host application supplies.
 *
 * <pre>{@code
 * IOpenIntakeFormFacade facade = OpenIntakeFormFacade.builder()
 *     .fieldSource(schemaFields)
 *     .fieldSource(customFields)
 *     .masterDataProvider(masterData)
 *     .layoutRepository(layouts)
 *     .accessRuleRepository(rules)
 *     .draftRepository(drafts)
 *     .build();
 * }</pre>
 *
 * <p>Without a layout repository layouts are kept in memory. Without an access rule
 * repository every field is visible and editable. Without a draft repository nothing
 * is persisted.</p>
 */
@Slf4j
public class OpenIntakeFormFacade implements IOpenIntakeFormFacade {

    private final OpenIntakeFormEngineConfig config;
    private final IOpenIntakeFieldProvenanceLoader provenanceLoader;
    private final IOpenIntakeFieldRegistryBuilder registryBuilder;
    private final IOpenIntakeDependentFieldResolver dependentFieldResolver;
    private final IOpenIntakeFieldTypeResolver typeResolver;
    private final FieldValueValidator valueValidator;
    private final IOpenIntakeAutoAssignmentHeuristic autoAssignmentHeuristic;
    private final IOpenIntakeLayoutService layoutService;
    private final IOpenIntakeRoleAccessEvaluator accessEvaluator;
    private final IOpenIntakeDraftRepository draftRepository;
    private final IOpenIntakeWidgetRenderer widgetRenderer;
    private final List<IOpenIntakeFieldChangeHook> changeHooks;
    private final FormSessionLoader sessionLoader;

    @Builder
    private OpenIntakeFormFacade(OpenIntakeFormEngineConfig config,
                                 @Singular List<IOpenIntakeFieldSourceProvider> fieldSources,
                                 IOpenIntakeMasterDataProvider masterDataProvider,
                                 IOpenIntakeLayoutRepository layoutRepository,
                                 IOpenIntakeAccessRuleRepository accessRuleRepository,
                                 IOpenIntakeDraftRepository draftRepository,
                                 IOpenIntakeWidgetRenderer widgetRenderer) {
        this.config = config == null ? OpenIntakeFormEngineConfig.defaultConfig() : config;
        this.config.validate();

        this.provenanceLoader = new FieldProvenanceLoaderImpl(fieldSources, this.config);
        this.registryBuilder = new FieldRegistryBuilderImpl(this.config, new FieldConfigParser());
        this.dependentFieldResolver = DependentFieldResolverImpl.getInstance();
        this.typeResolver = new FieldTypeResolverImpl(dependentFieldResolver,
                new FieldValueNormalizer(OpenIntakeObjectMapper.getInstance()));
        this.valueValidator = new FieldValueValidator();
        this.autoAssignmentHeuristic = new KeywordAutoAssignmentHeuristic(this.config.getKeywordStepMappings());
        this.layoutService = new LayoutServiceImpl(
                layoutRepository == null ? new InMemoryLayoutRepository() : layoutRepository,
                new LayoutValidator(), autoAssignmentHeuristic, this.config);
        this.accessEvaluator = new RoleAccessEvaluatorImpl(accessRuleRepository, this.config);
        this.draftRepository = draftRepository;
        this.widgetRenderer = widgetRenderer;
        this.changeHooks = FieldChangeHooks.defaultHooks(this.config);
        this.sessionLoader = new FormSessionLoader(provenanceLoader, masterDataProvider, registryBuilder,
                layoutService, accessEvaluator, this.config);

        log.info("Form engine initialised with {} field sources, persistence {}",
                fieldSources.size(), draftRepository == null ? "disabled" : "enabled");
    }

    @Override
    public OpenIntakeFormEngineConfig getConfig() {
        return config;
    }

    @Override
    public IOpenIntakeFieldProvenanceLoader getProvenanceLoader() {
        return provenanceLoader;
    }

    @Override
    public IOpenIntakeFieldRegistryBuilder getRegistryBuilder() {
        return registryBuilder;
    }

    @Override
    public IOpenIntakeFieldTypeResolver getTypeResolver() {
        return typeResolver;
    }

    @Override
    public IOpenIntakeDependentFieldResolver getDependentFieldResolver() {
        return dependentFieldResolver;
    }

    @Override
    public IOpenIntakeLayoutService getLayoutService() {
        return layoutService;
    }

    @Override
    public IOpenIntakeRoleAccessEvaluator getAccessEvaluator() {
        return accessEvaluator;
    }

    @Override
    public IOpenIntakeAutoAssignmentHeuristic getAutoAssignmentHeuristic() {
        return autoAssignmentHeuristic;
    }

    @Override
    public FormSession newSession() {
        return new FormSession(sessionLoader, typeResolver, valueValidator, draftRepository,
                widgetRenderer, changeHooks, config);
    }

    @Override
    public Mono<FormSession> openSession(IOpenIntakeFormContext context) {
        return openSession(context, null);
    }

    @Override
    public Mono<FormSession> openSession(IOpenIntakeFormContext context, String recordId) {
        return Mono.defer(() -> {
            FormSession session = newSession();
            return session.open(context, recordId).thenReturn(session);
        });
    }

    @Override
    public Mono<FieldRegistry> loadFieldRegistry(IOpenIntakeFormContext context) {
        return sessionLoader.loadRegistry(context);
    }

    @Override
    public Mono<String> exportLayout(String screenId) {
        return layoutService.loadActiveLayout(screenId)
                .flatMap(layout -> {
                    try {
                        return Mono.just(LayoutDocumentSerializer.toJson(layout));
                    } catch (LayoutSerializationException e) {
                        return Mono.error(e);
                    }
                });
    }

    @Override
    public Mono<IOpenIntakeLayoutDocument> importLayout(String json, IOpenIntakeFormContext actor) {
        return Mono.fromCallable(() -> LayoutDocumentSerializer.fromJson(json))
                .flatMap(layout -> layoutService.saveLayout(layout, actor));
    }
}
