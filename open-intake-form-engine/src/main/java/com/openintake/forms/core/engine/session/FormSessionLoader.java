package com.openintake.forms.core.engine.session;

import com.openintake.forms.core.engine.access.IOpenIntakeRoleAccessEvaluator;
import com.openintake.forms.core.engine.config.OpenIntakeFormEngineConfig;
import com.openintake.forms.core.engine.layout.IOpenIntakeLayoutService;
import com.openintake.forms.core.engine.provenance.IOpenIntakeFieldProvenanceLoader;
import com.openintake.forms.core.engine.registry.FieldRegistry;
import com.openintake.forms.core.engine.registry.IOpenIntakeFieldRegistryBuilder;
import com.openintake.forms.core.exception.codes.OpenIntakeInternalErrorCodes;
import com.openintake.forms.integration.contract.IOpenIntakeFormContext;
import com.openintake.forms.integration.contract.layout.IOpenIntakeLayoutDocument;
import com.openintake.forms.integration.contract.source.IOpenIntakeMasterDataProvider;
import com.openintake.forms.integration.enumerations.OpenIntakeLayoutType;
import com.openintake.forms.integration.models.layout.LayoutDocument;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Joins every fetch a screen depends on and turns the result into a {@link FormView}.
 *
 * <p>Field sources, master data, the layout and the access rules are fetched concurrently.
 * The registry is built only once all of them have settled. Field sources, master data and
 * access rules degrade to empty on failure; a missing layout yields
 * {@link FormViewState#NOT_CONFIGURED} and a failing layout fetch yields
 * {@link FormViewState#FAILED}.</p>
 */
@Slf4j
public class FormSessionLoader {

    private final IOpenIntakeFieldProvenanceLoader provenanceLoader;
    private final IOpenIntakeMasterDataProvider masterDataProvider;
    private final IOpenIntakeFieldRegistryBuilder registryBuilder;
    private final IOpenIntakeLayoutService layoutService;
    private final IOpenIntakeRoleAccessEvaluator accessEvaluator;
    private final OpenIntakeFormEngineConfig config;

    public FormSessionLoader(IOpenIntakeFieldProvenanceLoader provenanceLoader,
                             IOpenIntakeMasterDataProvider masterDataProvider,
                             IOpenIntakeFieldRegistryBuilder registryBuilder,
                             IOpenIntakeLayoutService layoutService,
                             IOpenIntakeRoleAccessEvaluator accessEvaluator,
                             OpenIntakeFormEngineConfig config) {
        this.provenanceLoader = provenanceLoader;
        this.masterDataProvider = masterDataProvider;
        this.registryBuilder = registryBuilder;
        this.layoutService = layoutService;
        this.accessEvaluator = accessEvaluator;
        this.config = config;
    }

    public Mono<FormView> load(IOpenIntakeFormContext context) {
        OpenIntakeLayoutType layoutType = OpenIntakeLayoutType.forWorkflowStage(context.getWorkflowStage());

        Mono<Optional<IOpenIntakeLayoutDocument>> layout = Mono.defer(
                        () -> layoutService.loadActiveLayout(context.getScreenId(), layoutType))
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());

        return Mono.zip(provenanceLoader.loadFieldSources(context),
                        loadMasterData(context),
                        layout,
                        accessEvaluator.loadRuleSet(context.getScreenId(), context.getRole()))
                .flatMap(joined -> {
                    FieldRegistry registry = registryBuilder.build(joined.getT1(), joined.getT2());
                    if (joined.getT3().isEmpty()) {
                        log.info("Screen {} has no active {} layout", context.getScreenId(), layoutType.getWireName());
                        return Mono.just(FormView.notConfigured(context, registry, joined.getT1().getUnavailableSources()));
                    }
                    return layoutService.ensurePopulated(joined.getT3().get(), context, registry)
                            .map(populated -> FormView.builder()
                                    .state(FormViewState.READY)
                                    .context(context)
                                    .layout(LayoutDocument.from(populated).withSortedSections())
                                    .registry(registry)
                                    .accessRules(joined.getT4())
                                    .unavailableSources(joined.getT1().getUnavailableSources())
                                    .build());
                })
                .onErrorResume(e -> {
                    log.error("Loading screen {} failed", context.getScreenId(), e);
                    return Mono.just(FormView.failed(context, e));
                });
    }

    /**
     * Builds the field registry of a context without loading a layout, for the designer.
     */
    public Mono<FieldRegistry> loadRegistry(IOpenIntakeFormContext context) {
        return Mono.zip(provenanceLoader.loadFieldSources(context), loadMasterData(context))
                .map(joined -> registryBuilder.build(joined.getT1(), joined.getT2()));
    }

    private Mono<Map<String, List<String>>> loadMasterData(IOpenIntakeFormContext context) {
        if (masterDataProvider == null) {
            return Mono.just(Collections.emptyMap());
        }
        return Mono.defer(() -> masterDataProvider.loadActiveLists(context))
                .timeout(config.getSourceFetchTimeout())
                .defaultIfEmpty(Collections.emptyMap())
                .onErrorResume(e -> {
                    log.warn("[{}] Master data unavailable, treated as empty: {}",
                            OpenIntakeInternalErrorCodes.FIELD_SOURCE_UNAVAILABLE.getErrorCode(), e.toString());
                    return Mono.just(Collections.emptyMap());
                });
    }
}
