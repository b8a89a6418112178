package com.openintake.forms.core.engine.layout.impl;

import com.openintake.forms.core.engine.assignment.IOpenIntakeAutoAssignmentHeuristic;
import com.openintake.forms.core.engine.config.FallbackStepTemplate;
import com.openintake.forms.core.engine.config.OpenIntakeFormEngineConfig;
import com.openintake.forms.core.engine.layout.IOpenIntakeLayoutService;
import com.openintake.forms.core.engine.layout.LayoutValidator;
import com.openintake.forms.core.engine.registry.FieldRegistry;
import com.openintake.forms.core.exception.codes.OpenIntakeInternalErrorCodes;
import com.openintake.forms.core.exception.layout.LayoutAccessDeniedException;
import com.openintake.forms.core.exception.layout.LayoutConfigurationException;
import com.openintake.forms.core.models.LayoutViolation;
import com.openintake.forms.integration.contract.IOpenIntakeFormContext;
import com.openintake.forms.integration.contract.layout.IOpenIntakeLayoutDocument;
import com.openintake.forms.integration.contract.layout.IOpenIntakeLayoutRepository;
import com.openintake.forms.integration.enumerations.OpenIntakeErrorCategory;
import com.openintake.forms.integration.enumerations.OpenIntakeLayoutType;
import com.openintake.forms.integration.exception.OpenIntakeFormRuntimeException;
import com.openintake.forms.integration.models.layout.LayoutDocument;
import com.openintake.forms.integration.models.layout.SectionDefinition;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Layout service backed by a layout repository.
 *
 * <h2>Write pipeline</h2>
 * <ol>
 *   <li>tenant check against the incoming and the stored layout</li>
 *   <li>structural validation, all violations reported together</li>
 *   <li>store, with sections sorted by order</li>
 *   <li>supersede the previously active and default layouts of the screen</li>
 * </ol>
 */
@Slf4j
public class LayoutServiceImpl implements IOpenIntakeLayoutService {

    private final IOpenIntakeLayoutRepository repository;
    private final LayoutValidator validator;
    private final IOpenIntakeAutoAssignmentHeuristic assignmentHeuristic;
    private final OpenIntakeFormEngineConfig config;

    private final Set<String> populationAttempted = ConcurrentHashMap.newKeySet();
    private final Set<String> populationBlocked = ConcurrentHashMap.newKeySet();

    public LayoutServiceImpl(IOpenIntakeLayoutRepository repository, LayoutValidator validator,
                             IOpenIntakeAutoAssignmentHeuristic assignmentHeuristic,
                             OpenIntakeFormEngineConfig config) {
        this.repository = repository;
        this.validator = validator;
        this.assignmentHeuristic = assignmentHeuristic;
        this.config = config;
    }

    // ========================================================================
    // READ
    // ========================================================================

    @Override
    public Mono<IOpenIntakeLayoutDocument> loadActiveLayout(String screenId) {
        return activeLayouts(screenId)
                .flatMap(active -> Mono.justOrEmpty(
                        active.stream().filter(LayoutDocument::isDefault).findFirst()
                                .or(() -> active.stream().findFirst())))
                .map(LayoutServiceImpl::sorted);
    }

    @Override
    public Mono<IOpenIntakeLayoutDocument> loadActiveLayout(String screenId, OpenIntakeLayoutType layoutType) {
        return activeLayouts(screenId)
                .flatMap(active -> {
                    Optional<LayoutDocument> byType = active.stream()
                            .filter(layout -> layout.getLayoutType() == layoutType)
                            .sorted((a, b) -> Boolean.compare(b.isDefault(), a.isDefault()))
                            .findFirst();
                    return Mono.justOrEmpty(byType.or(() -> active.stream().filter(LayoutDocument::isDefault).findFirst()));
                })
                .map(LayoutServiceImpl::sorted);
    }

    private Mono<List<LayoutDocument>> activeLayouts(String screenId) {
        return Flux.defer(() -> repository.findByScreen(screenId))
                .map(LayoutDocument::from)
                .filter(LayoutDocument::isActive)
                .collectList();
    }

    // ========================================================================
    // WRITE
    // ========================================================================

    @Override
    public Mono<IOpenIntakeLayoutDocument> saveLayout(IOpenIntakeLayoutDocument layout, IOpenIntakeFormContext actor) {
        LayoutDocument candidate = LayoutDocument.from(layout);
        LayoutDocument owned = candidate.getTenantId() == null ? candidate.withTenantId(actor.getTenantId()) : candidate;

        return checkTenant(owned, actor)
                .then(Mono.defer(() -> validate(owned)))
                .flatMap(valid -> repository.save(valid))
                .map(LayoutDocument::from)
                .flatMap(saved -> supersede(saved, actor).thenReturn(saved))
                .doOnNext(saved -> log.info("Layout {} saved for screen {} (active={}, default={})",
                        saved.getId(), saved.getScreenId(), saved.isActive(), saved.isDefault()))
                .cast(IOpenIntakeLayoutDocument.class)
                .onErrorMap(e -> isAccessDenied(e) && !(e instanceof LayoutAccessDeniedException),
                        e -> new LayoutAccessDeniedException(owned.getId(), actor.getTenantId()))
                .doOnError(LayoutAccessDeniedException.class, e -> {
                    populationBlocked.add(owned.getId());
                    log.warn("Write to layout {} denied for tenant {}", owned.getId(), actor.getTenantId());
                });
    }

    @Override
    public Mono<IOpenIntakeLayoutDocument> publishLayout(String layoutId, IOpenIntakeFormContext actor) {
        return repository.findById(layoutId)
                .switchIfEmpty(Mono.error(() -> new IllegalArgumentException("Layout not found: " + layoutId)))
                .map(LayoutDocument::from)
                .flatMap(layout -> saveLayout(layout.withActive(true), actor))
                .doOnNext(published -> log.info("Layout {} published for screen {}",
                        published.getId(), published.getScreenId()));
    }

    private Mono<Void> checkTenant(LayoutDocument layout, IOpenIntakeFormContext actor) {
        if (!Objects.equals(layout.getTenantId(), actor.getTenantId())) {
            return Mono.error(new LayoutAccessDeniedException(layout.getId(), actor.getTenantId()));
        }
        return repository.findById(layout.getId())
                .map(LayoutDocument::from)
                .flatMap(stored -> stored.getTenantId() != null && !stored.getTenantId().equals(actor.getTenantId())
                        ? Mono.<Void>error(new LayoutAccessDeniedException(layout.getId(), actor.getTenantId()))
                        : Mono.<Void>empty())
                .then();
    }

    private Mono<LayoutDocument> validate(LayoutDocument layout) {
        List<LayoutViolation> violations = validator.validate(layout);
        if (violations.isEmpty()) {
            return Mono.just(layout.withSortedSections());
        }
        OpenIntakeInternalErrorCodes code = layout.isTemplate() && layout.isDefault()
                ? OpenIntakeInternalErrorCodes.LAYOUT_TEMPLATE_CANNOT_BE_DEFAULT
                : OpenIntakeInternalErrorCodes.LAYOUT_STRUCTURE_INVALID;
        log.debug("Layout {} rejected with {} violations: {}", layout.getId(), violations.size(), violations);
        return Mono.error(new LayoutConfigurationException(code, layout.getId(), violations));
    }

    private Mono<Void> supersede(LayoutDocument saved, IOpenIntakeFormContext actor) {
        if (!saved.isActive() && !saved.isDefault()) {
            return Mono.empty();
        }
        return Flux.defer(() -> repository.findByScreen(saved.getScreenId()))
                .map(LayoutDocument::from)
                .filter(other -> !other.getId().equals(saved.getId()))
                .filter(other -> Objects.equals(other.getTenantId(), actor.getTenantId()))
                .concatMap(other -> {
                    LayoutDocument updated = other;
                    if (saved.isActive() && other.isActive() && other.getLayoutType() == saved.getLayoutType()) {
                        updated = updated.withActive(false);
                        log.info("Layout {} superseded by {}", other.getId(), saved.getId());
                    }
                    if (saved.isDefault() && other.isDefault()) {
                        updated = updated.withDefault(false);
                    }
                    return updated == other ? Mono.empty() : repository.save(updated);
                })
                .then();
    }

    private static boolean isAccessDenied(Throwable e) {
        return OpenIntakeFormRuntimeException.hasCategory(e, OpenIntakeErrorCategory.ACCESS_DENIED);
    }

    // ========================================================================
    // AUTO-POPULATION
    // ========================================================================

    @Override
    public Mono<IOpenIntakeLayoutDocument> ensurePopulated(IOpenIntakeLayoutDocument layout,
                                                           IOpenIntakeFormContext actor,
                                                           FieldRegistry registry) {
        LayoutDocument document = LayoutDocument.from(layout);
        if (!document.getSections().isEmpty() || !document.isDefault() || document.isTemplate()) {
            return Mono.just(document);
        }
        if (populationBlocked.contains(document.getId())) {
            return Mono.just(document);
        }
        if (!config.isAdministrativeRole(actor.getRole())
                || !Objects.equals(actor.getTenantId(), document.getTenantId())) {
            log.debug("Skipping auto-population of layout {}: role={}, tenant={}",
                    document.getId(), actor.getRole(), actor.getTenantId());
            return Mono.just(document);
        }
        if (!populationAttempted.add(document.getId())) {
            return Mono.just(document);
        }

        LayoutDocument populated = document.withSections(fallbackSections(registry));
        log.info("Auto-populating layout {} with {} fallback steps", document.getId(), populated.getSections().size());
        return saveLayout(populated, actor)
                .onErrorResume(LayoutAccessDeniedException.class, e -> Mono.just(document));
    }

    @Override
    public boolean isAutoPopulationBlocked(String layoutId) {
        return populationBlocked.contains(layoutId);
    }

    private List<SectionDefinition> fallbackSections(FieldRegistry registry) {
        List<SectionDefinition> sections = new ArrayList<>();
        Set<String> reserved = new HashSet<>();
        for (FallbackStepTemplate template : config.getFallbackSteps()) {
            List<String> standard = new ArrayList<>();
            for (String fieldName : template.getStandardFields()) {
                if (reserved.add(fieldName)) {
                    standard.add(fieldName);
                }
            }
            sections.add(SectionDefinition.builder()
                    .id("step-" + template.getId())
                    .title(template.getTitle())
                    .description(template.getDescription())
                    .order(template.getId())
                    .fieldNames(standard)
                    .build());
        }

        FieldRegistry fields = registry == null ? FieldRegistry.empty() : registry;
        Map<String, List<String>> assigned = assignmentHeuristic.assign(sections, fields, reserved);
        List<SectionDefinition> result = new ArrayList<>();
        for (SectionDefinition section : sections) {
            List<String> fieldNames = new ArrayList<>(section.getFieldNames());
            fieldNames.addAll(assigned.getOrDefault(section.getId(), List.of()));
            result.add(section.withFieldNames(fieldNames));
        }
        return result;
    }

    private static IOpenIntakeLayoutDocument sorted(LayoutDocument layout) {
        return layout.withSortedSections();
    }
}
