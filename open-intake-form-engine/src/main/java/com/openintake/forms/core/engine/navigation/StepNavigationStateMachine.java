package com.openintake.forms.core.engine.navigation;

import com.openintake.forms.core.engine.access.AccessRuleSet;
import com.openintake.forms.core.engine.access.FieldPermission;
import com.openintake.forms.core.engine.config.OpenIntakeFormEngineConfig;
import com.openintake.forms.core.engine.draft.DraftPersistenceCoordinator;
import com.openintake.forms.core.engine.registry.FieldRegistry;
import com.openintake.forms.core.engine.render.FieldValidationError;
import com.openintake.forms.core.engine.render.FieldValueValidator;
import com.openintake.forms.core.engine.render.IOpenIntakeFieldTypeResolver;
import com.openintake.forms.core.engine.render.RenderDecision;
import com.openintake.forms.core.exception.submission.SubmissionClosedException;
import com.openintake.forms.core.util.CommonUtil;
import com.openintake.forms.integration.enumerations.OpenIntakeFieldProvenance;
import com.openintake.forms.integration.enumerations.OpenIntakeSubmissionStatus;
import com.openintake.forms.integration.models.field.FieldDefinition;
import com.openintake.forms.integration.models.layout.LayoutDocument;
import com.openintake.forms.integration.models.layout.SectionDefinition;
import com.openintake.forms.integration.models.submission.SubmissionState;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Drives one form-filling session through the steps of a layout.
 *
 * <h2>States</h2>
 * <p>Steps are numbered {@code 1..N} in section order. Moving forward is gated on the
 * validation of the current step; moving back is always allowed. Once submitted the
 * session is terminal and every mutation raises {@link SubmissionClosedException}.</p>
 *
 * <h2>Persistence</h2>
 * <p>Moving past the checkpoint step creates the backing draft. From then on every step
 * transition schedules a save of the values and the new step. Writes are fire-and-forget
 * and sequenced by the {@link DraftPersistenceCoordinator}; {@link #awaitPersistence()}
 * waits for them.</p>
 *
 * <p>Not thread-safe: one instance serves one user acting sequentially.</p>
 */
@Slf4j
public class StepNavigationStateMachine {

    private final List<SectionDefinition> sections;
    private final FieldRegistry registry;
    private final AccessRuleSet accessRules;
    private final IOpenIntakeFieldTypeResolver typeResolver;
    private final FieldValueValidator valueValidator;
    private final DraftPersistenceCoordinator persistence;
    private final List<IOpenIntakeFieldChangeHook> hooks;
    private final Integer checkpointStep;
    private final String chainKey;

    private final Map<String, Object> values;
    private int currentStep;
    private OpenIntakeSubmissionStatus status;
    private volatile String recordId;
    private boolean draftRequested;

    @Builder
    private StepNavigationStateMachine(LayoutDocument layout,
                                       FieldRegistry registry,
                                       AccessRuleSet accessRules,
                                       IOpenIntakeFieldTypeResolver typeResolver,
                                       FieldValueValidator valueValidator,
                                       DraftPersistenceCoordinator persistence,
                                       List<IOpenIntakeFieldChangeHook> hooks,
                                       OpenIntakeFormEngineConfig config,
                                       SubmissionState initialState) {
        this.sections = List.copyOf(Objects.requireNonNull(layout, "layout").withSortedSections().getSections());
        this.registry = registry == null ? FieldRegistry.empty() : registry;
        this.accessRules = accessRules == null ? AccessRuleSet.noRules(layout.getScreenId(), null) : accessRules;
        this.typeResolver = Objects.requireNonNull(typeResolver, "typeResolver");
        this.valueValidator = valueValidator == null ? new FieldValueValidator() : valueValidator;
        this.persistence = persistence;
        this.hooks = hooks == null ? List.of() : List.copyOf(hooks);

        OpenIntakeFormEngineConfig effectiveConfig = config == null ? OpenIntakeFormEngineConfig.defaultConfig() : config;
        this.checkpointStep = resolveCheckpoint(effectiveConfig.getCheckpointStep());

        SubmissionState state = initialState == null ? SubmissionState.newSubmission() : initialState;
        this.values = new LinkedHashMap<>(state.getValues());
        this.currentStep = clamp(state.getCurrentStep());
        this.status = state.getStatus();
        this.recordId = state.getRecordId();
        this.draftRequested = state.getRecordId() != null;
        this.chainKey = state.getRecordId() != null ? state.getRecordId() : "session-" + UUID.randomUUID();
    }

    // ========================================================================
    // NAVIGATION
    // ========================================================================

    /**
     * Validates the current step and advances one step, staying put on the last step.
     */
    public StepTransitionResult next() {
        ensureOpen();
        int from = currentStep;
        StepValidationReport report = validateStep(from);
        if (!report.isValid()) {
            log.debug("Next refused on step {}: missing={}, errors={}",
                    from, report.getMissingFields(), report.getErrorMessages());
            return StepTransitionResult.refused(from, report);
        }
        return moveTo(from, clamp(from + 1));
    }

    public StepTransitionResult previous() {
        ensureOpen();
        int from = currentStep;
        return moveTo(from, clamp(from - 1));
    }

    /**
     * Moves to any earlier step freely. Moving forward first validates the current step.
     *
     * @throws IllegalArgumentException if the step does not exist
     */
    public StepTransitionResult jumpTo(int step) {
        ensureOpen();
        if (step < 1 || step > Math.max(1, getStepCount())) {
            throw new IllegalArgumentException("Step " + step + " out of range 1.." + getStepCount());
        }
        int from = currentStep;
        if (step > from) {
            StepValidationReport report = validateStep(from);
            if (!report.isValid()) {
                return StepTransitionResult.refused(from, report);
            }
        }
        return moveTo(from, step);
    }

    private StepTransitionResult moveTo(int from, int to) {
        if (to == from) {
            return StepTransitionResult.unchanged(from);
        }
        currentStep = to;
        if (to > from && checkpointStep != null && to > checkpointStep) {
            requestDraft();
        }
        scheduleSave();
        return StepTransitionResult.moved(from, to);
    }

    // ========================================================================
    // VALIDATION
    // ========================================================================

    /**
     * Checks the required fields and value formats of one step.
     * Hidden fields, read-only fields, blocked dependents and fields unknown to the registry
     * are skipped.
     */
    public StepValidationReport validateStep(int step) {
        SectionDefinition section = sectionAt(step);
        if (section == null) {
            return StepValidationReport.valid(step);
        }
        Set<String> overrides = new LinkedHashSet<>(CommonUtil.nonNullList(section.getRequiredOverrides()));
        List<String> missingLabels = new ArrayList<>();
        List<String> missingNames = new ArrayList<>();
        List<FieldValidationError> errors = new ArrayList<>();

        for (String fieldName : CommonUtil.nonNullList(section.getFieldNames())) {
            FieldDefinition field = registry.get(fieldName);
            if (field == null) {
                continue;
            }
            FieldPermission permission = accessRules.evaluate(fieldName);
            if (!permission.isCanView() || !permission.isCanEdit()) {
                continue;
            }
            RenderDecision decision = typeResolver.resolve(field, values.get(fieldName), values);
            if (!decision.isEditable()) {
                continue;
            }
            boolean required = field.isRequired() || overrides.contains(fieldName);
            if (required && !typeResolver.isRequirementSatisfied(field, decision.getNormalizedValue())) {
                missingLabels.add(decision.getLabel());
                missingNames.add(fieldName);
                continue;
            }
            errors.addAll(valueValidator.validate(field, decision.getLabel(), decision.getNormalizedValue()));
        }
        return StepValidationReport.builder()
                .step(step)
                .missingFields(missingLabels)
                .missingFieldNames(missingNames)
                .validationErrors(errors)
                .build();
    }

    // ========================================================================
    // VALUES
    // ========================================================================

    /**
     * Stores a new value for a field and runs the change hooks.
     * Fields the role may not edit are left unchanged.
     *
     * @return names of every field whose value changed
     */
    public Set<String> changeField(String fieldName, Object rawValue) {
        ensureOpen();
        if (!accessRules.evaluate(fieldName).isCanEdit()) {
            log.debug("Ignoring change of read-only field {} for role {}", fieldName, accessRules.getRole());
            return Set.of();
        }
        FieldDefinition field = registry.get(fieldName);
        Object normalized = field == null ? rawValue : typeResolver.normalize(field, rawValue);
        Object previous = values.get(fieldName);
        values.put(fieldName, normalized);
        if (Objects.equals(previous, normalized)) {
            return Set.of();
        }

        Set<String> changed = new LinkedHashSet<>();
        changed.add(fieldName);
        FieldChangeEvent event = new FieldChangeEvent(fieldName, previous, normalized, registry, typeResolver);
        for (IOpenIntakeFieldChangeHook hook : hooks) {
            if (hook.appliesTo(fieldName)) {
                changed.addAll(hook.apply(event, values));
            }
        }
        return changed;
    }

    public Object getValue(String fieldName) {
        return values.get(fieldName);
    }

    public Map<String, Object> getValues() {
        return Collections.unmodifiableMap(values);
    }

    // ========================================================================
    // SUBMISSION
    // ========================================================================

    /**
     * Validates every step and persists the values as submitted.
     * Refuses on the first invalid step and moves the session there.
     */
    public Mono<StepTransitionResult> submit() {
        return Mono.defer(() -> {
            ensureOpen();
            for (int step = 1; step <= getStepCount(); step++) {
                StepValidationReport report = validateStep(step);
                if (!report.isValid()) {
                    int from = currentStep;
                    currentStep = step;
                    return Mono.just(StepTransitionResult.refused(from, report));
                }
            }
            if (persistence == null) {
                status = OpenIntakeSubmissionStatus.SUBMITTED;
                return Mono.just(StepTransitionResult.submitted(currentStep, recordId));
            }
            requestDraft();
            return persistence.scheduleSubmit(chainKey, () -> recordId, values)
                    .then(Mono.fromCallable(() -> {
                        status = OpenIntakeSubmissionStatus.SUBMITTED;
                        return StepTransitionResult.submitted(currentStep, recordId);
                    }));
        });
    }

    /**
     * Completes once every draft write scheduled so far has finished.
     */
    public Mono<Void> awaitPersistence() {
        return persistence == null ? Mono.empty() : persistence.awaitPending(chainKey);
    }

    private void requestDraft() {
        if (persistence == null || recordId != null || draftRequested) {
            return;
        }
        draftRequested = true;
        persistence.createDraft(chainKey, values, created -> recordId = created)
                .subscribe(
                        created -> log.debug("Session {} now backed by draft {}", chainKey, created),
                        e -> {
                            draftRequested = false;
                            log.debug("Draft creation for session {} will be retried on the next forward move", chainKey);
                        });
    }

    private void scheduleSave() {
        if (persistence == null || (!draftRequested && recordId == null)) {
            return;
        }
        persistence.scheduleSave(chainKey, () -> recordId, values, currentStep);
    }

    // ========================================================================
    // STATE
    // ========================================================================

    public SubmissionState snapshot() {
        return SubmissionState.builder()
                .recordId(recordId)
                .values(new LinkedHashMap<>(values))
                .currentStep(currentStep)
                .status(status)
                .build();
    }

    public int getCurrentStep() {
        return currentStep;
    }

    public int getStepCount() {
        return sections.size();
    }

    public List<SectionDefinition> getSections() {
        return sections;
    }

    public SectionDefinition getCurrentSection() {
        return sectionAt(currentStep);
    }

    public SectionDefinition sectionAt(int step) {
        return step >= 1 && step <= sections.size() ? sections.get(step - 1) : null;
    }

    /**
     * The step whose completion creates the draft, or null when the draft is created at submit.
     */
    public Integer getCheckpointStep() {
        return checkpointStep;
    }

    public String getRecordId() {
        return recordId;
    }

    public boolean isSubmitted() {
        return status == OpenIntakeSubmissionStatus.SUBMITTED;
    }

    private void ensureOpen() {
        if (isSubmitted()) {
            throw new SubmissionClosedException(recordId);
        }
    }

    private int clamp(int step) {
        return Math.max(1, Math.min(step, Math.max(1, sections.size())));
    }

    /**
     * An explicit checkpoint wins. Otherwise the step before the first step collecting
     * requirement fields, never earlier than step 1. When step 1 itself collects requirements
     * there is no earlier step, so the draft is created on leaving step 1.
     */
    private Integer resolveCheckpoint(Integer configured) {
        if (configured != null) {
            return Math.min(configured, Math.max(1, sections.size()));
        }
        for (int index = 0; index < sections.size(); index++) {
            for (String fieldName : CommonUtil.nonNullList(sections.get(index).getFieldNames())) {
                FieldDefinition field = registry.get(fieldName);
                if (field != null && field.getProvenance() == OpenIntakeFieldProvenance.REQUIREMENT) {
                    return Math.max(1, index);
                }
            }
        }
        return null;
    }
}
