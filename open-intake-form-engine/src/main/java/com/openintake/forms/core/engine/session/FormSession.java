package com.openintake.forms.core.engine.session;

import com.openintake.forms.core.engine.access.FieldPermission;
import com.openintake.forms.core.engine.config.OpenIntakeFormEngineConfig;
import com.openintake.forms.core.engine.draft.DraftPersistenceCoordinator;
import com.openintake.forms.core.engine.navigation.IOpenIntakeFieldChangeHook;
import com.openintake.forms.core.engine.navigation.StepNavigationStateMachine;
import com.openintake.forms.core.engine.navigation.StepTransitionResult;
import com.openintake.forms.core.engine.render.FieldValueValidator;
import com.openintake.forms.core.engine.render.IOpenIntakeFieldTypeResolver;
import com.openintake.forms.core.engine.render.RenderDecision;
import com.openintake.forms.core.exception.layout.LayoutNotConfiguredException;
import com.openintake.forms.core.util.CommonUtil;
import com.openintake.forms.integration.contract.IOpenIntakeFormContext;
import com.openintake.forms.integration.contract.submission.IOpenIntakeDraftRepository;
import com.openintake.forms.integration.contract.widget.IOpenIntakeWidgetRenderer;
import com.openintake.forms.integration.models.field.FieldDefinition;
import com.openintake.forms.integration.models.layout.SectionDefinition;
import com.openintake.forms.integration.models.submission.SubmissionState;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One user's form on one screen.
 *
 * <p>The session is {@link FormViewState#LOADING} until the loader's join completes.
 * Opening it again, or switching to another context, starts a new load; the result of a
 * load that was superseded in the meantime is discarded.</p>
 */
@Slf4j
public class FormSession {

    private final FormSessionLoader loader;
    private final IOpenIntakeFieldTypeResolver typeResolver;
    private final FieldValueValidator valueValidator;
    private final IOpenIntakeDraftRepository draftRepository;
    private final DraftPersistenceCoordinator persistence;
    private final IOpenIntakeWidgetRenderer widgetRenderer;
    private final List<IOpenIntakeFieldChangeHook> hooks;
    private final OpenIntakeFormEngineConfig config;

    private final AtomicLong generation = new AtomicLong(0);
    private volatile FormView view;
    private volatile StepNavigationStateMachine navigation;

    public FormSession(FormSessionLoader loader,
                       IOpenIntakeFieldTypeResolver typeResolver,
                       FieldValueValidator valueValidator,
                       IOpenIntakeDraftRepository draftRepository,
                       IOpenIntakeWidgetRenderer widgetRenderer,
                       List<IOpenIntakeFieldChangeHook> hooks,
                       OpenIntakeFormEngineConfig config) {
        this.loader = loader;
        this.typeResolver = typeResolver;
        this.valueValidator = valueValidator;
        this.draftRepository = draftRepository;
        this.persistence = draftRepository == null ? null : new DraftPersistenceCoordinator(draftRepository);
        this.widgetRenderer = widgetRenderer;
        this.hooks = hooks;
        this.config = config;
    }

    // ========================================================================
    // LOADING
    // ========================================================================

    /**
     * Loads the form for a new submission.
     *
     * @return the loaded view, or empty when a newer load superseded this one
     */
    public Mono<FormView> open(IOpenIntakeFormContext context) {
        return open(context, null);
    }

    /**
     * Loads the form and resumes a stored draft. An unknown record starts a new submission.
     */
    public Mono<FormView> open(IOpenIntakeFormContext context, String recordId) {
        long requested = generation.incrementAndGet();
        view = FormView.loading(context);
        navigation = null;

        Mono<Optional<SubmissionState>> draft = recordId == null || draftRepository == null
                ? Mono.just(Optional.empty())
                : Mono.defer(() -> draftRepository.loadDraft(recordId))
                        .map(state -> Optional.of(SubmissionState.from(state)))
                        .defaultIfEmpty(Optional.empty());

        return Mono.zip(loader.load(context), draft)
                .filter(loaded -> {
                    boolean current = generation.get() == requested;
                    if (!current) {
                        log.debug("Discarding superseded load {} of screen {}", requested, context.getScreenId());
                    }
                    return current;
                })
                .map(loaded -> apply(loaded.getT1(), loaded.getT2().orElse(null)));
    }

    /**
     * Reloads the form when the tenant, screen, role or workflow stage changed, keeping the
     * stored draft the session is working on.
     */
    public Mono<FormView> changeContext(IOpenIntakeFormContext context) {
        FormView current = view;
        if (current != null && current.getState() != FormViewState.LOADING && sameContext(current.getContext(), context)) {
            return Mono.just(current);
        }
        StepNavigationStateMachine machine = navigation;
        return open(context, machine == null ? null : machine.getRecordId());
    }

    private synchronized FormView apply(FormView loaded, SubmissionState draft) {
        if (loaded.isReady()) {
            navigation = StepNavigationStateMachine.builder()
                    .layout(loaded.getLayout())
                    .registry(loaded.getRegistry())
                    .accessRules(loaded.getAccessRules())
                    .typeResolver(typeResolver)
                    .valueValidator(valueValidator)
                    .persistence(persistence)
                    .hooks(hooks)
                    .config(config)
                    .initialState(draft)
                    .build();
        }
        view = loaded;
        return loaded;
    }

    private static boolean sameContext(IOpenIntakeFormContext a, IOpenIntakeFormContext b) {
        return a != null && b != null
                && Objects.equals(a.getTenantId(), b.getTenantId())
                && Objects.equals(a.getScreenId(), b.getScreenId())
                && Objects.equals(a.getRole(), b.getRole())
                && Objects.equals(a.getWorkflowStage(), b.getWorkflowStage());
    }

    public FormView getView() {
        return view;
    }

    public FormViewState getState() {
        FormView current = view;
        return current == null ? FormViewState.LOADING : current.getState();
    }

    // ========================================================================
    // RENDERING
    // ========================================================================

    /**
     * Decisions for the visible fields of the current step, in step order.
     */
    public List<RenderDecision> renderCurrentStep() {
        StepNavigationStateMachine machine = requireNavigation();
        SectionDefinition section = machine.getCurrentSection();
        List<RenderDecision> decisions = new ArrayList<>();
        if (section == null) {
            return decisions;
        }
        for (String fieldName : CommonUtil.nonNullList(section.getFieldNames())) {
            renderField(fieldName).ifPresent(decisions::add);
        }
        return decisions;
    }

    /**
     * Decision for one field, empty when the field is unknown or hidden from the role.
     * Fields the role may only view come back not editable.
     */
    public Optional<RenderDecision> renderField(String fieldName) {
        StepNavigationStateMachine machine = requireNavigation();
        FieldDefinition field = view.getRegistry().get(fieldName);
        FieldPermission permission = view.getAccessRules().evaluate(fieldName);
        if (field == null || !permission.isCanView()) {
            return Optional.empty();
        }
        RenderDecision decision = typeResolver.resolve(field, machine.getValue(fieldName), machine.getValues());
        if (!permission.isCanEdit() && decision.isEditable()) {
            decision = decision.toBuilder().editable(false).build();
        }
        return Optional.of(decision);
    }

    /**
     * Hands a rich text, diagram or file field to the widget renderer. Values the widget
     * reports back go through {@link #changeField(String, Object)}.
     *
     * @throws IllegalStateException    if no renderer supports the field's category
     * @throws IllegalArgumentException if the field is not a delegated widget or is hidden
     */
    public Object renderWidget(String fieldName) {
        RenderDecision decision = renderField(fieldName)
                .orElseThrow(() -> new IllegalArgumentException("Field not visible: " + fieldName));
        if (!decision.isDelegatedWidget()) {
            throw new IllegalArgumentException("Field " + fieldName + " is drawn by the engine, category "
                    + decision.getCategory());
        }
        if (widgetRenderer == null || !widgetRenderer.getSupportedCategories().contains(decision.getCategory())) {
            throw new IllegalStateException("No widget renderer for category " + decision.getCategory());
        }
        FieldDefinition field = view.getRegistry().get(fieldName);
        return widgetRenderer.renderWidget(field, decision.getNormalizedValue(), newValue -> {
            if (decision.isEditable()) {
                changeField(fieldName, newValue);
            }
        });
    }

    // ========================================================================
    // NAVIGATION
    // ========================================================================

    public Set<String> changeField(String fieldName, Object value) {
        return requireNavigation().changeField(fieldName, value);
    }

    public StepTransitionResult next() {
        return requireNavigation().next();
    }

    public StepTransitionResult previous() {
        return requireNavigation().previous();
    }

    public StepTransitionResult jumpTo(int step) {
        return requireNavigation().jumpTo(step);
    }

    public Mono<StepTransitionResult> submit() {
        return Mono.defer(() -> requireNavigation().submit());
    }

    public SubmissionState snapshot() {
        return requireNavigation().snapshot();
    }

    public Mono<Void> awaitPersistence() {
        StepNavigationStateMachine machine = navigation;
        return machine == null ? Mono.empty() : machine.awaitPersistence();
    }

    /**
     * @throws LayoutNotConfiguredException if the screen has no active layout
     * @throws IllegalStateException        if the form is still loading or failed to load
     */
    public StepNavigationStateMachine requireNavigation() {
        FormView current = view;
        StepNavigationStateMachine machine = navigation;
        if (current != null && current.getState() == FormViewState.NOT_CONFIGURED) {
            throw new LayoutNotConfiguredException(current.getContext().getScreenId());
        }
        if (current == null || machine == null || !current.isReady()) {
            throw new IllegalStateException("Form is not ready: " + getState());
        }
        return machine;
    }
}
