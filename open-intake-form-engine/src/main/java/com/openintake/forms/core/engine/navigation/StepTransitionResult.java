package com.openintake.forms.core.engine.navigation;

import com.openintake.forms.core.engine.render.FieldValidationError;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Outcome of a navigation request.
 */
@Data
@Builder
public class StepTransitionResult {

    public enum ResultType {
        /** The current step changed. */
        MOVED,
        /** Accepted, but already at the boundary. */
        UNCHANGED,
        /** The current step has unmet required fields or invalid values. */
        REFUSED,
        /** The submission was persisted as submitted. */
        SUBMITTED
    }

    private final ResultType type;
    private final int fromStep;

    /**
     * The current step after the request.
     */
    private final int currentStep;

    @Builder.Default
    private final List<String> missingFields = List.of();

    @Builder.Default
    private final List<FieldValidationError> validationErrors = List.of();

    private final String recordId;

    public static StepTransitionResult moved(int fromStep, int toStep) {
        return StepTransitionResult.builder().type(ResultType.MOVED).fromStep(fromStep).currentStep(toStep).build();
    }

    public static StepTransitionResult unchanged(int step) {
        return StepTransitionResult.builder().type(ResultType.UNCHANGED).fromStep(step).currentStep(step).build();
    }

    public static StepTransitionResult refused(int fromStep, StepValidationReport report) {
        return StepTransitionResult.builder()
                .type(ResultType.REFUSED)
                .fromStep(fromStep)
                .currentStep(report.getStep())
                .missingFields(report.getMissingFields())
                .validationErrors(report.getValidationErrors())
                .build();
    }

    public static StepTransitionResult submitted(int step, String recordId) {
        return StepTransitionResult.builder()
                .type(ResultType.SUBMITTED).fromStep(step).currentStep(step).recordId(recordId).build();
    }

    public boolean isAccepted() {
        return type != ResultType.REFUSED;
    }

    public boolean isRefused() {
        return type == ResultType.REFUSED;
    }
}
