package com.openintake.forms.integration.models.submission;

import com.openintake.forms.integration.contract.submission.IOpenIntakeSubmissionState;
import com.openintake.forms.integration.enumerations.OpenIntakeSubmissionStatus;
import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of a form-filling session's collected values.
 */
@Data
@Builder(toBuilder = true)
@With
public class SubmissionState implements IOpenIntakeSubmissionState, Serializable {

    private static final long serialVersionUID = 1L;

    private final String recordId;

    @Builder.Default
    private final Map<String, Object> values = Collections.emptyMap();

    @Builder.Default
    private final int currentStep = 1;

    @Builder.Default
    private final OpenIntakeSubmissionStatus status = OpenIntakeSubmissionStatus.DRAFT;

    public static SubmissionState newSubmission() {
        return SubmissionState.builder().build();
    }

    public static SubmissionState from(IOpenIntakeSubmissionState state) {
        if (state instanceof SubmissionState) {
            return (SubmissionState) state;
        }
        return SubmissionState.builder()
                .recordId(state.getRecordId())
                .values(state.getValues() == null
                        ? Collections.emptyMap() : new LinkedHashMap<>(state.getValues()))
                .currentStep(Math.max(1, state.getCurrentStep()))
                .status(state.getStatus() == null ? OpenIntakeSubmissionStatus.DRAFT : state.getStatus())
                .build();
    }

    public boolean isSubmitted() {
        return status == OpenIntakeSubmissionStatus.SUBMITTED;
    }
}
