package com.openintake.forms.integration.contract.submission;

import com.openintake.forms.integration.enumerations.OpenIntakeSubmissionStatus;

import java.util.Map;

/**
 * Values collected by one form-filling session.
 */
public interface IOpenIntakeSubmissionState {

    /**
     * Identifier of the persisted record, or null before the first checkpoint.
     */
    String getRecordId();

    Map<String, Object> getValues();

    /**
     * One-based index of the step being shown.
     */
    int getCurrentStep();

    OpenIntakeSubmissionStatus getStatus();
}
