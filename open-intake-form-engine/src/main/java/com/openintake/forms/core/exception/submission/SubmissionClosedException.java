package com.openintake.forms.core.exception.submission;

import com.openintake.forms.core.exception.OpenIntakeRuntimeException;

/**
 * A mutation was attempted on a submission that was already submitted.
 */
public class SubmissionClosedException extends OpenIntakeRuntimeException {

    private final String recordId;

    public SubmissionClosedException(String recordId) {
        super("Submission already submitted. RecordId: [" + recordId + "]");
        this.recordId = recordId;
    }

    public String getRecordId() {
        return recordId;
    }
}
