package com.openintake.forms.integration.enumerations;

/**
 * Lifecycle status of a form-filling session.
 */
public enum OpenIntakeSubmissionStatus {

    /**
     * Values are still being collected. The record may not be persisted yet.
     */
    DRAFT,

    /**
     * The submission was finalised. Terminal.
     */
    SUBMITTED
}
