package com.openintake.forms.integration.enumerations;

import java.util.Locale;

/**
 * The screen a layout is authored for.
 */
public enum OpenIntakeLayoutType {

    /**
     * Shown to the submitter while filling or revising the form.
     */
    SUBMISSION("submission"),

    /**
     * Shown to approvers and reviewers.
     */
    APPROVER("approver"),

    /**
     * Shown on rejected records.
     */
    REJECTION("rejection"),

    /**
     * Read-only view of approved or closed records.
     */
    COMPLETED("completed");

    private final String wireName;

    OpenIntakeLayoutType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static OpenIntakeLayoutType fromWireName(String wireName) {
        for (OpenIntakeLayoutType type : values()) {
            if (type.wireName.equalsIgnoreCase(wireName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown layout type: " + wireName);
    }

    /**
     * Maps a workflow stage to the layout type that renders it.
     * Unknown or missing stages map to {@link #SUBMISSION}.
     */
    public static OpenIntakeLayoutType forWorkflowStage(String stage) {
        if (stage == null) {
            return SUBMISSION;
        }
        switch (stage.trim().toLowerCase(Locale.ROOT)) {
            case "pending_approval":
            case "pending_review":
            case "in_progress":
                return APPROVER;
            case "rejected":
                return REJECTION;
            case "approved":
            case "closed":
            case "cancelled":
                return COMPLETED;
            default:
                return SUBMISSION;
        }
    }
}
