package com.openintake.forms.integration.enumerations;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class OpenIntakeLayoutTypeTest {

    @Nested
    @DisplayName("Workflow Stage Mapping")
    class WorkflowStageTests {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "new, SUBMISSION",
                "needs_revision, SUBMISSION",
                "pending_approval, APPROVER",
                "pending_review, APPROVER",
                "in_progress, APPROVER",
                "rejected, REJECTION",
                "approved, COMPLETED",
                "closed, COMPLETED",
                "cancelled, COMPLETED",
                "PENDING_APPROVAL, APPROVER"
        })
        void shouldMapStageToLayoutType(String stage, OpenIntakeLayoutType expected) {
            assertEquals(expected, OpenIntakeLayoutType.forWorkflowStage(stage));
        }

        @Test
        @DisplayName("should fall back to submission for missing or unknown stages")
        void shouldFallBackToSubmission() {
            assertEquals(OpenIntakeLayoutType.SUBMISSION, OpenIntakeLayoutType.forWorkflowStage(null));
            assertEquals(OpenIntakeLayoutType.SUBMISSION, OpenIntakeLayoutType.forWorkflowStage("archived"));
        }
    }

    @Nested
    @DisplayName("Wire Names")
    class WireNameTests {

        @Test
        @DisplayName("should read wire names case-insensitively")
        void shouldReadWireNames() {
            assertEquals(OpenIntakeLayoutType.APPROVER, OpenIntakeLayoutType.fromWireName("Approver"));
            assertEquals("completed", OpenIntakeLayoutType.COMPLETED.getWireName());
        }

        @Test
        @DisplayName("should reject unknown wire names")
        void shouldRejectUnknownWireName() {
            assertThrows(IllegalArgumentException.class, () -> OpenIntakeLayoutType.fromWireName("draft"));
        }
    }
}
