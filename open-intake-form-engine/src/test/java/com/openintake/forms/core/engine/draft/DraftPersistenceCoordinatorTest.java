package com.openintake.forms.core.engine.draft;

import com.openintake.forms.core.engine.draft.impl.InMemoryDraftRepository;
import com.openintake.forms.integration.contract.submission.IOpenIntakeDraftRepository;
import com.openintake.forms.integration.contract.submission.IOpenIntakeSubmissionState;
import com.openintake.forms.integration.enumerations.OpenIntakeSubmissionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class DraftPersistenceCoordinatorTest {

    private static final String CHAIN = "session-1";

    private InMemoryDraftRepository store;
    private DraftPersistenceCoordinator coordinator;
    private AtomicReference<String> recordId;

    @BeforeEach
    void setUp() {
        store = new InMemoryDraftRepository();
        coordinator = new DraftPersistenceCoordinator(new SlowCreateRepository(store, Duration.ofMillis(100)));
        recordId = new AtomicReference<>();
    }

    @Nested
    @DisplayName("Write Ordering")
    class OrderingTests {

        @Test
        @DisplayName("should apply writes in scheduling order even when the create is slow")
        void shouldApplyWritesInOrder() {
            // When
            coordinator.createDraft(CHAIN, Map.of("name", "Helper"), recordId::set);
            coordinator.scheduleSave(CHAIN, recordId::get, Map.of("name", "Helper", "type", "Chatbot"), 2);
            coordinator.scheduleSave(CHAIN, recordId::get, Map.of("name", "Helper", "type", "Copilot"), 3);
            coordinator.scheduleSubmit(CHAIN, recordId::get, Map.of("name", "Helper", "type", "Copilot"));
            StepVerifier.create(coordinator.awaitPending(CHAIN)).expectComplete().verify(Duration.ofSeconds(5));

            // Then
            assertEquals(List.of("create:draft-1", "update:draft-1:2", "update:draft-1:3",
                    "submit:draft-1"), store.getWriteLog());
            assertEquals(OpenIntakeSubmissionStatus.SUBMITTED, store.get("draft-1").getStatus());
            assertEquals("Copilot", store.get("draft-1").getValues().get("type"));
        }

        @Test
        @DisplayName("should keep running queued writes after one of them fails")
        void shouldContinueAfterFailure() {
            // Given
            coordinator.createDraft(CHAIN, Map.of(), recordId::set);

            // When
            Mono<Void> failing = coordinator.scheduleSave(CHAIN, () -> "draft-404", Map.of(), 2);
            coordinator.scheduleSave(CHAIN, recordId::get, Map.of("name", "Helper"), 2);

            // Then
            StepVerifier.create(failing).expectError(IllegalArgumentException.class).verify(Duration.ofSeconds(5));
            StepVerifier.create(coordinator.awaitPending(CHAIN)).expectComplete().verify(Duration.ofSeconds(5));
            assertEquals(List.of("create:draft-1", "update:draft-1:2"), store.getWriteLog());
        }

        @Test
        @DisplayName("should keep chains independent of each other")
        void shouldKeepChainsIndependent() {
            coordinator.createDraft("session-a", Map.of(), id -> { });
            coordinator.createDraft("session-b", Map.of(), id -> { });

            StepVerifier.create(coordinator.awaitPending("session-a")
                            .then(coordinator.awaitPending("session-b")))
                    .expectComplete()
                    .verify(Duration.ofSeconds(5));
            assertEquals(2, store.getWriteLog().size());
        }
    }

    @Nested
    @DisplayName("Record Resolution")
    class RecordTests {

        @Test
        @DisplayName("should store the values as they were when the save was scheduled")
        void shouldSnapshotValues() {
            // Given
            Map<String, Object> values = new HashMap<>();
            values.put("name", "Helper");
            coordinator.createDraft(CHAIN, values, recordId::set);
            coordinator.scheduleSave(CHAIN, recordId::get, values, 2);

            // When
            values.put("name", "Changed later");
            StepVerifier.create(coordinator.awaitPending(CHAIN)).expectComplete().verify(Duration.ofSeconds(5));

            // Then
            assertEquals("Helper", store.get("draft-1").getValues().get("name"));
        }

        @Test
        @DisplayName("should skip a save when no record exists and fail a submit")
        void shouldHandleMissingRecord() {
            StepVerifier.create(coordinator.scheduleSave(CHAIN, () -> null, Map.of(), 1)).verifyComplete();
            StepVerifier.create(coordinator.scheduleSubmit(CHAIN, () -> null, Map.of()))
                    .expectError(IllegalStateException.class)
                    .verify();
            assertTrue(store.getWriteLog().isEmpty());
        }

        @Test
        @DisplayName("should complete immediately for a chain without writes")
        void shouldAwaitEmptyChain() {
            StepVerifier.create(coordinator.awaitPending("unknown")).verifyComplete();
        }
    }

    /**
     * Delays record creation so later writes are scheduled while the create is still running.
     */
    private static final class SlowCreateRepository implements IOpenIntakeDraftRepository {

        private final IOpenIntakeDraftRepository delegate;
        private final Duration delay;

        private SlowCreateRepository(IOpenIntakeDraftRepository delegate, Duration delay) {
            this.delegate = delegate;
            this.delay = delay;
        }

        @Override
        public Mono<IOpenIntakeSubmissionState> loadDraft(String recordId) {
            return delegate.loadDraft(recordId);
        }

        @Override
        public Mono<String> createDraft(Map<String, Object> values) {
            return Mono.delay(delay).then(delegate.createDraft(values));
        }

        @Override
        public Mono<Void> updateDraft(String recordId, Map<String, Object> values, int currentStep) {
            return delegate.updateDraft(recordId, values, currentStep);
        }

        @Override
        public Mono<Void> submit(String recordId, Map<String, Object> values) {
            return delegate.submit(recordId, values);
        }
    }
}
