package com.openintake.forms.integration.contract.submission;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Persistence boundary for submission drafts.
 */
public interface IOpenIntakeDraftRepository {

    /**
     * Loads a draft, completing empty when no record exists.
     */
    Mono<IOpenIntakeSubmissionState> loadDraft(String recordId);

    /**
     * Creates a draft record and emits its identifier.
     */
    Mono<String> createDraft(Map<String, Object> values);

    Mono<Void> updateDraft(String recordId, Map<String, Object> values, int currentStep);

    /**
     * Stores the final values and marks the record submitted.
     */
    Mono<Void> submit(String recordId, Map<String, Object> values);
}
