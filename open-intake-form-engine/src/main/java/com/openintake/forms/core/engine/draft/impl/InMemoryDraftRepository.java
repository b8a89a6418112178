package com.openintake.forms.core.engine.draft.impl;

import com.openintake.forms.core.exception.submission.SubmissionClosedException;
import com.openintake.forms.integration.contract.submission.IOpenIntakeDraftRepository;
import com.openintake.forms.integration.contract.submission.IOpenIntakeSubmissionState;
import com.openintake.forms.integration.enumerations.OpenIntakeSubmissionStatus;
import com.openintake.forms.integration.models.submission.SubmissionState;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory draft store. Records every write in order, which tests use to check sequencing.
 */
@Slf4j
public class InMemoryDraftRepository implements IOpenIntakeDraftRepository {

    private final Map<String, SubmissionState> drafts = new ConcurrentHashMap<>();
    private final List<String> writeLog = Collections.synchronizedList(new ArrayList<>());
    private final AtomicLong sequence = new AtomicLong(0);

    public InMemoryDraftRepository withDraft(IOpenIntakeSubmissionState state) {
        SubmissionState stored = SubmissionState.from(state);
        drafts.put(stored.getRecordId(), stored);
        return this;
    }

    @Override
    public Mono<IOpenIntakeSubmissionState> loadDraft(String recordId) {
        return Mono.fromCallable(() -> recordId == null ? null : drafts.get(recordId))
                .cast(IOpenIntakeSubmissionState.class);
    }

    @Override
    public Mono<String> createDraft(Map<String, Object> values) {
        return Mono.fromCallable(() -> {
            String recordId = "draft-" + sequence.incrementAndGet();
            drafts.put(recordId, SubmissionState.builder()
                    .recordId(recordId)
                    .values(copy(values))
                    .build());
            writeLog.add("create:" + recordId);
            log.debug("Created draft {}", recordId);
            return recordId;
        });
    }

    @Override
    public Mono<Void> updateDraft(String recordId, Map<String, Object> values, int currentStep) {
        return Mono.fromRunnable(() -> {
            SubmissionState existing = require(recordId);
            drafts.put(recordId, existing.withValues(copy(values)).withCurrentStep(currentStep));
            writeLog.add("update:" + recordId + ":" + currentStep);
        });
    }

    @Override
    public Mono<Void> submit(String recordId, Map<String, Object> values) {
        return Mono.fromRunnable(() -> {
            SubmissionState existing = require(recordId);
            drafts.put(recordId, existing.withValues(copy(values)).withStatus(OpenIntakeSubmissionStatus.SUBMITTED));
            writeLog.add("submit:" + recordId);
        });
    }

    public SubmissionState get(String recordId) {
        return drafts.get(recordId);
    }

    public List<String> getWriteLog() {
        synchronized (writeLog) {
            return List.copyOf(writeLog);
        }
    }

    private SubmissionState require(String recordId) {
        SubmissionState existing = drafts.get(recordId);
        if (existing == null) {
            throw new IllegalArgumentException("Unknown draft: " + recordId);
        }
        if (existing.isSubmitted()) {
            throw new SubmissionClosedException(recordId);
        }
        return existing;
    }

    private static Map<String, Object> copy(Map<String, Object> values) {
        return values == null ? Collections.emptyMap() : new LinkedHashMap<>(values);
    }
}
