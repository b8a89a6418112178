package com.openintake.forms.core.engine.draft;

import com.openintake.forms.integration.contract.submission.IOpenIntakeDraftRepository;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Sequences draft writes per chain.
 *
 * <p>Every write is started immediately and also returned, so callers may either fire and
 * forget or wait for it. A write on a chain starts only after the previous write on the same
 * chain has finished, successfully or not. A chain is keyed by the record id when the
 * session resumed an existing draft, or by a session key until the record is created.</p>
 *
 * <p>Values are copied at scheduling time; later edits to the caller's map do not leak into
 * a queued write.</p>
 */
@Slf4j
public class DraftPersistenceCoordinator {

    private final IOpenIntakeDraftRepository repository;
    private final Map<String, Mono<Void>> tails = new ConcurrentHashMap<>();

    public DraftPersistenceCoordinator(IOpenIntakeDraftRepository repository) {
        this.repository = repository;
    }

    /**
     * Creates the backing record. The callback sees the new id before any later write on the
     * chain starts.
     */
    public Mono<String> createDraft(String chainKey, Map<String, Object> values, Consumer<String> onCreated) {
        Map<String, Object> snapshot = copy(values);
        return enqueue(chainKey, "create", () -> repository.createDraft(snapshot)
                .doOnNext(recordId -> log.info("Draft {} created", recordId))
                .doOnNext(onCreated));
    }

    /**
     * Stores values and step on the record the supplier names when the write runs.
     * The write is skipped when no record exists by then.
     */
    public Mono<Void> scheduleSave(String chainKey, Supplier<String> recordId,
                                   Map<String, Object> values, int currentStep) {
        Map<String, Object> snapshot = copy(values);
        return enqueue(chainKey, "update", () -> {
            String id = recordId.get();
            if (id == null) {
                log.debug("No draft record on chain {} yet, skipping save of step {}", chainKey, currentStep);
                return Mono.empty();
            }
            return repository.updateDraft(id, snapshot, currentStep);
        });
    }

    /**
     * Marks the record the supplier names as submitted. Errors when no record exists by then.
     */
    public Mono<Void> scheduleSubmit(String chainKey, Supplier<String> recordId, Map<String, Object> values) {
        Map<String, Object> snapshot = copy(values);
        return enqueue(chainKey, "submit", () -> {
            String id = recordId.get();
            if (id == null) {
                return Mono.error(new IllegalStateException("No draft record to submit on chain " + chainKey));
            }
            return repository.submit(id, snapshot)
                    .doOnSuccess(ignored -> log.info("Draft {} submitted", id));
        });
    }

    /**
     * Completes once every write scheduled so far on the chain has finished.
     */
    public Mono<Void> awaitPending(String chainKey) {
        return tails.getOrDefault(chainKey, Mono.empty());
    }

    private <T> Mono<T> enqueue(String chainKey, String operation, Supplier<Mono<T>> write) {
        AtomicReference<Mono<T>> scheduled = new AtomicReference<>();
        tails.compute(chainKey, (key, previous) -> {
            Mono<Void> prior = previous == null ? Mono.empty() : previous;
            Mono<T> run = prior.then(Mono.defer(write)).cache();
            scheduled.set(run);
            // the tail never errors so a failed write does not block the ones queued after it
            return run.then().onErrorResume(e -> Mono.empty()).cache();
        });
        Mono<T> run = scheduled.get();
        run.subscribe(
                value -> log.trace("Draft {} on chain {} done", operation, chainKey),
                e -> log.warn("Draft {} on chain {} failed: {}", operation, chainKey, e.toString()));
        return run;
    }

    private static Map<String, Object> copy(Map<String, Object> values) {
        return values == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
