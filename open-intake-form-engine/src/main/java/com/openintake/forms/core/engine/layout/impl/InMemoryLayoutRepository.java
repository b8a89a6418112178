package com.openintake.forms.core.engine.layout.impl;

import com.openintake.forms.integration.contract.layout.IOpenIntakeLayoutDocument;
import com.openintake.forms.integration.contract.layout.IOpenIntakeLayoutRepository;
import com.openintake.forms.integration.models.layout.LayoutDocument;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory layout store.
 *
 * <p>Suitable for single-instance deployments and tests. Layouts are kept in insertion
 * order per screen; a stored layout is replaced on save, never deleted.</p>
 */
@Slf4j
public class InMemoryLayoutRepository implements IOpenIntakeLayoutRepository {

    private final Map<String, LayoutDocument> layouts = new ConcurrentHashMap<>();
    private final AtomicLong saveCount = new AtomicLong(0);

    public InMemoryLayoutRepository withLayout(IOpenIntakeLayoutDocument layout) {
        LayoutDocument document = LayoutDocument.from(layout);
        layouts.put(document.getId(), document);
        return this;
    }

    @Override
    public Flux<IOpenIntakeLayoutDocument> findByScreen(String screenId) {
        return Flux.defer(() -> Flux.fromIterable(layouts.values()))
                .filter(layout -> screenId != null && screenId.equals(layout.getScreenId()))
                .sort((a, b) -> a.getId().compareTo(b.getId()))
                .cast(IOpenIntakeLayoutDocument.class);
    }

    @Override
    public Mono<IOpenIntakeLayoutDocument> findById(String layoutId) {
        return Mono.fromCallable(() -> layoutId == null ? null : layouts.get(layoutId))
                .cast(IOpenIntakeLayoutDocument.class);
    }

    @Override
    public Mono<IOpenIntakeLayoutDocument> save(IOpenIntakeLayoutDocument layout) {
        return Mono.fromCallable(() -> {
            LayoutDocument document = LayoutDocument.from(layout);
            layouts.put(document.getId(), document);
            saveCount.incrementAndGet();
            log.debug("Stored layout {} for screen {}", document.getId(), document.getScreenId());
            return document;
        });
    }

    public long getSaveCount() {
        return saveCount.get();
    }

    public int size() {
        return layouts.size();
    }
}
