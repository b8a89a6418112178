package com.openintake.forms.integration.contract.layout;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Persistence boundary for layouts.
 */
public interface IOpenIntakeLayoutRepository {

    /**
     * All layouts stored for a screen, active or not.
     */
    Flux<IOpenIntakeLayoutDocument> findByScreen(String screenId);

    Mono<IOpenIntakeLayoutDocument> findById(String layoutId);

    /**
     * Creates or replaces the layout with the same id. Emits the stored layout.
     * May signal an error whose error info has category {@code ACCESS_DENIED}.
     */
    Mono<IOpenIntakeLayoutDocument> save(IOpenIntakeLayoutDocument layout);
}
