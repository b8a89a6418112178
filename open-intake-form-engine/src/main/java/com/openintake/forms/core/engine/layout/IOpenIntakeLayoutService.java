package com.openintake.forms.core.engine.layout;

import com.openintake.forms.core.engine.registry.FieldRegistry;
import com.openintake.forms.integration.contract.IOpenIntakeFormContext;
import com.openintake.forms.integration.contract.layout.IOpenIntakeLayoutDocument;
import com.openintake.forms.integration.enumerations.OpenIntakeLayoutType;
import reactor.core.publisher.Mono;

/**
 * Read and write access to layouts.
 */
public interface IOpenIntakeLayoutService {

    /**
     * The active layout of a screen, preferring the default one. Empty when none is published.
     * Sections are returned in display order.
     */
    Mono<IOpenIntakeLayoutDocument> loadActiveLayout(String screenId);

    /**
     * The active layout of the given type, falling back to the screen's active default layout.
     */
    Mono<IOpenIntakeLayoutDocument> loadActiveLayout(String screenId, OpenIntakeLayoutType layoutType);

    /**
     * Validates and stores a layout on behalf of an administrator.
     * <p>
     * Errors with {@code LayoutAccessDeniedException} when the layout belongs to another tenant
     * and with {@code LayoutConfigurationException} when it breaks a structural invariant.
     * Storing an active layout supersedes the previously active layout of the same type;
     * storing a default layout clears the default flag of the screen's other layouts.
     */
    Mono<IOpenIntakeLayoutDocument> saveLayout(IOpenIntakeLayoutDocument layout, IOpenIntakeFormContext actor);

    /**
     * Makes a stored layout the active one.
     */
    Mono<IOpenIntakeLayoutDocument> publishLayout(String layoutId, IOpenIntakeFormContext actor);

    /**
     * Fills a section-less default layout with the configured fallback steps, once.
     * Silently returns the layout unchanged when the actor is not an administrator of the
     * layout's tenant, when the layout already has sections, or when population was already
     * attempted.
     */
    Mono<IOpenIntakeLayoutDocument> ensurePopulated(IOpenIntakeLayoutDocument layout,
                                                    IOpenIntakeFormContext actor,
                                                    FieldRegistry registry);

    /**
     * Whether a write to the layout was denied, which disables further auto-population.
     */
    boolean isAutoPopulationBlocked(String layoutId);
}
