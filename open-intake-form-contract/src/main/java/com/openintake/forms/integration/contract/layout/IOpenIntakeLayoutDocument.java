package com.openintake.forms.integration.contract.layout;

import com.openintake.forms.integration.enumerations.OpenIntakeLayoutType;

import java.util.List;

/**
 * An authored arrangement of fields into ordered steps for one screen.
 * <p>
 * A layout is a draft while it is inactive. Publishing makes it the active layout for
 * its screen and layout type. A later publish supersedes it; layouts are never deleted
 * by the engine.
 */
public interface IOpenIntakeLayoutDocument {

    String getId();

    String getName();

    /**
     * Screen this layout renders.
     */
    String getScreenId();

    /**
     * Tenant owning the layout. Only members of this tenant may modify it.
     */
    String getTenantId();

    OpenIntakeLayoutType getLayoutType();

    /**
     * Sections in display order.
     */
    List<? extends IOpenIntakeSectionDefinition> getSections();

    boolean isActive();

    /**
     * Whether this is the screen's fallback layout when no type-specific layout is active.
     */
    boolean isDefault();

    /**
     * Templates are reusable starting points and can never be default.
     */
    boolean isTemplate();
}
