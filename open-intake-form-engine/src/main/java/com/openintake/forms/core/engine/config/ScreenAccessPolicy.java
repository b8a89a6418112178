package com.openintake.forms.core.engine.config;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Per-screen switch for field permission evaluation.
 * <p>
 * End-user submission screens are usually curated by the form owner, so they may turn
 * evaluation off and show every field as visible and editable.
 */
@Getter
@Builder
@ToString
public final class ScreenAccessPolicy {

    @Builder.Default
    private final boolean enforceFieldPermissions = true;

    public static ScreenAccessPolicy enforcing() {
        return ScreenAccessPolicy.builder().enforceFieldPermissions(true).build();
    }

    public static ScreenAccessPolicy unrestricted() {
        return ScreenAccessPolicy.builder().enforceFieldPermissions(false).build();
    }
}
