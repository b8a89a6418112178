package com.openintake.forms.core.engine.config;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Names of the identity fields that carry bespoke reset behavior.
 */
@Getter
@Builder
@ToString
public final class IdentityFieldNames {

    @Builder.Default
    private final String categoryField = "category";

    @Builder.Default
    private final String subcategoryField = "subcategory";

    @Builder.Default
    private final String vendorField = "llm_vendor";

    @Builder.Default
    private final String modelField = "llm_model";

    public static IdentityFieldNames defaults() {
        return IdentityFieldNames.builder().build();
    }
}
