package com.openintake.forms.core.engine.config;

import lombok.Builder;
import lombok.Data;

import java.util.Collections;
import java.util.List;

/**
 * A step created when an empty default layout is auto-populated.
 * {@code standardFields} are placed into the step directly; other fields are assigned by keyword.
 */
@Data
@Builder
public class FallbackStepTemplate {
    private final int id;
    private final String title;
    private final String description;
    @Builder.Default
    private final List<String> standardFields = Collections.emptyList();
}
