package com.openintake.forms.core.engine.config;

import com.openintake.forms.integration.enumerations.OpenIntakeFieldProvenance;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration of the form engine.
 *
 * Immutable; build a per-tenant or per-test variant with {@code toBuilder()}.
 * Nothing in the engine reads configuration from global state.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class OpenIntakeFormEngineConfig {

    // Provenance configuration
    @Builder.Default
    private final Duration sourceFetchTimeout = Duration.ofSeconds(5);

    @Builder.Default
    private final List<OpenIntakeFieldProvenance> provenancePrecedence = List.of(
            OpenIntakeFieldProvenance.ENTITY_SCHEMA,
            OpenIntakeFieldProvenance.ENTITY_METADATA,
            OpenIntakeFieldProvenance.CUSTOM_FIELD,
            OpenIntakeFieldProvenance.MASTER_DATA,
            OpenIntakeFieldProvenance.REQUIREMENT,
            OpenIntakeFieldProvenance.CURRENT_USER,
            OpenIntakeFieldProvenance.WORKFLOW_TICKET);

    // Layout configuration
    @Builder.Default
    private final Set<String> administrativeRoles = Set.of("tenant_admin", "platform_admin");

    @Builder.Default
    private final List<FallbackStepTemplate> fallbackSteps = defaultFallbackSteps();

    @Builder.Default
    private final KeywordStepMappings keywordStepMappings = KeywordStepMappings.defaultMappings();

    // Rendering configuration
    @Builder.Default
    private final VendorModelCatalog vendorModelCatalog = VendorModelCatalog.defaultCatalog();

    @Builder.Default
    private final IdentityFieldNames identityFieldNames = IdentityFieldNames.defaults();

    @Builder.Default
    private final List<SelectAllOptionRule> selectAllRules = List.of(
            SelectAllOptionRule.of("operational_regions", "Global"),
            SelectAllOptionRule.of("regions", "Global"));

    // Navigation configuration

    /**
     * One-based step whose completion creates the draft. Null derives it from the layout.
     */
    private final Integer checkpointStep;

    // Access configuration
    @Builder.Default
    private final ScreenAccessPolicy defaultScreenPolicy = ScreenAccessPolicy.enforcing();

    @Builder.Default
    private final Map<String, ScreenAccessPolicy> screenPolicies = Collections.emptyMap();

    public static OpenIntakeFormEngineConfig defaultConfig() {
        return OpenIntakeFormEngineConfig.builder().build();
    }

    public ScreenAccessPolicy policyFor(String screenId) {
        return screenPolicies.getOrDefault(screenId, defaultScreenPolicy);
    }

    public boolean isAdministrativeRole(String role) {
        return role != null && administrativeRoles.contains(role);
    }

    public static List<FallbackStepTemplate> defaultFallbackSteps() {
        return List.of(
                FallbackStepTemplate.builder().id(1).title("Agent Details")
                        .description("Basic information about the AI agent")
                        .standardFields(List.of("name", "type", "category", "description", "version"))
                        .build(),
                FallbackStepTemplate.builder().id(2).title("AI Configuration")
                        .description("LLM vendor and model configuration").build(),
                FallbackStepTemplate.builder().id(3).title("Data & Operations")
                        .description("Data types, regions and capabilities").build(),
                FallbackStepTemplate.builder().id(4).title("Integrations")
                        .description("Connections to external systems").build(),
                FallbackStepTemplate.builder().id(5).title("Compliance & Review")
                        .description("Compliance requirements and final review").build());
    }

    /**
     * Validates the configuration.
     *
     * @throws IllegalStateException if configuration is invalid
     */
    public void validate() {
        if (sourceFetchTimeout == null || sourceFetchTimeout.isNegative() || sourceFetchTimeout.isZero()) {
            throw new IllegalStateException("sourceFetchTimeout must be positive");
        }
        if (provenancePrecedence == null || provenancePrecedence.isEmpty()) {
            throw new IllegalStateException("provenancePrecedence must not be empty");
        }
        if (Set.copyOf(provenancePrecedence).size() != provenancePrecedence.size()) {
            throw new IllegalStateException("provenancePrecedence must not repeat a source");
        }
        if (checkpointStep != null && checkpointStep < 1) {
            throw new IllegalStateException("checkpointStep must be at least 1");
        }
    }
}
