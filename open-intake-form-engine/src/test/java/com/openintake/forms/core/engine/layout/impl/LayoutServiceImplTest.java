package com.openintake.forms.core.engine.layout.impl;

import com.openintake.forms.core.engine.assignment.impl.KeywordAutoAssignmentHeuristic;
import com.openintake.forms.core.engine.config.KeywordStepMappings;
import com.openintake.forms.core.engine.config.OpenIntakeFormEngineConfig;
import com.openintake.forms.core.engine.layout.LayoutValidator;
import com.openintake.forms.core.engine.registry.FieldRegistry;
import com.openintake.forms.core.exception.codes.OpenIntakeInternalErrorCodes;
import com.openintake.forms.core.exception.layout.LayoutAccessDeniedException;
import com.openintake.forms.core.exception.layout.LayoutConfigurationException;
import com.openintake.forms.integration.contract.layout.IOpenIntakeLayoutDocument;
import com.openintake.forms.integration.contract.layout.IOpenIntakeLayoutRepository;
import com.openintake.forms.integration.contract.layout.IOpenIntakeSectionDefinition;
import com.openintake.forms.integration.enumerations.OpenIntakeFieldType;
import com.openintake.forms.integration.enumerations.OpenIntakeLayoutType;
import com.openintake.forms.integration.exception.OpenIntakeFormRuntimeException;
import com.openintake.forms.integration.models.layout.LayoutDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static com.openintake.forms.core.engine.FormTestFixtures.SCREEN;
import static com.openintake.forms.core.engine.FormTestFixtures.TENANT;
import static com.openintake.forms.core.engine.FormTestFixtures.adminContext;
import static com.openintake.forms.core.engine.FormTestFixtures.context;
import static com.openintake.forms.core.engine.FormTestFixtures.field;
import static com.openintake.forms.core.engine.FormTestFixtures.layout;
import static com.openintake.forms.core.engine.FormTestFixtures.section;
import static org.junit.jupiter.api.Assertions.*;

class LayoutServiceImplTest {

    private InMemoryLayoutRepository repository;
    private LayoutServiceImpl service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryLayoutRepository();
        service = newService(repository);
    }

    private static LayoutServiceImpl newService(IOpenIntakeLayoutRepository repository) {
        OpenIntakeFormEngineConfig config = OpenIntakeFormEngineConfig.defaultConfig();
        return new LayoutServiceImpl(repository, new LayoutValidator(),
                new KeywordAutoAssignmentHeuristic(KeywordStepMappings.defaultMappings()), config);
    }

    // ========================================================================
    // LOAD TESTS
    // ========================================================================

    @Nested
    @DisplayName("Loading Layouts")
    class LoadTests {

        @Test
        @DisplayName("should prefer the active default layout and sort its sections")
        void shouldLoadActiveDefault() {
            // Given
            repository.withLayout(layout("layout-a", section("basics", 1, "name")).withDefault(false));
            repository.withLayout(layout("layout-b", section("review", 2, "notes"), section("basics", 1, "name")));
            repository.withLayout(layout("layout-c", section("old", 1, "name")).withActive(false));

            // When / Then
            StepVerifier.create(service.loadActiveLayout(SCREEN))
                    .assertNext(layout -> {
                        assertEquals("layout-b", layout.getId());
                        assertEquals("basics", layout.getSections().get(0).getId());
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should complete empty when no layout is active")
        void shouldCompleteEmptyWithoutActiveLayout() {
            repository.withLayout(layout("layout-a", section("basics", 1, "name")).withActive(false));

            StepVerifier.create(service.loadActiveLayout(SCREEN)).verifyComplete();
        }

        @Test
        @DisplayName("should pick the layout of the requested type and fall back to the default")
        void shouldLoadByType() {
            // Given
            repository.withLayout(layout("submission", section("basics", 1, "name")));
            repository.withLayout(layout("approver", section("review", 1, "risk_score"))
                    .withDefault(false)
                    .withLayoutType(OpenIntakeLayoutType.APPROVER));

            // When / Then
            StepVerifier.create(service.loadActiveLayout(SCREEN, OpenIntakeLayoutType.APPROVER))
                    .assertNext(layout -> assertEquals("approver", layout.getId()))
                    .verifyComplete();
            StepVerifier.create(service.loadActiveLayout(SCREEN, OpenIntakeLayoutType.COMPLETED))
                    .assertNext(layout -> assertEquals("submission", layout.getId()))
                    .verifyComplete();
        }
    }

    // ========================================================================
    // SAVE TESTS
    // ========================================================================

    @Nested
    @DisplayName("Saving Layouts")
    class SaveTests {

        @Test
        @DisplayName("should reject a layout with duplicate orders and store nothing")
        void shouldRejectInvalidLayout() {
            LayoutDocument invalid = layout("layout-1", section("basics", 1, "name"), section("ai", 1, "llm_vendor"));

            StepVerifier.create(service.saveLayout(invalid, adminContext()))
                    .expectErrorSatisfies(error -> {
                        LayoutConfigurationException exception = assertInstanceOf(LayoutConfigurationException.class, error);
                        assertEquals(OpenIntakeInternalErrorCodes.LAYOUT_STRUCTURE_INVALID, exception.getErrorInfo());
                        assertEquals(List.of("ai"), List.copyOf(exception.getOffendingSectionIds()));
                    })
                    .verify();
            assertEquals(0, repository.getSaveCount());
        }

        @Test
        @DisplayName("should reject a default template with its own error code")
        void shouldRejectDefaultTemplate() {
            LayoutDocument template = layout("layout-1", section("basics", 1, "name")).withTemplate(true);

            StepVerifier.create(service.saveLayout(template, adminContext()))
                    .expectErrorSatisfies(error -> assertEquals(
                            OpenIntakeInternalErrorCodes.LAYOUT_TEMPLATE_CANNOT_BE_DEFAULT,
                            ((LayoutConfigurationException) error).getErrorInfo()))
                    .verify();
        }

        @Test
        @DisplayName("should deactivate the previous active layout of the same type without deleting it")
        void shouldSupersedePreviousLayout() {
            // Given
            repository.withLayout(layout("layout-1", section("basics", 1, "name")));

            // When
            StepVerifier.create(service.saveLayout(layout("layout-2", section("basics", 1, "name", "type")), adminContext()))
                    .expectNextCount(1)
                    .verifyComplete();

            // Then
            assertEquals(2, repository.size());
            StepVerifier.create(repository.findById("layout-1"))
                    .assertNext(previous -> {
                        assertFalse(previous.isActive());
                        assertFalse(previous.isDefault());
                    })
                    .verifyComplete();
            StepVerifier.create(service.loadActiveLayout(SCREEN))
                    .assertNext(active -> assertEquals("layout-2", active.getId()))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should assign the actor tenant to a layout without one")
        void shouldAssignActorTenant() {
            StepVerifier.create(service.saveLayout(layout("layout-1", section("basics", 1, "name")).withTenantId(null),
                            adminContext()))
                    .assertNext(saved -> assertEquals(TENANT, saved.getTenantId()))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should deny a write to a layout stored by another tenant and block auto-population")
        void shouldDenyCrossTenantWrite() {
            // Given
            repository.withLayout(layout("shared", section("basics", 1, "name")).withTenantId("tenant-b"));
            LayoutDocument attempt = layout("shared").withTenantId(null);

            // When / Then
            StepVerifier.create(service.saveLayout(attempt, adminContext()))
                    .expectError(LayoutAccessDeniedException.class)
                    .verify();
            assertTrue(service.isAutoPopulationBlocked("shared"));
            assertEquals(0, repository.getSaveCount());
        }

        @Test
        @DisplayName("should map an access denial raised by the store")
        void shouldMapStoreAccessDenial() {
            // Given
            IOpenIntakeLayoutRepository denying = new IOpenIntakeLayoutRepository() {
                @Override
                public Flux<IOpenIntakeLayoutDocument> findByScreen(String screenId) {
                    return Flux.empty();
                }

                @Override
                public Mono<IOpenIntakeLayoutDocument> findById(String layoutId) {
                    return Mono.empty();
                }

                @Override
                public Mono<IOpenIntakeLayoutDocument> save(IOpenIntakeLayoutDocument layout) {
                    return Mono.error(new OpenIntakeFormRuntimeException(OpenIntakeInternalErrorCodes.LAYOUT_ACCESS_DENIED));
                }
            };
            LayoutServiceImpl denyingService = newService(denying);

            // When / Then
            StepVerifier.create(denyingService.saveLayout(layout("layout-1", section("basics", 1, "name")), adminContext()))
                    .expectErrorSatisfies(error -> {
                        LayoutAccessDeniedException denied = assertInstanceOf(LayoutAccessDeniedException.class, error);
                        assertFalse(denied.isRetryable());
                    })
                    .verify();
            assertTrue(denyingService.isAutoPopulationBlocked("layout-1"));
        }

        @Test
        @DisplayName("should publish a stored layout and fail for an unknown one")
        void shouldPublishLayout() {
            repository.withLayout(layout("draft-layout", section("basics", 1, "name")).withActive(false));

            StepVerifier.create(service.publishLayout("draft-layout", adminContext()))
                    .assertNext(published -> assertTrue(published.isActive()))
                    .verifyComplete();
            StepVerifier.create(service.publishLayout("missing", adminContext()))
                    .expectError(IllegalArgumentException.class)
                    .verify();
        }
    }

    // ========================================================================
    // AUTO-POPULATION TESTS
    // ========================================================================

    @Nested
    @DisplayName("Auto-Population")
    class AutoPopulationTests {

        private final FieldRegistry registry = FieldRegistry.of(List.of(
                field("name", "Name", OpenIntakeFieldType.TEXT),
                field("llm_vendor", "LLM Vendor", OpenIntakeFieldType.SELECT),
                field("operational_regions", "Operational Regions", OpenIntakeFieldType.MULTI_SELECT)));

        @Test
        @DisplayName("should fill an empty default layout with the fallback steps for an administrator")
        void shouldPopulateEmptyDefaultLayout() {
            // Given
            LayoutDocument empty = layout("layout-1");
            repository.withLayout(empty);

            // When / Then
            StepVerifier.create(service.ensurePopulated(empty, adminContext(), registry))
                    .assertNext(populated -> {
                        List<? extends IOpenIntakeSectionDefinition> steps = populated.getSections();
                        assertEquals(5, steps.size());
                        assertEquals("Agent Details", steps.get(0).getTitle());
                        assertEquals(List.of("name", "type", "category", "description", "version"),
                                steps.get(0).getFieldNames());
                        assertEquals(List.of("llm_vendor"), steps.get(1).getFieldNames());
                        assertEquals(List.of("operational_regions"), steps.get(2).getFieldNames());
                    })
                    .verifyComplete();
            assertEquals(1, repository.getSaveCount());
        }

        @Test
        @DisplayName("should attempt population at most once per layout")
        void shouldPopulateOnce() {
            LayoutDocument empty = layout("layout-1");
            repository.withLayout(empty);

            StepVerifier.create(service.ensurePopulated(empty, adminContext(), registry)).expectNextCount(1).verifyComplete();
            StepVerifier.create(service.ensurePopulated(empty, adminContext(), registry))
                    .assertNext(unchanged -> assertTrue(unchanged.getSections().isEmpty()))
                    .verifyComplete();
            assertEquals(1, repository.getSaveCount());
        }

        @Test
        @DisplayName("should not populate for a non-administrative role")
        void shouldSkipForNonAdmin() {
            LayoutDocument empty = layout("layout-1");

            StepVerifier.create(service.ensurePopulated(empty, context("vendor_user"), registry))
                    .assertNext(unchanged -> assertTrue(unchanged.getSections().isEmpty()))
                    .verifyComplete();
            assertEquals(0, repository.getSaveCount());
        }

        @Test
        @DisplayName("should still populate for an administrator after a vendor opened the layout first")
        void shouldPopulateForAdminAfterVendorVisit() {
            // Given
            LayoutDocument empty = layout("layout-1");
            repository.withLayout(empty);
            StepVerifier.create(service.ensurePopulated(empty, context("vendor_user"), registry))
                    .assertNext(unchanged -> assertTrue(unchanged.getSections().isEmpty()))
                    .verifyComplete();
            assertEquals(0, repository.getSaveCount());

            // When / Then
            StepVerifier.create(service.ensurePopulated(empty, adminContext(), registry))
                    .assertNext(populated -> assertEquals(5, populated.getSections().size()))
                    .verifyComplete();
            assertEquals(1, repository.getSaveCount());
        }

        @Test
        @DisplayName("should leave authored, non-default and template layouts alone")
        void shouldSkipAuthoredLayouts() {
            LayoutDocument authored = layout("authored", section("basics", 1, "name"));
            LayoutDocument nonDefault = layout("secondary").withDefault(false);
            LayoutDocument template = layout("template").withDefault(false).withTemplate(true);

            for (LayoutDocument layout : List.of(authored, nonDefault, template)) {
                StepVerifier.create(service.ensurePopulated(layout, adminContext(), registry))
                        .expectNext(layout)
                        .verifyComplete();
            }
            assertEquals(0, repository.getSaveCount());
        }

        @Test
        @DisplayName("should not retry population after an access denial")
        void shouldNotPopulateBlockedLayout() {
            // Given
            repository.withLayout(layout("shared").withTenantId("tenant-b"));
            StepVerifier.create(service.saveLayout(layout("shared").withTenantId(null), adminContext()))
                    .expectError(LayoutAccessDeniedException.class)
                    .verify();

            // When / Then
            StepVerifier.create(service.ensurePopulated(layout("shared"), adminContext(), registry))
                    .assertNext(unchanged -> assertTrue(unchanged.getSections().isEmpty()))
                    .verifyComplete();
            assertEquals(0, repository.getSaveCount());
        }
    }
}
