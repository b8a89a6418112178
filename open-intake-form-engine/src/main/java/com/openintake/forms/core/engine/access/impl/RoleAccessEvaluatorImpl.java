package com.openintake.forms.core.engine.access.impl;

import com.openintake.forms.core.engine.access.AccessRuleSet;
import com.openintake.forms.core.engine.access.FieldPermission;
import com.openintake.forms.core.engine.access.IOpenIntakeRoleAccessEvaluator;
import com.openintake.forms.core.engine.config.OpenIntakeFormEngineConfig;
import com.openintake.forms.integration.contract.access.IOpenIntakeAccessRuleRepository;
import com.openintake.forms.integration.contract.access.IOpenIntakeFieldAccessRule;
import com.openintake.forms.integration.models.access.FieldAccessRule;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Role access evaluator backed by an optional rule repository.
 * <p>
 * Without a repository every screen behaves as if no rules were configured.
 */
@Slf4j
public class RoleAccessEvaluatorImpl implements IOpenIntakeRoleAccessEvaluator {

    private final IOpenIntakeAccessRuleRepository repository;
    private final OpenIntakeFormEngineConfig config;

    public RoleAccessEvaluatorImpl(IOpenIntakeAccessRuleRepository repository, OpenIntakeFormEngineConfig config) {
        this.repository = repository;
        this.config = config;
    }

    @Override
    public Mono<AccessRuleSet> loadRuleSet(String screenId, String role) {
        if (!config.policyFor(screenId).isEnforceFieldPermissions()) {
            return Mono.just(AccessRuleSet.unrestricted(screenId, role));
        }
        if (repository == null) {
            return Mono.just(AccessRuleSet.noRules(screenId, role));
        }
        return Flux.defer(() -> repository.findRules(screenId, role))
                .collectList()
                .timeout(config.getSourceFetchTimeout())
                .map(rules -> AccessRuleSet.of(screenId, role, rules))
                .onErrorResume(e -> {
                    log.warn("Access rules for screen {} role {} unavailable, no rules applied: {}",
                            screenId, role, e.toString());
                    return Mono.just(AccessRuleSet.noRules(screenId, role));
                });
    }

    @Override
    public Mono<FieldPermission> evaluate(String screenId, String fieldName, String role) {
        return loadRuleSet(screenId, role).map(ruleSet -> ruleSet.evaluate(fieldName));
    }

    @Override
    public Mono<IOpenIntakeFieldAccessRule> saveRule(String screenId, IOpenIntakeFieldAccessRule rule) {
        if (repository == null) {
            return Mono.error(new IllegalStateException("No access rule repository configured"));
        }
        FieldAccessRule normalized = FieldAccessRule.from(rule);
        if (normalized.isCanEdit() && !normalized.isCanView()) {
            log.debug("Rule for field {} role {} grants edit without view, revoking edit",
                    normalized.getFieldName(), normalized.getRole());
            normalized = normalized.withCanEdit(false);
        }
        return repository.save(screenId, normalized);
    }

    @Override
    public Mono<Void> saveRolePermissions(String screenId, String fieldName,
                                          Map<String, Map<String, Boolean>> rolePermissions) {
        return Flux.fromIterable(rolePermissions.entrySet())
                .map(entry -> FieldAccessRule.builder()
                        .fieldName(fieldName)
                        .role(entry.getKey())
                        .canView(Boolean.TRUE.equals(entry.getValue().get("view")))
                        .canEdit(Boolean.TRUE.equals(entry.getValue().get("edit")))
                        .build())
                .concatMap(rule -> saveRule(screenId, rule))
                .then();
    }
}
