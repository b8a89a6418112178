package com.openintake.forms.integration.contract.access;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Persistence boundary for field access rules.
 */
public interface IOpenIntakeAccessRuleRepository {

    /**
     * Rules configured for a role on a screen. Empty when none are configured.
     */
    Flux<IOpenIntakeFieldAccessRule> findRules(String screenId, String role);

    /**
     * Stores a rule, replacing any rule for the same field and role.
     */
    Mono<IOpenIntakeFieldAccessRule> save(String screenId, IOpenIntakeFieldAccessRule rule);
}
