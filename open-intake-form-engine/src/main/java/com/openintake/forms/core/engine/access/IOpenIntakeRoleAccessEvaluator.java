package com.openintake.forms.core.engine.access;

import com.openintake.forms.integration.contract.access.IOpenIntakeFieldAccessRule;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Computes the effective view and edit permission of a role on each field of a screen.
 * <p>
 * Absent rules grant full access: newly added fields are usable before an administrator
 * has configured permissions for them.
 */
public interface IOpenIntakeRoleAccessEvaluator {

    /**
     * Loads the rules of a role on a screen. Never errors; an unreachable rule store
     * yields an empty rule set.
     */
    Mono<AccessRuleSet> loadRuleSet(String screenId, String role);

    /**
     * Evaluates a single field. Loads the rule set on each call.
     */
    Mono<FieldPermission> evaluate(String screenId, String fieldName, String role);

    /**
     * Stores a rule. A rule granting edit without view is stored with edit revoked.
     */
    Mono<IOpenIntakeFieldAccessRule> saveRule(String screenId, IOpenIntakeFieldAccessRule rule);

    /**
     * Stores rules given in the role permission map format {@code {role: {view, edit}}}.
     */
    Mono<Void> saveRolePermissions(String screenId, String fieldName,
                                   Map<String, Map<String, Boolean>> rolePermissions);
}
