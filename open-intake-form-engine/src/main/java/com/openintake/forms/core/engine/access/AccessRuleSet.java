package com.openintake.forms.core.engine.access;

import com.openintake.forms.integration.contract.access.IOpenIntakeFieldAccessRule;
import lombok.Getter;
import lombok.ToString;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The access rules of one role on one screen, ready for evaluation.
 * <p>
 * Fields without a rule are visible and editable. A rule that hides a field hides it
 * regardless of its edit flag. When enforcement is off every field is visible and editable.
 */
@Getter
@ToString
public final class AccessRuleSet {

    private final String screenId;
    private final String role;
    private final boolean enforced;
    private final Map<String, IOpenIntakeFieldAccessRule> rulesByField;

    private AccessRuleSet(String screenId, String role, boolean enforced,
                          Map<String, IOpenIntakeFieldAccessRule> rulesByField) {
        this.screenId = screenId;
        this.role = role;
        this.enforced = enforced;
        this.rulesByField = Collections.unmodifiableMap(rulesByField);
    }

    public static AccessRuleSet of(String screenId, String role, Collection<? extends IOpenIntakeFieldAccessRule> rules) {
        Map<String, IOpenIntakeFieldAccessRule> byField = new LinkedHashMap<>();
        for (IOpenIntakeFieldAccessRule rule : rules) {
            if (rule.getRole() == null || rule.getRole().equals(role)) {
                byField.put(rule.getFieldName(), rule);
            }
        }
        return new AccessRuleSet(screenId, role, true, byField);
    }

    /**
     * No rules configured: every field falls back to visible and editable.
     */
    public static AccessRuleSet noRules(String screenId, String role) {
        return new AccessRuleSet(screenId, role, true, Collections.emptyMap());
    }

    public static AccessRuleSet unrestricted(String screenId, String role) {
        return new AccessRuleSet(screenId, role, false, Collections.emptyMap());
    }

    public FieldPermission evaluate(String fieldName) {
        if (!enforced) {
            return FieldPermission.allowAll();
        }
        IOpenIntakeFieldAccessRule rule = rulesByField.get(fieldName);
        if (rule == null) {
            return FieldPermission.allowAll();
        }
        if (!rule.isCanView()) {
            return FieldPermission.hidden();
        }
        return new FieldPermission(true, rule.isCanEdit());
    }

    public boolean isViewable(String fieldName) {
        return evaluate(fieldName).isCanView();
    }
}
