package com.openintake.forms.integration.contract;

/**
 * The controlling context of a form screen: who is acting, for which tenant, on which screen.
 * A change of tenant, screen or role invalidates every fetched field source.
 */
public interface IOpenIntakeFormContext {

    /**
     * Tenant the acting user belongs to.
     */
    String getTenantId();

    /**
     * Screen whose layout and access rules apply.
     */
    String getScreenId();

    /**
     * Role of the acting user, for example {@code vendor_user} or {@code tenant_admin}.
     */
    String getRole();

    /**
     * Identifier of the acting user.
     */
    String getUserId();

    /**
     * Workflow stage of the record being viewed, if any. Selects the layout type.
     */
    String getWorkflowStage();
}
