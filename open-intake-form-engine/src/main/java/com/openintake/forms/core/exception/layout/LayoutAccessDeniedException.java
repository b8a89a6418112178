package com.openintake.forms.core.exception.layout;

import com.openintake.forms.core.exception.codes.OpenIntakeInternalErrorCodes;
import com.openintake.forms.integration.exception.OpenIntakeFormRuntimeException;

import java.util.Map;

/**
 * A layout write targeted a layout owned by another tenant. Never retryable.
 */
public class LayoutAccessDeniedException extends OpenIntakeFormRuntimeException {

    private final String layoutId;
    private final String actingTenantId;

    public LayoutAccessDeniedException(String layoutId, String actingTenantId) {
        super(OpenIntakeInternalErrorCodes.LAYOUT_ACCESS_DENIED,
                Map.of("layoutId", String.valueOf(layoutId), "tenantId", String.valueOf(actingTenantId)));
        this.layoutId = layoutId;
        this.actingTenantId = actingTenantId;
    }

    public String getLayoutId() {
        return layoutId;
    }

    public String getActingTenantId() {
        return actingTenantId;
    }

    public boolean isRetryable() {
        return false;
    }
}
