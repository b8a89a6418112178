package com.openintake.forms.core.exception.layout;

import com.openintake.forms.core.exception.codes.OpenIntakeInternalErrorCodes;
import com.openintake.forms.integration.exception.OpenIntakeFormRuntimeException;
import lombok.Getter;

import java.util.Map;

@Getter
public class LayoutNotConfiguredException extends OpenIntakeFormRuntimeException {
    private final String screenId;

    public LayoutNotConfiguredException(String screenId) {
        super(OpenIntakeInternalErrorCodes.LAYOUT_NOT_CONFIGURED, Map.of("screenId", String.valueOf(screenId)));
        this.screenId = screenId;
    }
}
