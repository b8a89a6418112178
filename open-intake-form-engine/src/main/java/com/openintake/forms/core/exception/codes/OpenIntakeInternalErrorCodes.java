package com.openintake.forms.core.exception.codes;

import com.openintake.forms.integration.contract.IOpenIntakeErrorInfo;
import com.openintake.forms.integration.enumerations.OpenIntakeErrorCategory;
import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum OpenIntakeInternalErrorCodes implements IOpenIntakeErrorInfo {

    LAYOUT_STRUCTURE_INVALID(
            "OIF_ERR_0001",
            OpenIntakeErrorCategory.CONFIGURATION_ERROR,
            "layout.structure.invalid",
            "layout.structure.invalid.resolution"
    ),

    LAYOUT_TEMPLATE_CANNOT_BE_DEFAULT(
            "OIF_ERR_0002",
            OpenIntakeErrorCategory.CONFIGURATION_ERROR,
            "layout.template.cannot.be.default",
            "layout.template.cannot.be.default.resolution"
    ),

    LAYOUT_ACCESS_DENIED(
            "OIF_ERR_0003",
            OpenIntakeErrorCategory.ACCESS_DENIED,
            "layout.access.denied",
            "layout.access.denied.resolution"
    ),

    LAYOUT_NOT_CONFIGURED(
            "OIF_ERR_0004",
            OpenIntakeErrorCategory.NOT_CONFIGURED,
            "layout.not.configured",
            "layout.not.configured.resolution"
    ),

    FIELD_SOURCE_UNAVAILABLE(
            "OIF_ERR_0005",
            OpenIntakeErrorCategory.SOURCE_UNAVAILABLE,
            "field.source.unavailable",
            "field.source.unavailable.resolution"
    ),

    LAYOUT_SERIALIZATION_FAILED(
            "OIF_ERR_0006",
            OpenIntakeErrorCategory.INTERNAL_ERROR,
            "layout.serialization.failed",
            "layout.serialization.failed.resolution"
    )

    ;

    private final String errorCode;
    private final OpenIntakeErrorCategory category;
    private final String errorTemplate;
    private final String resolutionTemplate;
}
