package com.openintake.forms.integration.models;

import com.openintake.forms.integration.contract.IOpenIntakeFormContext;
import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.io.Serializable;

@Data
@Builder(toBuilder = true)
@With
public class FormContext implements IOpenIntakeFormContext, Serializable {
    private static final long serialVersionUID = 1L;

    private final String tenantId;
    private final String screenId;
    private final String role;
    private final String userId;
    private final String workflowStage;
}
