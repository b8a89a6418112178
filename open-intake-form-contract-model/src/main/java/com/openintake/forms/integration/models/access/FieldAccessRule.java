package com.openintake.forms.integration.models.access;

import com.openintake.forms.integration.contract.access.IOpenIntakeFieldAccessRule;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.io.Serializable;

@Data
@Builder(toBuilder = true)
@With
public class FieldAccessRule implements IOpenIntakeFieldAccessRule, Serializable {
    private static final long serialVersionUID = 1L;

    @NotBlank
    private final String fieldName;
    @NotBlank
    private final String role;
    private final boolean canView;
    private final boolean canEdit;

    public static FieldAccessRule from(IOpenIntakeFieldAccessRule rule) {
        if (rule instanceof FieldAccessRule) {
            return (FieldAccessRule) rule;
        }
        return new FieldAccessRule(rule.getFieldName(), rule.getRole(), rule.isCanView(), rule.isCanEdit());
    }
}
