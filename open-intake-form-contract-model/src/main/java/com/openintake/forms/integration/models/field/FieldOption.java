package com.openintake.forms.integration.models.field;

import com.openintake.forms.integration.contract.field.IOpenIntakeFieldDefinition.IOpenIntakeFieldOption;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.io.Serializable;

@Data
public class FieldOption implements IOpenIntakeFieldOption, Serializable {
    private static final long serialVersionUID = 1L;

    @NotNull
    private final String value;
    private final String label;

    public static FieldOption of(String value, String label) {
        return new FieldOption(value, label == null || label.isBlank() ? value : label);
    }

    public static FieldOption of(String value) {
        return new FieldOption(value, value);
    }
}
