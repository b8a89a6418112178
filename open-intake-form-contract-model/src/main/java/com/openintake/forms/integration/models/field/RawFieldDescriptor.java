package com.openintake.forms.integration.models.field;

import com.openintake.forms.integration.contract.field.IOpenIntakeRawFieldDescriptor;
import com.openintake.forms.integration.enumerations.OpenIntakeFieldProvenance;
import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.io.Serializable;
import java.util.Collections;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@With
public class RawFieldDescriptor implements IOpenIntakeRawFieldDescriptor, Serializable {
    private static final long serialVersionUID = 1L;

    private final String fieldName;
    private final String label;
    private final String fieldType;
    private final String description;
    private final String category;
    private final boolean required;
    @Builder.Default
    private final Map<String, Object> fieldConfig = Collections.emptyMap();
    private final OpenIntakeFieldProvenance provenance;
}
