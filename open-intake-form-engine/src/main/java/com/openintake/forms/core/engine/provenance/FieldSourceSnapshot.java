package com.openintake.forms.core.engine.provenance;

import com.openintake.forms.integration.contract.field.IOpenIntakeRawFieldDescriptor;
import com.openintake.forms.integration.enumerations.OpenIntakeFieldProvenance;
import lombok.Data;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The settled result of loading every field source for one context.
 * <p>
 * A source that failed or timed out is present with an empty collection and is listed in
 * {@link #getUnavailableSources()}.
 */
@Data
public class FieldSourceSnapshot {

    private final Map<OpenIntakeFieldProvenance, List<IOpenIntakeRawFieldDescriptor>> sources;
    private final Set<OpenIntakeFieldProvenance> unavailableSources;

    public static FieldSourceSnapshot empty() {
        return new FieldSourceSnapshot(new EnumMap<>(OpenIntakeFieldProvenance.class),
                EnumSet.noneOf(OpenIntakeFieldProvenance.class));
    }

    public List<IOpenIntakeRawFieldDescriptor> descriptorsOf(OpenIntakeFieldProvenance provenance) {
        List<IOpenIntakeRawFieldDescriptor> descriptors = sources.get(provenance);
        return descriptors == null ? Collections.emptyList() : descriptors;
    }

    public boolean isDegraded() {
        return !unavailableSources.isEmpty();
    }
}
