package com.openintake.forms.core.engine.registry;

import com.openintake.forms.core.engine.provenance.FieldSourceSnapshot;

import java.util.List;
import java.util.Map;

/**
 * Merges provenance results into one field registry.
 */
public interface IOpenIntakeFieldRegistryBuilder {

    /**
     * Builds the registry from a settled snapshot.
     *
     * @param snapshot            descriptors per source
     * @param masterDataLists     active master-data values by list id, used to fill option gaps
     */
    FieldRegistry build(FieldSourceSnapshot snapshot, Map<String, List<String>> masterDataLists);
}
