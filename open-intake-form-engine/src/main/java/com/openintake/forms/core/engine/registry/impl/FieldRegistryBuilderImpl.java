package com.openintake.forms.core.engine.registry.impl;

import com.openintake.forms.core.engine.config.OpenIntakeFormEngineConfig;
import com.openintake.forms.core.engine.provenance.FieldSourceSnapshot;
import com.openintake.forms.core.engine.registry.FieldConfigParser;
import com.openintake.forms.core.engine.registry.FieldRegistry;
import com.openintake.forms.core.engine.registry.IOpenIntakeFieldRegistryBuilder;
import com.openintake.forms.core.util.CommonUtil;
import com.openintake.forms.integration.contract.field.IOpenIntakeRawFieldDescriptor;
import com.openintake.forms.integration.enumerations.OpenIntakeFieldProvenance;
import com.openintake.forms.integration.models.field.FieldDefinition;
import com.openintake.forms.integration.models.field.FieldOption;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Merges field descriptors in a fixed precedence order.
 * <p>
 * The first definition of a name wins. A later definition replaces it only when the
 * registered one carries no configuration and the later one does, so a vague source can
 * fill a gap but never overwrite a fully specified field. Sources missing from the
 * configured precedence are merged last, in declaration order.
 */
@Slf4j
public class FieldRegistryBuilderImpl implements IOpenIntakeFieldRegistryBuilder {

    private final OpenIntakeFormEngineConfig config;
    private final FieldConfigParser parser;

    public FieldRegistryBuilderImpl(OpenIntakeFormEngineConfig config, FieldConfigParser parser) {
        this.config = config;
        this.parser = parser;
    }

    @Override
    public FieldRegistry build(FieldSourceSnapshot snapshot, Map<String, List<String>> masterDataLists) {
        Map<String, FieldDefinition> registry = new LinkedHashMap<>();

        for (OpenIntakeFieldProvenance provenance : mergeOrder()) {
            for (IOpenIntakeRawFieldDescriptor descriptor : snapshot.descriptorsOf(provenance)) {
                if (CommonUtil.isNullOrBlank(descriptor.getFieldName())) {
                    log.warn("Ignoring {} descriptor without a field name: label={}",
                            provenance.getSourceName(), descriptor.getLabel());
                    continue;
                }
                merge(registry, parser.parse(descriptor));
            }
        }

        fillMasterDataOptions(registry, CommonUtil.nonNullMap(masterDataLists));
        log.debug("Field registry built with {} fields", registry.size());
        return FieldRegistry.of(registry);
    }

    private List<OpenIntakeFieldProvenance> mergeOrder() {
        List<OpenIntakeFieldProvenance> order = new ArrayList<>(config.getProvenancePrecedence());
        for (OpenIntakeFieldProvenance provenance : OpenIntakeFieldProvenance.values()) {
            if (!order.contains(provenance)) {
                order.add(provenance);
            }
        }
        return order;
    }

    private void merge(Map<String, FieldDefinition> registry, FieldDefinition incoming) {
        FieldDefinition existing = registry.get(incoming.getName());
        if (existing == null) {
            registry.put(incoming.getName(), incoming);
            return;
        }
        if (!existing.isConfigured() && incoming.isConfigured()) {
            log.debug("Field {} from {} fills configuration gap left by {}",
                    incoming.getName(), incoming.getProvenance(), existing.getProvenance());
            registry.put(incoming.getName(), incoming);
        }
    }

    private void fillMasterDataOptions(Map<String, FieldDefinition> registry, Map<String, List<String>> lists) {
        registry.replaceAll((name, field) -> {
            if (field.getMasterDataListId() == null || !field.getOptions().isEmpty()) {
                return field;
            }
            List<String> values = lists.get(field.getMasterDataListId());
            if (values == null) {
                log.debug("Master-data list {} for field {} not available", field.getMasterDataListId(), name);
                return field;
            }
            return field.withOptions(values.stream().map(FieldOption::of).collect(Collectors.toList()));
        });
    }
}
