package com.openintake.forms.core.engine.provenance.impl;

import com.openintake.forms.integration.contract.IOpenIntakeFormContext;
import com.openintake.forms.integration.contract.field.IOpenIntakeRawFieldDescriptor;
import com.openintake.forms.integration.contract.source.IOpenIntakeFieldSourceProvider;
import com.openintake.forms.integration.enumerations.OpenIntakeFieldProvenance;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Field source that serves a fixed list of descriptors, regardless of context.
 */
public class StaticFieldSourceProvider implements IOpenIntakeFieldSourceProvider {

    private final OpenIntakeFieldProvenance provenance;
    private final List<IOpenIntakeRawFieldDescriptor> descriptors = new CopyOnWriteArrayList<>();

    public StaticFieldSourceProvider(OpenIntakeFieldProvenance provenance) {
        this.provenance = provenance;
    }

    public static StaticFieldSourceProvider of(OpenIntakeFieldProvenance provenance,
                                               List<? extends IOpenIntakeRawFieldDescriptor> descriptors) {
        StaticFieldSourceProvider provider = new StaticFieldSourceProvider(provenance);
        provider.descriptors.addAll(descriptors);
        return provider;
    }

    public StaticFieldSourceProvider withDescriptor(IOpenIntakeRawFieldDescriptor descriptor) {
        descriptors.add(descriptor);
        return this;
    }

    @Override
    public OpenIntakeFieldProvenance getProvenance() {
        return provenance;
    }

    @Override
    public Flux<IOpenIntakeRawFieldDescriptor> loadFields(IOpenIntakeFormContext context) {
        return Flux.fromIterable(descriptors);
    }
}
