package com.openintake.forms.core.engine.provenance.impl;

import com.openintake.forms.core.engine.config.OpenIntakeFormEngineConfig;
import com.openintake.forms.core.engine.provenance.FieldSourceSnapshot;
import com.openintake.forms.core.engine.provenance.IOpenIntakeFieldProvenanceLoader;
import com.openintake.forms.core.exception.codes.OpenIntakeInternalErrorCodes;
import com.openintake.forms.integration.contract.IOpenIntakeFormContext;
import com.openintake.forms.integration.contract.field.IOpenIntakeRawFieldDescriptor;
import com.openintake.forms.integration.contract.source.IOpenIntakeFieldSourceProvider;
import com.openintake.forms.integration.enumerations.OpenIntakeFieldProvenance;
import com.openintake.forms.integration.models.field.RawFieldDescriptor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Fetches every field source concurrently and joins the results.
 *
 * <h2>Failure handling</h2>
 * <ul>
 *   <li>A source that errors contributes an empty collection and is marked unavailable</li>
 *   <li>A source that does not complete within the configured timeout is treated the same way</li>
 *   <li>Descriptors are re-tagged with the provenance of the provider that returned them</li>
 * </ul>
 */
@Slf4j
public class FieldProvenanceLoaderImpl implements IOpenIntakeFieldProvenanceLoader {

    private final List<IOpenIntakeFieldSourceProvider> providers;
    private final OpenIntakeFormEngineConfig config;

    public FieldProvenanceLoaderImpl(List<IOpenIntakeFieldSourceProvider> providers, OpenIntakeFormEngineConfig config) {
        this.providers = List.copyOf(providers);
        this.config = config;
    }

    @Override
    public Mono<FieldSourceSnapshot> loadFieldSources(IOpenIntakeFormContext context) {
        if (providers.isEmpty()) {
            return Mono.just(FieldSourceSnapshot.empty());
        }

        List<Mono<SourceResult>> fetches = providers.stream()
                .map(provider -> loadSource(provider, context))
                .collect(Collectors.toList());

        return Mono.zip(fetches, results -> {
            Map<OpenIntakeFieldProvenance, List<IOpenIntakeRawFieldDescriptor>> sources =
                    new EnumMap<>(OpenIntakeFieldProvenance.class);
            Set<OpenIntakeFieldProvenance> unavailable = EnumSet.noneOf(OpenIntakeFieldProvenance.class);
            for (Object result : results) {
                SourceResult sourceResult = (SourceResult) result;
                sources.computeIfAbsent(sourceResult.provenance, p -> new ArrayList<>())
                        .addAll(sourceResult.descriptors);
                if (!sourceResult.available) {
                    unavailable.add(sourceResult.provenance);
                }
            }
            log.debug("Field sources settled for screen={}: loaded={}, unavailable={}",
                    context.getScreenId(), sources.keySet(), unavailable);
            return new FieldSourceSnapshot(sources, unavailable);
        });
    }

    private Mono<SourceResult> loadSource(IOpenIntakeFieldSourceProvider provider, IOpenIntakeFormContext context) {
        OpenIntakeFieldProvenance provenance = provider.getProvenance();
        return Flux.defer(() -> provider.loadFields(context))
                .map(descriptor -> retag(descriptor, provenance))
                .collectList()
                .timeout(config.getSourceFetchTimeout())
                .map(descriptors -> new SourceResult(provenance, descriptors, true))
                .onErrorResume(e -> {
                    log.warn("[{}] Field source {} unavailable for screen {}, treating as empty: {}",
                            OpenIntakeInternalErrorCodes.FIELD_SOURCE_UNAVAILABLE.getErrorCode(),
                            provenance.getSourceName(), context.getScreenId(), e.toString());
                    return Mono.just(new SourceResult(provenance, List.of(), false));
                });
    }

    private static IOpenIntakeRawFieldDescriptor retag(IOpenIntakeRawFieldDescriptor descriptor,
                                                      OpenIntakeFieldProvenance provenance) {
        if (descriptor.getProvenance() == provenance) {
            return descriptor;
        }
        return RawFieldDescriptor.builder()
                .fieldName(descriptor.getFieldName())
                .label(descriptor.getLabel())
                .fieldType(descriptor.getFieldType())
                .description(descriptor.getDescription())
                .category(descriptor.getCategory())
                .required(descriptor.isRequired())
                .fieldConfig(descriptor.getFieldConfig())
                .provenance(provenance)
                .build();
    }

    private static final class SourceResult {
        private final OpenIntakeFieldProvenance provenance;
        private final List<IOpenIntakeRawFieldDescriptor> descriptors;
        private final boolean available;

        private SourceResult(OpenIntakeFieldProvenance provenance,
                             List<IOpenIntakeRawFieldDescriptor> descriptors,
                             boolean available) {
            this.provenance = provenance;
            this.descriptors = descriptors;
            this.available = available;
        }
    }
}
