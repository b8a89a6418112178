package com.openintake.forms.core.engine.provenance.impl;

import com.openintake.forms.integration.contract.IOpenIntakeFormContext;
import com.openintake.forms.integration.contract.source.IOpenIntakeMasterDataProvider;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Master data lists held in memory, keyed by list id.
 */
public class InMemoryMasterDataProvider implements IOpenIntakeMasterDataProvider {

    private final Map<String, List<String>> lists = new LinkedHashMap<>();

    public synchronized InMemoryMasterDataProvider withList(String listId, List<String> activeValues) {
        lists.put(listId, List.copyOf(activeValues));
        return this;
    }

    @Override
    public synchronized Mono<Map<String, List<String>>> loadActiveLists(IOpenIntakeFormContext context) {
        return Mono.just(Map.copyOf(lists));
    }
}
