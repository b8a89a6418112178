package com.openintake.forms.core.engine.access.impl;

import com.openintake.forms.integration.contract.access.IOpenIntakeAccessRuleRepository;
import com.openintake.forms.integration.contract.access.IOpenIntakeFieldAccessRule;
import com.openintake.forms.integration.models.access.FieldAccessRule;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory access rule store keyed by screen, field and role.
 */
public class InMemoryAccessRuleRepository implements IOpenIntakeAccessRuleRepository {

    private final Map<String, FieldAccessRule> rules = new ConcurrentHashMap<>();

    public InMemoryAccessRuleRepository withRule(String screenId, IOpenIntakeFieldAccessRule rule) {
        FieldAccessRule stored = FieldAccessRule.from(rule);
        rules.put(key(screenId, stored.getFieldName(), stored.getRole()), stored);
        return this;
    }

    @Override
    public Flux<IOpenIntakeFieldAccessRule> findRules(String screenId, String role) {
        String prefix = screenId + "/";
        return Flux.defer(() -> Flux.fromIterable(new ArrayList<>(rules.entrySet())))
                .filter(entry -> entry.getKey().startsWith(prefix))
                .map(Map.Entry::getValue)
                .filter(rule -> rule.getRole().equals(role))
                .cast(IOpenIntakeFieldAccessRule.class);
    }

    @Override
    public Mono<IOpenIntakeFieldAccessRule> save(String screenId, IOpenIntakeFieldAccessRule rule) {
        return Mono.fromCallable(() -> {
            FieldAccessRule stored = FieldAccessRule.from(rule);
            rules.put(key(screenId, stored.getFieldName(), stored.getRole()), stored);
            return stored;
        });
    }

    /**
     * Every stored rule of a screen, for inspection.
     */
    public List<FieldAccessRule> rulesOf(String screenId) {
        String prefix = screenId + "/";
        List<FieldAccessRule> result = new ArrayList<>();
        rules.forEach((key, rule) -> {
            if (key.startsWith(prefix)) {
                result.add(rule);
            }
        });
        return result;
    }

    private static String key(String screenId, String fieldName, String role) {
        return screenId + "/" + fieldName + "/" + role;
    }
}
