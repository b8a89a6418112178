package com.openintake.forms.integration.contract.source;

import com.openintake.forms.integration.contract.IOpenIntakeFormContext;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Supplies the active values of the tenant's master-data lists.
 */
public interface IOpenIntakeMasterDataProvider {

    /**
     * Returns list id mapped to its active values, in display order.
     */
    Mono<Map<String, List<String>>> loadActiveLists(IOpenIntakeFormContext context);
}
