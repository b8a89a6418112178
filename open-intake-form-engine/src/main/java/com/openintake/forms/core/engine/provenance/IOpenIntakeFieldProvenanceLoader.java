package com.openintake.forms.core.engine.provenance;

import com.openintake.forms.integration.contract.IOpenIntakeFormContext;
import reactor.core.publisher.Mono;

/**
 * Loads the raw field descriptors of every configured source for a context.
 */
public interface IOpenIntakeFieldProvenanceLoader {

    /**
     * Fetches all sources concurrently and emits once every fetch has settled.
     * Never errors because of a single source; failed sources are reported as unavailable.
     */
    Mono<FieldSourceSnapshot> loadFieldSources(IOpenIntakeFormContext context);
}
