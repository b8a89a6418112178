package com.openintake.forms.integration.contract.source;

import com.openintake.forms.integration.contract.IOpenIntakeFormContext;
import com.openintake.forms.integration.contract.field.IOpenIntakeRawFieldDescriptor;
import com.openintake.forms.integration.enumerations.OpenIntakeFieldProvenance;
import reactor.core.publisher.Flux;

/**
 * Supplies the raw field descriptors of one catalog.
 * Implementations are pure fetches with no side effects.
 */
public interface IOpenIntakeFieldSourceProvider {

    /**
     * The catalog this provider reads. Descriptors it emits are tagged with this provenance.
     */
    OpenIntakeFieldProvenance getProvenance();

    /**
     * Loads the catalog's fields for the given context. May error; callers degrade to empty.
     */
    Flux<IOpenIntakeRawFieldDescriptor> loadFields(IOpenIntakeFormContext context);
}
