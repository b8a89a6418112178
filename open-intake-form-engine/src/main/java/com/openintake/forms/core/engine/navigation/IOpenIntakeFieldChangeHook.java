package com.openintake.forms.core.engine.navigation;

import java.util.Map;
import java.util.Set;

/**
 * Side effect attached to changes of specific fields.
 */
public interface IOpenIntakeFieldChangeHook {

    boolean appliesTo(String fieldName);

    /**
     * Applies the side effect to the form values, which already hold the new value.
     *
     * @return names of the fields this hook changed
     */
    Set<String> apply(FieldChangeEvent event, Map<String, Object> values);
}
