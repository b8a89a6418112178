package com.openintake.forms.core.engine.navigation.hooks;

import com.openintake.forms.core.engine.config.IdentityFieldNames;
import com.openintake.forms.core.engine.navigation.FieldChangeEvent;
import com.openintake.forms.core.engine.navigation.IOpenIntakeFieldChangeHook;
import com.openintake.forms.core.engine.render.RequiredValueChecker;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Set;

/**
 * Selecting a taxonomy category clears the previously chosen subcategory.
 */
@Slf4j
public class CategoryResetHook implements IOpenIntakeFieldChangeHook {

    private final IdentityFieldNames identityFields;

    public CategoryResetHook(IdentityFieldNames identityFields) {
        this.identityFields = identityFields;
    }

    @Override
    public boolean appliesTo(String fieldName) {
        return identityFields.getCategoryField().equals(fieldName);
    }

    @Override
    public Set<String> apply(FieldChangeEvent event, Map<String, Object> values) {
        String subcategory = identityFields.getSubcategoryField();
        if (!RequiredValueChecker.isPresent(values.get(subcategory))) {
            return Set.of();
        }
        values.put(subcategory, event.emptyValueOf(subcategory));
        log.debug("Category changed to {}, cleared {}", event.getNewValue(), subcategory);
        return Set.of(subcategory);
    }
}
