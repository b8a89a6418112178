package com.openintake.forms.core.engine.navigation.hooks;

import com.openintake.forms.core.engine.config.IdentityFieldNames;
import com.openintake.forms.core.engine.config.VendorModelCatalog;
import com.openintake.forms.core.engine.navigation.FieldChangeEvent;
import com.openintake.forms.core.engine.navigation.IOpenIntakeFieldChangeHook;
import com.openintake.forms.core.engine.render.RequiredValueChecker;
import com.openintake.forms.core.util.CastUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Set;

/**
 * Selecting a vendor clears the model unless the model is still offered by the new vendor.
 */
@Slf4j
public class VendorModelResetHook implements IOpenIntakeFieldChangeHook {

    private final IdentityFieldNames identityFields;
    private final VendorModelCatalog catalog;

    public VendorModelResetHook(IdentityFieldNames identityFields, VendorModelCatalog catalog) {
        this.identityFields = identityFields;
        this.catalog = catalog;
    }

    @Override
    public boolean appliesTo(String fieldName) {
        return identityFields.getVendorField().equals(fieldName);
    }

    @Override
    public Set<String> apply(FieldChangeEvent event, Map<String, Object> values) {
        String modelField = identityFields.getModelField();
        Object model = values.get(modelField);
        if (!RequiredValueChecker.isPresent(model)) {
            return Set.of();
        }
        String vendor = CastUtil.castAsString(event.getNewValue());
        if (catalog.isModelValidFor(vendor, CastUtil.castAsString(model))) {
            return Set.of();
        }
        values.put(modelField, event.emptyValueOf(modelField));
        log.debug("Model {} not offered by vendor {}, cleared", model, vendor);
        return Set.of(modelField);
    }
}
