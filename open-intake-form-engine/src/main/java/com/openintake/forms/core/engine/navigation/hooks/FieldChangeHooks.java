package com.openintake.forms.core.engine.navigation.hooks;

import com.openintake.forms.core.engine.config.IdentityFieldNames;
import com.openintake.forms.core.engine.config.OpenIntakeFormEngineConfig;
import com.openintake.forms.core.engine.config.SelectAllOptionRule;
import com.openintake.forms.core.engine.navigation.IOpenIntakeFieldChangeHook;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

public final class FieldChangeHooks {

    private FieldChangeHooks() {
    }

    /**
     * The identity resets first, then the select-all rules, then the generic dependent reset.
     * The model field is left to the vendor reset, which keeps a model the new vendor still offers.
     */
    public static List<IOpenIntakeFieldChangeHook> defaultHooks(OpenIntakeFormEngineConfig config) {
        IdentityFieldNames identityFields = config.getIdentityFieldNames();
        List<IOpenIntakeFieldChangeHook> hooks = new ArrayList<>();
        hooks.add(new CategoryResetHook(identityFields));
        hooks.add(new VendorModelResetHook(identityFields, config.getVendorModelCatalog()));
        for (SelectAllOptionRule rule : config.getSelectAllRules()) {
            hooks.add(new SelectAllOptionHook(rule));
        }
        hooks.add(new DependentClearHook(Set.of(identityFields.getModelField())));
        return List.copyOf(hooks);
    }
}
