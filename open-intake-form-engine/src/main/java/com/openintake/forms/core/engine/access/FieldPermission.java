package com.openintake.forms.core.engine.access;

import lombok.Data;

/**
 * Effective permission of a role on one field.
 */
@Data
public class FieldPermission {

    private static final FieldPermission ALLOW_ALL = new FieldPermission(true, true);
    private static final FieldPermission HIDDEN = new FieldPermission(false, false);

    private final boolean canView;
    private final boolean canEdit;

    public static FieldPermission allowAll() {
        return ALLOW_ALL;
    }

    public static FieldPermission hidden() {
        return HIDDEN;
    }

    public static FieldPermission readOnly() {
        return new FieldPermission(true, false);
    }
}
