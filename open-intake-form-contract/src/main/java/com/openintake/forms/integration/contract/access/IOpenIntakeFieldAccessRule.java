package com.openintake.forms.integration.contract.access;

/**
 * Role permission on one field of a screen.
 * A rule that hides a field hides it regardless of {@link #isCanEdit()}.
 */
public interface IOpenIntakeFieldAccessRule {

    String getFieldName();

    String getRole();

    boolean isCanView();

    boolean isCanEdit();
}
