package com.openintake.forms.core.engine.session;

public enum FormViewState {
    /** Sources are being fetched; nothing may be drawn yet. */
    LOADING,
    READY,
    /** The screen has no active layout. */
    NOT_CONFIGURED,
    FAILED
}
