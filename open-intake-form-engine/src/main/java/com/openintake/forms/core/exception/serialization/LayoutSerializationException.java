package com.openintake.forms.core.exception.serialization;

import com.openintake.forms.core.exception.OpenIntakeException;

/**
 * A persisted layout document could not be read or written.
 */
public class LayoutSerializationException extends OpenIntakeException {
    public LayoutSerializationException(String message) {
        super(message);
    }
    public LayoutSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
