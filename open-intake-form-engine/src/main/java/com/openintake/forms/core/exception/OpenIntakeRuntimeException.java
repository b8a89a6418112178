package com.openintake.forms.core.exception;

public class OpenIntakeRuntimeException extends RuntimeException {
    public OpenIntakeRuntimeException(String message) {
        super(message);
    }
    public OpenIntakeRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }
    public OpenIntakeRuntimeException(Throwable cause) {
        super(cause);
    }
}
