package com.openintake.forms.core.exception;

public class OpenIntakeException extends Exception {
    public OpenIntakeException(String message) {
        super(message);
    }
    public OpenIntakeException(String message, Throwable cause) {
        super(message, cause);
    }
    public OpenIntakeException(Throwable cause) {
        super(cause);
    }
}
