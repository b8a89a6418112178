package com.openintake.forms.integration.exception;

import com.openintake.forms.integration.contract.IOpenIntakeErrorInfo;
import com.openintake.forms.integration.enumerations.OpenIntakeErrorCategory;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * Error carrying a categorized error code. Collaborators signal failures with it so
 * the engine can tell access denials and configuration errors apart from transport failures.
 */
@Getter
@ToString
public class OpenIntakeFormRuntimeException extends RuntimeException implements IOpenIntakeFormException {
    protected final IOpenIntakeErrorInfo errorInfo;
    protected final Map<String, String> templateVariables;
    protected final Throwable rootCause;
    protected final Object additionalInfo;

    public OpenIntakeFormRuntimeException(IOpenIntakeErrorInfo errorInfo, Map<String, String> templateVariables,
                                          Throwable rootCause, Object additionalInfo) {
        super(errorInfo.getErrorCode() + ": " + errorInfo.getErrorTemplate() + " " + templateVariables, rootCause);
        this.errorInfo = errorInfo;
        this.templateVariables = templateVariables;
        this.rootCause = rootCause;
        this.additionalInfo = additionalInfo;
    }

    public OpenIntakeFormRuntimeException(IOpenIntakeErrorInfo errorInfo) {
        this(errorInfo, Map.of(), null, null);
    }

    public OpenIntakeFormRuntimeException(IOpenIntakeErrorInfo errorInfo, Map<String, String> templateVariables) {
        this(errorInfo, templateVariables, null, null);
    }

    public OpenIntakeFormRuntimeException(IOpenIntakeErrorInfo errorInfo, Throwable rootCause) {
        this(errorInfo, Map.of(), rootCause, null);
    }

    public boolean isCategory(OpenIntakeErrorCategory category) {
        return errorInfo.getCategory() == category;
    }

    /**
     * Whether the error belongs to the given category, looking through wrappers.
     */
    public static boolean hasCategory(Throwable error, OpenIntakeErrorCategory category) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof IOpenIntakeFormException
                    && ((IOpenIntakeFormException) current).getErrorInfo().getCategory() == category) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }
}
