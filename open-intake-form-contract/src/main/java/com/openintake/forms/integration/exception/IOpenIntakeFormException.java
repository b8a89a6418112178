package com.openintake.forms.integration.exception;

import com.openintake.forms.integration.contract.IOpenIntakeErrorInfo;

import java.util.Map;

public interface IOpenIntakeFormException {
    IOpenIntakeErrorInfo getErrorInfo();
    Map<String, String> getTemplateVariables();
    Throwable getRootCause();
    Object getAdditionalInfo();
}
