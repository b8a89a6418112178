package com.openintake.forms.integration.contract;

import com.openintake.forms.integration.enumerations.OpenIntakeErrorCategory;

public interface IOpenIntakeErrorInfo {
    String getErrorCode();
    OpenIntakeErrorCategory getCategory();
    String getErrorTemplate();
    String getResolutionTemplate();
}
