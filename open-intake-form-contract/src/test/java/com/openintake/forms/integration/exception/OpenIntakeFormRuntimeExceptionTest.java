package com.openintake.forms.integration.exception;

import com.openintake.forms.integration.contract.IOpenIntakeErrorInfo;
import com.openintake.forms.integration.enumerations.OpenIntakeErrorCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OpenIntakeFormRuntimeExceptionTest {

    private static final IOpenIntakeErrorInfo DENIED = new IOpenIntakeErrorInfo() {
        @Override
        public String getErrorCode() {
            return "TEST_001";
        }

        @Override
        public OpenIntakeErrorCategory getCategory() {
            return OpenIntakeErrorCategory.ACCESS_DENIED;
        }

        @Override
        public String getErrorTemplate() {
            return "Access denied to {layoutId}";
        }

        @Override
        public String getResolutionTemplate() {
            return "Ask an administrator of the owning tenant";
        }
    };

    @Test
    @DisplayName("should carry error code and template variables in its message")
    void shouldDescribeError() {
        OpenIntakeFormRuntimeException exception =
                new OpenIntakeFormRuntimeException(DENIED, Map.of("layoutId", "layout-1"));

        assertTrue(exception.getMessage().startsWith("TEST_001"));
        assertTrue(exception.getMessage().contains("layout-1"));
        assertTrue(exception.isCategory(OpenIntakeErrorCategory.ACCESS_DENIED));
    }

    @Test
    @DisplayName("should find the category through wrapping exceptions")
    void shouldFindCategoryThroughWrappers() {
        RuntimeException wrapped = new RuntimeException("save failed",
                new IllegalStateException(new OpenIntakeFormRuntimeException(DENIED)));

        assertTrue(OpenIntakeFormRuntimeException.hasCategory(wrapped, OpenIntakeErrorCategory.ACCESS_DENIED));
        assertFalse(OpenIntakeFormRuntimeException.hasCategory(wrapped, OpenIntakeErrorCategory.CONFIGURATION_ERROR));
        assertFalse(OpenIntakeFormRuntimeException.hasCategory(new RuntimeException("plain"),
                OpenIntakeErrorCategory.ACCESS_DENIED));
    }
}
