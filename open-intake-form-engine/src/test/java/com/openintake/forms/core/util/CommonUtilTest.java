package com.openintake.forms.core.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommonUtilTest {

    @Test
    @DisplayName("should split comma separated values and drop blank entries")
    void shouldSplitCsv() {
        assertEquals(List.of("US", "EU", "APAC"), CommonUtil.csvToList(" US, EU,,APAC , "));
        assertEquals(List.of(), CommonUtil.csvToList("   "));
        assertEquals(List.of(), CommonUtil.csvToList(null));
    }

    @Test
    @DisplayName("should match a keyword in any of the texts ignoring case")
    void shouldMatchKeyword() {
        assertTrue(CommonUtil.anyContainsIgnoreCase("vendor", "AI Configuration", "LLM Vendor and model"));
        assertFalse(CommonUtil.anyContainsIgnoreCase("vendor", "Basics", null));
        assertFalse(CommonUtil.anyContainsIgnoreCase(" ", "anything"));
    }
}
