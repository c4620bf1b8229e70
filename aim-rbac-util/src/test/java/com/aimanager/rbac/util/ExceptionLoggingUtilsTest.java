package com.aimanager.rbac.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ExceptionLoggingUtilsTest {

    @Test
    void stackTraceContainsExceptionTypeAndMessage() {
        String trace = ExceptionLoggingUtils.getStackTrace(new IllegalStateException("sink offline"));
        assertTrue(trace.contains("IllegalStateException"));
        assertTrue(trace.contains("sink offline"));
        assertEquals("", ExceptionLoggingUtils.getStackTrace(null));
    }

    @Test
    void describeFallsBackToClassName() {
        assertEquals("boom", ExceptionLoggingUtils.describe(new RuntimeException("boom")));
        assertEquals(NullPointerException.class.getName(), ExceptionLoggingUtils.describe(new NullPointerException()));
    }

    @Test
    void loggingNeverThrows() {
        assertDoesNotThrow(() -> {
            ExceptionLoggingUtils.logError(new RuntimeException("x"), "failed for %s", "u1");
            ExceptionLoggingUtils.logWarn(null, "plain warning");
            ExceptionLoggingUtils.logDebug(new RuntimeException("y"), "debug %d", 1);
            ExceptionLoggingUtils.logIgnoredException(new RuntimeException("z"), "test");
        });
    }
}
