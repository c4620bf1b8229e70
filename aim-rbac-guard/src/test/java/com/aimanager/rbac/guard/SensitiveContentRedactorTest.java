package com.aimanager.rbac.guard;

import com.aimanager.rbac.model.Role;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class SensitiveContentRedactorTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "Salary: $120,000 approved|[SALARY REDACTED] approved",
        "total COMPENSATION $250,000|total [COMPENSATION REDACTED]",
        "revenue: $12M this year|[REVENUE REDACTED] this year",
        "the budget $40K is gone|the [BUDGET REDACTED] is gone",
        "salary is confidential|salary is confidential"
    })
    void redactsMoneyFigures(String input, String expected) {
        assertEquals(expected, SensitiveContentRedactor.redact(Role.CONTRIBUTOR, input));
    }

    @Test
    void onlyBelowManager() {
        assertTrue(SensitiveContentRedactor.appliesTo(Role.NEW_HIRE));
        assertTrue(SensitiveContentRedactor.appliesTo(Role.CONTRIBUTOR));
        assertTrue(SensitiveContentRedactor.appliesTo(null));
        assertFalse(SensitiveContentRedactor.appliesTo(Role.MANAGER));
        assertEquals("salary: $1", SensitiveContentRedactor.redact(Role.EXECUTIVE, "salary: $1"));
    }

    @Test
    void redactingTwiceIsRedactingOnce() {
        String once = SensitiveContentRedactor.redact(Role.NEW_HIRE, "salary: $1, budget: $2M, revenue $3B");
        assertEquals(once, SensitiveContentRedactor.redact(Role.NEW_HIRE, once));
        assertNull(SensitiveContentRedactor.redact(Role.NEW_HIRE, null));
    }
}
