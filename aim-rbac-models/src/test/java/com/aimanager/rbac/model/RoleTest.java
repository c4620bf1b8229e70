package com.aimanager.rbac.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class RoleTest {

    @ParameterizedTest
    @CsvSource({
        "new_employee, NEW_HIRE",
        "Intern, NEW_HIRE",
        "IC, CONTRIBUTOR",
        "engineer, CONTRIBUTOR",
        "team_lead, MANAGER",
        "Lead, MANAGER",
        "VP, LEADERSHIP",
        "vice_president, LEADERSHIP",
        "director, LEADERSHIP",
        "CTO, EXECUTIVE",
        "ceo, EXECUTIVE",
        "wizard, CONTRIBUTOR"
    })
    void parsesTokenVocabulary(String raw, Role expected) {
        assertEquals(expected, Role.fromString(raw));
    }

    @Test
    @DisplayName("null and blank role strings fall back to the contributor role")
    void nullAndBlankDefaultToContributor() {
        assertEquals(Role.CONTRIBUTOR, Role.fromString(null));
        assertEquals(Role.CONTRIBUTOR, Role.fromString("   "));
    }

    @Test
    void ranksAreTotallyOrdered() {
        assertTrue(Role.EXECUTIVE.isAtLeast(Role.LEADERSHIP));
        assertTrue(Role.LEADERSHIP.isAtLeast(Role.LEADERSHIP));
        assertTrue(Role.NEW_HIRE.isBelow(Role.CONTRIBUTOR));
        assertFalse(Role.MANAGER.isBelow(Role.MANAGER));
        for (int i = 1; i < Role.values().length; i++) {
            assertTrue(Role.values()[i].getRank() > Role.values()[i - 1].getRank());
        }
    }

    @Test
    void accessLevelsCompareNumerically() {
        assertTrue(AccessLevel.ADMIN.allows(AccessLevel.WRITE));
        assertTrue(AccessLevel.READ.allows(AccessLevel.READ));
        assertFalse(AccessLevel.READ.allows(AccessLevel.WRITE));
        assertFalse(AccessLevel.NONE.allows(AccessLevel.READ));
        assertEquals("Read", AccessLevel.READ.getLabel());
        assertEquals("write", AccessLevel.WRITE.toValue());
    }

    @Test
    void resourceTypesUseLowercaseWireValues() {
        assertEquals("knowledge_team", ResourceType.KNOWLEDGE_TEAM.getValue());
        assertEquals(ResourceType.MCP_JIRA, ResourceType.fromValue("mcp_jira"));
        assertEquals("team_analytics", ResourceType.TEAM_ANALYTICS.toString());
    }
}
