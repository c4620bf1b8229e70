package com.aimanager.rbac.guard;

import com.aimanager.rbac.audit.RecordingAuditSink;
import com.aimanager.rbac.engine.PolicyEngine;
import com.aimanager.rbac.engine.PolicyRegistry;
import com.aimanager.rbac.model.AccessLevel;
import com.aimanager.rbac.model.ResourceType;
import com.aimanager.rbac.model.Role;
import com.aimanager.rbac.model.policy.AccessDecision;
import com.aimanager.rbac.util.JsonUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class PayloadSerializationTest {

    @Test
    void accessDecisionUsesSnakeCaseNames() throws JsonProcessingException {
        AccessDecision decision = AccessDecision.allow("contributor_team_knowledge", ResourceType.KNOWLEDGE_TEAM,
            AccessLevel.READ, Map.of("team_id", "platform"), Map.of("user_id", "u1"));

        JsonNode json = JsonUtils.instance().getMapper().readTree(JsonUtils.instance().toJson(decision));

        assertTrue(json.get("allowed").asBoolean());
        assertEquals("contributor_team_knowledge", json.get("policy_id").asText());
        assertEquals("knowledge_team", json.get("resource").asText());
        assertEquals("read", json.get("access_level").asText());
        assertEquals("platform", json.get("scope_filters").get("team_id").asText());
        assertEquals("u1", json.get("context_snapshot").get("user_id").asText());
        assertTrue(json.get("decision_time").isTextual());
        assertEquals(decision.getDecisionTime(), Instant.parse(json.get("decision_time").asText()));
        assertNull(json.get("policyId"));
    }

    @Test
    void deniedDecisionCarriesNullLevel() {
        JsonNode json = JsonUtils.instance().toTree(AccessDecision.deny("no policy", ResourceType.DASHBOARD_COMPANY));

        assertFalse(json.get("allowed").asBoolean());
        assertEquals("dashboard_company", json.get("resource").asText());
        assertTrue(json.get("access_level").isNull());
        assertTrue(json.get("scope_filters").isEmpty());
    }

    @Test
    void bootstrapUsesSnakeCaseNames() {
        PolicyEngine engine = new PolicyEngine(new PolicyRegistry());
        engine.loadDefaultPolicies();
        PermissionGuard guard = new PermissionGuard(engine, new RecordingAuditSink().dispatcher());

        RbacBootstrap bootstrap = guard.getBootstrap(
            PermissionGuardTest.user("u1", Role.NEW_HIRE, "platform", "eng"));
        JsonNode json = JsonUtils.instance().toTree(bootstrap);

        assertEquals("NEW_HIRE", json.get("user").get("role").asText());
        assertEquals("onboarding", json.get("dashboard").get("data_scope").get("level").asText());
        assertEquals(DashboardConfig.ONBOARDING_REFRESH_SECONDS, json.get("dashboard").get("refresh_interval").asInt());
        assertTrue(json.get("mcp_permissions").isObject());
        assertFalse(json.get("mcp_permissions").isEmpty());
        assertTrue(json.get("knowledge_scope").has("allowed_nodes"));
        assertTrue(json.get("permissions").isArray());
        assertNull(json.get("mcpPermissions"));
        assertNull(json.get("knowledgeScope"));
    }
}
