package com.aimanager.rbac.guard;

import com.aimanager.rbac.audit.AuditEventType;
import com.aimanager.rbac.audit.RecordingAuditSink;
import com.aimanager.rbac.engine.PolicyEngine;
import com.aimanager.rbac.engine.PolicyRegistry;
import com.aimanager.rbac.model.Role;
import com.aimanager.rbac.model.UserContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class AgentGuardTest {

    RecordingAuditSink sink;
    AgentGuard agentGuard;

    @BeforeEach
    void setUp() {
        PolicyEngine engine = new PolicyEngine(new PolicyRegistry());
        engine.loadDefaultPolicies();
        sink = new RecordingAuditSink();
        agentGuard = new AgentGuard(new PermissionGuard(engine, sink.dispatcher()), sink.dispatcher());
    }

    static UserContext user(String userId, Role role) {
        return new UserContext.Builder()
            .withUserId(userId)
            .withRole(role)
            .withTeamId("platform")
            .withDepartmentId("eng")
            .build();
    }

    static RetrievedDocument doc(String id, String team, String department, int depth, boolean onboarding) {
        return RetrievedDocument.builder()
            .id(id)
            .title("Doc " + id)
            .teamId(team)
            .departmentId(department)
            .hierarchyDepth(depth)
            .onboardingVisible(onboarding)
            .build();
    }

    @Test
    void agentContextCarriesScopeAndFlags() {
        AgentContext newHire = agentGuard.buildAgentContext(user("n1", Role.NEW_HIRE), "where do I start?");
        assertEquals("n1", newHire.getUserId());
        assertEquals("NEW_HIRE", newHire.getUserRole());
        assertEquals("where do I start?", newHire.getQuery());
        assertTrue(newHire.isNewHire());
        assertFalse(newHire.isCrossTeamVisible());
        assertFalse(newHire.isSensitiveVisible());
        assertEquals(2, newHire.getKnowledgeScope().getMaxDepth());
        assertTrue(newHire.getDashboardWidgets().contains("onboarding_progress"));

        AgentContext lead = agentGuard.buildAgentContext(user("l1", Role.LEADERSHIP), "status?");
        assertFalse(lead.isNewHire());
        assertTrue(lead.isCrossTeamVisible());
        assertTrue(lead.isSensitiveVisible());
        assertEquals("department", lead.getDataScope().get("level"));
        assertEquals(3, lead.getMcpPermissions().size());
    }

    @Test
    @DisplayName("new hires only get shallow, onboarding-visible documents of their team")
    void retrievedContextForNewHire() {
        List<RetrievedDocument> docs = List.of(
            doc("a", "platform", "eng", 1, true),
            doc("b", "platform", "eng", 1, false),
            doc("c", "ml", "eng", 0, true),
            doc("d", "platform", "eng", 3, true),
            doc("e", null, null, 2, true));

        List<RetrievedDocument> kept = agentGuard.filterRetrievedContext(user("n1", Role.NEW_HIRE), docs);

        assertEquals(List.of("a", "e"), kept.stream().map(RetrievedDocument::getId).toList());
    }

    @Test
    void retrievedContextForLeadershipAndExecutive() {
        List<RetrievedDocument> docs = List.of(
            doc("a", "ml", "eng", 4, false),
            doc("b", "sales", "gtm", 1, false),
            doc("c", "ml", "eng", 11, false));

        List<RetrievedDocument> lead = agentGuard.filterRetrievedContext(user("l1", Role.LEADERSHIP), docs);
        List<RetrievedDocument> exec = agentGuard.filterRetrievedContext(user("e1", Role.EXECUTIVE), docs);

        assertEquals(List.of("a"), lead.stream().map(RetrievedDocument::getId).toList());
        assertEquals(List.of("a", "b"), exec.stream().map(RetrievedDocument::getId).toList());
        assertTrue(agentGuard.filterRetrievedContext(user("e1", Role.EXECUTIVE), null).isEmpty());
    }

    @Test
    void agentResponseIsFilteredAndAudited() {
        List<ChatSource> sources = List.of(ChatSource.builder().title("ML").type("document").teamId("ml").build());

        FilteredChatResponse r = agentGuard.filterAgentResponse(user("c1", Role.CONTRIBUTOR),
            "compensation: $90,000", sources, "knowledge-agent");

        assertTrue(r.isFiltered());
        assertEquals("[COMPENSATION REDACTED]", r.getText());
        assertTrue(r.getSources().get(0).isAccessDenied());
        assertEquals(AuditEventType.CHAT_FILTERED, sink.last().getEventType());
        assertEquals("knowledge-agent", sink.last().getMetadata().get("agent"));
    }

    @Test
    void toolPermissionForContributorIsScopedToOwner() {
        ToolPermissionResult r = agentGuard.checkToolPermission(user("c1", Role.CONTRIBUTOR), "jira_search",
            new HashMap<>(Map.of("query", "open bugs")));

        assertTrue(r.isAllowed());
        assertEquals(Map.of("owner_id", "c1"), r.getScopeFilters());
        assertEquals(AuditEventType.MCP_TOOL_CALL, sink.last().getEventType());
        assertEquals("jira_search", sink.last().getAction());
    }

    @Test
    void toolPermissionDenials() {
        ToolPermissionResult slack = agentGuard.checkToolPermission(user("m1", Role.MANAGER), "slack_search", Map.of());
        assertFalse(slack.isAllowed());
        assertTrue(slack.getScopeFilters().isEmpty());
        assertEquals(AuditEventType.MCP_TOOL_BLOCKED, sink.last().getEventType());

        int before = sink.recorded.size();
        ToolPermissionResult unknown = agentGuard.checkToolPermission(user("e1", Role.EXECUTIVE), "drop_tables", null);
        assertFalse(unknown.isAllowed());
        // no access decision for unknown tools, only the blocked tool call
        assertEquals(before + 1, sink.recorded.size());
        assertEquals(AuditEventType.MCP_TOOL_BLOCKED, sink.last().getEventType());
    }

    @Test
    void toolScopeIsForcedIntoParameters() {
        Map<String, Object> params = new HashMap<>();
        params.put("query", "open bugs");
        params.put("team_id", "ml");
        Map<String, Object> scope = Map.of("team_id", "platform", "owner_id", "c1", "max_depth", 2);

        Map<String, Object> scoped = agentGuard.applyToolScope(params, scope);

        assertEquals("open bugs", scoped.get("query"));
        assertEquals("platform", scoped.get("team_id"));
        assertEquals("platform", scoped.get("team_filter"));
        assertEquals("c1", scoped.get("owner_id"));
        assertEquals("c1", scoped.get("assignee"));
        assertEquals(2, scoped.get("max_depth"));
        assertEquals("ml", params.get("team_id"));
        assertFalse(params.containsKey("assignee"));

        assertEquals(Map.of("query", "x"), agentGuard.applyToolScope(Map.of("query", "x"), null));
    }
}
