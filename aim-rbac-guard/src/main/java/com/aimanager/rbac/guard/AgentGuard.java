package com.aimanager.rbac.guard;

import com.aimanager.rbac.audit.AuditDispatcher;
import com.aimanager.rbac.model.AccessLevel;
import com.aimanager.rbac.model.ResourceType;
import com.aimanager.rbac.model.Role;
import com.aimanager.rbac.model.ScopeFilterKeys;
import com.aimanager.rbac.model.UserContext;
import com.aimanager.rbac.model.policy.AccessDecision;
import com.google.common.collect.ImmutableMap;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies the caller's permissions around an LLM agent: what the agent is told it may see,
 * which retrieved documents reach it, which tools it may call and with what parameters, and
 * what of its answer reaches the user.
 */
@ApplicationScoped
public class AgentGuard {

    static final Map<String, ResourceType> TOOL_RESOURCES = ImmutableMap.<String, ResourceType>builder()
        .put("jira_search", ResourceType.MCP_JIRA)
        .put("jira_get_issue", ResourceType.MCP_JIRA)
        .put("jira_get_sprint", ResourceType.MCP_JIRA)
        .put("github_search", ResourceType.MCP_GITHUB)
        .put("github_get_pr", ResourceType.MCP_GITHUB)
        .put("github_get_commits", ResourceType.MCP_GITHUB)
        .put("slack_search", ResourceType.MCP_SLACK)
        .put("slack_get_channel", ResourceType.MCP_SLACK)
        .put("knowledge_search", ResourceType.KNOWLEDGE_TEAM)
        .put("team_analytics", ResourceType.TEAM_ANALYTICS)
        .put("ownership_lookup", ResourceType.OWNERSHIP_LOOKUP)
        .build();

    @Inject
    PermissionGuard guard;

    @Inject
    AuditDispatcher auditDispatcher;

    public AgentGuard() {
    }

    public AgentGuard(PermissionGuard guard, AuditDispatcher auditDispatcher) {
        this.guard = guard;
        this.auditDispatcher = auditDispatcher;
    }

    public AgentContext buildAgentContext(UserContext context, String query) {
        DashboardConfig dashboard = guard.getDashboardConfig(context);
        boolean leadershipOrAbove = context.getRole().isAtLeast(Role.LEADERSHIP);
        return AgentContext.builder()
            .userId(context.getUserId())
            .userRole(context.getRole().name())
            .userTeam(context.getTeamId())
            .userDepartment(context.getDepartmentId())
            .knowledgeScope(guard.getKnowledgeScope(context))
            .mcpPermissions(guard.getMcpToolPermissions(context))
            .dashboardWidgets(dashboard.getWidgets())
            .dataScope(dashboard.getDataScope())
            .query(query)
            .newHire(context.getRole() == Role.NEW_HIRE)
            .crossTeamVisible(leadershipOrAbove)
            .sensitiveVisible(leadershipOrAbove)
            .build();
    }

    /**
     * Drops documents outside the caller's knowledge scope. Documents without a team or
     * department are not excluded by that filter.
     */
    public List<RetrievedDocument> filterRetrievedContext(UserContext context, List<RetrievedDocument> documents) {
        if (documents == null || documents.isEmpty()) {
            return List.of();
        }
        KnowledgeScope scope = guard.getKnowledgeScope(context);
        Map<String, Object> filters = scope.getFilters();
        List<RetrievedDocument> kept = new ArrayList<>();
        for (RetrievedDocument doc : documents) {
            if (filters.containsKey(ScopeFilterKeys.TEAM_ID) && StringUtils.isNotEmpty(doc.getTeamId())
                    && !doc.getTeamId().equals(filters.get(ScopeFilterKeys.TEAM_ID))) {
                continue;
            }
            if (filters.containsKey(ScopeFilterKeys.DEPARTMENT_ID) && StringUtils.isNotEmpty(doc.getDepartmentId())
                    && !doc.getDepartmentId().equals(filters.get(ScopeFilterKeys.DEPARTMENT_ID))) {
                continue;
            }
            if (filters.containsKey(ScopeFilterKeys.ONBOARDING_VISIBLE) && !doc.isOnboardingVisible()) {
                continue;
            }
            if (doc.getHierarchyDepth() > scope.getMaxDepth()) {
                continue;
            }
            kept.add(doc);
        }
        if (Log.isDebugEnabled()) {
            Log.debugf("Context filtered for user %s: %d of %d documents kept",
                context.getUserId(), kept.size(), documents.size());
        }
        return kept;
    }

    /**
     * Filters an agent's answer like {@link PermissionGuard#filterChatResponse} and records a
     * chat audit event.
     */
    public FilteredChatResponse filterAgentResponse(UserContext context, String text, List<ChatSource> sources,
                                                    String agentName) {
        FilteredChatResponse filtered = guard.filterChatResponse(context, text, sources);
        if (auditDispatcher != null) {
            auditDispatcher.recordChatResponse(context, agentName == null ? "unknown" : agentName,
                filtered.getSources().size(), filtered.isFiltered());
        }
        return filtered;
    }

    /**
     * Checks a read on the resource behind {@code toolName}, using the tool parameters as
     * resource attributes. Unknown tools are denied without evaluation.
     */
    public ToolPermissionResult checkToolPermission(UserContext context, String toolName, Map<String, Object> toolParams) {
        ResourceType resource = toolName == null ? null : TOOL_RESOURCES.get(toolName);
        if (resource == null) {
            Log.warnf("Unknown tool %s requested by user %s", toolName, context.getUserId());
            if (auditDispatcher != null) {
                auditDispatcher.recordToolCall(context, toolName, false, null);
            }
            return ToolPermissionResult.denied();
        }
        AccessDecision decision = guard.checkAccess(context, resource, AccessLevel.READ,
            toolParams == null ? new HashMap<>() : toolParams);
        if (auditDispatcher != null) {
            auditDispatcher.recordToolCall(context, toolName, decision.isAllowed(), decision.getScopeFilters());
        }
        return decision.isAllowed()
            ? new ToolPermissionResult(true, decision.getScopeFilters())
            : ToolPermissionResult.denied();
    }

    /**
     * Copy of {@code toolParams} with the scope filters forced in, including the tool-side
     * aliases {@code team_filter} and {@code assignee}.
     */
    public Map<String, Object> applyToolScope(Map<String, Object> toolParams, Map<String, Object> scopeFilters) {
        Map<String, Object> scoped = new LinkedHashMap<>();
        if (toolParams != null) {
            scoped.putAll(toolParams);
        }
        if (scopeFilters == null) {
            return scoped;
        }
        if (scopeFilters.containsKey(ScopeFilterKeys.TEAM_ID)) {
            scoped.put(ScopeFilterKeys.TEAM_ID, scopeFilters.get(ScopeFilterKeys.TEAM_ID));
            scoped.put("team_filter", scopeFilters.get(ScopeFilterKeys.TEAM_ID));
        }
        if (scopeFilters.containsKey(ScopeFilterKeys.DEPARTMENT_ID)) {
            scoped.put(ScopeFilterKeys.DEPARTMENT_ID, scopeFilters.get(ScopeFilterKeys.DEPARTMENT_ID));
        }
        if (scopeFilters.containsKey(ScopeFilterKeys.OWNER_ID)) {
            scoped.put(ScopeFilterKeys.OWNER_ID, scopeFilters.get(ScopeFilterKeys.OWNER_ID));
            scoped.put("assignee", scopeFilters.get(ScopeFilterKeys.OWNER_ID));
        }
        if (scopeFilters.containsKey(ScopeFilterKeys.PROJECT_IDS)) {
            scoped.put(ScopeFilterKeys.PROJECT_IDS, scopeFilters.get(ScopeFilterKeys.PROJECT_IDS));
        }
        if (scopeFilters.containsKey(ScopeFilterKeys.MAX_DEPTH)) {
            scoped.put(ScopeFilterKeys.MAX_DEPTH, scopeFilters.get(ScopeFilterKeys.MAX_DEPTH));
        }
        return scoped;
    }
}
