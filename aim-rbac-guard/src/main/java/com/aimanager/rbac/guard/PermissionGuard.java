package com.aimanager.rbac.guard;

import com.aimanager.rbac.audit.AuditDispatcher;
import com.aimanager.rbac.engine.PolicyEngine;
import com.aimanager.rbac.exceptions.PermissionDeniedException;
import com.aimanager.rbac.model.AccessLevel;
import com.aimanager.rbac.model.ResourceType;
import com.aimanager.rbac.model.Role;
import com.aimanager.rbac.model.ScopeFilterKeys;
import com.aimanager.rbac.model.UserContext;
import com.aimanager.rbac.model.policy.AccessDecision;
import com.aimanager.rbac.util.AttributeUtils;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.validation.constraints.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Enforcement point used by the rest of the application. Every check goes through the
 * {@link PolicyEngine} and every resulting decision is handed to the {@link AuditDispatcher}.
 * The guard keeps no per-request state.
 */
@ApplicationScoped
public class PermissionGuard {

    @Inject
    PolicyEngine engine;

    @Inject
    AuditDispatcher auditDispatcher;

    public PermissionGuard() {
    }

    public PermissionGuard(PolicyEngine engine, AuditDispatcher auditDispatcher) {
        this.engine = engine;
        this.auditDispatcher = auditDispatcher;
    }

    public PolicyEngine getEngine() {
        return engine;
    }

    public AccessDecision checkAccess(UserContext context, ResourceType resource, AccessLevel requiredLevel,
                                      Map<String, Object> resourceAttrs) {
        AccessDecision decision = engine.evaluate(context, resource, requiredLevel, resourceAttrs);
        if (auditDispatcher != null && context != null) {
            auditDispatcher.recordDecision(decision, context);
        }
        return decision;
    }

    public AccessDecision checkAccess(UserContext context, ResourceType resource, AccessLevel requiredLevel) {
        return checkAccess(context, resource, requiredLevel, null);
    }

    public AccessDecision checkAccess(UserContext context, ResourceType resource) {
        return checkAccess(context, resource, AccessLevel.READ, null);
    }

    /**
     * Like {@link #checkAccess}, but a deny aborts the caller's operation.
     *
     * @throws PermissionDeniedException carrying the deny decision
     */
    public AccessDecision requireAccess(UserContext context, ResourceType resource, AccessLevel requiredLevel,
                                        Map<String, Object> resourceAttrs) {
        AccessDecision decision = checkAccess(context, resource, requiredLevel, resourceAttrs);
        if (!decision.isAllowed()) {
            throw new PermissionDeniedException(decision);
        }
        return decision;
    }

    public AccessDecision requireAccess(UserContext context, ResourceType resource, AccessLevel requiredLevel) {
        return requireAccess(context, resource, requiredLevel, null);
    }

    /**
     * Rank gate for operations that are not tied to a single resource.
     *
     * @throws PermissionDeniedException when the caller ranks below {@code minimum}
     */
    public void requireRole(UserContext context, @NotNull Role minimum) {
        if (context == null || context.getRole() == null || context.getRole().isBelow(minimum)) {
            AccessDecision denied = AccessDecision.deny("Requires " + minimum.name() + " role or higher", null);
            Log.warnf("Role check failed: user=%s role=%s required=%s",
                context == null ? null : context.getUserId(),
                context == null ? null : context.getRole(), minimum);
            if (auditDispatcher != null && context != null) {
                auditDispatcher.recordDecision(denied, context);
            }
            throw new PermissionDeniedException(denied);
        }
    }

    /**
     * Replaces every source the caller may not read by a {@link ChatSource#restricted} placeholder,
     * keeping order and count, and redacts sensitive money figures from the text for roles below
     * {@link Role#MANAGER}. Null entries and sources already flagged as denied also become
     * placeholders. Filtering an already filtered response changes nothing.
     */
    public FilteredChatResponse filterChatResponse(UserContext context, String text, List<ChatSource> sources) {
        List<ChatSource> filtered = new ArrayList<>();
        boolean sourcesChanged = false;
        if (sources != null) {
            for (ChatSource source : sources) {
                if (source == null || source.isAccessDenied()) {
                    // a denied flag is never trusted as is: only the placeholder survives
                    ChatSource placeholder = ChatSource.restricted(source == null ? null : source.getType());
                    filtered.add(placeholder);
                    sourcesChanged |= !placeholder.equals(source);
                    continue;
                }
                Map<String, Object> attrs = new HashMap<>();
                attrs.put(ScopeFilterKeys.TEAM_ID, source.getTeamId());
                attrs.put(ScopeFilterKeys.DEPARTMENT_ID, source.getDepartmentId());
                attrs.put(ScopeFilterKeys.OWNER_ID, source.getOwnerId());
                AccessDecision decision = checkAccess(context, SourceType.resourceFor(source.getType()), AccessLevel.READ, attrs);
                if (decision.isAllowed()) {
                    filtered.add(source);
                } else {
                    filtered.add(ChatSource.restricted(source.getType()));
                    sourcesChanged = true;
                }
            }
        }
        String redacted = SensitiveContentRedactor.redact(context == null ? null : context.getRole(), text);
        boolean textChanged = !Objects.equals(redacted, text);
        return new FilteredChatResponse(redacted, Collections.unmodifiableList(filtered), textChanged || sourcesChanged);
    }

    public KnowledgeScope getKnowledgeScope(@NotNull UserContext context) {
        Map<String, Object> filters = new LinkedHashMap<>();
        List<String> nodes;
        int maxDepth = KnowledgeScope.DEFAULT_MAX_DEPTH;
        switch (context.getRole()) {
            case EXECUTIVE:
                nodes = List.of(KnowledgeScope.ALL_NODES);
                break;
            case LEADERSHIP:
                nodes = List.of("department:" + context.getDepartmentId(), "team:" + context.getTeamId());
                filters.put(ScopeFilterKeys.DEPARTMENT_ID, context.getDepartmentId());
                break;
            case MANAGER:
                nodes = List.of("team:" + context.getTeamId());
                filters.put(ScopeFilterKeys.TEAM_ID, context.getTeamId());
                break;
            case CONTRIBUTOR:
                nodes = List.of("team:" + context.getTeamId());
                filters.put(ScopeFilterKeys.TEAM_ID, context.getTeamId());
                maxDepth = 5;
                break;
            case NEW_HIRE:
            default:
                nodes = List.of("team:" + context.getTeamId());
                filters.put(ScopeFilterKeys.TEAM_ID, context.getTeamId());
                filters.put(ScopeFilterKeys.ONBOARDING_VISIBLE, Boolean.TRUE);
                maxDepth = 2;
                break;
        }
        return new KnowledgeScope(nodes, maxDepth, Collections.unmodifiableMap(filters));
    }

    /**
     * One read check per external tool, scoped by the caller's own team and department.
     */
    public Map<McpTool, McpToolPermission> getMcpToolPermissions(@NotNull UserContext context) {
        Map<String, Object> attrs = new HashMap<>();
        attrs.put(ScopeFilterKeys.TEAM_ID, context.getTeamId());
        attrs.put(ScopeFilterKeys.DEPARTMENT_ID, context.getDepartmentId());
        Map<McpTool, McpToolPermission> out = new EnumMap<>(McpTool.class);
        for (McpTool tool : McpTool.values()) {
            AccessDecision d = checkAccess(context, tool.getResource(), AccessLevel.READ, attrs);
            out.put(tool, new McpToolPermission(d.isAllowed(),
                d.isAllowed() ? d.getAccessLevel() : AccessLevel.NONE,
                d.getScopeFilters()));
        }
        return Collections.unmodifiableMap(out);
    }

    public DashboardConfig getDashboardConfig(@NotNull UserContext context) {
        Map<String, Object> dataScope = new LinkedHashMap<>();
        List<String> widgets;
        int refresh = DashboardConfig.DEFAULT_REFRESH_SECONDS;
        switch (context.getRole()) {
            case EXECUTIVE:
                widgets = List.of("company_overview", "all_teams_health", "cross_team_analytics",
                    "company_okrs", "executive_summary", "bottleneck_analysis", "ownership_map");
                dataScope.put("level", "company");
                break;
            case LEADERSHIP:
                widgets = List.of("department_overview", "team_health", "department_analytics",
                    "department_okrs", "team_bottlenecks", "ownership_map");
                dataScope.put("level", "department");
                dataScope.put(ScopeFilterKeys.DEPARTMENT_ID, context.getDepartmentId());
                break;
            case MANAGER:
                widgets = List.of("team_overview", "sprint_velocity", "team_workload",
                    "team_analytics", "member_status", "ownership_lookup");
                dataScope.put("level", "team");
                dataScope.put(ScopeFilterKeys.TEAM_ID, context.getTeamId());
                break;
            case CONTRIBUTOR:
                widgets = List.of("personal_tasks", "team_activity", "my_analytics", "team_knowledge");
                dataScope.put("level", "personal");
                dataScope.put(ScopeFilterKeys.TEAM_ID, context.getTeamId());
                dataScope.put("user_id", context.getUserId());
                break;
            case NEW_HIRE:
            default:
                widgets = List.of("onboarding_progress", "next_steps", "team_introduction", "help_resources");
                dataScope.put("level", "onboarding");
                dataScope.put("user_id", context.getUserId());
                refresh = DashboardConfig.ONBOARDING_REFRESH_SECONDS;
                break;
        }
        return new DashboardConfig(widgets, Collections.unmodifiableMap(dataScope), refresh);
    }

    public boolean canViewEmployeeData(UserContext context, String targetUserId, String targetTeamId) {
        return canViewEmployeeData(context, targetUserId, targetTeamId, null);
    }

    /**
     * Self, executives, the target's manager and teammates may always view; leadership may view
     * targets in its own department when a team-members read check on the target's team and
     * department passes. Without a target department leadership is refused.
     */
    public boolean canViewEmployeeData(UserContext context, String targetUserId, String targetTeamId,
                                       String targetDepartmentId) {
        if (context == null || context.getRole() == null) {
            return false;
        }
        if (targetUserId != null && targetUserId.equals(context.getUserId())) {
            return true;
        }
        if (context.getRole() == Role.EXECUTIVE) {
            return true;
        }
        if (context.isManagerOf(targetUserId)) {
            return true;
        }
        if (targetTeamId != null && !targetTeamId.isEmpty() && targetTeamId.equals(context.getTeamId())) {
            return true;
        }
        if (context.getRole() == Role.LEADERSHIP) {
            // team_members is inherited from managers without conditions, so the department is checked here
            if (!AttributeUtils.sameNonBlank(targetDepartmentId, context.getDepartmentId())) {
                return false;
            }
            Map<String, Object> attrs = new HashMap<>();
            attrs.put(ScopeFilterKeys.TEAM_ID, targetTeamId);
            attrs.put(ScopeFilterKeys.DEPARTMENT_ID, targetDepartmentId);
            return checkAccess(context, ResourceType.TEAM_MEMBERS, AccessLevel.READ, attrs).isAllowed();
        }
        return false;
    }

    /**
     * Aggregate of everything a client needs to render for this caller.
     */
    public RbacBootstrap getBootstrap(@NotNull UserContext context) {
        Map<String, Object> user = new LinkedHashMap<>();
        user.put("id", context.getUserId());
        user.put("name", context.getName());
        user.put("email", context.getEmail());
        user.put("role", context.getRole().name());
        user.put(ScopeFilterKeys.TEAM_ID, context.getTeamId());
        user.put(ScopeFilterKeys.DEPARTMENT_ID, context.getDepartmentId());
        user.put("organization_id", context.getOrganizationId());

        Map<String, McpToolPermission> tools = new LinkedHashMap<>();
        getMcpToolPermissions(context).forEach((tool, permission) -> tools.put(tool.toValue(), permission));

        return new RbacBootstrap(
            Collections.unmodifiableMap(user),
            getDashboardConfig(context),
            Collections.unmodifiableMap(tools),
            getKnowledgeScope(context),
            engine.getPermissionsForRole(context.getRole()));
    }
}
