package com.aimanager.rbac.engine;

import com.aimanager.rbac.model.AccessLevel;
import com.aimanager.rbac.model.ResourceType;
import com.aimanager.rbac.model.Role;
import com.aimanager.rbac.model.policy.AccessPolicy;
import com.aimanager.rbac.model.policy.PolicyCondition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import static com.aimanager.rbac.model.policy.PolicyCondition.IS_OWNER;
import static com.aimanager.rbac.model.policy.PolicyCondition.ONBOARDING_VISIBLE;
import static com.aimanager.rbac.model.policy.PolicyCondition.SAME_DEPARTMENT;
import static com.aimanager.rbac.model.policy.PolicyCondition.SAME_TEAM;

/**
 * The code-defined policy set registered at startup.
 */
public final class DefaultPolicies {

    /** ceiling applied to new hires browsing team knowledge */
    public static final int NEW_HIRE_KNOWLEDGE_DEPTH = 2;

    private DefaultPolicies() {
    }

    public static List<AccessPolicy> all() {
        List<AccessPolicy> policies = new ArrayList<>();
        executive(policies);
        leadership(policies);
        manager(policies);
        contributor(policies);
        newHire(policies);
        common(policies);
        return Collections.unmodifiableList(policies);
    }

    private static void executive(List<AccessPolicy> out) {
        out.add(policy("executive-global-knowledge", Role.EXECUTIVE, ResourceType.KNOWLEDGE_GLOBAL, AccessLevel.ADMIN,
            "Executives have full access to all knowledge"));
        out.add(policy("executive-company-dashboard", Role.EXECUTIVE, ResourceType.DASHBOARD_COMPANY, AccessLevel.ADMIN,
            "Executives can view and configure company dashboards"));
        out.add(policy("executive-all-analytics", Role.EXECUTIVE, ResourceType.TEAM_ANALYTICS, AccessLevel.READ,
            "Executives can view all team analytics"));
        out.add(policy("executive-org-memory", Role.EXECUTIVE, ResourceType.MEMORY_ORG, AccessLevel.ADMIN,
            "Executives have full access to organizational memory"));
        out.add(policy("executive-ownership-lookup", Role.EXECUTIVE, ResourceType.OWNERSHIP_LOOKUP, AccessLevel.READ,
            "Executives can look up ownership across the company"));
    }

    private static void leadership(List<AccessPolicy> out) {
        out.add(policy("leadership-dept-knowledge", Role.LEADERSHIP, ResourceType.KNOWLEDGE_DEPARTMENT, AccessLevel.WRITE,
            "Leadership has write access to department knowledge", SAME_DEPARTMENT));
        out.add(policy("leadership-dept-dashboard", Role.LEADERSHIP, ResourceType.DASHBOARD_DEPARTMENT, AccessLevel.ADMIN,
            "Leadership can manage department dashboards", SAME_DEPARTMENT));
        out.add(policy("leadership-team-analytics", Role.LEADERSHIP, ResourceType.TEAM_ANALYTICS, AccessLevel.READ,
            "Leadership can view team analytics in their department", SAME_DEPARTMENT));
        // at least the level inherited from manager-team-memory
        out.add(policy("leadership-team-memory", Role.LEADERSHIP, ResourceType.MEMORY_TEAM, AccessLevel.WRITE,
            "Leadership can use team memory in their department", SAME_DEPARTMENT));
        out.add(policy("leadership-ownership-dept", Role.LEADERSHIP, ResourceType.OWNERSHIP_LOOKUP, AccessLevel.READ,
            "Leadership can look up ownership in their department", SAME_DEPARTMENT));
    }

    private static void manager(List<AccessPolicy> out) {
        out.add(policy("manager-team-knowledge", Role.MANAGER, ResourceType.KNOWLEDGE_TEAM, AccessLevel.WRITE,
            "Managers have write access to team knowledge", SAME_TEAM));
        out.add(policy("manager-team-dashboard", Role.MANAGER, ResourceType.DASHBOARD_TEAM, AccessLevel.ADMIN,
            "Managers can manage team dashboards", SAME_TEAM));
        out.add(policy("manager-team-members", Role.MANAGER, ResourceType.TEAM_MEMBERS, AccessLevel.READ,
            "Managers can view team member details", SAME_TEAM));
        out.add(policy("manager-team-workload", Role.MANAGER, ResourceType.TEAM_WORKLOAD, AccessLevel.READ,
            "Managers can view team workload", SAME_TEAM));
        out.add(policy("manager-team-analytics", Role.MANAGER, ResourceType.TEAM_ANALYTICS, AccessLevel.READ,
            "Managers can view team analytics", SAME_TEAM));
        out.add(policy("manager-team-memory", Role.MANAGER, ResourceType.MEMORY_TEAM, AccessLevel.WRITE,
            "Managers can write team memory", SAME_TEAM));
        out.add(policy("manager-ownership-team", Role.MANAGER, ResourceType.OWNERSHIP_LOOKUP, AccessLevel.READ,
            "Managers can look up ownership in their team", SAME_TEAM));
        out.add(policy("manager-mcp-jira", Role.MANAGER, ResourceType.MCP_JIRA, AccessLevel.READ,
            "Managers can query the team's Jira", SAME_TEAM));
        out.add(policy("manager-mcp-github", Role.MANAGER, ResourceType.MCP_GITHUB, AccessLevel.READ,
            "Managers can query the team's GitHub", SAME_TEAM));
    }

    private static void contributor(List<AccessPolicy> out) {
        out.add(policy("contributor-team-knowledge-read", Role.CONTRIBUTOR, ResourceType.KNOWLEDGE_TEAM, AccessLevel.READ,
            "Contributors can read team knowledge", SAME_TEAM));
        out.add(policy("contributor-personal-knowledge", Role.CONTRIBUTOR, ResourceType.KNOWLEDGE_PERSONAL, AccessLevel.WRITE,
            "Contributors manage their personal knowledge", IS_OWNER));
        out.add(policy("contributor-personal-dashboard", Role.CONTRIBUTOR, ResourceType.DASHBOARD_PERSONAL, AccessLevel.WRITE,
            "Contributors manage their personal dashboard", IS_OWNER));
        out.add(policy("contributor-user-memory", Role.CONTRIBUTOR, ResourceType.MEMORY_USER, AccessLevel.WRITE,
            "Contributors manage their own memory", IS_OWNER));
        out.add(policy("contributor-ownership-team", Role.CONTRIBUTOR, ResourceType.OWNERSHIP_LOOKUP, AccessLevel.READ,
            "Contributors can look up ownership in their team", SAME_TEAM));
        out.add(policy("contributor-mcp-jira-own", Role.CONTRIBUTOR, ResourceType.MCP_JIRA, AccessLevel.READ,
            "Contributors can query their own Jira issues", IS_OWNER));
        out.add(policy("contributor-mcp-github-own", Role.CONTRIBUTOR, ResourceType.MCP_GITHUB, AccessLevel.READ,
            "Contributors can query their own GitHub activity", IS_OWNER));
    }

    private static void newHire(List<AccessPolicy> out) {
        out.add(policy("new-hire-onboarding-flows", Role.NEW_HIRE, ResourceType.ONBOARDING_FLOWS, AccessLevel.READ,
            "New hires can read onboarding flows"));
        out.add(policy("new-hire-onboarding-progress", Role.NEW_HIRE, ResourceType.ONBOARDING_PROGRESS, AccessLevel.WRITE,
            "New hires track their own onboarding progress", IS_OWNER));
        out.add(new AccessPolicy.Builder()
            .withPolicyId("new-hire-team-knowledge-limited")
            .withRole(Role.NEW_HIRE)
            .withResource(ResourceType.KNOWLEDGE_TEAM)
            .withAccessLevel(AccessLevel.READ)
            .withCondition(SAME_TEAM)
            .withCondition(ONBOARDING_VISIBLE)
            .withMaxHierarchyDepth(NEW_HIRE_KNOWLEDGE_DEPTH)
            .withDescription("New hires can read shallow, onboarding-visible team knowledge")
            .build());
        out.add(policy("new-hire-chat", Role.NEW_HIRE, ResourceType.CHAT, AccessLevel.WRITE,
            "New hires can use chat"));
        out.add(policy("new-hire-ownership-team", Role.NEW_HIRE, ResourceType.OWNERSHIP_LOOKUP, AccessLevel.READ,
            "New hires can look up ownership in their team", SAME_TEAM));
    }

    private static void common(List<AccessPolicy> out) {
        for (Role role : List.of(Role.CONTRIBUTOR, Role.MANAGER, Role.LEADERSHIP, Role.EXECUTIVE)) {
            String prefix = role.name().toLowerCase(Locale.ROOT);
            out.add(policy(prefix + "-chat", role, ResourceType.CHAT, AccessLevel.WRITE,
                "Chat access"));
            out.add(policy(prefix + "-chat-history-own", role, ResourceType.CHAT_HISTORY, AccessLevel.READ,
                "Read own chat history", IS_OWNER));
        }
    }

    private static AccessPolicy policy(String id, Role role, ResourceType resource, AccessLevel level,
                                       String description, PolicyCondition... conditions) {
        return new AccessPolicy.Builder()
            .withPolicyId(id)
            .withRole(role)
            .withResource(resource)
            .withAccessLevel(level)
            .withConditions(List.of(conditions))
            .withDescription(description)
            .build();
    }
}
