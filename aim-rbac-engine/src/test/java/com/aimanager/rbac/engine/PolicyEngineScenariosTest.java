package com.aimanager.rbac.engine;

import com.aimanager.rbac.model.AccessLevel;
import com.aimanager.rbac.model.ResourceType;
import com.aimanager.rbac.model.Role;
import com.aimanager.rbac.model.UserContext;
import com.aimanager.rbac.model.policy.AccessDecision;
import com.aimanager.rbac.model.policy.AccessPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Evaluation against the default policy set, no container.
 */
public class PolicyEngineScenariosTest {

    PolicyEngine engine;

    @BeforeEach
    void setUp() {
        engine = new PolicyEngine(new PolicyRegistry());
        engine.loadDefaultPolicies();
    }

    static UserContext user(String userId, Role role, String team, String department) {
        return new UserContext.Builder()
            .withUserId(userId)
            .withRole(role)
            .withTeamId(team)
            .withDepartmentId(department)
            .withOrganizationId("acme")
            .build();
    }

    @Test
    @DisplayName("contributor reads knowledge of their own team, scoped to that team")
    void contributorReadsOwnTeamKnowledge() {
        AccessDecision d = engine.evaluate(user("u1", Role.CONTRIBUTOR, "platform", "eng"),
            ResourceType.KNOWLEDGE_TEAM, AccessLevel.READ, Map.of("team_id", "platform"));

        assertTrue(d.isAllowed());
        assertEquals("contributor-team-knowledge-read", d.getPolicyId());
        assertEquals(AccessLevel.READ, d.getAccessLevel());
        assertEquals(Map.of("team_id", "platform"), d.getScopeFilters());
    }

    @Test
    @DisplayName("contributor is denied knowledge of another team")
    void contributorDeniedOtherTeamKnowledge() {
        AccessDecision d = engine.evaluate(user("u1", Role.CONTRIBUTOR, "platform", "eng"),
            ResourceType.KNOWLEDGE_TEAM, AccessLevel.READ, Map.of("team_id", "ml"));

        assertFalse(d.isAllowed());
        assertEquals("No policy grants Read access to knowledge_team", d.getReason());
        assertNull(d.getAccessLevel());
        assertTrue(d.getScopeFilters().isEmpty());
    }

    @Test
    @DisplayName("executive inherits a manager-only grant without scope")
    void executiveInheritsUnscoped() {
        AccessDecision d = engine.evaluate(user("ceo", Role.EXECUTIVE, "exec", "board"),
            ResourceType.TEAM_MEMBERS, AccessLevel.READ, Map.of("team_id", "platform"));

        assertTrue(d.isAllowed());
        assertEquals("manager-team-members-inherited", d.getPolicyId());
        assertTrue(d.getScopeFilters().isEmpty());
    }

    @Test
    @DisplayName("new hire reads team knowledge with team, onboarding and depth filters")
    void newHireGetsOnboardingScope() {
        AccessDecision d = engine.evaluate(user("n1", Role.NEW_HIRE, "platform", "eng"),
            ResourceType.KNOWLEDGE_TEAM, AccessLevel.READ, Map.of("team_id", "platform"));

        assertTrue(d.isAllowed());
        assertEquals(Map.of("team_id", "platform", "onboarding_visible", true, "max_depth", 2), d.getScopeFilters());
    }

    @Test
    void newHireDeniedBeyondDepthOrHiddenNodes() {
        UserContext newHire = user("n1", Role.NEW_HIRE, "platform", "eng");

        AccessDecision deep = engine.evaluate(newHire, ResourceType.KNOWLEDGE_TEAM, AccessLevel.READ,
            Map.of("team_id", "platform", "hierarchy_depth", 3));
        AccessDecision hidden = engine.evaluate(newHire, ResourceType.KNOWLEDGE_TEAM, AccessLevel.READ,
            Map.of("team_id", "platform", "onboarding_visible", false));
        AccessDecision garbageDepth = engine.evaluate(newHire, ResourceType.KNOWLEDGE_TEAM, AccessLevel.READ,
            Map.of("team_id", "platform", "hierarchy_depth", "very deep"));

        assertFalse(deep.isAllowed());
        assertFalse(hidden.isAllowed());
        assertFalse(garbageDepth.isAllowed());
        assertTrue(engine.evaluate(newHire, ResourceType.KNOWLEDGE_TEAM, AccessLevel.READ,
            Map.of("team_id", "platform", "hierarchy_depth", "2")).isAllowed());
    }

    @Test
    @DisplayName("a matched policy with too low a level ends the search with a deny")
    void managerRequestingAdminOnReadGrant() {
        AccessDecision d = engine.evaluate(user("m1", Role.MANAGER, "platform", "eng"),
            ResourceType.TEAM_MEMBERS, AccessLevel.ADMIN, Map.of("team_id", "platform"));

        assertFalse(d.isAllowed());
        assertEquals("manager-team-members", d.getPolicyId());
        assertEquals("No policy grants Admin access to team_members", d.getReason());
    }

    @Test
    void noPoliciesForRoleAndResource() {
        AccessDecision d = engine.evaluate(user("u1", Role.CONTRIBUTOR, "platform", "eng"),
            ResourceType.EXPERTISE_SEARCH, AccessLevel.READ, null);

        assertFalse(d.isAllowed());
        assertEquals("No policies found for role CONTRIBUTOR on resource expertise_search", d.getReason());
    }

    @Test
    @DisplayName("a missing owner defaults to the caller, an explicit null owner does not")
    void ownerDefaulting() {
        UserContext ic = user("u1", Role.CONTRIBUTOR, "platform", "eng");

        AccessDecision implicit = engine.evaluate(ic, ResourceType.MEMORY_USER, AccessLevel.WRITE, Map.of());
        assertTrue(implicit.isAllowed());
        assertEquals(Map.of("owner_id", "u1"), implicit.getScopeFilters());

        Map<String, Object> explicitNull = new HashMap<>();
        explicitNull.put("owner_id", null);
        assertFalse(engine.evaluate(ic, ResourceType.MEMORY_USER, AccessLevel.WRITE, explicitNull).isAllowed());

        assertFalse(engine.evaluate(ic, ResourceType.MEMORY_USER, AccessLevel.WRITE, Map.of("owner_id", "u2")).isAllowed());
    }

    @Test
    void callerAttributesAreNotMutated() {
        Map<String, Object> attrs = new HashMap<>();
        attrs.put("team_id", "platform");
        engine.evaluate(user("u1", Role.CONTRIBUTOR, "platform", "eng"), ResourceType.KNOWLEDGE_TEAM, AccessLevel.READ, attrs);
        assertEquals(Map.of("team_id", "platform"), attrs);
    }

    @Test
    @DisplayName("explicit none policy denies with its id")
    void explicitDeny() {
        PolicyRegistry registry = new PolicyRegistry();
        registry.register(new AccessPolicy.Builder()
            .withPolicyId("contractor-block")
            .withRole(Role.CONTRIBUTOR)
            .withResource(ResourceType.MEMORY_ORG)
            .withAccessLevel(AccessLevel.NONE)
            .withPriority(100)
            .build());
        registry.register(new AccessPolicy.Builder()
            .withPolicyId("contributor-org-memory")
            .withRole(Role.CONTRIBUTOR)
            .withResource(ResourceType.MEMORY_ORG)
            .withAccessLevel(AccessLevel.READ)
            .build());
        PolicyEngine local = new PolicyEngine(registry);

        AccessDecision d = local.evaluate(user("u1", Role.CONTRIBUTOR, "platform", "eng"), ResourceType.MEMORY_ORG, AccessLevel.READ);
        assertFalse(d.isAllowed());
        assertEquals("Access denied by policy contractor-block", d.getReason());
        assertEquals("contractor-block", d.getPolicyId());
    }

    @Test
    @DisplayName("equal priorities prefer the higher level, then registration order")
    void tieBreaking() {
        PolicyRegistry registry = new PolicyRegistry();
        registry.registerAll(List.of(
            new AccessPolicy.Builder().withPolicyId("a-read").withRole(Role.MANAGER)
                .withResource(ResourceType.DASHBOARD_TEAM).withAccessLevel(AccessLevel.READ).build(),
            new AccessPolicy.Builder().withPolicyId("b-write").withRole(Role.MANAGER)
                .withResource(ResourceType.DASHBOARD_TEAM).withAccessLevel(AccessLevel.WRITE).build(),
            new AccessPolicy.Builder().withPolicyId("c-write").withRole(Role.MANAGER)
                .withResource(ResourceType.DASHBOARD_TEAM).withAccessLevel(AccessLevel.WRITE).build()));
        PolicyEngine local = new PolicyEngine(registry);

        AccessDecision d = local.evaluate(user("m1", Role.MANAGER, "t", "d"), ResourceType.DASHBOARD_TEAM, AccessLevel.READ);
        assertEquals("b-write", d.getPolicyId());
    }

    @Test
    void disabledPoliciesAreIgnored() {
        PolicyRegistry registry = new PolicyRegistry();
        registry.register(new AccessPolicy.Builder().withPolicyId("off").withRole(Role.MANAGER)
            .withResource(ResourceType.DASHBOARD_TEAM).withAccessLevel(AccessLevel.ADMIN).withEnabled(false).build());
        PolicyEngine local = new PolicyEngine(registry);

        AccessDecision d = local.evaluate(user("m1", Role.MANAGER, "t", "d"), ResourceType.DASHBOARD_TEAM, AccessLevel.READ);
        assertFalse(d.isAllowed());
        assertTrue(d.getReason().startsWith("No policies found"));
        assertTrue(local.getPermissionsForRole(Role.MANAGER).isEmpty());
    }

    @Test
    void incompleteRequestsAreDenied() {
        UserContext noRole = new UserContext.Builder().withUserId("u1").build();
        assertFalse(engine.evaluate(null, ResourceType.CHAT, AccessLevel.READ, null).isAllowed());
        assertFalse(engine.evaluate(noRole, ResourceType.CHAT, AccessLevel.READ, null).isAllowed());
        assertFalse(engine.evaluate(user("u1", Role.EXECUTIVE, "t", "d"), null, AccessLevel.READ, null).isAllowed());
        assertFalse(engine.evaluate(user("u1", Role.EXECUTIVE, "t", "d"), ResourceType.CHAT, null, null).isAllowed());
    }

    @Test
    void permissionListingForRole() {
        assertTrue(engine.isAllowed(user("u1", Role.CONTRIBUTOR, "t", "d"), ResourceType.CHAT, AccessLevel.WRITE));
        assertEquals(9, engine.getPermissionsForRole(Role.CONTRIBUTOR).size());
        assertTrue(engine.getPermissionsForRole(Role.NEW_HIRE).stream()
            .anyMatch(p -> p.getResource() == ResourceType.ONBOARDING_FLOWS));
    }
}
