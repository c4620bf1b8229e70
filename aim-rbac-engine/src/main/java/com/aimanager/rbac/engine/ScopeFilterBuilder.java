package com.aimanager.rbac.engine;

import com.aimanager.rbac.model.ScopeFilterKeys;
import com.aimanager.rbac.model.UserContext;
import com.aimanager.rbac.model.policy.AccessPolicy;
import com.aimanager.rbac.model.policy.PolicyCondition;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns the conditions of a matched policy into the filters a caller must apply to its own
 * queries. Each condition maps to exactly one entry; a policy without conditions yields an
 * empty map.
 */
final class ScopeFilterBuilder {

    private ScopeFilterBuilder() {
    }

    static Map<String, Object> build(AccessPolicy policy, UserContext context) {
        Map<String, Object> filters = new LinkedHashMap<>();
        for (PolicyCondition condition : policy.getConditions()) {
            switch (condition) {
                case SAME_TEAM:
                    filters.put(ScopeFilterKeys.TEAM_ID, context.getTeamId());
                    break;
                case SAME_DEPARTMENT:
                    filters.put(ScopeFilterKeys.DEPARTMENT_ID, context.getDepartmentId());
                    break;
                case IS_OWNER:
                    filters.put(ScopeFilterKeys.OWNER_ID, context.getUserId());
                    break;
                case IS_MANAGER_OF_OWNER:
                    filters.put(ScopeFilterKeys.OWNER_IDS, context.getDirectReports());
                    break;
                case PROJECT_MEMBER:
                    filters.put(ScopeFilterKeys.PROJECT_IDS, context.getProjectIds());
                    break;
                case MAX_HIERARCHY_DEPTH:
                    filters.put(ScopeFilterKeys.MAX_DEPTH, policy.getMaxHierarchyDepth());
                    break;
                case ONBOARDING_VISIBLE:
                    filters.put(ScopeFilterKeys.ONBOARDING_VISIBLE, Boolean.TRUE);
                    break;
                default:
                    break;
            }
        }
        return filters;
    }
}
