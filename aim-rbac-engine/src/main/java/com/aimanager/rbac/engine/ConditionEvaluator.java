package com.aimanager.rbac.engine;

import com.aimanager.rbac.model.ScopeFilterKeys;
import com.aimanager.rbac.model.UserContext;
import com.aimanager.rbac.model.policy.AccessPolicy;
import com.aimanager.rbac.model.policy.PolicyCondition;
import com.aimanager.rbac.util.AttributeUtils;
import io.quarkus.logging.Log;

import java.util.Map;
import java.util.Optional;

/**
 * Pure predicates behind {@link PolicyCondition}. Nothing here mutates the context or the
 * attribute map.
 */
final class ConditionEvaluator {

    private ConditionEvaluator() {
    }

    /**
     * @return true when the policy targets the caller's role and every one of its conditions holds
     */
    static boolean matches(AccessPolicy policy, UserContext context, Map<String, Object> attrs) {
        if (!policy.isEnabled() || policy.getRole() != context.getRole()) {
            return false;
        }
        for (PolicyCondition condition : policy.getConditions()) {
            if (!holds(condition, policy, context, attrs)) {
                if (Log.isDebugEnabled()) {
                    Log.debugf("Policy %s: condition %s failed for user %s", policy.getPolicyId(),
                        condition.toValue(), context.getUserId());
                }
                return false;
            }
        }
        return true;
    }

    static boolean holds(PolicyCondition condition, AccessPolicy policy, UserContext context, Map<String, Object> attrs) {
        switch (condition) {
            case SAME_TEAM:
                return AttributeUtils.sameNonBlank(context.getTeamId(), AttributeUtils.getString(attrs, ScopeFilterKeys.TEAM_ID));
            case SAME_DEPARTMENT:
                return AttributeUtils.sameNonBlank(context.getDepartmentId(), AttributeUtils.getString(attrs, ScopeFilterKeys.DEPARTMENT_ID));
            case IS_OWNER:
                return AttributeUtils.sameNonBlank(context.getUserId(), AttributeUtils.getString(attrs, ScopeFilterKeys.OWNER_ID));
            case IS_MANAGER_OF_OWNER:
                return context.isManagerOf(AttributeUtils.getString(attrs, ScopeFilterKeys.OWNER_ID));
            case PROJECT_MEMBER: {
                String projectId = AttributeUtils.getString(attrs, ScopeFilterKeys.PROJECT_ID);
                return projectId == null || projectId.isEmpty() || context.isMemberOfProject(projectId);
            }
            case MAX_HIERARCHY_DEPTH: {
                Integer ceiling = policy.getMaxHierarchyDepth();
                Optional<Integer> depth = AttributeUtils.getInteger(attrs, ScopeFilterKeys.HIERARCHY_DEPTH, 0);
                return ceiling != null && depth.isPresent() && depth.get() <= ceiling;
            }
            case ONBOARDING_VISIBLE:
                return AttributeUtils.getBoolean(attrs, ScopeFilterKeys.ONBOARDING_VISIBLE, true);
            default:
                return false;
        }
    }
}
