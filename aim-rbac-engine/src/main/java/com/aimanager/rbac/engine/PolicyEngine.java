package com.aimanager.rbac.engine;

import com.aimanager.rbac.model.AccessLevel;
import com.aimanager.rbac.model.ResourceType;
import com.aimanager.rbac.model.Role;
import com.aimanager.rbac.model.ScopeFilterKeys;
import com.aimanager.rbac.model.UserContext;
import com.aimanager.rbac.model.policy.AccessDecision;
import com.aimanager.rbac.model.policy.AccessPolicy;
import com.aimanager.rbac.model.policy.PermissionSummary;
import com.aimanager.rbac.util.ExceptionLoggingUtils;
import com.google.common.collect.Ordering;
import com.google.common.primitives.Ints;
import io.quarkus.logging.Log;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.validation.constraints.NotNull;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates a caller's request for a resource against the registered policies.
 * <p>
 * Candidates are the enabled policies for the caller's role on the resource, plus, for
 * {@link Role#LEADERSHIP} and above, condition-free copies of every strictly lower role's
 * policies on that resource. Candidates are tried from highest priority down; ties go to the
 * higher access level, then to registration order. The first candidate whose conditions all
 * hold decides the outcome, even when its level is too low.
 * <p>
 * Evaluation never throws: missing input, missing policies and internal failures all yield a
 * deny decision.
 */
@ApplicationScoped
public class PolicyEngine {

    static final String REASON_NO_POLICIES = "No policies found for role %s on resource %s";
    static final String REASON_DENIED_BY = "Access denied by policy %s";
    static final String REASON_INSUFFICIENT = "No policy grants %s access to %s";
    static final String REASON_INCOMPLETE_REQUEST = "Incomplete access request; denying by default";
    static final String REASON_EVALUATION_FAILED = "Access evaluation failed; denying by default";

    private static final Ordering<AccessPolicy> CANDIDATE_ORDER = new Ordering<AccessPolicy>() {
        @Override
        public int compare(AccessPolicy left, AccessPolicy right) {
            int c = Ints.compare(right.getPriority(), left.getPriority());
            if (c != 0) {
                return c;
            }
            return Ints.compare(right.getAccessLevel().getRank(), left.getAccessLevel().getRank());
        }
    };

    @Inject
    PolicyRegistry registry;

    @ConfigProperty(name = "aim.rbac.policies.defaults.enabled", defaultValue = "true")
    boolean defaultsEnabled;

    public PolicyEngine() {
        Log.debug("Creating policyEngine");
    }

    public PolicyEngine(PolicyRegistry registry) {
        this.registry = registry;
    }

    @PostConstruct
    void init() {
        if (defaultsEnabled) {
            loadDefaultPolicies();
        } else {
            Log.info("Default RBAC policies disabled; the registry starts empty");
        }
    }

    /**
     * Registers {@link DefaultPolicies#all()}. Fails with a configuration fault when any of
     * their ids is already taken.
     */
    public void loadDefaultPolicies() {
        List<AccessPolicy> defaults = DefaultPolicies.all();
        registry.registerAll(defaults);
        Log.infof("Loaded %d default RBAC policies", defaults.size());
    }

    public PolicyRegistry getRegistry() {
        return registry;
    }

    /**
     * Decide whether {@code context} may act on {@code resource} at {@code requiredLevel}.
     *
     * @param resourceAttrs attributes of the concrete resource instance; may be null. When it
     *                      carries no {@code owner_id}, the caller is assumed to own the resource.
     */
    public AccessDecision evaluate(UserContext context, ResourceType resource, AccessLevel requiredLevel,
                                   Map<String, Object> resourceAttrs) {
        if (context == null || context.getRole() == null || resource == null || requiredLevel == null) {
            Log.warnf("Denying incomplete access request: context=%s resource=%s level=%s",
                context == null ? null : context.getUserId(), resource, requiredLevel);
            return AccessDecision.deny(REASON_INCOMPLETE_REQUEST, resource);
        }
        try {
            return doEvaluate(context, resource, requiredLevel, resourceAttrs);
        } catch (RuntimeException e) {
            ExceptionLoggingUtils.logError(e, "Policy evaluation failed for user %s on %s",
                context.getUserId(), resource.getValue());
            return AccessDecision.deny(REASON_EVALUATION_FAILED, null, resource, context.toSnapshot());
        }
    }

    public AccessDecision evaluate(UserContext context, ResourceType resource, AccessLevel requiredLevel) {
        return evaluate(context, resource, requiredLevel, null);
    }

    /**
     * Boolean form of {@link #evaluate}, without resource attributes.
     */
    public boolean isAllowed(UserContext context, ResourceType resource, AccessLevel requiredLevel) {
        return evaluate(context, resource, requiredLevel, null).isAllowed();
    }

    /**
     * The enabled policies registered directly for {@code role}, in registration order.
     * Inherited grants are not listed.
     */
    public List<PermissionSummary> getPermissionsForRole(@NotNull Role role) {
        List<PermissionSummary> out = new ArrayList<>();
        for (AccessPolicy p : registry.policiesForRole(role)) {
            if (p.isEnabled()) {
                out.add(PermissionSummary.of(p));
            }
        }
        return out;
    }

    private AccessDecision doEvaluate(UserContext context, ResourceType resource, AccessLevel requiredLevel,
                                      Map<String, Object> resourceAttrs) {
        Map<String, Object> attrs = new HashMap<>();
        if (resourceAttrs != null) {
            attrs.putAll(resourceAttrs);
        }
        if (!attrs.containsKey(ScopeFilterKeys.OWNER_ID)) {
            attrs.put(ScopeFilterKeys.OWNER_ID, context.getUserId());
        }

        List<AccessPolicy> candidates = candidatesFor(context.getRole(), resource);
        if (candidates.isEmpty()) {
            return logged(context, AccessDecision.deny(
                String.format(REASON_NO_POLICIES, context.getRole().name(), resource.getValue()),
                null, resource, context.toSnapshot()));
        }

        for (AccessPolicy policy : CANDIDATE_ORDER.sortedCopy(candidates)) {
            if (!ConditionEvaluator.matches(policy, context, attrs)) {
                continue;
            }
            if (policy.isExplicitDeny()) {
                return logged(context, AccessDecision.deny(
                    String.format(REASON_DENIED_BY, policy.getPolicyId()),
                    policy.getPolicyId(), resource, context.toSnapshot()));
            }
            if (policy.getAccessLevel().allows(requiredLevel)) {
                return logged(context, AccessDecision.allow(policy.getPolicyId(), resource, policy.getAccessLevel(),
                    ScopeFilterBuilder.build(policy, context), context.toSnapshot()));
            }
            // first match is terminal even when its level is insufficient
            return logged(context, AccessDecision.deny(
                String.format(REASON_INSUFFICIENT, requiredLevel.getLabel(), resource.getValue()),
                policy.getPolicyId(), resource, context.toSnapshot()));
        }

        return logged(context, AccessDecision.deny(
            String.format(REASON_INSUFFICIENT, requiredLevel.getLabel(), resource.getValue()),
            null, resource, context.toSnapshot()));
    }

    List<AccessPolicy> candidatesFor(Role role, ResourceType resource) {
        List<AccessPolicy> onResource = registry.policiesForResource(resource);
        if (onResource.isEmpty()) {
            return Collections.emptyList();
        }
        boolean inherits = role.isAtLeast(Role.LEADERSHIP);
        List<AccessPolicy> candidates = new ArrayList<>();
        for (AccessPolicy p : onResource) {
            if (!p.isEnabled()) {
                continue;
            }
            if (p.getRole() == role) {
                candidates.add(p);
            } else if (inherits && p.getRole().isBelow(role)) {
                candidates.add(p.inheritFor(role));
            }
        }
        return candidates;
    }

    private static AccessDecision logged(UserContext context, AccessDecision decision) {
        if (Log.isDebugEnabled()) {
            Log.debugf("RBAC %s user=%s role=%s resource=%s policy=%s reason=%s",
                decision.isAllowed() ? "ALLOW" : "DENY", context.getUserId(), context.getRole(),
                decision.getResource(), decision.getPolicyId(), decision.getReason());
        }
        return decision;
    }
}
