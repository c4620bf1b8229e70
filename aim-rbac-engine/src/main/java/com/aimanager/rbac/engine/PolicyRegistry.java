package com.aimanager.rbac.engine;

import com.aimanager.rbac.exceptions.PolicyConfigurationException;
import com.aimanager.rbac.model.ResourceType;
import com.aimanager.rbac.model.Role;
import com.aimanager.rbac.model.policy.AccessPolicy;
import com.aimanager.rbac.model.policy.PolicyCondition;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.validation.constraints.NotNull;
import org.apache.commons.lang3.StringUtils;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Holds the registered policies, indexed by id, by role and by resource.
 * <p>
 * The indexes live in one immutable {@link Snapshot}. Mutators are synchronized and replace
 * the snapshot wholesale, so readers never lock and always see either the state before or
 * the state after a mutation. Index order is registration order.
 */
@ApplicationScoped
public class PolicyRegistry {

    private volatile Snapshot snapshot = Snapshot.EMPTY;

    public PolicyRegistry() {
        Log.debug("Creating policyRegistry");
    }

    /**
     * Validates and registers a single policy.
     *
     * @throws PolicyConfigurationException when the policy is malformed or its id is taken
     */
    public synchronized void register(@NotNull AccessPolicy policy) {
        registerAll(List.of(validate(policy)));
    }

    /**
     * Registers a batch atomically: the whole batch is validated, including duplicate ids
     * within the batch, before any of it becomes visible.
     */
    public synchronized void registerAll(@NotNull Collection<AccessPolicy> policies) {
        Snapshot current = snapshot;
        Set<String> batchIds = new HashSet<>();
        for (AccessPolicy policy : policies) {
            validate(policy);
            if (current.byId.containsKey(policy.getPolicyId()) || !batchIds.add(policy.getPolicyId())) {
                throw new PolicyConfigurationException(policy.getPolicyId(), "duplicate policy id");
            }
        }
        Map<String, AccessPolicy> next = new LinkedHashMap<>(current.byId);
        for (AccessPolicy policy : policies) {
            next.put(policy.getPolicyId(), policy);
        }
        snapshot = Snapshot.of(next.values(), current.version + 1);
        if (Log.isDebugEnabled()) {
            Log.debugf("Registered %d policies, registry now holds %d (version %d)",
                policies.size(), snapshot.byId.size(), snapshot.version);
        }
    }

    /**
     * @return false when no policy with that id is registered
     */
    public synchronized boolean unregister(String policyId) {
        Snapshot current = snapshot;
        if (policyId == null || !current.byId.containsKey(policyId)) {
            return false;
        }
        Map<String, AccessPolicy> next = new LinkedHashMap<>(current.byId);
        next.remove(policyId);
        snapshot = Snapshot.of(next.values(), current.version + 1);
        Log.infof("Unregistered policy %s", policyId);
        return true;
    }

    public synchronized void clear() {
        snapshot = Snapshot.of(List.of(), snapshot.version + 1);
    }

    public List<AccessPolicy> policiesForResource(ResourceType resource) {
        return snapshot.byResource.get(resource);
    }

    public List<AccessPolicy> policiesForRole(Role role) {
        return snapshot.byRole.get(role);
    }

    public Optional<AccessPolicy> find(String policyId) {
        return Optional.ofNullable(policyId == null ? null : snapshot.byId.get(policyId));
    }

    public List<AccessPolicy> all() {
        return snapshot.byId.values().asList();
    }

    public int size() {
        return snapshot.byId.size();
    }

    /**
     * Bumped on every mutation.
     */
    public long version() {
        return snapshot.version;
    }

    static AccessPolicy validate(AccessPolicy policy) {
        if (policy == null) {
            throw new PolicyConfigurationException(null, "policy must not be null");
        }
        String id = policy.getPolicyId();
        if (StringUtils.isBlank(id)) {
            throw new PolicyConfigurationException(null, "policy id must not be blank");
        }
        if (policy.getRole() == null) {
            throw new PolicyConfigurationException(id, "role is required");
        }
        if (policy.getResource() == null) {
            throw new PolicyConfigurationException(id, "resource is required");
        }
        if (policy.getAccessLevel() == null) {
            throw new PolicyConfigurationException(id, "access level is required");
        }
        if (policy.hasCondition(PolicyCondition.MAX_HIERARCHY_DEPTH)
                && (policy.getMaxHierarchyDepth() == null || policy.getMaxHierarchyDepth() < 0)) {
            throw new PolicyConfigurationException(id, "max_hierarchy_depth needs a non-negative ceiling");
        }
        return policy;
    }

    private static final class Snapshot {
        static final Snapshot EMPTY = of(List.of(), 0L);

        final ImmutableMap<String, AccessPolicy> byId;
        final ImmutableListMultimap<Role, AccessPolicy> byRole;
        final ImmutableListMultimap<ResourceType, AccessPolicy> byResource;
        final long version;

        private Snapshot(ImmutableMap<String, AccessPolicy> byId,
                         ImmutableListMultimap<Role, AccessPolicy> byRole,
                         ImmutableListMultimap<ResourceType, AccessPolicy> byResource,
                         long version) {
            this.byId = byId;
            this.byRole = byRole;
            this.byResource = byResource;
            this.version = version;
        }

        static Snapshot of(Collection<AccessPolicy> policies, long version) {
            ImmutableMap.Builder<String, AccessPolicy> ids = ImmutableMap.builder();
            ImmutableListMultimap.Builder<Role, AccessPolicy> roles = ImmutableListMultimap.builder();
            ImmutableListMultimap.Builder<ResourceType, AccessPolicy> resources = ImmutableListMultimap.builder();
            for (AccessPolicy p : ImmutableList.copyOf(policies)) {
                ids.put(p.getPolicyId(), p);
                roles.put(p.getRole(), p);
                resources.put(p.getResource(), p);
            }
            return new Snapshot(ids.build(), roles.build(), resources.build(), version);
        }
    }
}
