package com.aimanager.rbac.model.policy;

import com.aimanager.rbac.model.AccessLevel;
import com.aimanager.rbac.model.ResourceType;
import com.aimanager.rbac.model.Role;
import io.quarkus.runtime.annotations.RegisterForReflection;
import jakarta.validation.constraints.NotNull;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A single grant: "callers with {@code role} may have {@code accessLevel} on {@code resource}
 * when all {@code conditions} hold". A policy with level {@link AccessLevel#NONE} is an
 * explicit deny.
 */
@RegisterForReflection
public final class AccessPolicy {

   public static final int DEFAULT_PRIORITY = 0;

   public static final String INHERITED_SUFFIX = "-inherited";

   protected final @NotNull String policyId;
   protected final @NotNull Role role;
   protected final @NotNull ResourceType resource;
   protected final @NotNull AccessLevel accessLevel;
   protected final Set<PolicyCondition> conditions;
   // only meaningful with MAX_HIERARCHY_DEPTH
   protected final Integer maxHierarchyDepth;
   protected final String description;
   protected final int priority;
   protected final boolean enabled;
   // id of the policy this one was synthesised from, null for registered policies
   protected final String inheritedFrom;

   AccessPolicy(Builder b) {
      this.policyId = b.policyId;
      this.role = b.role;
      this.resource = b.resource;
      this.accessLevel = b.accessLevel;
      this.conditions = b.conditions.isEmpty()
         ? Collections.emptySet()
         : Collections.unmodifiableSet(EnumSet.copyOf(b.conditions));
      this.maxHierarchyDepth = b.maxHierarchyDepth;
      this.description = b.description == null ? "" : b.description;
      this.priority = b.priority;
      this.enabled = b.enabled;
      this.inheritedFrom = b.inheritedFrom;
   }

   public String getPolicyId() {
      return policyId;
   }

   public Role getRole() {
      return role;
   }

   public ResourceType getResource() {
      return resource;
   }

   public AccessLevel getAccessLevel() {
      return accessLevel;
   }

   public Set<PolicyCondition> getConditions() {
      return conditions;
   }

   public boolean hasCondition(PolicyCondition condition) {
      return conditions.contains(condition);
   }

   public Integer getMaxHierarchyDepth() {
      return maxHierarchyDepth;
   }

   public String getDescription() {
      return description;
   }

   public int getPriority() {
      return priority;
   }

   public boolean isEnabled() {
      return enabled;
   }

   public String getInheritedFrom() {
      return inheritedFrom;
   }

   public boolean isInherited() {
      return inheritedFrom != null;
   }

   public boolean isExplicitDeny() {
      return accessLevel == AccessLevel.NONE;
   }

   /**
    * Synthesises the grant a higher role inherits from this policy: the same resource and
    * level, re-targeted at {@code inheritingRole}, with every condition stripped and one
    * step lower priority.
    */
   public AccessPolicy inheritFor(Role inheritingRole) {
      return new Builder()
         .withPolicyId(policyId + INHERITED_SUFFIX)
         .withRole(inheritingRole)
         .withResource(resource)
         .withAccessLevel(accessLevel)
         .withDescription(description)
         .withPriority(priority - 1)
         .withEnabled(enabled)
         .withInheritedFrom(policyId)
         .build();
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof AccessPolicy)) return false;
      AccessPolicy that = (AccessPolicy) o;
      return priority == that.priority
         && enabled == that.enabled
         && Objects.equals(policyId, that.policyId)
         && role == that.role
         && resource == that.resource
         && accessLevel == that.accessLevel
         && Objects.equals(conditions, that.conditions)
         && Objects.equals(maxHierarchyDepth, that.maxHierarchyDepth)
         && Objects.equals(inheritedFrom, that.inheritedFrom);
   }

   @Override
   public int hashCode() {
      return Objects.hash(policyId, role, resource, accessLevel, conditions, maxHierarchyDepth, priority, enabled, inheritedFrom);
   }

   @Override
   public String toString() {
      return "AccessPolicy{" +
         "policyId='" + policyId + '\'' +
         ", role=" + role +
         ", resource=" + resource +
         ", accessLevel=" + accessLevel +
         ", conditions=" + conditions +
         (maxHierarchyDepth != null ? ", maxHierarchyDepth=" + maxHierarchyDepth : "") +
         ", priority=" + priority +
         ", enabled=" + enabled +
         (inheritedFrom != null ? ", inheritedFrom='" + inheritedFrom + '\'' : "") +
         '}';
   }

   public static class Builder {
      String policyId;
      Role role;
      ResourceType resource;
      AccessLevel accessLevel;
      Set<PolicyCondition> conditions = EnumSet.noneOf(PolicyCondition.class);
      Integer maxHierarchyDepth;
      String description;
      int priority = DEFAULT_PRIORITY;
      boolean enabled = true;
      String inheritedFrom;

      public Builder withPolicyId(String policyId) {
         this.policyId = policyId;
         return this;
      }

      public Builder withRole(Role role) {
         this.role = role;
         return this;
      }

      public Builder withResource(ResourceType resource) {
         this.resource = resource;
         return this;
      }

      public Builder withAccessLevel(AccessLevel accessLevel) {
         this.accessLevel = accessLevel;
         return this;
      }

      public Builder withCondition(PolicyCondition condition) {
         this.conditions.add(condition);
         return this;
      }

      public Builder withConditions(Collection<PolicyCondition> conditions) {
         if (conditions != null) {
            this.conditions.addAll(conditions);
         }
         return this;
      }

      /**
       * Adds {@link PolicyCondition#MAX_HIERARCHY_DEPTH} with the given ceiling.
       */
      public Builder withMaxHierarchyDepth(Integer maxDepth) {
         this.maxHierarchyDepth = maxDepth;
         this.conditions.add(PolicyCondition.MAX_HIERARCHY_DEPTH);
         return this;
      }

      public Builder withDescription(String description) {
         this.description = description;
         return this;
      }

      public Builder withPriority(int priority) {
         this.priority = priority;
         return this;
      }

      public Builder withEnabled(boolean enabled) {
         this.enabled = enabled;
         return this;
      }

      Builder withInheritedFrom(String inheritedFrom) {
         this.inheritedFrom = inheritedFrom;
         return this;
      }

      public AccessPolicy build() {
         return new AccessPolicy(this);
      }
   }
}
