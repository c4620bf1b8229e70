package com.aimanager.rbac.model.policy;

import com.aimanager.rbac.model.AccessLevel;
import com.aimanager.rbac.model.ResourceType;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One row of a role's permission listing, as shown to clients.
 */
@RegisterForReflection
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PermissionSummary {
   protected ResourceType resource;
   @JsonProperty("access_level")
   protected AccessLevel accessLevel;
   protected List<String> conditions;
   @JsonProperty("max_hierarchy_depth")
   protected Integer maxHierarchyDepth;
   protected String description;

   public static PermissionSummary of(AccessPolicy policy) {
      return PermissionSummary.builder()
         .resource(policy.getResource())
         .accessLevel(policy.getAccessLevel())
         .conditions(policy.getConditions().stream().map(PolicyCondition::toValue).sorted().toList())
         .maxHierarchyDepth(policy.getMaxHierarchyDepth())
         .description(policy.getDescription())
         .build();
   }
}
