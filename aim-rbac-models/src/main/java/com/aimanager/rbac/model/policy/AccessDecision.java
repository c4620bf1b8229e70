package com.aimanager.rbac.model.policy;

import com.aimanager.rbac.model.AccessLevel;
import com.aimanager.rbac.model.ResourceType;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one evaluation. A fresh instance is produced per evaluation and never mutated.
 * Equality ignores {@link #getDecisionTime()} so that repeated evaluations of the same
 * input compare equal.
 */
@RegisterForReflection
@Getter
@EqualsAndHashCode
@ToString
public final class AccessDecision {
   private final boolean allowed;
   private final String reason;
   @JsonProperty("policy_id")
   private final String policyId;
   private final ResourceType resource;
   // granted level; null on deny
   @JsonProperty("access_level")
   private final AccessLevel accessLevel;
   @JsonProperty("scope_filters")
   private final Map<String, Object> scopeFilters;
   @EqualsAndHashCode.Exclude
   @JsonProperty("decision_time")
   private final Instant decisionTime;
   @ToString.Exclude
   @JsonProperty("context_snapshot")
   private final Map<String, Object> contextSnapshot;

   private AccessDecision(boolean allowed, String reason, String policyId, ResourceType resource,
                          AccessLevel accessLevel, Map<String, Object> scopeFilters,
                          Map<String, Object> contextSnapshot) {
      this.allowed = allowed;
      this.reason = reason;
      this.policyId = policyId;
      this.resource = resource;
      this.accessLevel = accessLevel;
      this.scopeFilters = unmodifiableCopy(scopeFilters);
      this.contextSnapshot = unmodifiableCopy(contextSnapshot);
      this.decisionTime = Instant.now();
   }

   public static AccessDecision allow(String policyId, ResourceType resource, AccessLevel grantedLevel,
                                      Map<String, Object> scopeFilters, Map<String, Object> contextSnapshot) {
      return new AccessDecision(true, "Access granted by policy " + policyId, policyId, resource,
         grantedLevel, scopeFilters, contextSnapshot);
   }

   public static AccessDecision deny(String reason, ResourceType resource) {
      return new AccessDecision(false, reason, null, resource, null, null, null);
   }

   public static AccessDecision deny(String reason, String policyId, ResourceType resource,
                                     Map<String, Object> contextSnapshot) {
      return new AccessDecision(false, reason, policyId, resource, null, null, contextSnapshot);
   }

   public boolean isDenied() {
      return !allowed;
   }

   private static Map<String, Object> unmodifiableCopy(Map<String, Object> in) {
      if (in == null || in.isEmpty()) {
         return Collections.emptyMap();
      }
      return Collections.unmodifiableMap(new LinkedHashMap<>(in));
   }
}
