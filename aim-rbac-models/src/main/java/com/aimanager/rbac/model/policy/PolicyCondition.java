package com.aimanager.rbac.model.policy;

import com.fasterxml.jackson.annotation.JsonValue;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.Locale;

/**
 * Predicates a policy can attach to its grant. Each one is checked against the caller's
 * context and the resource attributes, and each one contributes a scope filter when the
 * policy matches.
 */
@RegisterForReflection
public enum PolicyCondition {
   /** resource {@code team_id} equals the caller's team */
   SAME_TEAM,
   /** resource {@code department_id} equals the caller's department */
   SAME_DEPARTMENT,
   /** resource {@code owner_id} is the caller */
   IS_OWNER,
   /** resource {@code owner_id} is one of the caller's direct reports */
   IS_MANAGER_OF_OWNER,
   /** resource {@code project_id}, when present, is one of the caller's projects */
   PROJECT_MEMBER,
   /** resource {@code hierarchy_depth} does not exceed the policy's ceiling */
   MAX_HIERARCHY_DEPTH,
   /** resource is not explicitly hidden from onboarding */
   ONBOARDING_VISIBLE;

   @JsonValue
   public String toValue() {
      return name().toLowerCase(Locale.ROOT);
   }
}
