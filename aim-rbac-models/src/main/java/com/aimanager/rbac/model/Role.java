package com.aimanager.rbac.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.Locale;
import java.util.Map;

/**
 * Organizational roles, totally ordered by {@link #getRank()}. Rank is the only thing that
 * drives policy inheritance: a role at or above {@link #LEADERSHIP} inherits the grants of
 * every strictly lower role.
 */
@RegisterForReflection
public enum Role {
   NEW_HIRE(1),
   CONTRIBUTOR(2),
   MANAGER(3),
   LEADERSHIP(4),
   EXECUTIVE(5);

   private static final Map<String, Role> ALIASES = Map.ofEntries(
      Map.entry("new_employee", NEW_HIRE),
      Map.entry("new_hire", NEW_HIRE),
      Map.entry("intern", NEW_HIRE),
      Map.entry("ic", CONTRIBUTOR),
      Map.entry("individual_contributor", CONTRIBUTOR),
      Map.entry("contributor", CONTRIBUTOR),
      Map.entry("engineer", CONTRIBUTOR),
      Map.entry("employee", CONTRIBUTOR),
      Map.entry("manager", MANAGER),
      Map.entry("team_lead", MANAGER),
      Map.entry("lead", MANAGER),
      Map.entry("leadership", LEADERSHIP),
      Map.entry("director", LEADERSHIP),
      Map.entry("vp", LEADERSHIP),
      Map.entry("vice_president", LEADERSHIP),
      Map.entry("ceo", EXECUTIVE),
      Map.entry("cto", EXECUTIVE),
      Map.entry("cfo", EXECUTIVE),
      Map.entry("executive", EXECUTIVE));

   private final int rank;

   Role(int rank) {
      this.rank = rank;
   }

   public int getRank() {
      return rank;
   }

   public boolean isAtLeast(Role other) {
      return other != null && rank >= other.rank;
   }

   public boolean isBelow(Role other) {
      return other != null && rank < other.rank;
   }

   @JsonValue
   public String toValue() {
      return name();
   }

   /**
    * Parses the role vocabulary used in identity tokens. Matching is case-insensitive and
    * anything unrecognised, including null or blank input, maps to {@link #CONTRIBUTOR}.
    */
   @JsonCreator
   public static Role fromString(String value) {
      if (value == null || value.isBlank()) {
         return CONTRIBUTOR;
      }
      return ALIASES.getOrDefault(value.trim().toLowerCase(Locale.ROOT), CONTRIBUTOR);
   }
}
