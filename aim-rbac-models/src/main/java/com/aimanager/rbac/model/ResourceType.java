package com.aimanager.rbac.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.Locale;

/**
 * Closed set of protected resource kinds. Every policy names exactly one of these.
 */
@RegisterForReflection
public enum ResourceType {
   // chat
   CHAT,
   CHAT_HISTORY,

   // knowledge graph
   KNOWLEDGE_GLOBAL,
   KNOWLEDGE_DEPARTMENT,
   KNOWLEDGE_TEAM,
   KNOWLEDGE_PERSONAL,

   // memory
   MEMORY_ORG,
   MEMORY_TEAM,
   MEMORY_USER,

   // dashboards
   DASHBOARD_COMPANY,
   DASHBOARD_DEPARTMENT,
   DASHBOARD_TEAM,
   DASHBOARD_PERSONAL,

   // external tools
   MCP_JIRA,
   MCP_GITHUB,
   MCP_SLACK,

   // team management
   TEAM_MEMBERS,
   TEAM_WORKLOAD,
   TEAM_ANALYTICS,

   // onboarding
   ONBOARDING_FLOWS,
   ONBOARDING_PROGRESS,

   OWNERSHIP_LOOKUP,
   EXPERTISE_SEARCH;

   /**
    * Stable lowercase identifier, e.g. {@code knowledge_team}.
    */
   @JsonValue
   public String getValue() {
      return name().toLowerCase(Locale.ROOT);
   }

   @JsonCreator
   public static ResourceType fromValue(String value) {
      if (value == null) {
         return null;
      }
      return ResourceType.valueOf(value.trim().toUpperCase(Locale.ROOT));
   }

   @Override
   public String toString() {
      return getValue();
   }
}
