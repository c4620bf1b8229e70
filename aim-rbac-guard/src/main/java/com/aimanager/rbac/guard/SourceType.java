package com.aimanager.rbac.guard;

import com.aimanager.rbac.model.ResourceType;

import java.util.Locale;

/**
 * Declared kinds of chat answer sources and the resource each one is checked against.
 */
public enum SourceType {
   DOCUMENT(ResourceType.KNOWLEDGE_TEAM),
   TEAM_DOC(ResourceType.KNOWLEDGE_TEAM),
   DEPARTMENT_DOC(ResourceType.KNOWLEDGE_DEPARTMENT),
   COMPANY_DOC(ResourceType.KNOWLEDGE_GLOBAL),
   PERSONAL(ResourceType.KNOWLEDGE_PERSONAL),
   JIRA(ResourceType.MCP_JIRA),
   GITHUB(ResourceType.MCP_GITHUB),
   SLACK(ResourceType.MCP_SLACK);

   private final ResourceType resource;

   SourceType(ResourceType resource) {
      this.resource = resource;
   }

   public ResourceType getResource() {
      return resource;
   }

   /**
    * Resource for a declared source type; unknown or missing types are treated as team documents.
    */
   public static ResourceType resourceFor(String declaredType) {
      if (declaredType == null || declaredType.isBlank()) {
         return ResourceType.KNOWLEDGE_TEAM;
      }
      try {
         return SourceType.valueOf(declaredType.trim().toUpperCase(Locale.ROOT)).resource;
      } catch (IllegalArgumentException e) {
         return ResourceType.KNOWLEDGE_TEAM;
      }
   }
}
