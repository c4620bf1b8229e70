package com.aimanager.rbac.guard;

import com.aimanager.rbac.model.ResourceType;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum McpTool {
   JIRA(ResourceType.MCP_JIRA),
   GITHUB(ResourceType.MCP_GITHUB),
   SLACK(ResourceType.MCP_SLACK);

   private final ResourceType resource;

   McpTool(ResourceType resource) {
      this.resource = resource;
   }

   public ResourceType getResource() {
      return resource;
   }

   @JsonValue
   public String toValue() {
      return name().toLowerCase(Locale.ROOT);
   }
}
