package com.aimanager.rbac.guard;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * The access envelope handed to an LLM agent alongside the user's query. Agents must not
 * reach outside it.
 */
@RegisterForReflection
@Value
@Builder
public class AgentContext {
   @JsonProperty("user_id")
   String userId;
   @JsonProperty("user_role")
   String userRole;
   @JsonProperty("user_team")
   String userTeam;
   @JsonProperty("user_department")
   String userDepartment;

   @JsonProperty("knowledge_scope")
   KnowledgeScope knowledgeScope;
   @JsonProperty("mcp_permissions")
   Map<McpTool, McpToolPermission> mcpPermissions;
   @JsonProperty("dashboard_widgets")
   List<String> dashboardWidgets;
   @JsonProperty("data_scope")
   Map<String, Object> dataScope;

   String query;

   @JsonProperty("is_new_hire")
   boolean newHire;
   @JsonProperty("can_see_cross_team")
   boolean crossTeamVisible;
   @JsonProperty("can_see_sensitive")
   boolean sensitiveVisible;
}
