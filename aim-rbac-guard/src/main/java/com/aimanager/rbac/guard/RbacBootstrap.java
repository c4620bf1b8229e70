package com.aimanager.rbac.guard;

import com.aimanager.rbac.model.policy.PermissionSummary;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Everything a client needs to shape its UI for the current caller, in one payload.
 */
@RegisterForReflection
@Value
public class RbacBootstrap {
   Map<String, Object> user;
   DashboardConfig dashboard;
   @JsonProperty("mcp_permissions")
   Map<String, McpToolPermission> mcpPermissions;
   @JsonProperty("knowledge_scope")
   KnowledgeScope knowledgeScope;
   List<PermissionSummary> permissions;
}
