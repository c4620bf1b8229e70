package com.aimanager.rbac.audit;

import com.aimanager.rbac.model.UserContext;
import com.aimanager.rbac.model.policy.AccessDecision;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.UUID;

/**
 * One auditable occurrence: who did what to which resource, and with what outcome.
 */
@RegisterForReflection
@Data
@Builder(toBuilder = true)
public class AuditEvent {
   public static final String RESULT_SUCCESS = "success";
   public static final String RESULT_DENIED = "denied";

   @Builder.Default
   @JsonProperty("event_id")
   private String eventId = UUID.randomUUID().toString();
   @JsonProperty("event_type")
   private AuditEventType eventType;
   @Builder.Default
   private Instant timestamp = Instant.now();

   @JsonProperty("user_id")
   private String userId;
   @JsonProperty("user_role")
   private String userRole;
   @JsonProperty("team_id")
   private String teamId;
   @JsonProperty("department_id")
   private String departmentId;

   @JsonProperty("resource_type")
   private String resourceType;
   private String action;
   private String result;

   @JsonProperty("session_id")
   private String sessionId;
   @JsonProperty("ip_address")
   private String ipAddress;
   @JsonProperty("user_agent")
   private String userAgent;

   @JsonProperty("policy_id")
   private String policyId;
   @JsonProperty("access_reason")
   private String accessReason;

   @Builder.Default
   private Map<String, Object> metadata = Collections.emptyMap();

   /**
    * Pre-filled builder carrying the actor and session fields of {@code context}.
    */
   public static AuditEventBuilder forContext(AuditEventType type, UserContext context) {
      return AuditEvent.builder()
         .eventType(type)
         .userId(context.getUserId())
         .userRole(context.getRole() != null ? context.getRole().name() : null)
         .teamId(context.getTeamId())
         .departmentId(context.getDepartmentId())
         .sessionId(context.getSessionId())
         .ipAddress(context.getIpAddress())
         .userAgent(context.getUserAgent());
   }

   public static AuditEvent fromDecision(AccessDecision decision, UserContext context) {
      return forContext(decision.isAllowed() ? AuditEventType.ACCESS_GRANTED : AuditEventType.ACCESS_DENIED, context)
         .resourceType(decision.getResource() != null ? decision.getResource().getValue() : null)
         .result(decision.isAllowed() ? RESULT_SUCCESS : RESULT_DENIED)
         .policyId(decision.getPolicyId())
         .accessReason(decision.getReason())
         .metadata(Map.of("scope_filters", decision.getScopeFilters()))
         .build();
   }
}
