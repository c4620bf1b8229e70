package com.aimanager.rbac.audit;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AuditEventType {
   ACCESS_GRANTED(false),
   ACCESS_DENIED(true),
   CHAT_RESPONSE(false),
   CHAT_FILTERED(false),
   MCP_TOOL_CALL(false),
   MCP_TOOL_BLOCKED(true),
   ROLE_CHANGE(true);

   private final boolean sensitive;

   AuditEventType(boolean sensitive) {
      this.sensitive = sensitive;
   }

   /**
    * Sensitive events are logged at WARN and also handed to {@link AuditSink#alert}.
    */
   public boolean isSensitive() {
      return sensitive;
   }

   @JsonValue
   public String toValue() {
      return name().toLowerCase(Locale.ROOT);
   }
}
