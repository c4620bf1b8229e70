package com.aimanager.rbac.guard;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Value;

import java.util.Collections;
import java.util.Map;

@RegisterForReflection
@Value
public class ToolPermissionResult {
   boolean allowed;
   // filters to force into the tool call; empty when denied
   Map<String, Object> scopeFilters;

   static ToolPermissionResult denied() {
      return new ToolPermissionResult(false, Collections.emptyMap());
   }
}
