package com.aimanager.rbac.guard;

import com.aimanager.rbac.model.AccessLevel;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Value;

import java.util.Map;

@RegisterForReflection
@Value
public class McpToolPermission {
   boolean allowed;
   AccessLevel level;
   Map<String, Object> scope;
}
