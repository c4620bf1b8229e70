package com.aimanager.rbac.guard;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Where in the knowledge graph a caller may traverse.
 */
@RegisterForReflection
@Value
public class KnowledgeScope {
   public static final int DEFAULT_MAX_DEPTH = 10;
   public static final String ALL_NODES = "*";

   @JsonProperty("allowed_nodes")
   List<String> allowedNodes;
   @JsonProperty("max_depth")
   int maxDepth;
   Map<String, Object> filters;
}
