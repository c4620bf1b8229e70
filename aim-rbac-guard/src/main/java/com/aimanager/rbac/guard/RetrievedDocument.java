package com.aimanager.rbac.guard;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A knowledge graph node returned by retrieval, before it is shown to an agent.
 */
@RegisterForReflection
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrievedDocument {
   protected String id;
   protected String title;
   protected String content;
   @JsonProperty("team_id")
   protected String teamId;
   @JsonProperty("department_id")
   protected String departmentId;
   @JsonProperty("hierarchy_depth")
   protected int hierarchyDepth;
   @JsonProperty("onboarding_visible")
   protected boolean onboardingVisible;
}
