package com.aimanager.rbac.guard;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A citation attached to a chat answer.
 */
@RegisterForReflection
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatSource {
   public static final String RESTRICTED_TITLE = "[Restricted]";

   protected String title;
   protected String type;
   protected String url;
   protected String snippet;
   @JsonProperty("team_id")
   protected String teamId;
   @JsonProperty("department_id")
   protected String departmentId;
   @JsonProperty("owner_id")
   protected String ownerId;
   @JsonProperty("access_denied")
   protected boolean accessDenied;

   /**
    * Placeholder shown in place of a source the caller may not see. Only the type survives.
    */
   public static ChatSource restricted(String type) {
      return ChatSource.builder()
         .title(RESTRICTED_TITLE)
         .type(type)
         .accessDenied(true)
         .build();
   }
}
