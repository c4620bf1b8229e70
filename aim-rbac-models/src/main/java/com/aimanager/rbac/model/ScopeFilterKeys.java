package com.aimanager.rbac.model;

/**
 * Keys shared between resource attribute maps, scope filters and tool parameters.
 */
public final class ScopeFilterKeys {
   public static final String TEAM_ID = "team_id";
   public static final String DEPARTMENT_ID = "department_id";
   public static final String OWNER_ID = "owner_id";
   public static final String OWNER_IDS = "owner_ids";
   public static final String PROJECT_ID = "project_id";
   public static final String PROJECT_IDS = "project_ids";
   public static final String HIERARCHY_DEPTH = "hierarchy_depth";
   public static final String MAX_DEPTH = "max_depth";
   public static final String ONBOARDING_VISIBLE = "onboarding_visible";

   private ScopeFilterKeys() {
   }
}
