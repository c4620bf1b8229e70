package com.aimanager.rbac.guard;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Value;

import java.util.List;
import java.util.Map;

@RegisterForReflection
@Value
public class DashboardConfig {
   public static final int DEFAULT_REFRESH_SECONDS = 60;
   public static final int ONBOARDING_REFRESH_SECONDS = 300;

   List<String> widgets;
   @JsonProperty("data_scope")
   Map<String, Object> dataScope;
   @JsonProperty("refresh_interval")
   int refreshIntervalSeconds;
}
