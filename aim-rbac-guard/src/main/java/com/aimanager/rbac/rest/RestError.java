package com.aimanager.rbac.rest;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.experimental.SuperBuilder;

@Data
@EqualsAndHashCode
@SuperBuilder
@RegisterForReflection
public class RestError {
   protected int status;
   protected int reasonCode;
   protected String statusMessage;
   protected String reasonMessage;
   protected String debugMessage;
   protected String policyId;
   protected String resource;
}
