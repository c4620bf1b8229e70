package com.aimanager.rbac.exceptions;

/**
 * A policy was rejected at registration time: missing fields, a duplicate id, or an
 * unusable condition.
 */
public class PolicyConfigurationException extends RbacException {
   private final String policyId;

   public PolicyConfigurationException(String policyId, String message) {
      super(policyId == null ? message : "Policy " + policyId + ": " + message);
      this.policyId = policyId;
   }

   public String getPolicyId() {
      return policyId;
   }
}
