package com.aimanager.rbac.exceptions;

import com.aimanager.rbac.model.policy.AccessDecision;

/**
 * Raised when a caller must hold a permission it does not have. The message is the
 * decision's reason, verbatim.
 */
public class PermissionDeniedException extends RbacException {
   private final transient AccessDecision decision;

   public PermissionDeniedException(AccessDecision decision) {
      super(decision.getReason());
      this.decision = decision;
   }

   public AccessDecision getDecision() {
      return decision;
   }
}
