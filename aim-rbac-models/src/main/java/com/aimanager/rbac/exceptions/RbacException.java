package com.aimanager.rbac.exceptions;

/**
 * Base type for faults raised by the access control layer.
 */
public class RbacException extends RuntimeException {

   public RbacException(String message) {
      super(message);
   }

   public RbacException(String message, Throwable cause) {
      super(message, cause);
   }
}
