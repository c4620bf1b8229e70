package com.aimanager.rbac.audit;

/**
 * Receives audit events, e.g. to persist them. Implementations are discovered as CDI beans.
 * Delivery is asynchronous and best effort; anything thrown here is logged and dropped.
 */
public interface AuditSink {

   void record(AuditEvent event);

   /**
    * Called in addition to {@link #record} for sensitive event types.
    */
   default void alert(AuditEvent event) {
   }
}
