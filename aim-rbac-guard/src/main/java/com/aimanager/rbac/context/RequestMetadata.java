package com.aimanager.rbac.context;

/**
 * Transport details of the request a context is built for. Every field is optional.
 *
 * @param demoRole role requested through the demo override header; ignored unless the
 *                 override is enabled
 */
public record RequestMetadata(String sessionId, String ipAddress, String userAgent, String demoRole) {

   public static final RequestMetadata NONE = new RequestMetadata(null, null, null, null);

   public static RequestMetadata of(String sessionId, String ipAddress, String userAgent) {
      return new RequestMetadata(sessionId, ipAddress, userAgent, null);
   }

   public RequestMetadata withDemoRole(String role) {
      return new RequestMetadata(sessionId, ipAddress, userAgent, role);
   }
}
