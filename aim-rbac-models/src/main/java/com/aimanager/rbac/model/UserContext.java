package com.aimanager.rbac.model;

import io.quarkus.runtime.annotations.RegisterForReflection;
import jakarta.validation.constraints.NotNull;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * UserContext holds everything known about the caller of a single request: who they are,
 * their role, where they sit in the organization, and the session metadata the request
 * arrived with. It is built once per request, is immutable, and is never persisted.
 */
@RegisterForReflection
@Getter
@EqualsAndHashCode
@ToString
public final class UserContext {
   @NotNull final String userId;
   @NotNull final Role role;
   final String teamId;
   final String departmentId;
   final String organizationId;

   final String email;
   final String name;
   final String managerId;
   final List<String> directReports;
   final List<String> projectIds;

   // session metadata
   final String sessionId;
   final String ipAddress;
   final String userAgent;
   @EqualsAndHashCode.Exclude
   final Instant createdAt;

   UserContext(Builder b) {
      this.userId = b.userId;
      this.role = b.role;
      this.teamId = b.teamId;
      this.departmentId = b.departmentId;
      this.organizationId = b.organizationId;
      this.email = b.email;
      this.name = b.name;
      this.managerId = b.managerId;
      this.directReports = Collections.unmodifiableList(new ArrayList<>(b.directReports));
      this.projectIds = Collections.unmodifiableList(new ArrayList<>(b.projectIds));
      this.sessionId = b.sessionId;
      this.ipAddress = b.ipAddress;
      this.userAgent = b.userAgent;
      this.createdAt = b.createdAt != null ? b.createdAt : Instant.now();
   }

   public boolean isManagerOf(String otherUserId) {
      return otherUserId != null && directReports.contains(otherUserId);
   }

   public boolean isMemberOfProject(String projectId) {
      return projectId != null && projectIds.contains(projectId);
   }

   /**
    * Identity fields as recorded on decisions and audit events. Session metadata is left out.
    */
   public Map<String, Object> toSnapshot() {
      Map<String, Object> snapshot = new LinkedHashMap<>();
      snapshot.put("user_id", userId);
      snapshot.put("role", role != null ? role.name() : null);
      snapshot.put("team_id", teamId);
      snapshot.put("department_id", departmentId);
      snapshot.put("organization_id", organizationId);
      snapshot.put("email", email);
      snapshot.put("name", name);
      snapshot.put("manager_id", managerId);
      snapshot.put("direct_reports", directReports);
      snapshot.put("project_ids", projectIds);
      return Collections.unmodifiableMap(snapshot);
   }

   /**
    * Copy of this context with a different role, used by the demo role override.
    */
   public UserContext withRole(Role newRole) {
      return toBuilder().withRole(newRole).build();
   }

   public Builder toBuilder() {
      return new Builder()
         .withUserId(userId)
         .withRole(role)
         .withTeamId(teamId)
         .withDepartmentId(departmentId)
         .withOrganizationId(organizationId)
         .withEmail(email)
         .withName(name)
         .withManagerId(managerId)
         .withDirectReports(directReports)
         .withProjectIds(projectIds)
         .withSessionId(sessionId)
         .withIpAddress(ipAddress)
         .withUserAgent(userAgent)
         .withCreatedAt(createdAt);
   }

   public static class Builder {
      String userId;
      Role role;
      String teamId = "";
      String departmentId = "";
      String organizationId = "";
      String email;
      String name;
      String managerId;
      List<String> directReports = new ArrayList<>();
      List<String> projectIds = new ArrayList<>();
      String sessionId;
      String ipAddress;
      String userAgent;
      Instant createdAt;

      public Builder withUserId(String userId) {
         this.userId = userId;
         return this;
      }

      public Builder withRole(Role role) {
         this.role = role;
         return this;
      }

      public Builder withTeamId(String teamId) {
         this.teamId = teamId;
         return this;
      }

      public Builder withDepartmentId(String departmentId) {
         this.departmentId = departmentId;
         return this;
      }

      public Builder withOrganizationId(String organizationId) {
         this.organizationId = organizationId;
         return this;
      }

      public Builder withEmail(String email) {
         this.email = email;
         return this;
      }

      public Builder withName(String name) {
         this.name = name;
         return this;
      }

      public Builder withManagerId(String managerId) {
         this.managerId = managerId;
         return this;
      }

      public Builder withDirectReports(Collection<String> directReports) {
         this.directReports = directReports == null ? new ArrayList<>() : new ArrayList<>(directReports);
         return this;
      }

      public Builder withProjectIds(Collection<String> projectIds) {
         this.projectIds = projectIds == null ? new ArrayList<>() : new ArrayList<>(projectIds);
         return this;
      }

      public Builder withSessionId(String sessionId) {
         this.sessionId = sessionId;
         return this;
      }

      public Builder withIpAddress(String ipAddress) {
         this.ipAddress = ipAddress;
         return this;
      }

      public Builder withUserAgent(String userAgent) {
         this.userAgent = userAgent;
         return this;
      }

      public Builder withCreatedAt(Instant createdAt) {
         this.createdAt = createdAt;
         return this;
      }

      public UserContext build() {
         return new UserContext(this);
      }
   }
}
