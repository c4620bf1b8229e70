package com.aimanager.rbac.context;

import java.util.List;

/**
 * What the organization directory knows about a user. Any field may be null.
 */
public record OrgChartEntry(String role,
                            String teamId,
                            String departmentId,
                            String organizationId,
                            String email,
                            String name,
                            String managerId,
                            List<String> directReports,
                            List<String> projectIds) {

   public OrgChartEntry {
      directReports = directReports == null ? List.of() : List.copyOf(directReports);
      projectIds = projectIds == null ? List.of() : List.copyOf(projectIds);
   }
}
