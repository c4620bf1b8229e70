package com.aimanager.rbac.context;

import java.util.Optional;

/**
 * Looks up reporting lines and project membership for a user, e.g. from an HR system.
 * Implementations are optional CDI beans; without one, contexts carry only token data.
 */
public interface OrgChartResolver {

   Optional<OrgChartEntry> lookup(String userId);
}
