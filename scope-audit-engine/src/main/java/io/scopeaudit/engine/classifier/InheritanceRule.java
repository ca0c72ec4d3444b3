// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.engine.classifier;

import io.scopeaudit.assignment.AssignmentCategory;
import io.scopeaudit.assignment.Inheritance;
import io.scopeaudit.scope.ScopeKind;
import io.scopeaudit.scope.ScopeNode;
import io.scopeaudit.scope.ScopePaths;

/**
 * Decides whether an assignment is bound at the reporting scope itself or at an ancestor.
 * Access grants and policy assignments use different rules and must not be unified.
 */
public enum InheritanceRule {

  /**
   * Direct iff the bound scope path is the reporting scope's path.
   */
  PATH_EQUALITY {
    @Override
    public Inheritance evaluate(String scopePath, ScopeNode reportingScope) {
      return ScopePaths.sameScope(scopePath, reportingScope.id()) ? Inheritance.DIRECT : Inheritance.INHERITED;
    }
  },

  /**
   * Policy assignments bound at a management group are always inherited below the management
   * group level. At management group level they are direct iff the group names match.
   */
  POLICY {
    @Override
    public Inheritance evaluate(String scopePath, ScopeNode reportingScope) {
      if (!ScopePaths.isManagementGroupPath(scopePath))
        return PATH_EQUALITY.evaluate(scopePath, reportingScope);
      if (reportingScope.kind() != ScopeKind.MANAGEMENT_GROUP)
        return Inheritance.INHERITED;
      String assignedGroup = ScopePaths.canonical(ScopePaths.lastSegment(scopePath));
      String reportingGroup = ScopePaths.canonical(ScopePaths.lastSegment(reportingScope.id()));
      return assignedGroup.equals(reportingGroup) ? Inheritance.DIRECT : Inheritance.INHERITED;
    }
  };

  public abstract Inheritance evaluate(String scopePath, ScopeNode reportingScope);

  public static InheritanceRule forCategory(AssignmentCategory category) {
    return category.domain() == AssignmentCategory.Domain.POLICY ? POLICY : PATH_EQUALITY;
  }
}
