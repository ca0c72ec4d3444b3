// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.engine.aggregator;

import io.scopeaudit.assignment.AssignmentCategory;
import io.scopeaudit.assignment.AssignmentRecord;
import io.scopeaudit.scope.ScopePaths;
import java.util.Objects;

/**
 * Identity of a grant as reported at one scope. Scope ids and paths are compared in canonical
 * form.
 */
public class AssignmentKey {

  private final String scopeId;
  private final AssignmentCategory category;
  private final String principalId;
  private final String definitionId;
  private final String scopePath;

  public AssignmentKey(String scopeId,
                       AssignmentCategory category,
                       String principalId,
                       String definitionId,
                       String scopePath) {
    this.scopeId = ScopePaths.canonical(scopeId);
    this.category = category;
    this.principalId = principalId;
    this.definitionId = definitionId;
    this.scopePath = ScopePaths.canonical(scopePath);
  }

  public static AssignmentKey of(AssignmentRecord record) {
    return new AssignmentKey(record.scopeId(),
        record.category(),
        record.principal().id(),
        record.roleOrPolicyRef().id(),
        record.scopePath());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AssignmentKey)) {
      return false;
    }

    AssignmentKey that = (AssignmentKey) o;
    return Objects.equals(scopeId, that.scopeId) &&
        category == that.category &&
        Objects.equals(principalId, that.principalId) &&
        Objects.equals(definitionId, that.definitionId) &&
        Objects.equals(scopePath, that.scopePath);
  }

  @Override
  public int hashCode() {
    return Objects.hash(scopeId, category, principalId, definitionId, scopePath);
  }

  @Override
  public String toString() {
    return "AssignmentKey(" +
        "scopeId='" + scopeId + '\'' +
        ", category=" + category +
        ", principalId='" + principalId + '\'' +
        ", definitionId='" + definitionId + '\'' +
        ", scopePath='" + scopePath + '\'' +
        ')';
  }
}
