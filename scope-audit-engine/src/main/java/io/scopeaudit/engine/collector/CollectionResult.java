// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.engine.collector;

import com.google.common.collect.ImmutableList;
import io.scopeaudit.assignment.CollectedAssignment;
import io.scopeaudit.engine.SkippedScope;
import io.scopeaudit.scope.ScopeNode;
import java.util.List;

/**
 * Assignments collected for one scope, with the categories that could not be collected.
 */
public class CollectionResult {

  private final ScopeNode scope;
  private final List<CollectedAssignment> assignments;
  private final List<SkippedScope> skipped;

  public CollectionResult(ScopeNode scope,
                          List<CollectedAssignment> assignments,
                          List<SkippedScope> skipped) {
    this.scope = scope;
    this.assignments = ImmutableList.copyOf(assignments);
    this.skipped = ImmutableList.copyOf(skipped);
  }

  public ScopeNode scope() {
    return scope;
  }

  public List<CollectedAssignment> assignments() {
    return assignments;
  }

  public List<SkippedScope> skipped() {
    return skipped;
  }

  @Override
  public String toString() {
    return "CollectionResult(" +
        "scope=" + scope.id() +
        ", assignments=" + assignments.size() +
        ", skipped=" + skipped +
        ')';
  }
}
