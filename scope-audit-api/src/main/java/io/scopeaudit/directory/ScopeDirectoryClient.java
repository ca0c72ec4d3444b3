// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.directory;

import io.scopeaudit.assignment.AssignmentCategory;
import io.scopeaudit.assignment.RawAssignment;
import java.io.Closeable;
import java.util.List;

/**
 * Read-only view of the tenant's scope hierarchy and the assignments bound to it.
 *
 * All methods are idempotent reads that may be retried. Implementations must be safe for use
 * by concurrent collector threads. Permanent failures are reported as
 * {@link PermanentDirectoryException}, throttling and timeouts as
 * {@link TransientDirectoryException}.
 */
public interface ScopeDirectoryClient extends Closeable {

  /**
   * Returns the immediate children of a scope, in the order the service lists them.
   */
  List<ChildScope> getChildren(String scopeId) throws RemoteDirectoryException;

  /**
   * Returns the standing grants effective at or above the scope.
   */
  List<RawAssignment> getStandingGrants(String scopeId) throws RemoteDirectoryException;

  /**
   * Returns the eligible (time-bound, activation-required) grants effective at or above the scope.
   */
  List<RawAssignment> getEligibleGrants(String scopeId) throws RemoteDirectoryException;

  /**
   * Returns the policy assignments effective at or above the scope.
   */
  List<RawAssignment> getPolicyAssignments(String scopeId) throws RemoteDirectoryException;

  default List<RawAssignment> getAssignments(String scopeId, AssignmentCategory category)
      throws RemoteDirectoryException {
    switch (category) {
      case STANDING_GRANT:
        return getStandingGrants(scopeId);
      case ELIGIBLE_GRANT:
        return getEligibleGrants(scopeId);
      case POLICY_ASSIGNMENT:
        return getPolicyAssignments(scopeId);
      default:
        throw new IllegalArgumentException("Unknown assignment category " + category);
    }
  }

  @Override
  default void close() {
  }
}
