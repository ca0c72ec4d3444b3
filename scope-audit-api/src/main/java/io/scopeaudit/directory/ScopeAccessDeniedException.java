// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.directory;

public class ScopeAccessDeniedException extends PermanentDirectoryException {

  private static final long serialVersionUID = 1L;

  public ScopeAccessDeniedException(String scopeId) {
    super(scopeId, FailureReason.ACCESS_DENIED, "Access denied to scope: " + scopeId);
  }
}
