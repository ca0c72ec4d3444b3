// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.directory;

public class ScopeNotFoundException extends PermanentDirectoryException {

  private static final long serialVersionUID = 1L;

  public ScopeNotFoundException(String scopeId) {
    super(scopeId, FailureReason.NOT_FOUND, "Scope not found: " + scopeId);
  }
}
