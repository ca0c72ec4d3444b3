// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.directory;

/**
 * Why a scope or branch is missing from an audit report.
 */
public enum FailureReason {
  NOT_FOUND("NotFound", false),
  ACCESS_DENIED("AccessDenied", false),
  THROTTLED("Throttled", true),
  REMOTE_TIMEOUT("RemoteTimeout", true),
  UNEXPECTED("Unexpected", false),
  CANCELLED("Cancelled", false),
  RUN_TIMEOUT("RunTimeout", false);

  private final String displayName;
  private final boolean retriable;

  FailureReason(String displayName, boolean retriable) {
    this.displayName = displayName;
    this.retriable = retriable;
  }

  public boolean retriable() {
    return retriable;
  }

  @Override
  public String toString() {
    return displayName;
  }
}
