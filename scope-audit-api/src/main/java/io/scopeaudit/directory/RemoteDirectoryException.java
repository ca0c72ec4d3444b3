// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.directory;

/**
 * Failure of a directory service call. Subclasses distinguish failures worth retrying from
 * failures that will not change on retry.
 */
public abstract class RemoteDirectoryException extends Exception {

  private static final long serialVersionUID = 1L;

  private final String scopeId;
  private final FailureReason reason;

  protected RemoteDirectoryException(String scopeId, FailureReason reason, String message) {
    super(message);
    this.scopeId = scopeId;
    this.reason = reason;
  }

  protected RemoteDirectoryException(String scopeId, FailureReason reason, String message, Throwable cause) {
    super(message, cause);
    this.scopeId = scopeId;
    this.reason = reason;
  }

  public String scopeId() {
    return scopeId;
  }

  public FailureReason reason() {
    return reason;
  }

  public boolean retriable() {
    return reason.retriable();
  }
}
