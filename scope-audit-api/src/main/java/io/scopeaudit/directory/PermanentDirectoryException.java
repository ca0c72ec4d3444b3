// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.directory;

/**
 * Directory failure that a retry will not fix. The affected scope or branch is skipped.
 */
public class PermanentDirectoryException extends RemoteDirectoryException {

  private static final long serialVersionUID = 1L;

  public PermanentDirectoryException(String scopeId, FailureReason reason, String message) {
    super(scopeId, reason, message);
    if (reason.retriable())
      throw new IllegalArgumentException("Reason " + reason + " is transient");
  }
}
