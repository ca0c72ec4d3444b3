// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.directory;

/**
 * Throttling or timeout of a directory call. These calls are idempotent reads and may be
 * retried.
 */
public class TransientDirectoryException extends RemoteDirectoryException {

  private static final long serialVersionUID = 1L;

  private final long retryAfterMs;

  public TransientDirectoryException(String scopeId, FailureReason reason, String message) {
    this(scopeId, reason, message, -1L, null);
  }

  public TransientDirectoryException(String scopeId, FailureReason reason, String message,
                                     long retryAfterMs, Throwable cause) {
    super(scopeId, reason, message, cause);
    if (!reason.retriable())
      throw new IllegalArgumentException("Reason " + reason + " is not transient");
    this.retryAfterMs = retryAfterMs;
  }

  public static TransientDirectoryException throttled(String scopeId, long retryAfterMs) {
    return new TransientDirectoryException(scopeId, FailureReason.THROTTLED,
        "Request for scope " + scopeId + " was throttled", retryAfterMs, null);
  }

  public static TransientDirectoryException timeout(String scopeId, Throwable cause) {
    return new TransientDirectoryException(scopeId, FailureReason.REMOTE_TIMEOUT,
        "Request for scope " + scopeId + " timed out", -1L, cause);
  }

  /**
   * Delay requested by the service before the next attempt, or -1 if none was requested.
   */
  public long retryAfterMs() {
    return retryAfterMs;
  }
}
