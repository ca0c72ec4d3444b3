// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.engine;

import io.scopeaudit.directory.RemoteDirectoryException;
import io.scopeaudit.directory.TransientDirectoryException;
import org.apache.kafka.common.utils.ExponentialBackoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retries directory calls that fail with throttling or timeouts, backing off exponentially
 * between attempts. Permanent failures are rethrown immediately. The last transient failure is
 * rethrown once attempts are exhausted or the run is stopped.
 *
 * A delay requested by the service is honoured up to the maximum backoff. No wait extends past
 * the run deadline.
 */
public class RemoteCallRetrier {

  private static final Logger log = LoggerFactory.getLogger(RemoteCallRetrier.class);

  public interface RemoteCall<T> {
    T call() throws RemoteDirectoryException;
  }

  private static final int BACKOFF_MULTIPLIER = 2;

  private final int maxAttempts;
  private final long initialBackoffMs;
  private final long maxBackoffMs;
  // Null without jitter, ExponentialBackoff requires a non-empty jitter range
  private final ExponentialBackoff backoff;
  private final RunContext context;

  public RemoteCallRetrier(int maxAttempts,
                           long initialBackoffMs,
                           long maxBackoffMs,
                           double jitter,
                           RunContext context) {
    if (maxAttempts < 1)
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    this.maxAttempts = maxAttempts;
    this.initialBackoffMs = initialBackoffMs;
    this.maxBackoffMs = maxBackoffMs;
    this.backoff = jitter > 0
        ? new ExponentialBackoff(initialBackoffMs, BACKOFF_MULTIPLIER, maxBackoffMs, jitter)
        : null;
    this.context = context;
  }

  public static RemoteCallRetrier fromConfig(AuditConfig config, RunContext context) {
    return new RemoteCallRetrier(config.retryMaxAttempts,
        config.retryBackoff.toMillis(),
        config.retryBackoffMax.toMillis(),
        config.retryBackoffJitter,
        context);
  }

  public <T> T call(String description, RemoteCall<T> remoteCall) throws RemoteDirectoryException {
    int attempt = 0;
    while (true) {
      try {
        return remoteCall.call();
      } catch (TransientDirectoryException e) {
        attempt++;
        if (attempt >= maxAttempts) {
          log.debug("Giving up on {} after {} attempts", description, attempt);
          throw e;
        }
        long waitMs = Math.min(waitMs(e, attempt), context.remainingMs());
        log.debug("{} failed with {}, retrying in {} ms (attempt {} of {})",
            description, e.reason(), waitMs, attempt, maxAttempts);
        context.time().sleep(waitMs);
        if (context.shouldStop()) {
          log.debug("Run stopped with {} while retrying {}", context.stopReason(), description);
          throw e;
        }
      }
    }
  }

  private long waitMs(TransientDirectoryException e, int attempt) {
    if (e.retryAfterMs() > 0)
      return Math.min(e.retryAfterMs(), maxBackoffMs);
    if (backoff != null)
      return backoff.backoff(attempt - 1);
    long waitMs = initialBackoffMs;
    for (int i = 1; i < attempt && waitMs < maxBackoffMs; i++)
      waitMs *= BACKOFF_MULTIPLIER;
    return Math.min(waitMs, maxBackoffMs);
  }
}
