// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.engine;

import io.scopeaudit.directory.FailureReason;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.kafka.common.utils.Time;

/**
 * Cancellation and deadline state shared by all stages of one audit run. Stages check
 * {@link #shouldStop()} before every remote call and stop issuing calls once it returns true.
 */
public class RunContext {

  private final Time time;
  private final long deadlineMs;
  private final AtomicReference<FailureReason> stopReason;

  public RunContext(Time time, Duration timeout) {
    this.time = time;
    long now = time.milliseconds();
    long timeoutMs = timeout.toMillis();
    this.deadlineMs = Long.MAX_VALUE - now < timeoutMs ? Long.MAX_VALUE : now + timeoutMs;
    this.stopReason = new AtomicReference<>();
  }

  public Time time() {
    return time;
  }

  public void cancel() {
    stopReason.compareAndSet(null, FailureReason.CANCELLED);
  }

  /**
   * Marks the run as timed out. Used when the deadline is detected by a wait on the run's
   * threads rather than by {@link #shouldStop()}.
   */
  public void expire() {
    stopReason.compareAndSet(null, FailureReason.RUN_TIMEOUT);
  }

  public boolean shouldStop() {
    if (stopReason.get() != null)
      return true;
    if (time.milliseconds() >= deadlineMs) {
      stopReason.compareAndSet(null, FailureReason.RUN_TIMEOUT);
      return true;
    }
    if (Thread.currentThread().isInterrupted()) {
      stopReason.compareAndSet(null, FailureReason.CANCELLED);
      return true;
    }
    return false;
  }

  /**
   * Returns {@link FailureReason#CANCELLED} or {@link FailureReason#RUN_TIMEOUT} if the run has
   * been stopped, null otherwise.
   */
  public FailureReason stopReason() {
    return stopReason.get();
  }

  public long remainingMs() {
    return Math.max(0, deadlineMs - time.milliseconds());
  }
}
