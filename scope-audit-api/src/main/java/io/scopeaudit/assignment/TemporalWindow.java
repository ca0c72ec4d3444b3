// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.assignment;

import java.time.Instant;
import java.util.Objects;

/**
 * Parsed validity window of a time-bound assignment. All values are optional; standing grants
 * have none of them.
 */
public class TemporalWindow {

  public static final TemporalWindow NONE = new TemporalWindow(null, null, null);

  private final Instant startTime;
  private final Instant endTime;
  private final Instant createdOn;

  public TemporalWindow(Instant startTime, Instant endTime, Instant createdOn) {
    this.startTime = startTime;
    this.endTime = endTime;
    this.createdOn = createdOn;
  }

  public Instant startTime() {
    return startTime;
  }

  public Instant endTime() {
    return endTime;
  }

  public Instant createdOn() {
    return createdOn;
  }

  public boolean isTimeBound() {
    return startTime != null || endTime != null;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TemporalWindow)) {
      return false;
    }

    TemporalWindow that = (TemporalWindow) o;
    return Objects.equals(startTime, that.startTime) &&
        Objects.equals(endTime, that.endTime) &&
        Objects.equals(createdOn, that.createdOn);
  }

  @Override
  public int hashCode() {
    return Objects.hash(startTime, endTime, createdOn);
  }

  @Override
  public String toString() {
    return "TemporalWindow(" +
        "startTime=" + startTime +
        ", endTime=" + endTime +
        ", createdOn=" + createdOn +
        ')';
  }
}
