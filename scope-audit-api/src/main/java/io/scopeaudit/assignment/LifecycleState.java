// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.assignment;

/**
 * Temporal and activation status of an assignment at evaluation time.
 */
public enum LifecycleState {
  ACTIVE("Active"),
  EXPIRED("Expired"),
  NOT_YET_ACTIVE("NotYetActive"),
  CONDITIONAL("Conditional"),
  // Time-bound, but no temporal value could be read
  UNKNOWN("TimeBound");

  public static final String CONDITIONAL_QUALIFIER = " (Conditional)";

  private final String label;

  LifecycleState(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  /**
   * Returns the human-readable state, with the conditional qualifier appended to states other
   * than {@link #CONDITIONAL} when the assignment carries a condition.
   */
  public String label(boolean conditional) {
    if (conditional && this != CONDITIONAL)
      return label + CONDITIONAL_QUALIFIER;
    return label;
  }

  @Override
  public String toString() {
    return label;
  }
}
