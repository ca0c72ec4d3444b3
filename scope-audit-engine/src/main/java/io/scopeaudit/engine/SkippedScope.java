// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.engine;

import io.scopeaudit.assignment.AssignmentCategory;
import io.scopeaudit.directory.FailureReason;
import java.util.Objects;

/**
 * A scope, or one category of a scope, whose data is missing from a report.
 */
public class SkippedScope {

  public enum Stage {
    CHILDREN("Children"),
    STANDING_GRANTS("StandingGrants"),
    ELIGIBLE_GRANTS("EligibleGrants"),
    POLICY_ASSIGNMENTS("PolicyAssignments");

    private final String displayName;

    Stage(String displayName) {
      this.displayName = displayName;
    }

    public static Stage of(AssignmentCategory category) {
      switch (category) {
        case STANDING_GRANT:
          return STANDING_GRANTS;
        case ELIGIBLE_GRANT:
          return ELIGIBLE_GRANTS;
        case POLICY_ASSIGNMENT:
          return POLICY_ASSIGNMENTS;
        default:
          throw new IllegalArgumentException("Unknown assignment category " + category);
      }
    }

    @Override
    public String toString() {
      return displayName;
    }
  }

  private final String scopeId;
  private final Stage stage;
  private final FailureReason reason;
  private final String message;

  public SkippedScope(String scopeId, Stage stage, FailureReason reason, String message) {
    this.scopeId = Objects.requireNonNull(scopeId, "scopeId");
    this.stage = Objects.requireNonNull(stage, "stage");
    this.reason = Objects.requireNonNull(reason, "reason");
    this.message = message == null ? "" : message;
  }

  public String scopeId() {
    return scopeId;
  }

  /**
   * What was skipped: the scope's subtree ({@link Stage#CHILDREN}) or one assignment category.
   */
  public Stage stage() {
    return stage;
  }

  public FailureReason reason() {
    return reason;
  }

  public String message() {
    return message;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SkippedScope)) {
      return false;
    }

    SkippedScope that = (SkippedScope) o;
    return Objects.equals(scopeId, that.scopeId) &&
        stage == that.stage &&
        reason == that.reason &&
        Objects.equals(message, that.message);
  }

  @Override
  public int hashCode() {
    return Objects.hash(scopeId, stage, reason, message);
  }

  @Override
  public String toString() {
    return "SkippedScope(" +
        "scopeId='" + scopeId + '\'' +
        ", stage=" + stage +
        ", reason=" + reason +
        ')';
  }
}
