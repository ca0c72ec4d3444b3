// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.assignment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A classified access grant or policy assignment, as reported for one scope. Records are
 * owned by the scope they were collected for and are never modified after classification.
 *
 * The scope path is the scope the assignment is bound to. It differs from the scope id when
 * the assignment is inherited from an ancestor.
 */
public class AssignmentRecord {

  private final String scopeId;
  private final String scopePath;
  private final AssignmentCategory category;
  private final String name;
  private final Principal principal;
  private final DefinitionRef roleOrPolicyRef;
  private final TemporalWindow temporal;
  private final Condition condition;
  private final Inheritance inheritance;
  private final LifecycleState lifecycleState;
  private final String enforcementMode;
  private final List<String> notScopes;
  private final List<String> warnings;

  public AssignmentRecord(String scopeId,
                          String scopePath,
                          AssignmentCategory category,
                          String name,
                          Principal principal,
                          DefinitionRef roleOrPolicyRef,
                          TemporalWindow temporal,
                          Condition condition,
                          Inheritance inheritance,
                          LifecycleState lifecycleState,
                          String enforcementMode,
                          List<String> notScopes,
                          List<String> warnings) {
    this.scopeId = Objects.requireNonNull(scopeId, "scopeId");
    this.scopePath = Objects.requireNonNull(scopePath, "scopePath");
    this.category = Objects.requireNonNull(category, "category");
    this.name = name == null ? "" : name;
    this.principal = Objects.requireNonNull(principal, "principal");
    this.roleOrPolicyRef = Objects.requireNonNull(roleOrPolicyRef, "roleOrPolicyRef");
    this.temporal = temporal == null ? TemporalWindow.NONE : temporal;
    this.condition = condition == null ? Condition.NONE : condition;
    this.inheritance = Objects.requireNonNull(inheritance, "inheritance");
    this.lifecycleState = Objects.requireNonNull(lifecycleState, "lifecycleState");
    this.enforcementMode = enforcementMode;
    this.notScopes = notScopes == null ? Collections.emptyList()
        : Collections.unmodifiableList(new ArrayList<>(notScopes));
    this.warnings = warnings == null ? Collections.emptyList()
        : Collections.unmodifiableList(new ArrayList<>(warnings));
  }

  public String scopeId() {
    return scopeId;
  }

  public String scopePath() {
    return scopePath;
  }

  public AssignmentCategory category() {
    return category;
  }

  public String name() {
    return name;
  }

  public Principal principal() {
    return principal;
  }

  public DefinitionRef roleOrPolicyRef() {
    return roleOrPolicyRef;
  }

  public TemporalWindow temporal() {
    return temporal;
  }

  public Condition condition() {
    return condition;
  }

  public boolean isConditional() {
    return condition.isPresent();
  }

  public Inheritance inheritance() {
    return inheritance;
  }

  public LifecycleState lifecycleState() {
    return lifecycleState;
  }

  /**
   * Single human-readable state, e.g. "Active", "Expired (Conditional)".
   */
  public String stateLabel() {
    return lifecycleState.label(isConditional());
  }

  /**
   * Policy enforcement mode, null for access grants.
   */
  public String enforcementMode() {
    return enforcementMode;
  }

  public List<String> notScopes() {
    return notScopes;
  }

  /**
   * Data quality problems found while classifying this record, empty for well-formed input.
   */
  public List<String> warnings() {
    return warnings;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AssignmentRecord)) {
      return false;
    }

    AssignmentRecord that = (AssignmentRecord) o;
    return Objects.equals(scopeId, that.scopeId) &&
        Objects.equals(scopePath, that.scopePath) &&
        category == that.category &&
        Objects.equals(name, that.name) &&
        Objects.equals(principal, that.principal) &&
        Objects.equals(roleOrPolicyRef, that.roleOrPolicyRef) &&
        Objects.equals(temporal, that.temporal) &&
        Objects.equals(condition, that.condition) &&
        inheritance == that.inheritance &&
        lifecycleState == that.lifecycleState &&
        Objects.equals(enforcementMode, that.enforcementMode) &&
        Objects.equals(notScopes, that.notScopes) &&
        Objects.equals(warnings, that.warnings);
  }

  @Override
  public int hashCode() {
    return Objects.hash(scopeId, scopePath, category, name, principal, roleOrPolicyRef, temporal,
        condition, inheritance, lifecycleState, enforcementMode, notScopes, warnings);
  }

  @Override
  public String toString() {
    return "AssignmentRecord(" +
        "scopeId='" + scopeId + '\'' +
        ", scopePath='" + scopePath + '\'' +
        ", category=" + category +
        ", principal=" + principal +
        ", roleOrPolicyRef=" + roleOrPolicyRef +
        ", inheritance=" + inheritance +
        ", state=" + stateLabel() +
        ')';
  }
}
