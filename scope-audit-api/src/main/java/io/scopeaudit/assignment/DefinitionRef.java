// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.assignment;

import java.util.Objects;

/**
 * Reference to the role definition of a grant or the policy definition of a policy assignment.
 */
public class DefinitionRef {

  private final String id;
  private final String displayName;

  public DefinitionRef(String id, String displayName) {
    this.id = id == null ? "" : id;
    this.displayName = displayName == null || displayName.isEmpty() ? this.id : displayName;
  }

  public String id() {
    return id;
  }

  public String displayName() {
    return displayName;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DefinitionRef)) {
      return false;
    }

    DefinitionRef that = (DefinitionRef) o;
    return Objects.equals(id, that.id) && Objects.equals(displayName, that.displayName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, displayName);
  }

  @Override
  public String toString() {
    return displayName;
  }
}
