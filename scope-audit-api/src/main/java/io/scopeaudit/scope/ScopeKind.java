// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.scope;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Level of a scope in the tenant hierarchy.
 */
public enum ScopeKind {
  // These are ordered general-to-specific. Reports are sorted on this
  // ordering, so it must be maintained.
  MANAGEMENT_GROUP("ManagementGroup"),
  SUBSCRIPTION("Subscription"),
  RESOURCE_GROUP("ResourceGroup"),
  RESOURCE("Resource");

  private final String displayName;

  ScopeKind(String displayName) {
    this.displayName = displayName;
  }

  @JsonValue
  public String displayName() {
    return displayName;
  }

  /**
   * Parses a kind as returned by directory services. Accepts both the display form
   * ("ResourceGroup") and the enum constant name ("RESOURCE_GROUP").
   */
  @JsonCreator
  public static ScopeKind fromString(String value) {
    if (value == null || value.trim().isEmpty())
      throw new InvalidScopeException("Scope kind must be non-empty");
    String normalized = value.trim().replace("_", "").replace("-", "");
    for (ScopeKind kind : values()) {
      if (kind.displayName.equalsIgnoreCase(normalized))
        return kind;
    }
    throw new InvalidScopeException("Unknown scope kind: " + value);
  }

  @Override
  public String toString() {
    return displayName;
  }
}
