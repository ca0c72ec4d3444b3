// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.assignment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category of an audited assignment. Standing and eligible grants belong to the access
 * (RBAC) domain, policy assignments to the policy domain. Both domains share the record shape
 * but not the semantics of their inheritance and identity fields.
 */
public enum AssignmentCategory {
  STANDING_GRANT("StandingGrant", Domain.RBAC),
  ELIGIBLE_GRANT("EligibleGrant", Domain.RBAC),
  POLICY_ASSIGNMENT("PolicyAssignment", Domain.POLICY);

  public enum Domain {
    RBAC,
    POLICY
  }

  private final String displayName;
  private final Domain domain;

  AssignmentCategory(String displayName, Domain domain) {
    this.displayName = displayName;
    this.domain = domain;
  }

  @JsonValue
  public String displayName() {
    return displayName;
  }

  public Domain domain() {
    return domain;
  }

  @JsonCreator
  public static AssignmentCategory fromString(String value) {
    for (AssignmentCategory category : values()) {
      if (category.displayName.equalsIgnoreCase(value) || category.name().equalsIgnoreCase(value))
        return category;
    }
    throw new IllegalArgumentException("Unknown assignment category: " + value);
  }

  @Override
  public String toString() {
    return displayName;
  }
}
