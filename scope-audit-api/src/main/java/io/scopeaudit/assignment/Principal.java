// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.assignment;

import java.util.Objects;

/**
 * The identity an assignment grants access to, or the identity a policy assignment runs as.
 */
public class Principal {

  public static final String NO_PRINCIPAL_ID = "None";

  public static final Principal NONE = new Principal(NO_PRINCIPAL_ID, "", PrincipalKind.UNKNOWN);

  private final String id;
  private final String displayName;
  private final PrincipalKind kind;

  public Principal(String id, String displayName, PrincipalKind kind) {
    this.id = Objects.requireNonNull(id, "id");
    this.displayName = displayName == null ? "" : displayName;
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public String id() {
    return id;
  }

  public String displayName() {
    return displayName;
  }

  public PrincipalKind kind() {
    return kind;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Principal)) {
      return false;
    }

    Principal that = (Principal) o;
    return Objects.equals(id, that.id) &&
        Objects.equals(displayName, that.displayName) &&
        Objects.equals(kind, that.kind);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, displayName, kind);
  }

  @Override
  public String toString() {
    return kind + ":" + id;
  }
}
