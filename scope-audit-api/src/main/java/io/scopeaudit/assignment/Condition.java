// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.assignment;

import java.util.Objects;

/**
 * Attribute-based condition attached to an assignment. The expression is kept verbatim.
 */
public class Condition {

  public static final Condition NONE = new Condition(null, null);

  private final String expression;
  private final String version;

  public Condition(String expression, String version) {
    this.expression = expression == null || expression.trim().isEmpty() ? null : expression;
    this.version = version;
  }

  public boolean isPresent() {
    return expression != null;
  }

  public String expression() {
    return expression;
  }

  public String version() {
    return version;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Condition)) {
      return false;
    }

    Condition that = (Condition) o;
    return Objects.equals(expression, that.expression) && Objects.equals(version, that.version);
  }

  @Override
  public int hashCode() {
    return Objects.hash(expression, version);
  }

  @Override
  public String toString() {
    return isPresent() ? expression : "None";
  }
}
