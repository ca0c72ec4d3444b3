// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.assignment;

public enum Inheritance {
  DIRECT("Direct"),
  INHERITED("Inherited");

  private final String displayName;

  Inheritance(String displayName) {
    this.displayName = displayName;
  }

  @Override
  public String toString() {
    return displayName;
  }
}
