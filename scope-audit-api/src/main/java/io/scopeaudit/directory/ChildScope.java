// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.directory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.scopeaudit.scope.ScopeKind;
import java.util.Objects;

/**
 * Immediate child of a scope as reported by the directory service.
 */
public class ChildScope {

  private final String id;
  private final String displayName;
  private final ScopeKind kind;

  @JsonCreator
  public ChildScope(@JsonProperty("id") String id,
                    @JsonProperty("displayName") String displayName,
                    @JsonProperty("kind") ScopeKind kind) {
    this.id = Objects.requireNonNull(id, "id");
    this.displayName = displayName;
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  @JsonProperty
  public String id() {
    return id;
  }

  @JsonProperty
  public String displayName() {
    return displayName;
  }

  @JsonProperty
  public ScopeKind kind() {
    return kind;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ChildScope)) {
      return false;
    }

    ChildScope that = (ChildScope) o;
    return Objects.equals(id, that.id) &&
        Objects.equals(displayName, that.displayName) &&
        kind == that.kind;
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, displayName, kind);
  }

  @Override
  public String toString() {
    return kind + "(" + id + ")";
  }
}
