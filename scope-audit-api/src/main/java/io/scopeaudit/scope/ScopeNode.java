// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.scope;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * A scope discovered during a hierarchy walk. Nodes are created by the walker when they are
 * first reached and are not modified afterwards.
 *
 * The parent id is null only for the roots named by the caller. The root id is the root that
 * first reached this node; other roots that can reach it are tracked by the walk result.
 */
public class ScopeNode {

  private final String id;
  private final String displayName;
  private final ScopeKind kind;
  private final String parentId;
  private final String rootId;

  @JsonCreator
  public ScopeNode(@JsonProperty("id") String id,
                   @JsonProperty("displayName") String displayName,
                   @JsonProperty("kind") ScopeKind kind,
                   @JsonProperty("parentId") String parentId,
                   @JsonProperty("rootId") String rootId) {
    if (id == null || id.isEmpty())
      throw new InvalidScopeException("Scope id must be non-empty");
    this.id = id;
    this.displayName = displayName == null || displayName.isEmpty() ? id : displayName;
    this.kind = Objects.requireNonNull(kind, "kind");
    this.parentId = parentId;
    this.rootId = rootId == null ? id : rootId;
  }

  public static ScopeNode root(String id, String displayName, ScopeKind kind) {
    return new ScopeNode(id, displayName, kind, null, id);
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

  @JsonProperty
  public String parentId() {
    return parentId;
  }

  @JsonProperty
  public String rootId() {
    return rootId;
  }

  public boolean isRoot() {
    return parentId == null;
  }

  /**
   * The path that assignments bound directly at this scope carry as their scope.
   */
  public String canonicalPath() {
    return ScopePaths.canonical(id);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ScopeNode)) {
      return false;
    }

    ScopeNode that = (ScopeNode) o;
    return Objects.equals(id, that.id) &&
        Objects.equals(displayName, that.displayName) &&
        kind == that.kind &&
        Objects.equals(parentId, that.parentId) &&
        Objects.equals(rootId, that.rootId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, displayName, kind, parentId, rootId);
  }

  @Override
  public String toString() {
    return "ScopeNode(" +
        "id='" + id + '\'' +
        ", kind=" + kind +
        ", parentId='" + parentId + '\'' +
        ", rootId='" + rootId + '\'' +
        ')';
  }
}
