// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.engine.walker;

import io.scopeaudit.directory.FailureReason;
import io.scopeaudit.engine.SkippedScope;
import io.scopeaudit.scope.ScopeNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scopes discovered by one walk, in discovery order, with the roots that can reach each of them
 * and the branches that could not be expanded.
 */
public class WalkResult {

  private final Map<String, ScopeNode> nodes;
  private final Map<String, Set<String>> parents;
  private final Map<String, Set<String>> reachingRoots;
  private final List<SkippedScope> skipped;
  private FailureReason stopReason;

  WalkResult() {
    this.nodes = new LinkedHashMap<>();
    this.parents = new LinkedHashMap<>();
    this.reachingRoots = new LinkedHashMap<>();
    this.skipped = new ArrayList<>();
  }

  void addRoot(ScopeNode root) {
    nodes.put(root.id(), root);
    parents.put(root.id(), new LinkedHashSet<>());
    reachingRoots.computeIfAbsent(root.id(), id -> new LinkedHashSet<>()).add(root.id());
  }

  void addChild(ScopeNode child) {
    nodes.put(child.id(), child);
    parents.computeIfAbsent(child.id(), id -> new LinkedHashSet<>()).add(child.parentId());
    reachingRoots.computeIfAbsent(child.id(), id -> new LinkedHashSet<>());
  }

  /**
   * Records that an already discovered scope is reachable from another parent or root.
   */
  void addReference(String scopeId, String parentId, String rootId) {
    if (parentId != null)
      parents.computeIfAbsent(scopeId, id -> new LinkedHashSet<>()).add(parentId);
    if (rootId != null)
      reachingRoots.computeIfAbsent(scopeId, id -> new LinkedHashSet<>()).add(rootId);
  }

  void addSkipped(SkippedScope skippedScope) {
    skipped.add(skippedScope);
  }

  void stopped(FailureReason reason) {
    this.stopReason = reason;
  }

  /**
   * Propagates reaching roots along all discovered parent links. A scope that was reached from
   * a second root is not expanded again, so its descendants only learn about that root here.
   */
  void closeReachability() {
    boolean changed = true;
    while (changed) {
      changed = false;
      for (Map.Entry<String, Set<String>> entry : parents.entrySet()) {
        Set<String> roots = reachingRoots.get(entry.getKey());
        for (String parentId : entry.getValue()) {
          Set<String> parentRoots = reachingRoots.get(parentId);
          if (parentRoots != null && roots.addAll(parentRoots))
            changed = true;
        }
      }
    }
  }

  public Map<String, ScopeNode> nodes() {
    return Collections.unmodifiableMap(nodes);
  }

  public Set<String> reachingRoots(String scopeId) {
    Set<String> roots = reachingRoots.get(scopeId);
    return roots == null ? Collections.emptySet() : Collections.unmodifiableSet(roots);
  }

  public Map<String, Set<String>> reachingRoots() {
    return Collections.unmodifiableMap(reachingRoots);
  }

  public List<SkippedScope> skipped() {
    return Collections.unmodifiableList(skipped);
  }

  /**
   * Returns the reason the walk was stopped early, or null if it ran to completion.
   */
  public FailureReason stopReason() {
    return stopReason;
  }

  @Override
  public String toString() {
    return "WalkResult(" +
        "nodes=" + nodes.size() +
        ", skipped=" + skipped.size() +
        ", stopReason=" + stopReason +
        ')';
  }
}
