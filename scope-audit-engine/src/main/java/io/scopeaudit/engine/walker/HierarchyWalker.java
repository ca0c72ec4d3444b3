// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.engine.walker;

import io.scopeaudit.directory.ChildScope;
import io.scopeaudit.directory.FailureReason;
import io.scopeaudit.directory.RemoteDirectoryException;
import io.scopeaudit.directory.ScopeDirectoryClient;
import io.scopeaudit.engine.RemoteCallRetrier;
import io.scopeaudit.engine.RunContext;
import io.scopeaudit.engine.SkippedScope;
import io.scopeaudit.scope.InvalidScopeException;
import io.scopeaudit.scope.ScopeNode;
import io.scopeaudit.scope.ScopePaths;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands root scopes into the flat set of their descendants.
 *
 * Each root is walked depth-first, children in the order the directory returns them. A single
 * visited map is shared by all roots of the walk, so a scope reachable from several roots is
 * expanded once and scopes that the directory reports as their own descendants do not loop.
 * The walk uses an explicit stack and has no depth limit.
 *
 * A branch whose children cannot be listed is logged, recorded as skipped and left out; the
 * walk continues with its siblings. A walker owns the visited state of one run and must not be
 * reused.
 */
public class HierarchyWalker {

  private static final Logger log = LoggerFactory.getLogger(HierarchyWalker.class);

  private final ScopeDirectoryClient directory;
  private final ExpansionPolicy expansionPolicy;
  private final RemoteCallRetrier retrier;
  private final RunContext context;
  // canonical scope path -> id of the node created for it
  private final ConcurrentMap<String, String> visited;

  public HierarchyWalker(ScopeDirectoryClient directory,
                         ExpansionPolicy expansionPolicy,
                         RemoteCallRetrier retrier,
                         RunContext context) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.expansionPolicy = Objects.requireNonNull(expansionPolicy, "expansionPolicy");
    this.retrier = Objects.requireNonNull(retrier, "retrier");
    this.context = Objects.requireNonNull(context, "context");
    this.visited = new ConcurrentHashMap<>();
  }

  /**
   * Validates root ids before any remote call is made.
   *
   * @throws InvalidScopeException if the list is empty or contains an empty id
   */
  public static List<String> validateRoots(List<String> roots) {
    if (roots == null || roots.isEmpty())
      throw new InvalidScopeException("At least one root scope must be provided");
    Set<String> distinct = new LinkedHashSet<>();
    for (String root : roots) {
      if (root == null || root.trim().isEmpty())
        throw new InvalidScopeException("Root scope ids must be non-empty: " + roots);
      distinct.add(root.trim());
    }
    return new ArrayList<>(distinct);
  }

  public WalkResult walk(List<String> roots) {
    List<String> rootIds = validateRoots(roots);
    WalkResult result = new WalkResult();

    for (String rootId : rootIds) {
      if (context.shouldStop()) {
        result.addSkipped(new SkippedScope(rootId, SkippedScope.Stage.CHILDREN,
            context.stopReason(), "Walk stopped before root was expanded"));
        continue;
      }
      String existingId = visited.putIfAbsent(ScopePaths.canonical(rootId), rootId);
      if (existingId != null) {
        log.debug("Root {} was already reached as scope {} from another root", rootId, existingId);
        result.addReference(existingId, null, rootId);
        continue;
      }
      ScopeNode root = ScopeNode.root(rootId, rootId, ScopePaths.inferKind(rootId));
      result.addRoot(root);
      expand(root, result);
    }

    result.closeReachability();
    if (context.stopReason() != null)
      result.stopped(context.stopReason());
    log.debug("Walk of roots {} discovered {} scopes, skipped {} branches",
        rootIds, result.nodes().size(), result.skipped().size());
    return result;
  }

  private void expand(ScopeNode root, WalkResult result) {
    if (!expansionPolicy.isExpandable(root.kind())) {
      log.debug("Root {} of kind {} is not expanded", root.id(), root.kind());
      return;
    }

    Deque<ScopeNode> pending = new ArrayDeque<>();
    pending.push(root);
    while (!pending.isEmpty()) {
      ScopeNode node = pending.pop();
      if (context.shouldStop()) {
        FailureReason reason = context.stopReason();
        result.addSkipped(new SkippedScope(node.id(), SkippedScope.Stage.CHILDREN, reason,
            "Walk stopped before scope was expanded"));
        while (!pending.isEmpty()) {
          result.addSkipped(new SkippedScope(pending.pop().id(), SkippedScope.Stage.CHILDREN, reason,
              "Walk stopped before scope was expanded"));
        }
        return;
      }

      List<ChildScope> children = children(node, result);
      if (children == null)
        continue;

      List<ScopeNode> expandable = new ArrayList<>();
      for (ChildScope child : children) {
        if (child == null)
          continue;
        String existingId = visited.putIfAbsent(ScopePaths.canonical(child.id()), child.id());
        if (existingId != null) {
          log.debug("Scope {} listed under {} was already visited", child.id(), node.id());
          result.addReference(existingId, node.id(), null);
          continue;
        }
        ScopeNode childNode = new ScopeNode(child.id(), child.displayName(), child.kind(),
            node.id(), node.rootId());
        result.addChild(childNode);
        if (expansionPolicy.isExpandable(child.kind()))
          expandable.add(childNode);
      }
      // Pushed in reverse so that siblings are expanded in directory order
      for (int i = expandable.size() - 1; i >= 0; i--)
        pending.push(expandable.get(i));
    }
  }

  private List<ChildScope> children(ScopeNode node, WalkResult result) {
    try {
      List<ChildScope> children = retrier.call("children of " + node.id(),
          () -> directory.getChildren(node.id()));
      return children == null ? new ArrayList<>() : children;
    } catch (RemoteDirectoryException e) {
      log.warn("Skipping subtree of scope {}: {} ({})", node.id(), e.reason(), e.getMessage());
      result.addSkipped(new SkippedScope(node.id(), SkippedScope.Stage.CHILDREN, e.reason(), e.getMessage()));
      return null;
    } catch (RuntimeException e) {
      log.error("Skipping subtree of scope {} after unexpected failure", node.id(), e);
      result.addSkipped(new SkippedScope(node.id(), SkippedScope.Stage.CHILDREN,
          FailureReason.UNEXPECTED, String.valueOf(e)));
      return null;
    }
  }
}
