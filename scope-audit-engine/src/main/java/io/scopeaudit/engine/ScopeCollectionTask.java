// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.engine;

import io.scopeaudit.assignment.AssignmentCategory;
import io.scopeaudit.assignment.AssignmentRecord;
import io.scopeaudit.directory.FailureReason;
import io.scopeaudit.engine.classifier.AssignmentClassifier;
import io.scopeaudit.engine.collector.AssignmentCollector;
import io.scopeaudit.engine.collector.CollectionResult;
import io.scopeaudit.scope.ScopeNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects and classifies the assignments of one scope. Results go to queues shared by all
 * collector threads of the run.
 *
 * The results of a scope are published atomically, together with the scope being marked as
 * collected. Once the task is closed, results of collector threads that are still running are
 * discarded, so a scope is reported either with its results or as skipped, never both.
 */
class ScopeCollectionTask {

  private static final Logger log = LoggerFactory.getLogger(ScopeCollectionTask.class);

  private final AssignmentCollector collector;
  private final AssignmentClassifier classifier;
  private final Set<AssignmentCategory> categories;
  private final RunContext context;
  private final Queue<AssignmentRecord> records;
  private final Queue<SkippedScope> skipped;
  private final Set<String> collectedScopes;
  private boolean closed;

  ScopeCollectionTask(AssignmentCollector collector,
                      AssignmentClassifier classifier,
                      Set<AssignmentCategory> categories,
                      RunContext context,
                      Queue<AssignmentRecord> records,
                      Queue<SkippedScope> skipped,
                      Set<String> collectedScopes) {
    this.collector = collector;
    this.classifier = classifier;
    this.categories = categories;
    this.context = context;
    this.records = records;
    this.skipped = skipped;
    this.collectedScopes = collectedScopes;
  }

  void collect(ScopeNode node) {
    List<AssignmentRecord> scopeRecords = Collections.emptyList();
    List<SkippedScope> scopeSkips;
    try {
      if (context.shouldStop()) {
        scopeSkips = skips(node, context.stopReason(), "Run stopped before scope was collected");
      } else {
        CollectionResult result = collector.collect(node, categories);
        scopeRecords = classifier.classifyAll(result.assignments(), node);
        scopeSkips = result.skipped();
        log.debug("Collected {} assignments for scope {}", result.assignments().size(), node.id());
      }
    } catch (RuntimeException e) {
      log.error("Skipping scope {} after unexpected failure", node.id(), e);
      scopeRecords = Collections.emptyList();
      scopeSkips = skips(node, FailureReason.UNEXPECTED, String.valueOf(e));
    }
    publish(node, scopeRecords, scopeSkips);
  }

  /**
   * Stops accepting results. Scopes not collected by now are reported through
   * {@link #skipAll(ScopeNode, FailureReason, String)}.
   */
  synchronized void close() {
    closed = true;
  }

  synchronized boolean isCollected(ScopeNode node) {
    return collectedScopes.contains(node.id());
  }

  void skipAll(ScopeNode node, FailureReason reason, String message) {
    skipped.addAll(skips(node, reason, message));
  }

  private synchronized void publish(ScopeNode node, List<AssignmentRecord> scopeRecords, List<SkippedScope> scopeSkips) {
    if (closed) {
      log.warn("Discarding {} assignments of scope {} collected after the run was closed",
          scopeRecords.size(), node.id());
      return;
    }
    records.addAll(scopeRecords);
    skipped.addAll(scopeSkips);
    collectedScopes.add(node.id());
  }

  private List<SkippedScope> skips(ScopeNode node, FailureReason reason, String message) {
    List<SkippedScope> skips = new ArrayList<>(categories.size());
    for (AssignmentCategory category : categories)
      skips.add(new SkippedScope(node.id(), SkippedScope.Stage.of(category), reason, message));
    return skips;
  }
}
