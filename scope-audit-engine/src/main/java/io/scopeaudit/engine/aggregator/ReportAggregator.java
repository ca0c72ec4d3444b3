// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.engine.aggregator;

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.Ordering;
import io.scopeaudit.assignment.AssignmentRecord;
import io.scopeaudit.directory.FailureReason;
import io.scopeaudit.engine.AuditReport;
import io.scopeaudit.engine.SkippedScope;
import io.scopeaudit.scope.ScopeNode;
import io.scopeaudit.scope.ScopePaths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges the nodes and records of all roots and scopes of a run into one report.
 *
 * Runs single-threaded after all collection work has joined, so none of its maps need
 * concurrent access.
 */
public class ReportAggregator {

  private static final Logger log = LoggerFactory.getLogger(ReportAggregator.class);

  private static final Comparator<ScopeNode> NODE_ORDER = (n1, n2) -> ComparisonChain.start()
      .compare(n1.rootId(), n2.rootId())
      .compare(n1.kind(), n2.kind())
      .compare(n1.id(), n2.id())
      .result();

  private static final Comparator<SkippedScope> SKIP_ORDER = (s1, s2) -> ComparisonChain.start()
      .compare(s1.scopeId(), s2.scopeId())
      .compare(s1.stage(), s2.stage())
      .compare(s1.reason(), s2.reason())
      .compare(s1.message(), s2.message())
      .result();

  public AuditReport aggregate(Collection<ScopeNode> nodes,
                               Map<String, Set<String>> reachingRoots,
                               Collection<AssignmentRecord> records,
                               Collection<SkippedScope> skipped,
                               FailureReason incompleteReason,
                               Instant evaluationTime) {
    // canonical id -> first node reaching it
    Map<String, ScopeNode> nodesByCanonicalId = new LinkedHashMap<>();
    Map<String, Set<String>> mergedRoots = new LinkedHashMap<>();
    for (ScopeNode node : nodes) {
      String canonicalId = node.canonicalPath();
      ScopeNode first = nodesByCanonicalId.putIfAbsent(canonicalId, node);
      if (first != null)
        log.debug("Dropping duplicate of scope {} reached from root {}", node.id(), node.rootId());
      ScopeNode kept = first == null ? node : first;
      Set<String> roots = mergedRoots.computeIfAbsent(kept.id(), id -> new LinkedHashSet<>());
      roots.add(node.rootId());
      roots.addAll(reachingRoots.getOrDefault(node.id(), Collections.emptySet()));
    }

    Map<String, ScopeNode> nodesById = new LinkedHashMap<>();
    for (ScopeNode node : nodesByCanonicalId.values())
      nodesById.put(node.id(), node);

    int danglingRecords = 0;
    int duplicateRecords = 0;
    Map<AssignmentKey, AssignmentRecord> recordsByKey = new LinkedHashMap<>();
    for (AssignmentRecord record : records) {
      if (!nodesByCanonicalId.containsKey(ScopePaths.canonical(record.scopeId()))) {
        danglingRecords++;
        continue;
      }
      if (recordsByKey.putIfAbsent(AssignmentKey.of(record), record) != null)
        duplicateRecords++;
    }
    if (danglingRecords > 0)
      log.warn("Dropped {} records of scopes missing from the scope set", danglingRecords);
    if (duplicateRecords > 0)
      log.debug("Dropped {} duplicate records", duplicateRecords);

    List<ScopeNode> sortedNodes = Ordering.from(NODE_ORDER).sortedCopy(nodesById.values());
    List<AssignmentRecord> sortedRecords = Ordering.from(recordOrder(nodesByCanonicalId))
        .sortedCopy(recordsByKey.values());
    List<SkippedScope> sortedSkips = Ordering.from(SKIP_ORDER).sortedCopy(new LinkedHashSet<>(skipped));

    Map<String, Map<String, Integer>> summaries = new LinkedHashMap<>();
    summaries.put(AuditReport.ROOT_SUMMARY,
        countBy(sortedRecords, r -> nodeOf(nodesByCanonicalId, r).rootId()));
    summaries.put(AuditReport.SCOPE_KIND_SUMMARY,
        countBy(sortedRecords, r -> nodeOf(nodesByCanonicalId, r).kind().toString()));
    summaries.put(AuditReport.CATEGORY_SUMMARY,
        countBy(sortedRecords, r -> r.category().toString()));
    summaries.put(AuditReport.LIFECYCLE_STATE_SUMMARY,
        countBy(sortedRecords, r -> r.lifecycleState().toString()));
    summaries.put(AuditReport.PRINCIPAL_KIND_SUMMARY,
        countBy(sortedRecords, r -> r.principal().kind().toString()));
    summaries.put(AuditReport.SKIP_REASON_SUMMARY,
        countBy(sortedSkips, s -> s.reason().toString()));

    return new AuditReport(sortedNodes,
        mergedRoots,
        sortedRecords,
        summaries,
        sortedSkips,
        incompleteReason,
        evaluationTime,
        duplicateRecords,
        danglingRecords);
  }

  private static Comparator<AssignmentRecord> recordOrder(Map<String, ScopeNode> nodesByCanonicalId) {
    return (r1, r2) -> {
      ScopeNode n1 = nodeOf(nodesByCanonicalId, r1);
      ScopeNode n2 = nodeOf(nodesByCanonicalId, r2);
      return ComparisonChain.start()
          .compare(n1.rootId(), n2.rootId())
          .compare(n1.kind(), n2.kind())
          .compare(r1.scopeId(), r2.scopeId())
          .compare(r1.category(), r2.category())
          .compare(r1.roleOrPolicyRef().displayName(), r2.roleOrPolicyRef().displayName())
          .compare(r1.roleOrPolicyRef().id(), r2.roleOrPolicyRef().id())
          .compare(r1.principal().id(), r2.principal().id())
          .compare(ScopePaths.canonical(r1.scopePath()), ScopePaths.canonical(r2.scopePath()))
          .result();
    };
  }

  private static ScopeNode nodeOf(Map<String, ScopeNode> nodesByCanonicalId, AssignmentRecord record) {
    return nodesByCanonicalId.get(ScopePaths.canonical(record.scopeId()));
  }

  private static <T> Map<String, Integer> countBy(List<T> values, Function<T, String> key) {
    Map<String, Integer> counts = new TreeMap<>();
    for (T value : values)
      counts.merge(key.apply(value), 1, Integer::sum);
    return counts;
  }
}
