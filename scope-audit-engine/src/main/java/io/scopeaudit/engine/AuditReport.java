// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.engine;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.scopeaudit.assignment.AssignmentRecord;
import io.scopeaudit.directory.FailureReason;
import io.scopeaudit.scope.ScopeNode;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Result of an audit run. Nodes and records are in presentation order. Summaries are grouped
 * counts over the records, keyed by summary name (see {@link #ROOT_SUMMARY} and friends).
 *
 * A report is incomplete when the run was cancelled or ran out of time. Scopes and categories
 * whose data is missing, for that or any other reason, are listed in {@link #skipped()}.
 */
public class AuditReport {

  public static final String ROOT_SUMMARY = "root";
  public static final String SCOPE_KIND_SUMMARY = "scopeKind";
  public static final String CATEGORY_SUMMARY = "category";
  public static final String LIFECYCLE_STATE_SUMMARY = "lifecycleState";
  public static final String PRINCIPAL_KIND_SUMMARY = "principalKind";
  public static final String SKIP_REASON_SUMMARY = "skipReason";

  private final List<ScopeNode> nodes;
  private final Map<String, ScopeNode> nodesById;
  private final Map<String, Set<String>> reachingRoots;
  private final List<AssignmentRecord> records;
  private final Map<String, Map<String, Integer>> summaries;
  private final List<SkippedScope> skipped;
  private final FailureReason incompleteReason;
  private final Instant evaluationTime;
  private final int duplicateRecords;
  private final int danglingRecords;

  public AuditReport(List<ScopeNode> nodes,
                     Map<String, Set<String>> reachingRoots,
                     List<AssignmentRecord> records,
                     Map<String, Map<String, Integer>> summaries,
                     List<SkippedScope> skipped,
                     FailureReason incompleteReason,
                     Instant evaluationTime,
                     int duplicateRecords,
                     int danglingRecords) {
    this.nodes = ImmutableList.copyOf(nodes);
    this.nodesById = nodes.stream().collect(ImmutableMap.toImmutableMap(ScopeNode::id, n -> n));
    this.reachingRoots = reachingRoots.entrySet().stream()
        .collect(ImmutableMap.toImmutableMap(Map.Entry::getKey, e -> ImmutableSet.copyOf(e.getValue())));
    this.records = ImmutableList.copyOf(records);
    this.summaries = summaries.entrySet().stream()
        .collect(ImmutableMap.toImmutableMap(Map.Entry::getKey, e -> ImmutableMap.copyOf(e.getValue())));
    this.skipped = ImmutableList.copyOf(skipped);
    this.incompleteReason = incompleteReason;
    this.evaluationTime = evaluationTime;
    this.duplicateRecords = duplicateRecords;
    this.danglingRecords = danglingRecords;
  }

  public List<ScopeNode> nodes() {
    return nodes;
  }

  public Optional<ScopeNode> node(String scopeId) {
    return Optional.ofNullable(nodesById.get(scopeId));
  }

  /**
   * Returns all roots from which the scope is reachable. The node's own root id is the first
   * of these that reached it during the walk.
   */
  public Set<String> reachingRoots(String scopeId) {
    return reachingRoots.getOrDefault(scopeId, Collections.emptySet());
  }

  public List<AssignmentRecord> records() {
    return records;
  }

  public List<AssignmentRecord> records(String scopeId) {
    return records.stream()
        .filter(r -> r.scopeId().equals(scopeId))
        .collect(Collectors.toList());
  }

  public Map<String, Map<String, Integer>> summaries() {
    return summaries;
  }

  public Map<String, Integer> summary(String name) {
    return summaries.getOrDefault(name, Collections.emptyMap());
  }

  public List<SkippedScope> skipped() {
    return skipped;
  }

  public boolean isComplete() {
    return incompleteReason == null;
  }

  /**
   * {@link FailureReason#CANCELLED} or {@link FailureReason#RUN_TIMEOUT} for incomplete
   * reports, null otherwise.
   */
  public FailureReason incompleteReason() {
    return incompleteReason;
  }

  public Instant evaluationTime() {
    return evaluationTime;
  }

  public int duplicateRecords() {
    return duplicateRecords;
  }

  public int danglingRecords() {
    return danglingRecords;
  }

  public long malformedRecords() {
    return records.stream().filter(r -> !r.warnings().isEmpty()).count();
  }

  @Override
  public String toString() {
    return "AuditReport(" +
        "nodes=" + nodes.size() +
        ", records=" + records.size() +
        ", skipped=" + skipped.size() +
        ", complete=" + isComplete() +
        ')';
  }
}
