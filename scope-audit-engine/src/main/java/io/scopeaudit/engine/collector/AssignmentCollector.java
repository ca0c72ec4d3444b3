// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.engine.collector;

import io.scopeaudit.assignment.AssignmentCategory;
import io.scopeaudit.assignment.CollectedAssignment;
import io.scopeaudit.assignment.RawAssignment;
import io.scopeaudit.directory.FailureReason;
import io.scopeaudit.directory.RemoteDirectoryException;
import io.scopeaudit.directory.ScopeDirectoryClient;
import io.scopeaudit.engine.RemoteCallRetrier;
import io.scopeaudit.engine.RunContext;
import io.scopeaudit.engine.SkippedScope;
import io.scopeaudit.scope.ScopeNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects the assignments of one scope, one directory request per category. A failed category
 * is recorded as skipped and does not affect the other categories of the scope.
 *
 * Collectors hold no per-scope state and are shared by all collector threads of a run.
 */
public class AssignmentCollector {

  private static final Logger log = LoggerFactory.getLogger(AssignmentCollector.class);

  private final ScopeDirectoryClient directory;
  private final RemoteCallRetrier retrier;
  private final RunContext context;
  private final AssignmentNormalizer normalizer;

  public AssignmentCollector(ScopeDirectoryClient directory,
                             RemoteCallRetrier retrier,
                             RunContext context) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.retrier = Objects.requireNonNull(retrier, "retrier");
    this.context = Objects.requireNonNull(context, "context");
    this.normalizer = new AssignmentNormalizer();
  }

  public CollectionResult collect(ScopeNode scope, Set<AssignmentCategory> categories) {
    List<CollectedAssignment> assignments = new ArrayList<>();
    List<SkippedScope> skipped = new ArrayList<>();

    for (AssignmentCategory category : categories) {
      SkippedScope.Stage stage = SkippedScope.Stage.of(category);
      if (context.shouldStop()) {
        skipped.add(new SkippedScope(scope.id(), stage, context.stopReason(),
            "Run stopped before " + category + " were collected"));
        continue;
      }
      try {
        List<RawAssignment> raw = retrier.call(category + " of " + scope.id(),
            () -> directory.getAssignments(scope.id(), category));
        if (raw == null)
          continue;
        for (RawAssignment assignment : raw) {
          if (assignment != null)
            assignments.add(normalizer.normalize(assignment));
        }
        log.trace("Collected {} {} for scope {}", raw.size(), category, scope.id());
      } catch (RemoteDirectoryException e) {
        log.warn("Skipping {} of scope {}: {} ({})", category, scope.id(), e.reason(), e.getMessage());
        skipped.add(new SkippedScope(scope.id(), stage, e.reason(), e.getMessage()));
      } catch (RuntimeException e) {
        log.error("Skipping {} of scope {} after unexpected failure", category, scope.id(), e);
        skipped.add(new SkippedScope(scope.id(), stage, FailureReason.UNEXPECTED, String.valueOf(e)));
      }
    }
    return new CollectionResult(scope, assignments, skipped);
  }
}
