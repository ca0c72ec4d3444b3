// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.engine;

import io.scopeaudit.assignment.AssignmentCategory;
import io.scopeaudit.assignment.AssignmentRecord;
import io.scopeaudit.directory.FailureReason;
import io.scopeaudit.directory.ScopeDirectoryClient;
import io.scopeaudit.engine.aggregator.ReportAggregator;
import io.scopeaudit.engine.classifier.AssignmentClassifier;
import io.scopeaudit.engine.collector.AssignmentCollector;
import io.scopeaudit.engine.walker.ExpansionPolicy;
import io.scopeaudit.engine.walker.HierarchyWalker;
import io.scopeaudit.engine.walker.WalkResult;
import io.scopeaudit.scope.ScopeNode;
import io.scopeaudit.utils.ThreadUtils;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Audits the scopes reachable from a set of roots: walks the hierarchy, collects and classifies
 * the assignments of every discovered scope on a bounded pool of collector threads and merges
 * the results into one report.
 *
 * Invalid roots and options are rejected before any remote call is made. All other failures
 * are recovered per scope or branch and listed in the report. A run that is cancelled or runs
 * past its deadline still produces a report of the data collected so far, marked incomplete.
 *
 * The engine itself is stateless and may be used for any number of concurrent runs.
 */
public class AuditEngine {

  private static final Logger log = LoggerFactory.getLogger(AuditEngine.class);

  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

  private final AuditConfig config;
  private final ScopeDirectoryClient directory;
  private final Time time;

  public AuditEngine(AuditConfig config, ScopeDirectoryClient directory) {
    this(config, directory, Time.SYSTEM);
  }

  public AuditEngine(AuditConfig config, ScopeDirectoryClient directory, Time time) {
    this.config = Objects.requireNonNull(config, "config");
    this.directory = Objects.requireNonNull(directory, "directory");
    this.time = Objects.requireNonNull(time, "time");
  }

  /**
   * Runs an audit on the calling thread. Interrupting the caller cancels the run.
   *
   * @param roots scope ids to start from, or an empty list for the configured default roots
   * @throws io.scopeaudit.scope.InvalidScopeException if no valid roots are provided
   */
  public AuditReport audit(List<String> roots) {
    List<String> rootIds = resolveRoots(roots);
    return execute(rootIds, new AuditRun(new RunContext(time, config.runTimeout)));
  }

  /**
   * Starts an audit on a background thread.
   *
   * @param roots scope ids to start from, or an empty list for the configured default roots
   * @throws io.scopeaudit.scope.InvalidScopeException if no valid roots are provided
   */
  public AuditRun submit(List<String> roots) {
    List<String> rootIds = resolveRoots(roots);
    AuditRun run = new AuditRun(new RunContext(time, config.runTimeout));
    ExecutorService runExecutor = Executors.newSingleThreadExecutor(
        ThreadUtils.createThreadFactory("scope-audit-run-%d", true));
    runExecutor.submit(() -> {
      try {
        run.complete(execute(rootIds, run));
      } catch (Throwable e) {
        log.error("Audit of roots {} failed", rootIds, e);
        run.completeExceptionally(e);
      } finally {
        runExecutor.shutdown();
      }
    });
    return run;
  }

  private List<String> resolveRoots(List<String> roots) {
    List<String> requested = roots == null || roots.isEmpty() ? config.defaultRoots() : roots;
    return HierarchyWalker.validateRoots(requested);
  }

  private AuditReport execute(List<String> rootIds, AuditRun run) {
    RunContext context = run.context();
    Instant evaluationTime = Instant.ofEpochMilli(time.milliseconds());
    Set<AssignmentCategory> categories = config.categories();
    log.info("Starting audit of roots {} collecting {}", rootIds, categories);

    RemoteCallRetrier retrier = RemoteCallRetrier.fromConfig(config, context);
    HierarchyWalker walker = new HierarchyWalker(directory, ExpansionPolicy.fromConfig(config),
        retrier, context);
    WalkResult walk = walker.walk(rootIds);
    log.info("Discovered {} scopes from roots {}, {} branches skipped",
        walk.nodes().size(), rootIds, walk.skipped().size());

    Queue<AssignmentRecord> records = new ConcurrentLinkedQueue<>();
    Queue<SkippedScope> skipped = new ConcurrentLinkedQueue<>(walk.skipped());
    Set<String> collectedScopes = ConcurrentHashMap.newKeySet();
    ScopeCollectionTask task = new ScopeCollectionTask(
        new AssignmentCollector(directory, retrier, context),
        new AssignmentClassifier(evaluationTime, config.clockSkew),
        categories, context, records, skipped, collectedScopes);

    collect(walk.nodes().values(), task, run);
    task.close();

    for (ScopeNode node : walk.nodes().values()) {
      if (!task.isCollected(node)) {
        FailureReason reason = context.stopReason() != null ? context.stopReason() : FailureReason.CANCELLED;
        task.skipAll(node, reason, "Run stopped before scope was collected");
      }
    }

    AuditReport report = new ReportAggregator().aggregate(walk.nodes().values(),
        walk.reachingRoots(), records, skipped, context.stopReason(), evaluationTime);
    if (report.isComplete()) {
      log.info("Audit of roots {} completed: {} scopes, {} records, {} skipped",
          rootIds, report.nodes().size(), report.records().size(), report.skipped().size());
    } else {
      log.warn("Audit of roots {} is incomplete ({}): {} scopes, {} records, {} skipped",
          rootIds, report.incompleteReason(), report.nodes().size(), report.records().size(),
          report.skipped().size());
    }
    return report;
  }

  private void collect(Collection<ScopeNode> nodes, ScopeCollectionTask task, AuditRun run) {
    RunContext context = run.context();
    ExecutorService executor = Executors.newFixedThreadPool(config.collectorThreads,
        ThreadUtils.createThreadFactory("scope-audit-collector-%d", true));
    run.collectorExecutor(executor);
    boolean interrupted = false;
    try {
      for (ScopeNode node : nodes)
        executor.submit(() -> task.collect(node));
      executor.shutdown();
      if (!executor.awaitTermination(context.remainingMs(), TimeUnit.MILLISECONDS)) {
        log.warn("Audit run deadline of {} ms expired while collecting assignments", config.runTimeout.toMillis());
        context.expire();
      }
    } catch (RejectedExecutionException e) {
      log.debug("Collector threads were shut down before all scopes were submitted");
    } catch (InterruptedException e) {
      log.warn("Interrupted while waiting for collector threads, cancelling run");
      context.cancel();
      interrupted = true;
    } finally {
      executor.shutdownNow();
    }

    if (interrupted) {
      Thread.currentThread().interrupt();
      return;
    }
    try {
      if (!executor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS))
        log.warn("Collector threads did not terminate within {} ms", SHUTDOWN_TIMEOUT.toMillis());
    } catch (InterruptedException e) {
      log.warn("Interrupted while waiting for collector threads to terminate");
      context.cancel();
      Thread.currentThread().interrupt();
    }
  }
}
