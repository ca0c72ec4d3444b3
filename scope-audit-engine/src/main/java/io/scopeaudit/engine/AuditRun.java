// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.engine;

import io.scopeaudit.directory.FailureReason;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handle of an audit run started with {@link AuditEngine#submit(java.util.List)}.
 *
 * Cancelling a run stops new remote calls and interrupts collector threads. The report future
 * still completes, with the data gathered so far and marked incomplete.
 */
public class AuditRun {

  private static final Logger log = LoggerFactory.getLogger(AuditRun.class);

  private final RunContext context;
  private final CompletableFuture<AuditReport> report;
  private volatile ExecutorService collectorExecutor;

  AuditRun(RunContext context) {
    this.context = context;
    this.report = new CompletableFuture<>();
  }

  public void cancel() {
    if (report.isDone())
      return;
    log.info("Cancelling audit run");
    context.cancel();
    ExecutorService executor = collectorExecutor;
    if (executor != null)
      executor.shutdownNow();
  }

  public boolean isCancelled() {
    return context.stopReason() == FailureReason.CANCELLED;
  }

  /**
   * Returns a future completed with the report once the run has finished or stopped. The
   * future completes exceptionally only if the run failed unexpectedly.
   */
  public CompletableFuture<AuditReport> report() {
    return report.copy();
  }

  RunContext context() {
    return context;
  }

  void collectorExecutor(ExecutorService executor) {
    this.collectorExecutor = executor;
    if (context.stopReason() == FailureReason.CANCELLED)
      executor.shutdownNow();
  }

  void complete(AuditReport auditReport) {
    report.complete(auditReport);
  }

  void completeExceptionally(Throwable exception) {
    report.completeExceptionally(exception);
  }
}
