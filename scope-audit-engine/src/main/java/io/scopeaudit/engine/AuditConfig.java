// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.engine;

import static org.apache.kafka.common.config.ConfigDef.Range.atLeast;
import static org.apache.kafka.common.config.ConfigDef.Range.between;

import io.scopeaudit.assignment.AssignmentCategory;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.kafka.common.config.AbstractConfig;
import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.utils.Utils;

public class AuditConfig extends AbstractConfig {

  public static final String PREFIX = "scope.audit.";

  public static final String INCLUDE_SUBSCRIPTIONS_PROP = PREFIX + "include.subscriptions";
  private static final boolean INCLUDE_SUBSCRIPTIONS_DEFAULT = false;
  private static final String INCLUDE_SUBSCRIPTIONS_DOC = "Expand subscriptions into their resource"
      + " groups instead of reporting them as leaves of the hierarchy.";

  public static final String INCLUDE_RESOURCE_GROUPS_PROP = PREFIX + "include.resource.groups";
  private static final boolean INCLUDE_RESOURCE_GROUPS_DEFAULT = false;
  private static final String INCLUDE_RESOURCE_GROUPS_DOC = "Expand resource groups into their"
      + " resources. Requires " + INCLUDE_SUBSCRIPTIONS_PROP + ".";

  public static final String INCLUDE_STANDING_GRANTS_PROP = PREFIX + "include.standing.grants";
  private static final boolean INCLUDE_STANDING_GRANTS_DEFAULT = true;
  private static final String INCLUDE_STANDING_GRANTS_DOC = "Collect standing (permanent) role"
      + " assignments for every discovered scope.";

  public static final String INCLUDE_ELIGIBLE_GRANTS_PROP = PREFIX + "include.eligible.grants";
  private static final boolean INCLUDE_ELIGIBLE_GRANTS_DEFAULT = false;
  private static final String INCLUDE_ELIGIBLE_GRANTS_DOC = "Collect eligible (time-bound,"
      + " activation-required) role assignments in addition to standing grants.";

  public static final String INCLUDE_POLICY_ASSIGNMENTS_PROP = PREFIX + "include.policy.assignments";
  private static final boolean INCLUDE_POLICY_ASSIGNMENTS_DEFAULT = false;
  private static final String INCLUDE_POLICY_ASSIGNMENTS_DOC = "Collect policy assignments. Combine"
      + " with " + INCLUDE_STANDING_GRANTS_PROP + "=false to audit the policy domain only.";

  public static final String ROOTS_PROP = PREFIX + "roots";
  private static final String ROOTS_DEFAULT = "";
  private static final String ROOTS_DOC = "Comma-separated scope ids to start from when an audit"
      + " request does not name its own roots.";

  public static final String COLLECTOR_THREADS_PROP = PREFIX + "collector.threads";
  private static final int COLLECTOR_THREADS_DEFAULT = 4;
  private static final String COLLECTOR_THREADS_DOC = "Number of worker threads collecting"
      + " assignments. Directory services are usually rate-limited, so keep this small.";

  public static final String RUN_TIMEOUT_PROP = PREFIX + "run.timeout.ms";
  private static final long RUN_TIMEOUT_DEFAULT = 30 * 60 * 1000L;
  private static final String RUN_TIMEOUT_DOC = "Deadline for a complete audit run. When it"
      + " expires, no further remote calls are issued and the report is marked incomplete.";

  public static final String RETRY_MAX_ATTEMPTS_PROP = PREFIX + "retry.max.attempts";
  private static final int RETRY_MAX_ATTEMPTS_DEFAULT = 3;
  private static final String RETRY_MAX_ATTEMPTS_DOC = "Maximum number of attempts of a remote"
      + " call that fails with throttling or a timeout.";

  public static final String RETRY_BACKOFF_PROP = PREFIX + "retry.backoff.ms";
  private static final long RETRY_BACKOFF_DEFAULT = 500L;
  private static final String RETRY_BACKOFF_DOC = "Initial backoff between attempts of a remote call.";

  public static final String RETRY_BACKOFF_MAX_PROP = PREFIX + "retry.backoff.max.ms";
  private static final long RETRY_BACKOFF_MAX_DEFAULT = 10000L;
  private static final String RETRY_BACKOFF_MAX_DOC = "Upper bound of the exponential backoff"
      + " between attempts of a remote call.";

  public static final String RETRY_BACKOFF_JITTER_PROP = PREFIX + "retry.backoff.jitter";
  private static final double RETRY_BACKOFF_JITTER_DEFAULT = 0.2;
  private static final String RETRY_BACKOFF_JITTER_DOC = "Random jitter applied to retry backoff,"
      + " as a fraction of the backoff.";

  public static final String CLOCK_SKEW_PROP = PREFIX + "clock.skew.ms";
  private static final long CLOCK_SKEW_DEFAULT = 0L;
  private static final String CLOCK_SKEW_DOC = "Tolerance applied when comparing assignment start"
      + " and end times with the evaluation time.";

  private static final ConfigDef CONFIG;

  static {
    CONFIG = new ConfigDef()
        .define(INCLUDE_SUBSCRIPTIONS_PROP, Type.BOOLEAN, INCLUDE_SUBSCRIPTIONS_DEFAULT,
            Importance.HIGH, INCLUDE_SUBSCRIPTIONS_DOC)
        .define(INCLUDE_RESOURCE_GROUPS_PROP, Type.BOOLEAN, INCLUDE_RESOURCE_GROUPS_DEFAULT,
            Importance.HIGH, INCLUDE_RESOURCE_GROUPS_DOC)
        .define(INCLUDE_STANDING_GRANTS_PROP, Type.BOOLEAN, INCLUDE_STANDING_GRANTS_DEFAULT,
            Importance.HIGH, INCLUDE_STANDING_GRANTS_DOC)
        .define(INCLUDE_ELIGIBLE_GRANTS_PROP, Type.BOOLEAN, INCLUDE_ELIGIBLE_GRANTS_DEFAULT,
            Importance.HIGH, INCLUDE_ELIGIBLE_GRANTS_DOC)
        .define(INCLUDE_POLICY_ASSIGNMENTS_PROP, Type.BOOLEAN, INCLUDE_POLICY_ASSIGNMENTS_DEFAULT,
            Importance.HIGH, INCLUDE_POLICY_ASSIGNMENTS_DOC)
        .define(ROOTS_PROP, Type.LIST, ROOTS_DEFAULT,
            Importance.MEDIUM, ROOTS_DOC)
        .define(COLLECTOR_THREADS_PROP, Type.INT, COLLECTOR_THREADS_DEFAULT,
            atLeast(1), Importance.MEDIUM, COLLECTOR_THREADS_DOC)
        .define(RUN_TIMEOUT_PROP, Type.LONG, RUN_TIMEOUT_DEFAULT,
            atLeast(1), Importance.MEDIUM, RUN_TIMEOUT_DOC)
        .define(RETRY_MAX_ATTEMPTS_PROP, Type.INT, RETRY_MAX_ATTEMPTS_DEFAULT,
            atLeast(1), Importance.LOW, RETRY_MAX_ATTEMPTS_DOC)
        .define(RETRY_BACKOFF_PROP, Type.LONG, RETRY_BACKOFF_DEFAULT,
            atLeast(0), Importance.LOW, RETRY_BACKOFF_DOC)
        .define(RETRY_BACKOFF_MAX_PROP, Type.LONG, RETRY_BACKOFF_MAX_DEFAULT,
            atLeast(0), Importance.LOW, RETRY_BACKOFF_MAX_DOC)
        .define(RETRY_BACKOFF_JITTER_PROP, Type.DOUBLE, RETRY_BACKOFF_JITTER_DEFAULT,
            between(0.0, 1.0), Importance.LOW, RETRY_BACKOFF_JITTER_DOC)
        .define(CLOCK_SKEW_PROP, Type.LONG, CLOCK_SKEW_DEFAULT,
            atLeast(0), Importance.LOW, CLOCK_SKEW_DOC);
  }

  public final boolean includeSubscriptions;
  public final boolean includeResourceGroups;
  public final int collectorThreads;
  public final Duration runTimeout;
  public final int retryMaxAttempts;
  public final Duration retryBackoff;
  public final Duration retryBackoffMax;
  public final double retryBackoffJitter;
  public final Duration clockSkew;
  private final Set<AssignmentCategory> categories;

  public AuditConfig(Map<?, ?> props) {
    super(CONFIG, props);

    includeSubscriptions = getBoolean(INCLUDE_SUBSCRIPTIONS_PROP);
    includeResourceGroups = getBoolean(INCLUDE_RESOURCE_GROUPS_PROP);
    collectorThreads = getInt(COLLECTOR_THREADS_PROP);
    runTimeout = Duration.ofMillis(getLong(RUN_TIMEOUT_PROP));
    retryMaxAttempts = getInt(RETRY_MAX_ATTEMPTS_PROP);
    retryBackoff = Duration.ofMillis(getLong(RETRY_BACKOFF_PROP));
    retryBackoffMax = Duration.ofMillis(getLong(RETRY_BACKOFF_MAX_PROP));
    retryBackoffJitter = getDouble(RETRY_BACKOFF_JITTER_PROP);
    clockSkew = Duration.ofMillis(getLong(CLOCK_SKEW_PROP));

    if (includeResourceGroups && !includeSubscriptions)
      throw new InvalidAuditConfigException(INCLUDE_RESOURCE_GROUPS_PROP + " requires "
          + INCLUDE_SUBSCRIPTIONS_PROP);
    if (retryBackoffMax.compareTo(retryBackoff) < 0)
      throw new InvalidAuditConfigException(RETRY_BACKOFF_MAX_PROP + " must not be smaller than "
          + RETRY_BACKOFF_PROP);

    Set<AssignmentCategory> categories = EnumSet.noneOf(AssignmentCategory.class);
    if (getBoolean(INCLUDE_STANDING_GRANTS_PROP))
      categories.add(AssignmentCategory.STANDING_GRANT);
    if (getBoolean(INCLUDE_ELIGIBLE_GRANTS_PROP))
      categories.add(AssignmentCategory.ELIGIBLE_GRANT);
    if (getBoolean(INCLUDE_POLICY_ASSIGNMENTS_PROP))
      categories.add(AssignmentCategory.POLICY_ASSIGNMENT);
    if (categories.isEmpty())
      throw new InvalidAuditConfigException("At least one of " + INCLUDE_STANDING_GRANTS_PROP + ", "
          + INCLUDE_ELIGIBLE_GRANTS_PROP + " or " + INCLUDE_POLICY_ASSIGNMENTS_PROP + " must be enabled");
    this.categories = Collections.unmodifiableSet(categories);
  }

  /**
   * Assignment categories collected for every scope, in report order.
   */
  public Set<AssignmentCategory> categories() {
    return categories;
  }

  public List<String> defaultRoots() {
    return getList(ROOTS_PROP);
  }

  @Override
  public String toString() {
    return String.format("%s: %n\t%s", getClass().getName(), Utils.mkString(values(), "", "", "=", "%n\t"));
  }

  public static void main(String[] args) throws Exception {
    try (PrintStream out = args.length == 0 ? System.out
        : new PrintStream(new FileOutputStream(args[0]), false, StandardCharsets.UTF_8.name())) {
      out.println(CONFIG.toHtmlTable());
      if (out != System.out) {
        out.close();
      }
    }
  }
}
