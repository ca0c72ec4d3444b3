// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.engine.classifier;

import io.scopeaudit.assignment.AssignmentCategory;
import io.scopeaudit.assignment.AssignmentRecord;
import io.scopeaudit.assignment.CollectedAssignment;
import io.scopeaudit.assignment.Condition;
import io.scopeaudit.assignment.DefinitionRef;
import io.scopeaudit.assignment.Inheritance;
import io.scopeaudit.assignment.LifecycleState;
import io.scopeaudit.assignment.Principal;
import io.scopeaudit.assignment.PrincipalKind;
import io.scopeaudit.assignment.TemporalWindow;
import io.scopeaudit.scope.ScopeNode;
import io.scopeaudit.scope.ScopePaths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies collected assignments relative to the scope they are reported for.
 *
 * Lifecycle states are evaluated in precedence order, the first match wins:
 * <ol>
 *   <li>no start or end time: {@link LifecycleState#ACTIVE}</li>
 *   <li>end time before the evaluation time: {@link LifecycleState#EXPIRED}</li>
 *   <li>start time after the evaluation time: {@link LifecycleState#NOT_YET_ACTIVE}</li>
 *   <li>condition present: {@link LifecycleState#CONDITIONAL}</li>
 *   <li>otherwise {@link LifecycleState#ACTIVE}, or {@link LifecycleState#UNKNOWN} if none of the
 *   reported start and end times could be parsed</li>
 * </ol>
 * Time comparisons allow for the configured clock skew. Malformed values are reported as
 * warnings on the record and never fail classification.
 *
 * The evaluation time is fixed when the classifier is created, so classifying the same
 * assignment twice yields equal records.
 */
public class AssignmentClassifier {

  private static final Logger log = LoggerFactory.getLogger(AssignmentClassifier.class);

  public static final String UNKNOWN_PRINCIPAL_ID = "Unknown";

  private final Instant evaluationTime;
  private final Duration clockSkew;

  public AssignmentClassifier(Instant evaluationTime, Duration clockSkew) {
    this.evaluationTime = Objects.requireNonNull(evaluationTime, "evaluationTime");
    this.clockSkew = clockSkew == null ? Duration.ZERO : clockSkew;
  }

  public AssignmentRecord classify(CollectedAssignment assignment, ScopeNode reportingScope) {
    List<String> warnings = new ArrayList<>();
    AssignmentCategory category = assignment.category();

    String scopePath = assignment.scopePath() == null ? ScopePaths.UNKNOWN_SCOPE_PATH : assignment.scopePath();
    if (ScopePaths.UNKNOWN_SCOPE_PATH.equals(scopePath))
      warnings.add("Scope path could not be resolved");
    Inheritance inheritance = InheritanceRule.forCategory(category).evaluate(scopePath, reportingScope);

    Principal principal = principal(assignment, warnings);
    DefinitionRef definition = new DefinitionRef(assignment.definitionId(), assignment.definitionDisplayName());
    if (definition.id().isEmpty())
      warnings.add("Missing " + (category.domain() == AssignmentCategory.Domain.POLICY ? "policy" : "role")
          + " definition id");

    Instant startTime = parse("startTime", assignment.startTime(), warnings);
    Instant endTime = parse("endTime", assignment.endTime(), warnings);
    Instant createdOn = parse("createdOn", assignment.createdOn(), warnings);
    Condition condition = new Condition(assignment.condition(), assignment.conditionVersion());

    LifecycleState state = lifecycleState(assignment, startTime, endTime, condition);

    if (!warnings.isEmpty())
      log.debug("Assignment {} at scope {} has malformed data: {}", assignment.name(), reportingScope.id(), warnings);

    return new AssignmentRecord(reportingScope.id(),
        scopePath,
        category,
        assignment.name(),
        principal,
        definition,
        new TemporalWindow(startTime, endTime, createdOn),
        condition,
        inheritance,
        state,
        assignment.enforcementMode(),
        assignment.notScopes(),
        warnings);
  }

  public List<AssignmentRecord> classifyAll(List<CollectedAssignment> assignments, ScopeNode reportingScope) {
    List<AssignmentRecord> records = new ArrayList<>(assignments.size());
    for (CollectedAssignment assignment : assignments)
      records.add(classify(assignment, reportingScope));
    return records;
  }

  public Instant evaluationTime() {
    return evaluationTime;
  }

  LifecycleState lifecycleState(CollectedAssignment assignment,
                                Instant startTime,
                                Instant endTime,
                                Condition condition) {
    boolean hasStart = isPresent(assignment.startTime());
    boolean hasEnd = isPresent(assignment.endTime());
    if (!hasStart && !hasEnd)
      return LifecycleState.ACTIVE;
    if (endTime != null && endTime.isBefore(evaluationTime.minus(clockSkew)))
      return LifecycleState.EXPIRED;
    if (startTime != null && startTime.isAfter(evaluationTime.plus(clockSkew)))
      return LifecycleState.NOT_YET_ACTIVE;
    if (condition.isPresent())
      return LifecycleState.CONDITIONAL;
    if (startTime == null && endTime == null)
      return LifecycleState.UNKNOWN;
    return LifecycleState.ACTIVE;
  }

  private Principal principal(CollectedAssignment assignment, List<String> warnings) {
    boolean policy = assignment.category().domain() == AssignmentCategory.Domain.POLICY;
    String id = assignment.principalId();
    if (!isPresent(id)) {
      // Policy assignments without a managed identity have no principal
      if (policy)
        return Principal.NONE;
      warnings.add("Missing principal id");
      id = UNKNOWN_PRINCIPAL_ID;
    }
    PrincipalKind kind = PrincipalKind.fromProviderType(assignment.principalType());
    if (!isPresent(assignment.principalType()))
      warnings.add("Missing principal type");
    return new Principal(id, assignment.principalDisplayName(), kind);
  }

  private static Instant parse(String field, String value, List<String> warnings) {
    try {
      return TimestampParser.parse(field, value);
    } catch (MalformedDataException e) {
      warnings.add(e.getMessage());
      return null;
    }
  }

  private static boolean isPresent(String value) {
    return value != null && !value.trim().isEmpty();
  }
}
