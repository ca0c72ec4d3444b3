// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.engine.classifier;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import io.scopeaudit.assignment.AssignmentCategory;
import io.scopeaudit.assignment.AssignmentRecord;
import io.scopeaudit.assignment.CollectedAssignment;
import io.scopeaudit.assignment.Inheritance;
import io.scopeaudit.assignment.LifecycleState;
import io.scopeaudit.assignment.Principal;
import io.scopeaudit.assignment.PrincipalKind;
import io.scopeaudit.scope.ScopeKind;
import io.scopeaudit.scope.ScopeNode;
import io.scopeaudit.scope.ScopePaths;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import org.junit.Test;

public class AssignmentClassifierTest {

  private static final Instant NOW = Instant.parse("2026-06-15T12:00:00Z");
  private static final String YESTERDAY = NOW.minus(1, ChronoUnit.DAYS).toString();
  private static final String TOMORROW = NOW.plus(1, ChronoUnit.DAYS).toString();
  private static final String LAST_WEEK = NOW.minus(7, ChronoUnit.DAYS).toString();
  private static final String NEXT_WEEK = NOW.plus(7, ChronoUnit.DAYS).toString();
  private static final String CONDITION = "@Resource[Microsoft.Storage/storageAccounts:name] StringEquals 'logs'";

  private static final String CONTOSO_MG = "/providers/Microsoft.Management/managementGroups/contoso-root";
  private static final ScopeNode CONTOSO_ROOT = ScopeNode.root("contoso-root", "Contoso", ScopeKind.MANAGEMENT_GROUP);
  private static final ScopeNode IT_DIV = new ScopeNode("it-div", "IT", ScopeKind.MANAGEMENT_GROUP,
      "contoso-root", "contoso-root");
  private static final ScopeNode SUBSCRIPTION = new ScopeNode("/subscriptions/1234", "Prod",
      ScopeKind.SUBSCRIPTION, "it-div", "contoso-root");

  private final AssignmentClassifier classifier = new AssignmentClassifier(NOW, Duration.ZERO);

  @Test
  public void testDirectStandingGrant() {
    AssignmentRecord record = classifier.classify(grant("it-div").build(), IT_DIV);

    assertEquals("it-div", record.scopeId());
    assertEquals("it-div", record.scopePath());
    assertEquals(Inheritance.DIRECT, record.inheritance());
    assertEquals(LifecycleState.ACTIVE, record.lifecycleState());
    assertEquals("Active", record.stateLabel());
    assertEquals(PrincipalKind.USER, record.principal().kind());
    assertEquals("alice", record.principal().id());
    assertEquals("Reader", record.roleOrPolicyRef().displayName());
    assertFalse(record.temporal().isTimeBound());
    assertFalse(record.isConditional());
    assertTrue(record.warnings().isEmpty());
  }

  @Test
  public void testInheritedFromAncestor() {
    ScopeNode itDivRoot = ScopeNode.root("it-div", "IT", ScopeKind.MANAGEMENT_GROUP);
    AssignmentRecord record = classifier.classify(grant("contoso-root").build(), itDivRoot);

    assertEquals("it-div", record.scopeId());
    assertEquals("contoso-root", record.scopePath());
    assertEquals(Inheritance.INHERITED, record.inheritance());
  }

  @Test
  public void testPathComparisonIsCanonical() {
    AssignmentRecord record = classifier.classify(grant("/Subscriptions/1234/").build(), SUBSCRIPTION);
    assertEquals(Inheritance.DIRECT, record.inheritance());
  }

  @Test
  public void testExpiredRegardlessOfStartTime() {
    assertEquals(LifecycleState.EXPIRED, state(grant("it-div").schedule(null, YESTERDAY, null)));
    assertEquals(LifecycleState.EXPIRED, state(grant("it-div").schedule(LAST_WEEK, YESTERDAY, null)));
    assertEquals(LifecycleState.EXPIRED, state(grant("it-div").schedule(TOMORROW, YESTERDAY, null)));
  }

  @Test
  public void testExpiredConditionalGrant() {
    AssignmentRecord record = classifier.classify(
        grant("it-div").schedule(LAST_WEEK, YESTERDAY, null).condition(CONDITION, "2.0").build(), IT_DIV);

    assertEquals(LifecycleState.EXPIRED, record.lifecycleState());
    assertTrue(record.isConditional());
    assertEquals("Expired (Conditional)", record.stateLabel());
    assertEquals(CONDITION, record.condition().expression());
  }

  @Test
  public void testTimeBoundStates() {
    assertEquals(LifecycleState.NOT_YET_ACTIVE, state(grant("it-div").schedule(TOMORROW, NEXT_WEEK, null)));
    assertEquals(LifecycleState.ACTIVE, state(grant("it-div").schedule(YESTERDAY, TOMORROW, null)));
    assertEquals(LifecycleState.ACTIVE, state(grant("it-div").schedule(YESTERDAY, null, null)));
    assertEquals(LifecycleState.CONDITIONAL,
        state(grant("it-div").schedule(YESTERDAY, TOMORROW, null).condition(CONDITION, null)));
    // Creation time alone does not make a grant time-bound
    assertEquals(LifecycleState.ACTIVE, state(grant("it-div").schedule(null, null, LAST_WEEK)));

    AssignmentRecord notYetActive = classifier.classify(
        grant("it-div").schedule(TOMORROW, null, null).condition(CONDITION, null).build(), IT_DIV);
    assertEquals("NotYetActive (Conditional)", notYetActive.stateLabel());
  }

  @Test
  public void testStandingConditionalGrantIsActive() {
    AssignmentRecord record = classifier.classify(grant("it-div").condition(CONDITION, null).build(), IT_DIV);
    assertEquals(LifecycleState.ACTIVE, record.lifecycleState());
    assertEquals("Active (Conditional)", record.stateLabel());
  }

  @Test
  public void testClockSkew() {
    AssignmentClassifier skewed = new AssignmentClassifier(NOW, Duration.ofMinutes(5));
    String justExpired = NOW.minusSeconds(60).toString();
    String aboutToStart = NOW.plusSeconds(60).toString();

    assertEquals(LifecycleState.EXPIRED, state(grant("it-div").schedule(null, justExpired, null)));
    assertEquals(LifecycleState.ACTIVE,
        skewed.classify(grant("it-div").schedule(null, justExpired, null).build(), IT_DIV).lifecycleState());
    assertEquals(LifecycleState.ACTIVE,
        skewed.classify(grant("it-div").schedule(aboutToStart, null, null).build(), IT_DIV).lifecycleState());
  }

  @Test
  public void testMalformedTimestampsDegrade() {
    AssignmentRecord unknown = classifier.classify(
        grant("it-div").schedule(null, "next tuesday", null).build(), IT_DIV);
    assertEquals(LifecycleState.UNKNOWN, unknown.lifecycleState());
    assertEquals("TimeBound", unknown.stateLabel());
    assertNull(unknown.temporal().endTime());
    assertEquals(1, unknown.warnings().size());
    assertTrue(unknown.warnings().get(0).contains("endTime"));

    AssignmentRecord bestEffort = classifier.classify(
        grant("it-div").schedule(YESTERDAY, "not a date", "also not a date").build(), IT_DIV);
    assertEquals(LifecycleState.ACTIVE, bestEffort.lifecycleState());
    assertEquals(2, bestEffort.warnings().size());

    AssignmentRecord expired = classifier.classify(
        grant("it-div").schedule("garbage", YESTERDAY, null).build(), IT_DIV);
    assertEquals(LifecycleState.EXPIRED, expired.lifecycleState());
  }

  @Test
  public void testMalformedIdentity() {
    AssignmentRecord record = classifier.classify(CollectedAssignment.builder(AssignmentCategory.STANDING_GRANT)
        .name("orphan")
        .scopePath("it-div")
        .definition("rd-reader", null)
        .build(), IT_DIV);

    assertEquals(AssignmentClassifier.UNKNOWN_PRINCIPAL_ID, record.principal().id());
    assertEquals(PrincipalKind.UNKNOWN, record.principal().kind());
    assertEquals("rd-reader", record.roleOrPolicyRef().displayName());
    assertEquals(2, record.warnings().size());
  }

  @Test
  public void testUnknownPrincipalTypePassesThrough() {
    AssignmentRecord record = classifier.classify(grant("it-div")
        .principal("partner", "Partner", "ForeignGroup").build(), IT_DIV);
    assertEquals(new PrincipalKind("ForeignGroup"), record.principal().kind());
    assertTrue(record.warnings().isEmpty());
  }

  @Test
  public void testUnresolvedScopePath() {
    AssignmentRecord record = classifier.classify(grant(ScopePaths.UNKNOWN_SCOPE_PATH).build(), IT_DIV);
    assertEquals(Inheritance.INHERITED, record.inheritance());
    assertEquals(1, record.warnings().size());
  }

  @Test
  public void testClassificationIsIdempotent() {
    CollectedAssignment assignment = grant("contoso-root")
        .schedule(LAST_WEEK, "not a date", null)
        .condition(CONDITION, "2.0")
        .build();

    AssignmentRecord first = classifier.classify(assignment, IT_DIV);
    AssignmentRecord second = classifier.classify(assignment, IT_DIV);
    assertEquals(first, second);
    assertEquals(first.hashCode(), second.hashCode());
    assertEquals(first, new AssignmentClassifier(NOW, Duration.ZERO).classify(assignment, IT_DIV));
  }

  @Test
  public void testPolicyInheritanceRule() {
    CollectedAssignment atManagementGroup = policy(CONTOSO_MG).build();

    assertEquals(Inheritance.DIRECT, classifier.classify(atManagementGroup, CONTOSO_ROOT).inheritance());
    assertEquals(Inheritance.INHERITED, classifier.classify(atManagementGroup, IT_DIV).inheritance());
    assertEquals(Inheritance.INHERITED, classifier.classify(atManagementGroup, SUBSCRIPTION).inheritance());
    ScopeNode sameNamedSubscription = new ScopeNode("/subscriptions/contoso-root", null,
        ScopeKind.SUBSCRIPTION, "contoso-root", "contoso-root");
    assertEquals(Inheritance.INHERITED, classifier.classify(atManagementGroup, sameNamedSubscription).inheritance());

    CollectedAssignment atSubscription = policy("/subscriptions/1234").build();
    assertEquals(Inheritance.DIRECT, classifier.classify(atSubscription, SUBSCRIPTION).inheritance());

    // Access grants compare the full path
    CollectedAssignment grantAtManagementGroup = grant(CONTOSO_MG).build();
    assertEquals(Inheritance.INHERITED, classifier.classify(grantAtManagementGroup, CONTOSO_ROOT).inheritance());
  }

  @Test
  public void testEpochSecondsEndTime() {
    String startOf2030 = String.valueOf(Instant.parse("2030-01-01T00:00:00Z").getEpochSecond());
    String lastWeekMillis = String.valueOf(NOW.minus(7, ChronoUnit.DAYS).toEpochMilli());
    assertEquals(LifecycleState.ACTIVE, state(grant("it-div").schedule(null, startOf2030, null)));
    assertEquals(LifecycleState.EXPIRED, state(grant("it-div").schedule(null, lastWeekMillis, null)));
  }

  @Test
  public void testPolicyAssignmentFields() {
    AssignmentRecord withoutIdentity = classifier.classify(policy("/subscriptions/1234")
        .enforcementMode("DoNotEnforce").build(), SUBSCRIPTION);
    assertEquals(Principal.NONE, withoutIdentity.principal());
    assertEquals("DoNotEnforce", withoutIdentity.enforcementMode());
    assertTrue(withoutIdentity.warnings().isEmpty());

    AssignmentRecord withIdentity = classifier.classify(policy("/subscriptions/1234")
        .principal("msi-1", "msi-1", "SystemAssigned").build(), SUBSCRIPTION);
    assertEquals(PrincipalKind.MANAGED_IDENTITY, withIdentity.principal().kind());
  }

  private LifecycleState state(CollectedAssignment.Builder builder) {
    return classifier.classify(builder.build(), IT_DIV).lifecycleState();
  }

  private static CollectedAssignment.Builder grant(String scopePath) {
    return CollectedAssignment.builder(AssignmentCategory.STANDING_GRANT)
        .name("alice-reader")
        .scopePath(scopePath)
        .principal("alice", "Alice", "User")
        .definition("rd-reader", "Reader");
  }

  private static CollectedAssignment.Builder policy(String scopePath) {
    return CollectedAssignment.builder(AssignmentCategory.POLICY_ASSIGNMENT)
        .name("deny-public-ip")
        .scopePath(scopePath)
        .definition("pd-deny-ip", "Deny public IPs");
  }
}
