// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.engine.walker;

import static io.scopeaudit.engine.AuditTestUtils.managementGroup;
import static io.scopeaudit.engine.AuditTestUtils.resourceGroup;
import static io.scopeaudit.engine.AuditTestUtils.subscription;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.scopeaudit.directory.ChildScope;
import io.scopeaudit.directory.FailureReason;
import io.scopeaudit.directory.ScopeAccessDeniedException;
import io.scopeaudit.directory.ScopeDirectoryClient;
import io.scopeaudit.directory.TransientDirectoryException;
import io.scopeaudit.engine.AuditTestUtils;
import io.scopeaudit.engine.RunContext;
import io.scopeaudit.engine.SkippedScope;
import io.scopeaudit.scope.InvalidScopeException;
import io.scopeaudit.scope.ScopeKind;
import io.scopeaudit.scope.ScopeNode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import org.apache.kafka.common.utils.MockTime;
import org.junit.Before;
import org.junit.Test;

public class HierarchyWalkerTest {

  private ScopeDirectoryClient directory;
  private RunContext context;

  @Before
  public void setUp() {
    directory = mock(ScopeDirectoryClient.class);
    context = AuditTestUtils.runContext(new MockTime());
  }

  @Test
  public void testWalkRecordsLineage() throws Exception {
    when(directory.getChildren("contoso-root"))
        .thenReturn(Arrays.asList(managementGroup("it-div"), managementGroup("finance")));
    when(directory.getChildren("it-div")).thenReturn(Collections.singletonList(subscription("/subscriptions/1")));

    WalkResult result = walker(false, false).walk(Collections.singletonList("contoso-root"));

    assertEquals(Arrays.asList("contoso-root", "it-div", "finance", "/subscriptions/1"),
        new ArrayList<>(result.nodes().keySet()));
    ScopeNode root = result.nodes().get("contoso-root");
    assertTrue(root.isRoot());
    assertEquals(ScopeKind.MANAGEMENT_GROUP, root.kind());
    ScopeNode subscription = result.nodes().get("/subscriptions/1");
    assertEquals("it-div", subscription.parentId());
    assertEquals("contoso-root", subscription.rootId());
    assertEquals(ScopeKind.SUBSCRIPTION, subscription.kind());
    assertTrue(result.skipped().isEmpty());
    assertNull(result.stopReason());

    // Subscriptions are leaves unless subscription expansion is enabled
    verify(directory, never()).getChildren("/subscriptions/1");
  }

  @Test
  public void testExpansionPolicy() throws Exception {
    when(directory.getChildren("contoso-root")).thenReturn(Collections.singletonList(subscription("/subscriptions/1")));
    when(directory.getChildren("/subscriptions/1"))
        .thenReturn(Collections.singletonList(resourceGroup("/subscriptions/1/resourceGroups/rg1")));

    WalkResult withSubscriptions = walker(true, false).walk(Collections.singletonList("contoso-root"));
    assertEquals(3, withSubscriptions.nodes().size());
    verify(directory, never()).getChildren("/subscriptions/1/resourceGroups/rg1");

    walker(true, true).walk(Collections.singletonList("contoso-root"));
    verify(directory).getChildren("/subscriptions/1/resourceGroups/rg1");
  }

  @Test
  public void testRootOfLeafKindIsNotExpanded() throws Exception {
    WalkResult result = walker(false, false).walk(Collections.singletonList("/subscriptions/1"));

    assertEquals(1, result.nodes().size());
    assertEquals(ScopeKind.SUBSCRIPTION, result.nodes().get("/subscriptions/1").kind());
    verifyNoInteractions(directory);
  }

  @Test
  public void testRootsWithoutOverlap() throws Exception {
    when(directory.getChildren("a")).thenReturn(Arrays.asList(managementGroup("a1"), managementGroup("a2")));
    when(directory.getChildren("a1")).thenReturn(Collections.singletonList(subscription("/subscriptions/a")));
    when(directory.getChildren("b")).thenReturn(Collections.singletonList(managementGroup("b1")));

    int sizeA = walker(false, false).walk(Collections.singletonList("a")).nodes().size();
    int sizeB = walker(false, false).walk(Collections.singletonList("b")).nodes().size();
    WalkResult combined = walker(false, false).walk(Arrays.asList("a", "b"));

    assertEquals(4, sizeA);
    assertEquals(2, sizeB);
    assertEquals(sizeA + sizeB, combined.nodes().size());
  }

  @Test
  public void testSharedDescendantIsExpandedOnce() throws Exception {
    when(directory.getChildren("a")).thenReturn(Collections.singletonList(managementGroup("shared")));
    when(directory.getChildren("b")).thenReturn(Collections.singletonList(managementGroup("shared")));
    when(directory.getChildren("shared")).thenReturn(Collections.singletonList(subscription("/subscriptions/s")));

    WalkResult result = walker(false, false).walk(Arrays.asList("a", "b"));

    assertEquals(4, result.nodes().size());
    assertEquals("a", result.nodes().get("shared").rootId());
    assertEquals(new HashSet<>(Arrays.asList("a", "b")), result.reachingRoots("shared"));
    assertEquals(new HashSet<>(Arrays.asList("a", "b")), result.reachingRoots("/subscriptions/s"));
    assertEquals(Collections.singleton("a"), result.reachingRoots("a"));
    verify(directory, times(1)).getChildren("shared");
  }

  @Test
  public void testRootReachableFromAnotherRoot() throws Exception {
    when(directory.getChildren("contoso-root")).thenReturn(Collections.singletonList(managementGroup("it-div")));

    WalkResult result = walker(false, false).walk(Arrays.asList("contoso-root", "IT-DIV"));

    assertEquals(2, result.nodes().size());
    assertEquals(new HashSet<>(Arrays.asList("contoso-root", "IT-DIV")), result.reachingRoots("it-div"));
    verify(directory, times(1)).getChildren("it-div");
  }

  @Test
  public void testSelfAndBackReferencesTerminate() throws Exception {
    when(directory.getChildren("contoso-root")).thenReturn(Collections.singletonList(managementGroup("it-div")));
    when(directory.getChildren("it-div"))
        .thenReturn(Arrays.asList(managementGroup("it-div"), managementGroup("contoso-root"), managementGroup("ops")));
    when(directory.getChildren("ops")).thenReturn(Collections.singletonList(managementGroup("IT-Div/")));

    WalkResult result = walker(false, false).walk(Collections.singletonList("contoso-root"));

    assertEquals(Arrays.asList("contoso-root", "it-div", "ops"), new ArrayList<>(result.nodes().keySet()));
    assertTrue(result.skipped().isEmpty());
  }

  @Test
  public void testDeepHierarchy() throws Exception {
    int depth = 20000;
    when(directory.getChildren(anyString())).thenAnswer(invocation -> {
      String id = invocation.getArgument(0);
      int level = Integer.parseInt(id.substring("mg-".length()));
      return level < depth ? Collections.singletonList(managementGroup("mg-" + (level + 1)))
          : Collections.<ChildScope>emptyList();
    });

    WalkResult result = walker(false, false).walk(Collections.singletonList("mg-0"));

    assertEquals(depth + 1, result.nodes().size());
    assertEquals("mg-0", result.nodes().get("mg-" + depth).rootId());
  }

  @Test
  public void testAccessDeniedSkipsBranch() throws Exception {
    when(directory.getChildren("contoso-root"))
        .thenReturn(Arrays.asList(managementGroup("it-div"), managementGroup("finance")));
    when(directory.getChildren("it-div")).thenThrow(new ScopeAccessDeniedException("it-div"));
    when(directory.getChildren("finance")).thenReturn(Collections.singletonList(subscription("/subscriptions/f")));

    WalkResult result = walker(false, false).walk(Collections.singletonList("contoso-root"));

    assertEquals(Arrays.asList("contoso-root", "it-div", "finance", "/subscriptions/f"),
        new ArrayList<>(result.nodes().keySet()));
    assertEquals(1, result.skipped().size());
    SkippedScope skipped = result.skipped().get(0);
    assertEquals("it-div", skipped.scopeId());
    assertEquals(SkippedScope.Stage.CHILDREN, skipped.stage());
    assertEquals(FailureReason.ACCESS_DENIED, skipped.reason());
    assertNull(result.stopReason());
  }

  @Test
  public void testTransientFailureIsRetried() throws Exception {
    when(directory.getChildren("contoso-root"))
        .thenThrow(TransientDirectoryException.throttled("contoso-root", 10))
        .thenReturn(Collections.singletonList(managementGroup("it-div")));

    WalkResult result = walker(false, false).walk(Collections.singletonList("contoso-root"));

    assertEquals(2, result.nodes().size());
    assertTrue(result.skipped().isEmpty());
    verify(directory, times(2)).getChildren("contoso-root");
  }

  @Test
  public void testUnexpectedFailureSkipsBranch() throws Exception {
    when(directory.getChildren("contoso-root")).thenThrow(new IllegalStateException("Malformed response"));

    WalkResult result = walker(false, false).walk(Collections.singletonList("contoso-root"));

    assertEquals(1, result.nodes().size());
    assertEquals(FailureReason.UNEXPECTED, result.skipped().get(0).reason());
  }

  @Test
  public void testCancelledWalk() throws Exception {
    context.cancel();

    WalkResult result = walker(false, false).walk(Arrays.asList("contoso-root", "finance"));

    assertTrue(result.nodes().isEmpty());
    assertEquals(2, result.skipped().size());
    assertEquals(FailureReason.CANCELLED, result.skipped().get(0).reason());
    assertEquals(FailureReason.CANCELLED, result.stopReason());
    verifyNoInteractions(directory);
  }

  @Test
  public void testInvalidRoots() {
    assertInvalidRoots(Collections.emptyList());
    assertInvalidRoots(Arrays.asList("contoso-root", " "));
    verifyNoInteractions(directory);
  }

  @Test
  public void testDuplicateRootIds() {
    assertEquals(Collections.singletonList("contoso-root"),
        HierarchyWalker.validateRoots(Arrays.asList("contoso-root", " contoso-root ")));
  }

  private void assertInvalidRoots(List<String> roots) {
    try {
      walker(false, false).walk(roots);
      throw new AssertionError("Invalid roots accepted: " + roots);
    } catch (InvalidScopeException e) {
      assertFalse(e.getMessage().isEmpty());
    }
  }

  private HierarchyWalker walker(boolean includeSubscriptions, boolean includeResourceGroups) {
    return new HierarchyWalker(directory,
        new ExpansionPolicy(includeSubscriptions, includeResourceGroups),
        AuditTestUtils.retrier(context),
        context);
  }
}
