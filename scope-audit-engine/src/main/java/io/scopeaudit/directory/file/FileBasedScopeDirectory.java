// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.directory.file;

import com.fasterxml.jackson.databind.JsonNode;
import io.scopeaudit.assignment.AssignmentCategory;
import io.scopeaudit.assignment.RawAssignment;
import io.scopeaudit.directory.ChildScope;
import io.scopeaudit.directory.FailureReason;
import io.scopeaudit.directory.PermanentDirectoryException;
import io.scopeaudit.directory.RemoteDirectoryException;
import io.scopeaudit.directory.ScopeAccessDeniedException;
import io.scopeaudit.directory.ScopeDirectoryClient;
import io.scopeaudit.directory.ScopeNotFoundException;
import io.scopeaudit.directory.TransientDirectoryException;
import io.scopeaudit.directory.file.DirectorySnapshot.FailureSpec;
import io.scopeaudit.directory.file.DirectorySnapshot.ScopeEntry;
import io.scopeaudit.scope.ScopePaths;
import io.scopeaudit.utils.JsonMapper;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scope directory backed by an exported {@link DirectorySnapshot}. Used to audit offline
 * exports and to replay directory failures in tests.
 *
 * Like the remote service, assignment lookups return the assignments bound at the scope and at
 * all of its ancestors. Scope ids are matched case-insensitively.
 */
public class FileBasedScopeDirectory implements ScopeDirectoryClient {

  private static final Logger log = LoggerFactory.getLogger(FileBasedScopeDirectory.class);

  // All maps are keyed by canonical scope id and are not modified after construction
  private final Map<String, ScopeEntry> scopes;
  private final Map<String, Set<String>> parents;
  private final Map<AssignmentCategory, Map<String, List<JsonNode>>> assignments;
  private final Map<String, Map<String, FailureSpec>> failures;
  private final Map<String, AtomicInteger> failureCounts;

  public FileBasedScopeDirectory(DirectorySnapshot snapshot) {
    this.scopes = new LinkedHashMap<>();
    this.parents = new HashMap<>();
    for (ScopeEntry scope : snapshot.scopes) {
      if (scopes.putIfAbsent(ScopePaths.canonical(scope.id), scope) != null)
        throw new InvalidDirectorySnapshotException("Duplicate scope in snapshot: " + scope.id);
    }
    for (ScopeEntry scope : snapshot.scopes) {
      for (String child : scope.children) {
        parents.computeIfAbsent(ScopePaths.canonical(child), id -> new LinkedHashSet<>())
            .add(ScopePaths.canonical(scope.id));
      }
    }

    this.assignments = new HashMap<>();
    assignments.put(AssignmentCategory.STANDING_GRANT, byScope(snapshot.standingGrants));
    assignments.put(AssignmentCategory.ELIGIBLE_GRANT, byScope(snapshot.eligibleGrants));
    assignments.put(AssignmentCategory.POLICY_ASSIGNMENT, byScope(snapshot.policyAssignments));

    this.failures = new HashMap<>();
    this.failureCounts = new HashMap<>();
    snapshot.failures.forEach((scopeId, stages) -> {
      String canonicalId = ScopePaths.canonical(scopeId);
      failures.put(canonicalId, stages);
      stages.keySet().forEach(stage -> failureCounts.put(failureKey(canonicalId, stage), new AtomicInteger()));
    });
  }

  public static FileBasedScopeDirectory load(Path snapshotFile) {
    try (BufferedReader reader = Files.newBufferedReader(snapshotFile, StandardCharsets.UTF_8)) {
      return new FileBasedScopeDirectory(JsonMapper.objectMapper().readValue(reader, DirectorySnapshot.class));
    } catch (IOException e) {
      throw new InvalidDirectorySnapshotException("Directory snapshot could not be loaded from " + snapshotFile, e);
    }
  }

  public static FileBasedScopeDirectory load(ClassLoader classLoader, String resourceName) {
    InputStream stream = classLoader.getResourceAsStream(resourceName);
    if (stream == null)
      throw new InvalidDirectorySnapshotException("Directory snapshot resource not found: " + resourceName);
    try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
      return new FileBasedScopeDirectory(JsonMapper.objectMapper().readValue(reader, DirectorySnapshot.class));
    } catch (IOException e) {
      throw new InvalidDirectorySnapshotException("Directory snapshot could not be loaded from " + resourceName, e);
    }
  }

  @Override
  public List<ChildScope> getChildren(String scopeId) throws RemoteDirectoryException {
    ScopeEntry scope = scope(scopeId, DirectorySnapshot.CHILDREN_STAGE);
    List<ChildScope> children = new ArrayList<>(scope.children.size());
    for (String childId : scope.children) {
      ScopeEntry child = scopes.get(ScopePaths.canonical(childId));
      if (child != null)
        children.add(new ChildScope(child.id, child.displayName, child.kind));
      else
        children.add(new ChildScope(childId, childId, ScopePaths.inferKind(childId)));
    }
    return children;
  }

  @Override
  public List<RawAssignment> getStandingGrants(String scopeId) throws RemoteDirectoryException {
    return effectiveAssignments(scopeId, AssignmentCategory.STANDING_GRANT, DirectorySnapshot.STANDING_GRANTS_STAGE);
  }

  @Override
  public List<RawAssignment> getEligibleGrants(String scopeId) throws RemoteDirectoryException {
    return effectiveAssignments(scopeId, AssignmentCategory.ELIGIBLE_GRANT, DirectorySnapshot.ELIGIBLE_GRANTS_STAGE);
  }

  @Override
  public List<RawAssignment> getPolicyAssignments(String scopeId) throws RemoteDirectoryException {
    return effectiveAssignments(scopeId, AssignmentCategory.POLICY_ASSIGNMENT, DirectorySnapshot.POLICY_ASSIGNMENTS_STAGE);
  }

  private List<RawAssignment> effectiveAssignments(String scopeId, AssignmentCategory category, String stage)
      throws RemoteDirectoryException {
    scope(scopeId, stage);
    Map<String, List<JsonNode>> byScope = assignments.get(category);
    List<RawAssignment> result = new ArrayList<>();
    for (String boundScope : selfAndAncestors(ScopePaths.canonical(scopeId))) {
      for (JsonNode payload : byScope.getOrDefault(boundScope, Collections.emptyList()))
        result.add(new RawAssignment(category, payload));
    }
    return result;
  }

  private ScopeEntry scope(String scopeId, String stage) throws RemoteDirectoryException {
    String canonicalId = ScopePaths.canonical(scopeId);
    maybeFail(scopeId, canonicalId, stage);
    ScopeEntry scope = scopes.get(canonicalId);
    if (scope == null)
      throw new ScopeNotFoundException(scopeId);
    return scope;
  }

  private void maybeFail(String scopeId, String canonicalId, String stage) throws RemoteDirectoryException {
    FailureSpec failure = failures.getOrDefault(canonicalId, Collections.emptyMap()).get(stage);
    if (failure == null)
      return;
    if (failure.times > 0 && failureCounts.get(failureKey(canonicalId, stage)).getAndIncrement() >= failure.times)
      return;

    log.debug("Injecting failure {} for {} of scope {}", failure.reason, stage, scopeId);
    switch (failure.reason) {
      case NOT_FOUND:
        throw new ScopeNotFoundException(scopeId);
      case ACCESS_DENIED:
        throw new ScopeAccessDeniedException(scopeId);
      case THROTTLED:
        throw TransientDirectoryException.throttled(scopeId, -1L);
      case REMOTE_TIMEOUT:
        throw TransientDirectoryException.timeout(scopeId, null);
      default:
        throw new PermanentDirectoryException(scopeId, FailureReason.UNEXPECTED,
            "Injected failure " + failure.reason + " for scope " + scopeId);
    }
  }

  // Top-down, so that assignments of the root come first
  private List<String> selfAndAncestors(String canonicalId) {
    Set<String> visited = new LinkedHashSet<>();
    Deque<String> pending = new ArrayDeque<>();
    pending.add(canonicalId);
    while (!pending.isEmpty()) {
      String id = pending.poll();
      if (visited.add(id))
        pending.addAll(parents.getOrDefault(id, Collections.emptySet()));
    }
    List<String> result = new ArrayList<>(visited);
    Collections.reverse(result);
    return result;
  }

  private static Map<String, List<JsonNode>> byScope(Map<String, List<JsonNode>> assignments) {
    Map<String, List<JsonNode>> result = new HashMap<>();
    assignments.forEach((scopeId, payloads) -> result
        .computeIfAbsent(ScopePaths.canonical(scopeId), id -> new ArrayList<>())
        .addAll(payloads == null ? Collections.emptyList() : payloads));
    return result;
  }

  private static String failureKey(String canonicalId, String stage) {
    return canonicalId + "#" + stage;
  }
}
