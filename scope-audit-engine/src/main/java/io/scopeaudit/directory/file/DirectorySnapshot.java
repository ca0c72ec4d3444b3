// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.directory.file;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import io.scopeaudit.directory.FailureReason;
import io.scopeaudit.scope.ScopeKind;
import io.scopeaudit.scope.ScopePaths;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Exported state of a tenant's scope hierarchy, as read by {@link FileBasedScopeDirectory}.
 * <pre>
 * {
 *   "scopes": [ { "id": "contoso-root", "kind": "ManagementGroup", "children": [ "it-div" ] } ],
 *   "standingGrants": { "it-div": [ { "principalId": "alice", ... } ] },
 *   "eligibleGrants": { },
 *   "policyAssignments": { },
 *   "failures": { "it-div": { "children": "AccessDenied", "standingGrants": { "reason": "Throttled", "times": 1 } } }
 * }
 * </pre>
 * Assignments are listed at the scope they are bound to. Failure stages are {@code children},
 * {@code standingGrants}, {@code eligibleGrants} and {@code policyAssignments}.
 */
public class DirectorySnapshot {

  public static final String CHILDREN_STAGE = "children";
  public static final String STANDING_GRANTS_STAGE = "standingGrants";
  public static final String ELIGIBLE_GRANTS_STAGE = "eligibleGrants";
  public static final String POLICY_ASSIGNMENTS_STAGE = "policyAssignments";

  final List<ScopeEntry> scopes;
  final Map<String, List<JsonNode>> standingGrants;
  final Map<String, List<JsonNode>> eligibleGrants;
  final Map<String, List<JsonNode>> policyAssignments;
  final Map<String, Map<String, FailureSpec>> failures;

  @JsonCreator
  public DirectorySnapshot(@JsonProperty("scopes") List<ScopeEntry> scopes,
                           @JsonProperty("standingGrants") Map<String, List<JsonNode>> standingGrants,
                           @JsonProperty("eligibleGrants") Map<String, List<JsonNode>> eligibleGrants,
                           @JsonProperty("policyAssignments") Map<String, List<JsonNode>> policyAssignments,
                           @JsonProperty("failures") Map<String, Map<String, FailureSpec>> failures) {
    this.scopes = scopes == null ? Collections.emptyList() : scopes;
    this.standingGrants = standingGrants == null ? Collections.emptyMap() : standingGrants;
    this.eligibleGrants = eligibleGrants == null ? Collections.emptyMap() : eligibleGrants;
    this.policyAssignments = policyAssignments == null ? Collections.emptyMap() : policyAssignments;
    this.failures = failures == null ? Collections.emptyMap() : failures;
  }

  public static class ScopeEntry {
    final String id;
    final String displayName;
    final ScopeKind kind;
    final List<String> children;

    @JsonCreator
    public ScopeEntry(@JsonProperty("id") String id,
                      @JsonProperty("displayName") String displayName,
                      @JsonProperty("kind") ScopeKind kind,
                      @JsonProperty("children") List<String> children) {
      if (id == null || id.trim().isEmpty())
        throw new InvalidDirectorySnapshotException("Snapshot scope without id");
      this.id = id;
      this.displayName = displayName;
      this.kind = kind == null ? ScopePaths.inferKind(id) : kind;
      this.children = children == null ? Collections.emptyList() : children;
    }
  }

  /**
   * Failure injected for one stage of a scope. A positive count fails that many calls, after
   * which the call succeeds. Otherwise every call fails.
   */
  public static class FailureSpec {
    final FailureReason reason;
    final int times;

    @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
    public FailureSpec(@JsonProperty("reason") String reason,
                       @JsonProperty("times") Integer times) {
      this.reason = reason(reason);
      this.times = times == null ? 0 : times;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static FailureSpec fromString(String reason) {
      return new FailureSpec(reason, null);
    }

    private static FailureReason reason(String value) {
      for (FailureReason reason : FailureReason.values()) {
        if (reason.toString().equalsIgnoreCase(value) || reason.name().equalsIgnoreCase(value))
          return reason;
      }
      throw new InvalidDirectorySnapshotException("Unknown failure reason: " + value);
    }
  }
}
