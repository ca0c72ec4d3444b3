// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.scopeaudit.assignment.AssignmentCategory;
import io.scopeaudit.assignment.RawAssignment;
import io.scopeaudit.directory.ChildScope;
import io.scopeaudit.scope.ScopeKind;
import io.scopeaudit.utils.JsonMapper;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.apache.kafka.common.utils.Time;

public final class AuditTestUtils {

  public static final Duration RUN_TIMEOUT = Duration.ofMinutes(5);

  private AuditTestUtils() {
  }

  public static RunContext runContext(Time time) {
    return new RunContext(time, RUN_TIMEOUT);
  }

  public static RemoteCallRetrier retrier(RunContext context) {
    return new RemoteCallRetrier(3, 100, 1000, 0.0, context);
  }

  public static AuditConfig config(Object... keyValues) {
    if (keyValues.length % 2 != 0)
      throw new IllegalArgumentException("Config keys and values must be provided in pairs");
    Map<String, Object> props = new HashMap<>();
    for (int i = 0; i < keyValues.length; i += 2)
      props.put((String) keyValues[i], keyValues[i + 1]);
    return new AuditConfig(props);
  }

  public static ChildScope managementGroup(String id) {
    return new ChildScope(id, id, ScopeKind.MANAGEMENT_GROUP);
  }

  public static ChildScope subscription(String id) {
    return new ChildScope(id, id, ScopeKind.SUBSCRIPTION);
  }

  public static ChildScope resourceGroup(String id) {
    return new ChildScope(id, id, ScopeKind.RESOURCE_GROUP);
  }

  public static ObjectNode grantPayload(String principalId, String principalType, String role, String scope) {
    ObjectNode payload = JsonMapper.objectMapper().createObjectNode();
    payload.put("name", principalId + "-" + role + "@" + scope);
    payload.put("scope", scope);
    payload.put("principalId", principalId);
    payload.put("principalDisplayName", principalId);
    payload.put("principalType", principalType);
    payload.put("roleDefinitionId", "role-" + role.toLowerCase());
    payload.put("roleDefinitionName", role);
    return payload;
  }

  public static RawAssignment standingGrant(String principalId, String principalType, String role, String scope) {
    return new RawAssignment(AssignmentCategory.STANDING_GRANT, grantPayload(principalId, principalType, role, scope));
  }

  public static RawAssignment eligibleGrant(String principalId, String role, String scope,
                                            String startDateTime, String endDateTime) {
    ObjectNode payload = grantPayload(principalId, "User", role, scope);
    if (startDateTime != null)
      payload.put("startDateTime", startDateTime);
    if (endDateTime != null)
      payload.put("endDateTime", endDateTime);
    return new RawAssignment(AssignmentCategory.ELIGIBLE_GRANT, payload);
  }

  public static RawAssignment policyAssignment(String name, String policyDefinition, String scope) {
    ObjectNode payload = JsonMapper.objectMapper().createObjectNode();
    payload.put("name", name);
    payload.put("id", scope + "/providers/Microsoft.Authorization/policyAssignments/" + name);
    payload.put("policyDefinitionId", "/providers/Microsoft.Authorization/policyDefinitions/" + policyDefinition);
    payload.put("displayName", policyDefinition);
    payload.put("enforcementMode", "Default");
    return new RawAssignment(AssignmentCategory.POLICY_ASSIGNMENT, payload);
  }
}
