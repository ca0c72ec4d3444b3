// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.engine.collector;

import com.fasterxml.jackson.databind.JsonNode;
import io.scopeaudit.assignment.AssignmentCategory;
import io.scopeaudit.assignment.CollectedAssignment;
import io.scopeaudit.assignment.RawAssignment;
import io.scopeaudit.scope.ScopePaths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Maps provider payloads onto the canonical assignment fields. Missing fields are left null
 * except for the scope path, which becomes {@link ScopePaths#UNKNOWN_SCOPE_PATH}, and display
 * names, which fall back to ids. Normalization never fails; malformed values are judged by the
 * classifier.
 */
public class AssignmentNormalizer {

  public CollectedAssignment normalize(RawAssignment raw) {
    JsonNode payload = raw.payload();
    AssignmentCategory category = raw.category();
    boolean policy = category.domain() == AssignmentCategory.Domain.POLICY;

    String name = AssignmentFields.NAME.resolveOrNull(payload);
    String scopePath = AssignmentFields.SCOPE_PATH.resolveOrDefault(payload, ScopePaths.UNKNOWN_SCOPE_PATH);

    String principalId;
    String principalDisplayName;
    String principalType;
    String definitionId;
    String definitionDisplayName;
    if (policy) {
      principalId = AssignmentFields.POLICY_PRINCIPAL_ID.resolveOrNull(payload);
      principalDisplayName = principalId;
      principalType = AssignmentFields.POLICY_PRINCIPAL_TYPE.resolveOrNull(payload);
      definitionId = AssignmentFields.POLICY_DEFINITION_ID.resolveOrNull(payload);
      definitionDisplayName = AssignmentFields.POLICY_DEFINITION_DISPLAY_NAME.resolveOrNull(payload);
    } else {
      principalId = AssignmentFields.RBAC_PRINCIPAL_ID.resolveOrNull(payload);
      principalDisplayName = AssignmentFields.RBAC_PRINCIPAL_DISPLAY_NAME.resolveOrDefault(payload, principalId);
      principalType = AssignmentFields.RBAC_PRINCIPAL_TYPE.resolveOrNull(payload);
      definitionId = AssignmentFields.ROLE_DEFINITION_ID.resolveOrNull(payload);
      definitionDisplayName = AssignmentFields.ROLE_DEFINITION_DISPLAY_NAME.resolveOrNull(payload);
    }
    if (definitionDisplayName == null)
      definitionDisplayName = name != null ? name : definitionId;

    return CollectedAssignment.builder(category)
        .name(name)
        .scopePath(scopePath)
        .principal(principalId, principalDisplayName, principalType)
        .definition(definitionId, definitionDisplayName)
        .schedule(AssignmentFields.START_TIME.resolveOrNull(payload),
            AssignmentFields.END_TIME.resolveOrNull(payload),
            AssignmentFields.CREATED_ON.resolveOrNull(payload))
        .condition(AssignmentFields.CONDITION.resolveOrNull(payload),
            AssignmentFields.CONDITION_VERSION.resolveOrNull(payload))
        .enforcementMode(policy ? AssignmentFields.ENFORCEMENT_MODE.resolveOrNull(payload) : null)
        .notScopes(policy ? notScopes(payload) : Collections.emptyList())
        .build();
  }

  private static List<String> notScopes(JsonNode payload) {
    JsonNode node = FieldAccessor.node(payload, "notScopes");
    if (node == null || !node.isArray())
      node = FieldAccessor.node(payload, "properties", "notScopes");
    if (node == null || !node.isArray())
      return Collections.emptyList();
    List<String> scopes = new ArrayList<>();
    for (JsonNode element : node) {
      if (element.isValueNode() && !element.isNull() && !element.asText().trim().isEmpty())
        scopes.add(element.asText().trim());
    }
    return scopes;
  }
}
