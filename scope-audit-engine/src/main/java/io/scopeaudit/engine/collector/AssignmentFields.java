// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.engine.collector;

import static io.scopeaudit.engine.collector.FieldAccessor.derived;
import static io.scopeaudit.engine.collector.FieldAccessor.field;

import io.scopeaudit.scope.ScopePaths;

/**
 * Provider field variants of the canonical assignment fields, in lookup order. Access grants
 * and policy assignments share most fields. Where they differ, each domain has its own list.
 */
public final class AssignmentFields {

  private static final FieldAccessor RESOURCE_ID = field("id");

  public static final FieldFallback NAME = FieldFallback.of("name",
      field("name"),
      field("properties", "name"),
      field("assignmentName"),
      field("roleAssignmentName"),
      derived("lastSegment", RESOURCE_ID, ScopePaths::lastSegment));

  public static final FieldFallback SCOPE_PATH = FieldFallback.of("scopePath",
      field("scope"),
      field("properties", "scope"),
      field("directoryScopeId"),
      derived("trimTrailingSegment", RESOURCE_ID, ScopePaths::trimTrailingSegment),
      derived("trimTrailingSegment", field("roleAssignmentId"), ScopePaths::trimTrailingSegment),
      derived("trimTrailingSegment", field("policyAssignmentId"), ScopePaths::trimTrailingSegment),
      derived("trimTrailingSegment", field("resourceId"), ScopePaths::trimTrailingSegment));

  public static final FieldFallback RBAC_PRINCIPAL_ID = FieldFallback.of("principalId",
      field("principalId"),
      field("properties", "principalId"),
      field("objectId"),
      field("expandedProperties", "principal", "id"),
      field("properties", "expandedProperties", "principal", "id"));

  public static final FieldFallback RBAC_PRINCIPAL_DISPLAY_NAME = FieldFallback.of("principalDisplayName",
      field("principalDisplayName"),
      field("properties", "principalDisplayName"),
      field("displayName"),
      field("expandedProperties", "principal", "displayName"),
      field("properties", "expandedProperties", "principal", "displayName"),
      field("signInName"));

  public static final FieldFallback RBAC_PRINCIPAL_TYPE = FieldFallback.of("principalType",
      field("principalType"),
      field("properties", "principalType"),
      field("objectType"),
      field("expandedProperties", "principal", "type"),
      field("properties", "expandedProperties", "principal", "type"));

  public static final FieldFallback POLICY_PRINCIPAL_ID = FieldFallback.of("principalId",
      field("identity", "principalId"),
      field("properties", "identity", "principalId"));

  public static final FieldFallback POLICY_PRINCIPAL_TYPE = FieldFallback.of("principalType",
      field("identity", "type"),
      field("properties", "identity", "type"));

  public static final FieldFallback ROLE_DEFINITION_ID = FieldFallback.of("definitionId",
      field("roleDefinitionId"),
      field("properties", "roleDefinitionId"),
      field("expandedProperties", "roleDefinition", "id"),
      field("properties", "expandedProperties", "roleDefinition", "id"));

  public static final FieldFallback ROLE_DEFINITION_DISPLAY_NAME = FieldFallback.of("definitionDisplayName",
      field("roleDefinitionName"),
      field("roleDefinitionDisplayName"),
      field("properties", "roleDefinitionDisplayName"),
      field("expandedProperties", "roleDefinition", "displayName"),
      field("properties", "expandedProperties", "roleDefinition", "displayName"));

  public static final FieldFallback POLICY_DEFINITION_ID = FieldFallback.of("definitionId",
      field("policyDefinitionId"),
      field("properties", "policyDefinitionId"));

  public static final FieldFallback POLICY_DEFINITION_DISPLAY_NAME = FieldFallback.of("definitionDisplayName",
      field("policyDefinitionDisplayName"),
      field("properties", "policyDefinitionDisplayName"),
      field("displayName"),
      field("properties", "displayName"));

  public static final FieldFallback START_TIME = FieldFallback.of("startTime",
      field("startDateTime"),
      field("properties", "startDateTime"),
      field("scheduleInfo", "startDateTime"),
      field("properties", "scheduleInfo", "startDateTime"),
      field("startTime"));

  public static final FieldFallback END_TIME = FieldFallback.of("endTime",
      field("endDateTime"),
      field("properties", "endDateTime"),
      field("scheduleInfo", "expiration", "endDateTime"),
      field("properties", "scheduleInfo", "expiration", "endDateTime"),
      field("endTime"));

  public static final FieldFallback CREATED_ON = FieldFallback.of("createdOn",
      field("createdOn"),
      field("properties", "createdOn"),
      field("createdDateTime"),
      field("properties", "createdDateTime"));

  public static final FieldFallback CONDITION = FieldFallback.of("condition",
      field("condition"),
      field("properties", "condition"));

  public static final FieldFallback CONDITION_VERSION = FieldFallback.of("conditionVersion",
      field("conditionVersion"),
      field("properties", "conditionVersion"));

  public static final FieldFallback ENFORCEMENT_MODE = FieldFallback.of("enforcementMode",
      field("enforcementMode"),
      field("properties", "enforcementMode"));

  private AssignmentFields() {
  }
}
