// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.engine.collector;

import static io.scopeaudit.engine.collector.FieldAccessor.field;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import com.fasterxml.jackson.databind.JsonNode;
import io.scopeaudit.utils.JsonMapper;
import java.util.Optional;
import org.junit.Test;

public class FieldFallbackTest {

  private static final String SUBSCRIPTION = "/subscriptions/1234";

  @Test
  public void testFirstNonEmptyValueWins() throws Exception {
    FieldFallback fallback = FieldFallback.of("displayName",
        field("displayName"), field("properties", "displayName"), field("name"));

    assertEquals(Optional.of("Reader"), fallback.resolve(json("{\"displayName\": \"Reader\", \"name\": \"r\"}")));
    assertEquals(Optional.of("Nested"), fallback.resolve(
        json("{\"displayName\": \"  \", \"properties\": {\"displayName\": \"Nested\"}, \"name\": \"r\"}")));
    assertEquals(Optional.of("r"), fallback.resolve(json("{\"displayName\": null, \"name\": \"r\"}")));
    assertFalse(fallback.resolve(json("{\"properties\": \"not an object\"}")).isPresent());
    assertEquals("default", fallback.resolveOrDefault(json("{}"), "default"));
  }

  @Test
  public void testStructuredValuesAreIgnored() throws Exception {
    FieldFallback fallback = FieldFallback.of("scope", field("scope"), field("fallback"));
    assertEquals("f", fallback.resolveOrNull(json("{\"scope\": {\"id\": 1}, \"fallback\": \"f\"}")));
    assertEquals("42", fallback.resolveOrNull(json("{\"scope\": 42}")));
  }

  @Test
  public void testScopePathResolution() throws Exception {
    assertEquals(SUBSCRIPTION, AssignmentFields.SCOPE_PATH.resolveOrNull(
        json("{\"scope\": \"" + SUBSCRIPTION + "\", \"properties\": {\"scope\": \"other\"}}")));
    assertEquals(SUBSCRIPTION, AssignmentFields.SCOPE_PATH.resolveOrNull(
        json("{\"properties\": {\"scope\": \"" + SUBSCRIPTION + "\"}}")));
    assertEquals(SUBSCRIPTION, AssignmentFields.SCOPE_PATH.resolveOrNull(
        json("{\"id\": \"" + SUBSCRIPTION + "/providers/Microsoft.Authorization/roleAssignments/abc\"}")));
    assertEquals(SUBSCRIPTION + "/resourceGroups/rg1", AssignmentFields.SCOPE_PATH.resolveOrNull(
        json("{\"resourceId\": \"" + SUBSCRIPTION + "/resourceGroups/rg1/grant\"}")));
    // A plain name has no trailing segment to trim
    assertFalse(AssignmentFields.SCOPE_PATH.resolve(json("{\"id\": \"abc\"}")).isPresent());
  }

  @Test
  public void testNameFallsBackToLastIdSegment() throws Exception {
    assertEquals("abc", AssignmentFields.NAME.resolveOrNull(
        json("{\"id\": \"" + SUBSCRIPTION + "/providers/Microsoft.Authorization/roleAssignments/abc\"}")));
  }

  private static JsonNode json(String value) throws Exception {
    return JsonMapper.objectMapper().readTree(value);
  }
}
