// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.assignment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.Objects;

/**
 * An assignment as returned by the directory service, before normalization. The payload keeps
 * the provider's field layout, which differs between categories and API versions.
 */
public class RawAssignment {

  private final AssignmentCategory category;
  private final JsonNode payload;

  public RawAssignment(AssignmentCategory category, JsonNode payload) {
    this.category = Objects.requireNonNull(category, "category");
    this.payload = payload == null ? JsonNodeFactory.instance.objectNode() : payload.deepCopy();
  }

  public AssignmentCategory category() {
    return category;
  }

  public JsonNode payload() {
    return payload;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RawAssignment)) {
      return false;
    }

    RawAssignment that = (RawAssignment) o;
    return category == that.category && Objects.equals(payload, that.payload);
  }

  @Override
  public int hashCode() {
    return Objects.hash(category, payload);
  }

  @Override
  public String toString() {
    return "RawAssignment(" +
        "category=" + category +
        ", payload=" + payload +
        ')';
  }
}
