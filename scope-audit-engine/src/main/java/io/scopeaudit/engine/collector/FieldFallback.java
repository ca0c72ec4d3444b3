// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.engine.collector;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered list of accessors for one canonical field. The first accessor yielding a non-empty
 * value wins.
 */
public class FieldFallback {

  private final String fieldName;
  private final List<FieldAccessor> accessors;

  public FieldFallback(String fieldName, List<FieldAccessor> accessors) {
    if (accessors.isEmpty())
      throw new IllegalArgumentException("No accessors provided for field " + fieldName);
    this.fieldName = fieldName;
    this.accessors = ImmutableList.copyOf(accessors);
  }

  public static FieldFallback of(String fieldName, FieldAccessor... accessors) {
    return new FieldFallback(fieldName, ImmutableList.copyOf(accessors));
  }

  public Optional<String> resolve(JsonNode payload) {
    for (FieldAccessor accessor : accessors) {
      Optional<String> value = accessor.read(payload);
      if (value.isPresent())
        return value;
    }
    return Optional.empty();
  }

  public String resolveOrNull(JsonNode payload) {
    return resolve(payload).orElse(null);
  }

  public String resolveOrDefault(JsonNode payload, String defaultValue) {
    return resolve(payload).orElse(defaultValue);
  }

  public String fieldName() {
    return fieldName;
  }

  public List<FieldAccessor> accessors() {
    return accessors;
  }

  @Override
  public String toString() {
    return fieldName + accessors;
  }
}
