// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.engine.collector;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Reads one provider field from an assignment payload. Accessors return empty for missing,
 * null and blank values so that they can be chained in a {@link FieldFallback}.
 */
public abstract class FieldAccessor {

  private final String description;

  protected FieldAccessor(String description) {
    this.description = Objects.requireNonNull(description, "description");
  }

  public abstract Optional<String> read(JsonNode payload);

  /**
   * Returns an accessor for the textual value at a nested field path, e.g.
   * {@code field("properties", "scope")}. Numbers and booleans are read as text.
   */
  public static FieldAccessor field(String... path) {
    String[] fieldPath = Arrays.copyOf(path, path.length);
    return new FieldAccessor(String.join(".", fieldPath)) {
      @Override
      public Optional<String> read(JsonNode payload) {
        JsonNode node = node(payload, fieldPath);
        if (node == null || !node.isValueNode() || node.isNull())
          return Optional.empty();
        String value = node.asText().trim();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
      }
    };
  }

  /**
   * Returns an accessor that applies a transformation to the value read by another accessor.
   * A transformation returning null or blank yields empty.
   */
  public static FieldAccessor derived(String description,
                                      FieldAccessor source,
                                      Function<String, String> transformation) {
    return new FieldAccessor(description + "(" + source.description + ")") {
      @Override
      public Optional<String> read(JsonNode payload) {
        return source.read(payload)
            .map(transformation)
            .map(String::trim)
            .filter(value -> !value.isEmpty());
      }
    };
  }

  static JsonNode node(JsonNode payload, String... path) {
    JsonNode node = payload;
    for (String name : path) {
      if (node == null || !node.isObject())
        return null;
      node = node.get(name);
    }
    return node;
  }

  public String description() {
    return description;
  }

  @Override
  public String toString() {
    return description;
  }
}
