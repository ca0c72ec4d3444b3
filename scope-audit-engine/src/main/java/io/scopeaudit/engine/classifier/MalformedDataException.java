// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.engine.classifier;

/**
 * Thrown when a provider value cannot be interpreted. Classification catches it and degrades
 * the record instead of failing the scope.
 */
public class MalformedDataException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final String field;

  public MalformedDataException(String field, String message) {
    super(message);
    this.field = field;
  }

  public String field() {
    return field;
  }
}
