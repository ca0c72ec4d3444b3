// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.scope;

import org.apache.kafka.common.config.ConfigException;

/**
 * Thrown when a scope identifier supplied by the caller cannot be used, for example an
 * empty root id. Raised before any remote call of an audit run is issued.
 */
public class InvalidScopeException extends ConfigException {

  private static final long serialVersionUID = 1L;

  public InvalidScopeException(String message) {
    super(message);
  }
}
