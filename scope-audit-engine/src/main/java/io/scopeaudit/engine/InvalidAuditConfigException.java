// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.engine;

import org.apache.kafka.common.config.ConfigException;

/**
 * Audit options that contradict each other. Raised before any remote call is issued.
 */
public class InvalidAuditConfigException extends ConfigException {

  private static final long serialVersionUID = 1L;

  public InvalidAuditConfigException(String message) {
    super(message);
  }
}
