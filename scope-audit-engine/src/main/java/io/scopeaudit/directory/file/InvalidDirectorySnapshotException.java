// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.directory.file;

import org.apache.kafka.common.config.ConfigException;

public class InvalidDirectorySnapshotException extends ConfigException {

  private static final long serialVersionUID = 1L;

  public InvalidDirectorySnapshotException(String message) {
    super(message);
  }

  public InvalidDirectorySnapshotException(String message, Throwable cause) {
    super(message);
    initCause(cause);
  }
}
