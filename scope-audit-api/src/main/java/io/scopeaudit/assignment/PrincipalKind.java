// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.assignment;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Identity kind of an assignment's principal. Well-known kinds are mapped from the provider's
 * principal type through a fixed table. Types outside the table are kept as reported so that
 * principal kinds introduced by the provider later show up in reports instead of failing.
 */
public class PrincipalKind {
  public static final PrincipalKind USER = new PrincipalKind("User");
  public static final PrincipalKind GROUP = new PrincipalKind("Group");
  public static final PrincipalKind SERVICE_PRINCIPAL = new PrincipalKind("ServicePrincipal");
  public static final PrincipalKind MANAGED_IDENTITY = new PrincipalKind("ManagedIdentity");
  public static final PrincipalKind UNKNOWN = new PrincipalKind("Unknown");

  private static final Map<String, PrincipalKind> KNOWN_TYPES;

  static {
    Map<String, PrincipalKind> types = new HashMap<>();
    types.put("user", USER);
    types.put("member", USER);
    types.put("group", GROUP);
    types.put("securitygroup", GROUP);
    types.put("serviceprincipal", SERVICE_PRINCIPAL);
    types.put("application", SERVICE_PRINCIPAL);
    types.put("managedidentity", MANAGED_IDENTITY);
    types.put("managedserviceidentity", MANAGED_IDENTITY);
    types.put("msi", MANAGED_IDENTITY);
    types.put("systemassigned", MANAGED_IDENTITY);
    types.put("userassigned", MANAGED_IDENTITY);
    types.put("unknown", UNKNOWN);
    KNOWN_TYPES = Collections.unmodifiableMap(types);
  }

  private final String name;

  public PrincipalKind(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  /**
   * Maps a provider principal type to a kind. Empty types map to {@link #UNKNOWN}, types
   * outside the table pass through unchanged.
   */
  public static PrincipalKind fromProviderType(String providerType) {
    if (providerType == null || providerType.trim().isEmpty())
      return UNKNOWN;
    String key = providerType.trim().toLowerCase(Locale.ROOT).replace("_", "").replace(" ", "");
    PrincipalKind kind = KNOWN_TYPES.get(key);
    return kind != null ? kind : new PrincipalKind(providerType.trim());
  }

  public String name() {
    return name;
  }

  public boolean isWellKnown() {
    return KNOWN_TYPES.containsValue(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PrincipalKind)) {
      return false;
    }

    PrincipalKind that = (PrincipalKind) o;
    return Objects.equals(this.name, that.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name);
  }

  @Override
  public String toString() {
    return name;
  }
}
