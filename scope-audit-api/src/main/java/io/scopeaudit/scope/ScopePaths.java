// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.scope;

import java.util.Locale;

/**
 * Helpers for resource-id-like scope strings such as
 * {@code /providers/Microsoft.Management/managementGroups/it-div} or
 * {@code /subscriptions/1234/resourceGroups/rg1}. Plain scope names like {@code it-div} are
 * also accepted, in which case only canonicalization applies.
 */
public final class ScopePaths {

  public static final String UNKNOWN_SCOPE_PATH = "Unknown";

  private static final String PATH_DELIMITER = "/";
  private static final String MANAGEMENT_GROUPS_SEGMENT = "/managementgroups/";
  private static final String SUBSCRIPTIONS_SEGMENT = "/subscriptions/";
  private static final String RESOURCE_GROUPS_SEGMENT = "/resourcegroups/";
  private static final String PROVIDERS_SEGMENT = "/providers/";
  private static final String AUTHORIZATION_PROVIDER_SEGMENT = "/providers/microsoft.authorization/";

  private ScopePaths() {
  }

  /**
   * Returns the form used for scope comparisons: trimmed, without trailing delimiters and
   * lower case. Directory services treat scope identifiers case-insensitively.
   */
  public static String canonical(String scopePath) {
    if (scopePath == null)
      return "";
    String path = scopePath.trim();
    while (path.length() > 1 && path.endsWith(PATH_DELIMITER))
      path = path.substring(0, path.length() - 1);
    return path.toLowerCase(Locale.ROOT);
  }

  public static boolean sameScope(String first, String second) {
    return canonical(first).equals(canonical(second));
  }

  public static boolean isManagementGroupPath(String scopePath) {
    String path = canonical(scopePath);
    return path.contains(MANAGEMENT_GROUPS_SEGMENT) && !path.contains(SUBSCRIPTIONS_SEGMENT);
  }

  /**
   * Returns the last segment of a path, which is the scope's own name for resource-id-like
   * paths and the path itself for plain names.
   */
  public static String lastSegment(String scopePath) {
    String path = scopePath == null ? "" : scopePath.trim();
    while (path.length() > 1 && path.endsWith(PATH_DELIMITER))
      path = path.substring(0, path.length() - 1);
    int index = path.lastIndexOf(PATH_DELIMITER);
    return index < 0 ? path : path.substring(index + 1);
  }

  /**
   * Derives the scope a grant is bound to from the grant's own resource id. Grants are
   * children of the authorization provider of their scope, e.g.
   * {@code /subscriptions/1/providers/Microsoft.Authorization/roleAssignments/abc} is bound to
   * {@code /subscriptions/1}. Ids without the provider segment lose their trailing segment.
   *
   * @return the scope path, or null if nothing remains after trimming
   */
  public static String trimTrailingSegment(String resourceId) {
    if (resourceId == null)
      return null;
    String path = resourceId.trim();
    while (path.length() > 1 && path.endsWith(PATH_DELIMITER))
      path = path.substring(0, path.length() - 1);
    int providerIndex = path.toLowerCase(Locale.ROOT).lastIndexOf(AUTHORIZATION_PROVIDER_SEGMENT);
    if (providerIndex == 0)
      return PATH_DELIMITER;
    if (providerIndex > 0)
      return path.substring(0, providerIndex);
    int index = path.lastIndexOf(PATH_DELIMITER);
    if (index < 0)
      return null;
    return index == 0 ? PATH_DELIMITER : path.substring(0, index);
  }

  /**
   * Infers the kind of a scope from its identifier. Used for roots, which are named by the
   * caller without any directory metadata. Plain names are treated as management groups.
   */
  public static ScopeKind inferKind(String scopeId) {
    String path = canonical(scopeId);
    int subscriptionIndex = path.indexOf(SUBSCRIPTIONS_SEGMENT);
    if (path.startsWith("subscriptions/"))
      subscriptionIndex = 0;
    if (subscriptionIndex < 0)
      return ScopeKind.MANAGEMENT_GROUP;
    String remainder = path.substring(subscriptionIndex);
    int resourceGroupIndex = remainder.indexOf(RESOURCE_GROUPS_SEGMENT);
    if (resourceGroupIndex < 0)
      return ScopeKind.SUBSCRIPTION;
    if (remainder.indexOf(PROVIDERS_SEGMENT, resourceGroupIndex) < 0)
      return ScopeKind.RESOURCE_GROUP;
    return ScopeKind.RESOURCE;
  }
}
