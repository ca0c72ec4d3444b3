// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.engine.walker;

import io.scopeaudit.engine.AuditConfig;
import io.scopeaudit.scope.ScopeKind;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Decides which scope kinds the walker expands into their children. Scopes of other kinds are
 * reported as leaves. Management groups are always expanded and resources never are.
 */
public class ExpansionPolicy {

  private final Set<ScopeKind> expandableKinds;

  public ExpansionPolicy(boolean includeSubscriptions, boolean includeResourceGroups) {
    Set<ScopeKind> kinds = EnumSet.of(ScopeKind.MANAGEMENT_GROUP);
    if (includeSubscriptions) {
      kinds.add(ScopeKind.SUBSCRIPTION);
      if (includeResourceGroups)
        kinds.add(ScopeKind.RESOURCE_GROUP);
    }
    this.expandableKinds = Collections.unmodifiableSet(kinds);
  }

  public static ExpansionPolicy fromConfig(AuditConfig config) {
    return new ExpansionPolicy(config.includeSubscriptions, config.includeResourceGroups);
  }

  public boolean isExpandable(ScopeKind kind) {
    return expandableKinds.contains(kind);
  }

  public Set<ScopeKind> expandableKinds() {
    return expandableKinds;
  }

  @Override
  public String toString() {
    return "ExpansionPolicy(" + expandableKinds + ")";
  }
}
