package io.b2mash.b2b.rolepermissions.permission;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Permissions each base role grants when a role carries no explicit override. Every base role has
 * an entry for every catalog pair; anything not granted below is denied.
 */
public final class BaseRoleDefaults {

  private static final Map<BaseRole, Map<ResourceType, Map<String, Boolean>>> DEFAULTS =
      buildDefaults();

  private BaseRoleDefaults() {}

  /**
   * Looks up the inherited value of one permission. Empty when the resource/permission pair is not
   * in the catalog.
   */
  public static Optional<Boolean> lookup(
      BaseRole baseRole, ResourceType resourceType, String permission) {
    if (baseRole == null || resourceType == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(DEFAULTS.get(baseRole).get(resourceType).get(permission));
  }

  /** The full default map of one base role, keyed by resource wire value. Mutable copy. */
  public static Map<String, Map<String, Boolean>> snapshot(BaseRole baseRole) {
    var copy = new LinkedHashMap<String, Map<String, Boolean>>();
    DEFAULTS
        .get(baseRole)
        .forEach((resource, perms) -> copy.put(resource.value(), new LinkedHashMap<>(perms)));
    return copy;
  }

  /** Defaults for every base role, keyed by wire values. Mutable deep copy. */
  public static Map<String, Map<String, Map<String, Boolean>>> snapshot() {
    var copy = new LinkedHashMap<String, Map<String, Map<String, Boolean>>>();
    for (BaseRole role : BaseRole.values()) {
      copy.put(role.value(), snapshot(role));
    }
    return copy;
  }

  private static Map<BaseRole, Map<ResourceType, Map<String, Boolean>>> buildDefaults() {
    var defaults = new EnumMap<BaseRole, Map<ResourceType, Map<String, Boolean>>>(BaseRole.class);

    defaults.put(BaseRole.OWNER, grantAll(Set.of()));
    defaults.put(
        BaseRole.ADMIN, grantAll(Set.of("secrets.view_plaintext", "workspace.manage_billing")));

    var developer = new EnumMap<ResourceType, Map<String, Boolean>>(ResourceType.class);
    developer.put(ResourceType.PROJECTS, grant(ResourceType.PROJECTS, "create", "read", "update"));
    developer.put(
        ResourceType.AGENTS,
        grant(ResourceType.AGENTS, "view", "create_custom", "assign_tasks", "pause_cancel"));
    developer.put(
        ResourceType.STORIES,
        grant(ResourceType.STORIES, "create", "read", "update", "assign", "change_status"));
    developer.put(ResourceType.DEPLOYMENTS, grant(ResourceType.DEPLOYMENTS, "view", "trigger"));
    developer.put(ResourceType.SECRETS, grant(ResourceType.SECRETS, "view_masked"));
    developer.put(ResourceType.INTEGRATIONS, grant(ResourceType.INTEGRATIONS, "view"));
    developer.put(ResourceType.WORKSPACE, grant(ResourceType.WORKSPACE, "view_members"));
    developer.put(
        ResourceType.COST_MANAGEMENT, grant(ResourceType.COST_MANAGEMENT, "view_own_usage"));
    defaults.put(BaseRole.DEVELOPER, Collections.unmodifiableMap(developer));

    var viewer = new EnumMap<ResourceType, Map<String, Boolean>>(ResourceType.class);
    viewer.put(ResourceType.PROJECTS, grant(ResourceType.PROJECTS, "read"));
    viewer.put(ResourceType.AGENTS, grant(ResourceType.AGENTS, "view"));
    viewer.put(ResourceType.STORIES, grant(ResourceType.STORIES, "read"));
    viewer.put(ResourceType.DEPLOYMENTS, grant(ResourceType.DEPLOYMENTS, "view"));
    viewer.put(ResourceType.SECRETS, grant(ResourceType.SECRETS));
    viewer.put(ResourceType.INTEGRATIONS, grant(ResourceType.INTEGRATIONS, "view"));
    viewer.put(ResourceType.WORKSPACE, grant(ResourceType.WORKSPACE, "view_members"));
    viewer.put(
        ResourceType.COST_MANAGEMENT, grant(ResourceType.COST_MANAGEMENT, "view_own_usage"));
    defaults.put(BaseRole.VIEWER, Collections.unmodifiableMap(viewer));

    var none = new EnumMap<ResourceType, Map<String, Boolean>>(ResourceType.class);
    for (ResourceType resource : ResourceType.values()) {
      none.put(resource, grant(resource));
    }
    defaults.put(BaseRole.NONE, Collections.unmodifiableMap(none));

    return Collections.unmodifiableMap(defaults);
  }

  private static Map<ResourceType, Map<String, Boolean>> grantAll(Set<String> except) {
    var map = new EnumMap<ResourceType, Map<String, Boolean>>(ResourceType.class);
    for (ResourceType resource : ResourceType.values()) {
      var perms = new LinkedHashMap<String, Boolean>();
      for (String permission : resource.permissions()) {
        perms.put(permission, !except.contains(resource.value() + "." + permission));
      }
      map.put(resource, Collections.unmodifiableMap(perms));
    }
    return Collections.unmodifiableMap(map);
  }

  private static Map<String, Boolean> grant(ResourceType resource, String... granted) {
    var grantedSet = Set.of(granted);
    var perms = new LinkedHashMap<String, Boolean>();
    for (String permission : resource.permissions()) {
      perms.put(permission, grantedSet.contains(permission));
    }
    return Collections.unmodifiableMap(perms);
  }
}
