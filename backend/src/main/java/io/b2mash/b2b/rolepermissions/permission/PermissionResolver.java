package io.b2mash.b2b.rolepermissions.permission;

import io.b2mash.b2b.rolepermissions.permission.dto.PermissionEntry;
import io.b2mash.b2b.rolepermissions.permission.dto.ResourcePermissions;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolution order shared by the matrix view, the effective-permissions view and the point check:
 * owner membership grants everything, then an explicit override, then the base role default, then
 * deny.
 */
public final class PermissionResolver {

  private PermissionResolver() {}

  /** Identifies one catalog pair. */
  public record PermissionKey(String resourceType, String permission) {}

  public static Map<PermissionKey, Boolean> indexOverrides(Collection<RolePermission> overrides) {
    var index = new HashMap<PermissionKey, Boolean>();
    for (RolePermission override : overrides) {
      index.put(
          new PermissionKey(override.getResourceType(), override.getPermission()),
          override.isGranted());
    }
    return index;
  }

  /** Resolves one pair for a role with the given overrides and (nullable) base role. */
  public static PermissionEntry resolve(
      BaseRole baseRole,
      Map<PermissionKey, Boolean> overrides,
      ResourceType resourceType,
      String permission) {
    Boolean explicit = overrides.get(new PermissionKey(resourceType.value(), permission));
    if (explicit != null) {
      return PermissionEntry.explicit(permission, explicit);
    }
    return inherit(baseRole, resourceType, permission);
  }

  public static PermissionEntry inherit(
      BaseRole baseRole, ResourceType resourceType, String permission) {
    return BaseRoleDefaults.lookup(baseRole, resourceType, permission)
        .map(granted -> new PermissionEntry(permission, granted, true, baseRole.value()))
        .orElseGet(() -> PermissionEntry.denied(permission));
  }

  /** Full catalog resolved for a role. */
  public static List<ResourcePermissions> resolveAll(
      BaseRole baseRole, Map<PermissionKey, Boolean> overrides) {
    var resources = new ArrayList<ResourcePermissions>();
    for (ResourceType resourceType : ResourceType.values()) {
      var entries = new ArrayList<PermissionEntry>();
      for (String permission : resourceType.permissions()) {
        entries.add(resolve(baseRole, overrides, resourceType, permission));
      }
      resources.add(new ResourcePermissions(resourceType.value(), List.copyOf(entries)));
    }
    return List.copyOf(resources);
  }

  /** Full catalog for an owner member. Every entry granted, no lookup. */
  public static List<ResourcePermissions> ownerGrants() {
    var resources = new ArrayList<ResourcePermissions>();
    for (ResourceType resourceType : ResourceType.values()) {
      var entries =
          resourceType.permissions().stream()
              .map(p -> new PermissionEntry(p, true, true, BaseRole.OWNER.value()))
              .toList();
      resources.add(new ResourcePermissions(resourceType.value(), entries));
    }
    return List.copyOf(resources);
  }
}
