package io.b2mash.b2b.rolepermissions.permission;

import java.util.UUID;

/**
 * Published whenever the effective permissions of a workspace may have changed. Handled after the
 * publishing transaction commits.
 *
 * @param awaitInvalidation when true the cache is cleared on the publishing thread before the
 *     operation returns; otherwise invalidation runs in the background
 */
public record RolePermissionsChangedEvent(
    UUID workspaceId, UUID roleId, String reason, boolean awaitInvalidation) {

  public static RolePermissionsChangedEvent background(
      UUID workspaceId, UUID roleId, String reason) {
    return new RolePermissionsChangedEvent(workspaceId, roleId, reason, false);
  }

  public static RolePermissionsChangedEvent immediate(
      UUID workspaceId, UUID roleId, String reason) {
    return new RolePermissionsChangedEvent(workspaceId, roleId, reason, true);
  }
}
