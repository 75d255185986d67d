package io.b2mash.b2b.rolepermissions.permissionaudit;

import java.util.Map;
import java.util.UUID;

/**
 * Input to {@link PermissionAuditService#record(PermissionAuditEventRecord)}.
 *
 * @param beforeState state prior to the change; null for creations
 * @param afterState state after the change; null for deletions
 */
public record PermissionAuditEventRecord(
    UUID workspaceId,
    PermissionAuditEventType eventType,
    UUID actorId,
    UUID targetUserId,
    UUID targetRoleId,
    Map<String, Object> beforeState,
    Map<String, Object> afterState) {

  public static PermissionAuditEventRecord forRole(
      UUID workspaceId,
      PermissionAuditEventType eventType,
      UUID actorId,
      UUID targetRoleId,
      Map<String, Object> beforeState,
      Map<String, Object> afterState) {
    return new PermissionAuditEventRecord(
        workspaceId, eventType, actorId, null, targetRoleId, beforeState, afterState);
  }
}
