package io.b2mash.b2b.rolepermissions.permissionaudit;

public enum PermissionAuditEventType {
  ROLE_CREATED,
  ROLE_UPDATED,
  ROLE_DELETED,
  PERMISSION_GRANTED,
  PERMISSION_REVOKED,
  PERMISSION_BULK_UPDATED,
  MEMBER_ROLE_CHANGED,
  ACCESS_DENIED_PERMISSION
}
