package io.b2mash.b2b.rolepermissions.permission;

public enum BulkResourceAction {
  ALLOW_ALL,
  DENY_ALL
}
