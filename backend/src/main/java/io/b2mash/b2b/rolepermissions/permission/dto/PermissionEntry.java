package io.b2mash.b2b.rolepermissions.permission.dto;

/**
 * One resolved permission.
 *
 * @param inherited true when the value came from a base role rather than an explicit override
 * @param inheritedFrom base role the value was inherited from; null for explicit or denied entries
 */
public record PermissionEntry(
    String permission, boolean granted, boolean inherited, String inheritedFrom) {

  public static PermissionEntry explicit(String permission, boolean granted) {
    return new PermissionEntry(permission, granted, false, null);
  }

  public static PermissionEntry denied(String permission) {
    return new PermissionEntry(permission, false, false, null);
  }
}
