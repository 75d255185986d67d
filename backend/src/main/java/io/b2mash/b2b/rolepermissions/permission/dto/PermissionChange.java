package io.b2mash.b2b.rolepermissions.permission.dto;

/**
 * Result of setting a single override.
 *
 * @param before previous explicit value; null when the permission was inherited
 */
public record PermissionChange(
    String resourceType, String permission, Boolean before, boolean after) {}
