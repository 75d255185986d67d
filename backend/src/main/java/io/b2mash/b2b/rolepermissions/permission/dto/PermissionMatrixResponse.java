package io.b2mash.b2b.rolepermissions.permission.dto;

import java.util.List;
import java.util.UUID;

public record PermissionMatrixResponse(
    UUID roleId,
    String roleName,
    String displayName,
    String baseRole,
    List<ResourcePermissions> resources) {}
