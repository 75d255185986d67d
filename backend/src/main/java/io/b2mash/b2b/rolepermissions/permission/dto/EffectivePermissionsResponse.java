package io.b2mash.b2b.rolepermissions.permission.dto;

import java.util.List;
import java.util.UUID;

public record EffectivePermissionsResponse(
    UUID userId,
    UUID workspaceId,
    String systemRole,
    UUID customRoleId,
    String customRoleName,
    List<ResourcePermissions> resources) {}
