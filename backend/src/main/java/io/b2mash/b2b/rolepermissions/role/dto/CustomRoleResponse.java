package io.b2mash.b2b.rolepermissions.role.dto;

import io.b2mash.b2b.rolepermissions.role.CustomRole;
import java.time.Instant;
import java.util.UUID;

public record CustomRoleResponse(
    UUID id,
    UUID workspaceId,
    String name,
    String displayName,
    String description,
    String color,
    String icon,
    String baseRole,
    boolean isSystem,
    boolean isActive,
    int priority,
    String templateId,
    UUID createdBy,
    long memberCount,
    Instant createdAt,
    Instant updatedAt) {

  public static CustomRoleResponse from(CustomRole role, long memberCount) {
    return new CustomRoleResponse(
        role.getId(),
        role.getWorkspaceId(),
        role.getName(),
        role.getDisplayName(),
        role.getDescription(),
        role.getColor(),
        role.getIcon(),
        role.getBaseRole() != null ? role.getBaseRole().value() : null,
        role.isSystem(),
        role.isActive(),
        role.getPriority(),
        role.getTemplateId(),
        role.getCreatedBy(),
        memberCount,
        role.getCreatedAt(),
        role.getUpdatedAt());
  }
}
