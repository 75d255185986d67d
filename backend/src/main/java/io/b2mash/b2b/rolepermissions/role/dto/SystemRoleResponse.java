package io.b2mash.b2b.rolepermissions.role.dto;

import io.b2mash.b2b.rolepermissions.role.SystemRoleDefinition;

public record SystemRoleResponse(
    String name,
    String displayName,
    String description,
    String color,
    String icon,
    boolean isSystem,
    long memberCount) {

  public static SystemRoleResponse from(SystemRoleDefinition definition, long memberCount) {
    return new SystemRoleResponse(
        definition.role().value(),
        definition.displayName(),
        definition.description(),
        definition.color(),
        definition.icon(),
        true,
        memberCount);
  }
}
