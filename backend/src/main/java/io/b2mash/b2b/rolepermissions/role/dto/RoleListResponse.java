package io.b2mash.b2b.rolepermissions.role.dto;

import java.util.List;

public record RoleListResponse(
    List<SystemRoleResponse> systemRoles, List<CustomRoleResponse> customRoles) {}
