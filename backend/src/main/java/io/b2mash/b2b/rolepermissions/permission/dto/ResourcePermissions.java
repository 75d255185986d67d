package io.b2mash.b2b.rolepermissions.permission.dto;

import java.util.List;

public record ResourcePermissions(String resourceType, List<PermissionEntry> permissions) {}
