package io.b2mash.b2b.rolepermissions.permission.dto;

import jakarta.validation.constraints.NotBlank;

public record SetPermissionRequest(
    @NotBlank String resourceType, @NotBlank String permission, boolean granted) {}
