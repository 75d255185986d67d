package io.b2mash.b2b.rolepermissions.role.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record CloneCustomRoleRequest(
    @NotBlank
        @Size(min = 2, max = 50)
        @Pattern(
            regexp = "^[a-z0-9]+(-[a-z0-9]+)*$",
            message = "must be lowercase letters, digits and single hyphens")
        String name,
    @NotBlank @Size(max = 100) String displayName,
    @Size(max = 500) String description) {}
