package io.b2mash.b2b.rolepermissions.role.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Partial update. Null fields are left unchanged; to remove inheritance set {@code baseRole} to
 * {@code none}.
 */
public record UpdateCustomRoleRequest(
    @Size(min = 2, max = 50)
        @Pattern(
            regexp = "^[a-z0-9]+(-[a-z0-9]+)*$",
            message = "must be lowercase letters, digits and single hyphens")
        String name,
    @Size(min = 1, max = 100) String displayName,
    @Size(max = 500) String description,
    @Pattern(regexp = "^#[0-9a-fA-F]{6}$", message = "must be a hex color such as #6366f1")
        String color,
    String icon,
    String baseRole,
    Boolean isActive) {}
