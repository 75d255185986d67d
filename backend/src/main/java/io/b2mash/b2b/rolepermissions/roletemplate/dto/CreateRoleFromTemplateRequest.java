package io.b2mash.b2b.rolepermissions.roletemplate.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.Map;

/**
 * Instantiates a template. Fields left null fall back to the template's values.
 *
 * @param customizations permission values that replace the template's for matching entries
 */
public record CreateRoleFromTemplateRequest(
    @NotBlank String templateId,
    @Size(min = 2, max = 50) String name,
    @Size(max = 100) String displayName,
    @Size(max = 500) String description,
    String color,
    String icon,
    Map<String, Map<String, Boolean>> customizations) {}
