package io.b2mash.b2b.rolepermissions.roletemplate;

import java.util.Map;

/** JSON shape of a file under {@code role-templates/}. */
public record RoleTemplateDefinition(
    String id,
    String name,
    String displayName,
    String description,
    String color,
    String icon,
    String baseRole,
    Map<String, Map<String, Boolean>> permissions) {}
