package io.b2mash.b2b.rolepermissions.roletemplate;

import io.b2mash.b2b.rolepermissions.permission.BaseRole;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A role archetype: a base role plus the permission values the template wants, keyed by resource
 * type and permission name. Resources the template does not mention are left to the base role.
 */
public record RoleTemplate(
    String id,
    String name,
    String displayName,
    String description,
    String color,
    String icon,
    BaseRole baseRole,
    Map<String, Map<String, Boolean>> permissions) {

  /** Same template with a permission map the caller is free to modify. */
  public RoleTemplate copy() {
    return new RoleTemplate(
        id, name, displayName, description, color, icon, baseRole, deepCopy(permissions));
  }

  RoleTemplate frozen() {
    var frozen = new LinkedHashMap<String, Map<String, Boolean>>();
    permissions.forEach(
        (resource, perms) ->
            frozen.put(resource, Collections.unmodifiableMap(new LinkedHashMap<>(perms))));
    return new RoleTemplate(
        id,
        name,
        displayName,
        description,
        color,
        icon,
        baseRole,
        Collections.unmodifiableMap(frozen));
  }

  static Map<String, Map<String, Boolean>> deepCopy(Map<String, Map<String, Boolean>> source) {
    var copy = new LinkedHashMap<String, Map<String, Boolean>>();
    if (source != null) {
      source.forEach((resource, perms) -> copy.put(resource, new LinkedHashMap<>(perms)));
    }
    return copy;
  }
}
