package io.b2mash.b2b.rolepermissions.role;

import java.util.List;
import java.util.Locale;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Limits applied to custom roles.
 *
 * @param maxCustomRolesPerWorkspace cap on stored custom roles per workspace
 * @param reservedNames names that custom roles may not use, compared case-insensitively
 */
@ConfigurationProperties(prefix = "roles")
public record RolePolicyProperties(int maxCustomRolesPerWorkspace, List<String> reservedNames) {

  public RolePolicyProperties {
    if (maxCustomRolesPerWorkspace <= 0) {
      maxCustomRolesPerWorkspace = 20;
    }
    if (reservedNames == null || reservedNames.isEmpty()) {
      reservedNames = List.of("owner", "admin", "developer", "viewer");
    }
    reservedNames = reservedNames.stream().map(n -> n.toLowerCase(Locale.ROOT)).toList();
  }

  public boolean isReserved(String name) {
    return name != null && reservedNames.contains(name.toLowerCase(Locale.ROOT));
  }
}
