package io.b2mash.b2b.rolepermissions.permission;

import java.util.Arrays;
import java.util.Optional;

/**
 * System roles. Used both as a member's top-level workspace role and as the inheritance source of a
 * custom role. {@link #NONE} only appears as a custom role's base and inherits nothing.
 */
public enum BaseRole {
  OWNER("owner"),
  ADMIN("admin"),
  DEVELOPER("developer"),
  VIEWER("viewer"),
  NONE("none");

  private final String value;

  BaseRole(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public boolean isSystemRole() {
    return this != NONE;
  }

  public static Optional<BaseRole> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(r -> r.value.equalsIgnoreCase(value)).findFirst();
  }
}
