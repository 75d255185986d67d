package io.b2mash.b2b.rolepermissions.role;

import io.b2mash.b2b.rolepermissions.permission.BaseRole;
import java.util.List;

/** Display metadata of the built-in roles. These are never stored as custom role rows. */
public record SystemRoleDefinition(
    BaseRole role, String displayName, String description, String color, String icon) {

  public static final List<SystemRoleDefinition> ALL =
      List.of(
          new SystemRoleDefinition(
              BaseRole.OWNER,
              "Owner",
              "Full access to all workspace features and settings",
              "#ef4444",
              "crown"),
          new SystemRoleDefinition(
              BaseRole.ADMIN,
              "Admin",
              "Manage workspace settings, members, and projects",
              "#f59e0b",
              "shield"),
          new SystemRoleDefinition(
              BaseRole.DEVELOPER,
              "Developer",
              "Create and manage projects and agents",
              "#3b82f6",
              "code"),
          new SystemRoleDefinition(
              BaseRole.VIEWER,
              "Viewer",
              "Read-only access to workspace content",
              "#6b7280",
              "eye"));
}
