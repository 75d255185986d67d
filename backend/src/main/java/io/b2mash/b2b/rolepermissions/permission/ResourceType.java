package io.b2mash.b2b.rolepermissions.permission;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/** Fixed catalog of resource domains and the permissions each one understands. */
public enum ResourceType {
  PROJECTS(
      "projects",
      "Projects",
      "Create and manage projects",
      List.of("create", "read", "update", "delete", "manage_settings")),
  AGENTS(
      "agents",
      "Agents",
      "View, configure and direct AI agents",
      List.of("view", "create_custom", "assign_tasks", "pause_cancel", "configure")),
  STORIES(
      "stories",
      "Stories",
      "Work items within projects",
      List.of("create", "read", "update", "delete", "assign", "change_status")),
  DEPLOYMENTS(
      "deployments",
      "Deployments",
      "Deployment pipelines and releases",
      List.of("view", "trigger", "approve", "rollback", "configure")),
  SECRETS(
      "secrets",
      "Secrets",
      "Credentials and environment secrets",
      List.of("view_masked", "create", "update", "delete", "view_plaintext")),
  INTEGRATIONS(
      "integrations",
      "Integrations",
      "Third-party service connections",
      List.of("view", "connect", "disconnect", "configure")),
  WORKSPACE(
      "workspace",
      "Workspace",
      "Workspace membership and settings",
      List.of(
          "view_members",
          "invite_members",
          "remove_members",
          "manage_roles",
          "manage_billing",
          "view_audit_log",
          "manage_settings")),
  COST_MANAGEMENT(
      "cost_management",
      "Cost Management",
      "Usage tracking and budgets",
      List.of("view_own_usage", "view_workspace_usage", "set_budgets", "export_reports"));

  private final String value;
  private final String displayName;
  private final String description;
  private final List<String> permissions;

  ResourceType(String value, String displayName, String description, List<String> permissions) {
    this.value = value;
    this.displayName = displayName;
    this.description = description;
    this.permissions = permissions;
  }

  public String value() {
    return value;
  }

  public String displayName() {
    return displayName;
  }

  public String description() {
    return description;
  }

  /** Immutable, in catalog order. */
  public List<String> permissions() {
    return permissions;
  }

  public boolean supports(String permission) {
    return permissions.contains(permission);
  }

  public static Optional<ResourceType> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(r -> r.value.equals(value)).findFirst();
  }
}
