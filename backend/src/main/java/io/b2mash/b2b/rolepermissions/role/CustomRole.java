package io.b2mash.b2b.rolepermissions.role;

import io.b2mash.b2b.rolepermissions.permission.BaseRole;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "custom_roles")
public class CustomRole {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "workspace_id", nullable = false, updatable = false)
  private UUID workspaceId;

  @Column(name = "name", nullable = false, length = 50)
  private String name;

  @Column(name = "display_name", nullable = false, length = 100)
  private String displayName;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "color", nullable = false, length = 7)
  private String color;

  @Column(name = "icon", nullable = false, length = 50)
  private String icon;

  @Enumerated(EnumType.STRING)
  @Column(name = "base_role", length = 20)
  private BaseRole baseRole;

  @Column(name = "is_system", nullable = false, updatable = false)
  private boolean system;

  @Column(name = "is_active", nullable = false)
  private boolean active;

  @Column(name = "priority", nullable = false)
  private int priority;

  /** Set once at creation; a role is resettable to its template only when present. */
  @Column(name = "template_id", length = 50, updatable = false)
  private String templateId;

  @Column(name = "created_by", updatable = false)
  private UUID createdBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected CustomRole() {}

  public CustomRole(
      UUID workspaceId,
      String name,
      String displayName,
      String description,
      String color,
      String icon,
      BaseRole baseRole,
      int priority,
      String templateId,
      UUID createdBy) {
    this.workspaceId = workspaceId;
    this.name = name;
    this.displayName = displayName;
    this.description = description;
    this.color = color;
    this.icon = icon;
    this.baseRole = baseRole;
    this.system = false;
    this.active = true;
    this.priority = priority;
    this.templateId = templateId;
    this.createdBy = createdBy;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void rename(String name) {
    this.name = name;
    this.updatedAt = Instant.now();
  }

  public void updateDisplay(String displayName, String description, String color, String icon) {
    this.displayName = displayName;
    this.description = description;
    this.color = color;
    this.icon = icon;
    this.updatedAt = Instant.now();
  }

  public void changeBaseRole(BaseRole baseRole) {
    this.baseRole = baseRole;
    this.updatedAt = Instant.now();
  }

  public void setActive(boolean active) {
    this.active = active;
    this.updatedAt = Instant.now();
  }

  public void moveTo(int priority) {
    this.priority = priority;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getWorkspaceId() {
    return workspaceId;
  }

  public String getName() {
    return name;
  }

  public String getDisplayName() {
    return displayName;
  }

  public String getDescription() {
    return description;
  }

  public String getColor() {
    return color;
  }

  public String getIcon() {
    return icon;
  }

  public BaseRole getBaseRole() {
    return baseRole;
  }

  public boolean isSystem() {
    return system;
  }

  public boolean isActive() {
    return active;
  }

  public int getPriority() {
    return priority;
  }

  public String getTemplateId() {
    return templateId;
  }

  public UUID getCreatedBy() {
    return createdBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
