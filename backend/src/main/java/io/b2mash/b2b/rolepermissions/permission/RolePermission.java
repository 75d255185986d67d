package io.b2mash.b2b.rolepermissions.permission;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;

/** Explicit override of one permission on a custom role. Wins over the base role default. */
@Entity
@Table(
    name = "role_permissions",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uq_role_permissions_role_resource_permission",
            columnNames = {"role_id", "resource_type", "permission"}))
public class RolePermission {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "role_id", nullable = false, updatable = false)
  private UUID roleId;

  @Column(name = "resource_type", nullable = false, length = 50, updatable = false)
  private String resourceType;

  @Column(name = "permission", nullable = false, length = 50, updatable = false)
  private String permission;

  @Column(name = "granted", nullable = false)
  private boolean granted;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected RolePermission() {}

  public RolePermission(UUID roleId, String resourceType, String permission, boolean granted) {
    this.roleId = roleId;
    this.resourceType = resourceType;
    this.permission = permission;
    this.granted = granted;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void setGranted(boolean granted) {
    this.granted = granted;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getRoleId() {
    return roleId;
  }

  public String getResourceType() {
    return resourceType;
  }

  public String getPermission() {
    return permission;
  }

  public boolean isGranted() {
    return granted;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
