package io.b2mash.b2b.rolepermissions.member;

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
import org.hibernate.annotations.Immutable;

/**
 * Workspace membership. Rows are owned by the membership service; this module only reads them to
 * resolve a user's system role and custom role.
 */
@Entity
@Immutable
@Table(name = "workspace_members")
public class WorkspaceMember {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "workspace_id", nullable = false)
  private UUID workspaceId;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Enumerated(EnumType.STRING)
  @Column(name = "role", nullable = false, length = 20)
  private BaseRole role;

  @Column(name = "custom_role_id")
  private UUID customRoleId;

  @Column(name = "email", length = 255)
  private String email;

  @Column(name = "name", length = 255)
  private String name;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected WorkspaceMember() {}

  public WorkspaceMember(
      UUID workspaceId,
      UUID userId,
      BaseRole role,
      UUID customRoleId,
      String email,
      String name) {
    this.workspaceId = workspaceId;
    this.userId = userId;
    this.role = role;
    this.customRoleId = customRoleId;
    this.email = email;
    this.name = name;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getWorkspaceId() {
    return workspaceId;
  }

  public UUID getUserId() {
    return userId;
  }

  public BaseRole getRole() {
    return role;
  }

  public UUID getCustomRoleId() {
    return customRoleId;
  }

  public String getEmail() {
    return email;
  }

  public String getName() {
    return name;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
