package io.b2mash.b2b.rolepermissions.permissionaudit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/** Append-only record of a role or permission change. */
@Entity
@Table(name = "permission_audit_events")
public class PermissionAuditEvent {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "workspace_id", nullable = false)
  private UUID workspaceId;

  @Enumerated(EnumType.STRING)
  @Column(name = "event_type", nullable = false, length = 50)
  private PermissionAuditEventType eventType;

  @Column(name = "actor_id")
  private UUID actorId;

  @Column(name = "target_user_id")
  private UUID targetUserId;

  @Column(name = "target_role_id")
  private UUID targetRoleId;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "before_state", columnDefinition = "jsonb")
  private Map<String, Object> beforeState;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "after_state", columnDefinition = "jsonb")
  private Map<String, Object> afterState;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected PermissionAuditEvent() {}

  public PermissionAuditEvent(PermissionAuditEventRecord record) {
    this.workspaceId = record.workspaceId();
    this.eventType = record.eventType();
    this.actorId = record.actorId();
    this.targetUserId = record.targetUserId();
    this.targetRoleId = record.targetRoleId();
    this.beforeState = record.beforeState();
    this.afterState = record.afterState();
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getWorkspaceId() {
    return workspaceId;
  }

  public PermissionAuditEventType getEventType() {
    return eventType;
  }

  public UUID getActorId() {
    return actorId;
  }

  public UUID getTargetUserId() {
    return targetUserId;
  }

  public UUID getTargetRoleId() {
    return targetRoleId;
  }

  public Map<String, Object> getBeforeState() {
    return beforeState;
  }

  public Map<String, Object> getAfterState() {
    return afterState;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
