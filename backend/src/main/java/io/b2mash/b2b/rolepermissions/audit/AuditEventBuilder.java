package io.b2mash.b2b.rolepermissions.audit;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Builder that constructs an {@link AuditEventRecord}.
 *
 * <p>Required fields: {@code workspaceId}, {@code eventType}, {@code entityType}.
 *
 * <p>Usage:
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .workspaceId(workspaceId)
 *     .actorId(actorId)
 *     .eventType("custom_role.created")
 *     .entityType("custom_role")
 *     .entityId(role.getId())
 *     .details(Map.of("name", role.getName()))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private UUID workspaceId;
  private UUID actorId;
  private String eventType;
  private String entityType;
  private UUID entityId;
  private Map<String, Object> details;

  private AuditEventBuilder() {}

  /** Creates a new builder instance. */
  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder workspaceId(UUID workspaceId) {
    this.workspaceId = workspaceId;
    return this;
  }

  public AuditEventBuilder actorId(UUID actorId) {
    this.actorId = actorId;
    return this;
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  public AuditEventRecord build() {
    Objects.requireNonNull(workspaceId, "workspaceId is required");
    Objects.requireNonNull(eventType, "eventType is required");
    Objects.requireNonNull(entityType, "entityType is required");
    return new AuditEventRecord(workspaceId, actorId, eventType, entityType, entityId, details);
  }
}
