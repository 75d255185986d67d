package io.b2mash.b2b.rolepermissions.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)}. Constructed by {@link
 * AuditEventBuilder}.
 *
 * @param workspaceId workspace the event belongs to
 * @param actorId user who performed the action; null for system-initiated events
 * @param eventType free-form event type following {@code {entity}.{action}} convention
 * @param entityType the kind of entity being audited (e.g., "custom_role")
 * @param entityId ID of the affected entity; null for workspace-wide actions such as reordering
 * @param details key field changes as JSONB; nullable
 */
public record AuditEventRecord(
    UUID workspaceId,
    UUID actorId,
    String eventType,
    String entityType,
    UUID entityId,
    Map<String, Object> details) {}
