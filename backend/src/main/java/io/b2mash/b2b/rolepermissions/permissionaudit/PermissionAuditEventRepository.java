package io.b2mash.b2b.rolepermissions.permissionaudit;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PermissionAuditEventRepository extends JpaRepository<PermissionAuditEvent, UUID> {

  List<PermissionAuditEvent> findByWorkspaceIdAndTargetRoleIdOrderByCreatedAtAsc(
      UUID workspaceId, UUID targetRoleId);
}
