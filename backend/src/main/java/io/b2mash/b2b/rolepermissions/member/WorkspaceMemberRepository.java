package io.b2mash.b2b.rolepermissions.member;

import io.b2mash.b2b.rolepermissions.permission.BaseRole;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

/** Read-only view over workspace membership. */
public interface WorkspaceMemberRepository extends Repository<WorkspaceMember, UUID> {

  Optional<WorkspaceMember> findByWorkspaceIdAndUserId(UUID workspaceId, UUID userId);

  long countByWorkspaceIdAndCustomRoleId(UUID workspaceId, UUID customRoleId);

  List<WorkspaceMember> findByWorkspaceIdAndCustomRoleIdOrderByCreatedAtAsc(
      UUID workspaceId, UUID customRoleId);

  /** Members per top-level system role, whether or not a custom role is also assigned. */
  @Query(
      "SELECT m.role AS role, COUNT(m) AS cnt FROM WorkspaceMember m"
          + " WHERE m.workspaceId = :workspaceId"
          + " GROUP BY m.role")
  List<SystemRoleCount> countBySystemRole(@Param("workspaceId") UUID workspaceId);

  @Query(
      "SELECT m.customRoleId AS customRoleId, COUNT(m) AS cnt FROM WorkspaceMember m"
          + " WHERE m.workspaceId = :workspaceId AND m.customRoleId IS NOT NULL"
          + " GROUP BY m.customRoleId")
  List<CustomRoleCount> countByCustomRole(@Param("workspaceId") UUID workspaceId);

  interface SystemRoleCount {
    BaseRole getRole();

    long getCnt();
  }

  interface CustomRoleCount {
    UUID getCustomRoleId();

    long getCnt();
  }
}
