package io.b2mash.b2b.rolepermissions.role;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CustomRoleRepository extends JpaRepository<CustomRole, UUID> {

  /**
   * Takes a transaction-scoped advisory lock keyed on the workspace, serializing role creation so
   * that the count check and the insert behave as one step. Released on commit or rollback.
   */
  @Query(
      value =
          "SELECT count(*) FROM"
              + " (SELECT pg_advisory_xact_lock(hashtext(CAST(:workspaceId AS text)))) AS l",
      nativeQuery = true)
  long lockWorkspaceRoles(@Param("workspaceId") UUID workspaceId);

  long countByWorkspaceId(UUID workspaceId);

  @Query("SELECT MAX(r.priority) FROM CustomRole r WHERE r.workspaceId = :workspaceId")
  Integer findMaxPriority(@Param("workspaceId") UUID workspaceId);

  Optional<CustomRole> findByIdAndWorkspaceId(UUID id, UUID workspaceId);

  List<CustomRole> findByWorkspaceIdOrderByPriorityAscCreatedAtAsc(UUID workspaceId);

  boolean existsByWorkspaceIdAndName(UUID workspaceId, String name);

  boolean existsByWorkspaceIdAndNameAndIdNot(UUID workspaceId, String name, UUID id);

  /** Names equal to {@code base} or starting with {@code base-}, used to pick a free suffix. */
  @Query(
      "SELECT r.name FROM CustomRole r WHERE r.workspaceId = :workspaceId"
          + " AND (r.name = :base OR r.name LIKE CONCAT(:base, '-%'))")
  List<String> findNamesLike(@Param("workspaceId") UUID workspaceId, @Param("base") String base);
}
