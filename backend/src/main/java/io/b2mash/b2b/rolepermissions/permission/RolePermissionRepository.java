package io.b2mash.b2b.rolepermissions.permission;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RolePermissionRepository extends JpaRepository<RolePermission, UUID> {

  List<RolePermission> findByRoleId(UUID roleId);

  List<RolePermission> findByRoleIdAndResourceType(UUID roleId, String resourceType);

  Optional<RolePermission> findByRoleIdAndResourceTypeAndPermission(
      UUID roleId, String resourceType, String permission);

  @Modifying(flushAutomatically = true)
  @Query("DELETE FROM RolePermission p WHERE p.roleId = :roleId")
  int deleteAllByRoleId(@Param("roleId") UUID roleId);

  @Modifying(flushAutomatically = true)
  @Query("DELETE FROM RolePermission p WHERE p.roleId = :roleId AND p.resourceType = :resourceType")
  int deleteAllByRoleIdAndResourceType(
      @Param("roleId") UUID roleId, @Param("resourceType") String resourceType);
}
