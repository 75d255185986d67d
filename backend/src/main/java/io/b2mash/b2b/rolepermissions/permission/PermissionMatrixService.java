package io.b2mash.b2b.rolepermissions.permission;

import io.b2mash.b2b.rolepermissions.audit.AuditEventBuilder;
import io.b2mash.b2b.rolepermissions.audit.AuditService;
import io.b2mash.b2b.rolepermissions.exception.ForbiddenException;
import io.b2mash.b2b.rolepermissions.exception.InvalidRequestException;
import io.b2mash.b2b.rolepermissions.exception.ResourceNotFoundException;
import io.b2mash.b2b.rolepermissions.member.WorkspaceMemberRepository;
import io.b2mash.b2b.rolepermissions.permission.PermissionResolver.PermissionKey;
import io.b2mash.b2b.rolepermissions.permission.dto.EffectivePermissionsResponse;
import io.b2mash.b2b.rolepermissions.permission.dto.PermissionChange;
import io.b2mash.b2b.rolepermissions.permission.dto.PermissionMatrixResponse;
import io.b2mash.b2b.rolepermissions.permission.dto.ResourcePermissions;
import io.b2mash.b2b.rolepermissions.permission.dto.SetPermissionRequest;
import io.b2mash.b2b.rolepermissions.permissionaudit.PermissionAuditEventRecord;
import io.b2mash.b2b.rolepermissions.permissionaudit.PermissionAuditEventType;
import io.b2mash.b2b.rolepermissions.permissionaudit.PermissionAuditService;
import io.b2mash.b2b.rolepermissions.role.CustomRole;
import io.b2mash.b2b.rolepermissions.role.CustomRoleRepository;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reads and mutates the explicit permission overrides of custom roles and resolves effective
 * permissions for workspace members.
 */
@Service
public class PermissionMatrixService {

  private static final Logger log = LoggerFactory.getLogger(PermissionMatrixService.class);

  private final RolePermissionRepository rolePermissionRepository;
  private final CustomRoleRepository customRoleRepository;
  private final WorkspaceMemberRepository workspaceMemberRepository;
  private final AuditService auditService;
  private final PermissionAuditService permissionAuditService;
  private final ApplicationEventPublisher eventPublisher;

  public PermissionMatrixService(
      RolePermissionRepository rolePermissionRepository,
      CustomRoleRepository customRoleRepository,
      WorkspaceMemberRepository workspaceMemberRepository,
      AuditService auditService,
      PermissionAuditService permissionAuditService,
      ApplicationEventPublisher eventPublisher) {
    this.rolePermissionRepository = rolePermissionRepository;
    this.customRoleRepository = customRoleRepository;
    this.workspaceMemberRepository = workspaceMemberRepository;
    this.auditService = auditService;
    this.permissionAuditService = permissionAuditService;
    this.eventPublisher = eventPublisher;
  }

  @Transactional(readOnly = true)
  public PermissionMatrixResponse getPermissionMatrix(UUID roleId, UUID workspaceId) {
    var role = loadRole(roleId, workspaceId, false);
    var overrides =
        PermissionResolver.indexOverrides(rolePermissionRepository.findByRoleId(roleId));
    return new PermissionMatrixResponse(
        role.getId(),
        role.getName(),
        role.getDisplayName(),
        role.getBaseRole() != null ? role.getBaseRole().value() : null,
        PermissionResolver.resolveAll(role.getBaseRole(), overrides));
  }

  @Transactional
  public PermissionChange setPermission(
      UUID roleId, UUID workspaceId, SetPermissionRequest request, UUID actorId) {
    var role = loadRole(roleId, workspaceId, true);
    validatePermission(request.resourceType(), request.permission());

    var existing =
        rolePermissionRepository.findByRoleIdAndResourceTypeAndPermission(
            roleId, request.resourceType(), request.permission());
    Boolean before = existing.map(RolePermission::isGranted).orElse(null);

    if (existing.isPresent()) {
      existing.get().setGranted(request.granted());
    } else {
      rolePermissionRepository.save(
          new RolePermission(
              roleId, request.resourceType(), request.permission(), request.granted()));
    }

    log.info(
        "Set permission {}:{}={} on role {} ({})",
        request.resourceType(),
        request.permission(),
        request.granted(),
        role.getName(),
        roleId);

    var beforeState = new LinkedHashMap<String, Object>();
    beforeState.put("resourceType", request.resourceType());
    beforeState.put("permission", request.permission());
    beforeState.put("granted", before);
    permissionAuditService.record(
        PermissionAuditEventRecord.forRole(
            workspaceId,
            request.granted()
                ? PermissionAuditEventType.PERMISSION_GRANTED
                : PermissionAuditEventType.PERMISSION_REVOKED,
            actorId,
            roleId,
            beforeState,
            Map.of(
                "resourceType", request.resourceType(),
                "permission", request.permission(),
                "granted", request.granted())));

    eventPublisher.publishEvent(
        RolePermissionsChangedEvent.background(workspaceId, roleId, "permission_set"));

    return new PermissionChange(
        request.resourceType(), request.permission(), before, request.granted());
  }

  /** Upserts every entry in one transaction. Nothing is written if any entry is invalid. */
  @Transactional
  public int setBulkPermissions(
      UUID roleId, UUID workspaceId, List<SetPermissionRequest> permissions, UUID actorId) {
    if (permissions == null || permissions.isEmpty()) {
      throw new InvalidRequestException(
          "Empty permission update", "At least one permission is required for bulk update");
    }
    var role = loadRole(roleId, workspaceId, true);
    for (SetPermissionRequest request : permissions) {
      validatePermission(request.resourceType(), request.permission());
    }

    upsertAll(roleId, rolePermissionRepository.findByRoleId(roleId), permissions);

    log.info("Set {} permissions on role {} ({})", permissions.size(), role.getName(), roleId);

    permissionAuditService.record(
        PermissionAuditEventRecord.forRole(
            workspaceId,
            PermissionAuditEventType.PERMISSION_BULK_UPDATED,
            actorId,
            roleId,
            null,
            Map.of("permissions", describe(permissions))));

    eventPublisher.publishEvent(
        RolePermissionsChangedEvent.background(workspaceId, roleId, "permissions_bulk_set"));
    return permissions.size();
  }

  /** Sets every permission of one resource type to the same value. Idempotent. */
  @Transactional
  public void bulkResourceAction(
      UUID roleId,
      UUID workspaceId,
      String resourceType,
      BulkResourceAction action,
      UUID actorId) {
    var role = loadRole(roleId, workspaceId, true);
    var resource = requireResourceType(resourceType);
    boolean granted = action == BulkResourceAction.ALLOW_ALL;

    var requests =
        resource.permissions().stream()
            .map(p -> new SetPermissionRequest(resource.value(), p, granted))
            .toList();
    upsertAll(
        roleId,
        rolePermissionRepository.findByRoleIdAndResourceType(roleId, resource.value()),
        requests);

    log.info(
        "Applied {} on resource {} for role {} ({})", action, resourceType, role.getName(), roleId);

    auditService.log(
        AuditEventBuilder.builder()
            .workspaceId(workspaceId)
            .actorId(actorId)
            .eventType("role_permission.bulk_resource_action")
            .entityType("custom_role")
            .entityId(roleId)
            .details(
                Map.of(
                    "roleName", role.getName(),
                    "resourceType", resource.value(),
                    "action", action.name().toLowerCase(),
                    "permissionCount", requests.size()))
            .build());

    eventPublisher.publishEvent(
        RolePermissionsChangedEvent.background(workspaceId, roleId, "resource_bulk_action"));
  }

  /**
   * Deletes explicit overrides so the base role defaults apply again.
   *
   * @param resourceType limits the reset to one resource type; null resets everything
   */
  @Transactional
  public int resetPermissions(UUID roleId, UUID workspaceId, String resourceType, UUID actorId) {
    var role = loadRole(roleId, workspaceId, true);
    int removed;
    if (resourceType != null) {
      var resource = requireResourceType(resourceType);
      removed = rolePermissionRepository.deleteAllByRoleIdAndResourceType(roleId, resource.value());
    } else {
      removed = rolePermissionRepository.deleteAllByRoleId(roleId);
    }

    log.info(
        "Reset {} overrides on role {} ({}), resource={}",
        removed,
        role.getName(),
        roleId,
        resourceType != null ? resourceType : "all");

    auditService.log(
        AuditEventBuilder.builder()
            .workspaceId(workspaceId)
            .actorId(actorId)
            .eventType("role_permission.reset")
            .entityType("custom_role")
            .entityId(roleId)
            .details(
                Map.of(
                    "roleName", role.getName(),
                    "resourceType", resourceType != null ? resourceType : "all",
                    "removed", removed))
            .build());

    eventPublisher.publishEvent(
        RolePermissionsChangedEvent.background(workspaceId, roleId, "permissions_reset"));
    return removed;
  }

  /**
   * Replaces all overrides of a role with the given set in the current transaction. The workspace
   * cache is cleared before the calling operation returns.
   */
  @Transactional
  public int replacePermissions(
      UUID roleId, UUID workspaceId, List<SetPermissionRequest> permissions, String reason) {
    loadRole(roleId, workspaceId, true);
    for (SetPermissionRequest request : permissions) {
      validatePermission(request.resourceType(), request.permission());
    }
    rolePermissionRepository.deleteAllByRoleId(roleId);
    upsertAll(roleId, List.of(), permissions);
    eventPublisher.publishEvent(RolePermissionsChangedEvent.immediate(workspaceId, roleId, reason));
    return permissions.size();
  }

  @Transactional(readOnly = true)
  public EffectivePermissionsResponse getEffectivePermissions(UUID userId, UUID workspaceId) {
    var member =
        workspaceMemberRepository
            .findByWorkspaceIdAndUserId(workspaceId, userId)
            .orElseThrow(
                () ->
                    ResourceNotFoundException.withDetail(
                        "Member not found",
                        "User " + userId + " is not a member of this workspace"));

    var customRole =
        member.getCustomRoleId() != null
            ? customRoleRepository.findByIdAndWorkspaceId(member.getCustomRoleId(), workspaceId)
            : Optional.<CustomRole>empty();

    var systemRole = member.getRole();
    List<ResourcePermissions> resources;
    if (systemRole == BaseRole.OWNER) {
      resources = PermissionResolver.ownerGrants();
    } else if (customRole.isPresent()) {
      var overrides =
          PermissionResolver.indexOverrides(
              rolePermissionRepository.findByRoleId(customRole.get().getId()));
      resources = PermissionResolver.resolveAll(customRole.get().getBaseRole(), overrides);
    } else {
      resources = PermissionResolver.resolveAll(systemRole, Map.of());
    }

    return new EffectivePermissionsResponse(
        userId,
        workspaceId,
        systemRole.value(),
        customRole.map(CustomRole::getId).orElse(null),
        customRole.map(CustomRole::getDisplayName).orElse(null),
        resources);
  }

  /**
   * Point check. Non-members are denied. A member whose custom role no longer exists falls back to
   * their system role.
   */
  @Transactional(readOnly = true)
  public boolean checkPermission(
      UUID userId, UUID workspaceId, String resourceType, String permission) {
    var member = workspaceMemberRepository.findByWorkspaceIdAndUserId(workspaceId, userId);
    if (member.isEmpty()) {
      return false;
    }
    if (member.get().getRole() == BaseRole.OWNER) {
      return true;
    }

    var resource = ResourceType.fromValue(resourceType).orElse(null);
    UUID customRoleId = member.get().getCustomRoleId();
    if (customRoleId != null) {
      var customRole = customRoleRepository.findByIdAndWorkspaceId(customRoleId, workspaceId);
      if (customRole.isPresent()) {
        var explicit =
            rolePermissionRepository.findByRoleIdAndResourceTypeAndPermission(
                customRoleId, resourceType, permission);
        if (explicit.isPresent()) {
          return explicit.get().isGranted();
        }
        return BaseRoleDefaults.lookup(customRole.get().getBaseRole(), resource, permission)
            .orElse(false);
      }
      log.warn(
          "Member {} references missing custom role {}, falling back to system role",
          userId,
          customRoleId);
    }
    return BaseRoleDefaults.lookup(member.get().getRole(), resource, permission).orElse(false);
  }

  /** Catalog of resource types and their permissions. Mutable copy. */
  public Map<String, List<String>> getResourceDefinitions() {
    return Arrays.stream(ResourceType.values())
        .collect(
            Collectors.toMap(
                ResourceType::value,
                r -> new ArrayList<>(r.permissions()),
                (a, b) -> a,
                LinkedHashMap::new));
  }

  public Map<String, Map<String, Map<String, Boolean>>> getBaseRoleDefaults() {
    return BaseRoleDefaults.snapshot();
  }

  /** Rejects pairs that are not in the catalog. */
  public ResourceType validatePermission(String resourceType, String permission) {
    var resource = requireResourceType(resourceType);
    if (!resource.supports(permission)) {
      throw new InvalidRequestException(
          "Invalid permission",
          "Invalid permission '"
              + permission
              + "' for resource type '"
              + resourceType
              + "'. Valid permissions: "
              + String.join(", ", resource.permissions()));
    }
    return resource;
  }

  private ResourceType requireResourceType(String resourceType) {
    return ResourceType.fromValue(resourceType)
        .orElseThrow(
            () ->
                new InvalidRequestException(
                    "Invalid resource type",
                    "Invalid resource type '"
                        + resourceType
                        + "'. Valid types: "
                        + Arrays.stream(ResourceType.values())
                            .map(ResourceType::value)
                            .collect(Collectors.joining(", "))));
  }

  private CustomRole loadRole(UUID roleId, UUID workspaceId, boolean rejectSystem) {
    var role =
        customRoleRepository
            .findByIdAndWorkspaceId(roleId, workspaceId)
            .orElseThrow(() -> new ResourceNotFoundException("CustomRole", roleId));
    if (rejectSystem && role.isSystem()) {
      throw new ForbiddenException(
          "System role", "System role permissions cannot be modified; they use fixed defaults");
    }
    return role;
  }

  private void upsertAll(
      UUID roleId, List<RolePermission> existing, List<SetPermissionRequest> requests) {
    Map<PermissionKey, RolePermission> byKey =
        existing.stream()
            .collect(
                Collectors.toMap(
                    p -> new PermissionKey(p.getResourceType(), p.getPermission()),
                    Function.identity()));
    var created = new HashMap<PermissionKey, RolePermission>();
    for (SetPermissionRequest request : requests) {
      var key = new PermissionKey(request.resourceType(), request.permission());
      var row = byKey.containsKey(key) ? byKey.get(key) : created.get(key);
      if (row != null) {
        row.setGranted(request.granted());
      } else {
        created.put(
            key,
            new RolePermission(
                roleId, request.resourceType(), request.permission(), request.granted()));
      }
    }
    rolePermissionRepository.saveAll(created.values());
  }

  private static List<Map<String, Object>> describe(List<SetPermissionRequest> permissions) {
    return permissions.stream()
        .map(
            p ->
                Map.<String, Object>of(
                    "resourceType", p.resourceType(),
                    "permission", p.permission(),
                    "granted", p.granted()))
        .toList();
  }
}
