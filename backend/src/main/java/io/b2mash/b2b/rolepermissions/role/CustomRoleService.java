package io.b2mash.b2b.rolepermissions.role;

import io.b2mash.b2b.rolepermissions.audit.AuditEventBuilder;
import io.b2mash.b2b.rolepermissions.audit.AuditService;
import io.b2mash.b2b.rolepermissions.exception.ForbiddenException;
import io.b2mash.b2b.rolepermissions.exception.InvalidRequestException;
import io.b2mash.b2b.rolepermissions.exception.InvalidStateException;
import io.b2mash.b2b.rolepermissions.exception.ResourceConflictException;
import io.b2mash.b2b.rolepermissions.exception.ResourceNotFoundException;
import io.b2mash.b2b.rolepermissions.member.WorkspaceMemberRepository;
import io.b2mash.b2b.rolepermissions.permission.BaseRole;
import io.b2mash.b2b.rolepermissions.permission.RolePermission;
import io.b2mash.b2b.rolepermissions.permission.RolePermissionRepository;
import io.b2mash.b2b.rolepermissions.permission.RolePermissionsChangedEvent;
import io.b2mash.b2b.rolepermissions.role.dto.CloneCustomRoleRequest;
import io.b2mash.b2b.rolepermissions.role.dto.CreateCustomRoleRequest;
import io.b2mash.b2b.rolepermissions.role.dto.CustomRoleResponse;
import io.b2mash.b2b.rolepermissions.role.dto.RoleListResponse;
import io.b2mash.b2b.rolepermissions.role.dto.RoleMemberResponse;
import io.b2mash.b2b.rolepermissions.role.dto.SystemRoleResponse;
import io.b2mash.b2b.rolepermissions.role.dto.UpdateCustomRoleRequest;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@EnableConfigurationProperties(RolePolicyProperties.class)
public class CustomRoleService {

  private static final Logger log = LoggerFactory.getLogger(CustomRoleService.class);

  public static final List<String> AVAILABLE_ICONS =
      List.of(
          "shield",
          "key",
          "lock",
          "user",
          "users",
          "star",
          "crown",
          "settings",
          "code",
          "eye",
          "edit",
          "terminal",
          "database",
          "server",
          "globe",
          "briefcase",
          "clipboard",
          "check-circle",
          "alert-triangle",
          "zap");

  static final String DEFAULT_COLOR = "#6366f1";
  static final String DEFAULT_ICON = "shield";

  private static final Pattern NAME_PATTERN = Pattern.compile("^[a-z0-9]+(-[a-z0-9]+)*$");
  private static final Pattern COLOR_PATTERN = Pattern.compile("^#[0-9a-fA-F]{6}$");

  private final CustomRoleRepository customRoleRepository;
  private final RolePermissionRepository rolePermissionRepository;
  private final WorkspaceMemberRepository workspaceMemberRepository;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;
  private final RolePolicyProperties policy;

  public CustomRoleService(
      CustomRoleRepository customRoleRepository,
      RolePermissionRepository rolePermissionRepository,
      WorkspaceMemberRepository workspaceMemberRepository,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher,
      RolePolicyProperties policy) {
    this.customRoleRepository = customRoleRepository;
    this.rolePermissionRepository = rolePermissionRepository;
    this.workspaceMemberRepository = workspaceMemberRepository;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
    this.policy = policy;
  }

  /** System roles first, then custom roles by priority, each with its live member count. */
  @Transactional(readOnly = true)
  public RoleListResponse listRoles(UUID workspaceId) {
    Map<BaseRole, Long> systemCounts = new HashMap<>();
    for (var count : workspaceMemberRepository.countBySystemRole(workspaceId)) {
      systemCounts.put(count.getRole(), count.getCnt());
    }
    Map<UUID, Long> customCounts = new HashMap<>();
    for (var count : workspaceMemberRepository.countByCustomRole(workspaceId)) {
      customCounts.put(count.getCustomRoleId(), count.getCnt());
    }

    var systemRoles =
        SystemRoleDefinition.ALL.stream()
            .map(d -> SystemRoleResponse.from(d, systemCounts.getOrDefault(d.role(), 0L)))
            .toList();
    var customRoles =
        customRoleRepository.findByWorkspaceIdOrderByPriorityAscCreatedAtAsc(workspaceId).stream()
            .map(r -> CustomRoleResponse.from(r, customCounts.getOrDefault(r.getId(), 0L)))
            .toList();
    return new RoleListResponse(systemRoles, customRoles);
  }

  @Transactional(readOnly = true)
  public CustomRoleResponse getRole(UUID roleId, UUID workspaceId) {
    var role = requireRole(roleId, workspaceId);
    return CustomRoleResponse.from(
        role, workspaceMemberRepository.countByWorkspaceIdAndCustomRoleId(workspaceId, roleId));
  }

  @Transactional
  public CustomRoleResponse createRole(
      UUID workspaceId, CreateCustomRoleRequest request, UUID actorId) {
    var role = createRole(workspaceId, request, null, actorId);
    return CustomRoleResponse.from(role, 0);
  }

  /**
   * Creates a role linked to a template. The link is permanent and makes the role resettable.
   *
   * @param templateId template the role derives from; null for an ad hoc role
   */
  @Transactional
  public CustomRole createRole(
      UUID workspaceId, CreateCustomRoleRequest request, String templateId, UUID actorId) {
    validateName(workspaceId, request.name(), null);
    validateDisplayName(request.displayName());
    String color = request.color() != null ? validateColor(request.color()) : DEFAULT_COLOR;
    String icon = request.icon() != null ? validateIcon(request.icon()) : DEFAULT_ICON;
    BaseRole baseRole = parseBaseRole(request.baseRole());

    int priority = reserveSlot(workspaceId);
    var role =
        insert(
            new CustomRole(
                workspaceId,
                request.name(),
                request.displayName(),
                blankToNull(request.description()),
                color,
                icon,
                baseRole,
                priority,
                templateId,
                actorId));

    log.info(
        "Created custom role {} ({}) in workspace {}", role.getName(), role.getId(), workspaceId);

    var details = new LinkedHashMap<String, Object>();
    details.put("name", role.getName());
    details.put("displayName", role.getDisplayName());
    details.put("baseRole", baseRole != null ? baseRole.value() : null);
    if (templateId != null) {
      details.put("templateId", templateId);
    }
    auditService.log(
        AuditEventBuilder.builder()
            .workspaceId(workspaceId)
            .actorId(actorId)
            .eventType("custom_role.created")
            .entityType("custom_role")
            .entityId(role.getId())
            .details(details)
            .build());
    return role;
  }

  /** Applies the non-null fields of the request. */
  @Transactional
  public CustomRoleResponse updateRole(
      UUID roleId, UUID workspaceId, UpdateCustomRoleRequest request, UUID actorId) {
    var role = requireMutableRole(roleId, workspaceId, "System roles cannot be modified");

    if (request.name() != null && !request.name().equals(role.getName())) {
      validateName(workspaceId, request.name(), roleId);
    }
    if (request.displayName() != null) {
      validateDisplayName(request.displayName());
    }
    if (request.color() != null) {
      validateColor(request.color());
    }
    if (request.icon() != null) {
      validateIcon(request.icon());
    }
    BaseRole newBaseRole =
        request.baseRole() != null ? parseBaseRole(request.baseRole()) : role.getBaseRole();

    var before = snapshot(role);
    BaseRole previousBaseRole = role.getBaseRole();

    if (request.name() != null) {
      role.rename(request.name());
    }
    role.updateDisplay(
        request.displayName() != null ? request.displayName() : role.getDisplayName(),
        request.description() != null ? blankToNull(request.description()) : role.getDescription(),
        request.color() != null ? request.color() : role.getColor(),
        request.icon() != null ? request.icon() : role.getIcon());
    if (newBaseRole != previousBaseRole) {
      role.changeBaseRole(newBaseRole);
    }
    if (request.isActive() != null) {
      role.setActive(request.isActive());
    }
    role = insert(role);

    var changes = diff(before, snapshot(role));
    log.info(
        "Updated custom role {} ({}) in workspace {}: {}",
        role.getName(),
        roleId,
        workspaceId,
        changes.keySet());

    auditService.log(
        AuditEventBuilder.builder()
            .workspaceId(workspaceId)
            .actorId(actorId)
            .eventType("custom_role.updated")
            .entityType("custom_role")
            .entityId(roleId)
            .details(Map.of("changes", changes))
            .build());

    if (newBaseRole != previousBaseRole) {
      // Every permission without an override now inherits from a different base role
      eventPublisher.publishEvent(
          RolePermissionsChangedEvent.immediate(workspaceId, roleId, "base_role_changed"));
    }

    return CustomRoleResponse.from(
        role, workspaceMemberRepository.countByWorkspaceIdAndCustomRoleId(workspaceId, roleId));
  }

  @Transactional
  public void deleteRole(UUID roleId, UUID workspaceId, UUID actorId) {
    var role = requireMutableRole(roleId, workspaceId, "System roles cannot be deleted");

    long memberCount =
        workspaceMemberRepository.countByWorkspaceIdAndCustomRoleId(workspaceId, roleId);
    if (memberCount > 0) {
      throw new InvalidStateException(
          "Role in use",
          "Cannot delete role with "
              + memberCount
              + " assigned member(s). Reassign members first.");
    }

    customRoleRepository.delete(role);

    log.info("Deleted custom role {} ({}) from workspace {}", role.getName(), roleId, workspaceId);

    auditService.log(
        AuditEventBuilder.builder()
            .workspaceId(workspaceId)
            .actorId(actorId)
            .eventType("custom_role.deleted")
            .entityType("custom_role")
            .entityId(roleId)
            .details(Map.of("name", role.getName(), "displayName", role.getDisplayName()))
            .build());

    eventPublisher.publishEvent(
        RolePermissionsChangedEvent.background(workspaceId, roleId, "role_deleted"));
  }

  /** Copies display fields, base role and every override of the source into a new role. */
  @Transactional
  public CustomRoleResponse cloneRole(
      UUID sourceRoleId, UUID workspaceId, CloneCustomRoleRequest request, UUID actorId) {
    var source = requireRole(sourceRoleId, workspaceId);
    validateName(workspaceId, request.name(), null);
    validateDisplayName(request.displayName());

    int priority = reserveSlot(workspaceId);
    var clone =
        insert(
            new CustomRole(
                workspaceId,
                request.name(),
                request.displayName(),
                request.description() != null && !request.description().isBlank()
                    ? request.description()
                    : source.getDescription(),
                source.getColor(),
                source.getIcon(),
                source.getBaseRole(),
                priority,
                null,
                actorId));

    var copies =
        rolePermissionRepository.findByRoleId(sourceRoleId).stream()
            .map(
                p ->
                    new RolePermission(
                        clone.getId(), p.getResourceType(), p.getPermission(), p.isGranted()))
            .toList();
    rolePermissionRepository.saveAll(copies);

    log.info(
        "Cloned custom role {} as {} ({}) with {} overrides in workspace {}",
        source.getName(),
        clone.getName(),
        clone.getId(),
        copies.size(),
        workspaceId);

    auditService.log(
        AuditEventBuilder.builder()
            .workspaceId(workspaceId)
            .actorId(actorId)
            .eventType("custom_role.cloned")
            .entityType("custom_role")
            .entityId(clone.getId())
            .details(
                Map.of(
                    "sourceRoleId", sourceRoleId.toString(),
                    "sourceRoleName", source.getName(),
                    "name", clone.getName(),
                    "permissionsCopiedCount", copies.size()))
            .build());

    return CustomRoleResponse.from(clone, 0);
  }

  /** Sets each role's priority to its position in {@code roleIds}. */
  @Transactional
  public void reorderRoles(UUID workspaceId, List<UUID> roleIds, UUID actorId) {
    if (roleIds == null) {
      throw new InvalidRequestException("Invalid reorder", "roleIds is required");
    }
    if (new HashSet<>(roleIds).size() != roleIds.size()) {
      throw new InvalidRequestException("Invalid reorder", "Duplicate role IDs are not allowed");
    }

    Map<UUID, CustomRole> roles =
        customRoleRepository.findByWorkspaceIdOrderByPriorityAscCreatedAtAsc(workspaceId).stream()
            .collect(Collectors.toMap(CustomRole::getId, r -> r));
    for (UUID roleId : roleIds) {
      if (!roles.containsKey(roleId)) {
        throw new InvalidRequestException(
            "Invalid reorder", "Role " + roleId + " does not belong to this workspace");
      }
    }

    for (int i = 0; i < roleIds.size(); i++) {
      roles.get(roleIds.get(i)).moveTo(i);
    }

    log.info("Reordered {} custom roles in workspace {}", roleIds.size(), workspaceId);

    auditService.log(
        AuditEventBuilder.builder()
            .workspaceId(workspaceId)
            .actorId(actorId)
            .eventType("custom_role.reordered")
            .entityType("custom_role")
            .details(Map.of("roleIds", roleIds.stream().map(UUID::toString).toList()))
            .build());
  }

  /** Members assigned to the role, in join order. */
  @Transactional(readOnly = true)
  public List<RoleMemberResponse> getRoleMembers(UUID roleId, UUID workspaceId) {
    requireRole(roleId, workspaceId);
    return workspaceMemberRepository
        .findByWorkspaceIdAndCustomRoleIdOrderByCreatedAtAsc(workspaceId, roleId)
        .stream()
        .map(RoleMemberResponse::from)
        .toList();
  }

  public List<String> getAvailableIcons() {
    return List.copyOf(AVAILABLE_ICONS);
  }

  @Transactional(readOnly = true)
  public long countCustomRoles(UUID workspaceId) {
    return customRoleRepository.countByWorkspaceId(workspaceId);
  }

  /**
   * Serializes creation within the workspace, enforces the role cap and returns the next priority.
   * Must run inside the transaction that inserts the role.
   */
  private int reserveSlot(UUID workspaceId) {
    customRoleRepository.lockWorkspaceRoles(workspaceId);
    long count = customRoleRepository.countByWorkspaceId(workspaceId);
    if (count >= policy.maxCustomRolesPerWorkspace()) {
      throw new InvalidStateException(
          "Role limit reached",
          "Maximum of "
              + policy.maxCustomRolesPerWorkspace()
              + " custom roles per workspace reached");
    }
    Integer maxPriority = customRoleRepository.findMaxPriority(workspaceId);
    return maxPriority == null ? 0 : maxPriority + 1;
  }

  private CustomRole insert(CustomRole role) {
    try {
      return customRoleRepository.saveAndFlush(role);
    } catch (DataIntegrityViolationException ex) {
      throw new ResourceConflictException(
          "Duplicate role name",
          "A role with name '" + role.getName() + "' already exists in this workspace");
    }
  }

  private CustomRole requireRole(UUID roleId, UUID workspaceId) {
    return customRoleRepository
        .findByIdAndWorkspaceId(roleId, workspaceId)
        .orElseThrow(() -> new ResourceNotFoundException("CustomRole", roleId));
  }

  private CustomRole requireMutableRole(UUID roleId, UUID workspaceId, String detail) {
    var role = requireRole(roleId, workspaceId);
    if (role.isSystem()) {
      throw new ForbiddenException("System role", detail);
    }
    return role;
  }

  private void validateName(UUID workspaceId, String name, UUID excludeRoleId) {
    if (name == null || name.length() < 2 || name.length() > 50) {
      throw new InvalidRequestException(
          "Invalid role name", "Role name must be between 2 and 50 characters");
    }
    if (!NAME_PATTERN.matcher(name).matches()) {
      throw new InvalidRequestException(
          "Invalid role name",
          "Role name '" + name + "' must be lowercase letters, digits and single hyphens");
    }
    if (policy.isReserved(name)) {
      throw new InvalidRequestException(
          "Reserved role name", "Role name '" + name + "' is reserved for system roles");
    }
    boolean taken =
        excludeRoleId == null
            ? customRoleRepository.existsByWorkspaceIdAndName(workspaceId, name)
            : customRoleRepository.existsByWorkspaceIdAndNameAndIdNot(
                workspaceId, name, excludeRoleId);
    if (taken) {
      throw new ResourceConflictException(
          "Duplicate role name",
          "A role with name '" + name + "' already exists in this workspace");
    }
  }

  private static void validateDisplayName(String displayName) {
    if (displayName == null || displayName.isBlank() || displayName.length() > 100) {
      throw new InvalidRequestException(
          "Invalid display name", "Display name must be between 1 and 100 characters");
    }
  }

  private static String validateColor(String color) {
    if (!COLOR_PATTERN.matcher(color).matches()) {
      throw new InvalidRequestException(
          "Invalid color", "Color '" + color + "' must be a hex value such as #6366f1");
    }
    return color;
  }

  private static String validateIcon(String icon) {
    if (!AVAILABLE_ICONS.contains(icon)) {
      throw new InvalidRequestException(
          "Invalid icon",
          "Icon '" + icon + "' is not one of: " + String.join(", ", AVAILABLE_ICONS));
    }
    return icon;
  }

  private static BaseRole parseBaseRole(String value) {
    if (value == null) {
      return null;
    }
    return BaseRole.fromValue(value)
        .orElseThrow(
            () ->
                new InvalidRequestException(
                    "Invalid base role",
                    "Base role '"
                        + value
                        + "' must be one of owner, admin, developer, viewer, none"));
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }

  private static Map<String, Object> snapshot(CustomRole role) {
    var state = new LinkedHashMap<String, Object>();
    state.put("name", role.getName());
    state.put("displayName", role.getDisplayName());
    state.put("description", role.getDescription());
    state.put("color", role.getColor());
    state.put("icon", role.getIcon());
    state.put("baseRole", role.getBaseRole() != null ? role.getBaseRole().value() : null);
    state.put("isActive", role.isActive());
    return state;
  }

  private static Map<String, Object> diff(Map<String, Object> before, Map<String, Object> after) {
    var changes = new LinkedHashMap<String, Object>();
    before.forEach(
        (field, from) -> {
          Object to = after.get(field);
          if (!Objects.equals(from, to)) {
            var change = new HashMap<String, Object>();
            change.put("from", from);
            change.put("to", to);
            changes.put(field, change);
          }
        });
    return changes;
  }
}
