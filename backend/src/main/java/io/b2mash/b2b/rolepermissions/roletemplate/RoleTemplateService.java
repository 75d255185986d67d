package io.b2mash.b2b.rolepermissions.roletemplate;

import io.b2mash.b2b.rolepermissions.audit.AuditEventBuilder;
import io.b2mash.b2b.rolepermissions.audit.AuditService;
import io.b2mash.b2b.rolepermissions.exception.InvalidRequestException;
import io.b2mash.b2b.rolepermissions.exception.InvalidStateException;
import io.b2mash.b2b.rolepermissions.exception.ResourceNotFoundException;
import io.b2mash.b2b.rolepermissions.permission.BaseRole;
import io.b2mash.b2b.rolepermissions.permission.BaseRoleDefaults;
import io.b2mash.b2b.rolepermissions.permission.PermissionMatrixService;
import io.b2mash.b2b.rolepermissions.permission.ResourceType;
import io.b2mash.b2b.rolepermissions.permission.dto.SetPermissionRequest;
import io.b2mash.b2b.rolepermissions.permissionaudit.PermissionAuditEventRecord;
import io.b2mash.b2b.rolepermissions.permissionaudit.PermissionAuditEventType;
import io.b2mash.b2b.rolepermissions.permissionaudit.PermissionAuditService;
import io.b2mash.b2b.rolepermissions.role.CustomRoleRepository;
import io.b2mash.b2b.rolepermissions.role.CustomRoleService;
import io.b2mash.b2b.rolepermissions.role.dto.CreateCustomRoleRequest;
import io.b2mash.b2b.rolepermissions.role.dto.CustomRoleResponse;
import io.b2mash.b2b.rolepermissions.roletemplate.dto.CreateRoleFromTemplateRequest;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates custom roles from templates and resets template-derived roles. Only the entries of a
 * template that differ from its base role's defaults are stored as overrides.
 */
@Service
public class RoleTemplateService {

  private static final Logger log = LoggerFactory.getLogger(RoleTemplateService.class);
  private static final int MAX_NAME_SUFFIX = 100;

  private final RoleTemplateRegistry registry;
  private final CustomRoleService customRoleService;
  private final CustomRoleRepository customRoleRepository;
  private final PermissionMatrixService permissionMatrixService;
  private final AuditService auditService;
  private final PermissionAuditService permissionAuditService;

  public RoleTemplateService(
      RoleTemplateRegistry registry,
      CustomRoleService customRoleService,
      CustomRoleRepository customRoleRepository,
      PermissionMatrixService permissionMatrixService,
      AuditService auditService,
      PermissionAuditService permissionAuditService) {
    this.registry = registry;
    this.customRoleService = customRoleService;
    this.customRoleRepository = customRoleRepository;
    this.permissionMatrixService = permissionMatrixService;
    this.auditService = auditService;
    this.permissionAuditService = permissionAuditService;
  }

  public List<RoleTemplate> listTemplates() {
    return registry.listTemplates();
  }

  public RoleTemplate getTemplate(String templateId) {
    return registry
        .findTemplate(templateId)
        .orElseThrow(() -> new ResourceNotFoundException("RoleTemplate", templateId));
  }

  /** The overrides a role created from this template receives. */
  public List<SetPermissionRequest> getTemplatePermissions(String templateId) {
    var template = getTemplate(templateId);
    return computeOverrides(template.baseRole(), template.permissions());
  }

  @Transactional
  public CustomRoleResponse createRoleFromTemplate(
      UUID workspaceId, CreateRoleFromTemplateRequest request, UUID actorId) {
    var template = getTemplate(request.templateId());
    if (request.customizations() != null) {
      validateCustomizations(request.customizations());
    }

    String name =
        uniqueName(
            workspaceId,
            request.name() != null && !request.name().isBlank() ? request.name() : template.name());
    var role =
        customRoleService.createRole(
            workspaceId,
            new CreateCustomRoleRequest(
                name,
                firstNonBlank(request.displayName(), template.displayName()),
                firstNonBlank(request.description(), template.description()),
                firstNonBlank(request.color(), template.color()),
                firstNonBlank(request.icon(), template.icon()),
                template.baseRole().value()),
            template.id(),
            actorId);

    var overrides =
        computeOverrides(
            template.baseRole(), merge(template.permissions(), request.customizations()));
    if (!overrides.isEmpty()) {
      permissionMatrixService.setBulkPermissions(role.getId(), workspaceId, overrides, actorId);
    }

    log.info(
        "Created role {} ({}) from template {} with {} overrides in workspace {}",
        role.getName(),
        role.getId(),
        template.id(),
        overrides.size(),
        workspaceId);

    permissionAuditService.record(
        PermissionAuditEventRecord.forRole(
            workspaceId,
            PermissionAuditEventType.ROLE_CREATED,
            actorId,
            role.getId(),
            null,
            Map.of(
                "templateId", template.id(),
                "templateName", template.displayName(),
                "permissionsApplied", overrides.size())));

    return CustomRoleResponse.from(role, 0);
  }

  /**
   * Replaces the role's overrides with its template's. The workspace cache is cleared before this
   * returns.
   */
  @Transactional
  public int resetRoleToTemplate(UUID roleId, UUID workspaceId, UUID actorId) {
    var role =
        customRoleRepository
            .findByIdAndWorkspaceId(roleId, workspaceId)
            .orElseThrow(() -> new ResourceNotFoundException("CustomRole", roleId));
    if (role.getTemplateId() == null) {
      throw new InvalidStateException(
          "Not template-derived", "Role '" + role.getName() + "' was not created from a template");
    }
    var template = getTemplate(role.getTemplateId());
    var overrides = computeOverrides(template.baseRole(), template.permissions());

    permissionMatrixService.replacePermissions(
        roleId, workspaceId, overrides, "reset_to_template");

    log.info(
        "Reset role {} ({}) to template {} in workspace {}",
        role.getName(),
        roleId,
        template.id(),
        workspaceId);

    auditService.log(
        AuditEventBuilder.builder()
            .workspaceId(workspaceId)
            .actorId(actorId)
            .eventType("custom_role.reset_to_template")
            .entityType("custom_role")
            .entityId(roleId)
            .details(
                Map.of(
                    "templateId", template.id(),
                    "templateName", template.displayName(),
                    "permissionsReset", overrides.size()))
            .build());
    return overrides.size();
  }

  /**
   * Entries whose value differs from the base role default, or that the base role does not define.
   */
  static List<SetPermissionRequest> computeOverrides(
      BaseRole baseRole, Map<String, Map<String, Boolean>> permissions) {
    var overrides = new ArrayList<SetPermissionRequest>();
    permissions.forEach(
        (resourceType, perms) -> {
          var resource = ResourceType.fromValue(resourceType).orElse(null);
          perms.forEach(
              (permission, granted) -> {
                var inherited = BaseRoleDefaults.lookup(baseRole, resource, permission);
                if (inherited.isEmpty() || !Objects.equals(inherited.get(), granted)) {
                  overrides.add(new SetPermissionRequest(resourceType, permission, granted));
                }
              });
        });
    return overrides;
  }

  static Map<String, Map<String, Boolean>> merge(
      Map<String, Map<String, Boolean>> templatePermissions,
      Map<String, Map<String, Boolean>> customizations) {
    var merged = RoleTemplate.deepCopy(templatePermissions);
    if (customizations != null) {
      customizations.forEach(
          (resource, perms) ->
              merged.computeIfAbsent(resource, r -> new LinkedHashMap<>()).putAll(perms));
    }
    return merged;
  }

  private void validateCustomizations(Map<String, Map<String, Boolean>> customizations) {
    customizations.forEach(
        (resourceType, perms) -> {
          if (perms == null) {
            throw new InvalidRequestException(
                "Invalid customizations", "No permissions given for '" + resourceType + "'");
          }
          perms.forEach(
              (permission, granted) -> {
                permissionMatrixService.validatePermission(resourceType, permission);
                if (granted == null) {
                  throw new InvalidRequestException(
                      "Invalid customizations",
                      "Value for " + resourceType + "." + permission + " must be true or false");
                }
              });
        });
  }

  /** {@code base}, or the first free {@code base-N} for N in 2..100. */
  private String uniqueName(UUID workspaceId, String base) {
    var existing = new HashSet<>(customRoleRepository.findNamesLike(workspaceId, base));
    if (!existing.contains(base)) {
      return base;
    }
    for (int i = 2; i <= MAX_NAME_SUFFIX; i++) {
      String candidate = base + "-" + i;
      if (!existing.contains(candidate)) {
        return candidate;
      }
    }
    throw new InvalidStateException(
        "Name unavailable", "Could not generate a unique name for role '" + base + "'");
  }

  private static String firstNonBlank(String value, String fallback) {
    return value != null && !value.isBlank() ? value : fallback;
  }
}
