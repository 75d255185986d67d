package io.b2mash.b2b.rolepermissions.roletemplate;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.b2b.rolepermissions.TestcontainersConfiguration;
import io.b2mash.b2b.rolepermissions.permission.PermissionMatrixService;
import io.b2mash.b2b.rolepermissions.permission.ResourceType;
import io.b2mash.b2b.rolepermissions.permission.cache.PermissionCacheService;
import io.b2mash.b2b.rolepermissions.permission.cache.PermissionCacheStore;
import io.b2mash.b2b.rolepermissions.permission.dto.PermissionEntry;
import io.b2mash.b2b.rolepermissions.permission.dto.SetPermissionRequest;
import io.b2mash.b2b.rolepermissions.role.CustomRoleRepository;
import io.b2mash.b2b.rolepermissions.roletemplate.dto.CreateRoleFromTemplateRequest;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
class RoleTemplateIntegrationTest {

  private static final UUID ACTOR_ID = UUID.randomUUID();

  @Autowired private RoleTemplateService roleTemplateService;
  @Autowired private PermissionMatrixService permissionMatrixService;
  @Autowired private PermissionCacheService permissionCacheService;
  @Autowired private PermissionCacheStore permissionCacheStore;
  @Autowired private CustomRoleRepository customRoleRepository;
  @Autowired private JdbcTemplate jdbcTemplate;
  @Autowired private PlatformTransactionManager transactionManager;

  private static CreateRoleFromTemplateRequest fromTemplate(String templateId) {
    return new CreateRoleFromTemplateRequest(templateId, null, null, null, null, null, null);
  }

  @Test
  void everyTemplate_instantiatesToItsDeclaredPermissions() {
    var workspaceId = UUID.randomUUID();

    for (RoleTemplate template : roleTemplateService.listTemplates()) {
      var role =
          roleTemplateService.createRoleFromTemplate(
              workspaceId, fromTemplate(template.id()), ACTOR_ID);
      var matrix = permissionMatrixService.getPermissionMatrix(role.id(), workspaceId);

      assertThat(role.templateId()).isEqualTo(template.id());
      assertThat(role.baseRole()).isEqualTo(template.baseRole().value());
      for (var resource : matrix.resources()) {
        var declared = template.permissions().getOrDefault(resource.resourceType(), Map.of());
        for (PermissionEntry entry : resource.permissions()) {
          if (declared.containsKey(entry.permission())) {
            assertThat(entry.granted())
                .as("%s %s.%s", template.id(), resource.resourceType(), entry.permission())
                .isEqualTo(declared.get(entry.permission()));
          }
        }
      }
    }
    assertThat(customRoleRepository.countByWorkspaceId(workspaceId)).isEqualTo(6);
  }

  @Test
  void instantiation_recordsAuditEventsOnCommit() {
    var workspaceId = UUID.randomUUID();

    roleTemplateService.createRoleFromTemplate(workspaceId, fromTemplate("qa_lead"), ACTOR_ID);

    assertThat(countRows("audit_events", workspaceId)).isPositive();
    assertThat(countRows("permission_audit_events", workspaceId)).isPositive();
  }

  @Test
  void rolledBackInstantiation_leavesNoAuditTrail() {
    var workspaceId = UUID.randomUUID();

    new TransactionTemplate(transactionManager)
        .executeWithoutResult(
            status -> {
              roleTemplateService.createRoleFromTemplate(
                  workspaceId, fromTemplate("qa_lead"), ACTOR_ID);
              status.setRollbackOnly();
            });

    assertThat(customRoleRepository.countByWorkspaceId(workspaceId)).isZero();
    assertThat(countRows("audit_events", workspaceId)).isZero();
    assertThat(countRows("permission_audit_events", workspaceId)).isZero();
  }

  private Integer countRows(String table, UUID workspaceId) {
    return jdbcTemplate.queryForObject(
        "SELECT count(*) FROM " + table + " WHERE workspace_id = ?", Integer.class, workspaceId);
  }

  @Test
  void instantiatingTwice_suffixesName() {
    var workspaceId = UUID.randomUUID();

    var first =
        roleTemplateService.createRoleFromTemplate(workspaceId, fromTemplate("qa_lead"), ACTOR_ID);
    var second =
        roleTemplateService.createRoleFromTemplate(workspaceId, fromTemplate("qa_lead"), ACTOR_ID);

    assertThat(first.name()).isEqualTo("qa-lead");
    assertThat(second.name()).isEqualTo("qa-lead-2");
    assertThat(second.templateId()).isEqualTo("qa_lead");
  }

  @Test
  void resetToTemplate_discardsCustomizationsAndClearsCache() throws Exception {
    var workspaceId = UUID.randomUUID();
    var userId = UUID.randomUUID();
    var role =
        roleTemplateService.createRoleFromTemplate(workspaceId, fromTemplate("qa_lead"), ACTOR_ID);
    jdbcTemplate.update(
        "INSERT INTO workspace_members (id, workspace_id, user_id, role, custom_role_id, email,"
            + " name, created_at) VALUES (?, ?, ?, 'DEVELOPER', ?, 'qa@example.com', 'QA', now())",
        UUID.randomUUID(),
        workspaceId,
        userId,
        role.id());

    assertThat(
            permissionCacheService.checkPermission(userId, workspaceId, "deployments", "trigger"))
        .isFalse();
    awaitCondition(() -> !cachedKeys(workspaceId).isEmpty());

    permissionMatrixService.setPermission(
        role.id(), workspaceId, new SetPermissionRequest("deployments", "trigger", true), ACTOR_ID);
    awaitCondition(() -> cachedKeys(workspaceId).isEmpty());

    assertThat(
            permissionCacheService.checkPermission(userId, workspaceId, "deployments", "trigger"))
        .isTrue();
    awaitCondition(() -> !cachedKeys(workspaceId).isEmpty());

    int applied = roleTemplateService.resetRoleToTemplate(role.id(), workspaceId, ACTOR_ID);

    assertThat(applied).isEqualTo(roleTemplateService.getTemplatePermissions("qa_lead").size());
    assertThat(cachedKeys(workspaceId)).isEmpty();
    assertThat(
            permissionCacheService.checkPermission(userId, workspaceId, "deployments", "trigger"))
        .isFalse();
  }

  @Test
  void customizations_overrideTemplateValues() {
    var workspaceId = UUID.randomUUID();

    var role =
        roleTemplateService.createRoleFromTemplate(
            workspaceId,
            new CreateRoleFromTemplateRequest(
                "contractor",
                "vendor-team",
                "Vendor Team",
                null,
                null,
                null,
                Map.of("secrets", Map.of("view_masked", true))),
            ACTOR_ID);

    assertThat(role.name()).isEqualTo("vendor-team");
    var secrets =
        permissionMatrixService.getPermissionMatrix(role.id(), workspaceId).resources().stream()
            .filter(r -> r.resourceType().equals(ResourceType.SECRETS.value()))
            .findFirst()
            .orElseThrow();
    assertThat(secrets.permissions())
        .contains(new PermissionEntry("view_masked", true, false, null));
  }

  private List<String> cachedKeys(UUID workspaceId) {
    return permissionCacheStore.scanKeys("perm:" + workspaceId + ":*");
  }

  private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (!condition.getAsBoolean()) {
      assertThat(System.nanoTime()).as("condition not met within 5s").isLessThan(deadline);
      Thread.sleep(20);
    }
  }
}
