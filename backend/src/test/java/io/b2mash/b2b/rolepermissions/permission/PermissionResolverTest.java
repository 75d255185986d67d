package io.b2mash.b2b.rolepermissions.permission;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.b2b.rolepermissions.permission.PermissionResolver.PermissionKey;
import io.b2mash.b2b.rolepermissions.permission.dto.PermissionEntry;
import io.b2mash.b2b.rolepermissions.permission.dto.ResourcePermissions;
import java.util.Arrays;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PermissionResolverTest {

  @Test
  void resolve_explicitOverrideBeatsInheritance() {
    var overrides = Map.of(new PermissionKey("projects", "delete"), true);

    var entry =
        PermissionResolver.resolve(BaseRole.VIEWER, overrides, ResourceType.PROJECTS, "delete");

    assertThat(entry).isEqualTo(new PermissionEntry("delete", true, false, null));
  }

  @Test
  void resolve_explicitDenyBeatsInheritedGrant() {
    var overrides = Map.of(new PermissionKey("projects", "read"), false);

    var entry =
        PermissionResolver.resolve(BaseRole.ADMIN, overrides, ResourceType.PROJECTS, "read");

    assertThat(entry.granted()).isFalse();
    assertThat(entry.inherited()).isFalse();
  }

  @Test
  void resolve_withoutOverride_inheritsFromBaseRole() {
    var entry =
        PermissionResolver.resolve(
            BaseRole.DEVELOPER, Map.of(), ResourceType.DEPLOYMENTS, "trigger");

    assertThat(entry).isEqualTo(new PermissionEntry("trigger", true, true, "developer"));
  }

  @Test
  void resolve_withoutBaseRole_deniesWithoutInheritance() {
    var entry = PermissionResolver.resolve(null, Map.of(), ResourceType.PROJECTS, "read");

    assertThat(entry).isEqualTo(new PermissionEntry("read", false, false, null));
  }

  @Test
  void resolveAll_coversWholeCatalogInOrder() {
    var resources = PermissionResolver.resolveAll(BaseRole.VIEWER, Map.of());

    assertThat(resources).extracting(ResourcePermissions::resourceType)
        .containsExactly(
            "projects",
            "agents",
            "stories",
            "deployments",
            "secrets",
            "integrations",
            "workspace",
            "cost_management");
    for (ResourcePermissions resource : resources) {
      var type = ResourceType.fromValue(resource.resourceType()).orElseThrow();
      assertThat(resource.permissions())
          .extracting(PermissionEntry::permission)
          .containsExactlyElementsOf(type.permissions());
      for (PermissionEntry entry : resource.permissions()) {
        assertThat(entry.granted())
            .isEqualTo(BaseRoleDefaults.lookup(BaseRole.VIEWER, type, entry.permission()).get());
      }
    }
  }

  @Test
  void ownerGrants_grantEveryEntry() {
    assertThat(PermissionResolver.ownerGrants())
        .flatExtracting(ResourcePermissions::permissions)
        .allMatch(PermissionEntry::granted)
        .hasSize(
            Arrays.stream(ResourceType.values())
                .mapToInt(r -> r.permissions().size())
                .sum());
  }
}
