package io.b2mash.b2b.rolepermissions.permission;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class BaseRoleDefaultsTest {

  @Test
  void everyBaseRole_definesEveryCatalogPair() {
    for (BaseRole role : BaseRole.values()) {
      for (ResourceType resource : ResourceType.values()) {
        for (String permission : resource.permissions()) {
          assertThat(BaseRoleDefaults.lookup(role, resource, permission))
              .as("%s %s.%s", role, resource.value(), permission)
              .isPresent();
        }
      }
    }
  }

  @Test
  void owner_grantsEverything() {
    for (ResourceType resource : ResourceType.values()) {
      for (String permission : resource.permissions()) {
        assertThat(BaseRoleDefaults.lookup(BaseRole.OWNER, resource, permission)).contains(true);
      }
    }
  }

  @Test
  void admin_deniesOnlyPlaintextSecretsAndBilling() {
    assertThat(BaseRoleDefaults.lookup(BaseRole.ADMIN, ResourceType.SECRETS, "view_plaintext"))
        .contains(false);
    assertThat(BaseRoleDefaults.lookup(BaseRole.ADMIN, ResourceType.WORKSPACE, "manage_billing"))
        .contains(false);
    assertThat(BaseRoleDefaults.lookup(BaseRole.ADMIN, ResourceType.WORKSPACE, "manage_roles"))
        .contains(true);
    assertThat(BaseRoleDefaults.lookup(BaseRole.ADMIN, ResourceType.SECRETS, "create"))
        .contains(true);
  }

  @Test
  void developer_canWorkOnStoriesButNotDeleteProjects() {
    assertThat(BaseRoleDefaults.lookup(BaseRole.DEVELOPER, ResourceType.STORIES, "change_status"))
        .contains(true);
    assertThat(BaseRoleDefaults.lookup(BaseRole.DEVELOPER, ResourceType.STORIES, "delete"))
        .contains(false);
    assertThat(BaseRoleDefaults.lookup(BaseRole.DEVELOPER, ResourceType.PROJECTS, "delete"))
        .contains(false);
    assertThat(BaseRoleDefaults.lookup(BaseRole.DEVELOPER, ResourceType.DEPLOYMENTS, "trigger"))
        .contains(true);
  }

  @Test
  void viewer_hasNoSecretAccess() {
    for (String permission : ResourceType.SECRETS.permissions()) {
      assertThat(BaseRoleDefaults.lookup(BaseRole.VIEWER, ResourceType.SECRETS, permission))
          .contains(false);
    }
    assertThat(BaseRoleDefaults.lookup(BaseRole.VIEWER, ResourceType.PROJECTS, "read"))
        .contains(true);
  }

  @Test
  void lookup_isEmptyForUnknownPermissionOrMissingBaseRole() {
    assertThat(BaseRoleDefaults.lookup(BaseRole.OWNER, ResourceType.PROJECTS, "launch")).isEmpty();
    assertThat(BaseRoleDefaults.lookup(null, ResourceType.PROJECTS, "read")).isEmpty();
    assertThat(BaseRoleDefaults.lookup(BaseRole.OWNER, null, "read")).isEmpty();
  }

  @Test
  void snapshot_returnsIndependentCopy() {
    var snapshot = BaseRoleDefaults.snapshot();
    snapshot.get("viewer").get("secrets").put("view_plaintext", true);
    snapshot.remove("owner");

    assertThat(BaseRoleDefaults.lookup(BaseRole.VIEWER, ResourceType.SECRETS, "view_plaintext"))
        .contains(false);
    assertThat(BaseRoleDefaults.snapshot()).containsKey("owner");
  }
}
