package io.b2mash.b2b.rolepermissions.roletemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.rolepermissions.permission.BaseRole;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

class RoleTemplateRegistryTest {

  private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder().build();

  private static RoleTemplateRegistry registry;

  @BeforeAll
  static void loadRegistry() {
    registry = new RoleTemplateRegistry(new PathMatchingResourcePatternResolver(), OBJECT_MAPPER);
  }

  @Test
  void loadsBundledTemplatesInFileOrder() {
    assertThat(registry.listTemplates())
        .extracting(RoleTemplate::id)
        .containsExactly(
            "qa_lead",
            "devops_engineer",
            "contractor",
            "project_manager",
            "billing_admin",
            "read_only_stakeholder");
  }

  @Test
  void findTemplate_returnsParsedTemplate() {
    var template = registry.findTemplate("contractor").orElseThrow();

    assertThat(template.name()).isEqualTo("contractor");
    assertThat(template.displayName()).isEqualTo("Contractor / External");
    assertThat(template.baseRole()).isEqualTo(BaseRole.VIEWER);
    assertThat(template.permissions().get("stories")).containsEntry("change_status", true);
  }

  @Test
  void findTemplate_unknownOrNullId_isEmpty() {
    assertThat(registry.findTemplate("astronaut")).isEmpty();
    assertThat(registry.findTemplate(null)).isEmpty();
  }

  @Test
  void returnedTemplatesAreIndependentCopies() {
    var template = registry.findTemplate("qa_lead").orElseThrow();
    template.permissions().get("stories").put("delete", true);
    template.permissions().remove("agents");

    var fresh = registry.findTemplate("qa_lead").orElseThrow();
    assertThat(fresh.permissions().get("stories")).containsEntry("delete", false);
    assertThat(fresh.permissions()).containsKey("agents");
  }

  @Test
  void toTemplate_rejectsUnknownBaseRole() {
    var definition =
        new RoleTemplateDefinition("x", "x", "X", null, null, null, "superuser", Map.of());

    assertThatThrownBy(() -> RoleTemplateRegistry.toTemplate(definition, "x.json"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("unknown base role 'superuser'");
  }

  @Test
  void toTemplate_rejectsUnknownResourceType() {
    var definition =
        new RoleTemplateDefinition(
            "x", "x", "X", null, null, null, "viewer", Map.of("rockets", Map.of("launch", true)));

    assertThatThrownBy(() -> RoleTemplateRegistry.toTemplate(definition, "x.json"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("unknown resource type 'rockets'");
  }

  @Test
  void toTemplate_rejectsPermissionOutsideResource() {
    var definition =
        new RoleTemplateDefinition(
            "x", "x", "X", null, null, null, "viewer", Map.of("projects", Map.of("launch", true)));

    assertThatThrownBy(() -> RoleTemplateRegistry.toTemplate(definition, "x.json"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("projects.launch");
  }

  @Test
  void toTemplate_rejectsMissingId() {
    var definition = new RoleTemplateDefinition(null, "x", "X", null, null, null, "viewer", null);

    assertThatThrownBy(() -> RoleTemplateRegistry.toTemplate(definition, "broken.json"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("broken.json");
  }

  @Test
  void duplicateTemplateIds_preventStartup() throws Exception {
    var json =
        """
        {"id": "dup", "name": "dup", "displayName": "Dup", "baseRole": "viewer",
         "permissions": {}}
        """;
    var resolver = mock(ResourcePatternResolver.class);
    when(resolver.getResources(RoleTemplateRegistry.TEMPLATE_LOCATION))
        .thenReturn(
            new Resource[] {
              new ByteArrayResource(json.getBytes(StandardCharsets.UTF_8)),
              new ByteArrayResource(json.getBytes(StandardCharsets.UTF_8))
            });

    assertThatThrownBy(() -> new RoleTemplateRegistry(resolver, OBJECT_MAPPER))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Duplicate role template id 'dup'");
  }
}
