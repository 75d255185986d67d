package io.b2mash.b2b.rolepermissions.roletemplate;

import io.b2mash.b2b.rolepermissions.permission.BaseRole;
import io.b2mash.b2b.rolepermissions.permission.ResourceType;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

/**
 * Catalog of role templates, read once from {@code classpath:role-templates/*.json} in file name
 * order. A template naming an unknown base role, resource type or permission prevents startup.
 * Accessors hand out copies; the loaded catalog is never exposed.
 */
@Component
public class RoleTemplateRegistry {

  private static final Logger log = LoggerFactory.getLogger(RoleTemplateRegistry.class);
  static final String TEMPLATE_LOCATION = "classpath:role-templates/*.json";

  private final Map<String, RoleTemplate> templates;

  public RoleTemplateRegistry(ResourcePatternResolver resourceResolver, ObjectMapper objectMapper) {
    this.templates = load(resourceResolver, objectMapper);
    log.info("Loaded {} role templates: {}", templates.size(), templates.keySet());
  }

  public List<RoleTemplate> listTemplates() {
    return templates.values().stream().map(RoleTemplate::copy).toList();
  }

  public Optional<RoleTemplate> findTemplate(String templateId) {
    return Optional.ofNullable(templateId).map(templates::get).map(RoleTemplate::copy);
  }

  private static Map<String, RoleTemplate> load(
      ResourcePatternResolver resourceResolver, ObjectMapper objectMapper) {
    Resource[] resources;
    try {
      resources = resourceResolver.getResources(TEMPLATE_LOCATION);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to scan role templates at " + TEMPLATE_LOCATION, e);
    }
    if (resources.length == 0) {
      log.warn("No role templates found at {}", TEMPLATE_LOCATION);
    }

    var loaded = new LinkedHashMap<String, RoleTemplate>();
    Arrays.stream(resources)
        .sorted(
            Comparator.comparing(
                Resource::getFilename, Comparator.nullsLast(String::compareTo)))
        .forEach(
            resource -> {
              RoleTemplateDefinition definition;
              try (InputStream in = resource.getInputStream()) {
                definition = objectMapper.readValue(in, RoleTemplateDefinition.class);
              } catch (Exception e) {
                throw new IllegalStateException(
                    "Failed to parse role template: " + resource.getFilename(), e);
              }
              var template = toTemplate(definition, resource.getFilename());
              if (loaded.putIfAbsent(template.id(), template) != null) {
                throw new IllegalStateException(
                    "Duplicate role template id '" + template.id() + "'");
              }
            });
    return Collections.unmodifiableMap(loaded);
  }

  static RoleTemplate toTemplate(RoleTemplateDefinition definition, String source) {
    if (definition.id() == null || definition.id().isBlank()) {
      throw new IllegalStateException("Role template " + source + " has no id");
    }
    if (definition.name() == null || definition.displayName() == null) {
      throw new IllegalStateException(
          "Role template '" + definition.id() + "' must define name and displayName");
    }
    var baseRole =
        BaseRole.fromValue(definition.baseRole())
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "Role template '"
                            + definition.id()
                            + "' has unknown base role '"
                            + definition.baseRole()
                            + "'"));

    Map<String, Map<String, Boolean>> permissions =
        definition.permissions() != null ? definition.permissions() : Map.of();
    permissions.forEach(
        (resourceType, perms) -> {
          var resource =
              ResourceType.fromValue(resourceType)
                  .orElseThrow(
                      () ->
                          new IllegalStateException(
                              "Role template '"
                                  + definition.id()
                                  + "' references unknown resource type '"
                                  + resourceType
                                  + "'"));
          perms.forEach(
              (permission, granted) -> {
                if (!resource.supports(permission) || granted == null) {
                  throw new IllegalStateException(
                      "Role template '"
                          + definition.id()
                          + "' has invalid entry "
                          + resourceType
                          + "."
                          + permission);
                }
              });
        });

    return new RoleTemplate(
            definition.id(),
            definition.name(),
            definition.displayName(),
            definition.description(),
            definition.color(),
            definition.icon(),
            baseRole,
            permissions)
        .frozen();
  }
}
