package io.b2mash.b2b.rolepermissions.permission.cache;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Builds cache keys of the form {@code perm:{workspace}:{user}:{resource}:{action}}. Components are
 * stripped of glob metacharacters and the separator so that a crafted value cannot widen an
 * invalidation scan. Checks whose components would be altered by stripping are not cacheable: two
 * different queries must never share a key.
 */
final class PermissionCacheKeys {

  static final String PREFIX = "perm";

  private static final Pattern UNSAFE = Pattern.compile("[*?\\[\\]\\\\:\\s]");

  private PermissionCacheKeys() {}

  static String sanitize(String component) {
    if (component == null) {
      return "";
    }
    return UNSAFE.matcher(component).replaceAll("");
  }

  /** True when both components are non-empty and survive {@link #sanitize} unchanged. */
  static boolean isCacheable(String resourceType, String action) {
    return isSafe(resourceType) && isSafe(action);
  }

  private static boolean isSafe(String component) {
    return component != null && !component.isEmpty() && component.equals(sanitize(component));
  }

  static String checkKey(UUID workspaceId, UUID userId, String resourceType, String action) {
    return String.join(
        ":",
        PREFIX,
        sanitize(String.valueOf(workspaceId)),
        sanitize(String.valueOf(userId)),
        sanitize(resourceType),
        sanitize(action));
  }

  static String userPattern(UUID workspaceId, UUID userId) {
    return String.join(
            ":", PREFIX, sanitize(String.valueOf(workspaceId)), sanitize(String.valueOf(userId)))
        + ":*";
  }

  static String workspacePattern(UUID workspaceId) {
    return PREFIX + ":" + sanitize(String.valueOf(workspaceId)) + ":*";
  }

  static String allPattern() {
    return PREFIX + ":*";
  }
}
