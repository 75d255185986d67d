package io.b2mash.b2b.rolepermissions.permission.cache;

import io.b2mash.b2b.rolepermissions.permission.PermissionMatrixService;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Read-through cache in front of {@link PermissionMatrixService#checkPermission}. Results may be
 * stale for up to the configured TTL after a change that skipped invalidation. A cache outage only
 * costs latency: reads fall through to the matrix and write or delete failures are logged. Checks
 * whose resource type or action contain key metacharacters always go to the matrix.
 */
@Service
public class PermissionCacheService {

  private static final Logger log = LoggerFactory.getLogger(PermissionCacheService.class);

  static final String GRANTED = "1";
  static final String DENIED = "0";

  private final PermissionCacheStore store;
  private final PermissionMatrixService permissionMatrixService;
  private final TaskExecutor executor;
  private final PermissionCacheProperties properties;

  public PermissionCacheService(
      PermissionCacheStore store,
      PermissionMatrixService permissionMatrixService,
      @Qualifier("permissionCacheExecutor") TaskExecutor executor,
      PermissionCacheProperties properties) {
    this.store = store;
    this.permissionMatrixService = permissionMatrixService;
    this.executor = executor;
    this.properties = properties;
  }

  public boolean checkPermission(
      UUID userId, UUID workspaceId, String resourceType, String action) {
    if (!PermissionCacheKeys.isCacheable(resourceType, action)) {
      log.debug("Bypassing permission cache for unsafe key components {}/{}", resourceType, action);
      return permissionMatrixService.checkPermission(userId, workspaceId, resourceType, action);
    }
    String key = PermissionCacheKeys.checkKey(workspaceId, userId, resourceType, action);

    var cached = read(key);
    if (cached.isPresent()) {
      log.debug("Permission cache hit: {}", key);
      return GRANTED.equals(cached.get());
    }

    boolean granted =
        permissionMatrixService.checkPermission(userId, workspaceId, resourceType, action);
    writeInBackground(key, granted);
    return granted;
  }

  /** Clears cached checks of one user, after a role or membership change. */
  public long invalidateUserPermissions(UUID workspaceId, UUID userId) {
    return invalidate(PermissionCacheKeys.userPattern(workspaceId, userId));
  }

  /**
   * Clears every cached check in the workspace. Role holders are not tracked here, so any change to
   * a role's permissions clears all members.
   */
  public long invalidateRolePermissions(UUID workspaceId) {
    return invalidate(PermissionCacheKeys.workspacePattern(workspaceId));
  }

  public long invalidateAll() {
    return invalidate(PermissionCacheKeys.allPattern());
  }

  private Optional<String> read(String key) {
    try {
      return store.get(key);
    } catch (RuntimeException e) {
      log.warn("Permission cache read failed for {}, falling back to direct check", key, e);
      return Optional.empty();
    }
  }

  private void writeInBackground(String key, boolean granted) {
    try {
      executor.execute(
          () -> {
            try {
              store.set(key, granted ? GRANTED : DENIED, properties.ttl());
            } catch (RuntimeException e) {
              log.warn("Permission cache write failed for {}", key, e);
            }
          });
    } catch (RuntimeException e) {
      log.warn("Permission cache write for {} could not be scheduled", key, e);
    }
  }

  private long invalidate(String pattern) {
    try {
      List<String> keys = store.scanKeys(pattern);
      long deleted = 0;
      int batchSize = properties.scanBatchSize();
      for (int from = 0; from < keys.size(); from += batchSize) {
        deleted += store.delete(keys.subList(from, Math.min(from + batchSize, keys.size())));
      }
      if (deleted > 0) {
        log.info("Invalidated {} cached permission checks matching {}", deleted, pattern);
      }
      return deleted;
    } catch (RuntimeException e) {
      log.warn("Permission cache invalidation failed for {}", pattern, e);
      return 0;
    }
  }
}
