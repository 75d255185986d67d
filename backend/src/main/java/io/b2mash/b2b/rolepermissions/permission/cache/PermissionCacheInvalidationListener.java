package io.b2mash.b2b.rolepermissions.permission.cache;

import io.b2mash.b2b.rolepermissions.permission.RolePermissionsChangedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Clears the workspace's cached checks once a permission change has committed. Invalidations
 * flagged {@code awaitInvalidation} run on the committing thread so they finish before the
 * operation returns; the rest are handed to the cache executor.
 */
@Component
public class PermissionCacheInvalidationListener {

  private static final Logger log =
      LoggerFactory.getLogger(PermissionCacheInvalidationListener.class);

  private final PermissionCacheService permissionCacheService;
  private final TaskExecutor executor;

  public PermissionCacheInvalidationListener(
      PermissionCacheService permissionCacheService,
      @Qualifier("permissionCacheExecutor") TaskExecutor executor) {
    this.permissionCacheService = permissionCacheService;
    this.executor = executor;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onRolePermissionsChanged(RolePermissionsChangedEvent event) {
    if (event.awaitInvalidation()) {
      invalidate(event);
      return;
    }
    try {
      executor.execute(() -> invalidate(event));
    } catch (RuntimeException e) {
      log.warn(
          "Could not schedule cache invalidation for workspace {} ({})",
          event.workspaceId(),
          event.reason(),
          e);
    }
  }

  private void invalidate(RolePermissionsChangedEvent event) {
    try {
      long removed = permissionCacheService.invalidateRolePermissions(event.workspaceId());
      log.debug(
          "Cache invalidated for workspace {} after {} on role {}: {} entries",
          event.workspaceId(),
          event.reason(),
          event.roleId(),
          removed);
    } catch (RuntimeException e) {
      log.error(
          "Cache invalidation failed for workspace {} after {}",
          event.workspaceId(),
          event.reason(),
          e);
    }
  }
}
