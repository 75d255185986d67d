package io.b2mash.b2b.rolepermissions.permission.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.rolepermissions.permission.RolePermissionsChangedEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

@ExtendWith(MockitoExtension.class)
class PermissionCacheInvalidationListenerTest {

  private static final UUID WORKSPACE_ID = UUID.randomUUID();
  private static final UUID ROLE_ID = UUID.randomUUID();

  @Mock private PermissionCacheService permissionCacheService;

  private final List<Runnable> scheduled = new ArrayList<>();
  private final TaskExecutor queueingExecutor = scheduled::add;

  @Test
  void immediateEvent_invalidatesOnCallingThread() {
    var listener =
        new PermissionCacheInvalidationListener(permissionCacheService, queueingExecutor);

    listener.onRolePermissionsChanged(
        RolePermissionsChangedEvent.immediate(WORKSPACE_ID, ROLE_ID, "base_role_changed"));

    verify(permissionCacheService).invalidateRolePermissions(WORKSPACE_ID);
    assertThat(scheduled).isEmpty();
  }

  @Test
  void backgroundEvent_isHandedToExecutor() {
    var listener =
        new PermissionCacheInvalidationListener(permissionCacheService, queueingExecutor);

    listener.onRolePermissionsChanged(
        RolePermissionsChangedEvent.background(WORKSPACE_ID, ROLE_ID, "permission_set"));

    verifyNoInteractions(permissionCacheService);
    assertThat(scheduled).hasSize(1);

    scheduled.get(0).run();
    verify(permissionCacheService).invalidateRolePermissions(WORKSPACE_ID);
  }

  @Test
  void invalidationFailure_isNotPropagated() {
    var listener =
        new PermissionCacheInvalidationListener(permissionCacheService, queueingExecutor);
    when(permissionCacheService.invalidateRolePermissions(WORKSPACE_ID))
        .thenThrow(new IllegalStateException("boom"));

    assertThatCode(
            () ->
                listener.onRolePermissionsChanged(
                    RolePermissionsChangedEvent.immediate(
                        WORKSPACE_ID, ROLE_ID, "template_reset")))
        .doesNotThrowAnyException();
  }

  @Test
  void rejectedScheduling_isNotPropagated() {
    TaskExecutor rejecting =
        task -> {
          throw new TaskRejectedException("queue full");
        };
    var listener = new PermissionCacheInvalidationListener(permissionCacheService, rejecting);

    assertThatCode(
            () ->
                listener.onRolePermissionsChanged(
                    RolePermissionsChangedEvent.background(WORKSPACE_ID, ROLE_ID, "role_deleted")))
        .doesNotThrowAnyException();
    verifyNoInteractions(permissionCacheService);
  }
}
