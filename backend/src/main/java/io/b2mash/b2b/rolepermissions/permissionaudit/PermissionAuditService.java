package io.b2mash.b2b.rolepermissions.permissionaudit;

import io.b2mash.b2b.rolepermissions.audit.AfterCommit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Records permission-level audit events. Writes happen after the caller commits, run in their own
 * transaction, and failures are only logged.
 */
@Service
public class PermissionAuditService {

  private static final Logger log = LoggerFactory.getLogger(PermissionAuditService.class);

  private final PermissionAuditEventRepository repository;
  private final TransactionTemplate requiresNew;

  public PermissionAuditService(
      PermissionAuditEventRepository repository, PlatformTransactionManager transactionManager) {
    this.repository = repository;
    this.requiresNew = new TransactionTemplate(transactionManager);
    this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  public void record(PermissionAuditEventRecord record) {
    AfterCommit.run(() -> write(record));
  }

  private void write(PermissionAuditEventRecord record) {
    try {
      requiresNew.executeWithoutResult(
          status -> repository.saveAndFlush(new PermissionAuditEvent(record)));
    } catch (RuntimeException e) {
      log.warn(
          "Failed to record permission audit event {} for role {} in workspace {}",
          record.eventType(),
          record.targetRoleId(),
          record.workspaceId(),
          e);
    }
  }
}
