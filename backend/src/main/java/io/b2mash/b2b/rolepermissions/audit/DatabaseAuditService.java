package io.b2mash.b2b.rolepermissions.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Database-backed implementation of {@link AuditService}.
 *
 * <p>Events are written once the caller's transaction has committed, each in its own REQUIRES_NEW
 * transaction flushed inside it. The resources of the committed transaction are still bound at that
 * point, so the new transaction is required to reach the database. A failed insert is logged and
 * never affects the business change.
 */
@Service
public class DatabaseAuditService implements AuditService {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAuditService.class);

  private final AuditEventRepository auditEventRepository;
  private final TransactionTemplate requiresNew;

  public DatabaseAuditService(
      AuditEventRepository auditEventRepository, PlatformTransactionManager transactionManager) {
    this.auditEventRepository = auditEventRepository;
    this.requiresNew = new TransactionTemplate(transactionManager);
    this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  @Override
  public void log(AuditEventRecord record) {
    AfterCommit.run(() -> write(record));
  }

  private void write(AuditEventRecord record) {
    try {
      requiresNew.executeWithoutResult(
          status -> auditEventRepository.saveAndFlush(new AuditEvent(record)));
      log.debug(
          "Recorded audit event: type={}, entity={}/{}, actor={}, workspace={}",
          record.eventType(),
          record.entityType(),
          record.entityId(),
          record.actorId(),
          record.workspaceId());
    } catch (RuntimeException e) {
      log.warn(
          "Failed to record audit event type={} entity={}/{} in workspace {}",
          record.eventType(),
          record.entityType(),
          record.entityId(),
          record.workspaceId(),
          e);
    }
  }
}
