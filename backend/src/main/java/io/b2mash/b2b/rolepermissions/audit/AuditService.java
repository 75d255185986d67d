package io.b2mash.b2b.rolepermissions.audit;

/**
 * Sink for workspace audit events. Callers treat it as fire-and-forget: implementations must never
 * propagate a failure back into the operation being audited.
 */
public interface AuditService {

  /**
   * Records a single audit event. Failures are logged by the implementation and swallowed.
   *
   * @param record the audit event data to persist
   */
  void log(AuditEventRecord record);
}
