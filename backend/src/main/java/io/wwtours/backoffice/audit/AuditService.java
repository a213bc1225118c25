package io.wwtours.backoffice.audit;

import java.util.List;
import java.util.UUID;

/** Records and reads the activity trail of proposals and bookings. */
public interface AuditService {

  /**
   * Records a single audit event within the current transaction. If the enclosing transaction rolls
   * back, the audit event is also rolled back (no REQUIRES_NEW).
   *
   * @param record the audit event data to persist
   */
  void log(AuditEventRecord record);

  /** Events for one entity, newest first. */
  List<AuditEvent> findByEntity(String entityType, UUID entityId);
}
