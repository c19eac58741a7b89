package io.realtycrm.backend.audit;

import java.util.List;
import java.util.UUID;

/** Records administrative changes to phase-system settings and memberships. */
public interface AuditService {

  /**
   * Records a single audit event within the current transaction. If the enclosing transaction rolls
   * back, the audit event is also rolled back (no REQUIRES_NEW).
   */
  void log(AuditEventRecord record);

  /** Events for one entity of a tenant, newest first. */
  List<AuditEvent> findForEntity(UUID tenantId, UUID entityId);
}
