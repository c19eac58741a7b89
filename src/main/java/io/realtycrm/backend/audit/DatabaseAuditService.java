package io.realtycrm.backend.audit;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tools.jackson.databind.ObjectMapper;

/**
 * Database-backed {@link AuditService}. {@code log()} participates in the caller's transaction; if
 * the domain operation rolls back, the audit event rolls back too.
 */
@Service
public class DatabaseAuditService implements AuditService {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAuditService.class);

  private final AuditEventRepository auditEventRepository;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public DatabaseAuditService(
      AuditEventRepository auditEventRepository, ObjectMapper objectMapper, Clock clock) {
    this.auditEventRepository = auditEventRepository;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Override
  @Transactional
  public void log(AuditEventRecord record) {
    String detailsJson =
        record.details() != null ? objectMapper.writeValueAsString(record.details()) : null;
    auditEventRepository.save(new AuditEvent(record, detailsJson, Instant.now(clock)));
    log.debug(
        "Recorded audit event: type={}, entity={}/{}, tenant={}",
        record.eventType(),
        record.entityType(),
        record.entityId(),
        record.tenantId());
  }

  @Override
  @Transactional(readOnly = true)
  public List<AuditEvent> findForEntity(UUID tenantId, UUID entityId) {
    return auditEventRepository.findForEntity(tenantId, entityId);
  }
}
