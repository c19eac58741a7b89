package io.realtycrm.backend.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)}. Constructed by {@link
 * AuditEventBuilder}, which fills in source and request metadata.
 *
 * @param tenantId tenant the audited entity belongs to
 * @param eventType free-form event type following {@code {entity}.{action}} convention
 * @param entityType the kind of entity being audited (e.g., "phase_config", "tenant_membership")
 * @param entityId ID of the affected entity (not a FK -- entity may be deleted later)
 * @param actorType USER or SYSTEM
 * @param source origin of the action: API or INTERNAL
 * @param ipAddress client IP; null for non-HTTP sources
 * @param userAgent truncated User-Agent header; null for non-HTTP sources
 * @param details key field changes; nullable
 */
public record AuditEventRecord(
    UUID tenantId,
    String eventType,
    String entityType,
    UUID entityId,
    String actorType,
    String source,
    String ipAddress,
    String userAgent,
    Map<String, Object> details) {}
