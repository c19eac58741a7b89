package io.realtycrm.backend.audit;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.UUID;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Builder for {@link AuditEventRecord}. Required fields: {@code tenantId}, {@code eventType},
 * {@code entityType}, {@code entityId}.
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .tenantId(tenantId)
 *     .eventType("phase_config.updated")
 *     .entityType("phase_config")
 *     .entityId(config.getId())
 *     .details(Map.of("active", true))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private static final int MAX_USER_AGENT_LENGTH = 500;

  private UUID tenantId;
  private String eventType;
  private String entityType;
  private UUID entityId;
  private Map<String, Object> details;

  private AuditEventBuilder() {}

  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder tenantId(UUID tenantId) {
    this.tenantId = tenantId;
    return this;
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  /**
   * Builds the record. Outside an HTTP request the source is "INTERNAL" and the actor "SYSTEM";
   * inside one the source is "API", the actor "USER" and the client address and user agent are
   * captured.
   */
  public AuditEventRecord build() {
    HttpServletRequest request = resolveHttpRequest();

    String ipAddress = null;
    String userAgent = null;
    if (request != null) {
      ipAddress = request.getRemoteAddr();
      userAgent = request.getHeader("User-Agent");
      if (userAgent != null && userAgent.length() > MAX_USER_AGENT_LENGTH) {
        userAgent = userAgent.substring(0, MAX_USER_AGENT_LENGTH);
      }
    }

    return new AuditEventRecord(
        tenantId,
        eventType,
        entityType,
        entityId,
        request != null ? "USER" : "SYSTEM",
        request != null ? "API" : "INTERNAL",
        ipAddress,
        userAgent,
        details);
  }

  private static HttpServletRequest resolveHttpRequest() {
    var attrs = RequestContextHolder.getRequestAttributes();
    if (attrs instanceof ServletRequestAttributes servletAttrs) {
      return servletAttrs.getRequest();
    }
    return null;
  }
}
