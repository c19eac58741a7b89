package io.realtycrm.backend.multitenancy;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Adds {@code requestId} and, for tenant-scoped routes, {@code tenantId} to the logging MDC. The
 * tenant is only read from the path here; services still receive it as an explicit argument.
 */
@Component
public class TenantLoggingFilter extends OncePerRequestFilter {

  static final String MDC_TENANT_ID = "tenantId";
  static final String MDC_REQUEST_ID = "requestId";

  private static final Pattern TENANT_PATH =
      Pattern.compile("^/api/tenants/([0-9a-fA-F-]{36})(/.*)?$");

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());

      String tenantId = extractTenantId(request.getRequestURI());
      if (tenantId != null) {
        MDC.put(MDC_TENANT_ID, tenantId);
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_TENANT_ID);
      MDC.remove(MDC_REQUEST_ID);
    }
  }

  static String extractTenantId(String requestUri) {
    if (requestUri == null) {
      return null;
    }
    var matcher = TENANT_PATH.matcher(requestUri);
    return matcher.matches() ? matcher.group(1).toLowerCase() : null;
  }
}
