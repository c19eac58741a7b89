package io.realtycrm.backend.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/** 404 for a tenant-scoped resource. Lookups never cross tenants, so the tenant is part of it. */
public class ResourceNotFoundException extends ErrorResponseException {

  public ResourceNotFoundException(String resourceType, Object id) {
    this(
        resourceType + " not found",
        "No " + resourceType.toLowerCase() + " found with id " + id);
  }

  private ResourceNotFoundException(String title, String detail) {
    super(HttpStatus.NOT_FOUND, ProblemDetails.of(HttpStatus.NOT_FOUND, title, detail), null);
  }

  public static ResourceNotFoundException forTenant(String resourceType, UUID tenantId) {
    return new ResourceNotFoundException(
        resourceType + " not found",
        "No " + resourceType.toLowerCase() + " configured for tenant " + tenantId);
  }

  public static ResourceNotFoundException inTenant(String resourceType, Object id, UUID tenantId) {
    return new ResourceNotFoundException(
        resourceType + " not found",
        "No " + resourceType.toLowerCase() + " found with id " + id + " in tenant " + tenantId);
  }
}
