package io.realtycrm.backend.poollead;

import io.realtycrm.backend.contact.Contact;
import io.realtycrm.backend.member.AppUser;
import java.time.Instant;
import java.util.UUID;

public record PoolLeadView(
    UUID id,
    UUID tenantId,
    String firstName,
    String lastName,
    String email,
    String phone,
    String leadSource,
    UUID assignedAdvisorId,
    Instant leadAssignedAt,
    String advisorFirstName,
    String advisorLastName) {

  public static PoolLeadView from(Contact contact, AppUser advisor) {
    return new PoolLeadView(
        contact.getId(),
        contact.getTenantId(),
        contact.getFirstName(),
        contact.getLastName(),
        contact.getEmail(),
        contact.getPhone(),
        contact.getLeadSource(),
        contact.getAssignedAdvisorId(),
        contact.getLeadAssignedAt(),
        advisor != null ? advisor.getFirstName() : null,
        advisor != null ? advisor.getLastName() : null);
  }
}
