package io.realtycrm.backend.contact;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ContactRepository extends JpaRepository<Contact, UUID> {

  @Query("SELECT c FROM Contact c WHERE c.tenantId = :tenantId AND c.id = :id")
  Optional<Contact> findByTenantIdAndId(@Param("tenantId") UUID tenantId, @Param("id") UUID id);

  /** Pool leads, most recently assigned first; unassigned leads follow, newest contact first. */
  @Query(
      """
      SELECT c FROM Contact c
      WHERE c.tenantId = :tenantId AND c.poolLead = true
      ORDER BY c.leadAssignedAt DESC NULLS LAST, c.createdAt DESC
      """)
  List<Contact> findPoolLeads(@Param("tenantId") UUID tenantId);

  /** Typed projection for pool-lead counters. */
  interface PoolLeadCounts {
    long getTotal();

    long getAssigned();
  }

  @Query(
      """
      SELECT COUNT(c) AS total, COUNT(c.assignedAdvisorId) AS assigned
      FROM Contact c
      WHERE c.tenantId = :tenantId AND c.poolLead = true
      """)
  PoolLeadCounts countPoolLeads(@Param("tenantId") UUID tenantId);
}
