package io.realtycrm.backend.phase;

import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PhaseHistoryRepository extends JpaRepository<PhaseHistoryEntry, UUID> {

  @Query(
      """
      SELECT h FROM PhaseHistoryEntry h
      WHERE h.tenantId = :tenantId AND h.userId = :userId
      ORDER BY h.createdAt DESC, h.sequenceNumber DESC
      """)
  List<PhaseHistoryEntry> findForAdvisor(
      @Param("tenantId") UUID tenantId, @Param("userId") UUID userId, Pageable pageable);
}
