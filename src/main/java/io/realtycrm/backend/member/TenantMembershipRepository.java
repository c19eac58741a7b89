package io.realtycrm.backend.member;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TenantMembershipRepository extends JpaRepository<TenantMembership, UUID> {

  @Query("SELECT m FROM TenantMembership m WHERE m.tenantId = :tenantId AND m.userId = :userId")
  Optional<TenantMembership> findByTenantIdAndUserId(
      @Param("tenantId") UUID tenantId, @Param("userId") UUID userId);

  /**
   * Locks the membership row ({@code SELECT ... FOR UPDATE}) so concurrent sale events for the same
   * advisor are applied one after the other.
   */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT m FROM TenantMembership m WHERE m.tenantId = :tenantId AND m.userId = :userId")
  Optional<TenantMembership> findByTenantIdAndUserIdForUpdate(
      @Param("tenantId") UUID tenantId, @Param("userId") UUID userId);

  @Query(
      """
      SELECT m FROM TenantMembership m
      WHERE m.tenantId = :tenantId AND m.active = true
      ORDER BY m.phaseState.enrolled DESC,
               m.phaseState.prestige DESC,
               m.phaseState.currentPhase DESC,
               m.phaseState.ultraRecord DESC
      """)
  List<TenantMembership> findActive(@Param("tenantId") UUID tenantId);

  @Query(
      """
      SELECT m FROM TenantMembership m
      WHERE m.tenantId = :tenantId AND m.active = true AND m.phaseState.enrolled = true
      ORDER BY m.phaseState.prestige DESC,
               m.phaseState.currentPhase DESC,
               m.phaseState.ultraRecord DESC
      """)
  List<TenantMembership> findEnrolled(@Param("tenantId") UUID tenantId);

  @Query(
      """
      SELECT m FROM TenantMembership m
      WHERE m.tenantId = :tenantId AND m.active = true AND m.phaseState.enrolled = true
      ORDER BY m.phaseState.prestige DESC,
               m.phaseState.currentPhase DESC,
               m.phaseState.ultraRecord DESC,
               m.phaseState.salesThisMonth DESC
      """)
  List<TenantMembership> findRanking(@Param("tenantId") UUID tenantId, Pageable pageable);

  /** Advisors eligible for pool leads, in a stable order for the cumulative-weight walk. */
  @Query(
      """
      SELECT m FROM TenantMembership m
      WHERE m.tenantId = :tenantId
        AND m.active = true
        AND m.phaseState.enrolled = true
        AND m.phaseState.solitary = false
      ORDER BY m.phaseState.enrolledAt ASC, m.id ASC
      """)
  List<TenantMembership> findLeadCandidates(@Param("tenantId") UUID tenantId);
}
