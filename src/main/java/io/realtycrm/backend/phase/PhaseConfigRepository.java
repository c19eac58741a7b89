package io.realtycrm.backend.phase;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PhaseConfigRepository extends JpaRepository<PhaseConfig, UUID> {

  @Query("SELECT pc FROM PhaseConfig pc WHERE pc.tenantId = :tenantId")
  Optional<PhaseConfig> findByTenantId(@Param("tenantId") UUID tenantId);
}
