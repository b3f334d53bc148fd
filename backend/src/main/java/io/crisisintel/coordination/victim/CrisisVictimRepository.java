package io.crisisintel.coordination.victim;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CrisisVictimRepository extends JpaRepository<CrisisVictim, UUID> {

  /** Typed projection for status count aggregation. */
  interface StatusCount {
    VictimStatus getStatus();

    long getCount();
  }

  boolean existsByCrisisIdAndUserId(UUID crisisId, UUID userId);

  Optional<CrisisVictim> findByCrisisIdAndUserId(UUID crisisId, UUID userId);

  long countByCrisisId(UUID crisisId);

  @Query(
      """
      SELECT v FROM CrisisVictim v
      WHERE v.crisisId = :crisisId
        AND (:status IS NULL OR v.status = :status)
      """)
  Page<CrisisVictim> findByCrisis(
      @Param("crisisId") UUID crisisId,
      @Param("status") VictimStatus status,
      Pageable pageable);

  @Query("SELECT v.userId FROM CrisisVictim v WHERE v.crisisId = :crisisId")
  Set<UUID> findUserIdsByCrisisId(@Param("crisisId") UUID crisisId);

  @Query(
      "SELECT v.status AS status, COUNT(v) AS count FROM CrisisVictim v"
          + " WHERE v.crisisId = :crisisId GROUP BY v.status")
  List<StatusCount> countByStatus(@Param("crisisId") UUID crisisId);
}
