package io.crisisintel.coordination.participation;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ParticipationRequestRepository
    extends JpaRepository<ParticipationRequest, UUID> {

  Optional<ParticipationRequest> findByCrisisIdAndUserIdAndStatus(
      UUID crisisId, UUID userId, ParticipationRequestStatus status);

  @Query(
      """
      SELECT r FROM ParticipationRequest r
      WHERE r.crisisId = :crisisId
        AND (:status IS NULL OR r.status = :status)
      """)
  Page<ParticipationRequest> findByCrisis(
      @Param("crisisId") UUID crisisId,
      @Param("status") ParticipationRequestStatus status,
      Pageable pageable);
}
