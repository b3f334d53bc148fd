package io.crisisintel.coordination.participation;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CrisisInvitationRepository extends JpaRepository<CrisisInvitation, UUID> {

  Optional<CrisisInvitation> findByCrisisIdAndOrgUserId(UUID crisisId, UUID orgUserId);

  @Query(
      """
      SELECT i FROM CrisisInvitation i
      WHERE i.crisisId = :crisisId
        AND (:status IS NULL OR i.status = :status)
      """)
  Page<CrisisInvitation> findByCrisis(
      @Param("crisisId") UUID crisisId,
      @Param("status") InvitationStatus status,
      Pageable pageable);

  @Query(
      """
      SELECT i FROM CrisisInvitation i
      WHERE i.orgUserId = :orgUserId
        AND (:status IS NULL OR i.status = :status)
      """)
  Page<CrisisInvitation> findByInvitee(
      @Param("orgUserId") UUID orgUserId,
      @Param("status") InvitationStatus status,
      Pageable pageable);
}
