package io.crisisintel.coordination.participation;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CrisisParticipantRepository extends JpaRepository<CrisisParticipant, UUID> {

  boolean existsByCrisisIdAndUserId(UUID crisisId, UUID userId);

  Optional<CrisisParticipant> findByCrisisIdAndUserId(UUID crisisId, UUID userId);

  Page<CrisisParticipant> findByCrisisId(UUID crisisId, Pageable pageable);

  List<CrisisParticipant> findByUserId(UUID userId);

  long countByCrisisId(UUID crisisId);
}
