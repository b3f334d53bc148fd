package io.crisisintel.coordination.crisis;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CrisisRepository extends JpaRepository<Crisis, UUID> {

  @Query(
      """
      SELECT c FROM Crisis c
      WHERE (:status IS NULL OR c.status = :status)
      """)
  Page<Crisis> findByOptionalStatus(@Param("status") CrisisStatus status, Pageable pageable);

  List<Crisis> findByStatus(CrisisStatus status);

  Optional<Crisis> findByIncidentId(UUID incidentId);
}
