package io.crisisintel.coordination.audit;

import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {

  /**
   * Timeline of a crisis: events whose JSONB {@code details->>'crisis_id'} names the crisis, plus
   * events recorded directly against the crisis entity. Uses the expression index
   * idx_audit_crisis.
   */
  @Query(
      value =
          """
          SELECT * FROM audit_events
          WHERE (details->>'crisis_id') = CAST(:crisisId AS TEXT)
             OR (entity_type = 'crisis' AND entity_id = :crisisId)
          ORDER BY occurred_at DESC
          """,
      countQuery =
          """
          SELECT count(*) FROM audit_events
          WHERE (details->>'crisis_id') = CAST(:crisisId AS TEXT)
             OR (entity_type = 'crisis' AND entity_id = :crisisId)
          """,
      nativeQuery = true)
  Page<AuditEvent> findByCrisisId(@Param("crisisId") UUID crisisId, Pageable pageable);
}
