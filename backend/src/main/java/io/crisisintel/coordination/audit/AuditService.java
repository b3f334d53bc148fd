package io.crisisintel.coordination.audit;

import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

/** Activity sink. Every mutating operation records exactly one event through {@link #log}. */
public interface AuditService {

  /**
   * Records a single audit event within the current transaction. If the enclosing transaction rolls
   * back, the audit event is also rolled back (no REQUIRES_NEW).
   *
   * @param record the audit event data to persist
   */
  void log(AuditEventRecord record);

  /**
   * Returns the timeline of a crisis, newest first.
   *
   * @param crisisId the crisis whose events to return
   * @param pageable pagination parameters
   */
  Page<AuditEvent> findCrisisTimeline(UUID crisisId, Pageable pageable);
}
