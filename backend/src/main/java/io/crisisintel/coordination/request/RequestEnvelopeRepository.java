package io.crisisintel.coordination.request;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RequestEnvelopeRepository extends JpaRepository<RequestEnvelope, UUID> {

  /** Pending requests identical to a new draft with a target time, newest first. */
  @Query(
      """
      SELECT r FROM RequestEnvelope r
      WHERE r.kind = :kind
        AND r.requesterId = :requesterId
        AND r.counterpartyId = :counterpartyId
        AND r.targetAt = :targetAt
        AND r.status = :status
        AND r.createdAt >= :since
      ORDER BY r.createdAt DESC
      """)
  List<RequestEnvelope> findRecentDuplicates(
      @Param("kind") RequestKind kind,
      @Param("requesterId") UUID requesterId,
      @Param("counterpartyId") UUID counterpartyId,
      @Param("targetAt") Instant targetAt,
      @Param("status") RequestStatus status,
      @Param("since") Instant since);

  /** Same as {@link #findRecentDuplicates} for drafts without a target time. */
  @Query(
      """
      SELECT r FROM RequestEnvelope r
      WHERE r.kind = :kind
        AND r.requesterId = :requesterId
        AND r.counterpartyId = :counterpartyId
        AND r.targetAt IS NULL
        AND r.status = :status
        AND r.createdAt >= :since
      ORDER BY r.createdAt DESC
      """)
  List<RequestEnvelope> findRecentUntimedDuplicates(
      @Param("kind") RequestKind kind,
      @Param("requesterId") UUID requesterId,
      @Param("counterpartyId") UUID counterpartyId,
      @Param("status") RequestStatus status,
      @Param("since") Instant since);

  /**
   * Requests the user is a party to, minus those the user hid. {@code side} narrows to
   * "requester" or "counterparty"; null means either side.
   */
  @Query(
      """
      SELECT r FROM RequestEnvelope r
      WHERE (:kind IS NULL OR r.kind = :kind)
        AND (:status IS NULL OR r.status = :status)
        AND (:crisisId IS NULL OR r.crisisId = :crisisId)
        AND (:counterpartyId IS NULL OR r.counterpartyId = :counterpartyId)
        AND (
          ((:side IS NULL OR :side = 'requester')
            AND r.requesterId = :userId AND r.hiddenByRequester = false)
          OR ((:side IS NULL OR :side = 'counterparty')
            AND r.counterpartyId = :userId AND r.hiddenByCounterparty = false))
      """)
  Page<RequestEnvelope> findVisibleTo(
      @Param("userId") UUID userId,
      @Param("side") String side,
      @Param("kind") RequestKind kind,
      @Param("status") RequestStatus status,
      @Param("crisisId") UUID crisisId,
      @Param("counterpartyId") UUID counterpartyId,
      Pageable pageable);

  /** Every request filed inside a crisis. For crisis administrators. */
  @Query(
      """
      SELECT r FROM RequestEnvelope r
      WHERE r.crisisId = :crisisId
        AND (:kind IS NULL OR r.kind = :kind)
        AND (:status IS NULL OR r.status = :status)
        AND (:counterpartyId IS NULL OR r.counterpartyId = :counterpartyId)
      """)
  Page<RequestEnvelope> findByCrisis(
      @Param("crisisId") UUID crisisId,
      @Param("kind") RequestKind kind,
      @Param("status") RequestStatus status,
      @Param("counterpartyId") UUID counterpartyId,
      Pageable pageable);
}
