package io.crisisintel.coordination.participation;

import io.crisisintel.coordination.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * A user's request to take part in a crisis. At most one PENDING row exists per (crisis, user),
 * enforced by a partial unique index; decided rows stay as history.
 */
@Entity
@Table(name = "crisis_participation_requests")
public class ParticipationRequest {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "crisis_id", nullable = false, updatable = false)
  private UUID crisisId;

  @Column(name = "user_id", nullable = false, updatable = false)
  private UUID userId;

  @Column(name = "role_label", nullable = false, length = 50)
  private String roleLabel;

  @Column(name = "note", length = 500)
  private String note;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ParticipationRequestStatus status;

  @Column(name = "decided_by")
  private UUID decidedBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "decided_at")
  private Instant decidedAt;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  protected ParticipationRequest() {}

  public ParticipationRequest(
      UUID crisisId, UUID userId, String roleLabel, String note, Instant createdAt) {
    this.crisisId = crisisId;
    this.userId = userId;
    this.roleLabel = roleLabel;
    this.note = note;
    this.status = ParticipationRequestStatus.PENDING;
    this.createdAt = createdAt;
  }

  public void approve(UUID deciderId, Instant at) {
    decide(ParticipationRequestStatus.APPROVED, deciderId, at);
  }

  public void reject(UUID deciderId, Instant at) {
    decide(ParticipationRequestStatus.REJECTED, deciderId, at);
  }

  private void decide(ParticipationRequestStatus target, UUID deciderId, Instant at) {
    if (status.isTerminal()) {
      throw new InvalidStateException(
          "Participation request already decided",
          "Participation request is already " + status.name().toLowerCase(Locale.ROOT));
    }
    this.status = target;
    this.decidedBy = deciderId;
    this.decidedAt = at;
  }

  public UUID getId() {
    return id;
  }

  public UUID getCrisisId() {
    return crisisId;
  }

  public UUID getUserId() {
    return userId;
  }

  public String getRoleLabel() {
    return roleLabel;
  }

  public String getNote() {
    return note;
  }

  public ParticipationRequestStatus getStatus() {
    return status;
  }

  public UUID getDecidedBy() {
    return decidedBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getDecidedAt() {
    return decidedAt;
  }
}
