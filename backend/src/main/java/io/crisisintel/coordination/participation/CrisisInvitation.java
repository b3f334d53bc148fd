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

/** Invitation of an organization into a crisis. Unique per (crisis, organization user). */
@Entity
@Table(name = "crisis_invitations")
public class CrisisInvitation {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "crisis_id", nullable = false, updatable = false)
  private UUID crisisId;

  @Column(name = "org_user_id", nullable = false, updatable = false)
  private UUID orgUserId;

  @Column(name = "org_type", nullable = false, length = 30)
  private String orgType;

  @Column(name = "note", length = 500)
  private String note;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private InvitationStatus status;

  @Column(name = "invited_by", nullable = false, updatable = false)
  private UUID invitedBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "responded_at")
  private Instant respondedAt;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  protected CrisisInvitation() {}

  public CrisisInvitation(
      UUID crisisId,
      UUID orgUserId,
      String orgType,
      String note,
      UUID invitedBy,
      Instant createdAt) {
    this.crisisId = crisisId;
    this.orgUserId = orgUserId;
    this.orgType = orgType;
    this.note = note;
    this.invitedBy = invitedBy;
    this.status = InvitationStatus.PENDING;
    this.createdAt = createdAt;
  }

  public void accept(Instant at) {
    respond(InvitationStatus.ACCEPTED, at);
  }

  public void decline(Instant at) {
    respond(InvitationStatus.DECLINED, at);
  }

  public boolean isPending() {
    return status == InvitationStatus.PENDING;
  }

  private void respond(InvitationStatus target, Instant at) {
    if (status.isTerminal()) {
      throw new InvalidStateException(
          "Invitation already answered",
          "Invitation is already " + status.name().toLowerCase(Locale.ROOT));
    }
    this.status = target;
    this.respondedAt = at;
  }

  public UUID getId() {
    return id;
  }

  public UUID getCrisisId() {
    return crisisId;
  }

  public UUID getOrgUserId() {
    return orgUserId;
  }

  public String getOrgType() {
    return orgType;
  }

  public String getNote() {
    return note;
  }

  public InvitationStatus getStatus() {
    return status;
  }

  public UUID getInvitedBy() {
    return invitedBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getRespondedAt() {
    return respondedAt;
  }
}
