package io.crisisintel.coordination.participation;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** Membership of a user in a crisis. Unique per (crisis, user) at the schema level. */
@Entity
@Table(name = "crisis_participants")
public class CrisisParticipant {

  public static final String ROLE_ADMIN = "admin";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "crisis_id", nullable = false, updatable = false)
  private UUID crisisId;

  @Column(name = "user_id", nullable = false, updatable = false)
  private UUID userId;

  @Column(name = "role_label", nullable = false, length = 50)
  private String roleLabel;

  @Column(name = "joined_at", nullable = false, updatable = false)
  private Instant joinedAt;

  protected CrisisParticipant() {}

  public CrisisParticipant(UUID crisisId, UUID userId, String roleLabel, Instant joinedAt) {
    this.crisisId = crisisId;
    this.userId = userId;
    this.roleLabel = roleLabel;
    this.joinedAt = joinedAt;
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

  public Instant getJoinedAt() {
    return joinedAt;
  }
}
