package io.crisisintel.coordination.victim;

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

/** A user registered as affected by a crisis. Unique per (crisis, user). */
@Entity
@Table(name = "crisis_victims")
public class CrisisVictim {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "crisis_id", nullable = false, updatable = false)
  private UUID crisisId;

  @Column(name = "user_id", nullable = false, updatable = false)
  private UUID userId;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private VictimStatus status;

  @Column(name = "note", columnDefinition = "TEXT")
  private String note;

  @Column(name = "last_lat")
  private Double lastLat;

  @Column(name = "last_lng")
  private Double lastLng;

  @Column(name = "created_by", nullable = false, updatable = false)
  private UUID createdBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  protected CrisisVictim() {}

  public CrisisVictim(
      UUID crisisId,
      UUID userId,
      String note,
      Double lastLat,
      Double lastLng,
      UUID createdBy,
      Instant createdAt) {
    this.crisisId = crisisId;
    this.userId = userId;
    this.note = note;
    this.lastLat = lastLat;
    this.lastLng = lastLng;
    this.createdBy = createdBy;
    this.status = VictimStatus.PENDING;
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
  }

  /** Moves to a different status. Setting the current status again is rejected. */
  public void changeStatus(VictimStatus target, Instant at) {
    if (target == null || target == status) {
      throw new InvalidStateException(
          "Invalid victim state", "Victim is already " + status.name().toLowerCase(Locale.ROOT));
    }
    this.status = target;
    this.updatedAt = at;
  }

  public void edit(String note, Double lastLat, Double lastLng, Instant at) {
    this.note = note;
    if (lastLat != null && lastLng != null) {
      this.lastLat = lastLat;
      this.lastLng = lastLng;
    }
    this.updatedAt = at;
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

  public VictimStatus getStatus() {
    return status;
  }

  public String getNote() {
    return note;
  }

  public Double getLastLat() {
    return lastLat;
  }

  public Double getLastLng() {
    return lastLng;
  }

  public UUID getCreatedBy() {
    return createdBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
