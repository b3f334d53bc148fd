package io.crisisintel.coordination.crisis;

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
import java.util.UUID;

@Entity
@Table(name = "crises")
public class Crisis {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "incident_id", nullable = false, updatable = false)
  private UUID incidentId;

  @Column(name = "title", nullable = false, length = 255)
  private String title;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private CrisisStatus status;

  @Column(name = "center_lat", nullable = false)
  private double centerLat;

  @Column(name = "center_lng", nullable = false)
  private double centerLng;

  @Column(name = "radius_km", nullable = false)
  private double radiusKm;

  @Column(name = "admin_user_id", nullable = false, updatable = false)
  private UUID adminUserId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "ended_at")
  private Instant endedAt;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  protected Crisis() {}

  public Crisis(
      UUID incidentId,
      String title,
      String description,
      double centerLat,
      double centerLng,
      double radiusKm,
      UUID adminUserId,
      Instant createdAt) {
    this.incidentId = incidentId;
    this.title = title;
    this.description = description;
    this.centerLat = centerLat;
    this.centerLng = centerLng;
    this.radiusKm = radiusKm;
    this.adminUserId = adminUserId;
    this.status = CrisisStatus.ACTIVE;
    this.createdAt = createdAt;
  }

  /** Closes the crisis and its incident. */
  public void close(Incident incident, Instant at) {
    end(CrisisStatus.CLOSED, incident, IncidentStatus.CLOSED, at);
  }

  /** Cancels the crisis and its incident. */
  public void cancel(Incident incident, Instant at) {
    end(CrisisStatus.CANCELLED, incident, IncidentStatus.CANCELLED, at);
  }

  /**
   * Fails with {@code immutable} once the crisis is closed or cancelled. Every mutation of the
   * crisis or its children calls this first.
   */
  public void requireActive() {
    if (status.isTerminal()) {
      throw InvalidStateException.immutable("Crisis", status);
    }
  }

  public boolean isActive() {
    return status == CrisisStatus.ACTIVE;
  }

  private void end(
      CrisisStatus target, Incident incident, IncidentStatus incidentStatus, Instant at) {
    requireActive();
    if (!status.canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid crisis state", "Cannot move crisis from " + status + " to " + target);
    }
    this.status = target;
    this.endedAt = at;
    if (incident != null && incident.isOpen()) {
      incident.end(incidentStatus, at);
    }
  }

  public UUID getId() {
    return id;
  }

  public UUID getIncidentId() {
    return incidentId;
  }

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
  }

  public CrisisStatus getStatus() {
    return status;
  }

  public double getCenterLat() {
    return centerLat;
  }

  public double getCenterLng() {
    return centerLng;
  }

  public double getRadiusKm() {
    return radiusKm;
  }

  public UUID getAdminUserId() {
    return adminUserId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getEndedAt() {
    return endedAt;
  }
}
