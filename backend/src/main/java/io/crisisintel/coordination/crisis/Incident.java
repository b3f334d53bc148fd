package io.crisisintel.coordination.crisis;

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

/** The real-world event a crisis responds to. Deployments target incidents. */
@Entity
@Table(name = "incidents")
public class Incident {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "title", nullable = false, length = 255)
  private String title;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "incident_type", nullable = false, length = 50)
  private String incidentType;

  @Column(name = "severity", nullable = false, length = 20)
  private String severity;

  @Column(name = "latitude", nullable = false)
  private double latitude;

  @Column(name = "longitude", nullable = false)
  private double longitude;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private IncidentStatus status;

  @Column(name = "created_by", nullable = false)
  private UUID createdBy;

  @Column(name = "opened_at", nullable = false, updatable = false)
  private Instant openedAt;

  @Column(name = "closed_at")
  private Instant closedAt;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  protected Incident() {}

  public Incident(
      String title,
      String description,
      String incidentType,
      String severity,
      double latitude,
      double longitude,
      UUID createdBy,
      Instant openedAt) {
    this.title = title;
    this.description = description;
    this.incidentType = incidentType;
    this.severity = severity;
    this.latitude = latitude;
    this.longitude = longitude;
    this.createdBy = createdBy;
    this.status = IncidentStatus.OPEN;
    this.openedAt = openedAt;
  }

  /** Ends the incident together with its crisis. */
  void end(IncidentStatus endStatus, Instant at) {
    this.status = endStatus;
    this.closedAt = at;
  }

  public boolean isOpen() {
    return status == IncidentStatus.OPEN;
  }

  public UUID getId() {
    return id;
  }

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
  }

  public String getIncidentType() {
    return incidentType;
  }

  public String getSeverity() {
    return severity;
  }

  public double getLatitude() {
    return latitude;
  }

  public double getLongitude() {
    return longitude;
  }

  public IncidentStatus getStatus() {
    return status;
  }

  public UUID getCreatedBy() {
    return createdBy;
  }

  public Instant getOpenedAt() {
    return openedAt;
  }

  public Instant getClosedAt() {
    return closedAt;
  }
}
