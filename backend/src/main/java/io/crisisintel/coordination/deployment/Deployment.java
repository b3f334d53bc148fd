package io.crisisintel.coordination.deployment;

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
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/** A fire team or volunteer group sent to an incident. */
@Entity
@Table(name = "deployments")
public class Deployment {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "incident_id", nullable = false, updatable = false)
  private UUID incidentId;

  @Enumerated(EnumType.STRING)
  @Column(name = "unit_type", nullable = false, updatable = false, length = 20)
  private UnitType unitType;

  @Column(name = "unit_id", nullable = false, updatable = false)
  private UUID unitId;

  @Column(name = "owner_user_id", nullable = false, updatable = false)
  private UUID ownerUserId;

  @Column(name = "headcount", nullable = false)
  private int headcount;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "members", columnDefinition = "jsonb")
  private List<UUID> members;

  @Column(name = "capabilities", length = 500)
  private String capabilities;

  @Column(name = "note", columnDefinition = "TEXT")
  private String note;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private DeploymentStatus status;

  @Column(name = "deployed_by", nullable = false, updatable = false)
  private UUID deployedBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "ended_at")
  private Instant endedAt;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  protected Deployment() {}

  public Deployment(
      UUID incidentId,
      UnitType unitType,
      UUID unitId,
      UUID ownerUserId,
      int headcount,
      List<UUID> members,
      String capabilities,
      String note,
      UUID deployedBy,
      Instant createdAt) {
    this.incidentId = incidentId;
    this.unitType = unitType;
    this.unitId = unitId;
    this.ownerUserId = ownerUserId;
    this.headcount = headcount;
    this.members = members != null ? List.copyOf(members) : List.of();
    this.capabilities = capabilities;
    this.note = note;
    this.deployedBy = deployedBy;
    this.status = DeploymentStatus.ACTIVE;
    this.createdAt = createdAt;
  }

  /** Ends an active deployment. A finished deployment never changes again. */
  public void finish(DeploymentStatus target, Instant at) {
    if (status.isTerminal()) {
      throw InvalidStateException.immutable("Deployment", status);
    }
    if (!status.canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid deployment transition",
          "Cannot move deployment from " + status + " to " + target);
    }
    this.status = target;
    this.endedAt = at;
  }

  public UUID getId() {
    return id;
  }

  public UUID getIncidentId() {
    return incidentId;
  }

  public UnitType getUnitType() {
    return unitType;
  }

  public UUID getUnitId() {
    return unitId;
  }

  public UUID getOwnerUserId() {
    return ownerUserId;
  }

  public int getHeadcount() {
    return headcount;
  }

  public List<UUID> getMembers() {
    return members != null ? members : List.of();
  }

  public String getCapabilities() {
    return capabilities;
  }

  public String getNote() {
    return note;
  }

  public DeploymentStatus getStatus() {
    return status;
  }

  public UUID getDeployedBy() {
    return deployedBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getEndedAt() {
    return endedAt;
  }
}
